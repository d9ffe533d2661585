package com.banking.scd.bulk;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.banking.scd.api.ScdEngine;
import com.banking.scd.core.model.DimensionId;
import com.banking.scd.core.model.DimensionVersion;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CsvAsOfRecordImporter Tests")
class CsvAsOfRecordImporterTest {

    private ScdEngine engine;
    private CsvAsOfRecordImporter importer;

    @BeforeEach
    void setUp() {
        engine = ScdEngine.builder().build();
        importer = new CsvAsOfRecordImporter(engine.getManager());
    }

    @Test
    @DisplayName("Should classify each line against the current version")
    void importsHistory() {
        String csv = """
                natural_key,as_of_date,risk_rating,full_name
                C001,2024-01-01,LOW,"Doe, Jane"
                C002,2024-01-01,MEDIUM,
                C001,2024-06-01,HIGH,"Doe, Jane"
                C001,2024-07-01,HIGH,"Smith, Jane"
                C002,2024-07-01,medium,
                """;

        ImportResult result = importer.importRecords(new StringReader(csv), DimensionId.CUSTOMER, null);

        assertEquals(5, result.totalRecords());
        assertEquals(2, result.newEntities());
        assertEquals(1, result.newVersions());
        assertEquals(1, result.overwrites());
        assertEquals(1, result.unchanged());
        assertFalse(result.hasErrors());

        DimensionVersion current = engine.currentVersion(DimensionId.CUSTOMER, "C001").orElseThrow();
        assertEquals("Smith, Jane", current.getAttribute("full_name"));
        assertEquals(LocalDate.of(2024, 6, 1), current.getEffectiveFrom());
        assertNull(engine.currentVersion(DimensionId.CUSTOMER, "C002").orElseThrow().getAttribute("full_name"));
    }

    @Test
    @DisplayName("Bad lines are reported with their line number and the import continues")
    void reportsBadLines() {
        String csv = """
                natural_key,as_of_date,risk_rating
                C001,2024-06-01,LOW
                C001,2024-01-01,HIGH
                C002,not-a-date,LOW
                C003,2024-01-01
                ,2024-01-01,LOW

                C004,2024-01-01,LOW
                """;

        ImportResult result = importer.importRecords(new StringReader(csv), DimensionId.CUSTOMER, null);

        assertEquals(2, result.successCount());
        assertEquals(4, result.errorCount());
        assertEquals(List.of(3L, 4L, 5L, 6L),
                result.errors().stream().map(ImportResult.ImportError::lineNumber).toList());
        assertEquals("C001", result.errors().get(0).naturalKey());
        assertTrue(result.errors().get(0).message().contains("earlier than"));
        assertTrue(engine.currentVersion(DimensionId.CUSTOMER, "C004").isPresent());
    }

    @Nested
    @DisplayName("Header")
    class HeaderTests {

        @Test
        @DisplayName("A header naming an unknown attribute aborts the import")
        void unknownColumn() {
            String csv = """
                    natural_key,as_of_date,shoe_size
                    C001,2024-01-01,42
                    """;

            ImportResult result = importer.importRecords(new StringReader(csv), DimensionId.CUSTOMER, null);

            assertEquals(0, result.totalRecords());
            assertEquals(1, result.errorCount());
            assertEquals(1, result.errors().get(0).lineNumber());
        }

        @Test
        @DisplayName("The key and date columns must come first")
        void keyColumnsFirst() {
            String csv = "as_of_date,natural_key\n2024-01-01,C001\n";

            ImportResult result = importer.importRecords(new StringReader(csv), DimensionId.CUSTOMER, null);

            assertTrue(result.hasErrors());
            assertTrue(engine.currentVersion(DimensionId.CUSTOMER, "C001").isEmpty());
        }

        @Test
        @DisplayName("A byte order mark before the header is ignored")
        void byteOrderMark() {
            byte[] bytes = "\uFEFFnatural_key,as_of_date,branch_name\nB1,2024-01-01,Main Street\n"
                    .getBytes(StandardCharsets.UTF_8);

            ImportResult result = importer.importRecords(new ByteArrayInputStream(bytes), DimensionId.BRANCH, null);

            assertFalse(result.hasErrors());
            assertEquals(1, result.newEntities());
        }

        @Test
        @DisplayName("An empty feed imports nothing")
        void emptyFeed() {
            ImportResult result = importer.importRecords(new StringReader(""), DimensionId.CUSTOMER, null);
            assertEquals(0, result.totalRecords());
            assertFalse(result.hasErrors());
        }
    }

    @Nested
    @DisplayName("Line parsing")
    class ParseLineTests {

        @Test
        @DisplayName("Quoted fields keep commas and escaped quotes")
        void quoted() {
            assertEquals(Arrays.asList("a", "b, c", "say \"hi\""),
                    CsvAsOfRecordImporter.parseLine("a,\"b, c\",\"say \"\"hi\"\"\""));
        }

        @Test
        @DisplayName("Empty unquoted fields are null, empty quoted fields are empty")
        void emptyFields() {
            assertEquals(Arrays.asList(null, "", null), CsvAsOfRecordImporter.parseLine(",\"\","));
        }

        @Test
        @DisplayName("An unterminated quote is an error")
        void unterminated() {
            assertThrows(IllegalArgumentException.class, () -> CsvAsOfRecordImporter.parseLine("a,\"b"));
        }
    }

    @Test
    @DisplayName("Progress is reported when the import completes")
    void progress() {
        List<String> messages = new ArrayList<>();
        String csv = "natural_key,as_of_date,risk_rating\nC001,2024-01-01,LOW\n";

        importer.importRecords(new StringReader(csv), DimensionId.CUSTOMER,
                (processed, total, message) -> messages.add(processed + ":" + message));

        assertEquals(List.of("1:Import completed"), messages);
        assertEquals("csv", importer.getFormat());
    }

    @Nested
    @DisplayName("Logging")
    class LoggingTests {

        private Logger importerLogger;
        private ListAppender<ILoggingEvent> appender;

        @BeforeEach
        void attach() {
            importerLogger = (Logger) LoggerFactory.getLogger(CsvAsOfRecordImporter.class);
            appender = new ListAppender<>();
            appender.start();
            importerLogger.addAppender(appender);
        }

        @AfterEach
        void detach() {
            importerLogger.detachAppender(appender);
        }

        @Test
        @DisplayName("Each rejected line is logged as a warning with its line number and natural key")
        void lineFailuresLogged() {
            String csv = """
                    natural_key,as_of_date,risk_rating
                    C001,2024-01-01,LOW
                    C002,not-a-date,LOW
                    """;

            importer.importRecords(new StringReader(csv), DimensionId.CUSTOMER, null);

            List<ILoggingEvent> warnings = appender.list.stream()
                    .filter(e -> e.getLevel() == Level.WARN)
                    .toList();
            assertEquals(1, warnings.size());
            assertTrue(warnings.get(0).getFormattedMessage().startsWith("import.lineFailed line=3 naturalKey=C002"));
            assertTrue(appender.list.stream()
                    .anyMatch(e -> e.getFormattedMessage().equals("import.started format=csv dimension=CUSTOMER")));
        }

        @Test
        @DisplayName("A rejected header is logged as an error")
        void headerRejectionLogged() {
            importer.importRecords(new StringReader("as_of_date,natural_key\n"), DimensionId.CUSTOMER, null);

            assertTrue(appender.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR
                    && e.getFormattedMessage().startsWith("import.headerRejected dimension=CUSTOMER")));
        }
    }
}
