package com.banking.scd.bulk;

import com.banking.scd.api.ScdEngine;
import com.banking.scd.core.model.DimensionId;
import com.banking.scd.core.model.DimensionVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JsonLinesAsOfRecordImporter Tests")
class JsonLinesAsOfRecordImporterTest {

    private ScdEngine engine;
    private JsonLinesAsOfRecordImporter importer;

    @BeforeEach
    void setUp() {
        engine = ScdEngine.builder().build();
        importer = new JsonLinesAsOfRecordImporter(engine.getManager());
    }

    @Test
    @DisplayName("Should load typed values from JSON objects")
    void typedValues() {
        String jsonl = """
                {"natural_key": "A1", "as_of_date": "2024-01-01", "attributes": {"account_status": "ACTIVE", "interest_rate": 1.50, "is_dormant": false}}
                {"natural_key": "A1", "as_of_date": "2024-04-01", "attributes": {"account_status": "ACTIVE", "interest_rate": 1.5, "is_dormant": false}}
                {"natural_key": "A1", "as_of_date": "2024-09-01", "attributes": {"account_status": "ACTIVE", "interest_rate": 2.25, "is_dormant": false}}
                """;

        ImportResult result = importer.importRecords(new StringReader(jsonl), DimensionId.ACCOUNT, null);

        assertFalse(result.hasErrors(), result.errors().toString());
        assertEquals(1, result.newEntities());
        assertEquals(1, result.unchanged());
        assertEquals(1, result.newVersions());

        DimensionVersion current = engine.currentVersion(DimensionId.ACCOUNT, "A1").orElseThrow();
        assertEquals(0, new BigDecimal("2.25").compareTo((BigDecimal) current.getAttribute("interest_rate")));
        assertEquals(Boolean.FALSE, current.getAttribute("is_dormant"));
        assertEquals(LocalDate.of(2024, 9, 1), current.getEffectiveFrom());
    }

    @Test
    @DisplayName("Malformed lines are reported and the import continues")
    void malformedLines() {
        String jsonl = """
                {"natural_key": "A1", "as_of_date": "2024-01-01", "attributes": {"account_status": "ACTIVE"}}
                {not json}
                ["an", "array"]
                {"natural_key": 42, "as_of_date": "2024-01-01"}
                {"natural_key": "A2", "as_of_date": "01/01/2024"}
                {"natural_key": "A3", "as_of_date": "2024-01-01", "attributes": {"account_status": ["A", "B"]}}
                {"natural_key": "A4", "as_of_date": "2024-01-01", "attributes": {"colour": "red"}}
                {"natural_key": "A5", "as_of_date": "2024-01-01"}
                """;

        ImportResult result = importer.importRecords(new StringReader(jsonl), DimensionId.ACCOUNT, null);

        assertEquals(8, result.totalRecords());
        assertEquals(2, result.successCount());
        assertEquals(6, result.errorCount());
        assertEquals("A2", result.errors().get(3).naturalKey());
        assertEquals(5, result.errors().get(3).lineNumber());
        assertTrue(engine.currentVersion(DimensionId.ACCOUNT, "A5").isPresent());
        assertEquals("jsonl", importer.getFormat());
    }
}
