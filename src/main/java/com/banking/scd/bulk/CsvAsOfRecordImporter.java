package com.banking.scd.bulk;

import com.banking.scd.api.DimensionVersionManager;
import com.banking.scd.api.LoadOptions;
import com.banking.scd.core.model.AsOfRecord;
import com.banking.scd.core.model.DimensionDefinition;
import com.banking.scd.core.model.DimensionId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CSV as-of record importer.
 *
 * <p>Expected CSV format:</p>
 * <pre>
 * natural_key,as_of_date,risk_rating,full_name
 * C001,2024-01-01,LOW,"Doe, Jane"
 * C002,2024-01-01,MEDIUM,
 * </pre>
 *
 * <p>The header names the columns: natural key, as-of date, then any subset of the
 * dimension's attributes. Attributes the header leaves out are loaded as null. Fields
 * may be double-quoted, with {@code ""} for an embedded quote; an empty field is null.
 * Quoted fields cannot span lines.</p>
 */
public class CsvAsOfRecordImporter implements AsOfRecordImporter {
    private static final Logger log = LoggerFactory.getLogger(CsvAsOfRecordImporter.class);

    static final String NATURAL_KEY_COLUMN = "natural_key";
    static final String AS_OF_DATE_COLUMN = "as_of_date";

    private final DimensionVersionManager manager;
    private final LoadOptions options;

    public CsvAsOfRecordImporter(DimensionVersionManager manager) {
        this(manager, manager.getDefaultOptions());
    }

    public CsvAsOfRecordImporter(DimensionVersionManager manager, LoadOptions options) {
        this.manager = manager;
        this.options = options;
    }

    @Override
    public ImportResult importRecords(Reader reader, DimensionId dimension, ProgressCallback callback) {
        ImportTally tally = new ImportTally(callback);
        log.info("import.started format=csv dimension={}", dimension);

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String headerLine = br.readLine();
            if (headerLine == null) {
                log.warn("import.emptyInput format=csv dimension={}", dimension);
                return tally.finish();
            }
            List<String> header;
            try {
                header = readHeader(headerLine, dimension);
            } catch (IllegalArgumentException e) {
                log.error("import.headerRejected dimension={} error={}", dimension, e.getMessage());
                tally.aborted(1, e.getMessage());
                return tally.finish();
            }
            log.debug("import.header dimension={} columns={}", dimension, header);

            String line;
            long lineNumber = 1;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                String naturalKey = null;
                try {
                    List<String> fields = parseLine(line);
                    naturalKey = fields.isEmpty() ? null : fields.get(0);
                    if (fields.size() != header.size()) {
                        throw new IllegalArgumentException("Expected " + header.size()
                                + " fields but found " + fields.size());
                    }
                    tally.applied(manager.apply(toRecord(dimension, header, fields), options));
                } catch (RuntimeException e) {
                    tally.failed(lineNumber, naturalKey, e);
                    log.warn("import.lineFailed line={} naturalKey={} error={}", lineNumber, naturalKey, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("import.failed format=csv dimension={} error={}", dimension, e.getMessage());
            tally.aborted(0, "IO error: " + e.getMessage());
        }
        return tally.finish();
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private List<String> readHeader(String headerLine, DimensionId dimension) {
        List<String> header = parseLine(headerLine.startsWith("\uFEFF") ? headerLine.substring(1) : headerLine);
        if (header.size() < 2
                || !NATURAL_KEY_COLUMN.equals(header.get(0))
                || !AS_OF_DATE_COLUMN.equals(header.get(1))) {
            throw new IllegalArgumentException("Header must start with "
                    + NATURAL_KEY_COLUMN + "," + AS_OF_DATE_COLUMN + ", got: " + headerLine);
        }
        DimensionDefinition definition = manager.getDefinitions().get(dimension);
        if (definition == null) {
            throw new IllegalArgumentException("No definition registered for dimension " + dimension);
        }
        for (String column : header.subList(2, header.size())) {
            definition.get(column);
        }
        return header;
    }

    private static AsOfRecord toRecord(DimensionId dimension, List<String> header, List<String> fields) {
        String naturalKey = fields.get(0);
        if (naturalKey == null) {
            throw new IllegalArgumentException("natural_key is empty");
        }
        String date = fields.get(1);
        if (date == null) {
            throw new IllegalArgumentException("as_of_date is empty");
        }
        LocalDate asOfDate;
        try {
            asOfDate = LocalDate.parse(date.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid as_of_date '" + date + "'", e);
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (int i = 2; i < header.size(); i++) {
            attributes.put(header.get(i), fields.get(i));
        }
        return AsOfRecord.of(dimension, naturalKey.trim(), asOfDate, attributes);
    }

    /**
     * Splits one CSV line. Unquoted empty fields are null; quoted fields keep their content verbatim.
     */
    static List<String> parseLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        boolean quoted = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                inQuotes = true;
                quoted = true;
            } else if (c == ',') {
                fields.add(field(current, quoted));
                current.setLength(0);
                quoted = false;
            } else {
                current.append(c);
            }
        }
        if (inQuotes) {
            throw new IllegalArgumentException("Unterminated quoted field");
        }
        fields.add(field(current, quoted));
        return fields;
    }

    private static String field(StringBuilder value, boolean quoted) {
        if (!quoted && value.toString().isBlank()) {
            return null;
        }
        return value.toString();
    }
}
