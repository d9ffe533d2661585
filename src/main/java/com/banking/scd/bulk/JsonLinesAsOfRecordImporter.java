package com.banking.scd.bulk;

import com.banking.scd.api.DimensionVersionManager;
import com.banking.scd.api.LoadOptions;
import com.banking.scd.core.model.AsOfRecord;
import com.banking.scd.core.model.DimensionId;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON Lines (JSONL) as-of record importer.
 *
 * <p>Expected format: one JSON object per line.</p>
 * <pre>
 * {"natural_key": "C001", "as_of_date": "2024-01-01", "attributes": {"risk_rating": "LOW"}}
 * {"natural_key": "C001", "as_of_date": "2024-06-01", "attributes": {"risk_rating": "HIGH"}}
 * </pre>
 *
 * <p>Numbers are read as exact decimals.</p>
 */
public class JsonLinesAsOfRecordImporter implements AsOfRecordImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesAsOfRecordImporter.class);

    private final DimensionVersionManager manager;
    private final LoadOptions options;
    private final ObjectMapper objectMapper;

    public JsonLinesAsOfRecordImporter(DimensionVersionManager manager) {
        this(manager, manager.getDefaultOptions());
    }

    public JsonLinesAsOfRecordImporter(DimensionVersionManager manager, LoadOptions options) {
        this.manager = manager;
        this.options = options;
        this.objectMapper = new ObjectMapper()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    }

    @Override
    public ImportResult importRecords(Reader reader, DimensionId dimension, ProgressCallback callback) {
        ImportTally tally = new ImportTally(callback);
        log.info("import.started format=jsonl dimension={}", dimension);

        try (BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader)) {
            String line;
            long lineNumber = 0;
            while ((line = br.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                String naturalKey = null;
                try {
                    JsonNode node = parse(line);
                    naturalKey = node.path("natural_key").asText(null);
                    tally.applied(manager.apply(toRecord(dimension, node), options));
                } catch (RuntimeException e) {
                    tally.failed(lineNumber, naturalKey, e);
                    log.warn("import.lineFailed line={} naturalKey={} error={}", lineNumber, naturalKey, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("import.failed format=jsonl dimension={} error={}", dimension, e.getMessage());
            tally.aborted(0, "IO error: " + e.getMessage());
        }
        return tally.finish();
    }

    @Override
    public String getFormat() {
        return "jsonl";
    }

    private JsonNode parse(String line) {
        try {
            JsonNode node = objectMapper.readTree(line);
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("Expected a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static AsOfRecord toRecord(DimensionId dimension, JsonNode node) {
        JsonNode naturalKey = node.get("natural_key");
        if (naturalKey == null || !naturalKey.isTextual()) {
            throw new IllegalArgumentException("natural_key must be a string");
        }
        JsonNode date = node.get("as_of_date");
        if (date == null || !date.isTextual()) {
            throw new IllegalArgumentException("as_of_date must be a YYYY-MM-DD string");
        }
        LocalDate asOfDate;
        try {
            asOfDate = LocalDate.parse(date.asText());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid as_of_date '" + date.asText() + "'", e);
        }

        Map<String, Object> attributes = new LinkedHashMap<>();
        JsonNode attributeNode = node.get("attributes");
        if (attributeNode != null && !attributeNode.isNull()) {
            if (!attributeNode.isObject()) {
                throw new IllegalArgumentException("attributes must be a JSON object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = attributeNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                attributes.put(field.getKey(), toValue(field.getKey(), field.getValue()));
            }
        }
        return AsOfRecord.of(dimension, naturalKey.asText().trim(), asOfDate, attributes);
    }

    private static Object toValue(String name, JsonNode value) {
        if (value.isNull()) {
            return null;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        throw new IllegalArgumentException("Attribute '" + name + "' must be a scalar value");
    }
}
