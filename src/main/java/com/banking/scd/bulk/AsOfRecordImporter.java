package com.banking.scd.bulk;

import com.banking.scd.core.model.DimensionId;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Reads as-of records of one dimension from a feed and applies them in file order.
 * A record that fails is reported in the result and the load continues.
 */
public interface AsOfRecordImporter {

    /**
     * Imports records from a reader.
     *
     * @param reader    the feed
     * @param dimension the dimension every record belongs to
     * @param callback  optional progress callback
     * @return the import result
     */
    ImportResult importRecords(Reader reader, DimensionId dimension, ProgressCallback callback);

    /**
     * Imports records from a UTF-8 encoded stream.
     */
    default ImportResult importRecords(InputStream input, DimensionId dimension, ProgressCallback callback) {
        return importRecords(new InputStreamReader(input, StandardCharsets.UTF_8), dimension, callback);
    }

    /**
     * Returns the format supported by this importer (e.g., "csv", "jsonl").
     */
    String getFormat();
}
