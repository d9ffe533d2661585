package com.banking.scd.bulk;

import java.util.List;

/**
 * Result of a bulk load.
 *
 * @param totalRecords number of data records read, failed ones included
 * @param newEntities  records that created the first version of a natural key
 * @param newVersions  records that superseded a version
 * @param overwrites   records that overwrote TYPE1 attributes in place
 * @param unchanged    records identical to the current version
 * @param errors       records that could not be applied
 */
public record ImportResult(
        long totalRecords,
        long newEntities,
        long newVersions,
        long overwrites,
        long unchanged,
        List<ImportError> errors
) {
    public ImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long successCount() {
        return newEntities + newVersions + overwrites + unchanged;
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A record that could not be applied.
     *
     * @param lineNumber the line number in the input (1-based), 0 for errors not tied to a line
     * @param naturalKey the record's natural key, empty if it could not be read
     * @param message    the error message
     */
    public record ImportError(long lineNumber, String naturalKey, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRecords +
                ", new=" + newEntities +
                ", versions=" + newVersions +
                ", overwrites=" + overwrites +
                ", unchanged=" + unchanged +
                ", errors=" + errors.size() + '}';
    }
}
