package com.banking.scd.api;

import com.banking.scd.core.model.ChangeType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of applying a batch of as-of records.
 * Records are applied independently; a failed record does not undo the others.
 */
public record BatchLoadResult(List<LoadResult> results, List<RecordFailure> failures) {

    public BatchLoadResult {
        results = results != null ? List.copyOf(results) : List.of();
        failures = failures != null ? List.copyOf(failures) : List.of();
    }

    /**
     * A record that could not be applied.
     *
     * @param index      position of the record in the batch
     * @param naturalKey the record's natural key
     * @param errorType  simple class name of the exception raised
     * @param message    the exception message
     */
    public record RecordFailure(int index, String naturalKey, String errorType, String message) {
    }

    public int totalRecords() {
        return results.size() + failures.size();
    }

    public long count(ChangeType changeType) {
        return results.stream().filter(r -> r.changeType() == changeType).count();
    }

    public Map<ChangeType, Long> countsByChangeType() {
        Map<ChangeType, Long> counts = new EnumMap<>(ChangeType.class);
        for (ChangeType type : ChangeType.values()) {
            counts.put(type, count(type));
        }
        return counts;
    }

    public boolean isSuccess() {
        return failures.isEmpty();
    }

    public boolean hasErrors() {
        return !failures.isEmpty();
    }

    @Override
    public String toString() {
        return "BatchLoadResult{" +
                "applied=" + results.size() +
                ", byType=" + countsByChangeType() +
                ", failures=" + failures.size() +
                '}';
    }
}
