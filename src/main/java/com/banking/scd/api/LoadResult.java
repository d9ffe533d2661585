package com.banking.scd.api;

import com.banking.scd.core.model.ChangeType;
import com.banking.scd.core.model.DimensionId;
import com.banking.scd.core.model.DimensionVersion;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of applying one as-of record.
 *
 * @param changeType        how the record was classified
 * @param current           the natural key's current version after the load
 * @param closed            the version closed by a TYPE2 change, or null
 * @param changedAttributes attributes whose value differed from the previous current version
 * @param attempts          read-detect-write attempts used, 1 when no concurrent write interfered
 */
public record LoadResult(
        DimensionId dimension,
        String naturalKey,
        LocalDate asOfDate,
        ChangeType changeType,
        DimensionVersion current,
        DimensionVersion closed,
        List<String> changedAttributes,
        int attempts
) {
    public LoadResult {
        Objects.requireNonNull(dimension, "dimension is required");
        Objects.requireNonNull(naturalKey, "naturalKey is required");
        Objects.requireNonNull(changeType, "changeType is required");
        changedAttributes = changedAttributes != null ? List.copyOf(changedAttributes) : List.of();
    }

    public Optional<DimensionVersion> getClosed() {
        return Optional.ofNullable(closed);
    }

    /**
     * Returns true if the load wrote to the store.
     */
    public boolean wasWritten() {
        return changeType.isWrite();
    }

    @Override
    public String toString() {
        return "LoadResult{" +
                "dimension=" + dimension +
                ", naturalKey='" + naturalKey + '\'' +
                ", asOfDate=" + asOfDate +
                ", changeType=" + changeType +
                ", currentSk=" + (current != null ? current.getSurrogateKey() : null) +
                ", closedSk=" + (closed != null ? closed.getSurrogateKey() : null) +
                ", attempts=" + attempts +
                '}';
    }
}
