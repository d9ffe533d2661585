package com.banking.scd.version;

import com.banking.scd.core.model.ChangeType;
import com.banking.scd.core.model.DimensionVersion;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one version write.
 *
 * @param changeType       what was written
 * @param current          the current version after the write
 * @param closed           the version closed by a TYPE2 change, or null
 * @param changedAttributes attributes whose value changed
 */
public record VersionWriteResult(ChangeType changeType, DimensionVersion current, DimensionVersion closed,
                                 List<String> changedAttributes) {

    public VersionWriteResult {
        Objects.requireNonNull(changeType, "changeType is required");
        Objects.requireNonNull(current, "current is required");
        changedAttributes = changedAttributes != null ? List.copyOf(changedAttributes) : List.of();
    }

    public Optional<DimensionVersion> getClosed() {
        return Optional.ofNullable(closed);
    }
}
