package com.banking.scd.api;

import com.banking.scd.core.model.DimensionId;

import java.util.List;
import java.util.Objects;

/**
 * Result of checking one natural key's version chain.
 *
 * @param versionCount number of versions in the chain
 * @param currentCount number of open-ended versions
 * @param violations   human-readable description of every broken rule, empty for a sound chain
 */
public record ChainReport(DimensionId dimension, String naturalKey, int versionCount, int currentCount,
                          List<String> violations) {

    public ChainReport {
        Objects.requireNonNull(dimension, "dimension is required");
        Objects.requireNonNull(naturalKey, "naturalKey is required");
        violations = violations != null ? List.copyOf(violations) : List.of();
    }

    /**
     * A chain is valid when its ranges are contiguous, do not overlap, and exactly
     * one version is current. An empty chain is valid.
     */
    public boolean isValid() {
        return violations.isEmpty();
    }
}
