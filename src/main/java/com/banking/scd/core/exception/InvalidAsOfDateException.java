package com.banking.scd.core.exception;

import com.banking.scd.core.model.DimensionId;

import java.time.LocalDate;

/**
 * Thrown when a record is dated before the effective-from date of the current version.
 * Backdated corrections are not inserted into the middle of a version chain; the load
 * is rejected and must be repaired out of band. Never retried.
 */
public class InvalidAsOfDateException extends ScdException {

    private final DimensionId dimension;
    private final String naturalKey;
    private final LocalDate asOfDate;
    private final LocalDate currentEffectiveFrom;

    public InvalidAsOfDateException(DimensionId dimension, String naturalKey,
                                    LocalDate asOfDate, LocalDate currentEffectiveFrom) {
        super("As-of date " + asOfDate + " for " + dimension + "/" + naturalKey
                + " is earlier than the current version's effective-from date " + currentEffectiveFrom);
        this.dimension = dimension;
        this.naturalKey = naturalKey;
        this.asOfDate = asOfDate;
        this.currentEffectiveFrom = currentEffectiveFrom;
    }

    public DimensionId getDimension() {
        return dimension;
    }

    public String getNaturalKey() {
        return naturalKey;
    }

    public LocalDate getAsOfDate() {
        return asOfDate;
    }

    public LocalDate getCurrentEffectiveFrom() {
        return currentEffectiveFrom;
    }
}
