package com.banking.scd.core.exception;

import com.banking.scd.core.model.DimensionId;

/**
 * A stored version chain violates a dimension invariant. Processing of the natural key
 * stops and the chain needs manual repair.
 */
public class DimensionIntegrityException extends ScdException {

    private final DimensionId dimension;
    private final String naturalKey;

    public DimensionIntegrityException(DimensionId dimension, String naturalKey, String message) {
        super(message);
        this.dimension = dimension;
        this.naturalKey = naturalKey;
    }

    public DimensionId getDimension() {
        return dimension;
    }

    public String getNaturalKey() {
        return naturalKey;
    }
}
