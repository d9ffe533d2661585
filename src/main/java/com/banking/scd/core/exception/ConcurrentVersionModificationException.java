package com.banking.scd.core.exception;

import com.banking.scd.core.model.DimensionId;

/**
 * A conditional write found that the version it was based on is no longer current,
 * because another writer changed the same natural key in between. Transient: the
 * read-detect-write sequence is retried a bounded number of times before this is surfaced.
 */
public class ConcurrentVersionModificationException extends ScdException {

    private final DimensionId dimension;
    private final String naturalKey;

    public ConcurrentVersionModificationException(DimensionId dimension, String naturalKey, String message) {
        super(message);
        this.dimension = dimension;
        this.naturalKey = naturalKey;
    }

    public ConcurrentVersionModificationException(DimensionId dimension, String naturalKey, String message,
                                                  Throwable cause) {
        super(message, cause);
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
