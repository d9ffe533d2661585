package com.banking.scd.core.exception;

/**
 * A dimension store could not complete a read or write.
 */
public class DimensionStoreException extends ScdException {

    public DimensionStoreException(String message) {
        super(message);
    }

    public DimensionStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
