package com.banking.scd.core.exception;

/**
 * Base class of the errors raised while versioning dimension records.
 */
public class ScdException extends RuntimeException {

    public ScdException(String message) {
        super(message);
    }

    public ScdException(String message, Throwable cause) {
        super(message, cause);
    }
}
