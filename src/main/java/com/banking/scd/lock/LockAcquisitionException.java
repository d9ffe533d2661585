package com.banking.scd.lock;

import com.banking.scd.core.exception.ScdException;

/**
 * Thrown when a natural key lock cannot be acquired within the configured timeout.
 */
public class LockAcquisitionException extends ScdException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
