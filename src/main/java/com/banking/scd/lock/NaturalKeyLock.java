package com.banking.scd.lock;

import com.banking.scd.core.model.DimensionId;

/**
 * Mutual exclusion per {@code (dimension, natural key)} pair.
 * Loads of different natural keys never contend.
 */
public interface NaturalKeyLock {

    /**
     * Acquires the lock of a natural key, waiting up to the configured timeout.
     *
     * @throws LockAcquisitionException if the lock cannot be acquired in time
     */
    void lock(DimensionId dimension, String naturalKey);

    /**
     * Releases the lock of a natural key held by the current thread.
     */
    void unlock(DimensionId dimension, String naturalKey);
}
