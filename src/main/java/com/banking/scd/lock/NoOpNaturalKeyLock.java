package com.banking.scd.lock;

import com.banking.scd.core.model.DimensionId;

/**
 * No-op lock implementation. Always succeeds immediately.
 * Used when serialization is left to the store's conditional writes.
 */
public class NoOpNaturalKeyLock implements NaturalKeyLock {

    @Override
    public void lock(DimensionId dimension, String naturalKey) {
        // no-op
    }

    @Override
    public void unlock(DimensionId dimension, String naturalKey) {
        // no-op
    }
}
