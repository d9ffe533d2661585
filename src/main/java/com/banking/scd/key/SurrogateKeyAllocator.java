package com.banking.scd.key;

import com.banking.scd.core.model.DimensionId;

/**
 * Issues surrogate keys for new dimension versions.
 * Keys are monotonically increasing per dimension and never reused, even when the
 * version they were issued for is never written. Implementations are thread-safe.
 */
public interface SurrogateKeyAllocator {

    /**
     * Allocates the next surrogate key of a dimension.
     *
     * @param dimension the dimension
     * @return a key greater than any key previously allocated for the dimension
     */
    long next(DimensionId dimension);

    /**
     * Moves the generator past a key that was assigned outside the allocator,
     * for example by a bulk seed load, so the next allocated key is greater than it.
     * Never moves the generator backwards.
     *
     * @param dimension the dimension
     * @param highWater the highest externally assigned key
     */
    void advancePast(DimensionId dimension, long highWater);
}
