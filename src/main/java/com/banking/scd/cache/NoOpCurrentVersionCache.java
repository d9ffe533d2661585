package com.banking.scd.cache;

import com.banking.scd.core.model.DimensionId;
import com.banking.scd.core.model.DimensionVersion;

import java.util.Optional;

/**
 * Cache that holds nothing. Used when no cache is configured.
 */
public class NoOpCurrentVersionCache implements CurrentVersionCache {

    @Override
    public Optional<DimensionVersion> get(DimensionId dimension, String naturalKey) {
        return Optional.empty();
    }

    @Override
    public long stamp(DimensionId dimension, String naturalKey) {
        return 0L;
    }

    @Override
    public boolean put(DimensionVersion version, long stamp) {
        return false;
    }

    @Override
    public void invalidate(DimensionId dimension, String naturalKey) {
        // nothing cached
    }

    @Override
    public void invalidateAll() {
        // nothing cached
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
