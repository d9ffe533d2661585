package com.banking.scd.cache;

import com.banking.scd.core.model.DimensionId;
import com.banking.scd.core.model.DimensionVersion;

import java.util.Optional;

/**
 * Cache of the current version per natural key, consulted by the resolver for reads.
 *
 * <p>Fills are stamped: a reader calls {@link #stamp} before reading the store and hands
 * the stamp back to {@link #put}. A put whose stamp predates an {@link #invalidate} of
 * the same natural key is dropped, so a slow reader cannot re-cache a version that a
 * writer has already superseded. A cache is only coherent when the engine is the single
 * writer of its store.</p>
 */
public interface CurrentVersionCache {

    /**
     * Gets the cached current version.
     *
     * @return the cached version, or empty if not cached
     */
    Optional<DimensionVersion> get(DimensionId dimension, String naturalKey);

    /**
     * Returns the stamp to pass to {@link #put} for a version read from the store after this call.
     */
    long stamp(DimensionId dimension, String naturalKey);

    /**
     * Caches the current version of its natural key unless the key was invalidated after
     * {@code stamp} was taken.
     *
     * @param version a current version
     * @param stamp   the value {@link #stamp} returned before the version was read
     * @return whether the version was cached
     */
    boolean put(DimensionVersion version, long stamp);

    /**
     * Drops the entry of a natural key and fences off fills stamped before this call.
     */
    void invalidate(DimensionId dimension, String naturalKey);

    void invalidateAll();

    CacheStats getStats();
}
