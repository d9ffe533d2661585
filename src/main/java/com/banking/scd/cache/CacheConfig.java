package com.banking.scd.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Sizing of the current-version cache.
 *
 * @param maxNaturalKeys natural keys kept across all dimensions, invalidation markers included
 * @param timeToLive     how long an entry is served after it was filled
 */
public record CacheConfig(long maxNaturalKeys, Duration timeToLive) {

    public CacheConfig {
        Objects.requireNonNull(timeToLive, "timeToLive is required");
        if (maxNaturalKeys <= 0) {
            throw new IllegalArgumentException("maxNaturalKeys must be > 0");
        }
        if (timeToLive.isNegative() || timeToLive.isZero()) {
            throw new IllegalArgumentException("timeToLive must be positive");
        }
    }

    /**
     * 50,000 natural keys for 10 minutes, enough for the current versions of a nightly
     * customer and account load.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(50_000, Duration.ofMinutes(10));
    }
}
