package com.banking.scd.cache;

import com.banking.scd.core.model.DimensionId;
import com.banking.scd.core.model.DimensionVersion;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Caffeine-backed cache of current versions, bounded by size and expiring after write.
 *
 * <p>Invalidating a natural key leaves a marker carrying a fresh generation number in
 * place of the entry. A fill is accepted only if its stamp is not older than the marker.
 * When a marker or entry is evicted its generation is folded into a floor that every
 * fill of an absent key must clear, so eviction cannot reopen the window.</p>
 */
public class CaffeineCurrentVersionCache implements CurrentVersionCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineCurrentVersionCache.class);

    private final Cache<CacheKey, Slot> cache;
    private final AtomicLong generation = new AtomicLong();
    private final AtomicLong evictedThrough = new AtomicLong();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    public CaffeineCurrentVersionCache() {
        this(CacheConfig.defaults());
    }

    public CaffeineCurrentVersionCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxNaturalKeys())
                .expireAfterWrite(config.timeToLive())
                .evictionListener((CacheKey key, Slot slot, RemovalCause cause) -> {
                    if (slot != null) {
                        evictedThrough.accumulateAndGet(slot.generation(), Math::max);
                    }
                })
                .recordStats()
                .build();
        log.info("cache.initialized maxNaturalKeys={} ttl={}", config.maxNaturalKeys(), config.timeToLive());
    }

    @Override
    public Optional<DimensionVersion> get(DimensionId dimension, String naturalKey) {
        Slot slot = cache.getIfPresent(new CacheKey(dimension, naturalKey));
        if (slot == null || slot.version() == null) {
            misses.increment();
            return Optional.empty();
        }
        hits.increment();
        return Optional.of(slot.version());
    }

    @Override
    public long stamp(DimensionId dimension, String naturalKey) {
        return generation.get();
    }

    @Override
    public boolean put(DimensionVersion version, long stamp) {
        if (!version.isCurrent()) {
            throw new IllegalArgumentException("Only current versions can be cached, got " + version);
        }
        CacheKey key = new CacheKey(version.getDimension(), version.getNaturalKey());
        AtomicBoolean stored = new AtomicBoolean();
        cache.asMap().compute(key, (k, slot) -> {
            long fence = slot != null ? slot.generation() : evictedThrough.get();
            if (fence > stamp) {
                return slot;
            }
            stored.set(true);
            return new Slot(stamp, version);
        });
        if (!stored.get()) {
            log.debug("cache.fillDropped dimension={} naturalKey={} sk={} stamp={}",
                    key.dimension(), key.naturalKey(), version.getSurrogateKey(), stamp);
        }
        return stored.get();
    }

    @Override
    public void invalidate(DimensionId dimension, String naturalKey) {
        cache.asMap().compute(new CacheKey(dimension, naturalKey),
                (k, slot) -> new Slot(generation.incrementAndGet(), null));
        log.debug("cache.invalidated dimension={} naturalKey={}", dimension, naturalKey);
    }

    @Override
    public void invalidateAll() {
        evictedThrough.accumulateAndGet(generation.incrementAndGet(), Math::max);
        cache.invalidateAll();
        log.debug("cache.invalidatedAll");
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(
                hits.sum(),
                misses.sum(),
                cache.stats().evictionCount(),
                cache.estimatedSize()
        );
    }

    record CacheKey(DimensionId dimension, String naturalKey) {}

    /**
     * A cached version, or an invalidation marker when {@code version} is null.
     */
    record Slot(long generation, DimensionVersion version) {}
}
