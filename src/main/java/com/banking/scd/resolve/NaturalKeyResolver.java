package com.banking.scd.resolve;

import com.banking.scd.cache.CurrentVersionCache;
import com.banking.scd.cache.NoOpCurrentVersionCache;
import com.banking.scd.core.exception.AmbiguousCurrentVersionException;
import com.banking.scd.core.model.DimensionId;
import com.banking.scd.core.model.DimensionVersion;
import com.banking.scd.metrics.MetricsService;
import com.banking.scd.metrics.NoOpMetricsService;
import com.banking.scd.store.DimensionStore;
import com.banking.scd.store.InputSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Locates the current version of a natural key.
 * Read-only; never returns a closed version.
 */
public class NaturalKeyResolver {
    private static final Logger log = LoggerFactory.getLogger(NaturalKeyResolver.class);

    private final DimensionStore store;
    private final CurrentVersionCache cache;
    private final MetricsService metricsService;

    public NaturalKeyResolver(DimensionStore store) {
        this(store, new NoOpCurrentVersionCache(), new NoOpMetricsService());
    }

    public NaturalKeyResolver(DimensionStore store, CurrentVersionCache cache, MetricsService metricsService) {
        this.store = store;
        this.cache = cache;
        this.metricsService = metricsService;
    }

    /**
     * Resolves the current version of a natural key, serving it from the cache when present.
     *
     * @return the current version, or empty if the natural key has never been loaded
     * @throws AmbiguousCurrentVersionException if more than one version is flagged current
     * @throws IllegalArgumentException if the natural key is blank or malformed
     */
    public Optional<DimensionVersion> resolveCurrent(DimensionId dimension, String naturalKey) {
        InputSanitizer.validateNaturalKey(naturalKey);

        Optional<DimensionVersion> cached = cache.get(dimension, naturalKey);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached;
        }
        metricsService.recordCacheMiss();
        return readStore(dimension, naturalKey);
    }

    /**
     * Resolves the current version from the store, bypassing the cache. Loads use this:
     * the version a change is detected against must be the one the store holds.
     *
     * @return the current version, or empty if the natural key has never been loaded
     * @throws AmbiguousCurrentVersionException if more than one version is flagged current
     * @throws IllegalArgumentException if the natural key is blank or malformed
     */
    public Optional<DimensionVersion> resolveFromStore(DimensionId dimension, String naturalKey) {
        InputSanitizer.validateNaturalKey(naturalKey);
        return readStore(dimension, naturalKey);
    }

    private Optional<DimensionVersion> readStore(DimensionId dimension, String naturalKey) {
        long stamp = cache.stamp(dimension, naturalKey);
        List<DimensionVersion> current = store.findCurrent(dimension, naturalKey);
        if (current.size() > 1) {
            List<Long> keys = current.stream().map(DimensionVersion::getSurrogateKey).toList();
            log.error("resolve.ambiguous dimension={} naturalKey={} surrogateKeys={}", dimension, naturalKey, keys);
            throw new AmbiguousCurrentVersionException(dimension, naturalKey, keys);
        }
        if (current.isEmpty()) {
            log.debug("resolve.notFound dimension={} naturalKey={}", dimension, naturalKey);
            return Optional.empty();
        }
        DimensionVersion version = current.get(0);
        cache.put(version, stamp);
        return Optional.of(version);
    }
}
