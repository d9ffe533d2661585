package com.banking.scd.metrics;

import com.banking.scd.core.model.ChangeType;
import com.banking.scd.core.model.DimensionId;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code scd.load.duration} Timer (tags: dimension, changeType)</li>
 *   <li>{@code scd.version.created} Counter (tag: dimension)</li>
 *   <li>{@code scd.version.closed} Counter (tag: dimension)</li>
 *   <li>{@code scd.type1.update} Counter (tag: dimension)</li>
 *   <li>{@code scd.load.rejected} Counter (tags: dimension, reason)</li>
 *   <li>{@code scd.load.retry} Counter (tag: dimension)</li>
 *   <li>{@code scd.batch.size} DistributionSummary</li>
 *   <li>{@code scd.cache.hit} / {@code scd.cache.miss} Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary batchSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.batchSizeSummary = DistributionSummary.builder("scd.batch.size")
                .description("Number of records per applied batch")
                .register(registry);
        this.cacheHitCounter = Counter.builder("scd.cache.hit")
                .description("Number of current-version cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("scd.cache.miss")
                .description("Number of current-version cache misses")
                .register(registry);
    }

    @Override
    public void recordLoadDuration(DimensionId dimension, ChangeType changeType, Duration duration) {
        String key = dimension.name() + ":" + changeType.name();
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("scd.load.duration")
                        .description("Duration of as-of record loads")
                        .tag("dimension", dimension.name())
                        .tag("changeType", changeType.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementVersionCreated(DimensionId dimension) {
        dimensionCounter("scd.version.created", "Number of dimension versions inserted", dimension)
                .increment();
    }

    @Override
    public void incrementVersionClosed(DimensionId dimension) {
        dimensionCounter("scd.version.closed", "Number of dimension versions closed", dimension)
                .increment();
    }

    @Override
    public void incrementType1Update(DimensionId dimension) {
        dimensionCounter("scd.type1.update", "Number of in-place attribute overwrites", dimension)
                .increment();
    }

    @Override
    public void incrementLoadRejected(DimensionId dimension, String reason) {
        String key = "scd.load.rejected:" + dimension.name() + ":" + reason;
        counterCache.computeIfAbsent(key, k ->
                Counter.builder("scd.load.rejected")
                        .description("Number of as-of records that were not applied")
                        .tag("dimension", dimension.name())
                        .tag("reason", reason)
                        .register(registry))
                .increment();
    }

    @Override
    public void incrementRetry(DimensionId dimension) {
        dimensionCounter("scd.load.retry", "Number of load attempts retried after a concurrent write", dimension)
                .increment();
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter dimensionCounter(String name, String description, DimensionId dimension) {
        return counterCache.computeIfAbsent(name + ":" + dimension.name(), k ->
                Counter.builder(name)
                        .description(description)
                        .tag("dimension", dimension.name())
                        .register(registry));
    }
}
