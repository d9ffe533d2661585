package com.banking.scd.metrics;

import com.banking.scd.core.model.ChangeType;
import com.banking.scd.core.model.DimensionId;

import java.time.Duration;

/**
 * Interface for recording dimension load metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics backend configured.
 */
public interface MetricsService {

    void recordLoadDuration(DimensionId dimension, ChangeType changeType, Duration duration);

    void incrementVersionCreated(DimensionId dimension);

    void incrementVersionClosed(DimensionId dimension);

    void incrementType1Update(DimensionId dimension);

    /**
     * Counts a record that was not applied.
     *
     * @param reason short machine-readable reason, e.g. the exception's simple class name
     */
    void incrementLoadRejected(DimensionId dimension, String reason);

    void incrementRetry(DimensionId dimension);

    void recordBatchSize(int size);

    void recordCacheHit();

    void recordCacheMiss();
}
