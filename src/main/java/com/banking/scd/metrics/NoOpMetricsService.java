package com.banking.scd.metrics;

import com.banking.scd.core.model.ChangeType;
import com.banking.scd.core.model.DimensionId;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordLoadDuration(DimensionId dimension, ChangeType changeType, Duration duration) {
    }

    @Override
    public void incrementVersionCreated(DimensionId dimension) {
    }

    @Override
    public void incrementVersionClosed(DimensionId dimension) {
    }

    @Override
    public void incrementType1Update(DimensionId dimension) {
    }

    @Override
    public void incrementLoadRejected(DimensionId dimension, String reason) {
    }

    @Override
    public void incrementRetry(DimensionId dimension) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
