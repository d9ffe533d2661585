package com.banking.scd.api;

/**
 * Options for applying as-of records.
 * Configures the optimistic retry budget and the lineage written with each version.
 */
public class LoadOptions {

    private static final int DEFAULT_MAX_ATTEMPTS = 3;
    private static final long DEFAULT_RETRY_DELAY_MS = 25;
    private static final String DEFAULT_SOURCE_SYSTEM = "CBS";

    private final int maxAttempts;
    private final long retryDelayMs;
    private final String sourceSystem;
    private final boolean auditEnabled;

    private LoadOptions(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.retryDelayMs = builder.retryDelayMs;
        this.sourceSystem = builder.sourceSystem;
        this.auditEnabled = builder.auditEnabled;
    }

    /**
     * Total number of read-detect-write attempts per record, the first one included.
     */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Base back-off between attempts; attempt {@code n} waits {@code n * retryDelayMs}.
     */
    public long getRetryDelayMs() {
        return retryDelayMs;
    }

    /**
     * Source system recorded in the audit trail ({@code dw_source_system}).
     */
    public String getSourceSystem() {
        return sourceSystem;
    }

    public boolean isAuditEnabled() {
        return auditEnabled;
    }

    public static LoadOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxAttempts(maxAttempts)
                .retryDelayMs(retryDelayMs)
                .sourceSystem(sourceSystem)
                .auditEnabled(auditEnabled);
    }

    @Override
    public String toString() {
        return "LoadOptions{" +
                "maxAttempts=" + maxAttempts +
                ", retryDelayMs=" + retryDelayMs +
                ", sourceSystem='" + sourceSystem + '\'' +
                ", auditEnabled=" + auditEnabled +
                '}';
    }

    public static class Builder {
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private long retryDelayMs = DEFAULT_RETRY_DELAY_MS;
        private String sourceSystem = DEFAULT_SOURCE_SYSTEM;
        private boolean auditEnabled = true;

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder retryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
            return this;
        }

        public Builder sourceSystem(String sourceSystem) {
            this.sourceSystem = sourceSystem;
            return this;
        }

        public Builder auditEnabled(boolean auditEnabled) {
            this.auditEnabled = auditEnabled;
            return this;
        }

        public LoadOptions build() {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be >= 1");
            }
            if (retryDelayMs < 0) {
                throw new IllegalArgumentException("retryDelayMs must be >= 0");
            }
            if (sourceSystem == null || sourceSystem.isBlank()) {
                throw new IllegalArgumentException("sourceSystem must not be blank");
            }
            if (sourceSystem.length() > 50) {
                throw new IllegalArgumentException("sourceSystem must not exceed 50 characters");
            }
            return new LoadOptions(this);
        }
    }
}
