package com.banking.scd.tracing;

import com.banking.scd.core.model.AsOfRecord;
import com.banking.scd.core.model.ChangeType;
import com.banking.scd.core.model.DimensionId;

/**
 * Tracing disabled. Hands out one shared span that records nothing.
 */
public class NoOpTracingService implements TracingService {

    static final Span NO_OP_SPAN = new Span() {
        @Override
        public void recordOutcome(ChangeType changeType, long surrogateKey, int attempts) {
        }

        @Override
        public void recordRetry(int attempt, String reason) {
        }

        @Override
        public void recordVersionsRead(int versionsRead) {
        }

        @Override
        public void recordFailure(Throwable failure) {
        }

        @Override
        public void close() {
        }
    };

    @Override
    public Span startLoad(AsOfRecord record) {
        return NO_OP_SPAN;
    }

    @Override
    public Span startQuery(String operation, DimensionId dimension, String naturalKey) {
        return NO_OP_SPAN;
    }
}
