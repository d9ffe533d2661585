package com.banking.scd.tracing;

import com.banking.scd.core.model.ChangeType;

/**
 * Trace span around one load or one chain query. Ends when closed.
 */
public interface Span extends AutoCloseable {

    /**
     * Marks a load as applied with its outcome.
     */
    void recordOutcome(ChangeType changeType, long surrogateKey, int attempts);

    /**
     * Adds an event for a load attempt that lost a race and is retried.
     */
    void recordRetry(int attempt, String reason);

    /**
     * Marks a query as answered after reading {@code versionsRead} versions.
     */
    void recordVersionsRead(int versionsRead);

    void recordFailure(Throwable failure);

    @Override
    void close();
}
