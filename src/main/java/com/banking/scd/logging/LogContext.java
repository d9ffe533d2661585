package com.banking.scd.logging;

import com.banking.scd.core.model.DimensionId;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to the SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forLoad(correlationId, DimensionId.CUSTOMER, "C001")) {
 *     log.info("load.applied changeType={}", changeType);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for loading one as-of record.
     */
    public static LogContext forLoad(String correlationId, DimensionId dimension, String naturalKey) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("dimension", dimension.name());
        ctx.put("naturalKey", naturalKey);
        ctx.put("operation", "load");
        return ctx;
    }

    /**
     * Creates a log context for a batch of records.
     */
    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "batch");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
