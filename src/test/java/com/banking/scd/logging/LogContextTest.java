package com.banking.scd.logging;

import com.banking.scd.core.model.DimensionId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("forLoad populates MDC and close removes it")
    void forLoad() {
        try (LogContext ctx = LogContext.forLoad("corr-1", DimensionId.CUSTOMER, "C001")) {
            assertEquals("corr-1", MDC.get("correlationId"));
            assertEquals("CUSTOMER", MDC.get("dimension"));
            assertEquals("C001", MDC.get("naturalKey"));
            assertEquals("load", MDC.get("operation"));
        }

        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("dimension"));
        assertNull(MDC.get("naturalKey"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("forBatch and with add extra keys")
    void forBatchWith() {
        try (LogContext ctx = LogContext.forBatch("batch-9").with("format", "csv")) {
            assertEquals("batch-9", MDC.get("batchId"));
            assertEquals("batch", MDC.get("operation"));
            assertEquals("csv", MDC.get("format"));
        }

        assertNull(MDC.get("batchId"));
        assertNull(MDC.get("format"));
    }

    @Test
    @DisplayName("Keys outside the context are left alone")
    void foreignKeysKept() {
        MDC.put("requestId", "r-1");
        try (LogContext ctx = LogContext.forBatch("b")) {
            assertEquals("r-1", MDC.get("requestId"));
        }
        assertEquals("r-1", MDC.get("requestId"));
    }

    @Test
    @DisplayName("Correlation ids are unique")
    void correlationIds() {
        assertNotEquals(LogContext.generateCorrelationId(), LogContext.generateCorrelationId());
    }
}
