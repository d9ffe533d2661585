package com.banking.scd.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LoadOptions Tests")
class LoadOptionsTest {

    @Test
    @DisplayName("Defaults allow three attempts from the core banking system")
    void defaults() {
        LoadOptions options = LoadOptions.defaults();

        assertEquals(3, options.getMaxAttempts());
        assertEquals("CBS", options.getSourceSystem());
        assertTrue(options.isAuditEnabled());
        assertTrue(options.getRetryDelayMs() >= 0);
    }

    @Test
    @DisplayName("toBuilder copies every option")
    void toBuilder() {
        LoadOptions options = LoadOptions.builder()
                .maxAttempts(5)
                .retryDelayMs(0)
                .sourceSystem("CARDS")
                .auditEnabled(false)
                .build();

        LoadOptions copy = options.toBuilder().maxAttempts(2).build();

        assertEquals(2, copy.getMaxAttempts());
        assertEquals(0, copy.getRetryDelayMs());
        assertEquals("CARDS", copy.getSourceSystem());
        assertFalse(copy.isAuditEnabled());
    }

    @Test
    @DisplayName("Should reject invalid values")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> LoadOptions.builder().maxAttempts(0).build());
        assertThrows(IllegalArgumentException.class, () -> LoadOptions.builder().retryDelayMs(-1).build());
        assertThrows(IllegalArgumentException.class, () -> LoadOptions.builder().sourceSystem(" ").build());
        assertThrows(IllegalArgumentException.class,
                () -> LoadOptions.builder().sourceSystem("S".repeat(51)).build());
    }
}
