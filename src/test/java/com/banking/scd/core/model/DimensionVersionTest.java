package com.banking.scd.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DimensionVersion Tests")
class DimensionVersionTest {

    private static final LocalDate JAN = LocalDate.of(2024, 1, 1);
    private static final LocalDate JUN = LocalDate.of(2024, 6, 1);

    private DimensionVersion version(LocalDate from, LocalDate to) {
        return DimensionVersion.builder()
                .surrogateKey(1)
                .dimension(DimensionId.CUSTOMER)
                .naturalKey("C001")
                .attributes(Map.of("risk_rating", "LOW"))
                .effectiveFrom(from)
                .effectiveTo(to)
                .build();
    }

    @Test
    @DisplayName("Current flag follows the open end of the range")
    void currentIsDerived() {
        assertTrue(version(JAN, null).isCurrent());
        assertFalse(version(JAN, JUN).isCurrent());
    }

    @Test
    @DisplayName("covers uses a half-open range")
    void coversHalfOpen() {
        DimensionVersion closed = version(JAN, JUN);
        assertTrue(closed.covers(JAN));
        assertTrue(closed.covers(LocalDate.of(2024, 5, 31)));
        assertFalse(closed.covers(JUN));
        assertFalse(closed.covers(LocalDate.of(2023, 12, 31)));
        assertTrue(version(JAN, null).covers(LocalDate.of(2099, 1, 1)));
    }

    @Test
    @DisplayName("A zero-length version covers no date")
    void zeroLengthCoversNothing() {
        DimensionVersion zeroLength = version(JUN, JUN);
        assertFalse(zeroLength.covers(JUN));
        assertFalse(zeroLength.isCurrent());
    }

    @Test
    @DisplayName("closedAt and withAttributes return modified copies")
    void copiesOnChange() {
        DimensionVersion open = version(JAN, null);
        DimensionVersion closed = open.closedAt(JUN);

        assertTrue(open.isCurrent());
        assertEquals(JUN, closed.getEffectiveTo());
        assertEquals(open.getSurrogateKey(), closed.getSurrogateKey());

        DimensionVersion renamed = open.withAttributes(Map.of("full_name", "Jane Doe"));
        assertEquals("LOW", renamed.getAttribute("risk_rating"));
        assertEquals("Jane Doe", renamed.getAttribute("full_name"));
        assertNull(open.getAttribute("full_name"));
    }

    @Test
    @DisplayName("Should keep null attribute values")
    void nullAttributes() {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("full_name", null);
        DimensionVersion v = DimensionVersion.builder(version(JAN, null)).attributes(attributes).build();
        assertTrue(v.getAttributes().containsKey("full_name"));
        assertNull(v.getAttribute("full_name"));
    }

    @Test
    @DisplayName("Should reject invalid keys and ranges")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> version(JUN, JAN));
        assertThrows(IllegalArgumentException.class, () -> DimensionVersion.builder(version(JAN, null))
                .surrogateKey(0).build());
        assertThrows(NullPointerException.class, () -> DimensionVersion.builder(version(JAN, null))
                .naturalKey(null).build());
    }
}
