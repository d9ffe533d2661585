package com.banking.scd.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AttributeType Tests")
class AttributeTypeTest {

    @Nested
    @DisplayName("coerce")
    class CoerceTests {

        @Test
        @DisplayName("Blank strings and null coerce to null for every type")
        void blankIsNull() {
            for (AttributeType type : AttributeType.values()) {
                assertNull(type.coerce(null), type.name());
                assertNull(type.coerce("   "), type.name());
            }
        }

        @Test
        @DisplayName("Should parse ISO dates")
        void parsesDates() {
            assertEquals(LocalDate.of(2024, 6, 1), AttributeType.DATE.coerce("2024-06-01"));
            assertEquals(LocalDate.of(2024, 6, 1), AttributeType.DATE.coerce(LocalDate.of(2024, 6, 1)));
        }

        @Test
        @DisplayName("Should convert numbers to BigDecimal and Long")
        void convertsNumbers() {
            assertEquals(new BigDecimal("12.50"), AttributeType.DECIMAL.coerce("12.50"));
            assertEquals(new BigDecimal("7"), AttributeType.DECIMAL.coerce(7));
            assertEquals(42L, AttributeType.INTEGER.coerce("42"));
            assertEquals(42L, AttributeType.INTEGER.coerce(42));
            assertEquals(42L, AttributeType.INTEGER.coerce(new BigDecimal("42.0")));
        }

        @Test
        @DisplayName("Should accept common boolean spellings")
        void convertsBooleans() {
            assertEquals(Boolean.TRUE, AttributeType.BOOLEAN.coerce("Y"));
            assertEquals(Boolean.TRUE, AttributeType.BOOLEAN.coerce("true"));
            assertEquals(Boolean.FALSE, AttributeType.BOOLEAN.coerce("0"));
            assertEquals(Boolean.FALSE, AttributeType.BOOLEAN.coerce(false));
        }

        @Test
        @DisplayName("Should reject values that do not fit the type")
        void rejectsInvalid() {
            assertThrows(IllegalArgumentException.class, () -> AttributeType.DATE.coerce("01/06/2024"));
            assertThrows(IllegalArgumentException.class, () -> AttributeType.DECIMAL.coerce("abc"));
            assertThrows(IllegalArgumentException.class, () -> AttributeType.INTEGER.coerce("1.5"));
            assertThrows(IllegalArgumentException.class, () -> AttributeType.INTEGER.coerce(new BigDecimal("1.5")));
            assertThrows(IllegalArgumentException.class, () -> AttributeType.BOOLEAN.coerce("maybe"));
        }
    }

    @Nested
    @DisplayName("valuesEqual")
    class EqualityTests {

        @Test
        @DisplayName("Decimals compare numerically regardless of scale")
        void decimalScaleIgnored() {
            assertTrue(AttributeType.DECIMAL.valuesEqual(new BigDecimal("1.50"), new BigDecimal("1.5")));
            assertFalse(AttributeType.DECIMAL.valuesEqual(new BigDecimal("1.50"), new BigDecimal("1.5000001")));
        }

        @Test
        @DisplayName("Null differs from any populated value")
        void nullVersusPopulated() {
            assertTrue(AttributeType.STRING.valuesEqual(null, null));
            assertFalse(AttributeType.STRING.valuesEqual(null, "x"));
            assertFalse(AttributeType.BOOLEAN.valuesEqual(Boolean.FALSE, null));
        }
    }
}
