package com.banking.scd.core.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;

/**
 * Value types of tracked dimension attributes.
 * Each type coerces raw input (text from a CSV/JSON feed, or a typed Java value
 * read back from a store) into a single canonical Java representation.
 */
public enum AttributeType {
    /** Free text, compared after trimming. */
    STRING,
    /** Categorical code (status, rating, ISO code), compared case-insensitively. */
    CODE,
    /** Calendar date as {@link LocalDate}. */
    DATE,
    /** Fixed-precision amount or rate as {@link BigDecimal}. */
    DECIMAL,
    BOOLEAN,
    /** Whole number as {@link Long}. */
    INTEGER;

    /**
     * Whether values of this type are text and go through normalization rules.
     */
    public boolean isText() {
        return this == STRING || this == CODE;
    }

    /**
     * Coerces a raw value into this type's canonical representation.
     * Blank strings become {@code null}.
     *
     * @param raw the raw value, may be null
     * @return the coerced value, or null
     * @throws IllegalArgumentException if the value cannot be represented in this type
     */
    public Object coerce(Object raw) {
        if (raw == null) {
            return null;
        }
        if (raw instanceof String s && s.isBlank()) {
            return null;
        }
        try {
            return switch (this) {
                case STRING, CODE -> raw.toString();
                case DATE -> toDate(raw);
                case DECIMAL -> toDecimal(raw);
                case BOOLEAN -> toBoolean(raw);
                case INTEGER -> toLong(raw);
            };
        } catch (NumberFormatException | ArithmeticException | DateTimeParseException e) {
            throw new IllegalArgumentException(
                    "Cannot convert '" + raw + "' to " + name() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Compares two canonical values of this type.
     * Decimals are equal when numerically equal regardless of scale; no tolerance is applied.
     */
    public boolean valuesEqual(Object a, Object b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (this == DECIMAL && a instanceof BigDecimal da && b instanceof BigDecimal db) {
            return da.compareTo(db) == 0;
        }
        return Objects.equals(a, b);
    }

    private static LocalDate toDate(Object raw) {
        if (raw instanceof LocalDate d) {
            return d;
        }
        if (raw instanceof java.sql.Date d) {
            return d.toLocalDate();
        }
        return LocalDate.parse(raw.toString().trim());
    }

    private static BigDecimal toDecimal(Object raw) {
        if (raw instanceof BigDecimal d) {
            return d;
        }
        if (raw instanceof Double || raw instanceof Float) {
            return BigDecimal.valueOf(((Number) raw).doubleValue());
        }
        if (raw instanceof Number n) {
            return new BigDecimal(n.toString());
        }
        return new BigDecimal(raw.toString().trim());
    }

    private static Boolean toBoolean(Object raw) {
        if (raw instanceof Boolean b) {
            return b;
        }
        String s = raw.toString().trim().toLowerCase(Locale.ROOT);
        return switch (s) {
            case "true", "t", "yes", "y", "1" -> Boolean.TRUE;
            case "false", "f", "no", "n", "0" -> Boolean.FALSE;
            default -> throw new IllegalArgumentException("Cannot convert '" + raw + "' to BOOLEAN");
        };
    }

    private static Long toLong(Object raw) {
        if (raw instanceof Long l) {
            return l;
        }
        if (raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
            return ((Number) raw).longValue();
        }
        if (raw instanceof BigDecimal d) {
            return d.longValueExact();
        }
        return Long.parseLong(raw.toString().trim());
    }
}
