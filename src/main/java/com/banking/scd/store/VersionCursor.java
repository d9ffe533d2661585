package com.banking.scd.store;

import com.banking.scd.core.model.DimensionVersion;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.Objects;

/**
 * Position in a version chain ordered by {@code (effectiveFrom, surrogateKey)}.
 * The surrogate key breaks ties between a zero-length version and its successor.
 * Encoded as {@code yyyy-MM-dd:surrogateKey}.
 */
public record VersionCursor(LocalDate effectiveFrom, long surrogateKey) {

    /** Chain order used by every store. */
    public static final Comparator<DimensionVersion> CHAIN_ORDER =
            Comparator.comparing(DimensionVersion::getEffectiveFrom)
                    .thenComparingLong(DimensionVersion::getSurrogateKey);

    public VersionCursor {
        Objects.requireNonNull(effectiveFrom, "effectiveFrom is required");
    }

    public static VersionCursor of(DimensionVersion version) {
        return new VersionCursor(version.getEffectiveFrom(), version.getSurrogateKey());
    }

    /**
     * Parses an encoded cursor.
     *
     * @return the cursor, or null for a null or empty string
     * @throws IllegalArgumentException if the string is not a valid cursor
     */
    public static VersionCursor parse(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            return null;
        }
        int sep = encoded.lastIndexOf(':');
        if (sep <= 0) {
            throw new IllegalArgumentException("Malformed version cursor: '" + encoded + "'");
        }
        try {
            return new VersionCursor(
                    LocalDate.parse(encoded.substring(0, sep)),
                    Long.parseLong(encoded.substring(sep + 1)));
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException("Malformed version cursor: '" + encoded + "'", e);
        }
    }

    public String encode() {
        return effectiveFrom + ":" + surrogateKey;
    }

    /**
     * Whether the version sorts strictly after this cursor.
     */
    public boolean precedes(DimensionVersion version) {
        int cmp = version.getEffectiveFrom().compareTo(effectiveFrom);
        return cmp > 0 || (cmp == 0 && version.getSurrogateKey() > surrogateKey);
    }
}
