package com.banking.scd.store;

import java.util.regex.Pattern;

/**
 * Input validation for values that reach a dimension store.
 * Natural keys are bound as parameters, but identifiers (schema, table and column
 * names) are spliced into SQL text and must be checked before use.
 */
public final class InputSanitizer {

    /** Maximum natural key length; the {@code *_nk} columns are VARCHAR(36). */
    public static final int MAX_NATURAL_KEY_LENGTH = 36;

    private static final Pattern IDENTIFIER = Pattern.compile("^[a-z_][a-z0-9_]{0,62}$");

    private InputSanitizer() {
        // utility class
    }

    /**
     * Validates a natural key.
     * Rejects null, blank, overly long, or control-character-containing keys.
     *
     * @param naturalKey the natural key to validate
     * @throws IllegalArgumentException if the key is invalid
     */
    public static void validateNaturalKey(String naturalKey) {
        if (naturalKey == null || naturalKey.isBlank()) {
            throw new IllegalArgumentException("Natural key must not be null or blank");
        }
        if (naturalKey.length() > MAX_NATURAL_KEY_LENGTH) {
            throw new IllegalArgumentException(
                    "Natural key exceeds maximum length of " + MAX_NATURAL_KEY_LENGTH +
                            " characters (was " + naturalKey.length() + ")");
        }
        if (containsControlCharacters(naturalKey)) {
            throw new IllegalArgumentException("Natural key must not contain control characters");
        }
    }

    /**
     * Validates a SQL identifier: lower case letters, digits and underscores,
     * at most 63 characters (the PostgreSQL limit).
     *
     * @param identifier the identifier to validate
     * @return the identifier, for chaining
     * @throws IllegalArgumentException if the identifier is invalid
     */
    public static String validateIdentifier(String identifier) {
        if (identifier == null || !IDENTIFIER.matcher(identifier).matches()) {
            throw new IllegalArgumentException("Invalid SQL identifier: '" + identifier + "'");
        }
        return identifier;
    }

    /**
     * Checks whether a string contains ASCII control characters (0x00-0x1F, 0x7F).
     */
    private static boolean containsControlCharacters(String s) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c < 0x20 || c == 0x7F) {
                return true;
            }
        }
        return false;
    }
}
