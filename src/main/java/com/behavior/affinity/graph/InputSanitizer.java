package com.behavior.affinity.graph;

/**
 * Validation for identifiers and display names that end up inside Cypher
 * statements or store keys.
 */
public final class InputSanitizer {

    /** Maximum length of a tenant, cohort, profile or subject identifier. */
    public static final int MAX_IDENTIFIER_LENGTH = 256;

    private InputSanitizer() {
    }

    /**
     * Rejects null, blank, overly long or control-character-containing values.
     *
     * @param value the identifier or display name
     * @param field the field name used in the error message
     * @return the value, for chaining
     * @throws IllegalArgumentException if the value is invalid
     */
    public static String requireIdentifier(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
        if (value.length() > MAX_IDENTIFIER_LENGTH) {
            throw new IllegalArgumentException(field + " exceeds maximum length of "
                    + MAX_IDENTIFIER_LENGTH + " characters (was " + value.length() + ")");
        }
        if (containsControlCharacters(value)) {
            throw new IllegalArgumentException(field + " must not contain control characters");
        }
        return value;
    }

    /**
     * Validates a score bound passed by a caller.
     *
     * @throws IllegalArgumentException if the bound is NaN or outside [0, 1]
     */
    public static double requireScoreBound(double score, String field) {
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException(field + " must be in [0, 1], was " + score);
        }
        return score;
    }

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
