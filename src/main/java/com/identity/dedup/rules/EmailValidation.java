package com.identity.dedup.rules;

/**
 * Structural check of a raw email address.
 */
public enum EmailValidation {
    VALID,

    /**
     * No {@code @}, or nothing before it.
     */
    MISSING_AT,

    /**
     * Empty address, or a domain without a dot.
     */
    MISSING_DOMAIN;

    public static EmailValidation of(String email) {
        if (email == null || email.isBlank()) {
            return MISSING_DOMAIN;
        }
        String trimmed = email.trim();
        if (trimmed.indexOf('@') < 0) {
            return MISSING_AT;
        }
        String[] parts = trimmed.split("@", -1);
        if (parts.length != 2 || !parts[1].contains(".")) {
            return MISSING_DOMAIN;
        }
        if (parts[0].isEmpty()) {
            return MISSING_AT;
        }
        return VALID;
    }

    public boolean isValid() {
        return this == VALID;
    }
}
