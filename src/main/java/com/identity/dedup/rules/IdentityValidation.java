package com.identity.dedup.rules;

import java.util.Objects;

/**
 * Result of validating a raw identity.
 *
 * @param nameValid whether the trimmed name has at least two characters
 * @param email     structural validity of the email address
 */
public record IdentityValidation(boolean nameValid, EmailValidation email) {

    public IdentityValidation {
        Objects.requireNonNull(email, "email is required");
    }

    public boolean isValid() {
        return nameValid && email.isValid();
    }
}
