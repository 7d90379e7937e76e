package com.identity.dedup.blocking;

import com.identity.dedup.core.model.NormalizedIdentity;

import java.util.Set;

/**
 * Groups identities by first initial and last name token ({@code ini:j|doe}),
 * so "J. Doe" and "Jane Doe" share a bucket.
 */
public class InitialsBlockingKeyStrategy implements BlockingKeyStrategy {

    static final String PREFIX = "ini:";

    @Override
    public Set<String> generateKeys(NormalizedIdentity identity) {
        if (identity == null || !identity.hasName() || identity.firstInitial().isEmpty()) {
            return Set.of();
        }
        return Set.of(PREFIX + identity.firstInitial() + "|" + identity.lastNameToken());
    }
}
