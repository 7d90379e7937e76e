package com.identity.dedup.blocking;

import com.identity.dedup.core.model.NormalizedIdentity;

import java.util.Set;

/**
 * Groups identities by email domain ({@code dom:example.com}).
 * Identities without a domain produce no key.
 */
public class DomainBlockingKeyStrategy implements BlockingKeyStrategy {

    static final String PREFIX = "dom:";

    @Override
    public Set<String> generateKeys(NormalizedIdentity identity) {
        if (identity == null || identity.emailDomain().isEmpty()) {
            return Set.of();
        }
        return Set.of(PREFIX + identity.emailDomain());
    }
}
