package com.identity.dedup.blocking;

import com.identity.dedup.core.model.NormalizedIdentity;

import java.util.Set;

/**
 * Strategy interface for generating blocking keys from normalized identities.
 * Blocking keys are used to narrow the candidate set for pairwise comparison,
 * avoiding an exhaustive O(n²) scan.
 *
 * <p>Identities that share at least one blocking key are compared. Keys must be
 * cheap and high-recall; an identity may produce several keys.</p>
 */
public interface BlockingKeyStrategy {

    /**
     * Generates the blocking keys of a normalized identity.
     *
     * @param identity the normalized identity
     * @return set of blocking keys (never null, may be empty)
     */
    Set<String> generateKeys(NormalizedIdentity identity);
}
