package com.identity.dedup.core.model;

/**
 * The two interchangeable matching methods.
 */
public enum Heuristic {
    /**
     * Rule-ordered binary baseline (Bird et al., MSR 2006).
     */
    BASELINE,

    /**
     * Weighted multi-signal score compared against a threshold.
     */
    IMPROVED
}
