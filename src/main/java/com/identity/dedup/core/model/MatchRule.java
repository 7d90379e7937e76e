package com.identity.dedup.core.model;

/**
 * Rule of the baseline heuristic that decided a comparison.
 * Rules are evaluated in declaration order and the first one that fires wins.
 */
public enum MatchRule {
    /**
     * Normalized email addresses are identical.
     */
    EMAIL_EQUAL,

    /**
     * Canonical email local parts are identical and the names share a non-initial token.
     */
    EMAIL_LOCAL_AND_NAME_TOKEN,

    /**
     * Name token sets are identical and contain a token of at least three characters.
     */
    NAME_TOKENS_EQUAL,

    /**
     * No rule fired.
     */
    NONE;

    public boolean isMatch() {
        return this != NONE;
    }
}
