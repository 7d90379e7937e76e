package com.identity.dedup.blocking;

import java.util.List;
import java.util.Locale;

/**
 * Selectable blocking configurations.
 */
public enum BlockingStrategy {
    DOMAIN,
    INITIALS,
    BOTH;

    public BlockingKeyStrategy keyStrategy() {
        return switch (this) {
            case DOMAIN -> new DomainBlockingKeyStrategy();
            case INITIALS -> new InitialsBlockingKeyStrategy();
            case BOTH -> new CompositeBlockingKeyStrategy(List.of(
                    new DomainBlockingKeyStrategy(),
                    new InitialsBlockingKeyStrategy()));
        };
    }

    /**
     * Case-insensitive lookup ("domain", "initials", "both").
     */
    public static BlockingStrategy fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Blocking strategy is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown blocking strategy: " + value
                    + " (expected domain, initials or both)", e);
        }
    }
}
