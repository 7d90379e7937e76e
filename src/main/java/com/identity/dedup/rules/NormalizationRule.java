package com.identity.dedup.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A regex rewrite applied to author names before tokenization.
 *
 * <p>Each rule belongs to one {@link RuleSet}; the default engine loads the address
 * rules first, then the person rules, then the punctuation rules shared by every name.
 * Within the engine rules are ordered by priority (lower number runs first).</p>
 */
public class NormalizationRule {

    /**
     * Groups of rules loaded by {@link IdentityNormalizationRules#createDefaultEngine()}.
     */
    public enum RuleSet {
        /** Email addresses pasted into the name field by misconfigured tooling. */
        ADDRESS,
        /** Honorifics and generational suffixes around a person's name. */
        PERSON,
        /** Apostrophes, separators and stray punctuation. */
        COMMON
    }

    private final String name;
    private final Pattern pattern;
    private final String replacement;
    private final RuleSet ruleSet;
    private final int priority;

    private NormalizationRule(Builder builder) {
        this.name = builder.name;
        this.pattern = Pattern.compile(builder.pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        this.replacement = builder.replacement;
        this.ruleSet = builder.ruleSet;
        this.priority = builder.priority;
    }

    public String getName() {
        return name;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public String getReplacement() {
        return replacement;
    }

    public RuleSet getRuleSet() {
        return ruleSet;
    }

    public int getPriority() {
        return priority;
    }

    /**
     * Rewrites every match in the author name. Null stays null.
     */
    public String apply(String authorName) {
        if (authorName == null) {
            return null;
        }
        return pattern.matcher(authorName).replaceAll(replacement);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NormalizationRule that = (NormalizationRule) o;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "NormalizationRule{" +
                "name='" + name + '\'' +
                ", ruleSet=" + ruleSet +
                ", pattern=" + pattern.pattern() +
                ", priority=" + priority +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String pattern;
        private String replacement;
        private RuleSet ruleSet = RuleSet.COMMON;
        private int priority = 100;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder pattern(String pattern) {
            this.pattern = pattern;
            return this;
        }

        public Builder replacement(String replacement) {
            this.replacement = replacement;
            return this;
        }

        public Builder ruleSet(RuleSet ruleSet) {
            this.ruleSet = ruleSet;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public NormalizationRule build() {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(pattern, "pattern is required");
            Objects.requireNonNull(replacement, "replacement is required");
            Objects.requireNonNull(ruleSet, "ruleSet is required");
            return new NormalizationRule(this);
        }
    }
}
