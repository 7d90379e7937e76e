package com.identity.dedup.rules;

import java.util.List;

/**
 * Built-in rules for author names as they appear in commit metadata.
 */
public final class IdentityNormalizationRules {

    private IdentityNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getAddressRules());
        engine.addRules(getPersonRules());
        engine.addRules(getCommonRules());
        return engine;
    }

    /**
     * Rules for misconfigured tooling that writes an email address into the name field.
     * An address that fills the whole field is reduced to its local part; an address next
     * to a real name is dropped so the name is not counted twice.
     */
    public static List<NormalizationRule> getAddressRules() {
        return List.of(
                // "jane.doe@example.com" -> "jane.doe"
                NormalizationRule.builder()
                        .name("address-only-name")
                        .ruleSet(NormalizationRule.RuleSet.ADDRESS)
                        .pattern("^\\s*<?([^\\s@<>]+)@[^\\s<>]+>?\\s*$")
                        .replacement("$1")
                        .priority(4)
                        .build(),

                // "Jane Doe <jane.doe@example.com>" -> "Jane Doe"
                NormalizationRule.builder()
                        .name("address-in-name")
                        .ruleSet(NormalizationRule.RuleSet.ADDRESS)
                        .pattern("<?[^\\s@<>]+@[^\\s<>]+>?")
                        .replacement(" ")
                        .priority(5)
                        .build(),

                NormalizationRule.builder()
                        .name("angle-brackets")
                        .ruleSet(NormalizationRule.RuleSet.ADDRESS)
                        .pattern("[<>]")
                        .replacement(" ")
                        .priority(6)
                        .build()
        );
    }

    /**
     * Honorifics and generational suffixes.
     */
    public static List<NormalizationRule> getPersonRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("person-honorific")
                        .ruleSet(NormalizationRule.RuleSet.PERSON)
                        .pattern("^\\s*(Mr|Mrs|Ms|Dr|Prof)\\.?\\s+")
                        .replacement("")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("person-generational-suffix")
                        .ruleSet(NormalizationRule.RuleSet.PERSON)
                        .pattern(",?\\s+(Jr|Sr|II|III|IV)\\.?\\s*$")
                        .replacement("")
                        .priority(10)
                        .build()
        );
    }

    /**
     * Punctuation handling shared by every name.
     */
    public static List<NormalizationRule> getCommonRules() {
        return List.of(
                // O'Connor -> OConnor
                NormalizationRule.builder()
                        .name("common-apostrophe")
                        .pattern("['’`]")
                        .replacement("")
                        .priority(50)
                        .build(),

                // John-Smith, john.smith, john_smith -> john smith
                NormalizationRule.builder()
                        .name("common-separators")
                        .pattern("[\\-_.]")
                        .replacement(" ")
                        .priority(60)
                        .build(),

                NormalizationRule.builder()
                        .name("common-special-chars")
                        .pattern("[^\\p{L}\\p{N}\\s]")
                        .replacement(" ")
                        .priority(100)
                        .build(),

                NormalizationRule.builder()
                        .name("common-collapse-spaces")
                        .pattern("\\s+")
                        .replacement(" ")
                        .priority(200)
                        .build()
        );
    }
}
