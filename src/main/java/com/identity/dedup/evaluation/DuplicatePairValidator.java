package com.identity.dedup.evaluation;

import com.identity.dedup.core.model.NormalizedIdentity;
import com.identity.dedup.similarity.JaccardSimilarity;
import com.identity.dedup.similarity.SimilarityAlgorithm;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Independent second opinion on a duplicate pair, for manual review of reported matches.
 *
 * <p>Besides name, domain and prefix agreement it looks for the conventional address
 * shapes built from a name: first initial + last name ({@code jsmith} for John Smith)
 * and last initial + first name ({@code sjohn}), checked in both directions. These
 * shapes are review evidence only and never influence either heuristic's score.</p>
 */
public class DuplicatePairValidator {

    static final double NAME_SIMILARITY_CUTOFF = 0.7;
    static final double NAME_WEIGHT = 0.3;
    static final double DOMAIN_WEIGHT = 0.2;
    static final double LOCAL_PART_WEIGHT = 0.4;
    static final double PREFIX_PATTERN_WEIGHT = 0.2;
    static final double LIKELY_DUPLICATE_CUTOFF = 0.5;

    private final SimilarityAlgorithm nameSimilarity = new JaccardSimilarity(JaccardSimilarity.Mode.CHARACTERS);

    public PairValidation validate(NormalizedIdentity a, NormalizedIdentity b) {
        List<String> evidence = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        double confidence = 0.0;

        if (!a.hasName() || !b.hasName()) {
            warnings.add("Missing name");
        } else {
            double similarity = nameSimilarity.compute(String.join(" ", a.nameTokens()),
                    String.join(" ", b.nameTokens()));
            if (similarity > NAME_SIMILARITY_CUTOFF) {
                evidence.add(String.format(Locale.ROOT, "High name similarity: %.2f", similarity));
                confidence += NAME_WEIGHT;
            }
        }

        if (!a.hasEmail() || !b.hasEmail()) {
            warnings.add("Missing email");
        }

        if (!a.emailDomain().isEmpty() && !b.emailDomain().isEmpty()) {
            if (a.emailDomain().equals(b.emailDomain())) {
                evidence.add("Same email domain: " + a.emailDomain());
                confidence += DOMAIN_WEIGHT;
            } else {
                warnings.add("Different email domains: " + a.emailDomain() + " vs " + b.emailDomain());
            }
        }

        String localA = a.canonicalLocal();
        if (!localA.isEmpty() && localA.equals(b.canonicalLocal())) {
            evidence.add("Identical email prefixes");
            confidence += LOCAL_PART_WEIGHT;
        }

        int patternsBefore = evidence.size();
        addPrefixPatterns(b.canonicalLocal(), a, evidence);
        addPrefixPatterns(localA, b, evidence);
        if (evidence.size() > patternsBefore) {
            confidence += PREFIX_PATTERN_WEIGHT;
        }

        confidence = Math.min(1.0, confidence);
        return new PairValidation(confidence > LIKELY_DUPLICATE_CUTOFF, confidence, evidence, warnings);
    }

    private static void addPrefixPatterns(String prefix, NormalizedIdentity named, List<String> evidence) {
        String first = firstName(named);
        String last = first.isEmpty() ? "" : named.lastNameToken();
        if (prefix.isEmpty() || last.isEmpty()) {
            return;
        }
        String initialLast = first.charAt(0) + last;
        if (prefix.contains(initialLast)) {
            addOnce(evidence, "Email prefix contains first initial + last name: " + initialLast);
        }
        String initialFirst = last.charAt(0) + first;
        if (prefix.contains(initialFirst)) {
            addOnce(evidence, "Email prefix contains last initial + first name: " + initialFirst);
        }
    }

    /**
     * First name of a name with at least two parts, or "" for single-word names.
     * An abbreviated first name ("J. Doe") is its initial.
     */
    static String firstName(NormalizedIdentity identity) {
        List<String> tokens = identity.nameTokens();
        if (tokens.size() >= 2) {
            return tokens.get(0);
        }
        if (tokens.size() == 1 && !identity.firstInitial().isEmpty()
                && !tokens.get(0).startsWith(identity.firstInitial())) {
            return identity.firstInitial();
        }
        return "";
    }

    private static void addOnce(List<String> evidence, String fact) {
        if (!evidence.contains(fact)) {
            evidence.add(fact);
        }
    }
}
