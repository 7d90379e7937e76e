package com.identity.dedup.similarity;

import com.identity.dedup.core.model.CandidatePair;
import com.identity.dedup.core.model.Heuristic;
import com.identity.dedup.core.model.IdentityPair;
import com.identity.dedup.core.model.NormalizedIdentity;
import com.identity.dedup.rules.NicknameDictionary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Set;

/**
 * Weighted multi-signal scorer.
 * Formula: score = wName*name + wLocal*emailLocal + wDomain*domain + wInitials*initials
 *
 * <ul>
 *   <li>name: edit-distance similarity of the sorted, nickname-canonical name tokens</li>
 *   <li>emailLocal: edit-distance similarity of the email local parts</li>
 *   <li>domain: 1.0 when the email domains are equal</li>
 *   <li>initials: shared initials over the size of the smaller initial set</li>
 * </ul>
 */
public class ImprovedScorer implements IdentityScorer {
    private static final Logger log = LoggerFactory.getLogger(ImprovedScorer.class);
    private static final double SCORE_EPSILON = 1e-9;

    private final ImprovedWeights weights;
    private final LevenshteinSimilarity levenshtein;
    private final NicknameDictionary nicknames;

    public ImprovedScorer() {
        this(ImprovedWeights.defaultWeights());
    }

    public ImprovedScorer(ImprovedWeights weights) {
        this(weights, NicknameDictionary.defaultDictionary());
    }

    public ImprovedScorer(ImprovedWeights weights, NicknameDictionary nicknames) {
        this.weights = weights;
        this.levenshtein = new LevenshteinSimilarity();
        this.nicknames = nicknames;
    }

    @Override
    public Heuristic heuristic() {
        return Heuristic.IMPROVED;
    }

    @Override
    public double score(NormalizedIdentity a, NormalizedIdentity b) {
        return breakdown(a, b).score();
    }

    @Override
    public boolean isDuplicate(NormalizedIdentity a, NormalizedIdentity b, double threshold) {
        return isDuplicate(score(a, b), threshold);
    }

    /**
     * Threshold decision on an already computed score; a score equal to the threshold is a duplicate.
     */
    public static boolean isDuplicate(double score, double threshold) {
        return score >= threshold;
    }

    @Override
    public String explain(NormalizedIdentity a, NormalizedIdentity b) {
        return breakdown(a, b).toString();
    }

    @Override
    public CandidatePair compare(IdentityPair pair, NormalizedIdentity a, NormalizedIdentity b, double threshold) {
        ScoreBreakdown breakdown = breakdown(a, b);
        boolean duplicate = isDuplicate(breakdown.score(), threshold);
        return new CandidatePair(pair, breakdown.score(), duplicate, duplicate ? breakdown.toString() : "");
    }

    /**
     * Computes every signal and the weighted score.
     */
    public ScoreBreakdown breakdown(NormalizedIdentity a, NormalizedIdentity b) {
        if (a == null || b == null) {
            return new ScoreBreakdown(0.0, 0.0, 0.0, 0.0, 0.0, weights);
        }
        double name = nameSimilarity(a, b);
        double emailLocal = levenshtein.compute(a.emailLocal(), b.emailLocal());
        double domain = !a.emailDomain().isEmpty() && a.emailDomain().equals(b.emailDomain()) ? 1.0 : 0.0;
        double initials = initialsMatch(a.initials(), b.initials());

        double score = weights.name() * name
                + weights.emailLocal() * emailLocal
                + weights.domain() * domain
                + weights.initials() * initials;
        // floating-point drift in the weight sum
        score = score > 1.0 - SCORE_EPSILON ? 1.0 : Math.max(0.0, score);

        ScoreBreakdown breakdown = new ScoreBreakdown(name, emailLocal, domain, initials, score, weights);
        if (log.isDebugEnabled()) {
            log.debug("Improved score for '{}' vs '{}': {}", a.email(), b.email(), breakdown);
        }
        return breakdown;
    }

    public ImprovedWeights getWeights() {
        return weights;
    }

    /**
     * Creates a new scorer with updated weights.
     */
    public ImprovedScorer withWeights(ImprovedWeights newWeights) {
        return new ImprovedScorer(newWeights, nicknames);
    }

    private double nameSimilarity(NormalizedIdentity a, NormalizedIdentity b) {
        if (!a.hasName() || !b.hasName()) {
            return 0.0;
        }
        return levenshtein.compute(canonicalName(a), canonicalName(b));
    }

    private String canonicalName(NormalizedIdentity identity) {
        return String.join(" ", identity.nameTokens().stream()
                .map(nicknames::canonical)
                .sorted()
                .toList());
    }

    private static double initialsMatch(Set<String> initialsA, Set<String> initialsB) {
        if (initialsA.isEmpty() || initialsB.isEmpty()) {
            return 0.0;
        }
        int shared = 0;
        for (String initial : initialsA) {
            if (initialsB.contains(initial)) {
                shared++;
            }
        }
        return (double) shared / Math.min(initialsA.size(), initialsB.size());
    }

    /**
     * Per-signal breakdown of an improved score.
     */
    public record ScoreBreakdown(
            double nameSimilarity,
            double emailLocalSimilarity,
            double domainMatch,
            double initialsMatch,
            double score,
            ImprovedWeights weights
    ) {
        @Override
        public String toString() {
            return String.format(Locale.ROOT,
                    "name=%.4f (w=%.2f), emailLocal=%.4f (w=%.2f), domain=%.1f (w=%.2f), initials=%.4f (w=%.2f), score=%.4f",
                    nameSimilarity, weights.name(),
                    emailLocalSimilarity, weights.emailLocal(),
                    domainMatch, weights.domain(),
                    initialsMatch, weights.initials(),
                    score);
        }
    }
}
