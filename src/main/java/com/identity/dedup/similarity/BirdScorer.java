package com.identity.dedup.similarity;

import com.identity.dedup.core.model.Heuristic;
import com.identity.dedup.core.model.MatchRule;
import com.identity.dedup.core.model.NormalizedIdentity;

import java.util.Set;

/**
 * Rule-ordered baseline heuristic after Bird et al. (MSR 2006).
 *
 * <p>Rules are tried in order and the first one that fires decides the match:</p>
 * <ol>
 *   <li>{@link MatchRule#EMAIL_EQUAL}: normalized addresses are identical</li>
 *   <li>{@link MatchRule#EMAIL_LOCAL_AND_NAME_TOKEN}: local parts are identical once
 *       separators and digits are stripped, and the names share a non-initial token</li>
 *   <li>{@link MatchRule#NAME_TOKENS_EQUAL}: name token sets are identical and contain a
 *       token of at least three characters</li>
 * </ol>
 *
 * <p>The threshold is ignored; scores are 1.0 for a match and 0.0 otherwise.</p>
 */
public class BirdScorer implements IdentityScorer {

    private static final int MIN_NON_INITIAL_LENGTH = 2;
    private static final int MIN_DISTINCTIVE_LENGTH = 3;

    @Override
    public Heuristic heuristic() {
        return Heuristic.BASELINE;
    }

    @Override
    public double score(NormalizedIdentity a, NormalizedIdentity b) {
        return matches(a, b) ? 1.0 : 0.0;
    }

    @Override
    public boolean isDuplicate(NormalizedIdentity a, NormalizedIdentity b, double threshold) {
        return matches(a, b);
    }

    @Override
    public String explain(NormalizedIdentity a, NormalizedIdentity b) {
        return rule(a, b).name();
    }

    public boolean matches(NormalizedIdentity a, NormalizedIdentity b) {
        return rule(a, b).isMatch();
    }

    /**
     * Returns the first rule that fires, or {@link MatchRule#NONE}.
     */
    public MatchRule rule(NormalizedIdentity a, NormalizedIdentity b) {
        if (a == null || b == null) {
            return MatchRule.NONE;
        }
        if (a.hasEmail() && a.email().equals(b.email())) {
            return MatchRule.EMAIL_EQUAL;
        }
        String localA = a.canonicalLocal();
        if (!localA.isEmpty() && localA.equals(b.canonicalLocal()) && shareNonInitialToken(a, b)) {
            return MatchRule.EMAIL_LOCAL_AND_NAME_TOKEN;
        }
        Set<String> tokensA = a.nameTokenSet();
        if (!tokensA.isEmpty() && tokensA.equals(b.nameTokenSet()) && hasDistinctiveToken(tokensA)) {
            return MatchRule.NAME_TOKENS_EQUAL;
        }
        return MatchRule.NONE;
    }

    private static boolean shareNonInitialToken(NormalizedIdentity a, NormalizedIdentity b) {
        Set<String> tokensB = b.nameTokenSet();
        for (String token : a.nameTokenSet()) {
            if (token.length() >= MIN_NON_INITIAL_LENGTH && tokensB.contains(token)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasDistinctiveToken(Set<String> tokens) {
        for (String token : tokens) {
            if (token.length() >= MIN_DISTINCTIVE_LENGTH) {
                return true;
            }
        }
        return false;
    }
}
