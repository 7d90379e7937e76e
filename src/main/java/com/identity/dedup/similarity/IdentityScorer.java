package com.identity.dedup.similarity;

import com.identity.dedup.core.model.CandidatePair;
import com.identity.dedup.core.model.Heuristic;
import com.identity.dedup.core.model.IdentityPair;
import com.identity.dedup.core.model.NormalizedIdentity;

/**
 * Common scoring contract of the baseline and improved heuristics.
 * Implementations are stateless, thread-safe and symmetric in their arguments.
 */
public interface IdentityScorer {

    /**
     * Which heuristic this scorer implements.
     */
    Heuristic heuristic();

    /**
     * Similarity of two identities in [0, 1].
     */
    double score(NormalizedIdentity a, NormalizedIdentity b);

    /**
     * Whether the pair is a duplicate under the given threshold.
     * Threshold-free heuristics may ignore the threshold.
     */
    boolean isDuplicate(NormalizedIdentity a, NormalizedIdentity b, double threshold);

    /**
     * Short explanation of the decision, used in duplicate-pair reports.
     */
    String explain(NormalizedIdentity a, NormalizedIdentity b);

    /**
     * Scores a canonical pair into a {@link CandidatePair}.
     */
    default CandidatePair compare(IdentityPair pair, NormalizedIdentity a, NormalizedIdentity b, double threshold) {
        double score = score(a, b);
        boolean duplicate = isDuplicate(a, b, threshold);
        return new CandidatePair(pair, score, duplicate, duplicate ? explain(a, b) : "");
    }
}
