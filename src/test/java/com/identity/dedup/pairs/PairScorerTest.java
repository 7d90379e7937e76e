package com.identity.dedup.pairs;

import com.identity.dedup.core.model.CandidatePair;
import com.identity.dedup.core.model.IdentityPair;
import com.identity.dedup.core.model.NormalizedIdentity;
import com.identity.dedup.core.model.RawIdentity;
import com.identity.dedup.rules.IdentityNormalizer;
import com.identity.dedup.similarity.IdentityScorer;
import com.identity.dedup.similarity.ImprovedScorer;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("PairScorer Tests")
class PairScorerTest {

    private static List<NormalizedIdentity> identities;
    private static List<IdentityPair> allPairs;

    @Mock
    private IdentityScorer scorer;

    @BeforeAll
    static void setUpIdentities() {
        IdentityNormalizer normalizer = new IdentityNormalizer();
        identities = new ArrayList<>();
        for (int i = 0; i < 80; i++) {
            String domain = i % 3 == 0 ? "example.com" : "corp.example.org";
            identities.add(normalizer.normalize(RawIdentity.of("Dev Number" + (i % 7), "dev" + (i % 11) + "@" + domain)));
        }
        allPairs = new ArrayList<>();
        for (int a = 0; a < identities.size(); a++) {
            for (int b = a + 1; b < identities.size(); b++) {
                allPairs.add(IdentityPair.of(a, b));
            }
        }
    }

    @Test
    @DisplayName("Parallel scoring returns the sequential results in input order")
    void parallelMatchesSequential() {
        ImprovedScorer improved = new ImprovedScorer();
        assertTrue(allPairs.size() > PairScorer.CHUNK_SIZE);

        List<CandidatePair> sequential;
        try (PairScorer single = new PairScorer(1)) {
            sequential = single.score(allPairs, identities, improved, 0.85);
        }
        List<CandidatePair> parallel;
        try (PairScorer pool = new PairScorer(4)) {
            parallel = pool.score(allPairs, identities, improved, 0.85);
        }

        assertEquals(allPairs.size(), parallel.size());
        assertEquals(sequential, parallel);
    }

    @Test
    @DisplayName("Each pair is handed to the scorer with its two identities")
    void delegatesToScorer() {
        when(scorer.compare(any(), any(), any(), anyDouble()))
                .thenAnswer(invocation -> CandidatePair.distinct(
                        invocation.<IdentityPair>getArgument(0).first(),
                        invocation.<IdentityPair>getArgument(0).second(), 0.0));
        List<IdentityPair> pairs = List.of(IdentityPair.of(0, 1), IdentityPair.of(2, 5));

        try (PairScorer pairScorer = new PairScorer()) {
            List<CandidatePair> results = pairScorer.score(pairs, identities, scorer, 0.5);

            assertEquals(2, results.size());
            assertEquals(IdentityPair.of(2, 5), results.get(1).pair());
        }
        verify(scorer).compare(IdentityPair.of(2, 5), identities.get(2), identities.get(5), 0.5);
        verify(scorer, times(2)).compare(any(), any(), any(), anyDouble());
    }

    @Test
    @DisplayName("Scorer failures on worker threads reach the caller unwrapped")
    void propagatesFailures() {
        when(scorer.compare(any(), any(), any(), anyDouble())).thenThrow(new IllegalStateException("boom"));

        try (PairScorer pairScorer = new PairScorer(2)) {
            IllegalStateException error = assertThrows(IllegalStateException.class,
                    () -> pairScorer.score(allPairs, identities, scorer, 0.5));
            assertEquals("boom", error.getMessage());
        }
    }

    @Test
    @DisplayName("Parallelism must be positive")
    void invalidParallelism() {
        assertThrows(IllegalArgumentException.class, () -> new PairScorer(0));
        try (PairScorer pairScorer = new PairScorer(3)) {
            assertEquals(3, pairScorer.getParallelism());
        }
    }

    @Test
    @DisplayName("No pairs, no results")
    void emptyInput() {
        try (PairScorer pairScorer = new PairScorer(2)) {
            assertTrue(pairScorer.score(List.of(), identities, new ImprovedScorer(), 0.85).isEmpty());
        }
    }
}
