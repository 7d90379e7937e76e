package com.identity.dedup.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IdentityPair and CandidatePair Tests")
class IdentityPairTest {

    @Test
    @DisplayName("Pairs are unordered")
    void canonicalOrder() {
        assertEquals(IdentityPair.of(1, 4), IdentityPair.of(4, 1));
        assertEquals(1, IdentityPair.of(4, 1).first());
    }

    @Test
    @DisplayName("Self pairs and negative ids are rejected")
    void invalidPairs() {
        assertThrows(IllegalArgumentException.class, () -> IdentityPair.of(2, 2));
        assertThrows(IllegalArgumentException.class, () -> IdentityPair.of(-1, 2));
    }

    @Test
    @DisplayName("Candidate scores must lie in [0, 1]")
    void scoreRange() {
        assertThrows(IllegalArgumentException.class, () -> CandidatePair.duplicate(0, 1, 1.5));
        assertThrows(IllegalArgumentException.class, () -> CandidatePair.distinct(0, 1, -0.1));
        assertTrue(CandidatePair.duplicate(1, 0, 1.0).duplicate());
    }
}
