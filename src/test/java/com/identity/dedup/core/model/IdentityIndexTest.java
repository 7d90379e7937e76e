package com.identity.dedup.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IdentityIndex Tests")
class IdentityIndexTest {

    @Test
    @DisplayName("Duplicate raw identities collapse into one id with a commit count")
    void collapsesDuplicates() {
        IdentityIndex index = IdentityIndex.fromCommits(List.of(
                CommitRecord.of("c1", "Jane Doe", "jane@co.com", Instant.EPOCH),
                CommitRecord.of("c2", "Jane Doe", "jane@co.com", Instant.EPOCH),
                CommitRecord.of("c3", "Bob", "bob@co.com", Instant.EPOCH)));

        assertEquals(2, index.size());
        assertEquals(3, index.totalCommits());
        int jane = index.idOf(RawIdentity.of("Jane Doe", "jane@co.com"));
        assertEquals(2, index.commitCount(jane));
    }

    @Test
    @DisplayName("Ids follow name then email order regardless of input order")
    void idsAreOrderIndependent() {
        RawIdentity a = RawIdentity.of("Alice", "a@x.org");
        RawIdentity b = RawIdentity.of("Bob", "b@x.org");
        RawIdentity c = RawIdentity.of("Bob", "a@x.org");

        IdentityIndex forward = IdentityIndex.of(List.of(a, b, c));
        IdentityIndex backward = IdentityIndex.of(List.of(c, b, a));

        assertEquals(forward.identities(), backward.identities());
        assertEquals(0, forward.idOf(a));
        assertEquals(1, forward.idOf(c));
        assertEquals(2, forward.idOf(b));
    }

    @Test
    @DisplayName("Unknown identities have id -1")
    void unknownIdentity() {
        IdentityIndex index = IdentityIndex.of(List.of(RawIdentity.of("A", "a@x.org")));

        assertEquals(-1, index.idOf(RawIdentity.of("B", "b@x.org")));
        assertFalse(index.contains(RawIdentity.of("B", "b@x.org")));
    }

    @Test
    @DisplayName("Null components are stored as empty strings")
    void nullComponents() {
        RawIdentity identity = RawIdentity.of(null, null);

        assertEquals("", identity.rawName());
        assertEquals("", identity.rawEmail());
        assertEquals(identity, RawIdentity.of("", ""));
    }

    @Test
    @DisplayName("Empty input builds an empty index")
    void emptyIndex() {
        IdentityIndex index = IdentityIndex.of(List.of());

        assertTrue(index.isEmpty());
        assertEquals(0, index.totalCommits());
    }
}
