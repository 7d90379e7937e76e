package com.identity.dedup.core.model;

import java.util.Comparator;

/**
 * The literal (name, email) pair attached to a commit.
 * Null components are stored as empty strings so equal text always means equal identity.
 */
public record RawIdentity(String rawName, String rawEmail) implements Comparable<RawIdentity> {

    private static final Comparator<RawIdentity> ORDER = Comparator
            .comparing(RawIdentity::rawName)
            .thenComparing(RawIdentity::rawEmail);

    public RawIdentity {
        rawName = rawName != null ? rawName : "";
        rawEmail = rawEmail != null ? rawEmail : "";
    }

    public static RawIdentity of(String name, String email) {
        return new RawIdentity(name, email);
    }

    @Override
    public int compareTo(RawIdentity other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return rawName + " <" + rawEmail + ">";
    }
}
