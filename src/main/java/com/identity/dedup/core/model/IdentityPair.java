package com.identity.dedup.core.model;

/**
 * Unordered pair of identity ids in canonical form ({@code first < second}).
 */
public record IdentityPair(int first, int second) implements Comparable<IdentityPair> {

    public IdentityPair {
        if (first < 0 || second < 0) {
            throw new IllegalArgumentException("Identity ids must be non-negative");
        }
        if (first == second) {
            throw new IllegalArgumentException("Self-pairs are not allowed: " + first);
        }
        if (first > second) {
            int temp = first;
            first = second;
            second = temp;
        }
    }

    public static IdentityPair of(int i, int j) {
        return new IdentityPair(i, j);
    }

    @Override
    public int compareTo(IdentityPair other) {
        int cmp = Integer.compare(first, other.first);
        return cmp != 0 ? cmp : Integer.compare(second, other.second);
    }
}
