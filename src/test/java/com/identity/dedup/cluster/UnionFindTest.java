package com.identity.dedup.cluster;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UnionFindTest {

    @Test
    @DisplayName("Starts with every element in its own set")
    void initialState() {
        UnionFind unionFind = new UnionFind(4);

        assertEquals(4, unionFind.componentCount());
        assertEquals(4, unionFind.size());
        for (int i = 0; i < 4; i++) {
            assertEquals(i, unionFind.find(i));
        }
    }

    @Test
    @DisplayName("Union is transitive and reports whether it merged")
    void unionIsTransitive() {
        UnionFind unionFind = new UnionFind(5);

        assertTrue(unionFind.union(0, 1));
        assertTrue(unionFind.union(1, 2));
        assertFalse(unionFind.union(0, 2));

        assertTrue(unionFind.connected(0, 2));
        assertFalse(unionFind.connected(0, 3));
        assertEquals(3, unionFind.componentCount());
    }

    @Test
    @DisplayName("Roots label members of a set identically")
    void roots() {
        UnionFind unionFind = new UnionFind(4);
        unionFind.union(3, 1);

        int[] roots = unionFind.roots();
        assertEquals(roots[1], roots[3]);
        assertNotEquals(roots[0], roots[1]);
        assertNotEquals(roots[2], roots[1]);
    }

    @Test
    @DisplayName("Out-of-range ids are rejected")
    void outOfRange() {
        UnionFind unionFind = new UnionFind(2);

        assertThrows(IndexOutOfBoundsException.class, () -> unionFind.find(2));
        assertThrows(IndexOutOfBoundsException.class, () -> unionFind.union(-1, 0));
        assertThrows(IllegalArgumentException.class, () -> new UnionFind(-1));
    }

    @Test
    @DisplayName("Empty forest")
    void empty() {
        UnionFind unionFind = new UnionFind(0);

        assertEquals(0, unionFind.componentCount());
        assertEquals(0, unionFind.roots().length);
    }
}
