package com.identity.dedup.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NicknameDictionaryTest {

    private final NicknameDictionary dictionary = NicknameDictionary.defaultDictionary();

    @ParameterizedTest
    @DisplayName("Nicknames map to their formal name")
    @CsvSource({
            "bob,robert",
            "bill,william",
            "jack,john",
            "robert,robert",
            "zed,zed"
    })
    void canonical(String token, String expected) {
        assertEquals(expected, dictionary.canonical(token));
    }

    @Test
    @DisplayName("Variants include the formal name and every sibling nickname")
    void variants() {
        assertTrue(dictionary.variants("bob").containsAll(List.of("bob", "robert", "rob", "bobby", "robbie")));
        assertTrue(dictionary.variants("").isEmpty());
    }

    @Test
    @DisplayName("Sibling nicknames are variants of each other")
    void areVariants() {
        assertTrue(dictionary.areVariants("bill", "will"));
        assertTrue(dictionary.areVariants("william", "billy"));
        assertFalse(dictionary.areVariants("bob", "bill"));
        assertFalse(dictionary.areVariants(null, "bob"));
    }

    @Test
    @DisplayName("Custom dictionaries are supported")
    void customDictionary() {
        NicknameDictionary custom = new NicknameDictionary(Map.of("sasha", "alexander"));

        assertEquals("alexander", custom.canonical("sasha"));
        assertEquals("bob", custom.canonical("bob"));
        assertEquals(1, custom.size());
    }
}
