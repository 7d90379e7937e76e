package com.identity.dedup.rules;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * English nickname to formal first-name mapping ("bob" -> "robert").
 */
public final class NicknameDictionary {

    private static final NicknameDictionary DEFAULT = new NicknameDictionary(defaultMappings());

    private final Map<String, String> formalByNickname;

    public NicknameDictionary(Map<String, String> formalByNickname) {
        this.formalByNickname = Collections.unmodifiableMap(new TreeMap<>(formalByNickname));
    }

    public static NicknameDictionary defaultDictionary() {
        return DEFAULT;
    }

    /**
     * Returns the formal name for a nickname, or the token itself.
     */
    public String canonical(String token) {
        if (token == null) {
            return "";
        }
        return formalByNickname.getOrDefault(token, token);
    }

    /**
     * All names interchangeable with the token: itself, its formal name and every
     * nickname of that formal name.
     */
    public Set<String> variants(String token) {
        Set<String> variants = new TreeSet<>();
        if (token == null || token.isEmpty()) {
            return variants;
        }
        String formal = canonical(token);
        variants.add(token);
        variants.add(formal);
        for (Map.Entry<String, String> entry : formalByNickname.entrySet()) {
            if (entry.getValue().equals(formal)) {
                variants.add(entry.getKey());
            }
        }
        return variants;
    }

    public boolean areVariants(String a, String b) {
        return a != null && b != null && !a.isEmpty() && canonical(a).equals(canonical(b));
    }

    public int size() {
        return formalByNickname.size();
    }

    private static Map<String, String> defaultMappings() {
        Map<String, String> m = new TreeMap<>();
        put(m, "robert", "bob", "bobby", "rob", "robbie");
        put(m, "william", "bill", "billy", "will", "willy");
        put(m, "richard", "dick", "rick", "rich", "ricky");
        put(m, "james", "jim", "jimmy", "jamie");
        put(m, "michael", "mike", "mickey", "mick");
        put(m, "david", "dave", "davey");
        put(m, "steven", "steve", "stevie");
        put(m, "christopher", "chris", "christy");
        put(m, "daniel", "dan", "danny");
        put(m, "matthew", "matt", "matty");
        put(m, "joseph", "joe", "joey");
        put(m, "thomas", "tom", "tommy");
        put(m, "patrick", "pat", "patty");
        put(m, "timothy", "tim", "timmy");
        put(m, "albert", "al");
        put(m, "alexander", "alex");
        put(m, "andrew", "andy");
        put(m, "benjamin", "ben");
        put(m, "bradley", "brad");
        put(m, "charles", "charlie");
        put(m, "edward", "ed", "eddie");
        put(m, "franklin", "frank");
        put(m, "frederick", "fred");
        put(m, "gregory", "greg");
        put(m, "henry", "harry");
        put(m, "jeffrey", "jeff");
        put(m, "john", "johnny", "jack");
        put(m, "kenneth", "ken", "kenny");
        put(m, "lawrence", "larry");
        put(m, "leonard", "leo");
        put(m, "peter", "pete");
        put(m, "philip", "phil");
        put(m, "raymond", "ray");
        put(m, "samuel", "sam");
        put(m, "sean", "shawn");
        put(m, "theodore", "ted");
        put(m, "anthony", "tony");
        put(m, "victor", "vic");
        return m;
    }

    private static void put(Map<String, String> mappings, String formal, String... nicknames) {
        for (String nickname : nicknames) {
            mappings.put(nickname, formal);
        }
    }
}
