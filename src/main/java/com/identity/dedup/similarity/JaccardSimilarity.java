package com.identity.dedup.similarity;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Jaccard similarity, |intersection| / |union|, over word tokens or over the
 * distinct characters of the two strings.
 */
public class JaccardSimilarity implements SimilarityAlgorithm {

    public enum Mode {
        TOKENS,
        CHARACTERS
    }

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Mode mode;

    public JaccardSimilarity() {
        this(Mode.TOKENS);
    }

    public JaccardSimilarity(Mode mode) {
        this.mode = mode;
    }

    @Override
    public double compute(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isBlank() || s2.isBlank()) {
            return 0.0;
        }

        Set<String> elements1 = elements(s1);
        Set<String> elements2 = elements(s2);
        if (elements1.isEmpty() || elements2.isEmpty()) {
            return 0.0;
        }

        int intersectionSize = 0;
        for (String element : elements1) {
            if (elements2.contains(element)) {
                intersectionSize++;
            }
        }
        int unionSize = elements1.size() + elements2.size() - intersectionSize;
        return (double) intersectionSize / unionSize;
    }

    @Override
    public String getName() {
        return mode == Mode.TOKENS ? "Jaccard" : "Jaccard-Characters";
    }

    private Set<String> elements(String s) {
        String lower = s.toLowerCase(Locale.ROOT);
        Set<String> result = new HashSet<>();
        if (mode == Mode.CHARACTERS) {
            lower.codePoints()
                    .filter(cp -> !Character.isWhitespace(cp))
                    .forEach(cp -> result.add(new String(Character.toChars(cp))));
            return result;
        }
        for (String token : WHITESPACE.split(lower)) {
            if (!token.isEmpty()) {
                result.add(token);
            }
        }
        return result;
    }
}
