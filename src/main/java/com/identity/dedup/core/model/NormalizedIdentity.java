package com.identity.dedup.core.model;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Canonical, comparable form of a {@link RawIdentity}.
 * Derived deterministically; never stored independently of its raw identity.
 *
 * @param nameTokens   lowercase name tokens in their original order
 * @param emailLocal   lowercase email local part with platform id decorations removed
 * @param emailDomain  lowercase email domain, empty when the address has none
 * @param initials     first letters of every name token, single-letter tokens included
 * @param firstInitial first letter of the first name token, empty when there is no name
 */
public record NormalizedIdentity(
        List<String> nameTokens,
        String emailLocal,
        String emailDomain,
        SortedSet<String> initials,
        String firstInitial
) {
    private static final NormalizedIdentity EMPTY =
            new NormalizedIdentity(List.of(), "", "", null, "");

    public NormalizedIdentity {
        nameTokens = nameTokens != null ? List.copyOf(nameTokens) : List.of();
        emailLocal = emailLocal != null ? emailLocal : "";
        emailDomain = emailDomain != null ? emailDomain : "";
        initials = Collections.unmodifiableSortedSet(initials != null ? new TreeSet<>(initials) : new TreeSet<>());
        firstInitial = firstInitial != null ? firstInitial : "";
    }

    public static NormalizedIdentity empty() {
        return EMPTY;
    }

    public boolean hasName() {
        return !nameTokens.isEmpty();
    }

    public boolean hasEmail() {
        return !emailLocal.isEmpty();
    }

    /**
     * Full address in normalized form, or an empty string when there is no local part.
     */
    public String email() {
        if (emailLocal.isEmpty()) {
            return "";
        }
        return emailDomain.isEmpty() ? emailLocal : emailLocal + "@" + emailDomain;
    }

    /**
     * Email local part with separators ({@code . _ - +}) and digits removed.
     */
    public String canonicalLocal() {
        return emailLocal.replaceAll("[._+\\-0-9]", "");
    }

    /**
     * Name tokens as a set, ignoring order.
     */
    public Set<String> nameTokenSet() {
        return new TreeSet<>(nameTokens);
    }

    /**
     * Name tokens sorted and joined with single spaces.
     */
    public String sortedName() {
        return String.join(" ", nameTokens.stream().sorted().toList());
    }

    /**
     * Last name token, or an empty string when the name is empty.
     */
    public String lastNameToken() {
        return nameTokens.isEmpty() ? "" : nameTokens.get(nameTokens.size() - 1);
    }
}
