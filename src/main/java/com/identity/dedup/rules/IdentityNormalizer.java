package com.identity.dedup.rules;

import com.identity.dedup.core.model.NormalizedIdentity;
import com.identity.dedup.core.model.RawIdentity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonicalizes raw (name, email) pairs into comparable tokens.
 *
 * <p>Pure and total: null, blank or malformed components degrade to empty tokens and
 * never raise. Equal raw identities always normalize to equal results.</p>
 */
public class IdentityNormalizer {

    // 12345+octocat@users.noreply.github.com
    private static final Pattern PLATFORM_ID_PREFIX = Pattern.compile("^\\d+\\+(.+)$");
    // jdoe42, jane.doe-2019
    private static final Pattern NUMERIC_SUFFIX = Pattern.compile("^(.*\\p{L}.*?)[._+\\-]?\\d+$");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final NormalizationEngine nameEngine;

    public IdentityNormalizer() {
        this(IdentityNormalizationRules.createDefaultEngine());
    }

    public IdentityNormalizer(NormalizationEngine nameEngine) {
        this.nameEngine = nameEngine;
    }

    public NormalizedIdentity normalize(RawIdentity identity) {
        if (identity == null) {
            return NormalizedIdentity.empty();
        }

        List<String> allTokens = tokenize(nameEngine.normalize(identity.rawName()));
        SortedSet<String> initials = new TreeSet<>();
        for (String token : allTokens) {
            initials.add(token.substring(0, 1));
        }
        String firstInitial = allTokens.isEmpty() ? "" : allTokens.get(0).substring(0, 1);

        List<String> nameTokens = new ArrayList<>();
        for (String token : allTokens) {
            if (token.length() > 1) {
                nameTokens.add(token);
            }
        }
        if (nameTokens.isEmpty()) {
            // initials only, e.g. "J. D."
            nameTokens = allTokens;
        }

        String email = cleanEmail(identity.rawEmail());
        int at = email.lastIndexOf('@');
        String local = at >= 0 ? email.substring(0, at) : email;
        String domain = at >= 0 ? email.substring(at + 1) : "";

        return new NormalizedIdentity(nameTokens, normalizeLocal(local), normalizeDomain(domain),
                initials, firstInitial);
    }

    /**
     * Checks the identity for a usable name (at least two characters) and a
     * structurally valid email address. Never throws.
     */
    public IdentityValidation validate(RawIdentity identity) {
        if (identity == null) {
            return new IdentityValidation(false, EmailValidation.MISSING_DOMAIN);
        }
        boolean nameValid = identity.rawName().trim().length() >= 2;
        return new IdentityValidation(nameValid, EmailValidation.of(identity.rawEmail()));
    }

    public boolean isValid(RawIdentity identity) {
        return validate(identity).isValid();
    }

    static String normalizeLocal(String local) {
        if (local.isEmpty()) {
            return "";
        }
        String result = local;
        Matcher platformId = PLATFORM_ID_PREFIX.matcher(result);
        if (platformId.matches()) {
            result = platformId.group(1);
        }
        Matcher numeric = NUMERIC_SUFFIX.matcher(result);
        if (numeric.matches()) {
            result = numeric.group(1);
        }
        return result;
    }

    static String normalizeDomain(String domain) {
        String result = domain.trim();
        while (result.endsWith(".")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    private static String cleanEmail(String rawEmail) {
        if (rawEmail == null) {
            return "";
        }
        String email = rawEmail.trim().toLowerCase(Locale.ROOT);
        if (email.startsWith("<")) {
            email = email.substring(1);
        }
        if (email.endsWith(">")) {
            email = email.substring(0, email.length() - 1);
        }
        return WHITESPACE.matcher(email).replaceAll("");
    }

    private static List<String> tokenize(String normalizedName) {
        if (normalizedName.isEmpty()) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        for (String token : WHITESPACE.split(normalizedName)) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
