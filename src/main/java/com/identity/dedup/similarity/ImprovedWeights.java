package com.identity.dedup.similarity;

import com.identity.dedup.api.ConfigurationException;

/**
 * Weights of the improved scorer's signals. Non-negative and summing to 1.0,
 * so the weighted score stays within [0, 1].
 */
public record ImprovedWeights(
        double name,
        double emailLocal,
        double domain,
        double initials
) {
    private static final double SUM_TOLERANCE = 0.001;

    public ImprovedWeights {
        if (name < 0 || emailLocal < 0 || domain < 0 || initials < 0) {
            throw new ConfigurationException("Weights must be non-negative");
        }
        double sum = name + emailLocal + domain + initials;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new ConfigurationException("Weights must sum to 1.0, got " + sum);
        }
    }

    /**
     * Default weights: email signals (0.65) ahead of name signals (0.35).
     */
    public static ImprovedWeights defaultWeights() {
        return new ImprovedWeights(0.15, 0.40, 0.25, 0.20);
    }

    /**
     * Weights for histories where people mostly keep one address.
     */
    public static ImprovedWeights emailFocused() {
        return new ImprovedWeights(0.10, 0.50, 0.30, 0.10);
    }

    /**
     * Weights for histories with many throwaway or per-machine addresses.
     * Name and email signals carry equal weight.
     */
    public static ImprovedWeights nameFocused() {
        return new ImprovedWeights(0.30, 0.30, 0.20, 0.20);
    }

    public double emailWeight() {
        return emailLocal + domain;
    }

    public double nameWeight() {
        return name + initials;
    }
}
