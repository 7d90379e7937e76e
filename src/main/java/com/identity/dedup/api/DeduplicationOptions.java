package com.identity.dedup.api;

import com.identity.dedup.blocking.BlockingStrategy;
import com.identity.dedup.similarity.ImprovedWeights;

import java.util.Objects;
import java.util.OptionalInt;
import java.util.Properties;

/**
 * Options for a deduplication analysis.
 * Configures the duplicate threshold, work budgets, blocking and improved-scorer weights.
 */
public class DeduplicationOptions {

    private static final double DEFAULT_THRESHOLD = 0.85;
    private static final int DEFAULT_MAX_PAIRS = 100_000;
    private static final int DEFAULT_PARALLELISM = 1;
    private static final int UNLIMITED = 0;

    private final double threshold;
    private final int maxPairs;
    private final int maxCommits;
    private final BlockingStrategy blockingStrategy;
    private final ImprovedWeights improvedWeights;
    private final int parallelism;
    private final boolean excludeInvalidIdentities;

    private DeduplicationOptions(Builder builder) {
        this.threshold = builder.threshold;
        this.maxPairs = builder.maxPairs;
        this.maxCommits = builder.maxCommits;
        this.blockingStrategy = builder.blockingStrategy;
        this.improvedWeights = builder.improvedWeights;
        this.parallelism = builder.parallelism;
        this.excludeInvalidIdentities = builder.excludeInvalidIdentities;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getMaxPairs() {
        return maxPairs;
    }

    /**
     * Number of most recent commits to analyze; empty when every commit is used.
     */
    public OptionalInt getMaxCommits() {
        return maxCommits == UNLIMITED ? OptionalInt.empty() : OptionalInt.of(maxCommits);
    }

    public BlockingStrategy getBlockingStrategy() {
        return blockingStrategy;
    }

    public ImprovedWeights getImprovedWeights() {
        return improvedWeights;
    }

    public int getParallelism() {
        return parallelism;
    }

    public boolean isExcludeInvalidIdentities() {
        return excludeInvalidIdentities;
    }

    public Builder toBuilder() {
        Builder builder = new Builder()
                .threshold(threshold)
                .maxPairs(maxPairs)
                .blockingStrategy(blockingStrategy)
                .improvedWeights(improvedWeights)
                .parallelism(parallelism)
                .excludeInvalidIdentities(excludeInvalidIdentities);
        builder.maxCommits = maxCommits;
        return builder;
    }

    public static DeduplicationOptions defaults() {
        return builder().build();
    }

    /**
     * Reads options from {@code dedup.*} properties. Missing keys keep their defaults.
     *
     * @throws ConfigurationException if a value is malformed or out of range
     */
    public static DeduplicationOptions fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties is required");
        Builder builder = builder();
        String value;
        if ((value = property(properties, "dedup.threshold")) != null) {
            builder.threshold(parseDouble("dedup.threshold", value));
        }
        if ((value = property(properties, "dedup.max-pairs")) != null) {
            builder.maxPairs(parseInt("dedup.max-pairs", value));
        }
        if ((value = property(properties, "dedup.max-commits")) != null) {
            builder.maxCommits(parseInt("dedup.max-commits", value));
        }
        if ((value = property(properties, "dedup.blocking")) != null) {
            try {
                builder.blockingStrategy(BlockingStrategy.fromString(value));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(e.getMessage(), e);
            }
        }
        if ((value = property(properties, "dedup.parallelism")) != null) {
            builder.parallelism(parseInt("dedup.parallelism", value));
        }
        if ((value = property(properties, "dedup.exclude-invalid")) != null) {
            builder.excludeInvalidIdentities(Boolean.parseBoolean(value));
        }

        ImprovedWeights defaults = ImprovedWeights.defaultWeights();
        String name = property(properties, "dedup.weights.name");
        String emailLocal = property(properties, "dedup.weights.email-local");
        String domain = property(properties, "dedup.weights.domain");
        String initials = property(properties, "dedup.weights.initials");
        if (name != null || emailLocal != null || domain != null || initials != null) {
            builder.improvedWeights(new ImprovedWeights(
                    name != null ? parseDouble("dedup.weights.name", name) : defaults.name(),
                    emailLocal != null ? parseDouble("dedup.weights.email-local", emailLocal) : defaults.emailLocal(),
                    domain != null ? parseDouble("dedup.weights.domain", domain) : defaults.domain(),
                    initials != null ? parseDouble("dedup.weights.initials", initials) : defaults.initials()));
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private double threshold = DEFAULT_THRESHOLD;
        private int maxPairs = DEFAULT_MAX_PAIRS;
        private int maxCommits = UNLIMITED;
        private BlockingStrategy blockingStrategy = BlockingStrategy.BOTH;
        private ImprovedWeights improvedWeights = ImprovedWeights.defaultWeights();
        private int parallelism = DEFAULT_PARALLELISM;
        private boolean excludeInvalidIdentities = false;

        public Builder threshold(double threshold) {
            if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
                throw new ConfigurationException("threshold must be between 0.0 and 1.0, got " + threshold);
            }
            this.threshold = threshold;
            return this;
        }

        public Builder maxPairs(int maxPairs) {
            if (maxPairs <= 0) {
                throw new ConfigurationException("maxPairs must be positive, got " + maxPairs);
            }
            this.maxPairs = maxPairs;
            return this;
        }

        public Builder maxCommits(int maxCommits) {
            if (maxCommits <= 0) {
                throw new ConfigurationException("maxCommits must be positive, got " + maxCommits);
            }
            this.maxCommits = maxCommits;
            return this;
        }

        public Builder unlimitedCommits() {
            this.maxCommits = UNLIMITED;
            return this;
        }

        public Builder blockingStrategy(BlockingStrategy blockingStrategy) {
            this.blockingStrategy = Objects.requireNonNull(blockingStrategy, "blockingStrategy is required");
            return this;
        }

        public Builder improvedWeights(ImprovedWeights improvedWeights) {
            this.improvedWeights = Objects.requireNonNull(improvedWeights, "improvedWeights is required");
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new ConfigurationException("parallelism must be positive, got " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder excludeInvalidIdentities(boolean excludeInvalidIdentities) {
            this.excludeInvalidIdentities = excludeInvalidIdentities;
            return this;
        }

        public DeduplicationOptions build() {
            return new DeduplicationOptions(this);
        }
    }

    private static String property(Properties properties, String key) {
        String value = properties.getProperty(key);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static double parseDouble(String key, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not a number: " + value, e);
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(key + " is not an integer: " + value, e);
        }
    }

    @Override
    public String toString() {
        return "DeduplicationOptions{" +
                "threshold=" + threshold +
                ", maxPairs=" + maxPairs +
                ", maxCommits=" + (maxCommits == UNLIMITED ? "unlimited" : maxCommits) +
                ", blocking=" + blockingStrategy +
                ", weights=" + improvedWeights +
                ", parallelism=" + parallelism +
                ", excludeInvalid=" + excludeInvalidIdentities +
                '}';
    }
}
