package com.identity.dedup.api;

import com.identity.dedup.blocking.BlockingStrategy;
import com.identity.dedup.similarity.ImprovedWeights;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.OptionalInt;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DeduplicationOptions Tests")
class DeduplicationOptionsTest {

    @Test
    @DisplayName("Defaults should have expected values")
    void defaults() {
        DeduplicationOptions options = DeduplicationOptions.defaults();

        assertEquals(0.85, options.getThreshold());
        assertEquals(100_000, options.getMaxPairs());
        assertEquals(OptionalInt.empty(), options.getMaxCommits());
        assertEquals(BlockingStrategy.BOTH, options.getBlockingStrategy());
        assertEquals(ImprovedWeights.defaultWeights(), options.getImprovedWeights());
        assertEquals(1, options.getParallelism());
        assertFalse(options.isExcludeInvalidIdentities());
    }

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Should set every option")
        void setsEveryOption() {
            DeduplicationOptions options = DeduplicationOptions.builder()
                    .threshold(0.9)
                    .maxPairs(500)
                    .maxCommits(1_000)
                    .blockingStrategy(BlockingStrategy.DOMAIN)
                    .improvedWeights(ImprovedWeights.nameFocused())
                    .parallelism(4)
                    .excludeInvalidIdentities(true)
                    .build();

            assertEquals(0.9, options.getThreshold());
            assertEquals(500, options.getMaxPairs());
            assertEquals(OptionalInt.of(1_000), options.getMaxCommits());
            assertEquals(BlockingStrategy.DOMAIN, options.getBlockingStrategy());
            assertEquals(ImprovedWeights.nameFocused(), options.getImprovedWeights());
            assertEquals(4, options.getParallelism());
            assertTrue(options.isExcludeInvalidIdentities());
        }

        @Test
        @DisplayName("Threshold bounds are inclusive")
        void thresholdBounds() {
            assertEquals(0.0, DeduplicationOptions.builder().threshold(0.0).build().getThreshold());
            assertEquals(1.0, DeduplicationOptions.builder().threshold(1.0).build().getThreshold());
        }

        @ParameterizedTest
        @DisplayName("Out-of-range thresholds are rejected")
        @ValueSource(doubles = {-0.01, 1.01, Double.NaN})
        void invalidThreshold(double threshold) {
            assertThrows(ConfigurationException.class, () -> DeduplicationOptions.builder().threshold(threshold));
        }

        @Test
        @DisplayName("Budgets and parallelism must be positive")
        void invalidBudgets() {
            assertThrows(ConfigurationException.class, () -> DeduplicationOptions.builder().maxPairs(0));
            assertThrows(ConfigurationException.class, () -> DeduplicationOptions.builder().maxCommits(-5));
            assertThrows(ConfigurationException.class, () -> DeduplicationOptions.builder().parallelism(0));
        }

        @Test
        @DisplayName("toBuilder copies every option")
        void toBuilderRoundTrip() {
            DeduplicationOptions original = DeduplicationOptions.builder()
                    .threshold(0.7)
                    .maxCommits(10)
                    .excludeInvalidIdentities(true)
                    .build();

            DeduplicationOptions copy = original.toBuilder().maxPairs(5).build();

            assertEquals(0.7, copy.getThreshold());
            assertEquals(OptionalInt.of(10), copy.getMaxCommits());
            assertTrue(copy.isExcludeInvalidIdentities());
            assertEquals(5, copy.getMaxPairs());
            assertEquals(OptionalInt.empty(), original.toBuilder().unlimitedCommits().build().getMaxCommits());
        }
    }

    @Nested
    @DisplayName("fromProperties")
    class FromProperties {

        @Test
        @DisplayName("Missing keys keep defaults")
        void emptyProperties() {
            DeduplicationOptions options = DeduplicationOptions.fromProperties(new Properties());

            assertEquals(0.85, options.getThreshold());
            assertEquals(BlockingStrategy.BOTH, options.getBlockingStrategy());
        }

        @Test
        @DisplayName("Reads every dedup key")
        void readsKeys() {
            Properties properties = new Properties();
            properties.setProperty("dedup.threshold", "0.8");
            properties.setProperty("dedup.max-pairs", "250");
            properties.setProperty("dedup.max-commits", "40");
            properties.setProperty("dedup.blocking", "initials");
            properties.setProperty("dedup.parallelism", "2");
            properties.setProperty("dedup.exclude-invalid", "true");

            DeduplicationOptions options = DeduplicationOptions.fromProperties(properties);

            assertEquals(0.8, options.getThreshold());
            assertEquals(250, options.getMaxPairs());
            assertEquals(OptionalInt.of(40), options.getMaxCommits());
            assertEquals(BlockingStrategy.INITIALS, options.getBlockingStrategy());
            assertEquals(2, options.getParallelism());
            assertTrue(options.isExcludeInvalidIdentities());
        }

        @Test
        @DisplayName("Partial weight overrides are completed from the defaults")
        void partialWeights() {
            Properties properties = new Properties();
            properties.setProperty("dedup.weights.name", "0.35");
            properties.setProperty("dedup.weights.email-local", "0.20");

            ImprovedWeights weights = DeduplicationOptions.fromProperties(properties).getImprovedWeights();

            assertEquals(new ImprovedWeights(0.35, 0.20, 0.25, 0.20), weights);
        }

        @Test
        @DisplayName("Malformed values raise ConfigurationException")
        void malformedValues() {
            Properties notANumber = new Properties();
            notANumber.setProperty("dedup.threshold", "high");
            Properties badStrategy = new Properties();
            badStrategy.setProperty("dedup.blocking", "soundex");
            Properties badWeights = new Properties();
            badWeights.setProperty("dedup.weights.name", "0.9");

            assertThrows(ConfigurationException.class, () -> DeduplicationOptions.fromProperties(notANumber));
            assertThrows(ConfigurationException.class, () -> DeduplicationOptions.fromProperties(badStrategy));
            assertThrows(ConfigurationException.class, () -> DeduplicationOptions.fromProperties(badWeights));
        }
    }
}
