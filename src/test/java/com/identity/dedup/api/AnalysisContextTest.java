package com.identity.dedup.api;

import com.identity.dedup.core.model.CommitRecord;
import com.identity.dedup.core.model.NormalizedIdentity;
import com.identity.dedup.core.model.RawIdentity;
import com.identity.dedup.rules.EmailValidation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnalysisContext Tests")
class AnalysisContextTest {

    private static final List<CommitRecord> COMMITS = List.of(
            CommitRecord.of("a1", "Jane Doe", "jane.doe@co.com", Instant.ofEpochSecond(100)),
            CommitRecord.of("a2", "Jane Doe", "jane.doe@co.com", Instant.ofEpochSecond(400)),
            CommitRecord.of("a3", "J. Doe", "jane.doe@co.com", Instant.ofEpochSecond(300)),
            CommitRecord.of("a4", "X", "not-an-email", Instant.ofEpochSecond(200)));

    @Test
    @DisplayName("Identities are deduplicated and ordered by name then email")
    void buildsIndex() {
        AnalysisContext context = AnalysisContext.of(COMMITS, DeduplicationOptions.defaults());

        assertEquals(3, context.size());
        assertEquals(RawIdentity.of("J. Doe", "jane.doe@co.com"), context.index().identity(0));
        assertEquals(RawIdentity.of("Jane Doe", "jane.doe@co.com"), context.index().identity(1));
        assertEquals(RawIdentity.of("X", "not-an-email"), context.index().identity(2));
        assertEquals(2, context.index().commitCount(1));
        assertNotNull(context.runId());
    }

    @Test
    @DisplayName("Statistics count commits and invalid identities")
    void statistics() {
        RunStatistics statistics = AnalysisContext.of(COMMITS, DeduplicationOptions.defaults()).statistics();

        assertEquals(new RunStatistics(4, 4, 3, 2, 1), statistics);
        assertFalse(statistics.commitsTruncated());
    }

    @Test
    @DisplayName("The commit budget keeps the most recent commits")
    void commitBudget() {
        DeduplicationOptions options = DeduplicationOptions.builder().maxCommits(2).build();

        AnalysisContext context = AnalysisContext.of(COMMITS, options);

        // a2 (t=400) and a3 (t=300)
        assertEquals(2, context.size());
        assertTrue(context.index().contains(RawIdentity.of("J. Doe", "jane.doe@co.com")));
        assertFalse(context.index().contains(RawIdentity.of("X", "not-an-email")));
        assertTrue(context.statistics().commitsTruncated());
        assertEquals(2, context.statistics().analyzedCommits());
    }

    @Test
    @DisplayName("Equal timestamps are broken by commit id")
    void commitBudgetTies() {
        List<CommitRecord> commits = List.of(
                CommitRecord.of("b", "Second", "second@x.org", Instant.ofEpochSecond(10)),
                CommitRecord.of("a", "First", "first@x.org", Instant.ofEpochSecond(10)));

        AnalysisContext context = AnalysisContext.of(commits, DeduplicationOptions.builder().maxCommits(1).build());

        assertTrue(context.index().contains(RawIdentity.of("First", "first@x.org")));
    }

    @Test
    @DisplayName("Invalid identities are validated, and blanked for scoring only when excluded")
    void invalidIdentities() {
        AnalysisContext kept = AnalysisContext.of(COMMITS, DeduplicationOptions.defaults());
        AnalysisContext excluded = AnalysisContext.of(COMMITS,
                DeduplicationOptions.builder().excludeInvalidIdentities(true).build());

        assertFalse(kept.validation(2).nameValid());
        assertEquals(EmailValidation.MISSING_AT, kept.validation(2).email());
        assertSame(kept.normalized().get(2), kept.scoringInput().get(2));
        assertEquals(NormalizedIdentity.empty(), excluded.scoringInput().get(2));
        assertNotEquals(NormalizedIdentity.empty(), excluded.normalized().get(2));
        assertEquals(excluded.normalized().get(1), excluded.scoringInput().get(1));
    }

    @Test
    @DisplayName("An empty commit list gives an empty context")
    void emptyInput() {
        AnalysisContext context = AnalysisContext.of(List.of(), DeduplicationOptions.defaults());

        assertEquals(0, context.size());
        assertEquals(new RunStatistics(0, 0, 0, 0, 0), context.statistics());
    }
}
