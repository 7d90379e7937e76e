package com.identity.dedup.api;

import com.identity.dedup.core.model.CommitRecord;
import com.identity.dedup.core.model.IdentityIndex;
import com.identity.dedup.core.model.NormalizedIdentity;
import com.identity.dedup.logging.LogContext;
import com.identity.dedup.rules.IdentityNormalizer;
import com.identity.dedup.rules.IdentityValidation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Run-scoped state shared by both heuristics of one analysis: the commit selection,
 * the identity index and the normalized identities. Immutable once built.
 */
public final class AnalysisContext {

    static final Comparator<CommitRecord> MOST_RECENT_FIRST =
            Comparator.comparing(CommitRecord::timestamp).reversed()
                    .thenComparing(CommitRecord::commitId);

    private final String runId;
    private final DeduplicationOptions options;
    private final IdentityIndex index;
    private final List<NormalizedIdentity> normalized;
    private final List<NormalizedIdentity> scoringInput;
    private final List<IdentityValidation> validations;
    private final RunStatistics statistics;

    private AnalysisContext(String runId, DeduplicationOptions options, IdentityIndex index,
                            List<NormalizedIdentity> normalized, List<NormalizedIdentity> scoringInput,
                            List<IdentityValidation> validations, RunStatistics statistics) {
        this.runId = runId;
        this.options = options;
        this.index = index;
        this.normalized = normalized;
        this.scoringInput = scoringInput;
        this.validations = validations;
        this.statistics = statistics;
    }

    public static AnalysisContext of(Collection<CommitRecord> commits, DeduplicationOptions options) {
        return of(commits, options, new IdentityNormalizer());
    }

    public static AnalysisContext of(Collection<CommitRecord> commits, DeduplicationOptions options,
                                     IdentityNormalizer normalizer) {
        Objects.requireNonNull(commits, "commits is required");
        Objects.requireNonNull(options, "options is required");
        Objects.requireNonNull(normalizer, "normalizer is required");

        List<CommitRecord> selected = selectCommits(commits, options);
        IdentityIndex index = IdentityIndex.fromCommits(selected);

        List<NormalizedIdentity> normalized = new ArrayList<>(index.size());
        List<NormalizedIdentity> scoringInput = new ArrayList<>(index.size());
        List<IdentityValidation> validations = new ArrayList<>(index.size());
        int valid = 0;
        for (int id = 0; id < index.size(); id++) {
            NormalizedIdentity identity = normalizer.normalize(index.identity(id));
            IdentityValidation validation = normalizer.validate(index.identity(id));
            normalized.add(identity);
            validations.add(validation);
            if (validation.isValid()) {
                valid++;
            }
            boolean excluded = options.isExcludeInvalidIdentities() && !validation.isValid();
            scoringInput.add(excluded ? NormalizedIdentity.empty() : identity);
        }

        RunStatistics statistics = new RunStatistics(commits.size(), selected.size(), index.size(),
                valid, index.size() - valid);
        return new AnalysisContext(LogContext.generateRunId(), options, index,
                Collections.unmodifiableList(normalized), Collections.unmodifiableList(scoringInput),
                Collections.unmodifiableList(validations), statistics);
    }

    /**
     * Applies the commit budget: the most recent commits win, ties broken by commit id.
     */
    static List<CommitRecord> selectCommits(Collection<CommitRecord> commits, DeduplicationOptions options) {
        if (options.getMaxCommits().isEmpty() || commits.size() <= options.getMaxCommits().getAsInt()) {
            return new ArrayList<>(commits);
        }
        List<CommitRecord> sorted = new ArrayList<>(commits);
        sorted.sort(MOST_RECENT_FIRST);
        return new ArrayList<>(sorted.subList(0, options.getMaxCommits().getAsInt()));
    }

    public String runId() {
        return runId;
    }

    public DeduplicationOptions options() {
        return options;
    }

    public IdentityIndex index() {
        return index;
    }

    /**
     * Normalized identities by id.
     */
    public List<NormalizedIdentity> normalized() {
        return normalized;
    }

    /**
     * Identities fed to blocking and scoring. Equal to {@link #normalized()} unless invalid
     * identities are excluded, in which case those are replaced by an empty identity that
     * never enters a bucket and so stays a singleton.
     */
    public List<NormalizedIdentity> scoringInput() {
        return scoringInput;
    }

    public IdentityValidation validation(int id) {
        return validations.get(id);
    }

    public RunStatistics statistics() {
        return statistics;
    }

    public int size() {
        return index.size();
    }
}
