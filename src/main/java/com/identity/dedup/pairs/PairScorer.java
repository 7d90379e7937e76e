package com.identity.dedup.pairs;

import com.identity.dedup.core.model.CandidatePair;
import com.identity.dedup.core.model.IdentityPair;
import com.identity.dedup.core.model.NormalizedIdentity;
import com.identity.dedup.similarity.IdentityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scores candidate pairs, sequentially or in chunks on a fixed worker pool.
 *
 * <p>Results always come back in the order of the input pairs, whatever the
 * parallelism, so downstream clustering sees an identical stream.</p>
 */
public class PairScorer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PairScorer.class);

    static final int CHUNK_SIZE = 1_024;

    private final int parallelism;
    private final ExecutorService executor;

    public PairScorer() {
        this(1);
    }

    public PairScorer(int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        this.parallelism = parallelism;
        this.executor = parallelism > 1 ? Executors.newFixedThreadPool(parallelism, workerThreads()) : null;
    }

    /**
     * Scores every pair against the identity list (list position = identity id).
     */
    public List<CandidatePair> score(List<IdentityPair> pairs, List<NormalizedIdentity> identities,
                                     IdentityScorer scorer, double threshold) {
        if (executor == null || pairs.size() <= CHUNK_SIZE) {
            return scoreChunk(pairs, identities, scorer, threshold);
        }

        List<CompletableFuture<List<CandidatePair>>> futures = new ArrayList<>();
        for (int start = 0; start < pairs.size(); start += CHUNK_SIZE) {
            List<IdentityPair> chunk = pairs.subList(start, Math.min(start + CHUNK_SIZE, pairs.size()));
            futures.add(CompletableFuture.supplyAsync(
                    () -> scoreChunk(chunk, identities, scorer, threshold), executor));
        }

        List<CandidatePair> results = new ArrayList<>(pairs.size());
        try {
            for (CompletableFuture<List<CandidatePair>> future : futures) {
                results.addAll(future.join());
            }
        } catch (CompletionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
        log.debug("pairs.scored pairs={} chunks={} parallelism={}", pairs.size(), futures.size(), parallelism);
        return results;
    }

    public int getParallelism() {
        return parallelism;
    }

    private static List<CandidatePair> scoreChunk(List<IdentityPair> pairs, List<NormalizedIdentity> identities,
                                                  IdentityScorer scorer, double threshold) {
        List<CandidatePair> results = new ArrayList<>(pairs.size());
        for (IdentityPair pair : pairs) {
            results.add(scorer.compare(pair, identities.get(pair.first()), identities.get(pair.second()), threshold));
        }
        return results;
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "pair-scorer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public void close() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
