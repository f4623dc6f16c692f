package com.codesurvey.core.survey;

import com.codesurvey.core.source.Repo;
import com.codesurvey.core.source.RepoCandidate;
import com.codesurvey.core.source.Source;
import com.codesurvey.core.store.CompletionStore;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Pulls repository candidates from the sources in strict round-robin order and resolves
 * which analyzer features remain outstanding for each.
 *
 * <p>A source that fails on a turn is passed over for that turn only; an exhausted source
 * leaves the rotation. Candidates already in flight, or with nothing left to analyze, are
 * skipped, and skipped repositories that were already prepared are cleaned up.
 */
final class RepoFeed {

    /**
     * Candidate handed to the coordinator.
     *
     * @param candidate repository or deferred repository job
     * @param features outstanding feature names per analyzer name, never empty
     */
    record Entry(RepoCandidate candidate, Map<String, List<String>> features) {
    }

    private final List<SourceCursor> cursors = new ArrayList<>();
    private final Map<String, List<String>> requestedFeatures;
    private final CompletionStore store;
    private final boolean useSavedFeatures;
    private final Predicate<RepoCandidate> inFlight;
    private final FailureHandler failureHandler;
    private final CancellationToken token;
    private final Logger log;
    private int turn;

    /**
     * @param sources sources in rotation order
     * @param requestedFeatures feature names per analyzer name
     * @param store store consulted for completed features
     * @param useSavedFeatures if false, every requested feature is outstanding
     * @param inFlight tells whether a candidate's repository is already being prepared or analyzed
     */
    RepoFeed(List<Source> sources, Map<String, List<String>> requestedFeatures, CompletionStore store,
             boolean useSavedFeatures, Predicate<RepoCandidate> inFlight, FailureHandler failureHandler,
             CancellationToken token, Logger log) {
        sources.forEach(source -> cursors.add(new SourceCursor(source)));
        this.requestedFeatures = requestedFeatures;
        this.store = store;
        this.useSavedFeatures = useSavedFeatures;
        this.inFlight = inFlight;
        this.failureHandler = failureHandler;
        this.token = token;
        this.log = log;
    }

    /**
     * @return true once every source is exhausted
     */
    boolean isExhausted() {
        return cursors.isEmpty();
    }

    /**
     * Returns the next candidate with outstanding features.
     *
     * @return next entry, or empty once every source is exhausted
     */
    Optional<Entry> next() {
        while (!cursors.isEmpty()) {
            token.throwIfCancelled();
            RepoCandidate candidate = nextCandidate();
            if (candidate == null) {
                continue;
            }
            if (inFlight.test(candidate)) {
                log.info("Skipping repo {} as it is already being analyzed", candidate.label());
                release(candidate);
                continue;
            }
            Map<String, List<String>> outstanding = useSavedFeatures
                ? store.outstandingFeatures(candidate.source().getName(), candidate.key(), requestedFeatures)
                : requestedFeatures;
            if (outstanding.isEmpty()) {
                log.info("Skipping repo {} as all features have already been analyzed", candidate.label());
                release(candidate);
                continue;
            }
            return Optional.of(new Entry(candidate, outstanding));
        }
        return Optional.empty();
    }

    /**
     * Cleans up a skipped candidate that was already prepared.
     */
    private void release(RepoCandidate candidate) {
        if (candidate instanceof Repo repo) {
            try {
                repo.cleanup();
            } catch (RuntimeException e) {
                log.warn("Failed to clean up skipped repo {}: {}", repo, e.getMessage(), e);
            }
        }
    }

    /**
     * Takes one turn of the rotation.
     *
     * @return the candidate yielded on this turn, or {@code null} if the source failed or was exhausted
     */
    private RepoCandidate nextCandidate() {
        if (turn >= cursors.size()) {
            turn = 0;
        }
        SourceCursor cursor = cursors.get(turn);
        try {
            if (!cursor.candidates().hasNext()) {
                log.info("Source {} is exhausted", cursor.source.getName());
                cursors.remove(turn);
                return null;
            }
            RepoCandidate candidate = cursor.candidates().next();
            turn++;
            return candidate;
        } catch (RuntimeException e) {
            turn++;
            failureHandler.handle("Failed to get repo candidate from source " + cursor.source.getName(), e);
            return null;
        }
    }

    /**
     * Lazily opened candidate iterator of one source.
     */
    private static final class SourceCursor {
        private final Source source;
        private Iterator<RepoCandidate> candidates;

        SourceCursor(Source source) {
            this.source = source;
        }

        Iterator<RepoCandidate> candidates() {
            if (candidates == null) {
                candidates = source.repoCandidates();
            }
            return candidates;
        }
    }
}
