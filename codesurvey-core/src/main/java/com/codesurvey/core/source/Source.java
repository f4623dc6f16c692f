package com.codesurvey.core.source;

import java.util.Iterator;

/**
 * Provides repositories to be surveyed.
 *
 * <p>Sources are pluggable. The survey visits configured sources in round-robin
 * order, pulling one candidate at a time from each {@link #repoCandidates()} iterator.
 *
 * <p>The source name namespaces every persisted result, so it must be stable across
 * runs and unique within a survey.
 *
 * @see AbstractSource
 */
public interface Source {

    /**
     * Returns the unique name of this source.
     *
     * @return source name
     */
    String getName();

    /**
     * Returns a lazy, possibly infinite, iterator of repositories.
     *
     * <p>Each element is either a {@link Repo} ready for analysis or a {@link RepoThunk}
     * that the survey executes on a worker thread. {@code next()} may throw to signal a
     * failure for that turn; the survey logs it and asks again on the next turn.
     *
     * @return iterator of repository candidates
     */
    Iterator<RepoCandidate> repoCandidates();

    /**
     * Prepares the repository with the given key for analysis.
     *
     * <p>Used by thunks and for re-inspecting a repository from a stored key.
     *
     * @param repoKey key of the repository within this source
     * @return repository ready for analysis
     * @throws SourceException if the repository cannot be prepared
     */
    Repo fetchRepo(String repoKey);
}
