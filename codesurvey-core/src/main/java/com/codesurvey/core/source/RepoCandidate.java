package com.codesurvey.core.source;

/**
 * Item produced by a {@link Source}: either a {@link Repo} that is ready for analysis
 * or a {@link RepoThunk} that must be executed to prepare one.
 */
public sealed interface RepoCandidate permits Repo, RepoThunk {

    /**
     * @return source the repository belongs to
     */
    Source source();

    /**
     * @return key of the repository, unique within its source
     */
    String key();

    /**
     * @return {@code sourceName:key}, the identity used in logs
     */
    default String label() {
        return source().getName() + ":" + key();
    }
}
