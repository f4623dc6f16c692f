package com.codesurvey.core.analyzer;

import com.codesurvey.core.source.Repo;

/**
 * Item produced by an {@link Analyzer} for a repository: either a finished {@link Code}
 * analysis or a {@link CodeThunk} to be executed on a worker thread.
 */
public sealed interface CodeCandidate permits Code, CodeThunk {

    Analyzer<?> analyzer();

    Repo repo();

    /**
     * @return key of the unit, unique within the repository (e.g. relative file path)
     */
    String key();
}
