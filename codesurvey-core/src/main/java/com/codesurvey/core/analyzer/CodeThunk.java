package com.codesurvey.core.analyzer;

import com.codesurvey.core.source.Repo;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * A task to be run on a worker thread to produce a {@link Code} analysis.
 *
 * @param analyzer analyzer that will perform the analysis
 * @param repo repository the unit belongs to
 * @param key unit key, unique within the repository
 * @param features names of the features to analyze
 * @param thunk computation producing the analysis, using only captured inputs
 */
public record CodeThunk(Analyzer<?> analyzer, Repo repo, String key, List<String> features, Callable<Code> thunk)
    implements CodeCandidate {

    public CodeThunk {
        Objects.requireNonNull(analyzer, "analyzer must not be null");
        Objects.requireNonNull(repo, "repo must not be null");
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(thunk, "thunk must not be null");
        features = List.copyOf(features);
    }

    @Override
    public String toString() {
        return repo.label() + ":" + analyzer.getName() + ":" + key;
    }
}
