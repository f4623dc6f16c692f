package com.codesurvey.core.analyzer;

import com.codesurvey.core.source.Repo;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of analyzing a single unit of code (e.g. one file) for a set of features.
 *
 * @param analyzer analyzer that produced the result
 * @param repo repository the unit belongs to
 * @param key unit key, unique within the repository
 * @param features outcome per requested feature name
 */
public record Code(Analyzer<?> analyzer, Repo repo, String key, Map<String, Feature> features)
    implements CodeCandidate {

    public Code {
        Objects.requireNonNull(analyzer, "analyzer must not be null");
        Objects.requireNonNull(repo, "repo must not be null");
        Objects.requireNonNull(key, "key must not be null");
        features = features == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    @Override
    public String toString() {
        return repo.label() + ":" + analyzer.getName() + ":" + key;
    }
}
