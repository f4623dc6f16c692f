package com.codesurvey.core.store;

import java.util.List;

/**
 * Filters for reading stored survey results. A {@code null} list applies no filter
 * on that column; an empty list matches nothing.
 *
 * @param sources source names
 * @param repoKeys repository keys
 * @param analyzers analyzer names
 * @param features feature names
 */
public record FeatureQuery(
    List<String> sources,
    List<String> repoKeys,
    List<String> analyzers,
    List<String> features
) {
    public FeatureQuery {
        sources = sources == null ? null : List.copyOf(sources);
        repoKeys = repoKeys == null ? null : List.copyOf(repoKeys);
        analyzers = analyzers == null ? null : List.copyOf(analyzers);
        features = features == null ? null : List.copyOf(features);
    }

    /**
     * @return query matching every stored record
     */
    public static FeatureQuery all() {
        return new FeatureQuery(null, null, null, null);
    }

    /**
     * @return query matching the records of a single repository
     */
    public static FeatureQuery forRepo(String source, String repoKey) {
        return new FeatureQuery(List.of(source), List.of(repoKey), null, null);
    }

    public FeatureQuery withSources(List<String> sources) {
        return new FeatureQuery(sources, repoKeys, analyzers, features);
    }

    public FeatureQuery withRepoKeys(List<String> repoKeys) {
        return new FeatureQuery(sources, repoKeys, analyzers, features);
    }

    public FeatureQuery withAnalyzers(List<String> analyzers) {
        return new FeatureQuery(sources, repoKeys, analyzers, features);
    }

    public FeatureQuery withFeatures(List<String> features) {
        return new FeatureQuery(sources, repoKeys, analyzers, features);
    }
}
