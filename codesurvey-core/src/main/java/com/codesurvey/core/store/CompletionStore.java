package com.codesurvey.core.store;

import com.codesurvey.core.analyzer.Feature;

import java.util.List;
import java.util.Map;

/**
 * Durable record of what has been analyzed and of the resulting aggregates.
 *
 * <p>All keys are namespaced by source name and repository key. Writes are issued by
 * the survey's coordinating thread only; implementations must still serialize writes
 * so that aggregation is merge-safe across resumed runs.
 *
 * @see SqliteCompletionStore
 */
public interface CompletionStore extends AutoCloseable {

    /**
     * Returns the requested features that have no repository-level aggregate yet.
     *
     * @param source source name
     * @param repoKey repository key
     * @param requested feature names per analyzer name
     * @return outstanding feature names per analyzer; analyzers with none are omitted
     */
    Map<String, List<String>> outstandingFeatures(String source, String repoKey, Map<String, List<String>> requested);

    /**
     * Returns the requested features that have no unit-level result yet.
     *
     * @return subset of {@code requested}, in the same order
     */
    List<String> outstandingUnitFeatures(String source, String repoKey, String analyzer, String codeKey,
                                         List<String> requested);

    /**
     * Upserts the results of one unit. Skipped outcomes are stored without a count.
     *
     * @param persistOccurrences if false, occurrence records are not stored (distinct from zero occurrences)
     */
    void recordUnitResult(String source, String repoKey, String analyzer, String codeKey,
                          Map<String, Feature> features, boolean persistOccurrences);

    /**
     * Upserts repository metadata, keeping the most recent value per key.
     */
    void recordRepoMetadata(String source, String repoKey, Map<String, Object> metadata);

    /**
     * Computes repository-level aggregates from the stored unit results of the repository
     * and merges them into the stored aggregates.
     *
     * @param deleteUnitRecords if true, unit results are deleted afterwards; their counts
     *                          stay part of every later aggregate of the repository
     */
    void aggregateAndPersist(String source, String repoKey, boolean deleteUnitRecords);

    /**
     * Deletes unit results and aggregates of the given features of a repository so that
     * they can be analyzed afresh.
     *
     * @param features feature names per analyzer name
     */
    void discardRepoResults(String source, String repoKey, Map<String, List<String>> features);

    List<RepoFeature> queryRepoAggregates(FeatureQuery query);

    List<CodeFeature> queryUnitResults(FeatureQuery query);

    /**
     * Releases the underlying resources. Never throws checked exceptions.
     */
    @Override
    void close();
}
