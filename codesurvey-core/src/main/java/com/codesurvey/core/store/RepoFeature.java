package com.codesurvey.core.store;

import java.time.Instant;
import java.util.Map;

/**
 * Aggregated results of one feature over every analyzed unit of a repository.
 *
 * @param source source name
 * @param repoKey repository key within the source
 * @param analyzer analyzer name
 * @param feature feature name
 * @param updated time of the most recent unit result included in the aggregate
 * @param occurrenceCount total occurrences over all units
 * @param codeOccurrenceCount number of units with at least one occurrence
 * @param codeTotalCount number of units evaluated, skipped units excluded
 * @param repoMetadata metadata reported by the source for the repository
 */
public record RepoFeature(
    String source,
    String repoKey,
    String analyzer,
    String feature,
    Instant updated,
    long occurrenceCount,
    long codeOccurrenceCount,
    long codeTotalCount,
    Map<String, Object> repoMetadata
) {
    public RepoFeature {
        repoMetadata = repoMetadata == null ? Map.of() : repoMetadata;
    }
}
