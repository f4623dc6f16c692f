package com.codesurvey.core.store;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Stored result of one feature for one unit of code.
 *
 * @param source source name
 * @param repoKey repository key within the source
 * @param analyzer analyzer name
 * @param codeKey unit key within the repository
 * @param feature feature name
 * @param updated time the result was recorded
 * @param occurrenceCount number of occurrences, {@code null} if the unit was skipped
 * @param occurrences occurrence records, {@code null} if skipped or not persisted
 * @param repoMetadata metadata reported by the source for the repository
 */
public record CodeFeature(
    String source,
    String repoKey,
    String analyzer,
    String codeKey,
    String feature,
    Instant updated,
    Integer occurrenceCount,
    List<Map<String, Object>> occurrences,
    Map<String, Object> repoMetadata
) {
    public CodeFeature {
        repoMetadata = repoMetadata == null ? Map.of() : repoMetadata;
    }

    public boolean isSkipped() {
        return occurrenceCount == null;
    }
}
