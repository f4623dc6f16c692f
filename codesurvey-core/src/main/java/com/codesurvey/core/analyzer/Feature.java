package com.codesurvey.core.analyzer;

import java.util.List;
import java.util.Map;

/**
 * Outcome of searching one unit of code for one feature.
 *
 * <p>Either {@link Skipped} (analysis was intentionally not attempted for the unit) or
 * {@link Occurrences} (zero or more occurrence records). Skipped outcomes are excluded
 * from aggregate unit counts.
 */
public sealed interface Feature permits Feature.Skipped, Feature.Occurrences {

    /**
     * @return true if analysis of the unit was skipped
     */
    boolean isSkipped();

    /**
     * @return occurrence records, empty for skipped outcomes
     */
    List<Map<String, Object>> occurrences();

    /**
     * @return number of occurrences, zero for skipped outcomes
     */
    default int occurrenceCount() {
        return occurrences().size();
    }

    static Feature skipped() {
        return Skipped.INSTANCE;
    }

    static Feature occurrences(List<Map<String, Object>> occurrences) {
        return new Occurrences(occurrences);
    }

    static Feature none() {
        return new Occurrences(List.of());
    }

    /**
     * The unit was not analyzed for this feature.
     */
    record Skipped() implements Feature {
        private static final Skipped INSTANCE = new Skipped();

        @Override
        public boolean isSkipped() {
            return true;
        }

        @Override
        public List<Map<String, Object>> occurrences() {
            return List.of();
        }
    }

    /**
     * The unit was analyzed; each element describes one occurrence.
     *
     * @param occurrences opaque occurrence records (e.g. line and column)
     */
    record Occurrences(List<Map<String, Object>> occurrences) implements Feature {
        public Occurrences {
            occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
        }

        @Override
        public boolean isSkipped() {
            return false;
        }
    }
}
