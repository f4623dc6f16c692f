package com.codesurvey.core.analyzer;

import java.util.List;

/**
 * Supplies the features that still need to be analyzed for a unit of code.
 *
 * <p>Called by analyzers on the coordinating thread while they enumerate units.
 */
@FunctionalInterface
public interface CodeFeatureResolver {

    /**
     * @param codeKey key of the unit within its repository
     * @return outstanding feature names, empty if the unit should not be yielded
     */
    List<String> outstandingFeatures(String codeKey);
}
