package com.codesurvey.core.analyzer;

/**
 * Produces a {@link Feature} outcome for a code representation.
 *
 * <p>Finders are executed on worker threads and must not keep mutable state.
 *
 * @param <T> code representation accepted by this finder (e.g. file text)
 * @see FeatureFinders
 */
public interface FeatureFinder<T> {

    /**
     * @return name of the feature, unique within an analyzer
     */
    String getName();

    /**
     * Searches the given code for occurrences of this feature.
     *
     * @param code code representation, never {@code null}
     * @return feature outcome
     */
    Feature find(T code);
}
