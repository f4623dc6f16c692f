package com.codesurvey.core.analyzer;

import com.codesurvey.core.source.Repo;

import java.util.Iterator;
import java.util.List;

/**
 * Analyzes repositories to produce per-unit {@link Code} results.
 *
 * <p>Analyzers are pluggable strategies. The survey asks each analyzer for a lazy
 * sequence of units per repository and schedules any {@link CodeThunk} on its
 * worker pool.
 *
 * @param <T> representation of a unit of code handed to this analyzer's feature finders
 * @see AbstractAnalyzer
 * @see FileAnalyzer
 */
public interface Analyzer<T> {

    /**
     * @return unique analyzer name, used to namespace persisted results
     */
    String getName();

    /**
     * @return names of all features this analyzer can find, in declaration order
     */
    List<String> getFeatureNames();

    /**
     * Returns a lazy, finite iterator over the units of the repository.
     *
     * <p>Units whose outstanding features (as reported by the resolver) are empty must
     * not be yielded. Iteration happens on the coordinating thread; any expensive work
     * belongs inside the yielded thunks.
     *
     * @param repo repository to analyze
     * @param resolver supplies the features still outstanding for each unit
     * @return iterator of finished results or thunks
     */
    Iterator<CodeCandidate> codeCandidates(Repo repo, CodeFeatureResolver resolver);

    /**
     * Analyzes a single unit for the given features.
     *
     * @param repo repository containing the unit
     * @param codeKey unit key within the repository
     * @param features feature names to analyze, a subset of {@link #getFeatureNames()}
     * @return analysis result with one outcome per requested feature
     */
    Code analyzeCode(Repo repo, String codeKey, List<String> features);
}
