package com.codesurvey.core.survey;

import com.codesurvey.core.analyzer.Analyzer;
import com.codesurvey.core.exception.SurveyConfigurationException;
import com.codesurvey.core.source.Source;
import com.codesurvey.core.store.CodeFeature;
import com.codesurvey.core.store.CompletionStore;
import com.codesurvey.core.store.CompletionStoreFactory;
import com.codesurvey.core.store.FeatureQuery;
import com.codesurvey.core.store.RepoFeature;
import com.codesurvey.core.store.SqliteCompletionStore;
import com.codesurvey.core.util.Names;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Surveys repositories from a set of sources with a set of analyzers, recording the
 * results in a {@link CompletionStore}.
 *
 * <p>Runs are resumable: work recorded by an earlier run against the same store is not
 * repeated.
 *
 * <pre>{@code
 * CodeSurvey survey = CodeSurvey.builder()
 *     .sources(List.of(new LocalSource(List.of("/code/project"))))
 *     .analyzers(List.of(new TextFileAnalyzer(List.of(FeatureFinders.regex("todo", "TODO")))))
 *     .databasePath(Path.of("survey.sqlite3"))
 *     .build();
 * SurveyRunSummary summary = survey.run(RunOptions.unlimited().withMaxRepos(10));
 * List<RepoFeature> features = survey.getRepoFeatures(FeatureQuery.all());
 * }</pre>
 */
public final class CodeSurvey implements AutoCloseable {

    /** MDC key tagging every log line of a run. */
    public static final String RUN_ID_MDC_KEY = "surveyRun";

    private static final Logger log = LoggerFactory.getLogger(CodeSurvey.class);

    private final List<Source> sources;
    private final List<Analyzer<?>> analyzers;
    private final CompletionStoreFactory storeFactory;
    private final int maxWorkers;
    private final boolean continueOnFailure;
    private final boolean saveCodeFeatures;
    private final boolean saveOccurrences;
    private final boolean useSavedFeatures;

    private CodeSurvey(Builder builder) {
        this.sources = List.copyOf(builder.sources);
        this.analyzers = List.copyOf(builder.analyzers);
        this.storeFactory = builder.storeFactory;
        this.maxWorkers = builder.maxWorkers;
        this.continueOnFailure = builder.continueOnFailure;
        this.saveCodeFeatures = builder.saveCodeFeatures;
        this.saveOccurrences = builder.saveOccurrences;
        this.useSavedFeatures = builder.useSavedFeatures;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the survey without limits.
     *
     * @return counters of the run
     */
    public SurveyRunSummary run() {
        return run(RunOptions.unlimited());
    }

    /**
     * Runs the survey until every source is exhausted, a limit is reached, or the run is
     * cancelled. In-flight repositories are always cleaned up before returning or throwing.
     *
     * @param options limits and cancellation token of the run
     * @return counters of the run
     * @throws com.codesurvey.core.exception.SurveyInterruptedException if the run was cancelled
     * @throws RuntimeException the first failure, if {@code continueOnFailure} is disabled
     */
    public SurveyRunSummary run(RunOptions options) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(RUN_ID_MDC_KEY, runId);
        try {
            Logger runLog = LoggerFactory.getLogger(SurveyRunner.class);
            runLog.info("Starting survey run {} with {} sources, {} analyzers and {} workers",
                runId, sources.size(), analyzers.size(), maxWorkers);
            return openRunner(options, runLog).run();
        } finally {
            MDC.remove(RUN_ID_MDC_KEY);
        }
    }

    private SurveyRunner openRunner(RunOptions options, Logger runLog) {
        CompletionStore store = storeFactory.open();
        try {
            return new SurveyRunner(this, options, store, runLog);
        } catch (RuntimeException e) {
            try {
                store.close();
            } catch (RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    /**
     * Returns stored repository-level results, joined with repository metadata.
     */
    public List<RepoFeature> getRepoFeatures(FeatureQuery query) {
        try (CompletionStore store = storeFactory.open()) {
            return store.queryRepoAggregates(query);
        }
    }

    /**
     * Returns stored unit-level results, joined with repository metadata. Empty for
     * repositories surveyed with {@code saveCodeFeatures} disabled.
     */
    public List<CodeFeature> getCodeFeatures(FeatureQuery query) {
        try (CompletionStore store = storeFactory.open()) {
            return store.queryUnitResults(query);
        }
    }

    /**
     * Returns stored results as a nested tree:
     * {@code sources -> <source> -> repos -> <repo> -> (repo_metadata | analyzers -> <analyzer>
     * -> (features -> <feature> | codes -> <code> -> features -> <feature>))}.
     *
     * @param query filters applied to both repository and unit results
     * @return tree of plain maps, suitable for JSON serialization
     */
    public Map<String, Object> getSurveyTree(FeatureQuery query) {
        Map<String, Object> sourcesNode = new LinkedHashMap<>();
        for (RepoFeature feature : getRepoFeatures(query)) {
            Map<String, Object> repoNode = repoNode(sourcesNode, feature.source(), feature.repoKey(), feature.repoMetadata());
            Map<String, Object> featureNode = new LinkedHashMap<>();
            featureNode.put("occurrence_count", feature.occurrenceCount());
            featureNode.put("code_occurrence_count", feature.codeOccurrenceCount());
            featureNode.put("code_total_count", feature.codeTotalCount());
            featureNode.put("updated", feature.updated().toString());
            child(child(analyzerNode(repoNode, feature.analyzer()), "features"), feature.feature()).putAll(featureNode);
        }
        for (CodeFeature feature : getCodeFeatures(query)) {
            Map<String, Object> repoNode = repoNode(sourcesNode, feature.source(), feature.repoKey(), feature.repoMetadata());
            Map<String, Object> codeNode = child(child(analyzerNode(repoNode, feature.analyzer()), "codes"), feature.codeKey());
            Map<String, Object> featureNode = child(child(codeNode, "features"), feature.feature());
            featureNode.put("occurrence_count", feature.occurrenceCount());
            featureNode.put("occurrences", feature.occurrences());
            featureNode.put("updated", feature.updated().toString());
        }
        Map<String, Object> tree = new LinkedHashMap<>();
        tree.put("sources", sourcesNode);
        return tree;
    }

    private static Map<String, Object> repoNode(Map<String, Object> sourcesNode, String source, String repoKey,
                                                Map<String, Object> metadata) {
        Map<String, Object> repoNode = child(child(child(sourcesNode, source), "repos"), repoKey);
        repoNode.putIfAbsent("repo_metadata", metadata);
        return repoNode;
    }

    private static Map<String, Object> analyzerNode(Map<String, Object> repoNode, String analyzer) {
        return child(child(repoNode, "analyzers"), analyzer);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> child(Map<String, Object> parent, String key) {
        return (Map<String, Object>) parent.computeIfAbsent(key, k -> new LinkedHashMap<String, Object>());
    }

    /**
     * Releases the store factory (for the default in-memory store, its records).
     */
    @Override
    public void close() {
        storeFactory.close();
    }

    public List<Source> getSources() {
        return sources;
    }

    public List<Analyzer<?>> getAnalyzers() {
        return analyzers;
    }

    /**
     * @return every feature name per analyzer name, in configuration order
     */
    public Map<String, List<String>> getAnalyzerFeatures() {
        Map<String, List<String>> features = new LinkedHashMap<>();
        analyzers.forEach(analyzer -> features.put(analyzer.getName(), analyzer.getFeatureNames()));
        return features;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public boolean isContinueOnFailure() {
        return continueOnFailure;
    }

    public boolean isSaveCodeFeatures() {
        return saveCodeFeatures;
    }

    public boolean isSaveOccurrences() {
        return saveOccurrences;
    }

    public boolean isUseSavedFeatures() {
        return useSavedFeatures;
    }

    /**
     * Builder for {@link CodeSurvey}. Names are validated eagerly by {@link #build()}.
     */
    public static final class Builder {
        private final List<Source> sources = new ArrayList<>();
        private final List<Analyzer<?>> analyzers = new ArrayList<>();
        private CompletionStoreFactory storeFactory;
        private int maxWorkers = Runtime.getRuntime().availableProcessors();
        private boolean continueOnFailure = true;
        private boolean saveCodeFeatures = true;
        private boolean saveOccurrences = true;
        private boolean useSavedFeatures = true;

        private Builder() {
        }

        public Builder sources(List<? extends Source> sources) {
            this.sources.addAll(sources);
            return this;
        }

        public Builder source(Source source) {
            this.sources.add(source);
            return this;
        }

        public Builder analyzers(List<? extends Analyzer<?>> analyzers) {
            this.analyzers.addAll(analyzers);
            return this;
        }

        public Builder analyzer(Analyzer<?> analyzer) {
            this.analyzers.add(analyzer);
            return this;
        }

        public Builder storeFactory(CompletionStoreFactory storeFactory) {
            this.storeFactory = storeFactory;
            return this;
        }

        /**
         * Stores results in an SQLite database file instead of the default in-memory database.
         */
        public Builder databasePath(Path databasePath) {
            this.storeFactory = SqliteCompletionStore.fileFactory(databasePath);
            return this;
        }

        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder continueOnFailure(boolean continueOnFailure) {
            this.continueOnFailure = continueOnFailure;
            return this;
        }

        /**
         * If false, unit-level results are deleted once their repository is aggregated.
         */
        public Builder saveCodeFeatures(boolean saveCodeFeatures) {
            this.saveCodeFeatures = saveCodeFeatures;
            return this;
        }

        public Builder saveOccurrences(boolean saveOccurrences) {
            this.saveOccurrences = saveOccurrences;
            return this;
        }

        /**
         * If false, previously recorded results are discarded and analyzed again.
         */
        public Builder useSavedFeatures(boolean useSavedFeatures) {
            this.useSavedFeatures = useSavedFeatures;
            return this;
        }

        /**
         * @throws SurveyConfigurationException if sources or analyzers are missing or share a name,
         *                                      or the worker count is not positive
         */
        public CodeSurvey build() {
            if (sources.isEmpty()) {
                throw new SurveyConfigurationException("A survey needs at least one source");
            }
            if (analyzers.isEmpty()) {
                throw new SurveyConfigurationException("A survey needs at least one analyzer");
            }
            List<String> duplicateSources = Names.duplicates(sources.stream().map(Source::getName).toList());
            if (!duplicateSources.isEmpty()) {
                throw new SurveyConfigurationException("Cannot create survey with duplicate source names: "
                    + String.join(", ", duplicateSources) + ". Please set a unique name for each source.");
            }
            List<String> duplicateAnalyzers = Names.duplicates(analyzers.stream().map(a -> a.getName()).toList());
            if (!duplicateAnalyzers.isEmpty()) {
                throw new SurveyConfigurationException("Cannot create survey with duplicate analyzer names: "
                    + String.join(", ", duplicateAnalyzers) + ". Please set a unique name for each analyzer.");
            }
            if (maxWorkers < 1) {
                throw new SurveyConfigurationException("maxWorkers must be at least 1: " + maxWorkers);
            }
            if (storeFactory == null) {
                log.debug("No database configured, storing survey results in memory");
                storeFactory = SqliteCompletionStore.inMemoryFactory();
            }
            return new CodeSurvey(this);
        }
    }
}
