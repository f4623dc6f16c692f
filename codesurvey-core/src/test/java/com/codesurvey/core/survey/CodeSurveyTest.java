package com.codesurvey.core.survey;

import com.codesurvey.core.analyzer.Analyzer;
import com.codesurvey.core.analyzer.Code;
import com.codesurvey.core.analyzer.CodeCandidate;
import com.codesurvey.core.analyzer.CodeFeatureResolver;
import com.codesurvey.core.exception.SurveyConfigurationException;
import com.codesurvey.core.exception.SurveyInterruptedException;
import com.codesurvey.core.source.Repo;
import com.codesurvey.core.store.CodeFeature;
import com.codesurvey.core.store.CompletionStore;
import com.codesurvey.core.store.CompletionStoreFactory;
import com.codesurvey.core.store.FeatureQuery;
import com.codesurvey.core.store.RepoFeature;
import com.codesurvey.core.store.SqliteCompletionStore;
import com.codesurvey.core.survey.SurveyFixtures.InlineAnalyzer;
import com.codesurvey.core.survey.SurveyFixtures.RecordingAnalyzer;
import com.codesurvey.core.survey.SurveyFixtures.RecordingSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Proxy;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static com.codesurvey.core.survey.SurveyFixtures.files;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * End-to-end tests for {@link CodeSurvey} runs against an in-memory store.
 */
class CodeSurveyTest {

    private final List<CodeSurvey> surveys = new ArrayList<>();

    @AfterEach
    void closeSurveys() {
        surveys.forEach(CodeSurvey::close);
    }

    @Test
    void run_twice_secondRunSkipsCompletedRepos() {
        RecordingSource a = new RecordingSource("a", Map.of(
            "r1", files("one.py", "# TODO\nx = 1  # TODO\n", "two.py", "pass\n", "notes.txt", "TODO"),
            "r2", files("three.py", "# FIXME\n")), false);
        RecordingSource b = new RecordingSource("b", Map.of("r3", files("pkg/four.py", "# TODO FIXME\n")), true);
        RecordingAnalyzer analyzer = new RecordingAnalyzer("py");
        CodeSurvey survey = survey(CodeSurvey.builder().source(a).source(b).analyzer(analyzer).maxWorkers(2));

        SurveyRunSummary first = survey.run();
        List<RepoFeature> featuresAfterFirstRun = survey.getRepoFeatures(FeatureQuery.all());
        SurveyRunSummary second = survey.run();

        assertThat(first.completedRepoCount()).isEqualTo(3);
        assertThat(first.completedCodeCount()).isEqualTo(4);
        assertThat(first.failureCount()).isZero();
        assertThat(first.featureRepoCounts()).containsEntry("py:todo", 2).containsEntry("py:fixme", 2);
        assertThat(second.completedRepoCount()).isZero();
        assertThat(second.completedCodeCount()).isZero();
        assertThat(analyzer.analyzed).hasValue(4);
        assertThat(survey.getRepoFeatures(FeatureQuery.all())).isEqualTo(featuresAfterFirstRun);
        assertThat(featuresAfterFirstRun)
            .filteredOn(feature -> feature.repoKey().equals("r1") && feature.feature().equals("todo"))
            .extracting(RepoFeature::occurrenceCount, RepoFeature::codeOccurrenceCount, RepoFeature::codeTotalCount)
            .containsExactly(tuple(2L, 1L, 2L));
        assertThat(a.totalCleanups()).isEqualTo(a.prepared.get()).isEqualTo(4);
        assertThat(b.prepared).hasValue(1);
    }

    @Test
    void run_withMaxCodes_stopsAfterExactlyThatManyUnits() {
        RecordingSource source = new RecordingSource("s", Map.of("r1", files(
            "a.py", "TODO", "b.py", "TODO", "c.py", "TODO", "d.py", "TODO", "e.py", "TODO")), false);
        RecordingAnalyzer analyzer = new RecordingAnalyzer("py");
        CodeSurvey survey = survey(CodeSurvey.builder().source(source).analyzer(analyzer).maxWorkers(3));

        SurveyRunSummary summary = survey.run(RunOptions.unlimited().withMaxCodes(2));

        assertThat(summary.completedCodeCount()).isEqualTo(2);
        assertThat(summary.completedRepoCount()).isEqualTo(1);
        assertThat(analyzer.analyzed).hasValue(2);
        assertThat(survey.getRepoFeatures(FeatureQuery.all().withFeatures(List.of("todo"))))
            .extracting(RepoFeature::codeTotalCount)
            .containsExactly(2L);
        assertThat(source.cleanups.get("r1")).hasValue(1);
    }

    @Test
    void run_withMaxRepos_preparesOnlyThatManyRepos() {
        RecordingSource source = new RecordingSource("s", orderedRepos(
            "r1", files("a.py", "TODO"), "r2", files("b.py", "TODO"), "r3", files("c.py", "TODO")), false);
        CodeSurvey survey = survey(CodeSurvey.builder().source(source).analyzer(new RecordingAnalyzer("py")));

        SurveyRunSummary summary = survey.run(RunOptions.unlimited().withMaxRepos(1));

        assertThat(summary.completedRepoCount()).isEqualTo(1);
        assertThat(source.prepared).hasValue(1);
        assertThat(survey.getRepoFeatures(FeatureQuery.all()))
            .extracting(RepoFeature::repoKey)
            .containsOnly("r1");
    }

    @Test
    void run_repoWithoutMatchingFiles_isCompletedWithoutResults() {
        RecordingSource source = new RecordingSource("s", Map.of("docs", files("README.md", "TODO")), false);
        CodeSurvey survey = survey(CodeSurvey.builder().source(source).analyzer(new RecordingAnalyzer("py")));

        SurveyRunSummary summary = survey.run();

        assertThat(summary.completedRepoCount()).isEqualTo(1);
        assertThat(summary.completedCodeCount()).isZero();
        assertThat(source.cleanups.get("docs")).hasValue(1);
        assertThat(survey.getRepoFeatures(FeatureQuery.all())).isEmpty();
    }

    @Test
    void run_failingUnit_isSkippedAndRepoStillCompletes() {
        RecordingSource source = new RecordingSource("s", Map.of("r1", files("bad.py", "TODO", "good.py", "TODO")), false);
        RecordingAnalyzer analyzer = new RecordingAnalyzer("py").withHook(codeKey -> {
            if (codeKey.equals("bad.py")) {
                throw new IllegalStateException("boom");
            }
        });
        CodeSurvey survey = survey(CodeSurvey.builder().source(source).analyzer(analyzer));

        SurveyRunSummary summary = survey.run();

        assertThat(summary.failureCount()).isEqualTo(1);
        assertThat(summary.completedCodeCount()).isEqualTo(1);
        assertThat(summary.completedRepoCount()).isEqualTo(1);
        assertThat(survey.getCodeFeatures(FeatureQuery.all()))
            .extracting(CodeFeature::codeKey)
            .containsOnly("good.py");
        assertThat(survey.getRepoFeatures(FeatureQuery.all().withFeatures(List.of("todo"))))
            .extracting(RepoFeature::codeTotalCount)
            .containsExactly(1L);
    }

    @Test
    void run_failingUnitWithoutContinueOnFailure_rethrowsAfterCleaningUp() {
        RecordingSource source = new RecordingSource("s", orderedRepos(
            "r1", files("a.py", "TODO", "bad.py", "TODO"), "r2", files("b.py", "TODO")), false);
        RecordingAnalyzer analyzer = new RecordingAnalyzer("py").withHook(codeKey -> {
            if (codeKey.equals("bad.py")) {
                throw new IllegalStateException("boom");
            }
        });
        CodeSurvey survey = survey(CodeSurvey.builder().source(source).analyzer(analyzer).continueOnFailure(false));

        assertThatThrownBy(survey::run).isInstanceOf(IllegalStateException.class).hasMessage("boom");
        assertThat(source.prepared.get()).isPositive();
        assertThat(source.totalCleanups()).isEqualTo(source.prepared.get());
        assertThat(MDC.get(CodeSurvey.RUN_ID_MDC_KEY)).isNull();
    }

    @Test
    void run_cancelled_throwsAfterCleaningUp() {
        CancellationToken token = new CancellationToken();
        RecordingSource source = new RecordingSource("s", orderedRepos(
            "r1", files("a.py", "TODO", "b.py", "TODO"), "r2", files("c.py", "TODO")), false);
        RecordingAnalyzer analyzer = new RecordingAnalyzer("py").withHook(codeKey -> token.cancel());
        CodeSurvey survey = survey(CodeSurvey.builder().source(source).analyzer(analyzer).maxWorkers(1));

        assertThatThrownBy(() -> survey.run(RunOptions.unlimited().withCancellationToken(token)))
            .isInstanceOf(SurveyInterruptedException.class);
        assertThat(source.totalCleanups()).isEqualTo(source.prepared.get());
    }

    @Test
    void run_cancelledWhilePreparedRepoAwaitsDispatch_cleansItUp() {
        CancellationToken token = new CancellationToken();
        CountDownLatch deferredPrepared = new CountDownLatch(1);
        RecordingSource deferredSource = new RecordingSource("deferred",
            orderedRepos("d1", files("d.py", "TODO")), true).withPrepareHook(repoKey -> deferredPrepared.countDown());
        RecordingSource readySource = new RecordingSource("ready", orderedRepos("r1", files("r.py", "TODO")), false);
        RecordingAnalyzer analyzer = new RecordingAnalyzer("py").withStreamHook(repoKey -> {
            if (repoKey.equals("r1")) {
                awaitLatch(deferredPrepared);
                pause(300);
                token.cancel();
            }
        });
        CodeSurvey survey = survey(CodeSurvey.builder()
            .source(deferredSource).source(readySource).analyzer(analyzer).maxWorkers(2));

        assertThatThrownBy(() -> survey.run(RunOptions.unlimited().withCancellationToken(token)))
            .isInstanceOf(SurveyInterruptedException.class);
        assertThat(deferredSource.prepared.get()).isEqualTo(1);
        assertThat(deferredSource.totalCleanups()).isEqualTo(1);
        assertThat(readySource.totalCleanups()).isEqualTo(readySource.prepared.get());
    }

    @Test
    void run_failingBeforeFirstRepo_closesOpenedStore() {
        AtomicBoolean featuresUnavailable = new AtomicBoolean();
        AtomicInteger opened = new AtomicInteger();
        AtomicInteger closed = new AtomicInteger();
        CompletionStoreFactory storeFactory = countingStores(SqliteCompletionStore.inMemoryFactory(), opened, closed);
        CodeSurvey survey = survey(CodeSurvey.builder()
            .source(new RecordingSource("s", orderedRepos("r1", files("a.py", "TODO")), false))
            .analyzer(new UnstableAnalyzer(featuresUnavailable))
            .storeFactory(storeFactory));
        featuresUnavailable.set(true);

        assertThatThrownBy(survey::run).isInstanceOf(IllegalStateException.class)
            .hasMessage("feature names unavailable");
        assertThat(opened).hasValue(1);
        assertThat(closed).hasValue(1);
    }

    @Test
    void run_failingSource_doesNotStopOtherRepos() {
        RecordingSource source = new RecordingSource("s", orderedRepos(
            "broken", files("a.py", "TODO"), "fine", files("b.py", "TODO")), true).failingOn("broken");
        CodeSurvey survey = survey(CodeSurvey.builder().source(source).analyzer(new RecordingAnalyzer("py")));

        SurveyRunSummary summary = survey.run();

        assertThat(summary.failureCount()).isEqualTo(1);
        assertThat(summary.completedRepoCount()).isEqualTo(1);
        assertThat(survey.getRepoFeatures(FeatureQuery.all()))
            .extracting(RepoFeature::repoKey)
            .containsOnly("fine");
    }

    @Test
    void run_withoutSavedFeatures_reanalyzesWithoutInflatingCounts() {
        CompletionStoreFactory storeFactory = SqliteCompletionStore.inMemoryFactory();
        Map<String, Map<String, String>> repos = Map.of("r1", files("a.py", "TODO TODO", "b.py", "FIXME"));
        RecordingAnalyzer analyzer = new RecordingAnalyzer("py");
        CodeSurvey first = CodeSurvey.builder()
            .source(new RecordingSource("s", repos, false)).analyzer(analyzer).storeFactory(storeFactory).build();
        CodeSurvey second = survey(CodeSurvey.builder()
            .source(new RecordingSource("s", repos, false)).analyzer(analyzer).storeFactory(storeFactory)
            .useSavedFeatures(false));

        first.run();
        List<RepoFeature> before = first.getRepoFeatures(FeatureQuery.all());
        SurveyRunSummary summary = second.run();

        assertThat(summary.completedCodeCount()).isEqualTo(2);
        assertThat(analyzer.analyzed).hasValue(4);
        assertThat(second.getRepoFeatures(FeatureQuery.all()))
            .extracting(RepoFeature::feature, RepoFeature::occurrenceCount, RepoFeature::codeTotalCount)
            .containsExactlyElementsOf(before.stream()
                .map(feature -> tuple(feature.feature(), feature.occurrenceCount(), feature.codeTotalCount()))
                .toList());
    }

    @Test
    void run_withoutSavingCodeFeatures_keepsOnlyRepoResults() {
        RecordingAnalyzer analyzer = new RecordingAnalyzer("py");
        CodeSurvey survey = survey(CodeSurvey.builder()
            .source(new RecordingSource("s", Map.of("r1", files("a.py", "TODO", "b.py", "TODO")), false))
            .analyzer(analyzer)
            .saveCodeFeatures(false));

        survey.run();
        SurveyRunSummary rerun = survey.run();

        assertThat(survey.getCodeFeatures(FeatureQuery.all())).isEmpty();
        assertThat(survey.getRepoFeatures(FeatureQuery.all().withFeatures(List.of("todo"))))
            .extracting(RepoFeature::occurrenceCount, RepoFeature::codeTotalCount)
            .containsExactly(tuple(2L, 2L));
        assertThat(rerun.completedCodeCount()).isZero();
        assertThat(analyzer.analyzed).hasValue(2);
    }

    @Test
    void run_manyUnits_neverExceedsMaxWorkers() {
        Map<String, String> manyFiles = new LinkedHashMap<>();
        for (int i = 0; i < 12; i++) {
            manyFiles.put("file" + i + ".py", "TODO");
        }
        RecordingAnalyzer analyzer = new RecordingAnalyzer("py").withHook(codeKey -> pause(20));
        CodeSurvey survey = survey(CodeSurvey.builder()
            .source(new RecordingSource("s", Map.of("r1", manyFiles), true))
            .analyzer(analyzer)
            .maxWorkers(2));

        SurveyRunSummary summary = survey.run();

        assertThat(summary.completedCodeCount()).isEqualTo(12);
        assertThat(analyzer.peakRunning.get()).isBetween(1, 2);
    }

    @Test
    void run_readyCodes_areRecordedWithoutWorkers() {
        CodeSurvey survey = survey(CodeSurvey.builder()
            .source(new RecordingSource("s", Map.of("r1", files("a.py", "")), false))
            .analyzer(new InlineAnalyzer()));

        SurveyRunSummary summary = survey.run();

        assertThat(summary.completedCodeCount()).isEqualTo(1);
        assertThat(summary.featureRepoCounts()).containsExactly(Map.entry("inline:marker", 1));
        assertThat(survey.getRepoFeatures(FeatureQuery.all()))
            .extracting(RepoFeature::analyzer, RepoFeature::feature, RepoFeature::occurrenceCount)
            .containsExactly(tuple("inline", "marker", 1L));
    }

    @Test
    void run_clearsRunIdFromMdc() {
        CodeSurvey survey = survey(CodeSurvey.builder()
            .source(new RecordingSource("s", Map.of("r1", files("a.py", "TODO")), false))
            .analyzer(new RecordingAnalyzer("py")));

        survey.run();

        assertThat(MDC.get(CodeSurvey.RUN_ID_MDC_KEY)).isNull();
    }

    @Test
    @SuppressWarnings("unchecked")
    void getSurveyTree_nestsResultsBySourceRepoAnalyzerAndCode() {
        CodeSurvey survey = survey(CodeSurvey.builder()
            .source(new RecordingSource("s", Map.of("r1", files("three.py", "# FIXME\n")), false))
            .analyzer(new RecordingAnalyzer("py")));
        survey.run();

        Map<String, Object> tree = survey.getSurveyTree(FeatureQuery.all());

        Map<String, Object> repo = path(tree, "sources", "s", "repos", "r1");
        assertThat((Map<String, Object>) repo.get("repo_metadata")).containsEntry("files", 1);
        Map<String, Object> analyzer = path(repo, "analyzers", "py");
        assertThat(path(analyzer, "features", "fixme"))
            .containsEntry("occurrence_count", 1L)
            .containsEntry("code_occurrence_count", 1L)
            .containsEntry("code_total_count", 1L)
            .containsKey("updated");
        assertThat(path(analyzer, "codes", "three.py", "features", "fixme"))
            .containsEntry("occurrence_count", 1)
            .containsKey("occurrences");
        assertThat(path(analyzer, "features", "todo")).containsEntry("occurrence_count", 0L);
    }

    @Test
    void build_duplicateSourceNames_throws() {
        CodeSurvey.Builder builder = CodeSurvey.builder()
            .source(new RecordingSource("same", Map.of(), false))
            .source(new RecordingSource("same", Map.of(), false))
            .analyzer(new RecordingAnalyzer("py"));

        assertThatThrownBy(builder::build)
            .isInstanceOf(SurveyConfigurationException.class)
            .hasMessageContaining("duplicate source names: same");
    }

    @Test
    void build_duplicateAnalyzerNames_throws() {
        CodeSurvey.Builder builder = CodeSurvey.builder()
            .source(new RecordingSource("s", Map.of(), false))
            .analyzer(new RecordingAnalyzer("py"))
            .analyzer(new RecordingAnalyzer("py"));

        assertThatThrownBy(builder::build)
            .isInstanceOf(SurveyConfigurationException.class)
            .hasMessageContaining("duplicate analyzer names: py");
    }

    @Test
    void build_withoutSources_throws() {
        assertThatThrownBy(() -> CodeSurvey.builder().analyzer(new RecordingAnalyzer("py")).build())
            .isInstanceOf(SurveyConfigurationException.class);
    }

    private static CompletionStoreFactory countingStores(CompletionStoreFactory delegate,
                                                         AtomicInteger opened, AtomicInteger closed) {
        return () -> {
            CompletionStore store = delegate.open();
            opened.incrementAndGet();
            return (CompletionStore) Proxy.newProxyInstance(CompletionStore.class.getClassLoader(),
                new Class<?>[] {CompletionStore.class}, (proxy, method, args) -> {
                    if (method.getName().equals("close")) {
                        closed.incrementAndGet();
                    }
                    try {
                        return method.invoke(store, args);
                    } catch (InvocationTargetException e) {
                        throw e.getCause();
                    }
                });
        };
    }

    /**
     * Analyzer whose feature names become unavailable once the flag is set.
     */
    private static final class UnstableAnalyzer implements Analyzer<String> {
        private final InlineAnalyzer delegate = new InlineAnalyzer();
        private final AtomicBoolean featuresUnavailable;

        UnstableAnalyzer(AtomicBoolean featuresUnavailable) {
            this.featuresUnavailable = featuresUnavailable;
        }

        @Override
        public String getName() {
            return "unstable";
        }

        @Override
        public List<String> getFeatureNames() {
            if (featuresUnavailable.get()) {
                throw new IllegalStateException("feature names unavailable");
            }
            return delegate.getFeatureNames();
        }

        @Override
        public Iterator<CodeCandidate> codeCandidates(Repo repo, CodeFeatureResolver resolver) {
            return delegate.codeCandidates(repo, resolver);
        }

        @Override
        public Code analyzeCode(Repo repo, String codeKey, List<String> features) {
            return delegate.analyzeCode(repo, codeKey, features);
        }
    }

    private CodeSurvey survey(CodeSurvey.Builder builder) {
        CodeSurvey survey = builder.build();
        surveys.add(survey);
        return survey;
    }

    private static Map<String, Map<String, String>> orderedRepos(Object... keyFilePairs) {
        Map<String, Map<String, String>> repos = new LinkedHashMap<>();
        for (int i = 0; i < keyFilePairs.length; i += 2) {
            @SuppressWarnings("unchecked")
            Map<String, String> repoFiles = (Map<String, String>) keyFilePairs[i + 1];
            repos.put((String) keyFilePairs[i], repoFiles);
        }
        return repos;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> path(Map<String, Object> node, String... keys) {
        Map<String, Object> current = node;
        for (String key : keys) {
            assertThat(current).containsKey(key);
            current = (Map<String, Object>) current.get(key);
        }
        return current;
    }

    private static void awaitLatch(CountDownLatch latch) {
        try {
            assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
