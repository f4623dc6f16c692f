package com.codesurvey.core.survey;

import com.codesurvey.core.analyzer.Analyzer;
import com.codesurvey.core.analyzer.Code;
import com.codesurvey.core.analyzer.CodeCandidate;
import com.codesurvey.core.analyzer.CodeThunk;
import com.codesurvey.core.source.Repo;
import com.codesurvey.core.source.RepoCandidate;
import com.codesurvey.core.source.RepoThunk;
import com.codesurvey.core.store.CompletionStore;
import com.codesurvey.core.store.FeatureQuery;
import com.codesurvey.core.store.RepoFeature;
import org.slf4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Drives one run of a {@link CodeSurvey}: admits repositories from the feed, streams
 * their units into the scheduler, completes repositories whose units are all done, and
 * unwinds everything when the run ends or fails.
 *
 * <p>All state below is owned by the coordinating thread.
 */
final class SurveyRunner {

    private final CodeSurvey survey;
    private final RunOptions options;
    private final CompletionStore store;
    private final Logger log;
    private final FailureHandler failureHandler;
    private final JobScheduler scheduler;
    private final RepoFeed feed;

    private final Map<Repo, RepoAnalysis> inFlight = new LinkedHashMap<>();
    private final Map<String, Integer> featureRepoCounts = new TreeMap<>();
    private boolean feedStopped;
    private int completedRepoCount;
    private int completedCodeCount;

    SurveyRunner(CodeSurvey survey, RunOptions options, CompletionStore store, Logger log) {
        this.survey = survey;
        this.options = options;
        this.store = store;
        this.log = log;
        this.failureHandler = new FailureHandler(survey.isContinueOnFailure(), log);
        this.feed = new RepoFeed(survey.getSources(), survey.getAnalyzerFeatures(), store,
            survey.isUseSavedFeatures(), this::isInFlight, failureHandler, options.cancellationToken(), log);
        this.scheduler = new JobScheduler(survey.getMaxWorkers(), log);
    }

    /**
     * Runs until the feed is exhausted or a cap is reached and no job is pending.
     *
     * <p>However the loop ends, pending jobs are cancelled, the worker pool is stopped,
     * in-flight repositories are cleaned up and the store is closed, in that order.
     */
    SurveyRunSummary run() {
        try {
            while (true) {
                admitWork();
                if (scheduler.pendingCount() == 0) {
                    break;
                }
                scheduler.awaitAndDispatch(options.cancellationToken());
            }
            log.info("Survey finished: {} repos and {} codes completed, {} failures",
                completedRepoCount, completedCodeCount, failureHandler.getFailureCount());
            return new SurveyRunSummary(completedRepoCount, completedCodeCount,
                failureHandler.getFailureCount(), featureRepoCounts);
        } finally {
            unwind();
        }
    }

    private void admitWork() {
        options.cancellationToken().throwIfCancelled();

        for (RepoAnalysis analysis : new ArrayList<>(inFlight.values())) {
            advance(analysis);
        }
        completeFinishedRepos();

        while (scheduler.hasCapacity() && !feedStopped) {
            if (repoCapReached() || codeCapReached()) {
                break;
            }
            Optional<RepoFeed.Entry> entry = feed.next();
            if (entry.isEmpty()) {
                log.debug("All sources are exhausted");
                feedStopped = true;
                break;
            }
            admitRepo(entry.get());
        }
        completeFinishedRepos();
    }

    private boolean isInFlight(RepoCandidate candidate) {
        String label = candidate.label();
        return scheduler.hasPendingSubject(JobKind.REPO, label)
            || inFlight.keySet().stream().anyMatch(repo -> repo.label().equals(label));
    }

    private boolean repoCapReached() {
        Integer maxRepos = options.maxRepos();
        if (maxRepos == null) {
            return false;
        }
        int admitted = completedRepoCount + scheduler.pendingCount(JobKind.REPO) + inFlight.size();
        return admitted >= maxRepos;
    }

    private boolean codeCapReached() {
        return options.maxCodes() != null && completedCodeCount >= options.maxCodes();
    }

    /**
     * @return true if every remaining unit slot under the code cap is taken by a pending job
     */
    private boolean codeSlotsTaken() {
        return options.maxCodes() != null
            && completedCodeCount + scheduler.pendingCount(JobKind.CODE) >= options.maxCodes();
    }

    private void admitRepo(RepoFeed.Entry entry) {
        RepoCandidate candidate = entry.candidate();
        String sourceName = candidate.source().getName();
        List<String> features = entry.features().entrySet().stream()
            .flatMap(e -> e.getValue().stream().map(feature -> e.getKey() + ":" + feature))
            .toList();
        Work<Repo> work = candidate instanceof RepoThunk thunk
            ? Work.deferred(thunk.thunk())
            : Work.ready((Repo) candidate);
        scheduler.admit(new Job<>(JobKind.REPO, sourceName, candidate.label(), null, features, work,
            outcome -> handleRepo(outcome, entry)));
    }

    private void handleRepo(JobOutcome<Repo> outcome, RepoFeed.Entry entry) {
        RepoCandidate candidate = entry.candidate();
        if (outcome.isFailure()) {
            failureHandler.handle("Failed to prepare repo " + candidate.label()
                + " from source " + candidate.source().getName(), outcome.failure());
            return;
        }
        Repo repo = outcome.value();
        log.info("Starting analysis of repo {}", repo);
        RepoAnalysis analysis = new RepoAnalysis(repo, entry.features());
        inFlight.put(repo, analysis);

        String sourceName = repo.source().getName();
        store.recordRepoMetadata(sourceName, repo.key(), repo.metadata());
        if (!survey.isUseSavedFeatures()) {
            store.discardRepoResults(sourceName, repo.key(), entry.features());
        }
        advance(analysis);
        completeIfFinished(analysis);
    }

    /**
     * Feeds the repository's units into the scheduler until it is full, the code cap is
     * reached or the units are exhausted.
     */
    private void advance(RepoAnalysis analysis) {
        while (!analysis.streamsDone && scheduler.hasCapacity()) {
            if (codeCapReached()) {
                log.info("Reached limit of {} codes, stopping analysis of repo {}", options.maxCodes(), analysis.repo);
                analysis.finishStreams();
                return;
            }
            if (codeSlotsTaken()) {
                return;
            }
            CodeCandidate candidate;
            try {
                candidate = analysis.nextCandidate();
            } catch (RuntimeException e) {
                String analyzerName = analysis.currentAnalyzer == null ? "?" : analysis.currentAnalyzer.getName();
                analysis.skipCurrentAnalyzer();
                failureHandler.handle("Failed to analyze repo " + analysis.repo + " with analyzer " + analyzerName, e);
                continue;
            }
            if (candidate != null) {
                admitCode(analysis, candidate);
            }
        }
    }

    private void admitCode(RepoAnalysis analysis, CodeCandidate candidate) {
        List<String> features;
        Work<Code> work;
        if (candidate instanceof CodeThunk thunk) {
            features = thunk.features();
            work = Work.deferred(thunk.thunk());
        } else {
            Code code = (Code) candidate;
            features = List.copyOf(code.features().keySet());
            work = Work.ready(code);
        }
        scheduler.admit(new Job<>(JobKind.CODE, candidate.analyzer().getName(), candidate.toString(),
            analysis.repo, features, work, outcome -> handleCode(outcome)));
    }

    private void handleCode(JobOutcome<Code> outcome) {
        Job<Code> job = outcome.job();
        if (outcome.isFailure()) {
            failureHandler.handle("Failed to analyze code " + job.subject()
                + " with analyzer " + job.owner(), outcome.failure());
            return;
        }
        if (codeCapReached()) {
            log.debug("Discarding result of {} after reaching the code limit", job.subject());
            return;
        }
        Code code = outcome.value();
        List<String> missing = job.features().stream().filter(f -> !code.features().containsKey(f)).toList();
        if (!missing.isEmpty()) {
            failureHandler.handle("Analysis of code " + job.subject() + " is missing features " + missing,
                new IllegalStateException("Analyzer " + job.owner() + " did not return features " + missing));
            return;
        }
        Repo repo = code.repo();
        store.recordUnitResult(repo.source().getName(), repo.key(), code.analyzer().getName(), code.key(),
            code.features(), survey.isSaveOccurrences());
        completedCodeCount++;
        log.debug("Completed code {}", code);
    }

    private void completeFinishedRepos() {
        for (RepoAnalysis analysis : new ArrayList<>(inFlight.values())) {
            completeIfFinished(analysis);
        }
    }

    private void completeIfFinished(RepoAnalysis analysis) {
        if (analysis.streamsDone && inFlight.get(analysis.repo) == analysis
            && !scheduler.hasPendingJobs(analysis.repo)) {
            completeRepo(analysis.repo);
        }
    }

    private void completeRepo(Repo repo) {
        String sourceName = repo.source().getName();
        store.aggregateAndPersist(sourceName, repo.key(), !survey.isSaveCodeFeatures());
        completedRepoCount++;
        for (RepoFeature feature : store.queryRepoAggregates(FeatureQuery.forRepo(sourceName, repo.key()))) {
            if (feature.occurrenceCount() > 0) {
                featureRepoCounts.merge(feature.analyzer() + ":" + feature.feature(), 1, Integer::sum);
            }
        }
        cleanup(repo);
        inFlight.remove(repo);
        log.info("Completed repo {}", repo);
    }

    private void cleanup(Repo repo) {
        try {
            repo.cleanup();
        } catch (RuntimeException e) {
            log.warn("Failed to clean up repo {}: {}", repo, e.getMessage(), e);
        }
    }

    private void unwind() {
        scheduler.cancelPending();
        scheduler.shutdownNow();
        if (!inFlight.isEmpty()) {
            log.info("Cleaning up {} repos still in flight", inFlight.size());
        }
        inFlight.keySet().forEach(this::cleanup);
        inFlight.clear();
        try {
            store.close();
        } catch (RuntimeException e) {
            log.error("Failed to close completion store", e);
        }
    }

    /**
     * Progress of the analyzers over one in-flight repository. Unit streams are opened one
     * analyzer at a time and consumed lazily.
     */
    private final class RepoAnalysis {
        private final Repo repo;
        private final Map<String, List<String>> features;
        private final Deque<Analyzer<?>> remainingAnalyzers;
        private Analyzer<?> currentAnalyzer;
        private Iterator<CodeCandidate> currentStream;
        private boolean streamsDone;

        RepoAnalysis(Repo repo, Map<String, List<String>> features) {
            this.repo = repo;
            this.features = features;
            this.remainingAnalyzers = new ArrayDeque<>(survey.getAnalyzers());
        }

        /**
         * @return next unit, or {@code null} once every analyzer's stream is exhausted
         */
        CodeCandidate nextCandidate() {
            while (true) {
                if (currentStream != null && currentStream.hasNext()) {
                    return currentStream.next();
                }
                currentStream = null;
                currentAnalyzer = remainingAnalyzers.poll();
                if (currentAnalyzer == null) {
                    streamsDone = true;
                    return null;
                }
                List<String> analyzerFeatures = features.getOrDefault(currentAnalyzer.getName(), List.of());
                if (analyzerFeatures.isEmpty()) {
                    log.info("Skipping analyzer {} for repo {} as all features have already been analyzed",
                        currentAnalyzer.getName(), repo);
                    continue;
                }
                String analyzerName = currentAnalyzer.getName();
                String sourceName = repo.source().getName();
                currentStream = currentAnalyzer.codeCandidates(repo, codeKey ->
                    store.outstandingUnitFeatures(sourceName, repo.key(), analyzerName, codeKey, analyzerFeatures));
            }
        }

        void skipCurrentAnalyzer() {
            currentStream = null;
            currentAnalyzer = null;
        }

        void finishStreams() {
            remainingAnalyzers.clear();
            currentStream = null;
            currentAnalyzer = null;
            streamsDone = true;
        }
    }
}
