package com.codesurvey.core.survey;

import com.codesurvey.core.analyzer.Feature;
import com.codesurvey.core.exception.SurveyInterruptedException;
import com.codesurvey.core.source.AbstractSource;
import com.codesurvey.core.source.Repo;
import com.codesurvey.core.source.RepoCandidate;
import com.codesurvey.core.source.Source;
import com.codesurvey.core.store.CompletionStore;
import com.codesurvey.core.store.CompletionStoreFactory;
import com.codesurvey.core.store.SqliteCompletionStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RepoFeed}.
 */
class RepoFeedTest {

    private static final Logger log = LoggerFactory.getLogger(RepoFeedTest.class);
    private static final Map<String, List<String>> FEATURES = Map.of("text", List.of("todo", "fixme"));

    private CompletionStoreFactory storeFactory;
    private CompletionStore store;
    private final CancellationToken token = new CancellationToken();

    @BeforeEach
    void openStore() {
        storeFactory = SqliteCompletionStore.inMemoryFactory();
        store = storeFactory.open();
    }

    @AfterEach
    void closeStore() {
        store.close();
        storeFactory.close();
    }

    @Test
    void next_roundRobinsSourcesUntilAllAreExhausted() {
        RepoFeed feed = feed(List.of(new KeySource("a", "a1", "a2", "a3"), new KeySource("b", "b1")), c -> false);

        assertThat(drain(feed)).containsExactly("a:a1", "b:b1", "a:a2", "a:a3");
        assertThat(feed.isExhausted()).isTrue();
    }

    @Test
    void next_failingSource_isSkippedForOneTurnOnly() {
        FailureHandler failureHandler = new FailureHandler(true, log);
        KeySource flaky = new KeySource("f", "f1").failingOnce();
        RepoFeed feed = new RepoFeed(List.of(flaky, new KeySource("a", "a1", "a2")), FEATURES, store, true,
            c -> false, failureHandler, token, log);

        assertThat(drain(feed)).containsExactly("a:a1", "f:f1", "a:a2");
        assertThat(failureHandler.getFailureCount()).isEqualTo(1);
    }

    @Test
    void next_failingSourceInStrictMode_rethrows() {
        RepoFeed feed = new RepoFeed(List.of(new KeySource("f", "f1").failingOnce()), FEATURES, store, true,
            c -> false, new FailureHandler(false, log), token, log);

        assertThatThrownBy(feed::next).isInstanceOf(IllegalStateException.class).hasMessage("source failure");
    }

    @Test
    void next_candidateInFlight_isSkipped() {
        RepoFeed feed = feed(List.of(new KeySource("a", "a1", "a2")), c -> c.key().equals("a1"));

        assertThat(drain(feed)).containsExactly("a:a2");
    }

    @Test
    void next_fullyAnalyzedCandidate_isSkipped() {
        store.recordUnitResult("a", "a1", "text", "x.py", Map.of("todo", Feature.none(), "fixme", Feature.none()), true);
        store.aggregateAndPersist("a", "a1", false);
        store.recordUnitResult("a", "a2", "text", "x.py", Map.of("todo", Feature.none()), true);
        store.aggregateAndPersist("a", "a2", false);

        RepoFeed feed = feed(List.of(new KeySource("a", "a1", "a2")), c -> false);

        RepoFeed.Entry entry = feed.next().orElseThrow();
        assertThat(entry.candidate().key()).isEqualTo("a2");
        assertThat(entry.features()).containsOnly(Map.entry("text", List.of("fixme")));
        assertThat(feed.next()).isEmpty();
    }

    @Test
    void next_withoutSavedFeatures_requestsEverything() {
        store.recordUnitResult("a", "a1", "text", "x.py", Map.of("todo", Feature.none(), "fixme", Feature.none()), true);
        store.aggregateAndPersist("a", "a1", false);
        RepoFeed feed = new RepoFeed(List.of(new KeySource("a", "a1")), FEATURES, store, false,
            c -> false, new FailureHandler(true, log), token, log);

        assertThat(feed.next().orElseThrow().features()).isEqualTo(FEATURES);
    }

    @Test
    void next_cancelledToken_throws() {
        RepoFeed feed = feed(List.of(new KeySource("a", "a1")), c -> false);
        token.cancel();

        assertThatThrownBy(feed::next).isInstanceOf(SurveyInterruptedException.class);
    }

    private RepoFeed feed(List<Source> sources, Predicate<RepoCandidate> inFlight) {
        return new RepoFeed(sources, FEATURES, store, true, inFlight, new FailureHandler(true, log), token, log);
    }

    private static List<String> drain(RepoFeed feed) {
        List<String> labels = new ArrayList<>();
        Optional<RepoFeed.Entry> entry;
        while ((entry = feed.next()).isPresent()) {
            labels.add(entry.get().candidate().label());
        }
        return labels;
    }

    /**
     * Source yielding repositories for fixed keys, optionally failing on its first turn.
     */
    private static final class KeySource extends AbstractSource {
        private final List<String> keys;
        private boolean failNext;

        KeySource(String name, String... keys) {
            super(name);
            this.keys = List.of(keys);
        }

        KeySource failingOnce() {
            failNext = true;
            return this;
        }

        @Override
        protected String getDefaultName() {
            return "keys";
        }

        @Override
        public Repo fetchRepo(String repoKey) {
            return repo(repoKey, Path.of(repoKey));
        }

        @Override
        public Iterator<RepoCandidate> repoCandidates() {
            Iterator<String> iterator = keys.iterator();
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return iterator.hasNext();
                }

                @Override
                public RepoCandidate next() {
                    if (failNext) {
                        failNext = false;
                        throw new IllegalStateException("source failure");
                    }
                    return repoThunk(iterator.next(), () -> fetchRepo("unused"));
                }
            };
        }
    }
}
