package com.codesurvey.core.source;

import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * A task to be run on a worker thread to prepare a {@link Repo}.
 *
 * <p>The task must only use state captured when the thunk was created.
 *
 * @param source source the repository is provided by
 * @param key key unique within the source
 * @param thunk computation that prepares and returns the repository
 */
public record RepoThunk(Source source, String key, Callable<Repo> thunk) implements RepoCandidate {

    public RepoThunk {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(thunk, "thunk must not be null");
    }

    @Override
    public String toString() {
        return label();
    }
}
