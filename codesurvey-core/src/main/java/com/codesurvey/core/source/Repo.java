package com.codesurvey.core.source;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A repository of code that is accessible in a local directory in order to be analyzed.
 *
 * <p>Equality is identity-based: two handles for the same key are distinct units of
 * work. The cleanup action runs at most once no matter how often {@link #cleanup()}
 * is called.
 */
public final class Repo implements RepoCandidate {

    private final Source source;
    private final String key;
    private final Path path;
    private final Runnable cleanupAction;
    private final Map<String, Object> metadata;
    private boolean cleanedUp;

    /**
     * @param source source providing the repository
     * @param key key unique within the source
     * @param path local directory holding the repository
     * @param cleanupAction action run once analysis has finished, may be {@code null}
     * @param metadata additional properties reported by the source, may be {@code null}
     */
    public Repo(Source source, String key, Path path, Runnable cleanupAction, Map<String, Object> metadata) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.cleanupAction = cleanupAction != null ? cleanupAction : () -> { };
        this.metadata = metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    @Override
    public Source source() {
        return source;
    }

    @Override
    public String key() {
        return key;
    }

    public Path path() {
        return path;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    /**
     * Runs the cleanup action if it has not run yet.
     */
    public synchronized void cleanup() {
        if (cleanedUp) {
            return;
        }
        cleanedUp = true;
        cleanupAction.run();
    }

    public synchronized boolean isCleanedUp() {
        return cleanedUp;
    }

    @Override
    public String toString() {
        return label();
    }
}
