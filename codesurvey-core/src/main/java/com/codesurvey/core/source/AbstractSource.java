package com.codesurvey.core.source;

import com.codesurvey.core.util.Names;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Base class for sources providing the name, a logger, and helpers for creating
 * {@link Repo} and {@link RepoThunk} instances owned by this source.
 */
public abstract class AbstractSource implements Source {

    protected final Logger log;

    private final String name;

    /**
     * @param name source name, or {@code null} to use {@link #getDefaultName()}
     */
    protected AbstractSource(String name) {
        this.log = LoggerFactory.getLogger(getClass());
        this.name = Names.requireName(name != null ? name : getDefaultName(), "Source");
    }

    /**
     * Returns the name used when none is configured.
     *
     * @return default name for sources of this type
     */
    protected abstract String getDefaultName();

    @Override
    public String getName() {
        return name;
    }

    protected Repo repo(String key, Path path) {
        return new Repo(this, key, path, null, null);
    }

    protected Repo repo(String key, Path path, Runnable cleanup, Map<String, Object> metadata) {
        return new Repo(this, key, path, cleanup, metadata);
    }

    protected RepoThunk repoThunk(String key, Callable<Repo> thunk) {
        return new RepoThunk(this, key, thunk);
    }

    @Override
    public String toString() {
        return name;
    }
}
