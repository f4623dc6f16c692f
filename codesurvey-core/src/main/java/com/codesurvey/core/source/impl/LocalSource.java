package com.codesurvey.core.source.impl;

import com.codesurvey.core.source.AbstractSource;
import com.codesurvey.core.source.Repo;
import com.codesurvey.core.source.RepoCandidate;
import com.codesurvey.core.source.SourceException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

/**
 * Source of repositories from local filesystem directories.
 *
 * <p>Each configured directory is one repository keyed by the path as given. The
 * directories are analyzed in place and never deleted.
 *
 * <pre>{@code
 * Source source = new LocalSource(List.of("path/to/project-a", "path/to/project-b"));
 * }</pre>
 */
public class LocalSource extends AbstractSource {

    public static final String DEFAULT_NAME = "local";

    private final List<String> directories;

    public LocalSource(List<String> directories) {
        this(directories, null);
    }

    /**
     * @param directories paths to the local directory of each repository
     * @param name source name, or {@code null} for {@value #DEFAULT_NAME}
     */
    public LocalSource(List<String> directories, String name) {
        super(name);
        this.directories = List.copyOf(directories);
    }

    @Override
    protected String getDefaultName() {
        return DEFAULT_NAME;
    }

    @Override
    public Repo fetchRepo(String repoKey) {
        Path path = Path.of(repoKey);
        if (!Files.isDirectory(path)) {
            throw new SourceException("Source " + this + " cannot find directory: " + repoKey);
        }
        return repo(repoKey, path);
    }

    @Override
    public Iterator<RepoCandidate> repoCandidates() {
        Iterator<String> keys = directories.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return keys.hasNext();
            }

            @Override
            public RepoCandidate next() {
                return fetchRepo(keys.next());
            }
        };
    }
}
