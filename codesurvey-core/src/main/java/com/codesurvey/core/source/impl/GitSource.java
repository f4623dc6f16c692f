package com.codesurvey.core.source.impl;

import com.codesurvey.core.exception.SurveyConfigurationException;
import com.codesurvey.core.source.AbstractSource;
import com.codesurvey.core.source.Repo;
import com.codesurvey.core.source.RepoCandidate;
import com.codesurvey.core.source.SourceException;
import com.codesurvey.core.util.FileUtils;

import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;

/**
 * Source of repositories from remote Git URLs.
 *
 * <p>Each URL becomes a {@link com.codesurvey.core.source.RepoThunk} that clones the
 * repository into a temporary directory on a worker thread. The directory is deleted
 * when the repository is cleaned up.
 *
 * <pre>{@code
 * Source source = new GitSource(List.of("https://github.com/example/project"));
 * }</pre>
 */
public class GitSource extends AbstractSource {

    public static final String DEFAULT_NAME = "git";

    /** Shallow clones keep downloads small. */
    public static final int DEFAULT_CLONE_DEPTH = 1;

    private final List<String> repoUrls;
    private final int cloneDepth;

    public GitSource(List<String> repoUrls) {
        this(repoUrls, null, DEFAULT_CLONE_DEPTH);
    }

    /**
     * @param repoUrls URLs of remote repositories
     * @param name source name, or {@code null} for {@value #DEFAULT_NAME}
     * @param cloneDepth history depth to clone, {@code 0} for full history
     */
    public GitSource(List<String> repoUrls, String name, int cloneDepth) {
        super(name);
        if (cloneDepth < 0) {
            throw new SurveyConfigurationException("cloneDepth must not be negative: " + cloneDepth);
        }
        this.repoUrls = List.copyOf(repoUrls);
        this.cloneDepth = cloneDepth;
    }

    @Override
    protected String getDefaultName() {
        return DEFAULT_NAME;
    }

    @Override
    public Repo fetchRepo(String repoKey) {
        Path directory;
        try {
            directory = GitCloner.cloneToTempDirectory(repoKey, cloneDepth);
        } catch (SourceException e) {
            throw new SourceException("Source " + this + " failed to clone: " + e.getMessage(), e);
        }
        return repo(repoKey, directory, () -> FileUtils.deleteRecursively(directory), null);
    }

    @Override
    public Iterator<RepoCandidate> repoCandidates() {
        Iterator<String> urls = repoUrls.iterator();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return urls.hasNext();
            }

            @Override
            public RepoCandidate next() {
                String url = urls.next();
                return repoThunk(url, () -> fetchRepo(url));
            }
        };
    }
}
