package com.codesurvey.core.source.impl;

import com.codesurvey.core.source.AbstractSource;
import com.codesurvey.core.source.Repo;
import com.codesurvey.core.source.RepoCandidate;
import com.codesurvey.core.util.FileUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Creates a single repository in a temporary directory from a map of relative file
 * paths to file contents.
 *
 * <p>Only use with trusted paths: they are not checked for absolute or parent
 * directory navigation. The temporary directory is deleted on cleanup.
 */
public class TestSource extends AbstractSource {

    public static final String DEFAULT_NAME = "test";

    private final Map<String, String> pathToContent;

    public TestSource(Map<String, String> pathToContent) {
        this(pathToContent, null);
    }

    /**
     * @param pathToContent relative paths and contents of files to create
     * @param name source name, or {@code null} for {@value #DEFAULT_NAME}
     */
    public TestSource(Map<String, String> pathToContent, String name) {
        super(name);
        this.pathToContent = new LinkedHashMap<>(pathToContent);
    }

    @Override
    protected String getDefaultName() {
        return DEFAULT_NAME;
    }

    @Override
    public Repo fetchRepo(String repoKey) {
        Path directory = Path.of(repoKey);
        return repo(repoKey, directory, () -> FileUtils.deleteRecursively(directory), null);
    }

    @Override
    public Iterator<RepoCandidate> repoCandidates() {
        return new Iterator<>() {
            private boolean created;

            @Override
            public boolean hasNext() {
                return !created;
            }

            @Override
            public RepoCandidate next() {
                if (created) {
                    throw new NoSuchElementException();
                }
                created = true;
                return createRepo();
            }
        };
    }

    /**
     * Writes the configured files into a fresh temporary directory.
     *
     * @return repository backed by the new directory
     */
    public Repo createRepo() {
        Path directory = FileUtils.createTempDirectory("codesurvey-test-");
        try {
            for (Map.Entry<String, String> entry : pathToContent.entrySet()) {
                Path file = directory.resolve(entry.getKey());
                Files.createDirectories(file.getParent());
                Files.writeString(file, entry.getValue());
            }
        } catch (IOException e) {
            FileUtils.deleteRecursively(directory);
            throw new UncheckedIOException("Failed to create test repository files", e);
        }
        return fetchRepo(directory.toString());
    }
}
