package com.codesurvey.core.source.impl;

import com.codesurvey.core.source.SourceException;
import com.codesurvey.core.util.FileUtils;
import org.eclipse.jgit.api.CloneCommand;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Clones remote Git repositories into temporary directories with JGit.
 */
final class GitCloner {

    private static final Logger log = LoggerFactory.getLogger(GitCloner.class);

    private GitCloner() {
        // Utility class
    }

    /**
     * Clones a repository into a new temporary directory.
     *
     * <p>On failure the directory is removed before the exception propagates.
     *
     * @param cloneUrl URL (or local path) of the repository to clone
     * @param depth history depth, or {@code 0} for a full clone
     * @return directory holding the working tree
     * @throws SourceException if the clone fails
     */
    static Path cloneToTempDirectory(String cloneUrl, int depth) {
        Path destination = FileUtils.createTempDirectory("codesurvey-git-");
        log.debug("Cloning {} into {}", cloneUrl, destination);

        CloneCommand command = Git.cloneRepository()
            .setURI(cloneUrl)
            .setDirectory(destination.toFile());
        if (depth > 0) {
            command.setDepth(depth);
        }

        try (Git ignored = command.call()) {
            return destination;
        } catch (GitAPIException | RuntimeException e) {
            FileUtils.deleteRecursively(destination);
            throw new SourceException("Failed to Git clone \"" + cloneUrl + "\": " + e.getMessage(), e);
        }
    }
}
