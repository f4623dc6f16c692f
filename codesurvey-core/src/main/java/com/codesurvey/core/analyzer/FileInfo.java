package com.codesurvey.core.analyzer;

import com.codesurvey.core.source.Repo;

import java.nio.file.Path;

/**
 * Identifies a source file within a repository.
 *
 * @param repo repository the file belongs to
 * @param relativePath path relative to the repository directory, used as the unit key
 */
public record FileInfo(Repo repo, String relativePath) {

    public Path absolutePath() {
        return repo.path().resolve(relativePath);
    }
}
