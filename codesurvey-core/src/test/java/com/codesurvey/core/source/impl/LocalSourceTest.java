package com.codesurvey.core.source.impl;

import com.codesurvey.core.source.Repo;
import com.codesurvey.core.source.RepoCandidate;
import com.codesurvey.core.source.SourceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void repoCandidates_yieldsImmediateReposKeyedByPath() throws IOException {
        Path first = Files.createDirectory(tempDir.resolve("first"));
        Path second = Files.createDirectory(tempDir.resolve("second"));
        LocalSource source = new LocalSource(List.of(first.toString(), second.toString()));

        List<RepoCandidate> candidates = new ArrayList<>();
        source.repoCandidates().forEachRemaining(candidates::add);

        assertThat(candidates).hasSize(2).allMatch(candidate -> candidate instanceof Repo);
        Repo repo = (Repo) candidates.get(0);
        assertThat(repo.key()).isEqualTo(first.toString());
        assertThat(repo.path()).isEqualTo(first);
        assertThat(repo.label()).isEqualTo("local:" + first);
    }

    @Test
    void fetchRepo_missingDirectory_throwsSourceException() {
        LocalSource source = new LocalSource(List.of(), "mine");

        assertThatThrownBy(() -> source.fetchRepo(tempDir.resolve("missing").toString()))
            .isInstanceOf(SourceException.class)
            .hasMessageContaining("mine");
    }

    @Test
    void cleanup_leavesLocalDirectoryInPlace() throws IOException {
        Path directory = Files.createDirectory(tempDir.resolve("project"));
        Repo repo = new LocalSource(List.of(directory.toString())).fetchRepo(directory.toString());

        repo.cleanup();

        assertThat(repo.isCleanedUp()).isTrue();
        assertThat(directory).isDirectory();
    }
}
