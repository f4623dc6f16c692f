package com.codesurvey.core.analyzer;

import com.codesurvey.core.source.Repo;
import com.codesurvey.core.source.impl.TestSource;
import com.codesurvey.core.util.FileUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Predicate;

/**
 * Base class for analyzers whose unit of code is a single file.
 *
 * <p>Files are found with a glob relative to the repository directory; any file for
 * which an exclusion filter returns {@code true} is left out. Every remaining file with
 * outstanding features becomes a {@link CodeThunk}.
 *
 * @param <T> code representation type
 */
public abstract class FileAnalyzer<T> extends AbstractAnalyzer<T> {

    private final String fileGlob;
    private final List<Predicate<FileInfo>> fileFilters;

    /**
     * @param featureFinders finders applied to each file
     * @param fileGlob glob for files to analyze, or {@code null} for {@link #getDefaultFileGlob()}
     * @param fileFilters exclusion filters, or {@code null} for none
     * @param name analyzer name, or {@code null} for the default
     */
    protected FileAnalyzer(List<FeatureFinder<T>> featureFinders, String fileGlob,
                           List<Predicate<FileInfo>> fileFilters, String name) {
        super(featureFinders, name);
        this.fileGlob = fileGlob != null ? fileGlob : getDefaultFileGlob();
        this.fileFilters = fileFilters != null ? List.copyOf(fileFilters) : List.of();
    }

    protected abstract String getDefaultFileGlob();

    /**
     * Prepares the representation of a file.
     *
     * @param fileInfo file to read
     * @return code representation, or {@code null} to skip the file
     */
    protected abstract T prepareFile(FileInfo fileInfo);

    public String getFileGlob() {
        return fileGlob;
    }

    @Override
    protected T prepareCode(Repo repo, String codeKey) {
        return prepareFile(new FileInfo(repo, codeKey));
    }

    @Override
    public Iterator<CodeCandidate> codeCandidates(Repo repo, CodeFeatureResolver resolver) {
        Iterator<String> fileKeys = findFileKeys(repo).iterator();

        return new Iterator<>() {
            private CodeCandidate nextCandidate;

            @Override
            public boolean hasNext() {
                while (nextCandidate == null && fileKeys.hasNext()) {
                    String fileKey = fileKeys.next();
                    List<String> features = List.copyOf(resolver.outstandingFeatures(fileKey));
                    if (!features.isEmpty()) {
                        nextCandidate = new CodeThunk(FileAnalyzer.this, repo, fileKey, features,
                            () -> analyzeCode(repo, fileKey, features));
                    }
                }
                return nextCandidate != null;
            }

            @Override
            public CodeCandidate next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                CodeCandidate candidate = nextCandidate;
                nextCandidate = null;
                return candidate;
            }
        };
    }

    private List<String> findFileKeys(Repo repo) {
        List<Path> files;
        try {
            files = FileUtils.findFiles(repo.path(), fileGlob);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list files of repo " + repo, e);
        }
        return files.stream()
            .map(file -> new FileInfo(repo, repo.path().relativize(file).toString()))
            .filter(fileInfo -> fileFilters.stream().noneMatch(filter -> filter.test(fileInfo)))
            .map(FileInfo::relativePath)
            .toList();
    }

    /**
     * Analyzes a code snippet written to a temporary file.
     *
     * @param snippet file content
     * @param fileName name of the temporary file (must match {@link #getFileGlob()} for realistic results)
     * @return outcome for every feature of this analyzer
     */
    public Map<String, Feature> test(String snippet, String fileName) {
        Repo repo = new TestSource(Map.of(fileName, snippet)).createRepo();
        try {
            return analyzeCode(repo, fileName, getFeatureNames()).features();
        } finally {
            repo.cleanup();
        }
    }
}
