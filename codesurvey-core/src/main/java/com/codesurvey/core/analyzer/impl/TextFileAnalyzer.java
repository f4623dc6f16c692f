package com.codesurvey.core.analyzer.impl;

import com.codesurvey.core.analyzer.FeatureFinder;
import com.codesurvey.core.analyzer.FileAnalyzer;
import com.codesurvey.core.analyzer.FileInfo;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.util.List;
import java.util.function.Predicate;

/**
 * Analyzes files as plain text.
 *
 * <p>Pairs with {@link com.codesurvey.core.analyzer.FeatureFinders#regex(String, String)}
 * for language-agnostic pattern counting. Files that are not valid UTF-8 or cannot be
 * read are skipped.
 *
 * <pre>{@code
 * Analyzer<String> analyzer = new TextFileAnalyzer(
 *     List.of(FeatureFinders.regex("todo", "TODO")), "**}{@code /*.py", null, "python-text");
 * }</pre>
 */
public class TextFileAnalyzer extends FileAnalyzer<String> {

    public static final String DEFAULT_NAME = "text";
    public static final String DEFAULT_FILE_GLOB = "**";

    public TextFileAnalyzer(List<FeatureFinder<String>> featureFinders) {
        this(featureFinders, null, null, null);
    }

    public TextFileAnalyzer(List<FeatureFinder<String>> featureFinders, String fileGlob,
                            List<Predicate<FileInfo>> fileFilters, String name) {
        super(featureFinders, fileGlob, fileFilters, name);
    }

    @Override
    protected String getDefaultName() {
        return DEFAULT_NAME;
    }

    @Override
    protected String getDefaultFileGlob() {
        return DEFAULT_FILE_GLOB;
    }

    @Override
    protected String prepareFile(FileInfo fileInfo) {
        try {
            return Files.readString(fileInfo.absolutePath());
        } catch (CharacterCodingException e) {
            log.debug("Skipping non-UTF-8 file {} in repo {}", fileInfo.relativePath(), fileInfo.repo());
            return null;
        } catch (IOException e) {
            log.warn("Skipping unreadable file {} in repo {}: {}", fileInfo.relativePath(), fileInfo.repo(), e.getMessage());
            return null;
        }
    }
}
