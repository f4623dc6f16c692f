package com.codesurvey.core.config;

import com.codesurvey.core.analyzer.Analyzer;
import com.codesurvey.core.analyzer.FeatureFinder;
import com.codesurvey.core.analyzer.FeatureFinders;
import com.codesurvey.core.analyzer.FileInfo;
import com.codesurvey.core.analyzer.impl.TextFileAnalyzer;
import com.codesurvey.core.exception.SurveyConfigurationException;
import com.codesurvey.core.source.Source;
import com.codesurvey.core.source.impl.GitSource;
import com.codesurvey.core.source.impl.GithubSampleSource;
import com.codesurvey.core.source.impl.LocalSource;
import com.codesurvey.core.survey.CodeSurvey;
import com.codesurvey.core.survey.RunOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Builds a {@link CodeSurvey} from a {@link SurveyConfig}.
 *
 * <p>Source types: {@code local}, {@code git}, {@code github-sample}. Analyzer types:
 * {@code text}. Unknown types and incomplete entries raise a
 * {@link SurveyConfigurationException}.
 */
public final class SurveyFactory {

    private static final Logger log = LoggerFactory.getLogger(SurveyFactory.class);

    private SurveyFactory() {
        // Utility class
    }

    /**
     * @param config survey configuration
     * @return configured survey
     * @throws SurveyConfigurationException if the configuration is invalid
     */
    public static CodeSurvey create(SurveyConfig config) {
        CodeSurvey.Builder builder = CodeSurvey.builder()
            .sources(config.sources().stream().map(SurveyFactory::createSource).toList())
            .analyzers(config.analyzers().stream().map(SurveyFactory::createAnalyzer).toList())
            .continueOnFailure(config.continueOnFailure())
            .saveCodeFeatures(config.saveCodeFeatures())
            .saveOccurrences(config.saveOccurrences())
            .useSavedFeatures(config.useSavedFeatures());
        if (config.database() != null) {
            builder.databasePath(Path.of(config.database()));
        }
        if (config.maxWorkers() != null) {
            builder.maxWorkers(config.maxWorkers());
        }
        return builder.build();
    }

    /**
     * @return run limits configured in the file
     */
    public static RunOptions runOptions(SurveyConfig config) {
        return new RunOptions(config.maxRepos(), config.maxCodes(), null);
    }

    static Source createSource(SurveyConfig.SourceConfig config) {
        String type = required(config.type(), "Source type").toLowerCase(Locale.ROOT);
        return switch (type) {
            case "local" -> new LocalSource(required(config.paths(), "Local source paths"), config.name());
            case "git" -> new GitSource(required(config.urls(), "Git source urls"), config.name(),
                config.cloneDepth() != null ? config.cloneDepth() : GitSource.DEFAULT_CLONE_DEPTH);
            case "github-sample" -> new GithubSampleSource(githubSettings(config), config.name());
            default -> throw new SurveyConfigurationException("Unknown source type: " + config.type());
        };
    }

    private static GithubSampleSource.Settings githubSettings(SurveyConfig.SourceConfig config) {
        String token = null;
        if (config.authTokenEnv() != null) {
            token = System.getenv(config.authTokenEnv());
            if (token == null) {
                log.warn("Environment variable {} is not set, searching GitHub without authentication",
                    config.authTokenEnv());
            }
        }
        return new GithubSampleSource.Settings(config.searchQuery(), config.language(), config.maxKb(),
            config.sort(), config.authUsername(), token, config.randomSeed());
    }

    static Analyzer<?> createAnalyzer(SurveyConfig.AnalyzerConfig config) {
        String type = required(config.type(), "Analyzer type").toLowerCase(Locale.ROOT);
        if (!type.equals("text")) {
            throw new SurveyConfigurationException("Unknown analyzer type: " + config.type());
        }
        List<Predicate<FileInfo>> filters = config.exclude().stream().map(SurveyFactory::excludeFilter).toList();
        return new TextFileAnalyzer(createFeatureFinders(config), config.fileGlob(), filters, config.name());
    }

    private static List<FeatureFinder<String>> createFeatureFinders(SurveyConfig.AnalyzerConfig config) {
        Map<String, FeatureFinder<String>> defined = new LinkedHashMap<>();
        List<FeatureFinder<String>> finders = new ArrayList<>();
        for (SurveyConfig.FeatureConfig feature : config.features()) {
            String name = required(feature.name(), "Feature name");
            FeatureFinder<String> finder;
            if (feature.regex() != null) {
                finder = FeatureFinders.regex(name, feature.regex());
            } else if (feature.union() != null) {
                finder = FeatureFinders.union(name, feature.union().stream()
                    .map(member -> lookup(defined, member, name))
                    .toList());
            } else {
                throw new SurveyConfigurationException("Feature " + name + " needs either a regex or a union");
            }
            defined.putIfAbsent(name, finder);
            finders.add(finder);
        }
        return finders;
    }

    private static FeatureFinder<String> lookup(Map<String, FeatureFinder<String>> defined, String member,
                                                String unionName) {
        FeatureFinder<String> finder = defined.get(member);
        if (finder == null) {
            throw new SurveyConfigurationException("Union feature " + unionName
                + " refers to undefined feature " + member);
        }
        return finder;
    }

    private static Predicate<FileInfo> excludeFilter(String glob) {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        return fileInfo -> matcher.matches(Path.of(fileInfo.relativePath()));
    }

    private static <T> T required(T value, String what) {
        if (value == null) {
            throw new SurveyConfigurationException(what + " is required");
        }
        return value;
    }
}
