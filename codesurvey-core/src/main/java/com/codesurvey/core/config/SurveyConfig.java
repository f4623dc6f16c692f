package com.codesurvey.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration of a survey, loaded from {@code codesurvey.yaml}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * database: "survey.sqlite3"
 * maxWorkers: 4
 * maxRepos: 20
 *
 * sources:
 *   - type: github-sample
 *     language: python
 *     maxKb: 50000
 *     authUsername: octocat
 *     authTokenEnv: GITHUB_TOKEN
 *   - type: local
 *     name: my-projects
 *     paths: ["/code/project-a", "/code/project-b"]
 *
 * analyzers:
 *   - type: text
 *     name: python-text
 *     fileGlob: "**}{@code /*.py"
 *     exclude: ["**}{@code /test_*.py"]
 *     features:
 *       - name: for
 *         regex: "\\bfor\\b"
 *       - name: while
 *         regex: "\\bwhile\\b"
 *       - name: loop
 *         union: [for, while]
 * }</pre>
 *
 * @param database SQLite database file, or {@code null} to keep results in memory
 * @param maxWorkers worker count, or {@code null} for the number of processors
 * @param maxRepos repository limit per run, or {@code null} for none
 * @param maxCodes unit limit per run, or {@code null} for none
 * @param continueOnFailure log and skip failures instead of halting (default true)
 * @param saveCodeFeatures keep unit-level results after aggregation (default true)
 * @param saveOccurrences store occurrence records of unit results (default true)
 * @param useSavedFeatures skip work recorded by earlier runs (default true)
 * @param sources source configurations
 * @param analyzers analyzer configurations
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SurveyConfig(
    @JsonProperty("database") String database,
    @JsonProperty("maxWorkers") Integer maxWorkers,
    @JsonProperty("maxRepos") Integer maxRepos,
    @JsonProperty("maxCodes") Integer maxCodes,
    @JsonProperty("continueOnFailure") Boolean continueOnFailure,
    @JsonProperty("saveCodeFeatures") Boolean saveCodeFeatures,
    @JsonProperty("saveOccurrences") Boolean saveOccurrences,
    @JsonProperty("useSavedFeatures") Boolean useSavedFeatures,
    @JsonProperty("sources") List<SourceConfig> sources,
    @JsonProperty("analyzers") List<AnalyzerConfig> analyzers
) {
    public SurveyConfig {
        if (continueOnFailure == null) {
            continueOnFailure = true;
        }
        if (saveCodeFeatures == null) {
            saveCodeFeatures = true;
        }
        if (saveOccurrences == null) {
            saveOccurrences = true;
        }
        if (useSavedFeatures == null) {
            useSavedFeatures = true;
        }
        sources = sources == null ? List.of() : List.copyOf(sources);
        analyzers = analyzers == null ? List.of() : List.copyOf(analyzers);
    }

    /**
     * Creates an empty configuration with in-memory storage and no sources or analyzers.
     *
     * @return default configuration
     */
    public static SurveyConfig defaults() {
        return new SurveyConfig(null, null, null, null, null, null, null, null, List.of(), List.of());
    }

    public SurveyConfig withDatabase(String database) {
        return new SurveyConfig(database, maxWorkers, maxRepos, maxCodes, continueOnFailure, saveCodeFeatures,
            saveOccurrences, useSavedFeatures, sources, analyzers);
    }

    /**
     * Source configuration. Which fields apply depends on the type.
     *
     * @param type {@code local}, {@code git} or {@code github-sample}
     * @param name source name, or {@code null} for the type's default
     * @param paths repository directories ({@code local})
     * @param urls repository clone URLs ({@code git})
     * @param cloneDepth clone depth, 0 for full history ({@code git})
     * @param searchQuery free-text search ({@code github-sample})
     * @param language language constraint ({@code github-sample})
     * @param maxKb repository size limit ({@code github-sample})
     * @param sort search sort order ({@code github-sample})
     * @param randomSeed page sampling seed ({@code github-sample})
     * @param authUsername GitHub username ({@code github-sample})
     * @param authTokenEnv environment variable holding the GitHub token ({@code github-sample})
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SourceConfig(
        @JsonProperty("type") String type,
        @JsonProperty("name") String name,
        @JsonProperty("paths") List<String> paths,
        @JsonProperty("urls") List<String> urls,
        @JsonProperty("cloneDepth") Integer cloneDepth,
        @JsonProperty("searchQuery") String searchQuery,
        @JsonProperty("language") String language,
        @JsonProperty("maxKb") Integer maxKb,
        @JsonProperty("sort") String sort,
        @JsonProperty("randomSeed") Long randomSeed,
        @JsonProperty("authUsername") String authUsername,
        @JsonProperty("authTokenEnv") String authTokenEnv
    ) {}

    /**
     * Analyzer configuration.
     *
     * @param type analyzer type, currently only {@code text}
     * @param name analyzer name, or {@code null} for the type's default
     * @param fileGlob files to analyze, relative to the repository directory
     * @param exclude globs of files to leave out
     * @param features feature definitions
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalyzerConfig(
        @JsonProperty("type") String type,
        @JsonProperty("name") String name,
        @JsonProperty("fileGlob") String fileGlob,
        @JsonProperty("exclude") List<String> exclude,
        @JsonProperty("features") List<FeatureConfig> features
    ) {
        public AnalyzerConfig {
            exclude = exclude == null ? List.of() : List.copyOf(exclude);
            features = features == null ? List.of() : List.copyOf(features);
        }
    }

    /**
     * Feature definition: either a regular expression or a union of features defined
     * earlier in the same analyzer.
     *
     * @param name feature name
     * @param regex regular expression, one occurrence per match
     * @param union names of the features to combine
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FeatureConfig(
        @JsonProperty("name") String name,
        @JsonProperty("regex") String regex,
        @JsonProperty("union") List<String> union
    ) {}
}
