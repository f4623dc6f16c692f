package com.codesurvey.cli;

import com.codesurvey.core.config.ConfigLoader;
import com.codesurvey.core.config.SurveyConfig;
import com.codesurvey.core.config.SurveyFactory;
import com.codesurvey.core.exception.SurveyException;
import com.codesurvey.core.store.FeatureQuery;
import com.codesurvey.core.store.RepoFeature;
import com.codesurvey.core.survey.CodeSurvey;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to print stored survey results as JSON.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Repository-level results of one analyzer
 * codesurvey report -c codesurvey.yaml --analyzer python-text
 *
 * # Nested tree including file-level results
 * codesurvey report -c codesurvey.yaml --tree
 * }</pre>
 */
@Command(
    name = "report",
    description = "Print stored survey results as JSON",
    mixinStandardHelpOptions = true
)
public class ReportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReportCommand.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file, or directory holding codesurvey.yaml (default: codesurvey.yaml)"
    )
    private Path configPath = Path.of(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"--tree"}, description = "Print a nested tree including file-level results")
    private boolean tree;

    @Option(names = {"--source"}, description = "Only include these sources")
    private List<String> sources;

    @Option(names = {"--repo"}, description = "Only include these repository keys")
    private List<String> repos;

    @Option(names = {"--analyzer"}, description = "Only include these analyzers")
    private List<String> analyzers;

    @Option(names = {"--feature"}, description = "Only include these features")
    private List<String> features;

    private PrintStream out = System.out;

    @Override
    public Integer call() {
        SurveyConfig config = ConfigLoader.load(configPath);
        if (config.database() == null) {
            log.error("No database configured in {}", configPath);
            System.err.println("✗ No database configured in " + configPath);
            return RunCommand.EXIT_CONFIGURATION;
        }

        FeatureQuery query = new FeatureQuery(sources, repos, analyzers, features);
        try (CodeSurvey survey = SurveyFactory.create(config)) {
            Object report = tree
                ? survey.getSurveyTree(query)
                : survey.getRepoFeatures(query).stream().map(ReportCommand::toMap).toList();
            out.println(JSON_MAPPER.writeValueAsString(report));
            return 0;
        } catch (SurveyException | JsonProcessingException e) {
            log.error("Report failed", e);
            System.err.println("✗ Report failed: " + e.getMessage());
            return RunCommand.EXIT_FAILURE;
        }
    }

    private static Map<String, Object> toMap(RepoFeature feature) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("source", feature.source());
        map.put("repo", feature.repoKey());
        map.put("analyzer", feature.analyzer());
        map.put("feature", feature.feature());
        map.put("occurrence_count", feature.occurrenceCount());
        map.put("code_occurrence_count", feature.codeOccurrenceCount());
        map.put("code_total_count", feature.codeTotalCount());
        map.put("updated", feature.updated().toString());
        map.put("repo_metadata", feature.repoMetadata());
        return map;
    }

    void setOut(PrintStream out) {
        this.out = out;
    }
}
