package com.codesurvey.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            database: "survey.sqlite3"
            maxWorkers: 4
            maxRepos: 20
            saveOccurrences: false

            sources:
              - type: github-sample
                language: python
                maxKb: 50000
                authTokenEnv: GITHUB_TOKEN
              - type: local
                name: my-projects
                paths: ["/code/a", "/code/b"]

            analyzers:
              - type: text
                name: python-text
                fileGlob: "**/*.py"
                exclude: ["**/test_*.py"]
                features:
                  - name: for
                    regex: "\\\\bfor\\\\b"
                  - name: while
                    regex: "\\\\bwhile\\\\b"
                  - name: loop
                    union: [for, while]
            """);

        SurveyConfig config = ConfigLoader.load(configFile);

        assertThat(config.database()).isEqualTo(tempDir.toAbsolutePath().resolve("survey.sqlite3").toString());
        assertThat(config.maxWorkers()).isEqualTo(4);
        assertThat(config.maxRepos()).isEqualTo(20);
        assertThat(config.maxCodes()).isNull();
        assertThat(config.saveOccurrences()).isFalse();
        assertThat(config.continueOnFailure()).isTrue();
        assertThat(config.sources()).extracting(SurveyConfig.SourceConfig::type)
            .containsExactly("github-sample", "local");
        assertThat(config.sources().get(0).maxKb()).isEqualTo(50000);
        assertThat(config.sources().get(1).paths()).containsExactly("/code/a", "/code/b");
        SurveyConfig.AnalyzerConfig analyzer = config.analyzers().get(0);
        assertThat(analyzer.fileGlob()).isEqualTo("**/*.py");
        assertThat(analyzer.exclude()).containsExactly("**/test_*.py");
        assertThat(analyzer.features()).extracting(SurveyConfig.FeatureConfig::name)
            .containsExactly("for", "while", "loop");
        assertThat(analyzer.features().get(0).regex()).isEqualTo("\\bfor\\b");
        assertThat(analyzer.features().get(2).union()).containsExactly("for", "while");
    }

    @Test
    void load_minimalYaml_appliesDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, """
            maxCodes: 100
            unknownSetting: ignored
            """);

        SurveyConfig config = ConfigLoader.load(configFile);

        assertThat(config.maxCodes()).isEqualTo(100);
        assertThat(config.database()).isNull();
        assertThat(config.useSavedFeatures()).isTrue();
        assertThat(config.saveCodeFeatures()).isTrue();
        assertThat(config.sources()).isEmpty();
        assertThat(config.analyzers()).isEmpty();
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        SurveyConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(SurveyConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "invalid: yaml: syntax: [[[");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(SurveyConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(SurveyConfig.defaults());
    }

    @Test
    void load_directoryWithoutConfig_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(SurveyConfig.defaults());
    }

    @Test
    void load_directory_findsYmlFile() throws IOException {
        Files.writeString(tempDir.resolve("codesurvey.yml"), "maxRepos: 3\n");

        assertThat(ConfigLoader.load(tempDir).maxRepos()).isEqualTo(3);
    }

    @Test
    void load_directory_prefersYamlOverYml() throws IOException {
        Files.writeString(tempDir.resolve("codesurvey.yml"), "maxRepos: 3\n");
        Files.writeString(tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME), "maxRepos: 5\n");

        assertThat(ConfigLoader.load(tempDir).maxRepos()).isEqualTo(5);
    }

    @Test
    void load_absoluteDatabase_keptAsIs() throws IOException {
        Path database = tempDir.resolve("elsewhere").resolve("results.sqlite3").toAbsolutePath();
        Path configFile = tempDir.resolve(ConfigLoader.DEFAULT_FILE_NAME);
        Files.writeString(configFile, "database: '" + database + "'\n");

        assertThat(ConfigLoader.load(configFile).database()).isEqualTo(database.toString());
    }

    @Test
    void load_relativeDatabase_resolvedAgainstConfigDirectory() throws IOException {
        Path nested = Files.createDirectories(tempDir.resolve("surveys"));
        Files.writeString(nested.resolve(ConfigLoader.DEFAULT_FILE_NAME), "database: data/../results.sqlite3\n");

        SurveyConfig config = ConfigLoader.load(nested);

        assertThat(config.database()).isEqualTo(nested.toAbsolutePath().resolve("results.sqlite3").toString());
    }
}
