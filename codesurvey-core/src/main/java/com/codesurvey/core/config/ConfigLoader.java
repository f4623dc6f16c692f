package com.codesurvey.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Utility for loading survey configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code codesurvey.yaml} into {@link SurveyConfig} records.
 * The path may name the file itself or the directory holding it ({@code codesurvey.yaml},
 * then {@code codesurvey.yml}). A relative {@code database} is resolved against the
 * directory of the configuration file, so results land in the same place wherever the
 * survey is started from. A missing, unreadable or invalid file yields
 * {@link SurveyConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SurveyConfig config = ConfigLoader.load(Path.of("surveys/python"));
 * CodeSurvey survey = SurveyFactory.create(config);
 * }</pre>
 */
public final class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "codesurvey.yaml";

    private static final List<String> FILE_NAMES = List.of(DEFAULT_FILE_NAME, "codesurvey.yml");

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file or from the configuration file in a directory.
     *
     * @param configPath configuration file, or directory containing one
     * @return loaded configuration, or defaults if none could be read
     */
    public static SurveyConfig load(Path configPath) {
        Optional<Path> configFile = locate(configPath);
        if (configFile.isEmpty()) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return SurveyConfig.defaults();
        }
        return read(configFile.get())
            .map(config -> resolveDatabase(config, configFile.get()))
            .orElseGet(SurveyConfig::defaults);
    }

    private static Optional<Path> locate(Path configPath) {
        if (!Files.isDirectory(configPath)) {
            return Files.exists(configPath) ? Optional.of(configPath) : Optional.empty();
        }
        return FILE_NAMES.stream()
            .map(configPath::resolve)
            .filter(Files::exists)
            .findFirst();
    }

    private static Optional<SurveyConfig> read(Path configFile) {
        if (!Files.isRegularFile(configFile) || !Files.isReadable(configFile)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configFile);
            return Optional.empty();
        }
        try {
            log.debug("Loading configuration from: {}", configFile);
            SurveyConfig config = YAML_MAPPER.readValue(configFile.toFile(), SurveyConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configFile);
                return Optional.empty();
            }
            log.info("Loaded {} sources and {} analyzers from: {}",
                config.sources().size(), config.analyzers().size(), configFile);
            return Optional.of(config);
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configFile, e.getMessage());
            return Optional.empty();
        }
    }

    private static SurveyConfig resolveDatabase(SurveyConfig config, Path configFile) {
        if (config.database() == null || Path.of(config.database()).isAbsolute()) {
            return config;
        }
        Path database = configFile.toAbsolutePath().getParent().resolve(config.database()).normalize();
        log.debug("Resolved database {} to {}", config.database(), database);
        return config.withDatabase(database.toString());
    }
}
