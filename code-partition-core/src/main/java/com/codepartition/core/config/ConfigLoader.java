package com.codepartition.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading partition configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code codepartition.yaml} into {@link PartitionConfig} records.
 * If the config file is missing or cannot be parsed, returns {@link PartitionConfig#defaults()}.
 * Semantic validation is left to {@link PartitionConfig#validate()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PartitionConfig config = ConfigLoader.load(repositoryRoot.resolve(ConfigLoader.DEFAULT_FILE_NAME));
 * config.validate();
 * }</pre>
 */
public class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "codepartition.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist, logs a warning and returns defaults. If it can't be
     * parsed, logs an error and returns defaults.
     *
     * @param configPath path to {@code codepartition.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static PartitionConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return PartitionConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return PartitionConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            PartitionConfig config = YAML_MAPPER.readValue(configPath.toFile(), PartitionConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return PartitionConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return PartitionConfig.defaults();
        }
    }

    /**
     * Parses configuration from YAML text without any fallback.
     *
     * @param yaml YAML document
     * @return parsed configuration
     * @throws IOException if the document is malformed
     */
    public static PartitionConfig parse(String yaml) throws IOException {
        PartitionConfig config = YAML_MAPPER.readValue(yaml, PartitionConfig.class);
        return config == null ? PartitionConfig.defaults() : config;
    }
}
