package com.distindex.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading DistIndex configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code distindex.yaml} into an {@link IndexConfig}
 * record. If the file is missing, unreadable, empty or invalid, returns
 * {@link IndexConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * IndexConfig config = ConfigLoader.load(Paths.get("distindex.yaml"));
 * PipelineSettings settings = config.settings();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Default configuration file name.
     */
    public static final String DEFAULT_FILE_NAME = "distindex.yaml";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code distindex.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static IndexConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return IndexConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return IndexConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            IndexConfig config = YAML_MAPPER.readValue(configPath.toFile(), IndexConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return IndexConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return IndexConfig.defaults();
        }
    }
}
