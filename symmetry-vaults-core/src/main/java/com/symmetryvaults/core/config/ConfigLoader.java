package com.symmetryvaults.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading engine configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code symmetry-vaults.yaml} into {@link EngineConfig}.
 * If the file is missing or invalid, returns {@link EngineConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * EngineConfig config = ConfigLoader.load(Paths.get("symmetry-vaults.yaml"));
 * SearchLimits limits = config.searchLimits();
 * }</pre>
 */
public class ConfigLoader {

    /**
     * Configuration file looked up in the working directory when none is given.
     */
    public static final String DEFAULT_FILE_NAME = "symmetry-vaults.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link EngineConfig#defaults()}.
     *
     * @param configPath path to {@code symmetry-vaults.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static EngineConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return EngineConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return EngineConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            EngineConfig config = YAML_MAPPER.readValue(configPath.toFile(), EngineConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return EngineConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return EngineConfig.defaults();
        }
    }

    /**
     * Loads the given file, or the default file from the working directory when
     * {@code configPath} is null. The default file is optional.
     *
     * @param configPath explicit configuration file, may be null
     * @return loaded configuration or defaults
     */
    public static EngineConfig loadOrDefaults(Path configPath) {
        if (configPath != null) {
            return load(configPath);
        }
        Path defaultPath = Path.of(DEFAULT_FILE_NAME);
        if (Files.exists(defaultPath)) {
            return load(defaultPath);
        }
        log.debug("No {} in working directory. Using defaults.", DEFAULT_FILE_NAME);
        return EngineConfig.defaults();
    }
}
