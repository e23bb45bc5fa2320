package com.furiflow.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads project settings from {@code furiflow.yaml}.
 *
 * <p>Settings are optional. Whenever the file cannot supply them the generator
 * falls back to {@link ProjectConfig#defaults()}, so callers never see an
 * exception from here.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProjectConfig config = ConfigLoader.load(Path.of(ConfigLoader.DEFAULT_FILE_NAME));
 * Path outputDir = Path.of(config.output().directory());
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    public static final String DEFAULT_FILE_NAME = "furiflow.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads project settings.
     *
     * @param configPath settings file, usually {@value #DEFAULT_FILE_NAME}
     * @return settings from the file, or defaults
     */
    public static ProjectConfig load(Path configPath) {
        return read(configPath).orElseGet(ProjectConfig::defaults);
    }

    private static Optional<ProjectConfig> read(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("No project settings at {}, using built-in defaults", configPath);
            return Optional.empty();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Cannot read project settings {}, using built-in defaults", configPath);
            return Optional.empty();
        }

        ProjectConfig config;
        try {
            config = YAML_MAPPER.readValue(configPath.toFile(), ProjectConfig.class);
        } catch (IOException e) {
            log.error("Invalid project settings in {}: {}. Using built-in defaults", configPath, e.getMessage());
            return Optional.empty();
        }
        if (config == null) {
            log.warn("Project settings file {} is empty, using built-in defaults", configPath);
            return Optional.empty();
        }
        log.info("Project settings: catalog={}, output={}, validation={}",
            config.catalog() != null ? config.catalog() : "<bundled>",
            config.output().directory(),
            config.validation().enabled() ? "on" : "off");
        return Optional.of(config);
    }
}
