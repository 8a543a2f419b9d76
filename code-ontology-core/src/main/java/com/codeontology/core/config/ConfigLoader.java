package com.codeontology.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Locates and reads {@code code-ontology.yaml}.
 *
 * <p>Loading never fails: a missing, unreadable, empty or malformed file yields
 * {@link ProjectConfig#defaults()} and a log message, so a syntax tree can always be built.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * // explicit file
 * ProjectConfig config = ConfigLoader.load(Paths.get("code-ontology.yaml"));
 *
 * // relative name, looked up next to the input first, then in the working directory
 * ProjectConfig config = ConfigLoader.loadFor(Paths.get("lib/my_app.ast.json"),
 *     Paths.get(ConfigLoader.DEFAULT_FILE_NAME));
 * }</pre>
 */
public final class ConfigLoader {

    /** File name looked up next to the analysed input. */
    public static final String DEFAULT_FILE_NAME = "code-ontology.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class - no instantiation
    }

    /**
     * Reads the configuration stored at {@code configPath}.
     *
     * @param configPath YAML file, may be null
     * @return parsed configuration, or defaults when the file is unusable
     */
    public static ProjectConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ProjectConfig.defaults();
        }
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ProjectConfig.defaults();
        }
        return read(configPath).orElseGet(ProjectConfig::defaults);
    }

    /**
     * Reads the configuration that applies to a syntax tree file.
     *
     * <p>An absolute {@code configPath} is used as is. A relative one is resolved against the
     * input's directory first and the working directory second. When neither exists the
     * defaults are returned without a warning, since most trees are built without a config.
     *
     * @param input syntax tree file being processed
     * @param configPath configured file name or path
     * @return configuration for the input
     */
    public static ProjectConfig loadFor(Path input, Path configPath) {
        Optional<Path> located = locate(input, configPath);
        if (located.isEmpty()) {
            log.debug("No {} found for {}. Using defaults.", configPath, input);
            return ProjectConfig.defaults();
        }
        return load(located.get());
    }

    /**
     * Finds the configuration file for an input.
     *
     * @param input syntax tree file, may be null
     * @param configPath configured file name or path
     * @return the first candidate that is a regular file
     */
    public static Optional<Path> locate(Path input, Path configPath) {
        if (configPath == null) {
            return Optional.empty();
        }
        List<Path> candidates = new ArrayList<>();
        Path inputDir = input != null ? input.toAbsolutePath().getParent() : null;
        if (!configPath.isAbsolute() && inputDir != null) {
            candidates.add(inputDir.resolve(configPath));
        }
        candidates.add(configPath);
        return candidates.stream().filter(Files::isRegularFile).findFirst();
    }

    private static Optional<ProjectConfig> read(Path configPath) {
        try {
            log.debug("Loading configuration from: {}", configPath);
            ProjectConfig config = YAML_MAPPER.readValue(configPath.toFile(), ProjectConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return Optional.empty();
            }
            log.info("Loaded configuration from: {}", configPath);
            return Optional.of(config);
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return Optional.empty();
        }
    }
}
