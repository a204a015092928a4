package com.autodoc.core.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading analyzer configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code autodoc.yaml} into {@link AnalyzerConfig} records.
 * If the config file is missing or invalid, returns {@link AnalyzerConfig#defaults()}.
 * Numeric limits outside their valid range are replaced, with a warning naming the value used.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * AnalyzerConfig config = ConfigLoader.load(projectRoot.resolve(ConfigLoader.DEFAULT_FILE_NAME));
 * AnalysisResult result = new SourceAnalyzer(config).analyze(projectRoot);
 * }</pre>
 */
public class ConfigLoader {

    /** Conventional configuration file name in a project root. */
    public static final String DEFAULT_FILE_NAME = "autodoc.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link AnalyzerConfig#defaults()}.
     *
     * @param configPath path to {@code autodoc.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static AnalyzerConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return AnalyzerConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return AnalyzerConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            JsonNode tree = YAML_MAPPER.readTree(configPath.toFile());
            if (tree == null || tree.isMissingNode() || tree.isNull()) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return AnalyzerConfig.defaults();
            }
            AnalyzerConfig config = YAML_MAPPER.treeToValue(tree, AnalyzerConfig.class);
            warnOnAdjustedLimits(tree, config);
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return AnalyzerConfig.defaults();
        }
    }

    private static void warnOnAdjustedLimits(JsonNode tree, AnalyzerConfig config) {
        warnIfAdjusted(tree, "analysis", "workers", config.analysis().workers());
        warnIfAdjusted(tree, "analysis", "maxFileBytes", config.analysis().maxFileBytes());
        warnIfAdjusted(tree, "analysis", "highComplexityThreshold", config.analysis().highComplexityThreshold());
        warnIfAdjusted(tree, "flow", "maxDepth", config.flow().maxDepth());
        warnIfAdjusted(tree, "flow", "maxChainsPerEntry", config.flow().maxChainsPerEntry());
        warnIfAdjusted(tree, "flow", "maxChains", config.flow().maxChains());
    }

    private static void warnIfAdjusted(JsonNode tree, String section, String field, Number effective) {
        JsonNode configured = tree.path(section).path(field);
        if (configured.isNumber() && configured.longValue() != effective.longValue()) {
            log.warn("Configured {}.{} = {} is out of range. Using {}.", section, field, configured.asText(), effective);
        }
    }

    /**
     * Loads {@code autodoc.yaml} from a project root, or returns defaults if not found.
     *
     * @param projectRoot project root directory
     * @return loaded configuration or defaults
     */
    public static AnalyzerConfig loadFromRoot(Path projectRoot) {
        return load(projectRoot.resolve(DEFAULT_FILE_NAME));
    }
}
