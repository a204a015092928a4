package com.autodoc.core.config;

import com.autodoc.core.analyzer.classify.ClassRule;
import com.autodoc.core.analyzer.classify.FunctionRule;
import com.autodoc.core.analyzer.classify.RuleTable;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration for an analysis run.
 *
 * <p>Loaded from {@code autodoc.yaml}. Every section and every field is optional; missing
 * values fall back to the defaults documented on each field.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * analysis:
 *   include: ["src/**"]
 *   exclude: ["src/legacy/**"]
 *   workers: 4
 *
 * flow:
 *   maxDepth: 5
 *
 * classification:
 *   functionRules:
 *     - target: name
 *       match: prefix
 *       patterns: [handle_]
 *       category: processor
 * }</pre>
 *
 * @param analysis file selection and per-file limits
 * @param flow flow chain inference limits
 * @param classification optional replacement rule tables
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalyzerConfig(
    @JsonProperty("analysis") AnalysisSettings analysis,
    @JsonProperty("flow") FlowSettings flow,
    @JsonProperty("classification") ClassificationSettings classification
) {
    public AnalyzerConfig {
        analysis = analysis != null ? analysis : AnalysisSettings.defaults();
        flow = flow != null ? flow : FlowSettings.defaults();
        classification = classification != null ? classification : ClassificationSettings.defaults();
    }

    /**
     * Creates the default configuration: every {@code .py}/{@code .pyw} file outside the
     * usual tool and environment directories, one worker per processor.
     *
     * @return default configuration
     */
    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(AnalysisSettings.defaults(), FlowSettings.defaults(), ClassificationSettings.defaults());
    }

    /**
     * File selection and per-file limits.
     *
     * @param include glob patterns a file must match (default: every file)
     * @param exclude glob patterns that drop a file (default none)
     * @param excludedDirectories directory names that are never walked
     * @param sourceExtensions extension allow-list, with leading dot (default {@code .py}, {@code .pyw})
     * @param workers size of the per-file worker pool (default available processors)
     * @param maxFileBytes larger files are skipped (default 1 MiB)
     * @param highComplexityThreshold complexity above which a function is reported (default 10)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisSettings(
        @JsonProperty("include") List<String> include,
        @JsonProperty("exclude") List<String> exclude,
        @JsonProperty("excludedDirectories") List<String> excludedDirectories,
        @JsonProperty("sourceExtensions") List<String> sourceExtensions,
        @JsonProperty("workers") Integer workers,
        @JsonProperty("maxFileBytes") Long maxFileBytes,
        @JsonProperty("highComplexityThreshold") Integer highComplexityThreshold
    ) {
        public static final List<String> DEFAULT_EXCLUDED_DIRECTORIES = List.of(
            "venv", ".venv", "env", ".env", "__pycache__", ".git", "node_modules",
            "site-packages", "build", "dist", ".tox");

        public AnalysisSettings {
            include = include != null && !include.isEmpty() ? List.copyOf(include) : List.of("**/*");
            exclude = exclude != null ? List.copyOf(exclude) : List.of();
            excludedDirectories = excludedDirectories != null
                ? List.copyOf(excludedDirectories) : DEFAULT_EXCLUDED_DIRECTORIES;
            sourceExtensions = sourceExtensions != null && !sourceExtensions.isEmpty()
                ? sourceExtensions.stream().map(ext -> ext.startsWith(".") ? ext : "." + ext).toList()
                : List.of(".py", ".pyw");
            workers = workers != null && workers > 0 ? workers : Runtime.getRuntime().availableProcessors();
            maxFileBytes = maxFileBytes != null && maxFileBytes > 0 ? maxFileBytes : 1024L * 1024L;
            highComplexityThreshold = highComplexityThreshold != null && highComplexityThreshold > 0
                ? highComplexityThreshold : 10;
        }

        public static AnalysisSettings defaults() {
            return new AnalysisSettings(null, null, null, null, null, null, null);
        }
    }

    /**
     * Limits for flow chain inference.
     *
     * @param maxDepth maximum number of edges followed from an entry point (default 4, at least 2)
     * @param maxChainsPerEntry maximum chains emitted per entry point (default 10)
     * @param maxChains maximum chains emitted per run (default 200)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FlowSettings(
        @JsonProperty("maxDepth") Integer maxDepth,
        @JsonProperty("maxChainsPerEntry") Integer maxChainsPerEntry,
        @JsonProperty("maxChains") Integer maxChains
    ) {
        public static final int MIN_MAX_DEPTH = 2;

        public FlowSettings {
            maxDepth = maxDepth != null ? Math.max(maxDepth, MIN_MAX_DEPTH) : 4;
            maxChainsPerEntry = maxChainsPerEntry != null && maxChainsPerEntry > 0 ? maxChainsPerEntry : 10;
            maxChains = maxChains != null && maxChains > 0 ? maxChains : 200;
        }

        public static FlowSettings defaults() {
            return new FlowSettings(null, null, null);
        }
    }

    /**
     * Replacement rule tables. An empty list keeps the built-in table for that kind.
     *
     * @param functionRules ordered function rules
     * @param classRules ordered class rules
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ClassificationSettings(
        @JsonProperty("functionRules") List<FunctionRule> functionRules,
        @JsonProperty("classRules") List<ClassRule> classRules
    ) {
        public ClassificationSettings {
            functionRules = functionRules != null ? List.copyOf(functionRules) : List.of();
            classRules = classRules != null ? List.copyOf(classRules) : List.of();
        }

        public static ClassificationSettings defaults() {
            return new ClassificationSettings(List.of(), List.of());
        }

        /**
         * Builds the effective rule table.
         *
         * @return configured rules, falling back to the built-in tables
         */
        public RuleTable toRuleTable() {
            return RuleTable.withOverrides(functionRules, classRules);
        }
    }
}
