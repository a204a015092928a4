package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics collected during an analysis run.
 *
 * <p>Gives transparency into how many files were parsed on the fast path, how many needed
 * the slower full-context parse, and why files failed.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * AnalysisStatistics stats = new AnalysisStatistics.Builder()
 *     .filesDiscovered(12)
 *     .incrementFilesAnalyzed()
 *     .incrementFilesParsedSuccessfully()
 *     .build();
 * }</pre>
 *
 * @param filesDiscovered files handed to the analyzer
 * @param filesAnalyzed files with an allow-listed extension that were examined
 * @param filesParsedSuccessfully files parsed with the fast prediction mode
 * @param filesParsedWithFallback files that needed full-context prediction
 * @param filesFailed files that could not be decoded or parsed
 * @param filesSkipped files skipped because of their extension
 * @param errorCounts map of error types to their occurrence counts
 * @param topErrors first error messages (max 10)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisStatistics(
    int filesDiscovered,
    int filesAnalyzed,
    int filesParsedSuccessfully,
    int filesParsedWithFallback,
    int filesFailed,
    int filesSkipped,
    Map<String, Integer> errorCounts,
    List<String> topErrors
) {
    private static final int MAX_TOP_ERRORS = 10;

    /**
     * Compact constructor with validation and defaults.
     */
    public AnalysisStatistics {
        filesDiscovered = Math.max(0, filesDiscovered);
        filesAnalyzed = Math.max(0, filesAnalyzed);
        filesParsedSuccessfully = Math.max(0, filesParsedSuccessfully);
        filesParsedWithFallback = Math.max(0, filesParsedWithFallback);
        filesFailed = Math.max(0, filesFailed);
        filesSkipped = Math.max(0, filesSkipped);
        errorCounts = errorCounts != null ? Map.copyOf(errorCounts) : Map.of();
        topErrors = topErrors != null ? List.copyOf(topErrors) : List.of();
    }

    /**
     * Creates an empty statistics instance (no files processed).
     *
     * @return empty statistics
     */
    public static AnalysisStatistics empty() {
        return new AnalysisStatistics(0, 0, 0, 0, 0, 0, Map.of(), List.of());
    }

    /**
     * Calculates the share of analyzed files that parsed, on either path.
     *
     * @return parse rate as percentage (0.0 to 100.0), or 0 if no files were analyzed
     */
    public double parseRate() {
        if (filesAnalyzed == 0) {
            return 0.0;
        }
        return ((filesParsedSuccessfully + filesParsedWithFallback) * 100.0) / filesAnalyzed;
    }

    /**
     * Returns true if any file failed to parse.
     *
     * @return true if at least one file failed
     */
    public boolean hasFailures() {
        return filesFailed > 0;
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    public String summary() {
        return String.format(
            "Discovered: %d, Analyzed: %d, Parsed: %d, Fallback: %d, Failed: %d, Skipped: %d (%.1f%% parsed)",
            filesDiscovered,
            filesAnalyzed,
            filesParsedSuccessfully,
            filesParsedWithFallback,
            filesFailed,
            filesSkipped,
            parseRate()
        );
    }

    /**
     * Builder for constructing AnalysisStatistics incrementally.
     */
    public static class Builder {
        private int filesDiscovered = 0;
        private int filesAnalyzed = 0;
        private int filesParsedSuccessfully = 0;
        private int filesParsedWithFallback = 0;
        private int filesFailed = 0;
        private int filesSkipped = 0;
        private final Map<String, Integer> errorCounts = new HashMap<>();
        private final List<String> topErrors = new ArrayList<>();

        public Builder filesDiscovered(int count) {
            this.filesDiscovered = count;
            return this;
        }

        public Builder incrementFilesAnalyzed() {
            this.filesAnalyzed++;
            return this;
        }

        public Builder incrementFilesParsedSuccessfully() {
            this.filesParsedSuccessfully++;
            return this;
        }

        public Builder incrementFilesParsedWithFallback() {
            this.filesParsedWithFallback++;
            return this;
        }

        public Builder incrementFilesFailed() {
            this.filesFailed++;
            return this;
        }

        public Builder incrementFilesSkipped() {
            this.filesSkipped++;
            return this;
        }

        public Builder addError(String errorType, String errorDetail) {
            errorCounts.merge(errorType, 1, Integer::sum);
            if (topErrors.size() < MAX_TOP_ERRORS) {
                topErrors.add(errorDetail);
            }
            return this;
        }

        public AnalysisStatistics build() {
            return new AnalysisStatistics(
                filesDiscovered,
                filesAnalyzed,
                filesParsedSuccessfully,
                filesParsedWithFallback,
                filesFailed,
                filesSkipped,
                errorCounts,
                topErrors
            );
        }
    }
}
