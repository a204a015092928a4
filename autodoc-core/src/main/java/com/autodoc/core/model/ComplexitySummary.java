package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Aggregate complexity figures over all functions.
 *
 * @param averageComplexity mean complexity, 0 when there are no functions
 * @param maxComplexity highest complexity, 0 when there are no functions
 * @param totalFunctions number of functions considered
 * @param threshold complexity above which a function is reported
 * @param highComplexityFunctions ids of functions above the threshold, most complex first
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ComplexitySummary(
    double averageComplexity,
    int maxComplexity,
    int totalFunctions,
    int threshold,
    List<Integer> highComplexityFunctions
) {
    public ComplexitySummary {
        highComplexityFunctions = highComplexityFunctions != null ? List.copyOf(highComplexityFunctions) : List.of();
    }

    public static ComplexitySummary empty(int threshold) {
        return new ComplexitySummary(0.0, 0, 0, threshold, List.of());
    }
}
