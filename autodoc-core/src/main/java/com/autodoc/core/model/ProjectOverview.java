package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Headline numbers for an analyzed tree.
 *
 * @param totalFiles number of analyzed modules
 * @param totalLines sum of module line counts
 * @param totalFunctions number of functions
 * @param totalClasses number of classes
 * @param languagesDetected languages seen among all input files, sorted
 * @param projectType coarse project kind such as {@code Flask Web Application} or {@code Python Library/Package}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectOverview(
    int totalFiles,
    int totalLines,
    int totalFunctions,
    int totalClasses,
    List<String> languagesDetected,
    String projectType
) {
    public ProjectOverview {
        languagesDetected = languagesDetected != null ? List.copyOf(languagesDetected) : List.of();
        projectType = projectType != null ? projectType : "Unknown";
    }
}
