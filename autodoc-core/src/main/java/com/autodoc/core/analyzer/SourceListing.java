package com.autodoc.core.analyzer;

import java.util.List;

import com.autodoc.core.model.Diagnostic;

/**
 * Outcome of walking a source tree.
 *
 * @param files selected source files, sorted by path
 * @param allPaths every walked file path outside excluded directories, sorted
 * @param diagnostics files that were skipped or could not be read
 */
public record SourceListing(List<SourceFile> files, List<String> allPaths, List<Diagnostic> diagnostics) {

    public SourceListing {
        files = files != null ? List.copyOf(files) : List.of();
        allPaths = allPaths != null ? List.copyOf(allPaths) : List.of();
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
    }
}
