package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * Layer assignment of a top-level directory.
 *
 * @param directory directory name directly under the analysis root
 * @param layer assigned layer
 * @param fileCount number of source files below the directory
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ArchitectureLayer(String directory, LayerType layer, int fileCount) {

    public ArchitectureLayer {
        Objects.requireNonNull(directory, "directory must not be null");
        Objects.requireNonNull(layer, "layer must not be null");
    }
}
