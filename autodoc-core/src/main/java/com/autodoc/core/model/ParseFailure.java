package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * A source file that could not be decoded or parsed.
 *
 * @param path file path relative to the analysis root
 * @param reason human-readable reason, including the location when known
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParseFailure(String path, String reason) {

    public ParseFailure {
        Objects.requireNonNull(path, "path must not be null");
        reason = reason != null ? reason : "unknown error";
    }
}
