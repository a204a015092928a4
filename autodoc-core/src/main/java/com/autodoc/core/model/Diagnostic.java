package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * A non-fatal condition observed during analysis.
 *
 * @param kind diagnostic kind
 * @param path file the diagnostic refers to, or null when it is not tied to one file
 * @param message description
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Diagnostic(DiagnosticKind kind, String path, String message) {

    public Diagnostic {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static Diagnostic of(DiagnosticKind kind, String path, String message) {
        return new Diagnostic(kind, path, message);
    }
}
