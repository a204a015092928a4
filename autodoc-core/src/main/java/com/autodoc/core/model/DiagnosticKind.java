package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of non-fatal conditions collected during an analysis run.
 *
 * <p>Labels are part of the serialized result and must not change.
 */
public enum DiagnosticKind {
    PARSE_FAILURE("parse_failure"),
    SKIPPED_FILE("skipped_file"),
    UNREADABLE_FILE("unreadable_file"),
    RESOLUTION_AMBIGUITY("resolution_ambiguity"),
    UNRESOLVED_IMPORT("unresolved_import"),
    DEPTH_EXCEEDED("depth_exceeded");

    private final String label;

    DiagnosticKind(String label) {
        this.label = label;
    }

    /**
     * Returns the serialized label (lower snake case).
     *
     * @return label
     */
    @JsonValue
    public String label() {
        return label;
    }
}
