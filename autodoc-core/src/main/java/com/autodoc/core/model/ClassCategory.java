package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Semantic role of a class, assigned by the ordered class rule table.
 *
 * <p>Labels are part of the serialized result and must not change.
 */
public enum ClassCategory {
    MODEL("model"),
    PIPELINE("pipeline"),
    GENERATOR("generator"),
    ANALYZER("analyzer"),
    ENTITY("entity"),
    SERVICE("service"),
    GENERAL("general");

    private final String label;

    ClassCategory(String label) {
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
