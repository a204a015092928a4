package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Architecture layer assigned to a top-level directory.
 *
 * <p>Labels are part of the serialized result and must not change.
 */
public enum LayerType {
    PRESENTATION("presentation"),
    INTERFACE("interface"),
    BUSINESS("business"),
    DATA("data"),
    INFRASTRUCTURE("infrastructure"),
    TEST("test");

    private final String label;

    LayerType(String label) {
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
