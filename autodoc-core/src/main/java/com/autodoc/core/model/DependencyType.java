package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether an import target lives inside the analyzed tree.
 *
 * <p>Labels are part of the serialized result and must not change.
 */
public enum DependencyType {
    INTERNAL("internal"),
    EXTERNAL("external");

    private final String label;

    DependencyType(String label) {
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
