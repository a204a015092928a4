package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role a function plays in an inferred data-flow chain.
 *
 * <p>Labels are part of the serialized result and must not change.
 */
public enum FlowRole {
    ENTRY_POINT("entry_point"),
    TRANSFORMATION("transformation"),
    OUTPUT("output"),
    DATA_STORE("data_store");

    private final String label;

    FlowRole(String label) {
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
