package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Semantic role of a function, assigned by the ordered function rule table.
 *
 * <p>Labels are part of the serialized result and must not change.
 */
public enum FunctionCategory {
    DUNDER("dunder"),
    ENTRY_POINT("entry_point"),
    PRIVATE("private"),
    GETTER("getter"),
    SETTER("setter"),
    CREATOR("creator"),
    PROCESSOR("processor"),
    GENERAL("general");

    private final String label;

    FunctionCategory(String label) {
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
