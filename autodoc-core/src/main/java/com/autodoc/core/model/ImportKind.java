package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Form of an import statement: {@code import a.b} or {@code from a import b}.
 *
 * <p>Labels are part of the serialized result and must not change.
 */
public enum ImportKind {
    MODULE("module"),
    MEMBER("member");

    private final String label;

    ImportKind(String label) {
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
