package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * A function participating in a flow chain.
 *
 * @param functionId id of the function
 * @param role flow role
 * @param detail role-specific sub-type such as {@code filter}, {@code file} or {@code database}, or null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowNode(int functionId, FlowRole role, String detail) {

    public FlowNode {
        Objects.requireNonNull(role, "role must not be null");
    }
}
