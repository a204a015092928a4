package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * A function parameter as written in the source.
 *
 * <p>Variadic parameters keep their marker ({@code *args}, {@code **kwargs}).
 *
 * @param name parameter name, never null
 * @param type annotation text, or null when unannotated
 * @param defaultValue default expression text, or null when the parameter has none
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Parameter(String name, String type, String defaultValue) {

    public Parameter {
        Objects.requireNonNull(name, "name must not be null");
    }

    /**
     * Returns whether this parameter declares a default value.
     *
     * @return true if a default is present
     */
    public boolean hasDefault() {
        return defaultValue != null;
    }
}
