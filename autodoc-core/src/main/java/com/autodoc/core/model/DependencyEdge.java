package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Objects;

/**
 * A module-level dependency.
 *
 * <p>Internal edges point at another analyzed module; external edges name the top-level
 * package of a library. A module never depends on itself.
 *
 * @param sourceModule id of the importing module
 * @param type internal or external
 * @param targetModule id of the imported module for internal edges, otherwise null
 * @param externalPackage top-level package name for external edges, otherwise null
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DependencyEdge(
    int sourceModule,
    DependencyType type,
    Integer targetModule,
    String externalPackage
) {
    public DependencyEdge {
        Objects.requireNonNull(type, "type must not be null");
        if (type == DependencyType.INTERNAL) {
            Objects.requireNonNull(targetModule, "internal edge requires a target module");
            if (targetModule == sourceModule) {
                throw new IllegalArgumentException("module " + sourceModule + " cannot depend on itself");
            }
            externalPackage = null;
        } else {
            Objects.requireNonNull(externalPackage, "external edge requires a package name");
            targetModule = null;
        }
    }

    public static DependencyEdge internal(int sourceModule, int targetModule) {
        return new DependencyEdge(sourceModule, DependencyType.INTERNAL, targetModule, null);
    }

    public static DependencyEdge external(int sourceModule, String externalPackage) {
        return new DependencyEdge(sourceModule, DependencyType.EXTERNAL, null, externalPackage);
    }
}
