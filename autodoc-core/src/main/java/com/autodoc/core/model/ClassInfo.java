package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * A class definition, including classes nested in other classes or functions.
 *
 * @param id stable identifier, equal to the class's index in the result
 * @param moduleId id of the defining module
 * @param name simple class name
 * @param qualifiedName dotted name within the module ({@code Outer.Inner})
 * @param file defining file path
 * @param line 1-based line of the {@code class} keyword
 * @param endLine last line of the class body
 * @param docstring cleaned docstring, or null
 * @param bases base class expressions as written
 * @param methods names of functions defined directly in the class body
 * @param decorators decorator names
 * @param category semantic role
 * @param abstractBase whether a base names an abstract base class
 * @param exceptionType whether a base names an exception or error type
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassInfo(
    int id,
    int moduleId,
    String name,
    String qualifiedName,
    String file,
    int line,
    int endLine,
    String docstring,
    List<String> bases,
    List<String> methods,
    List<String> decorators,
    ClassCategory category,
    boolean abstractBase,
    boolean exceptionType
) {
    public ClassInfo {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(category, "category must not be null");
        bases = bases != null ? List.copyOf(bases) : List.of();
        methods = methods != null ? List.copyOf(methods) : List.of();
        decorators = decorators != null ? List.copyOf(decorators) : List.of();
    }

    /**
     * Returns a copy with global identifiers.
     *
     * @param globalModuleId id of the defining module
     * @param classOffset first global class id of the defining file
     * @return relocated class record
     */
    public ClassInfo relocate(int globalModuleId, int classOffset) {
        return new ClassInfo(id + classOffset, globalModuleId, name, qualifiedName, file, line, endLine,
            docstring, bases, methods, decorators, category, abstractBase, exceptionType);
    }
}
