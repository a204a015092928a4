package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * A function or method definition, including nested functions.
 *
 * @param id stable identifier, equal to the function's index in the result
 * @param moduleId id of the defining module
 * @param name simple function name
 * @param qualifiedName dotted name within the module ({@code Service.handle.inner})
 * @param file defining file path
 * @param line 1-based line of the {@code def} keyword
 * @param endLine last line of the function body
 * @param parameters parameters in declaration order
 * @param returnType return annotation text, or null
 * @param docstring cleaned docstring, or null
 * @param complexity cyclomatic complexity, at least 1
 * @param category semantic role
 * @param calls sorted, distinct callee names found in the body (nested definitions excluded)
 * @param decorators decorator names
 * @param ownerClass simple name of the directly enclosing class, or null
 * @param asyncDef whether declared with {@code async def}
 * @param staticLike whether a method is static or takes no parameters
 * @param classMethod whether decorated with {@code classmethod}
 * @param property whether decorated as a property accessor
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FunctionInfo(
    int id,
    int moduleId,
    String name,
    String qualifiedName,
    String file,
    int line,
    int endLine,
    List<Parameter> parameters,
    String returnType,
    String docstring,
    int complexity,
    FunctionCategory category,
    List<String> calls,
    List<String> decorators,
    String ownerClass,
    boolean asyncDef,
    boolean staticLike,
    boolean classMethod,
    boolean property
) {
    public FunctionInfo {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(qualifiedName, "qualifiedName must not be null");
        Objects.requireNonNull(file, "file must not be null");
        Objects.requireNonNull(category, "category must not be null");
        if (complexity < 1) {
            throw new IllegalArgumentException("complexity must be at least 1: " + complexity);
        }
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        calls = calls != null ? List.copyOf(calls) : List.of();
        decorators = decorators != null ? List.copyOf(decorators) : List.of();
    }

    /**
     * Returns whether this function is defined directly in a class body.
     *
     * @return true for methods
     */
    public boolean method() {
        return ownerClass != null;
    }

    /**
     * Returns a copy with global identifiers.
     *
     * @param globalModuleId id of the defining module
     * @param functionOffset first global function id of the defining file
     * @return relocated function record
     */
    public FunctionInfo relocate(int globalModuleId, int functionOffset) {
        return new FunctionInfo(id + functionOffset, globalModuleId, name, qualifiedName, file, line, endLine,
            parameters, returnType, docstring, complexity, category, calls, decorators, ownerClass,
            asyncDef, staticLike, classMethod, property);
    }
}
