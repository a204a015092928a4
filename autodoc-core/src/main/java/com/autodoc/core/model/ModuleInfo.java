package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * One analyzed source file.
 *
 * @param id stable identifier, equal to the module's index in the result
 * @param name dotted module name derived from the path ({@code pkg/__init__.py} is {@code pkg})
 * @param path path relative to the analysis root, using forward slashes
 * @param docstring cleaned module docstring, or null
 * @param lineCount number of source lines
 * @param imports import references in source order
 * @param classIds ids of classes defined in this file
 * @param functionIds ids of functions defined in this file
 * @param entryModule whether the file is {@code main.py}/{@code __main__.py} or has a {@code __main__} guard
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModuleInfo(
    int id,
    String name,
    String path,
    String docstring,
    int lineCount,
    List<ImportRef> imports,
    List<Integer> classIds,
    List<Integer> functionIds,
    boolean entryModule
) {
    public ModuleInfo {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(path, "path must not be null");
        imports = imports != null ? List.copyOf(imports) : List.of();
        classIds = classIds != null ? List.copyOf(classIds) : List.of();
        functionIds = functionIds != null ? List.copyOf(functionIds) : List.of();
    }

    /**
     * Returns a copy placed into the global tables at the given offsets.
     *
     * @param moduleId global module id
     * @param classOffset first global class id of this file
     * @param functionOffset first global function id of this file
     * @return relocated module record
     */
    public ModuleInfo relocate(int moduleId, int classOffset, int functionOffset) {
        return new ModuleInfo(moduleId, name, path, docstring, lineCount, imports,
            classIds.stream().map(local -> local + classOffset).toList(),
            functionIds.stream().map(local -> local + functionOffset).toList(),
            entryModule);
    }
}
