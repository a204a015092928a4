package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * One import statement target of a module.
 *
 * <p>{@code import a.b} yields a {@link ImportKind#MODULE} reference with module {@code a.b}.
 * {@code from ..pkg import x, y} yields a {@link ImportKind#MEMBER} reference with module
 * {@code pkg}, names {@code [x, y]} and level 2. A bare {@code from . import x} has an empty module.
 *
 * @param kind import form
 * @param module dotted module path, empty for a bare relative import
 * @param names imported member names (empty for {@link ImportKind#MODULE})
 * @param level number of leading dots, 0 for absolute imports
 * @param line 1-based line of the statement
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ImportRef(
    ImportKind kind,
    String module,
    List<String> names,
    int level,
    int line
) {
    public ImportRef {
        Objects.requireNonNull(kind, "kind must not be null");
        module = module != null ? module : "";
        names = names != null ? List.copyOf(names) : List.of();
        if (level < 0) {
            throw new IllegalArgumentException("level must not be negative: " + level);
        }
    }

    /**
     * Creates an {@code import a.b} reference.
     */
    public static ImportRef module(String module, int line) {
        return new ImportRef(ImportKind.MODULE, module, List.of(), 0, line);
    }

    /**
     * Creates a {@code from ... import ...} reference.
     */
    public static ImportRef member(String module, List<String> names, int level, int line) {
        return new ImportRef(ImportKind.MEMBER, module, names, level, line);
    }

    /**
     * Returns whether this import is relative to the importing module's package.
     *
     * @return true if level is greater than zero
     */
    public boolean relative() {
        return level > 0;
    }
}
