package com.autodoc.core.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Maps source file paths to Python module names.
 *
 * <p>{@code pkg/sub/mod.py} is module {@code pkg.sub.mod}; a package initializer
 * {@code pkg/sub/__init__.py} is module {@code pkg.sub}.
 */
public final class ModulePaths {

    private static final String PACKAGE_INIT = "__init__";

    private ModulePaths() {
        // Utility class
    }

    /**
     * Returns the dotted-name segments of the module a file defines.
     *
     * @param path forward-slash path relative to the analysis root
     * @return name segments, empty for a root-level {@code __init__.py}
     */
    public static List<String> segments(String path) {
        String stem = FileUtils.stripExtension(FileUtils.toUnixPath(path));
        List<String> segments = new ArrayList<>(Arrays.asList(stem.split("/")));
        segments.removeIf(String::isEmpty);
        if (!segments.isEmpty() && segments.get(segments.size() - 1).equals(PACKAGE_INIT)) {
            segments.remove(segments.size() - 1);
        }
        return segments;
    }

    /**
     * Returns the dotted module name of a file.
     *
     * @param path forward-slash path relative to the analysis root
     * @return dotted name; a root-level {@code __init__.py} keeps the name {@code __init__}
     */
    public static String dottedName(String path) {
        List<String> segments = segments(path);
        return segments.isEmpty() ? PACKAGE_INIT : String.join(".", segments);
    }

    /**
     * Returns the segments of the package containing a module, which is the base for
     * its relative imports. For a package initializer this is the package itself.
     *
     * @param path forward-slash path relative to the analysis root
     * @return package segments
     */
    public static List<String> packageSegments(String path) {
        String unix = FileUtils.toUnixPath(path);
        int slash = unix.lastIndexOf('/');
        if (slash < 0) {
            return List.of();
        }
        return Arrays.stream(unix.substring(0, slash).split("/")).filter(part -> !part.isEmpty()).toList();
    }
}
