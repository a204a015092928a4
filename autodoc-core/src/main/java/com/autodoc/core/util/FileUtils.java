package com.autodoc.core.util;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Utility class for file and path operations.
 */
public final class FileUtils {

    private static final String RECURSIVE_PREFIX = "**/";

    private static final Map<String, PathMatcher> matcherCache = new ConcurrentHashMap<>();

    private FileUtils() {
        // Utility class
    }

    /**
     * Converts a path below a root into the forward-slash form used in analysis results.
     *
     * @param root root directory
     * @param file file below the root
     * @return relative path with '/' separators
     */
    public static String relativePath(Path root, Path file) {
        return toUnixPath(root.relativize(file).toString());
    }

    /**
     * Normalizes separators to '/'.
     *
     * @param path path text
     * @return path with forward slashes
     */
    public static String toUnixPath(String path) {
        return path.replace('\\', '/');
    }

    /**
     * Checks a relative path against a glob pattern.
     *
     * <p>A pattern starting with {@code **}{@code /} also matches files directly in the root,
     * so {@code **}{@code /*.py} matches both {@code app.py} and {@code pkg/mod.py}.
     *
     * @param globPattern glob pattern
     * @param relativePath forward-slash path relative to the root
     * @return true if the path matches
     */
    public static boolean matches(String globPattern, String relativePath) {
        Path path = Path.of(relativePath);
        if (matcher(globPattern).matches(path)) {
            return true;
        }
        return globPattern.startsWith(RECURSIVE_PREFIX)
            && matcher(globPattern.substring(RECURSIVE_PREFIX.length())).matches(path);
    }

    /**
     * Checks a relative path against any of several glob patterns.
     *
     * @param globPatterns glob patterns
     * @param relativePath forward-slash path relative to the root
     * @return true if at least one pattern matches
     */
    public static boolean matchesAny(List<String> globPatterns, String relativePath) {
        return globPatterns.stream().anyMatch(pattern -> matches(pattern, relativePath));
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return lower-case file extension without dot, or empty string if no extension
     */
    public static String getExtension(String path) {
        String fileName = fileName(path);
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1).toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Returns the last segment of a forward-slash path.
     *
     * @param path file path
     * @return file name
     */
    public static String fileName(String path) {
        String unix = toUnixPath(path);
        return unix.substring(unix.lastIndexOf('/') + 1);
    }

    /**
     * Removes the extension from the last segment of a path.
     *
     * @param path file path
     * @return path without extension
     */
    public static String stripExtension(String path) {
        String unix = toUnixPath(path);
        int lastDot = unix.lastIndexOf('.');
        return lastDot > unix.lastIndexOf('/') + 1 ? unix.substring(0, lastDot) : unix;
    }

    private static PathMatcher matcher(String globPattern) {
        return matcherCache.computeIfAbsent(globPattern,
            pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern));
    }
}
