package com.autodoc.core.util;

import java.util.Map;
import java.util.Optional;

/**
 * Language identifiers and the file extensions that reveal them.
 * <p>
 * Only Python is parsed; the other entries feed the project overview's
 * "languages detected" list.
 * </p>
 */
public final class Languages {
    /** Language identifier for Python. */
    public static final String PYTHON = "python";

    private static final Map<String, String> DISPLAY_NAMES = Map.ofEntries(
        Map.entry("py", "Python"),
        Map.entry("pyw", "Python"),
        Map.entry("js", "JavaScript"),
        Map.entry("jsx", "JavaScript"),
        Map.entry("ts", "TypeScript"),
        Map.entry("tsx", "TypeScript"),
        Map.entry("java", "Java"),
        Map.entry("kt", "Kotlin"),
        Map.entry("go", "Go"),
        Map.entry("rs", "Rust"),
        Map.entry("cpp", "C++"),
        Map.entry("cc", "C++"),
        Map.entry("c", "C"),
        Map.entry("h", "C"),
        Map.entry("cs", "C#"),
        Map.entry("rb", "Ruby"),
        Map.entry("php", "PHP"),
        Map.entry("swift", "Swift"),
        Map.entry("scala", "Scala"),
        Map.entry("sql", "SQL"),
        Map.entry("sh", "Shell")
    );

    private Languages() {
        // Prevent instantiation
    }

    /**
     * Returns the display name of the language a file is written in.
     *
     * @param path file path
     * @return language display name, if the extension is known
     */
    public static Optional<String> displayNameOf(String path) {
        return Optional.ofNullable(DISPLAY_NAMES.get(FileUtils.getExtension(path)));
    }
}
