package com.autodoc.core.analyzer.architecture;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Detects well-known architecture patterns from top-level directory names.
 *
 * <p>A pattern is reported when at least one of its indicator words appears in a
 * non-hidden top-level directory name. Detection is shallow on purpose: it recognizes
 * conventions, not actual dependencies between layers.
 */
public class ArchitecturePatternDetector {

    private static final Map<String, List<String>> INDICATORS = new LinkedHashMap<>();

    static {
        INDICATORS.put("MVC", List.of("models", "views", "controllers"));
        INDICATORS.put("Layered", List.of("presentation", "business", "data", "services"));
        INDICATORS.put("Microservices", List.of("services", "api", "gateway"));
        INDICATORS.put("Repository", List.of("repositories", "models", "entities"));
        INDICATORS.put("Clean Architecture", List.of("domain", "infrastructure", "application", "interface"));
    }

    /**
     * Detects patterns.
     *
     * @param allPaths every walked file path relative to the root
     * @return pattern names in fixed order
     */
    public List<String> detect(Collection<String> allPaths) {
        Set<String> directories = topLevelDirectories(allPaths);
        return INDICATORS.entrySet().stream()
            .filter(entry -> directories.stream()
                .anyMatch(dir -> entry.getValue().stream().anyMatch(dir::contains)))
            .map(Map.Entry::getKey)
            .toList();
    }

    static Set<String> topLevelDirectories(Collection<String> paths) {
        Set<String> directories = new TreeSet<>();
        for (String path : paths) {
            String unix = path.replace('\\', '/');
            int slash = unix.indexOf('/');
            if (slash > 0 && unix.charAt(0) != '.') {
                directories.add(unix.substring(0, slash).toLowerCase(Locale.ROOT));
            }
        }
        return directories;
    }
}
