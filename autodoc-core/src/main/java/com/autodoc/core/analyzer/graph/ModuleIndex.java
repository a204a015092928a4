package com.autodoc.core.analyzer.graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.autodoc.core.model.ModuleInfo;
import com.autodoc.core.util.ModulePaths;

/**
 * Lookup table from dotted module names to analyzed modules.
 *
 * <p>Each module is registered under every dotted suffix of its path, so
 * {@code src/pkg/mod.py} answers to {@code src.pkg.mod}, {@code pkg.mod} and {@code mod}.
 * This lets absolute imports resolve whether or not the analysis root is the import root.
 * Candidates for a name are ordered by path length, then path, so the shortest path comes first.
 *
 * <p>The index is immutable once built and may be read from several threads.
 */
public final class ModuleIndex {

    private static final Comparator<ModuleInfo> SHORTEST_PATH_FIRST =
        Comparator.comparingInt((ModuleInfo module) -> module.path().length()).thenComparing(ModuleInfo::path);

    private final Map<String, List<ModuleInfo>> bySuffix;
    private final Map<String, ModuleInfo> byFullName;

    private ModuleIndex(Map<String, List<ModuleInfo>> bySuffix, Map<String, ModuleInfo> byFullName) {
        this.bySuffix = bySuffix;
        this.byFullName = byFullName;
    }

    /**
     * Builds the index.
     *
     * @param modules analyzed modules
     * @return lookup table
     */
    public static ModuleIndex of(List<ModuleInfo> modules) {
        Map<String, List<ModuleInfo>> bySuffix = new HashMap<>();
        Map<String, ModuleInfo> byFullName = new HashMap<>();

        List<ModuleInfo> ordered = new ArrayList<>(modules);
        ordered.sort(SHORTEST_PATH_FIRST);
        for (ModuleInfo module : ordered) {
            List<String> segments = ModulePaths.segments(module.path());
            if (segments.isEmpty()) {
                continue;
            }
            byFullName.putIfAbsent(String.join(".", segments), module);
            for (int start = 0; start < segments.size(); start++) {
                String suffix = String.join(".", segments.subList(start, segments.size()));
                bySuffix.computeIfAbsent(suffix, key -> new ArrayList<>()).add(module);
            }
        }
        bySuffix.replaceAll((suffix, candidates) -> List.copyOf(candidates));
        return new ModuleIndex(Map.copyOf(bySuffix), Map.copyOf(byFullName));
    }

    /**
     * Returns every module registered under a dotted name, shortest path first.
     *
     * @param dottedName dotted module name
     * @return candidates, possibly empty
     */
    public List<ModuleInfo> candidates(String dottedName) {
        return bySuffix.getOrDefault(dottedName, List.of());
    }

    /**
     * Returns the module whose full root-relative name is exactly the given segments.
     *
     * @param segments name segments from the analysis root
     * @return the module, if present
     */
    public Optional<ModuleInfo> exact(List<String> segments) {
        if (segments.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byFullName.get(String.join(".", segments)));
    }
}
