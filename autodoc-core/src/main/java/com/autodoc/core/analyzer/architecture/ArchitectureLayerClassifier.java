package com.autodoc.core.analyzer.architecture;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

import com.autodoc.core.model.ArchitectureLayer;
import com.autodoc.core.model.LayerType;
import com.autodoc.core.util.FileUtils;

/**
 * Labels the top-level directories of a tree with architecture layers.
 *
 * <p>A directory name is matched case-insensitively against ordered keyword lists; the first
 * list with a keyword contained in the name wins, and unmatched directories are
 * {@link LayerType#BUSINESS}. Files directly in the root belong to no layer.
 */
public class ArchitectureLayerClassifier {

    private static final Map<LayerType, List<String>> LEXICON = new LinkedHashMap<>();

    static {
        LEXICON.put(LayerType.INTERFACE, List.of("api", "server", "router", "endpoint"));
        LEXICON.put(LayerType.DATA, List.of("model", "schema", "entity", "db", "database"));
        LEXICON.put(LayerType.INFRASTRUCTURE, List.of("util", "helper", "lib", "common", "config"));
        LEXICON.put(LayerType.PRESENTATION, List.of("ui", "view", "component"));
        LEXICON.put(LayerType.TEST, List.of("test", "spec"));
    }

    /**
     * Classifies the top-level directories that contain source files.
     *
     * @param sourcePaths forward-slash source file paths relative to the root
     * @return one layer per directory, sorted by directory name
     */
    public List<ArchitectureLayer> classify(Collection<String> sourcePaths) {
        Map<String, Integer> fileCounts = new TreeMap<>();
        for (String path : sourcePaths) {
            String unix = FileUtils.toUnixPath(path);
            int slash = unix.indexOf('/');
            if (slash > 0) {
                fileCounts.merge(unix.substring(0, slash), 1, Integer::sum);
            }
        }
        return fileCounts.entrySet().stream()
            .map(entry -> new ArchitectureLayer(entry.getKey(), layerOf(entry.getKey()), entry.getValue()))
            .toList();
    }

    /**
     * Returns the layer for one directory name.
     *
     * @param directory directory name
     * @return matched layer, or business
     */
    public static LayerType layerOf(String directory) {
        String lower = directory.toLowerCase(Locale.ROOT);
        for (Map.Entry<LayerType, List<String>> entry : LEXICON.entrySet()) {
            if (entry.getValue().stream().anyMatch(lower::contains)) {
                return entry.getKey();
            }
        }
        return LayerType.BUSINESS;
    }
}
