package com.autodoc.core.analyzer.graph;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.autodoc.core.model.DependencyEdge;
import com.autodoc.core.model.Diagnostic;
import com.autodoc.core.model.DiagnosticKind;
import com.autodoc.core.model.ImportKind;
import com.autodoc.core.model.ImportRef;
import com.autodoc.core.model.ModuleInfo;
import com.autodoc.core.util.ModulePaths;

/**
 * Resolves module imports into dependency edges.
 *
 * <p>An import that names an analyzed module becomes an internal edge; anything else becomes
 * an external edge keyed by the first segment of the imported name. For
 * {@code from a.b import c} the submodule {@code a.b.c} is tried before the module
 * {@code a.b}. Relative imports are resolved against the importing module's package.
 *
 * <p>Edges are deduplicated per source module and a module never depends on itself: when the
 * only match for a name is the importing module, the name is treated as external (a local
 * {@code logging.py} importing the standard {@code logging}, for instance).
 *
 * <p>Diagnostics:
 * <ul>
 *   <li>{@code resolution_ambiguity} when several modules match a name; the shortest path wins</li>
 *   <li>{@code unresolved_import} when a relative import points at nothing in the tree</li>
 * </ul>
 */
public class DependencyGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private static final String STAR = "*";

    /**
     * Builds the edges for all modules.
     *
     * @param modules complete module table, indexed by id
     * @param diagnostics sink for resolution diagnostics
     * @return edges grouped by source module in id order
     */
    public List<DependencyEdge> build(List<ModuleInfo> modules, List<Diagnostic> diagnostics) {
        ModuleIndex index = ModuleIndex.of(modules);
        Set<String> reportedAmbiguities = new HashSet<>();
        List<DependencyEdge> edges = new ArrayList<>();

        for (ModuleInfo module : modules) {
            Set<DependencyEdge> moduleEdges = new LinkedHashSet<>();
            for (ImportRef ref : module.imports()) {
                resolve(index, module, ref, moduleEdges, diagnostics, reportedAmbiguities);
            }
            edges.addAll(moduleEdges);
        }

        log.debug("Resolved {} dependency edges across {} modules", edges.size(), modules.size());
        return edges;
    }

    private void resolve(ModuleIndex index, ModuleInfo source, ImportRef ref, Set<DependencyEdge> edges,
                         List<Diagnostic> diagnostics, Set<String> reportedAmbiguities) {
        if (ref.relative()) {
            List<ModuleInfo> targets = resolveRelative(index, source, ref);
            if (targets.isEmpty()) {
                diagnostics.add(Diagnostic.of(DiagnosticKind.UNRESOLVED_IMPORT, source.path(),
                    "Cannot resolve relative import '" + ".".repeat(ref.level()) + ref.module()
                        + "' at line " + ref.line()));
            }
            for (ModuleInfo target : targets) {
                if (target.id() != source.id()) {
                    edges.add(DependencyEdge.internal(source.id(), target.id()));
                }
            }
            return;
        }

        List<ModuleInfo> targets = new ArrayList<>();
        if (ref.kind() == ImportKind.MEMBER) {
            for (String name : ref.names()) {
                if (!name.equals(STAR)) {
                    resolveAbsolute(index, source, ref.module() + "." + name, diagnostics, reportedAmbiguities)
                        .ifPresent(targets::add);
                }
            }
        }
        if (targets.isEmpty()) {
            resolveAbsolute(index, source, ref.module(), diagnostics, reportedAmbiguities).ifPresent(targets::add);
        }

        if (targets.isEmpty()) {
            edges.add(DependencyEdge.external(source.id(), topLevelPackage(ref.module())));
        } else {
            targets.forEach(target -> edges.add(DependencyEdge.internal(source.id(), target.id())));
        }
    }

    private Optional<ModuleInfo> resolveAbsolute(ModuleIndex index, ModuleInfo source, String dottedName,
                                                 List<Diagnostic> diagnostics, Set<String> reportedAmbiguities) {
        List<ModuleInfo> candidates = index.candidates(dottedName).stream()
            .filter(candidate -> candidate.id() != source.id())
            .toList();
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        ModuleInfo chosen = candidates.get(0);
        if (candidates.size() > 1 && reportedAmbiguities.add(source.path() + "|" + dottedName)) {
            diagnostics.add(Diagnostic.of(DiagnosticKind.RESOLUTION_AMBIGUITY, source.path(),
                "Import '" + dottedName + "' matches " + candidates.size() + " modules; using " + chosen.path()));
        }
        return Optional.of(chosen);
    }

    private List<ModuleInfo> resolveRelative(ModuleIndex index, ModuleInfo source, ImportRef ref) {
        List<String> base = ModulePaths.packageSegments(source.path());
        int up = ref.level() - 1;
        if (up > base.size()) {
            return List.of();
        }
        List<String> prefix = new ArrayList<>(base.subList(0, base.size() - up));
        if (!ref.module().isEmpty()) {
            prefix.addAll(Arrays.asList(ref.module().split("\\.")));
        }

        List<ModuleInfo> targets = new ArrayList<>();
        for (String name : ref.names()) {
            if (!name.equals(STAR)) {
                List<String> submodule = new ArrayList<>(prefix);
                submodule.add(name);
                index.exact(submodule).ifPresent(targets::add);
            }
        }
        if (targets.isEmpty()) {
            index.exact(prefix).ifPresent(targets::add);
        }
        return targets;
    }

    private static String topLevelPackage(String dottedName) {
        int dot = dottedName.indexOf('.');
        return dot < 0 ? dottedName : dottedName.substring(0, dot);
    }
}
