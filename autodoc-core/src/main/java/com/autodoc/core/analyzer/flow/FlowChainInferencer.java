package com.autodoc.core.analyzer.flow;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.autodoc.core.config.AnalyzerConfig.FlowSettings;
import com.autodoc.core.model.Diagnostic;
import com.autodoc.core.model.DiagnosticKind;
import com.autodoc.core.model.FlowChain;
import com.autodoc.core.model.FlowNode;
import com.autodoc.core.model.FlowRole;
import com.autodoc.core.model.FunctionInfo;

/**
 * Infers likely data-flow chains from entry points toward outputs and data stores.
 *
 * <p>The inference runs in three steps:
 * <ol>
 *   <li>Role assignment (see {@link FlowRoleAssigner}); functions without a role are not nodes.</li>
 *   <li>Linking: {@code A -> B} when A may call B (through {@link CalleeNames}), or when A and B
 *       are defined in the same module and A comes first. Entry points have no incoming links.</li>
 *   <li>Assembly: a depth-first walk from every entry point, successors in ascending id order,
 *       never revisiting a function on the current path. A path ends at an output or data
 *       store, or is cut when it reaches the depth limit. Paths shorter than
 *       {@value FlowChain#MIN_LENGTH} nodes are dropped.</li>
 * </ol>
 *
 * <p>Chains are a heuristic. Co-location links in particular connect functions that never
 * call each other; consumers should present chains as candidates, not as a call graph.
 */
public class FlowChainInferencer {

    private static final Logger log = LoggerFactory.getLogger(FlowChainInferencer.class);

    private final CalleeNames calleeNames;
    private final FlowSettings settings;

    public FlowChainInferencer(CalleeNames calleeNames, FlowSettings settings) {
        this.calleeNames = Objects.requireNonNull(calleeNames, "calleeNames must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    /**
     * Infers chains over the complete function table.
     *
     * @param functions function table, indexed by id
     * @param diagnostics sink for {@code depth_exceeded} diagnostics
     * @return chains, grouped by entry point in id order
     */
    public List<FlowChain> infer(List<FunctionInfo> functions, List<Diagnostic> diagnostics) {
        Map<String, List<FunctionInfo>> byName = new HashMap<>();
        Map<Integer, List<FunctionInfo>> byModule = new HashMap<>();
        for (FunctionInfo function : functions) {
            byName.computeIfAbsent(function.name(), key -> new ArrayList<>()).add(function);
            byModule.computeIfAbsent(function.moduleId(), key -> new ArrayList<>()).add(function);
        }

        List<Set<String>> callees = functions.stream().map(calleeNames::calleeNames).toList();
        boolean[] hasCaller = new boolean[functions.size()];
        for (FunctionInfo caller : functions) {
            for (String name : callees.get(caller.id())) {
                for (FunctionInfo callee : byName.getOrDefault(name, List.of())) {
                    if (callee.id() != caller.id()) {
                        hasCaller[callee.id()] = true;
                    }
                }
            }
        }

        Map<Integer, FlowNode> nodes = new TreeMap<>();
        for (FunctionInfo function : functions) {
            FlowRoleAssigner.assign(function, hasCaller[function.id()])
                .ifPresent(node -> nodes.put(function.id(), node));
        }

        Map<Integer, List<FlowNode>> successors = new HashMap<>();
        for (FlowNode node : nodes.values()) {
            FunctionInfo function = functions.get(node.functionId());
            Set<Integer> next = new TreeSet<>();
            for (String name : callees.get(function.id())) {
                byName.getOrDefault(name, List.of()).forEach(callee -> next.add(callee.id()));
            }
            for (FunctionInfo sibling : byModule.get(function.moduleId())) {
                if (sibling.id() > function.id()) {
                    next.add(sibling.id());
                }
            }
            next.remove(function.id());
            successors.put(node.functionId(), next.stream()
                .map(nodes::get)
                .filter(candidate -> candidate != null && candidate.role() != FlowRole.ENTRY_POINT)
                .toList());
        }

        Assembly assembly = new Assembly(successors, diagnostics, functions);
        for (FlowNode node : nodes.values()) {
            if (node.role() == FlowRole.ENTRY_POINT) {
                assembly.walkFrom(node);
            }
            if (assembly.chains.size() >= settings.maxChains()) {
                log.debug("Flow chain limit of {} reached", settings.maxChains());
                break;
            }
        }

        log.debug("Inferred {} flow chains from {} flow nodes", assembly.chains.size(), nodes.size());
        return assembly.chains;
    }

    /**
     * Depth-first chain assembly state for one run.
     */
    private final class Assembly {

        private final Map<Integer, List<FlowNode>> successors;
        private final List<Diagnostic> diagnostics;
        private final List<FunctionInfo> functions;
        private final List<FlowChain> chains = new ArrayList<>();

        private int chainsForEntry;
        private boolean truncatedForEntry;

        Assembly(Map<Integer, List<FlowNode>> successors, List<Diagnostic> diagnostics, List<FunctionInfo> functions) {
            this.successors = successors;
            this.diagnostics = diagnostics;
            this.functions = functions;
        }

        void walkFrom(FlowNode entry) {
            chainsForEntry = 0;
            truncatedForEntry = false;
            List<FlowNode> path = new ArrayList<>();
            path.add(entry);
            Set<Integer> visited = new HashSet<>();
            visited.add(entry.functionId());
            extend(path, visited);

            if (truncatedForEntry) {
                FunctionInfo function = functions.get(entry.functionId());
                diagnostics.add(Diagnostic.of(DiagnosticKind.DEPTH_EXCEEDED, function.file(),
                    "Flow traversal from '" + function.qualifiedName() + "' was cut at depth " + settings.maxDepth()));
            }
        }

        private void extend(List<FlowNode> path, Set<Integer> visited) {
            FlowNode last = path.get(path.size() - 1);
            for (FlowNode next : successors.getOrDefault(last.functionId(), List.of())) {
                if (full()) {
                    return;
                }
                if (visited.contains(next.functionId())) {
                    continue;
                }
                path.add(next);
                visited.add(next.functionId());

                if (next.role() == FlowRole.OUTPUT || next.role() == FlowRole.DATA_STORE) {
                    emit(path, false);
                } else if (path.size() > settings.maxDepth()) {
                    truncatedForEntry = true;
                    emit(path, true);
                } else {
                    extend(path, visited);
                }

                path.remove(path.size() - 1);
                visited.remove(next.functionId());
            }
        }

        private void emit(List<FlowNode> path, boolean truncated) {
            if (path.size() >= FlowChain.MIN_LENGTH) {
                chains.add(new FlowChain(path, truncated));
                chainsForEntry++;
            }
        }

        private boolean full() {
            return chainsForEntry >= settings.maxChainsPerEntry() || chains.size() >= settings.maxChains();
        }
    }
}
