package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * An inferred data-flow path, starting at an entry point.
 *
 * @param nodes path nodes, at least three, with distinct functions
 * @param truncated whether the path was cut at the depth limit instead of reaching a sink
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FlowChain(List<FlowNode> nodes, boolean truncated) {

    public static final int MIN_LENGTH = 3;

    public FlowChain {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        if (nodes.size() < MIN_LENGTH) {
            throw new IllegalArgumentException("flow chain needs at least " + MIN_LENGTH + " nodes, got " + nodes.size());
        }
        if (nodes.get(0).role() != FlowRole.ENTRY_POINT) {
            throw new IllegalArgumentException("flow chain must start at an entry point");
        }
        Set<Integer> seen = new HashSet<>();
        for (FlowNode node : nodes) {
            if (!seen.add(node.functionId())) {
                throw new IllegalArgumentException("function " + node.functionId() + " appears twice in a chain");
            }
        }
    }

    /**
     * Returns the function ids along the path.
     *
     * @return ids in path order
     */
    public List<Integer> functionIds() {
        return nodes.stream().map(FlowNode::functionId).toList();
    }
}
