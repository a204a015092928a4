package com.autodoc.core.analyzer.flow;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import com.autodoc.core.model.FlowNode;
import com.autodoc.core.model.FlowRole;
import com.autodoc.core.model.FunctionCategory;
import com.autodoc.core.model.FunctionInfo;

/**
 * Assigns flow roles and role details to functions.
 *
 * <p>Precedence: entry point, then output, then data store, then transformation. A function
 * that qualifies for none of them takes no part in flow chains.
 */
final class FlowRoleAssigner {

    private static final List<String> OUTPUT_VERBS = List.of("save", "write", "log", "export", "render");
    private static final List<String> STORE_VERBS = List.of("cache", "persist", "db", "store");

    private static final Map<String, List<String>> TRANSFORMATION_DETAILS = orderedDetails(
        "parser", "parse,decode,deserialize",
        "cleaner", "clean,sanitize,normalize",
        "converter", "convert,transform,map",
        "filter", "filter,select,extract",
        "aggregator", "aggregate,reduce,summarize",
        "validator", "validate,verify,check");

    private static final Map<String, List<String>> OUTPUT_DETAILS = orderedDetails(
        "storage", "save,write,store",
        "export", "export,dump,serialize",
        "communication", "send,transmit,publish",
        "presentation", "render,display,show",
        "logging", "log,print,output");

    private static final Map<String, List<String>> STORE_DETAILS = orderedDetails(
        "cache", "cache",
        "persistence", "persist",
        "database", "db,database,query");

    private FlowRoleAssigner() {
        // Utility class
    }

    /**
     * Assigns a role to a function.
     *
     * @param function function record
     * @param hasCaller whether another analyzed function calls it
     * @return flow node, or empty when the function has no flow role
     */
    static Optional<FlowNode> assign(FunctionInfo function, boolean hasCaller) {
        String name = function.name();
        if (function.category() == FunctionCategory.ENTRY_POINT || !hasCaller) {
            return Optional.of(new FlowNode(function.id(), FlowRole.ENTRY_POINT, "entry_point"));
        }
        if (hasTokenStartingWith(name, OUTPUT_VERBS)) {
            return Optional.of(new FlowNode(function.id(), FlowRole.OUTPUT, detail(name, OUTPUT_DETAILS, "output")));
        }
        if (hasTokenStartingWith(name, STORE_VERBS)) {
            return Optional.of(new FlowNode(function.id(), FlowRole.DATA_STORE, detail(name, STORE_DETAILS, "store")));
        }
        if (function.category() == FunctionCategory.PROCESSOR) {
            return Optional.of(new FlowNode(function.id(), FlowRole.TRANSFORMATION,
                detail(name, TRANSFORMATION_DETAILS, "processor")));
        }
        return Optional.empty();
    }

    /**
     * Checks whether an underscore-separated name token starts with one of the verbs.
     */
    static boolean hasTokenStartingWith(String name, List<String> verbs) {
        return Arrays.stream(name.toLowerCase(Locale.ROOT).split("_"))
            .filter(token -> !token.isEmpty())
            .anyMatch(token -> verbs.stream().anyMatch(token::startsWith));
    }

    private static String detail(String name, Map<String, List<String>> details, String fallback) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : details.entrySet()) {
            if (entry.getValue().stream().anyMatch(lower::contains)) {
                return entry.getKey();
            }
        }
        return fallback;
    }

    private static Map<String, List<String>> orderedDetails(String... pairs) {
        Map<String, List<String>> details = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            details.put(pairs[i], List.of(pairs[i + 1].split(",")));
        }
        return Collections.unmodifiableMap(details);
    }
}
