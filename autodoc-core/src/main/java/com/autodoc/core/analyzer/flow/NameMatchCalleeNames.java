package com.autodoc.core.analyzer.flow;

import java.util.Set;
import java.util.TreeSet;

import com.autodoc.core.model.FunctionInfo;

/**
 * Default {@link CalleeNames}: the last dotted segment of every recorded call target.
 *
 * <p>{@code self.repo.save(x)} links to any function named {@code save}. This over-links on
 * common names, which is accepted for a best-effort heuristic.
 */
public class NameMatchCalleeNames implements CalleeNames {

    @Override
    public Set<String> calleeNames(FunctionInfo function) {
        Set<String> names = new TreeSet<>();
        for (String call : function.calls()) {
            names.add(call.substring(call.lastIndexOf('.') + 1));
        }
        return names;
    }
}
