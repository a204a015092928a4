package com.autodoc.core.analyzer.flow;

import java.util.Set;

import com.autodoc.core.model.FunctionInfo;

/**
 * Decides which function names a function may call.
 *
 * <p>The flow inferencer links functions through this interface only, so a more precise
 * call-graph source (import-aware or type-aware resolution) can replace name matching
 * without touching chain assembly.
 */
@FunctionalInterface
public interface CalleeNames {

    /**
     * Returns the simple function names a function may call.
     *
     * @param function caller
     * @return simple names of possible callees
     */
    Set<String> calleeNames(FunctionInfo function);
}
