package com.autodoc.core.analyzer.index;

import java.util.List;
import java.util.Objects;

import com.autodoc.core.model.ClassInfo;
import com.autodoc.core.model.FunctionInfo;
import com.autodoc.core.model.ModuleInfo;

/**
 * Indexed content of one file, with file-local ids.
 *
 * <p>Class and function ids count from zero within the file and the module id is zero;
 * the result builder relocates them into the run-wide tables after the barrier.
 *
 * @param module module record
 * @param classes classes in declaration order
 * @param functions functions in declaration order
 */
public record FileAnalysis(ModuleInfo module, List<ClassInfo> classes, List<FunctionInfo> functions) {

    public FileAnalysis {
        Objects.requireNonNull(module, "module must not be null");
        classes = classes != null ? List.copyOf(classes) : List.of();
        functions = functions != null ? List.copyOf(functions) : List.of();
    }

    public String path() {
        return module.path();
    }
}
