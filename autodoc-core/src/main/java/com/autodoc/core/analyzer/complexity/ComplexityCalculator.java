package com.autodoc.core.analyzer.complexity;

import java.util.Comparator;
import java.util.List;

import com.autodoc.core.analyzer.ast.PythonAst;
import com.autodoc.core.analyzer.ast.PythonAst.Node;
import com.autodoc.core.model.ComplexitySummary;
import com.autodoc.core.model.FunctionInfo;

/**
 * Computes cyclomatic complexity from the syntax tree.
 *
 * <p>The score of a function is one plus the number of decision points in its own body:
 * {@code if}/{@code elif} clauses, loops, {@code except} handlers, comprehension filters,
 * conditional expressions and each boolean operator ({@code a and b or c} adds two).
 * Nested functions and classes are scored separately and add nothing to the enclosing
 * function. Lambdas belong to the function that contains them.
 */
public class ComplexityCalculator {

    /**
     * Scores one function.
     *
     * @param function function node
     * @return complexity, at least 1
     */
    public int complexity(PythonAst.FunctionDef function) {
        int decisions = 0;
        for (Node child : function.children()) {
            decisions += decisionPoints(child);
        }
        return 1 + decisions;
    }

    private int decisionPoints(Node node) {
        if (node.kind() == PythonAst.NodeKind.FUNCTION_DEF || node.kind() == PythonAst.NodeKind.CLASS_DEF) {
            return 0;
        }
        int total = weight(node);
        for (Node child : node.children()) {
            total += decisionPoints(child);
        }
        return total;
    }

    /**
     * Returns the decision points contributed by a node itself, excluding its children.
     */
    static int weight(Node node) {
        return switch (node.kind()) {
            case IF, ELIF, WHILE, FOR, EXCEPT_HANDLER, COMPREHENSION_FILTER, TERNARY -> 1;
            case BOOL_OP -> ((PythonAst.BoolOp) node).operands() - 1;
            case MODULE, CLASS_DEF, FUNCTION_DEF, IMPORT, IMPORT_FROM, CALL, BLOCK -> 0;
        };
    }

    /**
     * Summarizes the complexity of a set of functions.
     *
     * @param functions functions with global ids
     * @param threshold complexity above which a function is listed
     * @return summary
     */
    public static ComplexitySummary summarize(List<FunctionInfo> functions, int threshold) {
        if (functions.isEmpty()) {
            return ComplexitySummary.empty(threshold);
        }
        int total = 0;
        int max = 0;
        for (FunctionInfo function : functions) {
            total += function.complexity();
            max = Math.max(max, function.complexity());
        }
        double average = Math.round(total * 100.0 / functions.size()) / 100.0;
        List<Integer> high = functions.stream()
            .filter(function -> function.complexity() > threshold)
            .sorted(Comparator.comparingInt(FunctionInfo::complexity).reversed()
                .thenComparingInt(FunctionInfo::id))
            .map(FunctionInfo::id)
            .toList();
        return new ComplexitySummary(average, max, functions.size(), threshold, high);
    }
}
