package com.autodoc.core.analyzer.classify;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

import com.autodoc.core.model.ClassCategory;
import com.autodoc.core.model.FunctionCategory;

/**
 * Assigns semantic categories to functions and classes from an ordered {@link RuleTable}.
 *
 * <p>Classification is a pure function of its inputs: the first rule that fires decides,
 * and when no rule fires the category is {@code general}. Instances hold no mutable state
 * and are shared by all workers of a run.
 */
public class RoleClassifier {

    private final RuleTable rules;

    public RoleClassifier(RuleTable rules) {
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
    }

    /**
     * Classifies a function.
     *
     * @param name function name
     * @param decorators decorator names
     * @return category, never null
     */
    public FunctionCategory classifyFunction(String name, List<String> decorators) {
        for (FunctionRule rule : rules.functionRules()) {
            if (rule.matches(name, decorators)) {
                return rule.category();
            }
        }
        return FunctionCategory.GENERAL;
    }

    /**
     * Classifies a class.
     *
     * @param name class name
     * @param bases base class expressions
     * @param methodNames names of methods defined in the class body
     * @param docstring docstring, or null
     * @return category, never null
     */
    public ClassCategory classifyClass(String name, List<String> bases, Collection<String> methodNames, String docstring) {
        for (ClassRule rule : rules.classRules()) {
            if (rule.matches(name, bases, methodNames, docstring)) {
                return rule.category();
            }
        }
        return ClassCategory.GENERAL;
    }

    public RuleTable rules() {
        return rules;
    }
}
