package com.autodoc.core.analyzer.classify;

import java.util.ArrayList;
import java.util.List;

import com.autodoc.core.analyzer.classify.ClassRule.Target;
import com.autodoc.core.model.ClassCategory;
import com.autodoc.core.model.FunctionCategory;

/**
 * Ordered rule tables for function and class classification.
 *
 * <p>Rules are evaluated top to bottom and the first match wins, so the order is part of
 * the table's meaning: a leading-underscore function is {@code private} even if its name
 * also carries a {@code process_} prefix, because the private rule comes first.
 *
 * @param version table version, reported as {@code AnalysisResult#ruleTableVersion()}
 * @param functionRules ordered function rules
 * @param classRules ordered class rules
 */
public record RuleTable(String version, List<FunctionRule> functionRules, List<ClassRule> classRules) {

    public static final String DEFAULT_VERSION = "1";

    private static final String[][] CLASS_KEYWORDS = {
        {"analyzer", "parser"},
        {"generator", "builder", "factory"},
        {"manager", "service", "handler", "controller", "client"},
        {"model", "schema"},
        {"entity"},
        {"pipeline", "workflow"},
    };

    private static final ClassCategory[] CLASS_KEYWORD_CATEGORIES = {
        ClassCategory.ANALYZER,
        ClassCategory.GENERATOR,
        ClassCategory.SERVICE,
        ClassCategory.MODEL,
        ClassCategory.ENTITY,
        ClassCategory.PIPELINE,
    };

    public RuleTable {
        version = version != null ? version : DEFAULT_VERSION;
        functionRules = functionRules != null ? List.copyOf(functionRules) : List.of();
        classRules = classRules != null ? List.copyOf(classRules) : List.of();
    }

    /**
     * Returns the built-in tables.
     *
     * @return default rule table
     */
    public static RuleTable defaults() {
        return new RuleTable(DEFAULT_VERSION, defaultFunctionRules(), defaultClassRules());
    }

    /**
     * Returns a table that replaces the defaults with the given rules where they are non-empty.
     *
     * @param functionRules replacement function rules, or empty to keep the defaults
     * @param classRules replacement class rules, or empty to keep the defaults
     * @return rule table
     */
    public static RuleTable withOverrides(List<FunctionRule> functionRules, List<ClassRule> classRules) {
        boolean customFunctions = functionRules != null && !functionRules.isEmpty();
        boolean customClasses = classRules != null && !classRules.isEmpty();
        if (!customFunctions && !customClasses) {
            return defaults();
        }
        return new RuleTable(
            "custom",
            customFunctions ? functionRules : defaultFunctionRules(),
            customClasses ? classRules : defaultClassRules());
    }

    private static List<FunctionRule> defaultFunctionRules() {
        return List.of(
            FunctionRule.byName(MatchMode.DUNDER, FunctionCategory.DUNDER),
            FunctionRule.byName(MatchMode.EXACT, FunctionCategory.ENTRY_POINT, "main"),
            FunctionRule.byDecorator(MatchMode.EXACT, FunctionCategory.ENTRY_POINT,
                "command", "group", "entrypoint", "entry_point"),
            FunctionRule.byName(MatchMode.PREFIX, FunctionCategory.PRIVATE, "_"),
            FunctionRule.byName(MatchMode.PREFIX, FunctionCategory.GETTER, "get_", "fetch_", "load_", "retrieve_"),
            FunctionRule.byName(MatchMode.PREFIX, FunctionCategory.SETTER, "set_", "save_", "update_", "write_"),
            FunctionRule.byName(MatchMode.PREFIX, FunctionCategory.CREATOR, "create_", "generate_", "build_", "make_"),
            FunctionRule.byName(MatchMode.PREFIX, FunctionCategory.PROCESSOR,
                "process_", "transform_", "analyze_", "convert_")
        );
    }

    private static List<ClassRule> defaultClassRules() {
        List<ClassRule> rules = new ArrayList<>();
        addKeywordRules(rules, Target.NAME);
        addKeywordRules(rules, Target.BASE);
        rules.add(ClassRule.of(Target.METHOD, MatchMode.PREFIX, ClassCategory.ANALYZER, "analyze"));
        rules.add(ClassRule.of(Target.METHOD, MatchMode.PREFIX, ClassCategory.GENERATOR, "generate"));
        rules.add(ClassRule.of(Target.METHOD, MatchMode.EXACT, ClassCategory.PIPELINE, "add_step", "add_stage"));
        addKeywordRules(rules, Target.DOCSTRING);
        return rules;
    }

    private static void addKeywordRules(List<ClassRule> rules, Target target) {
        for (int i = 0; i < CLASS_KEYWORDS.length; i++) {
            rules.add(ClassRule.of(target, MatchMode.CONTAINS, CLASS_KEYWORD_CATEGORIES[i], CLASS_KEYWORDS[i]));
        }
    }
}
