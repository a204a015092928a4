package com.autodoc.core.analyzer.classify;

import com.autodoc.core.model.ClassCategory;
import com.autodoc.core.model.FunctionCategory;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RoleClassifier} with the built-in and custom rule tables.
 */
class RoleClassifierTest {

    private final RoleClassifier classifier = new RoleClassifier(RuleTable.defaults());

    @Test
    void classifyFunction_appliesRulesInOrder() {
        assertThat(classifier.classifyFunction("__init__", List.of())).isEqualTo(FunctionCategory.DUNDER);
        assertThat(classifier.classifyFunction("main", List.of())).isEqualTo(FunctionCategory.ENTRY_POINT);
        assertThat(classifier.classifyFunction("_save_report", List.of())).isEqualTo(FunctionCategory.PRIVATE);
        assertThat(classifier.classifyFunction("get_user", List.of())).isEqualTo(FunctionCategory.GETTER);
        assertThat(classifier.classifyFunction("save_documentation", List.of())).isEqualTo(FunctionCategory.SETTER);
        assertThat(classifier.classifyFunction("build_index", List.of())).isEqualTo(FunctionCategory.CREATOR);
        assertThat(classifier.classifyFunction("process_data", List.of())).isEqualTo(FunctionCategory.PROCESSOR);
        assertThat(classifier.classifyFunction("helper", List.of())).isEqualTo(FunctionCategory.GENERAL);
    }

    @Test
    void classifyFunction_withEntryDecorator_isEntryPoint() {
        assertThat(classifier.classifyFunction("sync", List.of("click.command"))).isEqualTo(FunctionCategory.ENTRY_POINT);
        assertThat(classifier.classifyFunction("cli", List.of("group"))).isEqualTo(FunctionCategory.ENTRY_POINT);
        assertThat(classifier.classifyFunction("sync", List.of("app.route"))).isEqualTo(FunctionCategory.GENERAL);
    }

    @Test
    void classifyFunction_comparesNamesCaseSensitively() {
        assertThat(classifier.classifyFunction("Main", List.of())).isEqualTo(FunctionCategory.GENERAL);
        assertThat(classifier.classifyFunction("GET_items", List.of())).isEqualTo(FunctionCategory.GENERAL);
        assertThat(classifier.classifyFunction("Get_Config", List.of())).isEqualTo(FunctionCategory.GENERAL);
        assertThat(classifier.classifyFunction("sync", List.of("click.Command"))).isEqualTo(FunctionCategory.GENERAL);
    }

    @Test
    void classifyFunction_withCustomMixedCaseRule_keepsPatternCase() {
        RoleClassifier custom = new RoleClassifier(RuleTable.withOverrides(
            List.of(FunctionRule.byName(MatchMode.PREFIX, FunctionCategory.PROCESSOR, "on")),
            List.of()));

        assertThat(custom.classifyFunction("onClick", List.of())).isEqualTo(FunctionCategory.PROCESSOR);
        assertThat(custom.classifyFunction("OnClick", List.of())).isEqualTo(FunctionCategory.GENERAL);
    }

    @Test
    void classifyClass_isCaseInsensitive() {
        assertThat(classifier.classifyClass("HTTPCLIENT", List.of(), List.of(), null)).isEqualTo(ClassCategory.SERVICE);
        assertThat(classifier.classifyClass("Order", List.of("SQLModel"), List.of(), null)).isEqualTo(ClassCategory.MODEL);
    }

    @Test
    void classifyFunction_withShortDunderLikeName_isNotDunder() {
        assertThat(classifier.classifyFunction("____", List.of())).isEqualTo(FunctionCategory.PRIVATE);
    }

    @Test
    void classifyFunction_isDeterministic() {
        FunctionCategory first = classifier.classifyFunction("process_orders", List.of("staticmethod"));
        FunctionCategory second = new RoleClassifier(RuleTable.defaults())
            .classifyFunction("process_orders", List.of("staticmethod"));

        assertThat(first).isEqualTo(second);
    }

    @Test
    void classifyClass_byName() {
        assertThat(classify("CodeAnalyzer")).isEqualTo(ClassCategory.ANALYZER);
        assertThat(classify("ReportGenerator")).isEqualTo(ClassCategory.GENERATOR);
        assertThat(classify("UserService")).isEqualTo(ClassCategory.SERVICE);
        assertThat(classify("UserSchema")).isEqualTo(ClassCategory.MODEL);
        assertThat(classify("OrderEntity")).isEqualTo(ClassCategory.ENTITY);
        assertThat(classify("DataPipeline")).isEqualTo(ClassCategory.PIPELINE);
        assertThat(classify("Thing")).isEqualTo(ClassCategory.GENERAL);
    }

    @Test
    void classifyClass_byBaseMethodsAndDocstring() {
        assertThat(classifier.classifyClass("User", List.of("BaseModel"), List.of(), null))
            .isEqualTo(ClassCategory.MODEL);
        assertThat(classifier.classifyClass("Inspector", List.of(), List.of("analyze_tree"), null))
            .isEqualTo(ClassCategory.ANALYZER);
        assertThat(classifier.classifyClass("Flow", List.of(), List.of("add_step", "run"), null))
            .isEqualTo(ClassCategory.PIPELINE);
        assertThat(classifier.classifyClass("Record", List.of(), List.of(), "Entity stored per customer."))
            .isEqualTo(ClassCategory.ENTITY);
    }

    @Test
    void classifyClass_nameRulesWinOverBaseRules() {
        assertThat(classifier.classifyClass("UserService", List.of("BaseModel"), List.of(), null))
            .isEqualTo(ClassCategory.SERVICE);
    }

    @Test
    void withOverrides_replacesOnlyTheGivenTable() {
        RuleTable table = RuleTable.withOverrides(
            List.of(FunctionRule.byName(MatchMode.PREFIX, FunctionCategory.PROCESSOR, "handle_")),
            List.of());
        RoleClassifier custom = new RoleClassifier(table);

        assertThat(table.version()).isEqualTo("custom");
        assertThat(custom.classifyFunction("handle_event", List.of())).isEqualTo(FunctionCategory.PROCESSOR);
        assertThat(custom.classifyFunction("main", List.of())).isEqualTo(FunctionCategory.GENERAL);
        assertThat(custom.classifyClass("UserService", List.of(), List.of(), null)).isEqualTo(ClassCategory.SERVICE);
    }

    @Test
    void withOverrides_withoutRules_returnsDefaults() {
        assertThat(RuleTable.withOverrides(List.of(), List.of())).isEqualTo(RuleTable.defaults());
    }

    @Test
    void functionRule_withoutPatterns_isRejected() {
        assertThatThrownBy(() -> new FunctionRule(FunctionRule.Target.NAME, MatchMode.PREFIX, List.of(),
            FunctionCategory.GETTER))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private ClassCategory classify(String name) {
        return classifier.classifyClass(name, List.of(), List.of(), null);
    }
}
