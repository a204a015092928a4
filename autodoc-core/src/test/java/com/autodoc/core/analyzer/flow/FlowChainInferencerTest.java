package com.autodoc.core.analyzer.flow;

import com.autodoc.core.config.AnalyzerConfig.FlowSettings;
import com.autodoc.core.model.Diagnostic;
import com.autodoc.core.model.DiagnosticKind;
import com.autodoc.core.model.FlowChain;
import com.autodoc.core.model.FlowNode;
import com.autodoc.core.model.FlowRole;
import com.autodoc.core.model.FunctionInfo;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.autodoc.core.analyzer.flow.FlowTestFunctions.function;
import static com.autodoc.core.model.FunctionCategory.ENTRY_POINT;
import static com.autodoc.core.model.FunctionCategory.GENERAL;
import static com.autodoc.core.model.FunctionCategory.PROCESSOR;
import static com.autodoc.core.model.FunctionCategory.SETTER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FlowChainInferencer}.
 */
class FlowChainInferencerTest {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Test
    void infer_entryThroughTransformationToOutput_producesOneChain() {
        // Given
        List<FunctionInfo> functions = List.of(
            function(0, 0, "main", ENTRY_POINT, "process_data"),
            function(1, 0, "process_data", PROCESSOR, "save_results"),
            function(2, 0, "save_results", SETTER));

        // When
        List<FlowChain> chains = inferencer(FlowSettings.defaults()).infer(functions, diagnostics);

        // Then
        assertThat(chains).singleElement().satisfies(chain -> {
            assertThat(chain.functionIds()).containsExactly(0, 1, 2);
            assertThat(chain.truncated()).isFalse();
            assertThat(chain.nodes()).extracting(FlowNode::role)
                .containsExactly(FlowRole.ENTRY_POINT, FlowRole.TRANSFORMATION, FlowRole.OUTPUT);
            assertThat(chain.nodes()).extracting(FlowNode::detail)
                .containsExactly("entry_point", "processor", "storage");
        });
        assertThat(diagnostics).isEmpty();
    }

    @Test
    void infer_linksByCallAcrossModules() {
        // Given
        List<FunctionInfo> functions = List.of(
            function(0, 0, "main", ENTRY_POINT, "app.transform_rows"),
            function(1, 1, "transform_rows", PROCESSOR, "self.store.cache_rows"),
            function(2, 2, "cache_rows", GENERAL));

        // When
        List<FlowChain> chains = inferencer(FlowSettings.defaults()).infer(functions, diagnostics);

        // Then
        assertThat(chains).singleElement().satisfies(chain -> {
            assertThat(chain.functionIds()).containsExactly(0, 1, 2);
            assertThat(chain.nodes().get(2).role()).isEqualTo(FlowRole.DATA_STORE);
            assertThat(chain.nodes().get(1).detail()).isEqualTo("converter");
        });
    }

    @Test
    void infer_neverLinksIntoEntryPoints() {
        // Given
        List<FunctionInfo> functions = List.of(
            function(0, 0, "main", ENTRY_POINT, "cli"),
            function(1, 0, "cli", ENTRY_POINT, "process_jobs"),
            function(2, 1, "process_jobs", PROCESSOR, "save_jobs"),
            function(3, 2, "save_jobs", SETTER));

        // When
        List<FlowChain> chains = inferencer(FlowSettings.defaults()).infer(functions, diagnostics);

        // Then
        assertThat(chains).singleElement()
            .satisfies(chain -> assertThat(chain.functionIds()).containsExactly(1, 2, 3));
    }

    @Test
    void infer_withCallCycle_visitsEachFunctionOncePerPath() {
        // Given
        List<FunctionInfo> functions = List.of(
            function(0, 0, "main", ENTRY_POINT, "transform_a"),
            function(1, 1, "transform_a", PROCESSOR, "transform_b"),
            function(2, 2, "transform_b", PROCESSOR, "transform_a", "save_out"),
            function(3, 3, "save_out", SETTER));

        // When
        List<FlowChain> chains = inferencer(FlowSettings.defaults()).infer(functions, diagnostics);

        // Then
        assertThat(chains).singleElement()
            .satisfies(chain -> assertThat(chain.functionIds()).containsExactly(0, 1, 2, 3));
        assertThat(diagnostics).isEmpty();
    }

    @Test
    void infer_beyondMaxDepth_truncatesAndReportsOncePerEntry() {
        // Given
        List<FunctionInfo> functions = List.of(
            function(0, 0, "main", ENTRY_POINT, "process_a"),
            function(1, 1, "process_a", PROCESSOR, "process_b"),
            function(2, 2, "process_b", PROCESSOR, "process_c"),
            function(3, 3, "process_c", PROCESSOR, "save_all"),
            function(4, 4, "save_all", SETTER));

        // When
        List<FlowChain> chains = inferencer(new FlowSettings(2, null, null)).infer(functions, diagnostics);

        // Then
        assertThat(chains).singleElement().satisfies(chain -> {
            assertThat(chain.functionIds()).containsExactly(0, 1, 2);
            assertThat(chain.truncated()).isTrue();
        });
        assertThat(diagnostics).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.DEPTH_EXCEEDED);
            assertThat(diagnostic.path()).isEqualTo("mod0.py");
            assertThat(diagnostic.message()).contains("main", "2");
        });
    }

    @Test
    void infer_respectsPerEntryAndGlobalLimits() {
        // Given
        List<FunctionInfo> functions = List.of(
            function(0, 0, "main", ENTRY_POINT, "process_batch"),
            function(1, 1, "process_batch", PROCESSOR, "save_a", "save_b", "save_c"),
            function(2, 2, "save_a", SETTER),
            function(3, 3, "save_b", SETTER),
            function(4, 4, "save_c", SETTER),
            function(5, 5, "worker", ENTRY_POINT, "process_batch"));

        // When
        List<FlowChain> perEntry = inferencer(new FlowSettings(null, 2, null)).infer(functions, diagnostics);
        List<FlowChain> global = inferencer(new FlowSettings(null, 10, 2)).infer(functions, diagnostics);

        // Then
        assertThat(perEntry).extracting(FlowChain::functionIds).containsExactly(
            List.of(0, 1, 2), List.of(0, 1, 3), List.of(5, 1, 2), List.of(5, 1, 3));
        assertThat(global).extracting(FlowChain::functionIds).containsExactly(
            List.of(0, 1, 2), List.of(0, 1, 3));
    }

    @Test
    void infer_functionsWithoutRoleBreakChains() {
        // Given
        List<FunctionInfo> functions = List.of(
            function(0, 0, "main", ENTRY_POINT, "helper"),
            function(1, 1, "helper", GENERAL, "save_it"),
            function(2, 2, "save_it", SETTER));

        // When
        List<FlowChain> chains = inferencer(FlowSettings.defaults()).infer(functions, diagnostics);

        // Then
        assertThat(chains).isEmpty();
    }

    @Test
    void infer_uncalledFunctionsAreEntryPoints() {
        // Given
        List<FunctionInfo> functions = List.of(
            function(0, 0, "run_job", GENERAL, "run_job", "process_items"),
            function(1, 1, "process_items", PROCESSOR, "write_items"),
            function(2, 2, "write_items", SETTER));

        // When
        List<FlowChain> chains = inferencer(FlowSettings.defaults()).infer(functions, diagnostics);

        // Then
        assertThat(chains).singleElement()
            .satisfies(chain -> assertThat(chain.functionIds()).containsExactly(0, 1, 2));
    }

    @Test
    void infer_isDeterministic() {
        // Given
        List<FunctionInfo> functions = List.of(
            function(0, 0, "main", ENTRY_POINT, "process_batch"),
            function(1, 1, "process_batch", PROCESSOR, "save_b", "save_a"),
            function(2, 1, "save_a", SETTER),
            function(3, 1, "save_b", SETTER));

        // When
        List<FlowChain> first = inferencer(FlowSettings.defaults()).infer(functions, new ArrayList<>());
        List<FlowChain> second = inferencer(FlowSettings.defaults()).infer(functions, new ArrayList<>());

        // Then
        assertThat(first).isEqualTo(second);
        assertThat(first).extracting(FlowChain::functionIds)
            .containsExactly(List.of(0, 1, 2), List.of(0, 1, 3));
    }

    @Test
    void flowChain_shorterThanMinimum_isRejected() {
        assertThatThrownBy(() -> new FlowChain(List.of(
            new FlowNode(0, FlowRole.ENTRY_POINT, "entry_point"),
            new FlowNode(1, FlowRole.OUTPUT, "storage")), false))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static FlowChainInferencer inferencer(FlowSettings settings) {
        return new FlowChainInferencer(new NameMatchCalleeNames(), settings);
    }
}
