package com.autodoc.core.analyzer;

import com.autodoc.core.analyzer.classify.FunctionRule;
import com.autodoc.core.analyzer.classify.MatchMode;
import com.autodoc.core.analyzer.classify.RuleTable;
import com.autodoc.core.config.AnalyzerConfig;
import com.autodoc.core.config.AnalyzerConfig.ClassificationSettings;
import com.autodoc.core.config.AnalyzerConfig.FlowSettings;
import com.autodoc.core.model.AnalysisResult;
import com.autodoc.core.model.ArchitectureLayer;
import com.autodoc.core.model.DependencyEdge;
import com.autodoc.core.model.DiagnosticKind;
import com.autodoc.core.model.FunctionCategory;
import com.autodoc.core.model.FunctionInfo;
import com.autodoc.core.model.LayerType;
import com.autodoc.core.model.ModuleInfo;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Functional tests for {@link SourceAnalyzer}.
 */
class SourceAnalyzerTest extends AnalyzerTestBase {

    private static final String PIPELINE = """
        def main():
            data = process_data()
            return data

        def process_data():
            rows = [1, 2, 3]
            save_results(rows)
            return rows

        def save_results(rows):
            print(rows)
        """;

    private final SourceAnalyzer analyzer = new SourceAnalyzer(configWithWorkers(4));

    @Test
    void analyze_privateFunctionWithNestedBranches() {
        // Given
        String source = """
            def _save_report(rows):
                if rows:
                    for row in rows:
                        print(row)
            """;

        // When
        AnalysisResult result = analyzer.analyze("project", List.of(SourceFile.of("report.py", source)));

        // Then
        FunctionInfo function = result.functionNamed("report.py", "_save_report").orElseThrow();
        assertThat(function.category()).isEqualTo(FunctionCategory.PRIVATE);
        assertThat(function.complexity()).isEqualTo(3);
    }

    @Test
    void analyze_setterWithoutBranches() {
        // Given
        String source = """
            def save_documentation(doc, path):
                with open(path, "w") as handle:
                    handle.write(doc)
            """;

        // When
        AnalysisResult result = analyzer.analyze("project", List.of(SourceFile.of("docs.py", source)));

        // Then
        FunctionInfo function = result.function(0);
        assertThat(function.category()).isEqualTo(FunctionCategory.SETTER);
        assertThat(function.complexity()).isEqualTo(1);
    }

    @Test
    void analyze_resolvesInternalAndExternalDependencies() {
        // Given
        List<SourceFile> files = List.of(
            SourceFile.of("b.py", "VALUE = 1\n"),
            SourceFile.of("a.py", "import b\nimport requests\n"));

        // When
        AnalysisResult result = analyzer.analyze("project", files);

        // Then
        assertThat(result.module(0).path()).isEqualTo("a.py");
        assertThat(result.dependencies()).containsExactly(
            DependencyEdge.internal(0, 1),
            DependencyEdge.external(0, "requests"));
        assertThat(result.externalPackages()).containsExactly("requests");
        assertThat(result.dependenciesOf(1)).isEmpty();
    }

    @Test
    void analyze_infersFlowChainFromEntryPointToOutput() {
        // When
        AnalysisResult result = analyzer.analyze("project", List.of(SourceFile.of("pipeline.py", PIPELINE)));

        // Then
        assertThat(result.flowChains()).singleElement().satisfies(chain -> {
            assertThat(chain.functionIds()).containsExactly(0, 1, 2);
            assertThat(chain.truncated()).isFalse();
        });
    }

    @Test
    void analyze_withSyntaxError_isolatesTheFailure() {
        // Given
        List<SourceFile> files = List.of(
            SourceFile.of("broken.py", "def broken(:\n    pass\n"),
            SourceFile.of("good.py", "def ok():\n    return 1\n"));

        // When
        AnalysisResult result = analyzer.analyze("project", files);

        // Then
        assertThat(result.parseFailures()).singleElement().satisfies(failure -> {
            assertThat(failure.path()).isEqualTo("broken.py");
            assertThat(failure.reason()).contains("broken.py");
        });
        assertThat(result.modules()).singleElement()
            .satisfies(module -> assertThat(module.path()).isEqualTo("good.py"));
        assertThat(result.diagnostics())
            .anySatisfy(diagnostic -> assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.PARSE_FAILURE));
        assertThat(result.statistics().filesAnalyzed()).isEqualTo(2);
        assertThat(result.statistics().filesFailed()).isEqualTo(1);
        assertThat(result.statistics().errorCounts()).containsEntry("syntax", 1);
    }

    @Test
    void analyze_withInvalidUtf8_reportsEncodingFailure() {
        // Given
        SourceFile invalid = new SourceFile("latin.py", new byte[] {'x', ' ', '=', ' ', (byte) 0xE9, '\n'});

        // When
        AnalysisResult result = analyzer.analyze("project", List.of(invalid));

        // Then
        assertThat(result.parseFailures()).singleElement()
            .satisfies(failure -> assertThat(failure.reason()).contains("UTF-8"));
        assertThat(result.statistics().errorCounts()).containsEntry("encoding", 1);
        assertThat(result.modules()).isEmpty();
    }

    @Test
    void analyze_withByteOrderMark_indexesModule() {
        // Given
        SourceFile bom = SourceFile.of("bom.py", "\uFEFFimport os\n\ndef f():\n    return 1\n");

        // When
        AnalysisResult result = analyzer.analyze("project", List.of(bom));

        // Then
        assertThat(result.parseFailures()).isEmpty();
        assertThat(result.modules()).extracting(ModuleInfo::path).containsExactly("bom.py");
        assertThat(result.functions()).extracting(FunctionInfo::name).containsExactly("f");
        assertThat(result.dependencies()).extracting(DependencyEdge::externalPackage).containsExactly("os");
    }

    @Test
    void analyze_withTrailingBlankOrCommentLines_keepsEveryFile() {
        // Given
        List<SourceFile> files = List.of(
            SourceFile.of("a1.py", "x = 1\n    \n"),
            SourceFile.of("a2.py", "def f():\n    return 1\n\n    \n"),
            SourceFile.of("a3.py", "def g():\n    return 2\n    # c"),
            SourceFile.of("a4.py", "def h():\n    return 3"));

        // When
        AnalysisResult result = analyzer.analyze("project", files);

        // Then
        assertThat(result.parseFailures()).isEmpty();
        assertThat(result.modules()).hasSize(4);
        assertThat(result.functions()).extracting(FunctionInfo::name).containsExactly("f", "g", "h");
    }

    @Test
    void analyze_recordsRuleTableVersion() {
        // Given
        AnalyzerConfig customRules = new AnalyzerConfig(
            configWithWorkers(2).analysis(),
            FlowSettings.defaults(),
            new ClassificationSettings(
                List.of(FunctionRule.byName(MatchMode.PREFIX, FunctionCategory.PROCESSOR, "handle_")),
                List.of()));
        List<SourceFile> files = List.of(SourceFile.of("events.py", "def handle_event(e):\n    return e\n"));

        // When
        AnalysisResult defaults = analyzer.analyze("project", files);
        AnalysisResult custom = new SourceAnalyzer(customRules).analyze("project", files);

        // Then
        assertThat(defaults.ruleTableVersion()).isEqualTo(RuleTable.DEFAULT_VERSION);
        assertThat(custom.ruleTableVersion()).isEqualTo("custom");
        assertThat(custom.function(0).category()).isEqualTo(FunctionCategory.PROCESSOR);
    }

    @Test
    void analyze_skipsFilesWithoutSourceExtension() {
        // Given
        List<SourceFile> files = List.of(
            SourceFile.of("notes.txt", "def not_python(:"),
            SourceFile.of("app.py", "x = 1\n"));

        // When
        AnalysisResult result = analyzer.analyze("project", files);

        // Then
        assertThat(result.modules()).hasSize(1);
        assertThat(result.parseFailures()).isEmpty();
        assertThat(result.statistics().filesDiscovered()).isEqualTo(2);
        assertThat(result.statistics().filesSkipped()).isEqualTo(1);
        assertThat(result.statistics().filesAnalyzed()).isEqualTo(1);
        assertThat(result.diagnostics()).singleElement().satisfies(diagnostic -> {
            assertThat(diagnostic.kind()).isEqualTo(DiagnosticKind.SKIPPED_FILE);
            assertThat(diagnostic.path()).isEqualTo("notes.txt");
        });
    }

    @Test
    void analyze_relocatesIdsAcrossFiles() {
        // Given
        List<SourceFile> files = List.of(
            SourceFile.of("b.py", "class Repo:\n    def load(self):\n        pass\n\ndef helper():\n    pass\n"),
            SourceFile.of("a.py", "def first():\n    pass\n"));

        // When
        AnalysisResult result = analyzer.analyze("project", files);

        // Then
        assertThat(result.functions()).extracting(FunctionInfo::id).containsExactly(0, 1, 2);
        assertThat(result.functions()).extracting(FunctionInfo::qualifiedName)
            .containsExactly("first", "Repo.load", "helper");
        assertThat(result.module(1).functionIds()).containsExactly(1, 2);
        assertThat(result.module(1).classIds()).containsExactly(0);
        assertThat(result.function(2).moduleId()).isEqualTo(1);
        assertThat(result.classesOf(result.module(1))).singleElement()
            .satisfies(cls -> assertThat(cls.moduleId()).isEqualTo(1));
        assertThat(result.moduleAt("b.py")).hasValueSatisfying(module ->
            assertThat(result.functionsOf(module)).extracting(FunctionInfo::name).containsExactly("load", "helper"));
        assertThat(result.moduleAt("missing.py")).isEmpty();
    }

    @Test
    void analyze_isIndependentOfInputOrder() {
        // Given
        List<SourceFile> files = new ArrayList<>(List.of(
            SourceFile.of("pipeline.py", PIPELINE),
            SourceFile.of("a.py", "import pipeline\nimport os\n"),
            SourceFile.of("broken.py", "class :\n"),
            SourceFile.of("pkg/__init__.py", "from .core import run\n"),
            SourceFile.of("pkg/core.py", "def run():\n    return 1\n")));
        List<SourceFile> reversed = new ArrayList<>(files);
        Collections.reverse(reversed);

        // When
        AnalysisResult first = analyzer.analyze("project", files);
        AnalysisResult second = new SourceAnalyzer(configWithWorkers(1)).analyze("project", reversed);

        // Then
        assertThat(second).isEqualTo(first);
    }

    @Test
    void analyze_whenCancelled_throwsAndProducesNoResult() {
        // Given
        List<SourceFile> files = List.of(SourceFile.of("a.py", "x = 1\n"), SourceFile.of("b.py", "y = 2\n"));

        // When / Then
        assertThatThrownBy(() -> analyzer.analyze("project", files, List.of("a.py", "b.py"), List.of(), () -> true))
            .isInstanceOf(CancellationException.class);
    }

    @Test
    void analyze_withNoFiles_returnsEmptyResult() {
        // When
        AnalysisResult result = analyzer.analyze("empty", List.of());

        // Then
        assertThat(result.root()).isEqualTo("empty");
        assertThat(result.modules()).isEmpty();
        assertThat(result.complexity().averageComplexity()).isZero();
        assertThat(result.overview().totalFiles()).isZero();
    }

    @Test
    void analyze_directory_profilesProjectAndArchitecture() throws IOException {
        // Given
        createFiles(Map.of(
            "requirements.txt", "requests\n",
            "models/user.py", "class UserModel:\n    pass\n",
            "views/home.py", "from models.user import UserModel\n\ndef render_home():\n    return UserModel()\n",
            "controllers/auth.py", "def login():\n    pass\n",
            "static/app.js", "console.log('hi');\n",
            "venv/lib/ignored.py", "import nothing\n"));

        // When
        AnalysisResult result = analyzer.analyze(tempDir);

        // Then
        assertThat(result.root()).isEqualTo(tempDir.getFileName().toString());
        assertThat(result.modules()).extracting(ModuleInfo::path)
            .containsExactly("controllers/auth.py", "models/user.py", "views/home.py");
        assertThat(result.overview().projectType()).isEqualTo("Python Library/Package");
        assertThat(result.overview().languagesDetected()).containsExactly("JavaScript", "Python");
        assertThat(result.overview().totalClasses()).isEqualTo(1);
        assertThat(result.architecturePatterns()).containsExactly("MVC", "Repository");
        assertThat(result.layers()).containsExactly(
            new ArchitectureLayer("controllers", LayerType.BUSINESS, 1),
            new ArchitectureLayer("models", LayerType.DATA, 1),
            new ArchitectureLayer("views", LayerType.PRESENTATION, 1));
        assertThat(result.dependencies()).containsExactly(DependencyEdge.internal(2, 1));
    }

    @Test
    void analyze_reportsHighComplexityFunctions() {
        // Given
        String source = """
            def tangled(a, b, c, d):
                if a:
                    pass
                if b:
                    pass
                if c:
                    pass
                if d:
                    pass
                while a and b and c:
                    pass
                for x in d:
                    if x or a or b:
                        pass
                return a

            def simple():
                return 1
            """;

        // When
        AnalysisResult result = analyzer.analyze("project", List.of(SourceFile.of("tangled.py", source)));

        // Then
        FunctionInfo tangled = result.function(0);
        assertThat(tangled.complexity()).isEqualTo(12);
        assertThat(result.complexity().highComplexityFunctions()).containsExactly(0);
        assertThat(result.complexity().maxComplexity()).isEqualTo(12);
        assertThat(result.complexity().averageComplexity()).isEqualTo(6.5);
    }
}
