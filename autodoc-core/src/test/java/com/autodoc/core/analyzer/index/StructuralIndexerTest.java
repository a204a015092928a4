package com.autodoc.core.analyzer.index;

import com.autodoc.core.analyzer.classify.RoleClassifier;
import com.autodoc.core.analyzer.classify.RuleTable;
import com.autodoc.core.analyzer.complexity.ComplexityCalculator;
import com.autodoc.core.analyzer.impl.python.util.PythonAstParser;
import com.autodoc.core.model.ClassCategory;
import com.autodoc.core.model.ClassInfo;
import com.autodoc.core.model.FunctionCategory;
import com.autodoc.core.model.FunctionInfo;
import com.autodoc.core.model.ImportKind;
import com.autodoc.core.model.ImportRef;
import com.autodoc.core.model.ModuleInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link StructuralIndexer}.
 */
class StructuralIndexerTest {

    private static final String SERVICE = """
        class Service:
            def handle(self, request):
                def inner():
                    return request
                return inner()

            @staticmethod
            def build_default():
                return Service()

            @property
            def name(self):
                return "service"

            @classmethod
            def create(cls):
                return cls()

        def helper():
            pass
        """;

    private final PythonAstParser parser = new PythonAstParser();
    private final StructuralIndexer indexer = new StructuralIndexer(
        new ComplexityCalculator(), new RoleClassifier(RuleTable.defaults()));

    @Test
    void index_assignsFileLocalIdsInDeclarationOrder() {
        // When
        FileAnalysis analysis = index("app/service.py", SERVICE);

        // Then
        assertThat(analysis.functions())
            .extracting(FunctionInfo::id, FunctionInfo::qualifiedName)
            .containsExactly(
                tuple(0, "Service.handle"),
                tuple(1, "Service.handle.inner"),
                tuple(2, "Service.build_default"),
                tuple(3, "Service.name"),
                tuple(4, "Service.create"),
                tuple(5, "helper"));
        assertThat(analysis.module().functionIds()).containsExactly(0, 1, 2, 3, 4, 5);
        assertThat(analysis.module().classIds()).containsExactly(0);
        assertThat(analysis.path()).isEqualTo("app/service.py");
    }

    @Test
    void index_recordsOwnerClassOnlyForDirectMethods() {
        // When
        List<FunctionInfo> functions = index("app/service.py", SERVICE).functions();

        // Then
        assertThat(functions.get(0).ownerClass()).isEqualTo("Service");
        assertThat(functions.get(0).method()).isTrue();
        assertThat(functions.get(1).ownerClass()).isNull();
        assertThat(functions.get(5).ownerClass()).isNull();
    }

    @Test
    void index_collectsCallsOfOwnBodyOnly() {
        // When
        List<FunctionInfo> functions = index("app/service.py", SERVICE).functions();

        // Then
        assertThat(functions.get(0).calls()).containsExactly("inner");
        assertThat(functions.get(1).calls()).isEmpty();
        assertThat(functions.get(2).calls()).containsExactly("Service");
    }

    @Test
    void index_setsMethodFlagsFromDecorators() {
        // When
        List<FunctionInfo> functions = index("app/service.py", SERVICE).functions();

        // Then
        FunctionInfo buildDefault = functions.get(2);
        assertThat(buildDefault.staticLike()).isTrue();
        assertThat(buildDefault.category()).isEqualTo(FunctionCategory.CREATOR);

        FunctionInfo name = functions.get(3);
        assertThat(name.property()).isTrue();
        assertThat(name.staticLike()).isFalse();

        FunctionInfo create = functions.get(4);
        assertThat(create.classMethod()).isTrue();
        assertThat(create.staticLike()).isFalse();
        assertThat(create.category()).isEqualTo(FunctionCategory.GENERAL);

        assertThat(functions.get(5).staticLike()).isFalse();
    }

    @Test
    void index_buildsClassRecord() {
        // When
        ClassInfo service = index("app/service.py", SERVICE).classes().get(0);

        // Then
        assertThat(service.name()).isEqualTo("Service");
        assertThat(service.qualifiedName()).isEqualTo("Service");
        assertThat(service.category()).isEqualTo(ClassCategory.SERVICE);
        assertThat(service.methods()).containsExactly("handle", "build_default", "name", "create");
        assertThat(service.line()).isEqualTo(1);
        assertThat(service.file()).isEqualTo("app/service.py");
    }

    @Test
    void index_detectsAbstractAndExceptionBases() {
        // Given
        String source = """
            from abc import ABC

            class Repository(ABC):
                pass

            class NotFound(ValueError):
                pass

            class Plain:
                pass
            """;

        // When
        List<ClassInfo> classes = index("repo.py", source).classes();

        // Then
        assertThat(classes.get(0).abstractBase()).isTrue();
        assertThat(classes.get(0).exceptionType()).isFalse();
        assertThat(classes.get(1).exceptionType()).isTrue();
        assertThat(classes.get(2).abstractBase()).isFalse();
        assertThat(classes.get(2).exceptionType()).isFalse();
    }

    @Test
    void index_collectsImportsIncludingNestedOnes() {
        // Given
        String source = """
            import os, json as j
            from ..core import engine, models
            from . import helpers

            def lazy():
                import yaml
                return yaml
            """;

        // When
        List<ImportRef> imports = index("pkg/sub/mod.py", source).module().imports();

        // Then
        assertThat(imports).hasSize(5);
        assertThat(imports.get(0).kind()).isEqualTo(ImportKind.MODULE);
        assertThat(imports.get(0).module()).isEqualTo("os");
        assertThat(imports.get(1).module()).isEqualTo("json");
        assertThat(imports.get(2).kind()).isEqualTo(ImportKind.MEMBER);
        assertThat(imports.get(2).module()).isEqualTo("core");
        assertThat(imports.get(2).level()).isEqualTo(2);
        assertThat(imports.get(2).names()).containsExactly("engine", "models");
        assertThat(imports.get(3).module()).isEmpty();
        assertThat(imports.get(3).level()).isEqualTo(1);
        assertThat(imports.get(4).module()).isEqualTo("yaml");
        assertThat(imports.get(4).line()).isEqualTo(6);
    }

    @Test
    void index_namesModulesFromPaths() {
        assertThat(index("pkg/__init__.py", "").module().name()).isEqualTo("pkg");
        assertThat(index("pkg/sub/mod.py", "").module().name()).isEqualTo("pkg.sub.mod");
        assertThat(index("setup.py", "").module().name()).isEqualTo("setup");
    }

    @Test
    void index_marksEntryModules() {
        // Given
        String guarded = """
            def run():
                pass

            if __name__ == "__main__":
                run()
            """;

        // When / Then
        assertThat(index("tool.py", guarded).module().entryModule()).isTrue();
        assertThat(index("pkg/__main__.py", "").module().entryModule()).isTrue();
        assertThat(index("main.py", "").module().entryModule()).isTrue();
        assertThat(index("lib.py", "def run():\n    pass\n").module().entryModule()).isFalse();
    }

    @Test
    void index_keepsModuleDocstringAndLineCount() {
        // Given
        String source = """
            \"\"\"Report helpers.\"\"\"

            def _save_report(rows):
                if rows:
                    for row in rows:
                        print(row)
            """;

        // When
        FileAnalysis analysis = index("report.py", source);

        // Then
        ModuleInfo module = analysis.module();
        assertThat(module.docstring()).isEqualTo("Report helpers.");
        assertThat(module.lineCount()).isEqualTo(6);
        FunctionInfo saveReport = analysis.functions().get(0);
        assertThat(saveReport.category()).isEqualTo(FunctionCategory.PRIVATE);
        assertThat(saveReport.complexity()).isEqualTo(3);
    }

    @Test
    void index_marksAsyncFunctions() {
        // Given
        String source = """
            async def fetch_user(user_id: int) -> dict:
                return await client.get(user_id)
            """;

        // When
        FunctionInfo fetch = index("client.py", source).functions().get(0);

        // Then
        assertThat(fetch.asyncDef()).isTrue();
        assertThat(fetch.category()).isEqualTo(FunctionCategory.GETTER);
        assertThat(fetch.returnType()).isEqualTo("dict");
        assertThat(fetch.parameters()).singleElement()
            .satisfies(parameter -> {
                assertThat(parameter.type()).isEqualTo("int");
                assertThat(parameter.hasDefault()).isFalse();
            });
        assertThat(fetch.calls()).containsExactly("client.get");
    }

    private FileAnalysis index(String path, String source) {
        return indexer.index(path, parser.parseString(source, path).tree());
    }
}
