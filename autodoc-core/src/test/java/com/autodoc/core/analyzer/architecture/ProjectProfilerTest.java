package com.autodoc.core.analyzer.architecture;

import com.autodoc.core.model.ClassCategory;
import com.autodoc.core.model.ClassInfo;
import com.autodoc.core.model.FunctionCategory;
import com.autodoc.core.model.FunctionInfo;
import com.autodoc.core.model.ModuleInfo;
import com.autodoc.core.model.ProjectOverview;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ProjectProfiler}.
 */
class ProjectProfilerTest {

    private final ProjectProfiler profiler = new ProjectProfiler();

    @Test
    void profile_countsEntitiesAndLines() {
        // Given
        List<ModuleInfo> modules = List.of(module(0, "a.py", 10), module(1, "pkg/b.py", 32));
        List<ClassInfo> classes = List.of(new ClassInfo(0, 1, "Repo", "Repo", "pkg/b.py", 1, 5, null,
            List.of(), List.of(), List.of(), ClassCategory.GENERAL, false, false));
        List<FunctionInfo> functions = List.of(
            new FunctionInfo(0, 0, "main", "main", "a.py", 1, 3, List.of(), null, null, 1,
                FunctionCategory.ENTRY_POINT, List.of(), List.of(), null, false, false, false, false));

        // When
        ProjectOverview overview = profiler.profile(modules, classes, functions,
            List.of("a.py", "pkg/b.py", "web/index.js", "requirements.txt"));

        // Then
        assertThat(overview.totalFiles()).isEqualTo(2);
        assertThat(overview.totalLines()).isEqualTo(42);
        assertThat(overview.totalClasses()).isEqualTo(1);
        assertThat(overview.totalFunctions()).isEqualTo(1);
        assertThat(overview.languagesDetected()).containsExactly("JavaScript", "Python");
        assertThat(overview.projectType()).isEqualTo(ProjectProfiler.PYTHON_LIBRARY);
    }

    @Test
    void projectTypeOf_recognizesFrameworks() {
        assertThat(ProjectProfiler.projectTypeOf(List.of("requirements.txt", "app.py")))
            .isEqualTo(ProjectProfiler.FLASK);
        assertThat(ProjectProfiler.projectTypeOf(List.of("setup.py", "blog/django_settings.py")))
            .isEqualTo(ProjectProfiler.DJANGO);
        assertThat(ProjectProfiler.projectTypeOf(List.of("pyproject.toml", "fastapi_app/main.py")))
            .isEqualTo(ProjectProfiler.FASTAPI);
        assertThat(ProjectProfiler.projectTypeOf(List.of("requirements.txt", "streamlit_app.py")))
            .isEqualTo(ProjectProfiler.STREAMLIT);
    }

    @Test
    void projectTypeOf_withoutPythonMarkers() {
        assertThat(ProjectProfiler.projectTypeOf(List.of("package.json", "src/index.js")))
            .isEqualTo(ProjectProfiler.NODE);
        assertThat(ProjectProfiler.projectTypeOf(List.of("main.py", "lib/requirements.txt")))
            .isEqualTo(ProjectProfiler.GENERAL);
        assertThat(ProjectProfiler.projectTypeOf(List.of())).isEqualTo(ProjectProfiler.GENERAL);
    }

    @Test
    void languagesOf_ignoresUnknownExtensions() {
        assertThat(ProjectProfiler.languagesOf(List.of("README.md", "Makefile", "tool.PY")))
            .containsExactly("Python");
    }

    private static ModuleInfo module(int id, String path, int lines) {
        return new ModuleInfo(id, path, path, null, lines, List.of(), List.of(), List.of(), false);
    }
}
