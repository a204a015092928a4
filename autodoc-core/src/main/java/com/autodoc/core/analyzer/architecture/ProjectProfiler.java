package com.autodoc.core.analyzer.architecture;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

import com.autodoc.core.model.ClassInfo;
import com.autodoc.core.model.FunctionInfo;
import com.autodoc.core.model.ModuleInfo;
import com.autodoc.core.model.ProjectOverview;
import com.autodoc.core.util.Languages;

/**
 * Computes the project overview: headline counts, detected languages and project type.
 *
 * <p>The project type comes from marker files in the root:
 * <ul>
 *   <li>{@code requirements.txt}, {@code setup.py} or {@code pyproject.toml}: a Python project,
 *       refined to a Flask, Django, FastAPI or Streamlit application when a path mentions
 *       the framework (or {@code app.py} exists, for Flask)</li>
 *   <li>{@code package.json}: a Node.js application</li>
 *   <li>otherwise a general software project</li>
 * </ul>
 */
public class ProjectProfiler {

    static final String FLASK = "Flask Web Application";
    static final String DJANGO = "Django Web Application";
    static final String FASTAPI = "FastAPI Application";
    static final String STREAMLIT = "Streamlit Application";
    static final String PYTHON_LIBRARY = "Python Library/Package";
    static final String NODE = "Node.js Application";
    static final String GENERAL = "General Software Project";

    private static final Set<String> PYTHON_MARKERS = Set.of("requirements.txt", "setup.py", "pyproject.toml");

    public ProjectOverview profile(
        List<ModuleInfo> modules,
        List<ClassInfo> classes,
        List<FunctionInfo> functions,
        Collection<String> allPaths
    ) {
        int totalLines = modules.stream().mapToInt(ModuleInfo::lineCount).sum();
        return new ProjectOverview(
            modules.size(),
            totalLines,
            functions.size(),
            classes.size(),
            languagesOf(allPaths),
            projectTypeOf(allPaths)
        );
    }

    static List<String> languagesOf(Collection<String> allPaths) {
        Set<String> languages = new TreeSet<>();
        for (String path : allPaths) {
            Languages.displayNameOf(path).ifPresent(languages::add);
        }
        return List.copyOf(languages);
    }

    static String projectTypeOf(Collection<String> allPaths) {
        Set<String> rootFiles = new TreeSet<>();
        for (String path : allPaths) {
            if (path.indexOf('/') < 0) {
                rootFiles.add(path.toLowerCase(Locale.ROOT));
            }
        }

        if (rootFiles.stream().anyMatch(PYTHON_MARKERS::contains)) {
            if (rootFiles.contains("app.py") || anyPathContains(allPaths, "flask")) {
                return FLASK;
            }
            if (anyPathContains(allPaths, "django")) {
                return DJANGO;
            }
            if (anyPathContains(allPaths, "fastapi")) {
                return FASTAPI;
            }
            if (anyPathContains(allPaths, "streamlit")) {
                return STREAMLIT;
            }
            return PYTHON_LIBRARY;
        }
        if (rootFiles.contains("package.json")) {
            return NODE;
        }
        return GENERAL;
    }

    private static boolean anyPathContains(Collection<String> paths, String word) {
        return paths.stream().anyMatch(path -> path.toLowerCase(Locale.ROOT).contains(word));
    }
}
