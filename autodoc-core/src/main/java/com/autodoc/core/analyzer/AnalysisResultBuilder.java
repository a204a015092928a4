package com.autodoc.core.analyzer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import com.autodoc.core.analyzer.classify.RuleTable;
import com.autodoc.core.analyzer.index.FileAnalysis;
import com.autodoc.core.model.AnalysisResult;
import com.autodoc.core.model.AnalysisStatistics;
import com.autodoc.core.model.ArchitectureLayer;
import com.autodoc.core.model.ClassInfo;
import com.autodoc.core.model.ComplexitySummary;
import com.autodoc.core.model.DependencyEdge;
import com.autodoc.core.model.Diagnostic;
import com.autodoc.core.model.FlowChain;
import com.autodoc.core.model.FunctionInfo;
import com.autodoc.core.model.ModuleInfo;
import com.autodoc.core.model.ParseFailure;
import com.autodoc.core.model.ProjectOverview;

/**
 * Assembles an {@link AnalysisResult} from per-file outcomes.
 *
 * <p>Per-file records carry file-local ids. {@link #relocate()} sorts the files by path and
 * moves every record into the run-wide tables, so ids only depend on the set of input paths
 * and never on the order in which workers finished.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * AnalysisResultBuilder builder = new AnalysisResultBuilder("my-project");
 * analyses.forEach(builder::addFile);
 * builder.relocate();
 *
 * AnalysisResult result = builder
 *     .dependencies(graphBuilder.build(builder.modules(), diagnostics))
 *     .overview(overview)
 *     .complexity(summary)
 *     .build();
 * }</pre>
 */
public class AnalysisResultBuilder {

    private final String root;
    private final List<FileAnalysis> files = new ArrayList<>();
    private final List<ParseFailure> parseFailures = new ArrayList<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private List<ModuleInfo> modules;
    private List<ClassInfo> classes;
    private List<FunctionInfo> functions;

    private ProjectOverview overview;
    private List<DependencyEdge> dependencies = List.of();
    private List<FlowChain> flowChains = List.of();
    private List<ArchitectureLayer> layers = List.of();
    private List<String> architecturePatterns = List.of();
    private ComplexitySummary complexity;
    private AnalysisStatistics statistics = AnalysisStatistics.empty();
    private String ruleTableVersion = RuleTable.DEFAULT_VERSION;

    public AnalysisResultBuilder(String root) {
        this.root = Objects.requireNonNull(root, "root must not be null");
    }

    public AnalysisResultBuilder addFile(FileAnalysis file) {
        if (modules != null) {
            throw new IllegalStateException("files cannot be added after relocation");
        }
        files.add(Objects.requireNonNull(file, "file must not be null"));
        return this;
    }

    public AnalysisResultBuilder addParseFailure(ParseFailure failure) {
        parseFailures.add(failure);
        return this;
    }

    public AnalysisResultBuilder addDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        return this;
    }

    public AnalysisResultBuilder addDiagnostics(List<Diagnostic> more) {
        diagnostics.addAll(more);
        return this;
    }

    /**
     * Moves all file-local records into the global tables.
     *
     * @return this builder
     */
    public AnalysisResultBuilder relocate() {
        List<FileAnalysis> ordered = new ArrayList<>(files);
        ordered.sort(Comparator.comparing(FileAnalysis::path));

        List<ModuleInfo> moduleTable = new ArrayList<>();
        List<ClassInfo> classTable = new ArrayList<>();
        List<FunctionInfo> functionTable = new ArrayList<>();
        for (FileAnalysis file : ordered) {
            int moduleId = moduleTable.size();
            int classOffset = classTable.size();
            int functionOffset = functionTable.size();
            moduleTable.add(file.module().relocate(moduleId, classOffset, functionOffset));
            file.classes().forEach(cls -> classTable.add(cls.relocate(moduleId, classOffset)));
            file.functions().forEach(fn -> functionTable.add(fn.relocate(moduleId, functionOffset)));
        }

        modules = List.copyOf(moduleTable);
        classes = List.copyOf(classTable);
        functions = List.copyOf(functionTable);
        return this;
    }

    public List<ModuleInfo> modules() {
        return requireRelocated(modules);
    }

    public List<ClassInfo> classes() {
        return requireRelocated(classes);
    }

    public List<FunctionInfo> functions() {
        return requireRelocated(functions);
    }

    /**
     * Returns the diagnostics gathered so far. Post-barrier passes append to this list.
     *
     * @return mutable diagnostic list
     */
    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public AnalysisResultBuilder overview(ProjectOverview overview) {
        this.overview = overview;
        return this;
    }

    public AnalysisResultBuilder dependencies(List<DependencyEdge> dependencies) {
        this.dependencies = dependencies;
        return this;
    }

    public AnalysisResultBuilder flowChains(List<FlowChain> flowChains) {
        this.flowChains = flowChains;
        return this;
    }

    public AnalysisResultBuilder layers(List<ArchitectureLayer> layers) {
        this.layers = layers;
        return this;
    }

    public AnalysisResultBuilder architecturePatterns(List<String> architecturePatterns) {
        this.architecturePatterns = architecturePatterns;
        return this;
    }

    public AnalysisResultBuilder complexity(ComplexitySummary complexity) {
        this.complexity = complexity;
        return this;
    }

    public AnalysisResultBuilder statistics(AnalysisStatistics statistics) {
        this.statistics = statistics;
        return this;
    }

    public AnalysisResultBuilder ruleTableVersion(String ruleTableVersion) {
        this.ruleTableVersion = ruleTableVersion;
        return this;
    }

    /**
     * Builds the immutable result.
     *
     * @return analysis result
     * @throws IllegalStateException if the tables were not relocated yet
     */
    public AnalysisResult build() {
        List<ParseFailure> failures = new ArrayList<>(parseFailures);
        failures.sort(Comparator.comparing(ParseFailure::path));
        return new AnalysisResult(
            root,
            overview,
            modules(),
            classes(),
            functions(),
            dependencies,
            flowChains,
            layers,
            architecturePatterns,
            complexity,
            failures,
            diagnostics,
            statistics,
            ruleTableVersion
        );
    }

    private static <T> List<T> requireRelocated(List<T> table) {
        if (table == null) {
            throw new IllegalStateException("relocate() must be called first");
        }
        return table;
    }
}
