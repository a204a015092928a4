package com.autodoc.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Complete, immutable outcome of analyzing one source tree.
 *
 * <p>Modules, classes and functions live in flat tables; every identifier equals the
 * record's index in its table, so cross references ({@link ModuleInfo#classIds()},
 * {@link DependencyEdge#targetModule()}, {@link FlowNode#functionId()}) are plain lookups.
 * Modules are ordered by path, and classes and functions by module and then declaration order.
 *
 * @param root label of the analyzed root
 * @param overview headline numbers
 * @param modules module table
 * @param classes class table
 * @param functions function table
 * @param dependencies module dependency edges
 * @param flowChains inferred flow chains
 * @param layers architecture layers of top-level directories
 * @param architecturePatterns detected architecture patterns
 * @param complexity complexity summary
 * @param parseFailures files that could not be parsed
 * @param diagnostics non-fatal conditions
 * @param statistics run statistics
 * @param ruleTableVersion version of the classification rules that assigned the categories
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AnalysisResult(
    String root,
    ProjectOverview overview,
    List<ModuleInfo> modules,
    List<ClassInfo> classes,
    List<FunctionInfo> functions,
    List<DependencyEdge> dependencies,
    List<FlowChain> flowChains,
    List<ArchitectureLayer> layers,
    List<String> architecturePatterns,
    ComplexitySummary complexity,
    List<ParseFailure> parseFailures,
    List<Diagnostic> diagnostics,
    AnalysisStatistics statistics,
    String ruleTableVersion
) {
    public AnalysisResult {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(overview, "overview must not be null");
        Objects.requireNonNull(complexity, "complexity must not be null");
        modules = modules != null ? List.copyOf(modules) : List.of();
        classes = classes != null ? List.copyOf(classes) : List.of();
        functions = functions != null ? List.copyOf(functions) : List.of();
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
        flowChains = flowChains != null ? List.copyOf(flowChains) : List.of();
        layers = layers != null ? List.copyOf(layers) : List.of();
        architecturePatterns = architecturePatterns != null ? List.copyOf(architecturePatterns) : List.of();
        parseFailures = parseFailures != null ? List.copyOf(parseFailures) : List.of();
        diagnostics = diagnostics != null ? List.copyOf(diagnostics) : List.of();
        statistics = statistics != null ? statistics : AnalysisStatistics.empty();
    }

    public ModuleInfo module(int id) {
        return modules.get(id);
    }

    public ClassInfo classInfo(int id) {
        return classes.get(id);
    }

    public FunctionInfo function(int id) {
        return functions.get(id);
    }

    /**
     * Finds a module by its root-relative path.
     *
     * @param path forward-slash path
     * @return the module, if the file was analyzed
     */
    public Optional<ModuleInfo> moduleAt(String path) {
        return modules.stream().filter(module -> module.path().equals(path)).findFirst();
    }

    /**
     * Finds a function by module path and qualified name.
     *
     * @param path module path
     * @param qualifiedName dotted name within the module
     * @return the function, if present
     */
    public Optional<FunctionInfo> functionNamed(String path, String qualifiedName) {
        return functions.stream()
            .filter(function -> function.file().equals(path) && function.qualifiedName().equals(qualifiedName))
            .findFirst();
    }

    /**
     * Returns the functions defined in a module, in declaration order.
     *
     * @param module defining module
     * @return function records
     */
    public List<FunctionInfo> functionsOf(ModuleInfo module) {
        return module.functionIds().stream().map(this::function).toList();
    }

    /**
     * Returns the classes defined in a module, in declaration order.
     *
     * @param module defining module
     * @return class records
     */
    public List<ClassInfo> classesOf(ModuleInfo module) {
        return module.classIds().stream().map(this::classInfo).toList();
    }

    /**
     * Returns the dependency edges leaving a module.
     *
     * @param moduleId source module id
     * @return outgoing edges
     */
    public List<DependencyEdge> dependenciesOf(int moduleId) {
        return dependencies.stream().filter(edge -> edge.sourceModule() == moduleId).toList();
    }

    /**
     * Returns the distinct external packages imported anywhere, sorted.
     *
     * @return package names
     */
    public List<String> externalPackages() {
        return dependencies.stream()
            .filter(edge -> edge.type() == DependencyType.EXTERNAL)
            .map(DependencyEdge::externalPackage)
            .distinct()
            .sorted()
            .toList();
    }
}
