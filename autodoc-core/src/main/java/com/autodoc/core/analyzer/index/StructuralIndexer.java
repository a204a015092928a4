package com.autodoc.core.analyzer.index;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.IntStream;

import com.autodoc.core.analyzer.ast.PythonAst;
import com.autodoc.core.analyzer.ast.PythonAst.Node;
import com.autodoc.core.analyzer.classify.RoleClassifier;
import com.autodoc.core.analyzer.complexity.ComplexityCalculator;
import com.autodoc.core.model.ClassInfo;
import com.autodoc.core.model.FunctionInfo;
import com.autodoc.core.model.ImportRef;
import com.autodoc.core.model.ModuleInfo;
import com.autodoc.core.model.Parameter;
import com.autodoc.core.util.FileUtils;
import com.autodoc.core.util.ModulePaths;

/**
 * Walks one syntax tree and produces the module, class and function records of a file.
 *
 * <p>Nested functions and classes become entities of their own, qualified by their
 * enclosing scopes ({@code Service.handle.inner}). Complexity and categories are computed
 * here, while the file is still owned by one worker, so the aggregation phase only has to
 * relocate ids.
 */
public class StructuralIndexer {

    private static final Set<String> ENTRY_FILE_NAMES = Set.of("main", "__main__");

    private final ComplexityCalculator complexityCalculator;
    private final RoleClassifier classifier;

    public StructuralIndexer(ComplexityCalculator complexityCalculator, RoleClassifier classifier) {
        this.complexityCalculator = Objects.requireNonNull(complexityCalculator, "complexityCalculator must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    /**
     * Indexes one parsed file.
     *
     * @param path forward-slash path relative to the analysis root
     * @param tree parsed module
     * @return file-local records
     */
    public FileAnalysis index(String path, PythonAst.ModuleDef tree) {
        Walk walk = new Walk(path);
        for (Node child : tree.children()) {
            walk.visit(child, Scope.TOP_LEVEL);
        }

        boolean entryModule = tree.mainGuard()
            || ENTRY_FILE_NAMES.contains(FileUtils.stripExtension(FileUtils.fileName(path)));
        ModuleInfo module = new ModuleInfo(
            0,
            ModulePaths.dottedName(path),
            path,
            tree.docstring(),
            tree.lineCount(),
            walk.imports,
            IntStream.range(0, walk.classes.size()).boxed().toList(),
            IntStream.range(0, walk.functions.size()).boxed().toList(),
            entryModule
        );
        return new FileAnalysis(module, walk.classes, walk.functions);
    }

    /**
     * Enclosing scope during the walk.
     *
     * @param qualifiedName dotted name of the scope, empty at module level
     * @param className simple name when the scope is a class body, otherwise null
     */
    private record Scope(String qualifiedName, String className) {

        static final Scope TOP_LEVEL = new Scope("", null);

        String qualify(String name) {
            return qualifiedName.isEmpty() ? name : qualifiedName + "." + name;
        }
    }

    /**
     * Mutable state of one walk; never shared between files.
     */
    private final class Walk {

        private final String path;
        private final List<ImportRef> imports = new ArrayList<>();
        private final List<ClassInfo> classes = new ArrayList<>();
        private final List<FunctionInfo> functions = new ArrayList<>();

        Walk(String path) {
            this.path = path;
        }

        void visit(Node node, Scope scope) {
            switch (node.kind()) {
                case CLASS_DEF -> indexClass((PythonAst.ClassDef) node, scope);
                case FUNCTION_DEF -> indexFunction((PythonAst.FunctionDef) node, scope);
                case IMPORT -> {
                    for (PythonAst.ImportAlias alias : ((PythonAst.Import) node).names()) {
                        imports.add(ImportRef.module(alias.name(), node.line()));
                    }
                }
                case IMPORT_FROM -> {
                    PythonAst.ImportFrom from = (PythonAst.ImportFrom) node;
                    List<String> names = from.names().stream().map(PythonAst.ImportAlias::name).toList();
                    imports.add(ImportRef.member(from.module(), names, from.level(), from.line()));
                }
                default -> node.children().forEach(child -> visit(child, scope));
            }
        }

        private void indexClass(PythonAst.ClassDef node, Scope scope) {
            String qualifiedName = scope.qualify(node.name());
            List<String> methods = node.children().stream()
                .filter(PythonAst.FunctionDef.class::isInstance)
                .map(child -> ((PythonAst.FunctionDef) child).name())
                .toList();

            classes.add(new ClassInfo(
                classes.size(),
                0,
                node.name(),
                qualifiedName,
                path,
                node.line(),
                node.endLine(),
                node.docstring(),
                node.bases(),
                methods,
                node.decorators(),
                classifier.classifyClass(node.name(), node.bases(), methods, node.docstring()),
                anyBaseContains(node.bases(), "abc", "abstract"),
                anyBaseContains(node.bases(), "exception", "error")
            ));

            Scope body = new Scope(qualifiedName, node.name());
            node.children().forEach(child -> visit(child, body));
        }

        private void indexFunction(PythonAst.FunctionDef node, Scope scope) {
            String qualifiedName = scope.qualify(node.name());
            String ownerClass = scope.className();
            List<String> decorators = node.decorators();
            boolean staticMethod = decorators.contains("staticmethod");

            functions.add(new FunctionInfo(
                functions.size(),
                0,
                node.name(),
                qualifiedName,
                path,
                node.line(),
                node.endLine(),
                node.parameters().stream()
                    .map(parameter -> new Parameter(parameter.name(), parameter.type(), parameter.defaultValue()))
                    .toList(),
                node.returnType(),
                node.docstring(),
                complexityCalculator.complexity(node),
                classifier.classifyFunction(node.name(), decorators),
                List.copyOf(calleesOf(node)),
                decorators,
                ownerClass,
                node.async(),
                ownerClass != null && (staticMethod || node.parameters().isEmpty()),
                decorators.contains("classmethod"),
                decorators.stream().anyMatch(StructuralIndexer::isPropertyDecorator)
            ));

            Scope body = new Scope(qualifiedName, null);
            node.children().forEach(child -> visit(child, body));
        }
    }

    /**
     * Collects the callee names of a function's own body, sorted and distinct.
     */
    static SortedSet<String> calleesOf(PythonAst.FunctionDef function) {
        SortedSet<String> callees = new TreeSet<>();
        function.children().forEach(child -> collectCallees(child, callees));
        return callees;
    }

    private static void collectCallees(Node node, SortedSet<String> callees) {
        if (node.kind() == PythonAst.NodeKind.FUNCTION_DEF || node.kind() == PythonAst.NodeKind.CLASS_DEF) {
            return;
        }
        if (node instanceof PythonAst.Call call && call.callee() != null) {
            callees.add(call.callee());
        }
        node.children().forEach(child -> collectCallees(child, callees));
    }

    private static boolean isPropertyDecorator(String decorator) {
        return decorator.equals("property")
            || decorator.endsWith("cached_property")
            || decorator.endsWith(".setter")
            || decorator.endsWith(".getter")
            || decorator.endsWith(".deleter");
    }

    private static boolean anyBaseContains(List<String> bases, String... keywords) {
        return bases.stream()
            .map(base -> base.toLowerCase(Locale.ROOT))
            .anyMatch(base -> {
                for (String keyword : keywords) {
                    if (base.contains(keyword)) {
                        return true;
                    }
                }
                return false;
            });
    }
}
