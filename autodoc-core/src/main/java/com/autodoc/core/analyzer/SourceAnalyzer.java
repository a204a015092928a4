package com.autodoc.core.analyzer;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.autodoc.core.analyzer.architecture.ArchitectureLayerClassifier;
import com.autodoc.core.analyzer.architecture.ArchitecturePatternDetector;
import com.autodoc.core.analyzer.architecture.ProjectProfiler;
import com.autodoc.core.analyzer.ast.AstParser;
import com.autodoc.core.analyzer.ast.AstParser.AstParseException;
import com.autodoc.core.analyzer.ast.AstParserFactory;
import com.autodoc.core.analyzer.ast.PythonAst;
import com.autodoc.core.analyzer.classify.RoleClassifier;
import com.autodoc.core.analyzer.complexity.ComplexityCalculator;
import com.autodoc.core.analyzer.flow.FlowChainInferencer;
import com.autodoc.core.analyzer.flow.NameMatchCalleeNames;
import com.autodoc.core.analyzer.graph.DependencyGraphBuilder;
import com.autodoc.core.analyzer.index.FileAnalysis;
import com.autodoc.core.analyzer.index.StructuralIndexer;
import com.autodoc.core.config.AnalyzerConfig;
import com.autodoc.core.model.AnalysisResult;
import com.autodoc.core.model.AnalysisStatistics;
import com.autodoc.core.model.Diagnostic;
import com.autodoc.core.model.DiagnosticKind;
import com.autodoc.core.model.ParseFailure;
import com.autodoc.core.util.FileUtils;

/**
 * Entry point of the analysis pipeline.
 *
 * <p>Runs in two phases:
 * <ol>
 *   <li><b>Per file</b>, on a bounded worker pool: extension check, strict UTF-8 decoding,
 *       parsing and indexing (complexity and categories included). A file that cannot be
 *       decoded or parsed becomes a {@link ParseFailure}; its siblings are unaffected.</li>
 *   <li><b>Aggregation</b>, single-threaded after all files are done: id relocation,
 *       dependency graph, flow chains, architecture layers and patterns, project overview
 *       and complexity summary.</li>
 * </ol>
 *
 * <p>Cancellation is checked after each file completes. A cancelled run throws
 * {@link CancellationException} and produces no result.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * AnalyzerConfig config = ConfigLoader.loadFromRoot(projectRoot);
 * AnalysisResult result = new SourceAnalyzer(config).analyze(projectRoot);
 *
 * result.functions().stream()
 *     .filter(fn -> fn.complexity() > 10)
 *     .forEach(fn -> System.out.println(fn.qualifiedName()));
 * }</pre>
 */
public class SourceAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SourceAnalyzer.class);

    private final AnalyzerConfig config;
    private final Set<String> sourceExtensions;
    private final RoleClassifier classifier;
    private final StructuralIndexer indexer;
    private final DependencyGraphBuilder graphBuilder = new DependencyGraphBuilder();
    private final FlowChainInferencer flowInferencer;
    private final ArchitectureLayerClassifier layerClassifier = new ArchitectureLayerClassifier();
    private final ArchitecturePatternDetector patternDetector = new ArchitecturePatternDetector();
    private final ProjectProfiler profiler = new ProjectProfiler();

    public SourceAnalyzer(AnalyzerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.sourceExtensions = config.analysis().sourceExtensions().stream()
            .map(ext -> ext.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
        this.classifier = new RoleClassifier(config.classification().toRuleTable());
        this.indexer = new StructuralIndexer(new ComplexityCalculator(), classifier);
        this.flowInferencer = new FlowChainInferencer(new NameMatchCalleeNames(), config.flow());
    }

    /**
     * Analyzes a directory tree.
     *
     * @param root root directory
     * @return analysis result
     * @throws IOException if the root cannot be walked
     */
    public AnalysisResult analyze(Path root) throws IOException {
        log.info("Starting analysis of: {}", root.toAbsolutePath());
        SourceListing listing = new SourceTree(config.analysis()).collect(root);
        Path name = root.toAbsolutePath().normalize().getFileName();
        return analyze(name != null ? name.toString() : root.toString(),
            listing.files(), listing.allPaths(), listing.diagnostics(), () -> false);
    }

    /**
     * Analyzes caller-supplied files.
     *
     * @param root label of the analyzed root
     * @param files source files
     * @return analysis result
     */
    public AnalysisResult analyze(String root, List<SourceFile> files) {
        return analyze(root, files, files.stream().map(SourceFile::path).toList(), List.of(), () -> false);
    }

    /**
     * Analyzes caller-supplied files with full control over the run.
     *
     * @param root label of the analyzed root
     * @param files source files
     * @param allPaths every known file path of the tree, used for project profiling
     * @param upstreamDiagnostics diagnostics produced while collecting the files
     * @param cancelled polled after each file; returning true aborts the run
     * @return analysis result
     * @throws CancellationException if the run was cancelled
     */
    public AnalysisResult analyze(
        String root,
        List<SourceFile> files,
        Collection<String> allPaths,
        List<Diagnostic> upstreamDiagnostics,
        BooleanSupplier cancelled
    ) {
        long start = System.currentTimeMillis();
        List<FileOutcome> outcomes = runPerFile(files, cancelled);
        outcomes.sort(Comparator.comparing(FileOutcome::path));

        AnalysisResultBuilder builder = new AnalysisResultBuilder(root);
        builder.addDiagnostics(upstreamDiagnostics);
        AnalysisStatistics.Builder stats = new AnalysisStatistics.Builder().filesDiscovered(files.size());
        List<String> sourcePaths = new ArrayList<>();

        for (FileOutcome outcome : outcomes) {
            if (outcome.skipped()) {
                stats.incrementFilesSkipped();
                builder.addDiagnostic(Diagnostic.of(DiagnosticKind.SKIPPED_FILE, outcome.path(),
                    "Extension is not in the source allow-list"));
                continue;
            }
            stats.incrementFilesAnalyzed();
            sourcePaths.add(outcome.path());
            if (outcome.failure() != null) {
                stats.incrementFilesFailed().addError(outcome.errorType(), outcome.path() + ": " + outcome.failure().reason());
                builder.addParseFailure(outcome.failure());
                builder.addDiagnostic(Diagnostic.of(DiagnosticKind.PARSE_FAILURE, outcome.path(), outcome.failure().reason()));
            } else {
                if (outcome.usedFallback()) {
                    stats.incrementFilesParsedWithFallback();
                } else {
                    stats.incrementFilesParsedSuccessfully();
                }
                builder.addFile(outcome.analysis());
            }
        }

        builder.relocate();
        List<Diagnostic> diagnostics = builder.diagnostics();
        AnalysisResult result = builder
            .dependencies(graphBuilder.build(builder.modules(), diagnostics))
            .flowChains(flowInferencer.infer(builder.functions(), diagnostics))
            .layers(layerClassifier.classify(sourcePaths))
            .architecturePatterns(patternDetector.detect(allPaths))
            .overview(profiler.profile(builder.modules(), builder.classes(), builder.functions(), allPaths))
            .complexity(ComplexityCalculator.summarize(builder.functions(),
                config.analysis().highComplexityThreshold()))
            .statistics(stats.build())
            .ruleTableVersion(classifier.rules().version())
            .build();

        log.info("Analysis of {} complete in {} ms: {} modules, {} classes, {} functions, {} flow chains",
            root, System.currentTimeMillis() - start, result.modules().size(), result.classes().size(),
            result.functions().size(), result.flowChains().size());
        if (result.statistics().hasFailures()) {
            log.warn("{} of {} files could not be parsed", result.statistics().filesFailed(),
                result.statistics().filesAnalyzed());
        }
        log.debug("Statistics: {}", result.statistics().summary());
        return result;
    }

    private List<FileOutcome> runPerFile(List<SourceFile> files, BooleanSupplier cancelled) {
        List<FileOutcome> outcomes = new ArrayList<>(files.size());
        if (files.isEmpty()) {
            return outcomes;
        }
        int workers = Math.min(config.analysis().workers(), files.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            CompletionService<FileOutcome> completion = new ExecutorCompletionService<>(pool);
            for (SourceFile file : files) {
                completion.submit(() -> analyzeFile(file));
            }
            for (int i = 0; i < files.size(); i++) {
                outcomes.add(completion.take().get());
                if (cancelled.getAsBoolean()) {
                    log.info("Analysis cancelled after {} of {} files", outcomes.size(), files.size());
                    throw new CancellationException("Analysis cancelled");
                }
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancellation = new CancellationException("Analysis interrupted");
            cancellation.initCause(e);
            throw cancellation;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Per-file analysis failed unexpectedly", e.getCause());
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Runs decoding, parsing and indexing for one file. Never throws for bad input.
     */
    FileOutcome analyzeFile(SourceFile file) {
        String path = FileUtils.toUnixPath(file.path());
        Optional<AstParser<PythonAst.ModuleDef>> parser = AstParserFactory.forFile(path, sourceExtensions);
        if (parser.isEmpty()) {
            log.debug("Skipping non-source file: {}", path);
            return FileOutcome.skipped(path);
        }

        String text;
        try {
            text = AstParser.decodeStrict(file.content());
        } catch (CharacterCodingException e) {
            log.warn("File {} is not valid UTF-8", path);
            return FileOutcome.failed(path, "encoding", "File is not valid UTF-8: " + e.getMessage());
        }

        try {
            AstParser.ParsedSource<PythonAst.ModuleDef> parsed = parser.get().parseString(text, path);
            FileAnalysis analysis = indexer.index(path, parsed.tree());
            log.debug("Indexed {}: {} classes, {} functions{}", path, analysis.classes().size(),
                analysis.functions().size(), parsed.usedFallback() ? " (LL fallback)" : "");
            return FileOutcome.parsed(analysis, parsed.usedFallback());
        } catch (AstParseException e) {
            log.warn("Failed to parse {}: {}", path, e.getMessage());
            return FileOutcome.failed(path, "syntax", e.getMessage());
        } catch (StackOverflowError e) {
            log.warn("Failed to parse {}: nesting too deep", path);
            return FileOutcome.failed(path, "nesting", "Nesting too deep to parse");
        } catch (RuntimeException e) {
            log.error("Unexpected error while analyzing {}", path, e);
            return FileOutcome.failed(path, e.getClass().getSimpleName(), "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Outcome of the per-file phase. Exactly one of skipped, failure or analysis is set.
     */
    record FileOutcome(
        String path,
        boolean skipped,
        FileAnalysis analysis,
        boolean usedFallback,
        ParseFailure failure,
        String errorType
    ) {
        static FileOutcome skipped(String path) {
            return new FileOutcome(path, true, null, false, null, null);
        }

        static FileOutcome parsed(FileAnalysis analysis, boolean usedFallback) {
            return new FileOutcome(analysis.path(), false, analysis, usedFallback, null, null);
        }

        static FileOutcome failed(String path, String errorType, String reason) {
            return new FileOutcome(path, false, null, false, new ParseFailure(path, reason), errorType);
        }
    }
}
