package com.autodoc.core.analyzer;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.autodoc.core.config.AnalyzerConfig.AnalysisSettings;
import com.autodoc.core.model.Diagnostic;
import com.autodoc.core.model.DiagnosticKind;
import com.autodoc.core.util.FileUtils;

/**
 * File-system collaborator that lists and reads the files of a tree.
 *
 * <p>Excluded directories are never entered. A file is read only when its extension is
 * allow-listed and it passes the include and exclude globs; every other file is only
 * recorded in {@link SourceListing#allPaths()}, which feeds project profiling.
 */
public class SourceTree {

    private static final Logger log = LoggerFactory.getLogger(SourceTree.class);

    private final AnalysisSettings settings;
    private final Set<String> excludedDirectories;
    private final Set<String> sourceExtensions;

    public SourceTree(AnalysisSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.excludedDirectories = Set.copyOf(settings.excludedDirectories());
        this.sourceExtensions = settings.sourceExtensions().stream()
            .map(ext -> ext.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Walks a tree and reads its source files.
     *
     * @param root root directory
     * @return listing with files sorted by path
     * @throws IOException if the root is not a readable directory
     */
    public SourceListing collect(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new NotDirectoryException(root.toString());
        }
        Path start = root.toAbsolutePath().normalize();
        Collector collector = new Collector(start);
        Files.walkFileTree(start, collector);

        collector.files.sort(Comparator.comparing(SourceFile::path));
        collector.allPaths.sort(Comparator.naturalOrder());
        log.debug("Collected {} source files out of {} files under {}",
            collector.files.size(), collector.allPaths.size(), start);
        return new SourceListing(collector.files, collector.allPaths, collector.diagnostics);
    }

    boolean isSourcePath(String relativePath) {
        String extension = FileUtils.getExtension(relativePath);
        return !extension.isEmpty()
            && sourceExtensions.contains("." + extension)
            && FileUtils.matchesAny(settings.include(), relativePath)
            && !FileUtils.matchesAny(settings.exclude(), relativePath);
    }

    private final class Collector extends SimpleFileVisitor<Path> {

        private final Path root;
        private final List<SourceFile> files = new ArrayList<>();
        private final List<String> allPaths = new ArrayList<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        Collector(Path root) {
            this.root = root;
        }

        @Override
        public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
            if (!dir.equals(root) && dir.getFileName() != null
                    && excludedDirectories.contains(dir.getFileName().toString())) {
                log.debug("Skipping excluded directory: {}", dir);
                return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (!attrs.isRegularFile()) {
                return FileVisitResult.CONTINUE;
            }
            String path = FileUtils.relativePath(root, file);
            allPaths.add(path);
            if (!isSourcePath(path)) {
                return FileVisitResult.CONTINUE;
            }
            if (attrs.size() > settings.maxFileBytes()) {
                log.debug("Skipping {} ({} bytes exceeds limit of {})", path, attrs.size(), settings.maxFileBytes());
                diagnostics.add(Diagnostic.of(DiagnosticKind.SKIPPED_FILE, path,
                    "File size " + attrs.size() + " bytes exceeds the limit of " + settings.maxFileBytes() + " bytes"));
                return FileVisitResult.CONTINUE;
            }
            try {
                files.add(new SourceFile(path, Files.readAllBytes(file)));
            } catch (IOException e) {
                log.warn("Failed to read file {}: {}", path, e.getMessage());
                diagnostics.add(Diagnostic.of(DiagnosticKind.UNREADABLE_FILE, path, "Cannot read file: " + e.getMessage()));
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (file.equals(root)) {
                throw exc;
            }
            String path = FileUtils.relativePath(root, file);
            log.warn("Failed to access {}: {}", path, exc.getMessage());
            diagnostics.add(Diagnostic.of(DiagnosticKind.UNREADABLE_FILE, path, "Cannot access: " + exc.getMessage()));
            return FileVisitResult.CONTINUE;
        }
    }
}
