package com.autodoc.core.analyzer;

import com.autodoc.core.config.AnalyzerConfig;
import com.autodoc.core.config.AnalyzerConfig.AnalysisSettings;
import com.autodoc.core.config.AnalyzerConfig.ClassificationSettings;
import com.autodoc.core.config.AnalyzerConfig.FlowSettings;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Base class for analyzer functional tests.
 *
 * <p>Provides a temporary project root, helpers for writing fixture files into it and a
 * configuration with a small fixed worker pool.
 */
public abstract class AnalyzerTestBase {

    @TempDir
    protected Path tempDir;

    /**
     * Creates a file in the temp directory with the given content.
     *
     * @param relativePath path relative to tempDir (e.g., "app.py" or "pkg/models.py")
     * @param content file content
     * @return the created file path
     * @throws IOException if file cannot be created
     */
    protected Path createFile(String relativePath, String content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.writeString(filePath, content);
        return filePath;
    }

    /**
     * Creates multiple files from a map of relative paths to content.
     *
     * @param files map of relative path to content
     * @throws IOException if any file cannot be created
     */
    protected void createFiles(Map<String, String> files) throws IOException {
        for (Map.Entry<String, String> entry : files.entrySet()) {
            createFile(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Creates a configuration with default settings and the given worker count.
     *
     * @param workers worker pool size
     * @return configuration
     */
    protected static AnalyzerConfig configWithWorkers(int workers) {
        return new AnalyzerConfig(
            new AnalysisSettings(null, null, null, null, workers, null, null),
            FlowSettings.defaults(),
            ClassificationSettings.defaults());
    }
}
