package com.autodoc.core.analyzer;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * One input file: its root-relative path and raw content.
 *
 * <p>Content stays as bytes so the analyzer, not the caller, decides how to decode it.
 *
 * @param path forward-slash path relative to the analysis root
 * @param content raw file bytes
 */
public record SourceFile(String path, byte[] content) {

    public SourceFile {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Creates a source file from text, encoded as UTF-8.
     *
     * @param path relative path
     * @param text file content
     * @return source file
     */
    public static SourceFile of(String path, String text) {
        return new SourceFile(path, text.getBytes(StandardCharsets.UTF_8));
    }
}
