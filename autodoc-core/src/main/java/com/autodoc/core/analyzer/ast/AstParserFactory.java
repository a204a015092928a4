package com.autodoc.core.analyzer.ast;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.autodoc.core.util.FileUtils;
import com.autodoc.core.util.Languages;

/**
 * Factory for creating language-specific AST parsers.
 *
 * <p>Parser instances are created on demand and reused across analysis runs. Selection by
 * file goes through an extension allow-list; files with other extensions get no parser.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * Optional<AstParser<PythonAst.ModuleDef>> parser =
 *     AstParserFactory.forFile("app/models.py", Set.of(".py"));
 * }</pre>
 *
 * <p><b>Thread Safety:</b></p>
 * <p>This factory is thread-safe. Parser instances are cached in a {@link ConcurrentHashMap}
 * and initialized only once per language. Parsers themselves are stateless.</p>
 *
 * @see AstParser
 * @see PythonAst
 */
public final class AstParserFactory {

    private static final Logger log = LoggerFactory.getLogger(AstParserFactory.class);

    private static final String PYTHON_PARSER_CLASS = "com.autodoc.core.analyzer.impl.python.util.PythonAstParser";

    // Cache of parser instances (one per language)
    private static final Map<String, AstParser<?>> parserCache = new ConcurrentHashMap<>();

    private AstParserFactory() {
        // Utility class - no instantiation
    }

    /**
     * Gets the Python AST parser.
     *
     * @return Python parser instance (cached, thread-safe)
     */
    @SuppressWarnings("unchecked")
    public static AstParser<PythonAst.ModuleDef> getPythonParser() {
        return (AstParser<PythonAst.ModuleDef>) parserCache.computeIfAbsent(Languages.PYTHON, lang ->
            createParser(PYTHON_PARSER_CLASS, "Python")
        );
    }

    /**
     * Selects the parser for a file by its extension.
     *
     * @param path file path
     * @param allowedExtensions extensions routed to the Python parser, with leading dot (e.g. ".py")
     * @return the parser, or empty when the extension is not allow-listed
     */
    public static Optional<AstParser<PythonAst.ModuleDef>> forFile(String path, Set<String> allowedExtensions) {
        String extension = FileUtils.getExtension(path);
        if (extension.isEmpty() || !allowedExtensions.contains("." + extension)) {
            return Optional.empty();
        }
        return Optional.of(getPythonParser());
    }

    /**
     * Helper method to create parser instances via reflection.
     *
     * @param className fully qualified class name
     * @param displayName display name for logging
     * @return parser instance
     * @throws IllegalStateException if parser cannot be created
     */
    private static AstParser<?> createParser(String className, String displayName) {
        try {
            Class<?> implClass = Class.forName(className);
            AstParser<?> parser = (AstParser<?>) implClass.getDeclaredConstructor().newInstance();
            log.info("{} AST parser initialized successfully", displayName);
            return parser;
        } catch (ClassNotFoundException e) {
            log.warn("{} AST parser not available: {}", displayName, e.getMessage());
            throw new IllegalStateException(displayName + " AST parser not available", e);
        } catch (ReflectiveOperationException e) {
            log.error("{} AST parser failed to initialize", displayName, e);
            throw new IllegalStateException(displayName + " AST parser failed to initialize", e);
        }
    }
}
