package com.autodoc.core.analyzer.ast;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Common interface for language-specific AST parsers.
 *
 * <p>A parser turns the source of one file into a neutral syntax tree (see {@link PythonAst})
 * that downstream passes walk without knowing the grammar. Parsing is pure: the same text
 * always yields the same tree.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * AstParser<PythonAst.ModuleDef> parser = AstParserFactory.getPythonParser();
 * AstParser.ParsedSource<PythonAst.ModuleDef> parsed = parser.parseString(source, "app/models.py");
 *
 * for (PythonAst.Node node : parsed.tree().children()) {
 *     if (node instanceof PythonAst.ClassDef cls) {
 *         System.out.println("Class: " + cls.name());
 *     }
 * }
 * }</pre>
 *
 * @param <T> the root node type returned by this parser
 * @see AstParserFactory
 */
public interface AstParser<T> {

    String BYTE_ORDER_MARK = "\uFEFF";

    /**
     * Parses source text.
     *
     * @param sourceCode decoded source text
     * @param sourceName name used in error messages (usually the relative path)
     * @return parsed tree
     * @throws AstParseException if the text is not valid for this language
     */
    ParsedSource<T> parseString(String sourceCode, String sourceName) throws AstParseException;

    /**
     * Decodes source bytes as UTF-8, rejecting malformed input instead of replacing it.
     * A single leading byte order mark is dropped, as Python does.
     *
     * @param bytes raw file content
     * @return decoded text
     * @throws CharacterCodingException if the bytes are not valid UTF-8
     */
    static String decodeStrict(byte[] bytes) throws CharacterCodingException {
        String text = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(bytes))
            .toString();
        return text.startsWith(BYTE_ORDER_MARK) ? text.substring(1) : text;
    }

    /**
     * Result of a successful parse.
     *
     * @param tree root of the syntax tree
     * @param usedFallback whether the parser needed its slower full-context mode
     * @param <T> root node type
     */
    record ParsedSource<T>(T tree, boolean usedFallback) {
        public ParsedSource {
            Objects.requireNonNull(tree, "tree must not be null");
        }
    }

    /**
     * Exception thrown when AST parsing fails.
     */
    class AstParseException extends RuntimeException {
        public AstParseException(String message, Throwable cause) {
            super(message, cause);
        }

        public AstParseException(String message) {
            super(message);
        }
    }
}
