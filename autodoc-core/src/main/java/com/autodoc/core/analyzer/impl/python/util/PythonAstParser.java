package com.autodoc.core.analyzer.impl.python.util;

import org.antlr.v4.runtime.BailErrorStrategy;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.atn.PredictionMode;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.autodoc.core.analyzer.ast.AstParser;
import com.autodoc.core.analyzer.ast.PythonAst;
import com.autodoc.parser.Python3Lexer;
import com.autodoc.parser.Python3Parser;

/**
 * Parses Python source files with the ANTLR Python 3 grammar.
 *
 * <p>Parsing runs in two stages. The first stage uses SLL prediction with a bail-out error
 * strategy, which is fast and succeeds for nearly all real code. If it bails out, the token
 * stream is rewound and parsed again with full LL prediction and error reporting, so a file
 * is only rejected when it is genuinely not valid Python.
 *
 * <p>The resulting parse tree is reduced to a {@link PythonAst.ModuleDef} by
 * {@link PythonTreeBuilder}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PythonAstParser parser = new PythonAstParser();
 * PythonAst.ModuleDef module = parser.parseString(source, "app/service.py").tree();
 * }</pre>
 *
 * <p>Instances are stateless and safe to share between worker threads.
 */
public class PythonAstParser implements AstParser<PythonAst.ModuleDef> {

    private static final Logger log = LoggerFactory.getLogger(PythonAstParser.class);

    @Override
    public ParsedSource<PythonAst.ModuleDef> parseString(String sourceCode, String sourceName) {
        CharStream input = CharStreams.fromString(sourceCode, sourceName);
        Python3Lexer lexer = new Python3Lexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(new ThrowingErrorListener(sourceName));

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        Python3Parser parser = new Python3Parser(tokens);
        parser.removeErrorListeners();
        parser.setErrorHandler(new BailErrorStrategy());
        parser.getInterpreter().setPredictionMode(PredictionMode.SLL);

        Python3Parser.File_inputContext tree;
        boolean usedFallback = false;
        try {
            tree = parser.file_input();
        } catch (ParseCancellationException e) {
            log.debug("SLL parse bailed out for {}, retrying with full LL prediction", sourceName);
            tokens.seek(0);
            parser.reset();
            parser.addErrorListener(new ThrowingErrorListener(sourceName));
            parser.setErrorHandler(new DefaultErrorStrategy());
            parser.getInterpreter().setPredictionMode(PredictionMode.LL);
            tree = parser.file_input();
            usedFallback = true;
        }

        PythonAst.ModuleDef module = new PythonTreeBuilder(tokens).build(tree, countLines(sourceCode));
        return new ParsedSource<>(module, usedFallback);
    }

    /**
     * Counts source lines the way editors do: a trailing newline does not start a new line.
     */
    static int countLines(String source) {
        if (source.isEmpty()) {
            return 0;
        }
        int lines = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n' && i < source.length() - 1) {
                lines++;
            }
        }
        return lines;
    }

    /**
     * Turns the first syntax error into an {@link AstParseException} carrying the location.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        private final String sourceName;

        ThrowingErrorListener(String sourceName) {
            this.sourceName = sourceName;
        }

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new AstParseException(
                "Syntax error in " + sourceName + " at line " + line + ":" + charPositionInLine + ": " + msg, e);
        }
    }
}
