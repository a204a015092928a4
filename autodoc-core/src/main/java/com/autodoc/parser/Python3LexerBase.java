package com.autodoc.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedList;

import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CommonToken;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Token;

/**
 * Base class for the generated Python 3 lexer.
 *
 * <p>Python blocks are delimited by indentation, which a context-free lexer cannot express.
 * This base class tracks the indentation stack and turns line starts into
 * {@code NEWLINE}, {@code INDENT} and {@code DEDENT} tokens:
 * <ul>
 *   <li>line breaks inside brackets and on blank, whitespace-only or comment-only lines are
 *       dropped, including such lines at the end of input</li>
 *   <li>a deeper indent pushes the stack and emits one {@code INDENT}</li>
 *   <li>a shallower indent pops the stack, emitting one {@code DEDENT} per level</li>
 *   <li>before {@code EOF} a final {@code NEWLINE} and all pending {@code DEDENT}s are emitted</li>
 * </ul>
 */
public abstract class Python3LexerBase extends Lexer {

    private static final int TAB_WIDTH = 8;

    private final LinkedList<Token> pending = new LinkedList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private int opened;
    private Token lastToken;
    private boolean endOfInputHandled;

    protected Python3LexerBase(CharStream input) {
        super(input);
    }

    @Override
    public void emit(Token token) {
        if (token.getType() == Token.EOF && !endOfInputHandled) {
            endOfInputHandled = true;
            if (lastToken != null && lastToken.getType() != Python3Lexer.NEWLINE
                    && lastToken.getType() != Python3Lexer.DEDENT) {
                emit(commonToken(Python3Lexer.NEWLINE, "\n"));
            }
            while (!indents.isEmpty()) {
                emit(createDedent());
                indents.pop();
            }
        }
        super.setToken(token);
        pending.offer(token);
        if (token.getChannel() == Token.DEFAULT_CHANNEL && token.getType() != Token.EOF) {
            lastToken = token;
        }
    }

    @Override
    public Token nextToken() {
        Token next = super.nextToken();
        return pending.isEmpty() ? next : pending.poll();
    }

    @Override
    public void reset() {
        pending.clear();
        indents.clear();
        opened = 0;
        lastToken = null;
        endOfInputHandled = false;
        super.reset();
    }

    protected boolean atStartOfInput() {
        return getCharPositionInLine() == 0 && getLine() == 1;
    }

    protected void openBrace() {
        opened++;
    }

    protected void closeBrace() {
        if (opened > 0) {
            opened--;
        }
    }

    protected void onNewLine() {
        String text = getText();
        String newLine = text.replaceAll("[^\r\n\f]+", "");
        String spaces = text.replaceAll("[\r\n\f]+", "");

        int next = _input.LA(1);
        boolean blankLine = next == EOF || next == '\r' || next == '\n' || next == '\f' || next == '#';

        if (opened > 0 || blankLine) {
            skip();
            return;
        }

        emit(commonToken(Python3Lexer.NEWLINE, newLine));
        int indent = indentationOf(spaces);
        int previous = indents.isEmpty() ? 0 : indents.peek();

        if (indent == previous) {
            skip();
        } else if (indent > previous) {
            indents.push(indent);
            emit(commonToken(Python3Lexer.INDENT, spaces));
        } else {
            while (!indents.isEmpty() && indents.peek() > indent) {
                emit(createDedent());
                indents.pop();
            }
        }
    }

    static int indentationOf(String spaces) {
        int count = 0;
        for (char ch : spaces.toCharArray()) {
            if (ch == '\t') {
                count += TAB_WIDTH - (count % TAB_WIDTH);
            } else {
                count++;
            }
        }
        return count;
    }

    private Token createDedent() {
        CommonToken dedent = commonToken(Python3Lexer.DEDENT, "");
        if (lastToken != null) {
            dedent.setLine(lastToken.getLine());
        }
        return dedent;
    }

    private CommonToken commonToken(int type, String text) {
        int stop = getCharIndex() - 1;
        int start = text.isEmpty() ? stop : stop - text.length() + 1;
        CommonToken token = new CommonToken(_tokenFactorySourcePair, type, DEFAULT_TOKEN_CHANNEL, start, stop);
        token.setText(text);
        return token;
    }
}
