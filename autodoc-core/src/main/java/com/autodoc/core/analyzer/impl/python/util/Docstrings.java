package com.autodoc.core.analyzer.impl.python.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for turning string literal tokens into cleaned docstring text.
 */
final class Docstrings {

    private static final int TAB_WIDTH = 8;

    private Docstrings() {
        // Utility class
    }

    /**
     * Returns the value of a single string literal token: prefix and quotes removed,
     * common escapes resolved unless the literal is raw.
     *
     * @param token literal text as it appears in the source
     * @return literal value
     */
    static String literalValue(String token) {
        int prefixEnd = 0;
        while (prefixEnd < token.length() && Character.isLetter(token.charAt(prefixEnd))) {
            prefixEnd++;
        }
        boolean raw = token.substring(0, prefixEnd).toLowerCase().contains("r");
        String quoted = token.substring(prefixEnd);
        int quoteLength = quoted.startsWith("\"\"\"") || quoted.startsWith("'''") ? 3 : 1;
        if (quoted.length() < 2 * quoteLength) {
            return "";
        }
        String body = quoted.substring(quoteLength, quoted.length() - quoteLength);
        return raw ? body : unescape(body);
    }

    /**
     * Cleans docstring indentation: the first line is stripped, the common leading
     * whitespace of the remaining lines is removed, and leading and trailing blank lines
     * are dropped.
     *
     * @param docstring raw docstring value
     * @return cleaned text, or null when nothing but whitespace remains
     */
    static String clean(String docstring) {
        String[] lines = expandTabs(docstring).split("\r\n|\r|\n", -1);
        int margin = Integer.MAX_VALUE;
        for (int i = 1; i < lines.length; i++) {
            String content = lines[i].stripLeading();
            if (!content.isEmpty()) {
                margin = Math.min(margin, lines[i].length() - content.length());
            }
        }

        List<String> cleaned = new ArrayList<>(lines.length);
        cleaned.add(lines[0].strip());
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            cleaned.add(margin != Integer.MAX_VALUE && line.length() >= margin
                ? line.substring(margin).stripTrailing()
                : line.strip());
        }
        while (!cleaned.isEmpty() && cleaned.get(0).isEmpty()) {
            cleaned.remove(0);
        }
        while (!cleaned.isEmpty() && cleaned.get(cleaned.size() - 1).isEmpty()) {
            cleaned.remove(cleaned.size() - 1);
        }
        return cleaned.isEmpty() ? null : String.join("\n", cleaned);
    }

    private static String unescape(String body) {
        if (body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder out = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char ch = body.charAt(i);
            if (ch != '\\' || i == body.length() - 1) {
                out.append(ch);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n' -> out.append('\n');
                case 't' -> out.append('\t');
                case '\\' -> out.append('\\');
                case '\'' -> out.append('\'');
                case '"' -> out.append('"');
                case '\n' -> {
                    // escaped line break continues the line
                }
                default -> out.append('\\').append(next);
            }
        }
        return out.toString();
    }

    private static String expandTabs(String text) {
        if (text.indexOf('\t') < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int column = 0;
        for (char ch : text.toCharArray()) {
            if (ch == '\t') {
                int spaces = TAB_WIDTH - (column % TAB_WIDTH);
                out.append(" ".repeat(spaces));
                column += spaces;
            } else {
                out.append(ch);
                column = ch == '\n' || ch == '\r' ? 0 : column + 1;
            }
        }
        return out.toString();
    }
}
