package com.autodoc.core.analyzer.classify;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a rule pattern is compared with a name. Comparison is case-sensitive; rules that
 * ignore case fold both sides before matching.
 */
public enum MatchMode {
    EXACT,
    PREFIX,
    SUFFIX,
    CONTAINS,
    /** Name starts and ends with a double underscore; patterns are ignored. */
    DUNDER;

    /**
     * Tests a value against one pattern.
     *
     * @param value name to test
     * @param pattern pattern
     * @return true if the value matches
     */
    public boolean matches(String value, String pattern) {
        return switch (this) {
            case EXACT -> value.equals(pattern);
            case PREFIX -> value.startsWith(pattern);
            case SUFFIX -> value.endsWith(pattern);
            case CONTAINS -> value.contains(pattern);
            case DUNDER -> value.length() > 4 && value.startsWith("__") && value.endsWith("__");
        };
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
