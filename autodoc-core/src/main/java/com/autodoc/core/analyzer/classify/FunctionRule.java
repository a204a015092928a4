package com.autodoc.core.analyzer.classify;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.autodoc.core.model.FunctionCategory;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One row of the function rule table.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * - target: decorator
 *   match: exact
 *   patterns: [command, group]
 *   category: entry_point
 * }</pre>
 *
 * @param target what the patterns are compared with
 * @param match comparison mode
 * @param patterns patterns compared case-sensitively, as Python names are; any match fires the rule
 * @param category category assigned when the rule fires
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FunctionRule(
    @JsonProperty("target") Target target,
    @JsonProperty("match") MatchMode match,
    @JsonProperty("patterns") List<String> patterns,
    @JsonProperty("category") FunctionCategory category
) {
    /**
     * Part of a function definition a rule looks at.
     */
    public enum Target {
        NAME,
        /** Decorator name; both the full dotted name and its last segment are tested. */
        DECORATOR;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public FunctionRule {
        target = target != null ? target : Target.NAME;
        Objects.requireNonNull(match, "match must not be null");
        Objects.requireNonNull(category, "category must not be null");
        patterns = patterns != null ? List.copyOf(patterns) : List.of();
        if (patterns.isEmpty() && match != MatchMode.DUNDER) {
            throw new IllegalArgumentException("rule for " + category.label() + " has no patterns");
        }
    }

    public static FunctionRule byName(MatchMode match, FunctionCategory category, String... patterns) {
        return new FunctionRule(Target.NAME, match, List.of(patterns), category);
    }

    public static FunctionRule byDecorator(MatchMode match, FunctionCategory category, String... patterns) {
        return new FunctionRule(Target.DECORATOR, match, List.of(patterns), category);
    }

    /**
     * Tests a function against this rule.
     *
     * @param name function name
     * @param decorators decorator names
     * @return true if the rule fires
     */
    public boolean matches(String name, List<String> decorators) {
        return switch (target) {
            case NAME -> matchesValue(name);
            case DECORATOR -> decorators.stream()
                .anyMatch(decorator -> matchesValue(decorator) || matchesValue(lastSegment(decorator)));
        };
    }

    private boolean matchesValue(String value) {
        if (match == MatchMode.DUNDER) {
            return match.matches(value, "");
        }
        return patterns.stream().anyMatch(pattern -> match.matches(value, pattern));
    }

    private static String lastSegment(String dotted) {
        return dotted.substring(dotted.lastIndexOf('.') + 1);
    }
}
