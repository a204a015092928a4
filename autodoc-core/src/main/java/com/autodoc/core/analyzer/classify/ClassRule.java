package com.autodoc.core.analyzer.classify;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import com.autodoc.core.model.ClassCategory;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One row of the class rule table.
 *
 * @param target what the patterns are compared with
 * @param match comparison mode
 * @param patterns lower-case patterns; any match fires the rule
 * @param category category assigned when the rule fires
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClassRule(
    @JsonProperty("target") Target target,
    @JsonProperty("match") MatchMode match,
    @JsonProperty("patterns") List<String> patterns,
    @JsonProperty("category") ClassCategory category
) {
    /**
     * Part of a class definition a rule looks at.
     */
    public enum Target {
        NAME,
        BASE,
        METHOD,
        DOCSTRING;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public ClassRule {
        target = target != null ? target : Target.NAME;
        Objects.requireNonNull(match, "match must not be null");
        Objects.requireNonNull(category, "category must not be null");
        patterns = patterns != null
            ? patterns.stream().map(pattern -> pattern.toLowerCase(Locale.ROOT)).toList()
            : List.of();
        if (patterns.isEmpty()) {
            throw new IllegalArgumentException("rule for " + category.label() + " has no patterns");
        }
    }

    public static ClassRule of(Target target, MatchMode match, ClassCategory category, String... patterns) {
        return new ClassRule(target, match, List.of(patterns), category);
    }

    /**
     * Tests a class against this rule.
     *
     * @param name class name
     * @param bases base class expressions
     * @param methodNames names of methods defined in the class body
     * @param docstring docstring, or null
     * @return true if the rule fires
     */
    public boolean matches(String name, List<String> bases, Collection<String> methodNames, String docstring) {
        return switch (target) {
            case NAME -> matchesValue(name);
            case BASE -> bases.stream().anyMatch(this::matchesValue);
            case METHOD -> methodNames.stream().anyMatch(this::matchesValue);
            case DOCSTRING -> docstring != null && matchesValue(docstring);
        };
    }

    private boolean matchesValue(String value) {
        String lower = value.toLowerCase(Locale.ROOT);
        return patterns.stream().anyMatch(pattern -> match.matches(lower, pattern));
    }
}
