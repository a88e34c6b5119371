package com.questrail.voice.grammar;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A named grammar rule as contributed by one command source.
 *
 * @param converter optional value builder; {@code null} means the rule yields
 *                  its single collected value, or the list of values when it
 *                  collects zero or several
 */
public record RuleDefinition(
    String name,
    String expression,
    RuleConverter converter,
    String source
) {
    private static final Pattern RULE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public RuleDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(source, "source");
        if (!RULE_NAME.matcher(name).matches()) {
            throw new GrammarException("invalid rule name '" + name + "'");
        }
    }

    /**
     * True if {@code other} can stand in for this definition when two sources
     * define the same rule.
     */
    public boolean isCompatibleWith(RuleDefinition other) {
        return name.equals(other.name)
                && expression.equals(other.expression)
                && converter == other.converter;
    }
}
