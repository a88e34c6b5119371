package com.questrail.voice.grammar;

import java.util.List;
import java.util.Objects;

/**
 * Successful match of a line against a {@link Grammar}.
 *
 * @param pattern the command pattern that matched, as registered
 * @param values  values produced by the pattern's rule references and terminals, in order
 */
public record GrammarMatch(String pattern, List<Object> values) {
    public GrammarMatch {
        Objects.requireNonNull(pattern, "pattern");
        values = List.copyOf(values);
    }
}
