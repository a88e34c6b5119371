package com.questrail.voice.api;

import java.util.List;
import java.util.Objects;

/**
 * A command line after it matched a registered pattern.
 *
 * @param pattern   the command pattern that matched, exactly as registered
 * @param arguments values produced by the pattern's rule references, in order;
 *                  literals contribute nothing
 */
public record ParsedCommand(String pattern, List<Object> arguments) {
    public ParsedCommand {
        Objects.requireNonNull(pattern, "pattern");
        arguments = List.copyOf(arguments);
    }

    /**
     * Typed access to one argument.
     *
     * @throws IndexOutOfBoundsException if there is no such argument
     * @throws ClassCastException if the argument is not a {@code type}
     */
    public <T> T argument(int index, Class<T> type) {
        return type.cast(arguments.get(index));
    }
}
