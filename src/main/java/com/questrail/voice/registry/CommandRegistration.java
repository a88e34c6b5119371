package com.questrail.voice.registry;

import com.questrail.voice.api.CommandHandler;

import java.util.Objects;

/**
 * One command pattern and the handler it dispatches to.
 *
 * @param source name of the plugin or registry that contributed it
 */
public record CommandRegistration(
    String pattern,
    CommandHandler handler,
    String source
) {
    public CommandRegistration {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(source, "source");
    }
}
