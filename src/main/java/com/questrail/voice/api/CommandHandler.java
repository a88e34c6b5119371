package com.questrail.voice.api;

/**
 * Side-effecting action bound to one command pattern.
 *
 * <p>Handlers run on a task thread owned by the connection that delivered the
 * command, concurrently with other handlers for the same and other
 * connections. Blocking is allowed. A handler that observes interruption
 * should stop promptly: interruption means its connection or the server is
 * shutting down.</p>
 *
 * <p>Any exception thrown is contained to the single command and reported as
 * a handler failure; it never affects the connection.</p>
 */
@FunctionalInterface
public interface CommandHandler
{
    void handle(ParsedCommand command) throws Exception;
}
