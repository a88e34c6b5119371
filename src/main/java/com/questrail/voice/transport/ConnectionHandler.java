package com.questrail.voice.transport;

/**
 * Callback that serves one accepted connection until it ends.
 *
 * <p>Invoked on a thread dedicated to the connection. The handler owns the
 * connection and must close it before returning. Interruption of the calling
 * thread means the listener is stopping.</p>
 */
@FunctionalInterface
public interface ConnectionHandler
{
    void handle(CommandConnection connection);
}
