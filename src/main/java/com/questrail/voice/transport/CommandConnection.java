package com.questrail.voice.transport;

import com.questrail.voice.protocol.framing.ByteSource;

/**
 * CommandConnection
 * -----------------------------------------------------------------------------
 * One accepted client stream, owned by exactly one dispatcher for its lifetime.
 *
 * <p>The protocol is fire-and-forget, so only the inbound half is exposed.</p>
 */
public interface CommandConnection extends AutoCloseable
{
    /** Identifier used in logs and observability events. */
    String id();

    /** Inbound bytes. Reads block the calling thread, never an event loop. */
    ByteSource source();

    /**
     * Close the connection and release its transport resources.
     *
     * <p>Idempotent. A read blocked on {@link #source()} returns end of stream
     * or fails once the connection is closed.</p>
     */
    @Override
    void close();
}
