package com.questrail.voice.protocol.framing;

import java.io.IOException;

/**
 * ByteSource
 * -----------------------------------------------------------------------------
 * Minimal pull-based port for the inbound half of a duplex byte stream.
 *
 * <p>Implementations may be backed by a Netty channel, a plain
 * {@link java.io.InputStream}, or a scripted test double.</p>
 */
@FunctionalInterface
public interface ByteSource
{
    /**
     * Block until at least one byte is available, the stream ends, or the
     * calling thread is interrupted.
     *
     * @param dst destination array
     * @param off offset of the first byte to write
     * @param len maximum number of bytes to read; always positive
     * @return number of bytes read, or {@code -1} at orderly end of stream
     * @throws IOException if the stream failed or the read was interrupted
     */
    int read(byte[] dst, int off, int len) throws IOException;
}
