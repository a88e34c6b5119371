package com.questrail.voice.protocol.framing;

import java.io.IOException;
import java.util.Optional;

/**
 * FrameReceiver
 * -----------------------------------------------------------------------------
 * Stateful, incremental extractor of delimited frames from an ordered byte
 * stream.
 *
 * <p>This interface defines the inbound boundary between raw transport bytes
 * (a connection's {@link ByteSource}) and discrete command frames. A receiver
 * is bound to exactly one stream for its whole life; it is not restartable and
 * is not safe for use by more than one thread.</p>
 *
 * <p>The receiver is responsible only for:</p>
 * <ul>
 *   <li>Locating frame terminators</li>
 *   <li>Bounding the memory held for a partial frame</li>
 *   <li>Distinguishing an orderly end of stream from an abandoned frame</li>
 * </ul>
 *
 * <p>The receiver is <strong>not</strong> responsible for decoding text,
 * parsing commands, or recovering from framing errors. Every
 * {@link FramingException} is fatal to the stream it was raised for.</p>
 */
public interface FrameReceiver
{
    /**
     * Block until the next complete frame is available.
     *
     * <p>Repeated calls yield the frames of the stream in arrival order. The
     * returned array is owned by the caller and excludes the terminator.</p>
     *
     * @return the next frame, or {@link Optional#empty()} once the peer closed
     *         the stream cleanly between frames
     * @throws FrameTooLongException if more than the configured maximum number
     *         of bytes accumulated without a terminator
     * @throws IncompleteFrameException if the peer closed the stream in the
     *         middle of a frame
     * @throws IOException if the underlying source fails
     */
    Optional<byte[]> receive() throws IOException, FramingException;
}
