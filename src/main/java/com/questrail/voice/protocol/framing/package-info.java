/**
 * Command Stream Framing
 * =============================================================================
 *
 * <p>This package defines the <strong>framing layer</strong> of the command
 * protocol: the boundary between a connection's raw bytes and the discrete
 * command lines carried on it.</p>
 *
 * <h2>Wire format</h2>
 * <ul>
 *   <li>UTF-8 text, one command utterance per frame</li>
 *   <li>Frames are terminated by a single {@code \n} byte</li>
 *   <li>A frame may not exceed the configured maximum length (16384 bytes by
 *       default); exceeding it is fatal to the connection</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   ByteSource (transport)
 *        → FrameReceiver        (terminator search, size bound)
 *            → byte[] frame
 *                → UTF-8 text
 *                    → CommandProcessor
 * </pre>
 *
 * <h2>Failure taxonomy</h2>
 * <ul>
 *   <li>{@link com.questrail.voice.protocol.framing.FrameTooLongException}:
 *       fatal to the connection</li>
 *   <li>{@link com.questrail.voice.protocol.framing.IncompleteFrameException}:
 *       fatal to the connection</li>
 *   <li>End of stream between frames: not an error, reported as an empty
 *       result from {@link com.questrail.voice.protocol.framing.FrameReceiver#receive()}</li>
 * </ul>
 */
package com.questrail.voice.protocol.framing;
