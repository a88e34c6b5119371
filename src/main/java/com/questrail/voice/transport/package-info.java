/**
 * Command Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty over a Unix domain
 * socket, or a test double) and the command dispatch layer.
 *
 * <h2>Why these ports exist</h2>
 * Netty is used in production for its native domain socket support and
 * lifecycle handling, <strong>without</strong> allowing Netty types to leak
 * into framing or dispatch.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>A pull-based {@link com.questrail.voice.protocol.framing.ByteSource} per connection</li>
 *   <li>A connection identifier</li>
 *   <li>An idempotent close</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no framing or parsing)</li>
 *   <li>Run each connection's handler on its own thread</li>
 *   <li>Never block an event loop waiting for a handler</li>
 * </ul>
 */
package com.questrail.voice.transport;
