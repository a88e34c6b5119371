package com.questrail.voice.observability;

import java.time.Instant;

/**
 * Record representing a lifecycle change of one client connection.
 *
 * @param cause the framing or I/O failure for {@link Kind#FAILED}; {@code null} otherwise
 */
public record ConnectionEvent(
    Instant timestamp,
    String connectionId,
    Kind kind,
    Throwable cause
) {
    public enum Kind {
        OPENED,
        CLOSED,
        FAILED
    }
}
