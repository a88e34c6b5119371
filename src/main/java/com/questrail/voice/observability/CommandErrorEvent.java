package com.questrail.voice.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly outside the scope of a single command.
 */
public record CommandErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
