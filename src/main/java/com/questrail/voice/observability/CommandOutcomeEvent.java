package com.questrail.voice.observability;

import com.questrail.voice.dispatch.ProcessingOutcome;

import java.time.Instant;

/**
 * Record representing the result of processing one command line.
 */
public record CommandOutcomeEvent(
    Instant timestamp,
    String connectionId,
    String text,
    ProcessingOutcome outcome
) {
}
