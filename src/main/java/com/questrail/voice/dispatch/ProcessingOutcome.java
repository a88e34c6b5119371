package com.questrail.voice.dispatch;

import java.time.Duration;
import java.util.Objects;

/**
 * ProcessingOutcome
 * -----------------------------------------------------------------------------
 * Result of processing one command line.
 *
 * <p>None of these outcomes is sent to the peer; the protocol is
 * fire-and-forget. They exist so that every line leaves an observable trace.</p>
 */
public sealed interface ProcessingOutcome
        permits ProcessingOutcome.Handled,
                ProcessingOutcome.Unrecognized,
                ProcessingOutcome.HandlerFailed,
                ProcessingOutcome.Rejected
{
    /** The handler for {@code pattern} completed normally. */
    record Handled(String pattern, Duration elapsed) implements ProcessingOutcome {
        public Handled {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(elapsed, "elapsed");
        }
    }

    /** The line matched no registered pattern and was dropped. */
    record Unrecognized(String reason) implements ProcessingOutcome {
        public Unrecognized {
            Objects.requireNonNull(reason, "reason");
        }
    }

    /** The handler for {@code pattern} threw; contained to this line. */
    record HandlerFailed(String pattern, Throwable cause) implements ProcessingOutcome {
        public HandlerFailed {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(cause, "cause");
        }
    }

    /** The connection already had the maximum number of commands in flight. */
    record Rejected(int inFlight) implements ProcessingOutcome {
    }
}
