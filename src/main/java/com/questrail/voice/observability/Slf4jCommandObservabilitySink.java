package com.questrail.voice.observability;

import com.questrail.voice.dispatch.ProcessingOutcome;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of CommandObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jCommandObservabilitySink implements CommandObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jCommandObservabilitySink.class);

    @Override
    public void onConnectionEvent(ConnectionEvent event) {
        switch (event.kind()) {
            case OPENED -> log.debug("Connection {} opened", event.connectionId());
            case CLOSED -> log.debug("Connection {} closed", event.connectionId());
            case FAILED -> log.warn("Connection {} dropped: {}",
                event.connectionId(),
                event.cause() != null ? event.cause().getMessage() : "unknown cause");
        }
    }

    @Override
    public void onCommandOutcome(CommandOutcomeEvent event) {
        ProcessingOutcome outcome = event.outcome();
        if (outcome instanceof ProcessingOutcome.Handled handled) {
            log.debug("[{}] handled {} in {}", event.connectionId(), handled.pattern(), handled.elapsed());
        }
        else if (outcome instanceof ProcessingOutcome.Unrecognized unrecognized) {
            log.info("[{}] unrecognized command '{}': {}", event.connectionId(), event.text(), unrecognized.reason());
        }
        else if (outcome instanceof ProcessingOutcome.HandlerFailed failed) {
            log.error("[{}] handler for {} failed on '{}'",
                event.connectionId(), failed.pattern(), event.text(), failed.cause());
        }
        else if (outcome instanceof ProcessingOutcome.Rejected rejected) {
            log.warn("[{}] rejected '{}': {} commands already in flight",
                event.connectionId(), event.text(), rejected.inFlight());
        }
    }

    @Override
    public void onError(CommandErrorEvent event) {
        log.error("Command server error: {}", event.message(), event.cause());
    }
}
