package com.questrail.voice.observability;

/**
 * Main interface for receiving command server observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive concurrently from connection and task threads;
 * implementations must be thread-safe.</p>
 */
public interface CommandObservabilitySink {
    /**
     * Called when a connection is opened or closed, or fails at the framing level.
     * @param event the connection event
     */
    void onConnectionEvent(ConnectionEvent event);

    /**
     * Called once for every command line that reached the processor.
     * @param event the outcome of processing the line
     */
    void onCommandOutcome(CommandOutcomeEvent event);

    /**
     * Called when an error occurs outside any single command (listener, bridge, runtime).
     * @param event the error event
     */
    void onError(CommandErrorEvent event);
}
