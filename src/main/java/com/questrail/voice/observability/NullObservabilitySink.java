package com.questrail.voice.observability;

/**
 * No-op implementation of CommandObservabilitySink.
 */
public final class NullObservabilitySink implements CommandObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onConnectionEvent(ConnectionEvent event) {}

    @Override
    public void onCommandOutcome(CommandOutcomeEvent event) {}

    @Override
    public void onError(CommandErrorEvent event) {}
}
