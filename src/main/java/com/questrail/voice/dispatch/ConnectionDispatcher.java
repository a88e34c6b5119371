package com.questrail.voice.dispatch;

import com.questrail.voice.config.CommandServerConfig;
import com.questrail.voice.observability.CommandObservabilitySink;
import com.questrail.voice.observability.ConnectionEvent;
import com.questrail.voice.observability.NullObservabilitySink;
import com.questrail.voice.protocol.framing.FrameReceiver;
import com.questrail.voice.protocol.framing.FramingException;
import com.questrail.voice.protocol.framing.impl.TerminatedFrameReceiver;
import com.questrail.voice.transport.CommandConnection;
import com.questrail.voice.transport.ConnectionHandler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * ConnectionDispatcher
 * =============================================================================
 * Serves one connection: frames its byte stream and runs every command line
 * as an independent task.
 *
 * <h2>Read loop</h2>
 * <pre>
 *   CommandConnection.source()
 *        → TerminatedFrameReceiver("\n")
 *            → UTF-8 text
 *                → TaskScope.spawn(CommandProcessor.process)   (never awaited here)
 * </pre>
 *
 * <p>The loop never waits for a command to finish before reading the next
 * line: a slow handler cannot delay ingestion or dispatch of later commands on
 * the same connection. Lines are read and spawned in arrival order; their
 * effects may complete in any order.</p>
 *
 * <h2>Teardown</h2>
 * <ul>
 *   <li>End of stream: stop reading, join every spawned task, close.</li>
 *   <li>Framing error, I/O error or interruption: cancel every spawned task,
 *       join them, close. The failure is reported and goes no further than
 *       this connection.</li>
 * </ul>
 */
public final class ConnectionDispatcher implements ConnectionHandler
{
    private final CommandProcessor processor;
    private final Executor taskExecutor;
    private final int maxLineLength;
    private final int receiveSize;
    private final int maxInFlight;
    private final CommandObservabilitySink observabilitySink;
    private final Clock clock;

    public ConnectionDispatcher(CommandProcessor processor,
                                Executor taskExecutor,
                                CommandServerConfig config,
                                CommandObservabilitySink observabilitySink)
    {
        this(processor, taskExecutor, config, observabilitySink, Clock.systemUTC());
    }

    public ConnectionDispatcher(CommandProcessor processor,
                                Executor taskExecutor,
                                CommandServerConfig config,
                                CommandObservabilitySink observabilitySink,
                                Clock clock)
    {
        this.processor = Objects.requireNonNull(processor, "processor");
        this.taskExecutor = Objects.requireNonNull(taskExecutor, "taskExecutor");
        Objects.requireNonNull(config, "config");
        this.maxLineLength = config.maxLineLength();
        this.receiveSize = config.receiveSize();
        this.maxInFlight = config.maxInFlightPerConnection();
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void handle(CommandConnection connection)
    {
        final String id = connection.id();
        observabilitySink.onConnectionEvent(new ConnectionEvent(clock.instant(), id, ConnectionEvent.Kind.OPENED, null));

        FrameReceiver receiver = new TerminatedFrameReceiver(
                connection.source(), TerminatedFrameReceiver.NEWLINE, maxLineLength, receiveSize);

        Exception failure = null;
        try (TaskScope scope = new TaskScope(taskExecutor, maxInFlight)) {
            try {
                readLoop(id, receiver, scope);
                // Orderly end of stream: nothing spawned is dropped.
                scope.joinAll();
            }
            catch (FramingException | IOException e) {
                failure = e;
            }
            catch (InterruptedException e) {
                failure = e;
                Thread.currentThread().interrupt();
            }
            // On failure, leaving this block cancels and joins the remaining tasks.
        }
        finally {
            connection.close();
        }

        if (failure == null) {
            observabilitySink.onConnectionEvent(new ConnectionEvent(clock.instant(), id, ConnectionEvent.Kind.CLOSED, null));
        }
        else {
            observabilitySink.onConnectionEvent(new ConnectionEvent(clock.instant(), id, ConnectionEvent.Kind.FAILED, failure));
        }
    }

    private void readLoop(String id, FrameReceiver receiver, TaskScope scope)
            throws IOException, FramingException, InterruptedException
    {
        while (true) {
            Optional<byte[]> frame = receiver.receive();
            if (frame.isEmpty()) {
                return;
            }
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedException("connection " + id + " cancelled");
            }

            // Malformed UTF-8 is replaced, never fatal; the grammar will reject it if it matters.
            final String text = new String(frame.get(), StandardCharsets.UTF_8);

            if (!scope.spawn(() -> processor.process(id, text))) {
                processor.reject(id, text, scope.inFlight());
            }
        }
    }
}
