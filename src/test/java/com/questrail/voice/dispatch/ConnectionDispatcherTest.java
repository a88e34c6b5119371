package com.questrail.voice.dispatch;

import com.questrail.voice.config.CommandServerConfig;
import com.questrail.voice.observability.CommandOutcomeEvent;
import com.questrail.voice.observability.ConnectionEvent;
import com.questrail.voice.observability.RecordingObservabilitySink;
import com.questrail.voice.protocol.framing.FrameTooLongException;
import com.questrail.voice.registry.CommandRegistry;
import com.questrail.voice.transport.FakeCommandConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class ConnectionDispatcherTest
{
    private final ExecutorService taskExecutor = Executors.newCachedThreadPool();
    private final ExecutorService connectionThread = Executors.newSingleThreadExecutor();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private final CountDownLatch releaseSlow = new CountDownLatch(1);
    private final CountDownLatch slowStarted = new CountDownLatch(1);
    private final CountDownLatch fastDone = new CountDownLatch(1);
    private final AtomicBoolean slowInterrupted = new AtomicBoolean();
    private final AtomicInteger mouseCount = new AtomicInteger();

    @AfterEach
    void shutdown()
    {
        releaseSlow.countDown();
        connectionThread.shutdownNow();
        taskExecutor.shutdownNow();
    }

    private ConnectionDispatcher dispatcher(CommandServerConfig config)
    {
        CommandRegistry registry = CommandRegistry.builder("test")
                .register("\"slow\"", command -> {
                    slowStarted.countDown();
                    try {
                        releaseSlow.await();
                    }
                    catch (InterruptedException e) {
                        slowInterrupted.set(true);
                        throw e;
                    }
                })
                .register("\"fast\"", command -> fastDone.countDown())
                .register("\"mouse\"", command -> mouseCount.incrementAndGet())
                .build();
        return new ConnectionDispatcher(new CommandProcessor(registry, sink), taskExecutor, config, sink);
    }

    private static CommandServerConfig.Builder config()
    {
        return CommandServerConfig.builder().withSocketPath(Path.of("/tmp/unused.sock"));
    }

    private Future<?> serve(ConnectionDispatcher dispatcher, FakeCommandConnection connection)
    {
        return connectionThread.submit(() -> dispatcher.handle(connection));
    }

    // ---------------------------------------------------------------------
    // Concurrency
    // ---------------------------------------------------------------------

    @Test
    void slowHandlerDoesNotDelayLaterLinesOnSameConnection() throws Exception
    {
        FakeCommandConnection connection = new FakeCommandConnection("conn-1").write("slow\nfast\n");
        Future<?> served = serve(dispatcher(config().build()), connection);

        assertTrue(slowStarted.await(5, TimeUnit.SECONDS));
        assertTrue(fastDone.await(5, TimeUnit.SECONDS), "fast command waited behind slow one");

        releaseSlow.countDown();
        connection.endOfStream();
        served.get(5, TimeUnit.SECONDS);

        assertTrue(connection.isClosed());
        assertEquals(2, sink.getOutcomes().size());
    }

    @Test
    void linesSplitAcrossReadsAreReassembled() throws Exception
    {
        FakeCommandConnection connection = new FakeCommandConnection("conn-1")
                .write("mo").write("use\nmou").write("se\n").endOfStream();

        serve(dispatcher(config().build()), connection).get(5, TimeUnit.SECONDS);

        assertEquals(2, mouseCount.get());
    }

    @Test
    void unrecognizedLineDoesNotAffectTheNext() throws Exception
    {
        FakeCommandConnection connection = new FakeCommandConnection("conn-1")
                .write("garbage in\nmouse\n").endOfStream();

        serve(dispatcher(config().build()), connection).get(5, TimeUnit.SECONDS);

        assertEquals(1, mouseCount.get());
        List<CommandOutcomeEvent> outcomes = sink.getOutcomes();
        assertEquals(2, outcomes.size());
        assertTrue(outcomes.stream().anyMatch(e -> e.outcome() instanceof ProcessingOutcome.Unrecognized));
        assertTrue(sink.awaitConnectionEvent(ConnectionEvent.Kind.CLOSED, 1000));
    }

    @Test
    void malformedUtf8IsNotFatal() throws Exception
    {
        FakeCommandConnection connection = new FakeCommandConnection("conn-1")
                .write(new byte[] { (byte) 0xff, (byte) 0xfe, '\n' })
                .write("mouse\n")
                .endOfStream();

        serve(dispatcher(config().build()), connection).get(5, TimeUnit.SECONDS);

        assertEquals(1, mouseCount.get());
        assertFalse(sink.getConnectionEvents().stream().anyMatch(e -> e.kind() == ConnectionEvent.Kind.FAILED));
    }

    // ---------------------------------------------------------------------
    // Teardown
    // ---------------------------------------------------------------------

    @Test
    void endOfStreamWaitsForSpawnedCommands() throws Exception
    {
        FakeCommandConnection connection = new FakeCommandConnection("conn-1").write("slow\n").endOfStream();
        Future<?> served = serve(dispatcher(config().build()), connection);

        assertTrue(slowStarted.await(5, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertFalse(served.isDone(), "connection closed while a command was still running");
        assertFalse(connection.isClosed());

        releaseSlow.countDown();
        served.get(5, TimeUnit.SECONDS);

        assertTrue(connection.isClosed());
        assertFalse(slowInterrupted.get());
    }

    @Test
    void framingErrorCancelsInFlightCommands() throws Exception
    {
        FakeCommandConnection connection = new FakeCommandConnection("conn-1").write("slow\n");
        Future<?> served = serve(dispatcher(config().withMaxLineLength(8).build()), connection);
        assertTrue(slowStarted.await(5, TimeUnit.SECONDS));

        connection.write("this line never ends");
        served.get(5, TimeUnit.SECONDS);

        assertTrue(slowInterrupted.get());
        assertTrue(connection.isClosed());
        ConnectionEvent failed = sink.getConnectionEvents().stream()
                .filter(e -> e.kind() == ConnectionEvent.Kind.FAILED)
                .findFirst()
                .orElseThrow();
        assertInstanceOf(FrameTooLongException.class, failed.cause());
    }

    @Test
    void transportErrorCancelsInFlightCommands() throws Exception
    {
        FakeCommandConnection connection = new FakeCommandConnection("conn-1").write("slow\n");
        Future<?> served = serve(dispatcher(config().build()), connection);
        assertTrue(slowStarted.await(5, TimeUnit.SECONDS));

        connection.fail(new IOException("reset by peer"));
        served.get(5, TimeUnit.SECONDS);

        assertTrue(slowInterrupted.get());
        assertTrue(sink.awaitConnectionEvent(ConnectionEvent.Kind.FAILED, 1000));
    }

    @Test
    void interruptingTheConnectionThreadCancelsCommands() throws Exception
    {
        FakeCommandConnection connection = new FakeCommandConnection("conn-1").write("slow\n");
        Future<?> served = serve(dispatcher(config().build()), connection);
        assertTrue(slowStarted.await(5, TimeUnit.SECONDS));

        served.cancel(true);

        assertTrue(connection.awaitClosed(5, TimeUnit.SECONDS));
        assertTrue(sink.awaitConnectionEvent(ConnectionEvent.Kind.FAILED, 5000));
        assertTrue(slowInterrupted.get());
    }

    // ---------------------------------------------------------------------
    // Admission
    // ---------------------------------------------------------------------

    @Test
    void saturatedConnectionRejectsInsteadOfBlocking() throws Exception
    {
        FakeCommandConnection connection = new FakeCommandConnection("conn-1").write("slow\n");
        Future<?> served = serve(dispatcher(config().withMaxInFlightPerConnection(1).build()), connection);
        assertTrue(slowStarted.await(5, TimeUnit.SECONDS));

        connection.write("mouse\n");
        assertTrue(sink.awaitOutcomes(1, 5000));
        assertEquals(new ProcessingOutcome.Rejected(1), sink.getOutcomes().get(0).outcome());
        assertEquals(0, mouseCount.get());

        releaseSlow.countDown();
        connection.endOfStream();
        served.get(5, TimeUnit.SECONDS);
    }
}
