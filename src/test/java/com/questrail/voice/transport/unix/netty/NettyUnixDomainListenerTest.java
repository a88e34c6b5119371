package com.questrail.voice.transport.unix.netty;

import com.questrail.voice.config.CommandServerConfig;
import com.questrail.voice.dispatch.CommandProcessor;
import com.questrail.voice.dispatch.ConnectionDispatcher;
import com.questrail.voice.observability.ConnectionEvent;
import com.questrail.voice.observability.RecordingObservabilitySink;
import com.questrail.voice.registry.CommandRegistry;
import com.questrail.voice.transport.BindFailureException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Exercises the listener over a real Unix domain socket. Skipped where the
 * native epoll transport is not available.
 */
public class NettyUnixDomainListenerTest
{
    @TempDir
    Path dir;

    private Path socket;
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();
    private final ExecutorService taskExecutor = Executors.newCachedThreadPool();
    private final List<String> said = new CopyOnWriteArrayList<>();
    private final CountDownLatch releaseSlow = new CountDownLatch(1);
    private final CountDownLatch slowStarted = new CountDownLatch(1);

    private NettyUnixDomainListener listener;

    @BeforeEach
    void setUp()
    {
        assumeTrue(NettyUnixDomainListener.isSupported(), "native epoll transport unavailable");
        socket = dir.resolve("voice.sock");
    }

    @AfterEach
    void tearDown()
    {
        releaseSlow.countDown();
        if (listener != null) {
            listener.stop();
        }
        taskExecutor.shutdownNow();
    }

    private CommandServerConfig.Builder config()
    {
        return CommandServerConfig.builder()
                .withSocketPath(socket)
                .withShutdownGracePeriod(Duration.ofSeconds(2));
    }

    private NettyUnixDomainListener start(CommandServerConfig config)
    {
        CommandRegistry registry = CommandRegistry.builder("test")
                .define("word", "/[a-z]+/")
                .register("\"say\" word", command -> said.add(command.argument(0, String.class)))
                .register("\"slow\"", command -> {
                    slowStarted.countDown();
                    releaseSlow.await();
                })
                .build();
        ConnectionDispatcher dispatcher =
                new ConnectionDispatcher(new CommandProcessor(registry, sink), taskExecutor, config, sink);
        NettyUnixDomainListener started = new NettyUnixDomainListener(config, sink);
        started.start(dispatcher);
        return started;
    }

    private SocketChannel connect() throws IOException
    {
        SocketChannel client = SocketChannel.open(StandardProtocolFamily.UNIX);
        client.connect(UnixDomainSocketAddress.of(socket));
        return client;
    }

    private static void send(SocketChannel client, String text) throws IOException
    {
        ByteBuffer buffer = ByteBuffer.wrap(text.getBytes(StandardCharsets.UTF_8));
        while (buffer.hasRemaining()) {
            client.write(buffer);
        }
    }

    private void awaitSaid(int count) throws InterruptedException
    {
        long deadline = System.currentTimeMillis() + 5000;
        while (said.size() < count && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
    }

    // ---------------------------------------------------------------------
    // Serving
    // ---------------------------------------------------------------------

    @Test
    void commandsSentOverSocketAreHandled() throws Exception
    {
        listener = start(config().build());

        try (SocketChannel client = connect()) {
            send(client, "say hello\nsay wor");
            send(client, "ld\n");
            awaitSaid(2);
        }

        assertEquals(Set.of("hello", "world"), Set.copyOf(said));
    }

    @Test
    void peerCloseEndsTheConnectionCleanly() throws Exception
    {
        listener = start(config().build());

        try (SocketChannel client = connect()) {
            send(client, "say bye\n");
        }

        assertTrue(sink.awaitConnectionEvent(ConnectionEvent.Kind.CLOSED, 5000));
        assertEquals(List.of("bye"), said);
    }

    @Test
    void slowCommandOnOneConnectionDoesNotBlockAnother() throws Exception
    {
        listener = start(config().build());

        try (SocketChannel first = connect(); SocketChannel second = connect()) {
            send(first, "slow\nsay first\n");
            assertTrue(slowStarted.await(5, TimeUnit.SECONDS));
            send(second, "say second\n");
            awaitSaid(2);

            assertEquals(Set.of("first", "second"), Set.copyOf(said));
            releaseSlow.countDown();
        }
    }

    @Test
    void overlongLineClosesOnlyThatConnection() throws Exception
    {
        listener = start(config().withMaxLineLength(16).build());

        try (SocketChannel bad = connect(); SocketChannel good = connect()) {
            send(bad, "x".repeat(64));
            assertTrue(sink.awaitConnectionEvent(ConnectionEvent.Kind.FAILED, 5000));

            send(good, "say still\n");
            awaitSaid(1);
        }

        assertEquals(List.of("still"), said);
    }

    // ---------------------------------------------------------------------
    // Endpoint lifecycle
    // ---------------------------------------------------------------------

    @Test
    void permissionsAreAppliedToSocketFile() throws Exception
    {
        listener = start(config().withSocketPermissions("rw-------").build());

        assertEquals(Set.of(PosixFilePermission.OWNER_READ, PosixFilePermission.OWNER_WRITE),
                Files.getPosixFilePermissions(socket));
    }

    @Test
    void staleSocketFileIsReplaced() throws Exception
    {
        Files.createFile(socket);

        listener = start(config().build());

        try (SocketChannel client = connect()) {
            send(client, "say fresh\n");
            awaitSaid(1);
        }
        assertEquals(List.of("fresh"), said);
    }

    @Test
    void secondListenerOnSamePathFailsToStart()
    {
        listener = start(config().build());

        NettyUnixDomainListener second = new NettyUnixDomainListener(config().build(), sink);
        assertThrows(BindFailureException.class, () -> second.start(connection -> { }));
        assertTrue(Files.exists(socket), "running listener's endpoint was removed");
    }

    @Test
    void stopRemovesEndpointAndAllowsRestart() throws Exception
    {
        listener = start(config().build());
        listener.stop();
        listener.awaitTermination();

        assertFalse(Files.exists(socket));

        listener = start(config().build());
        try (SocketChannel client = connect()) {
            send(client, "say again\n");
            awaitSaid(1);
        }
        assertEquals(List.of("again"), said);
    }

    @Test
    void stopCancelsInFlightConnections() throws Exception
    {
        listener = start(config().build());

        try (SocketChannel client = connect()) {
            send(client, "slow\n");
            assertTrue(slowStarted.await(5, TimeUnit.SECONDS));

            listener.stop();

            assertEquals(0, listener.activeConnections());
            assertTrue(sink.awaitConnectionEvent(ConnectionEvent.Kind.FAILED, 5000));
        }
    }
}
