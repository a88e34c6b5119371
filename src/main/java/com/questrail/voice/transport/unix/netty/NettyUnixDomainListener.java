package com.questrail.voice.transport.unix.netty;

import com.questrail.voice.config.CommandServerConfig;
import com.questrail.voice.observability.CommandErrorEvent;
import com.questrail.voice.observability.CommandObservabilitySink;
import com.questrail.voice.observability.NullObservabilitySink;
import com.questrail.voice.transport.BindFailureException;
import com.questrail.voice.transport.ConnectionHandler;
import com.questrail.voice.transport.ConnectionListener;
import com.questrail.voice.transport.unix.EndpointLock;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.FixedRecvByteBufAllocator;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollDomainSocketChannel;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerDomainSocketChannel;
import io.netty.channel.unix.DomainSocketAddress;
import io.netty.util.concurrent.DefaultThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * NettyUnixDomainListener
 * =============================================================================
 * Netty-backed implementation of the {@link ConnectionListener} port over a
 * Unix domain socket (native epoll transport, Linux only).
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>. It MUST NOT frame,
 * decode or parse command lines.
 *
 * <h2>Startup sequence</h2>
 * <ol>
 *   <li>Acquire the endpoint's advisory lock ({@link EndpointLock}).</li>
 *   <li>Remove any stale socket file at the configured path.</li>
 *   <li>Bind with the configured backlog, with accepting still paused.</li>
 *   <li>Restrict the socket file's permissions, if configured.</li>
 *   <li>Resume accepting.</li>
 * </ol>
 * <p>Accepting is paused between bind and the permission change so that no
 * client can connect while the socket file still has default permissions.</p>
 *
 * <h2>Connection handling</h2>
 * Every accepted channel gets its own thread running the
 * {@link ConnectionHandler}. Event loop threads only move bytes.
 *
 * <h2>Lifecycle</h2>
 * - {@link #start(ConnectionHandler)} performs the startup sequence.
 * - {@link #stop()} closes the server channel, cancels every in-flight
 *   connection as a unit, waits up to the grace period for their handlers,
 *   then shuts down the event loops and releases the endpoint.
 */
public final class NettyUnixDomainListener implements ConnectionListener
{
    private static final Logger log = LoggerFactory.getLogger(NettyUnixDomainListener.class);

    private final CommandServerConfig config;
    private final CommandObservabilitySink observabilitySink;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicLong connectionIds = new AtomicLong();
    private final Map<NettyChannelConnection, FutureTask<Void>> connections = new ConcurrentHashMap<>();

    private volatile EndpointLock endpointLock;
    private volatile EventLoopGroup acceptGroup;
    private volatile EventLoopGroup ioGroup;
    private volatile ExecutorService connectionExecutor;
    private volatile Channel serverChannel;

    public NettyUnixDomainListener(CommandServerConfig config, CommandObservabilitySink observabilitySink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /** True if the native transport this listener needs can be loaded on this host. */
    public static boolean isSupported()
    {
        return Epoll.isAvailable();
    }

    @Override
    public void start(ConnectionHandler handler)
    {
        Objects.requireNonNull(handler, "handler");
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("listener already started");
        }
        if (!Epoll.isAvailable()) {
            throw new BindFailureException("native epoll transport unavailable", Epoll.unavailabilityCause());
        }

        final Path path = config.socketPath();
        endpointLock = EndpointLock.acquire(path);
        try {
            Files.deleteIfExists(path);
        }
        catch (IOException e) {
            releaseEndpoint();
            throw new BindFailureException("cannot remove stale endpoint " + path, e);
        }

        acceptGroup = new EpollEventLoopGroup(1, new DefaultThreadFactory("voice-accept"));
        ioGroup = new EpollEventLoopGroup(0, new DefaultThreadFactory("voice-io"));
        connectionExecutor = Executors.newCachedThreadPool(new DefaultThreadFactory("voice-connection"));

        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(acceptGroup, ioGroup)
                .channel(EpollServerDomainSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, config.backlog())
                .option(ChannelOption.AUTO_READ, false)
                .childOption(ChannelOption.AUTO_READ, false)
                .childOption(ChannelOption.RCVBUF_ALLOCATOR, new FixedRecvByteBufAllocator(config.receiveSize()))
                .childHandler(new ChannelInitializer<EpollDomainSocketChannel>() {
                    @Override
                    protected void initChannel(EpollDomainSocketChannel ch)
                    {
                        NettyChannelConnection connection =
                                new NettyChannelConnection("conn-" + connectionIds.incrementAndGet(), ch);
                        ch.pipeline().addLast(connection.inboundHandler());
                        dispatch(connection, handler);
                    }
                });

        ChannelFuture bind = bootstrap.bind(new DomainSocketAddress(path.toString())).awaitUninterruptibly();
        if (!bind.isSuccess()) {
            shutdownGroups();
            releaseEndpoint();
            throw new BindFailureException("cannot bind " + path, bind.cause());
        }
        serverChannel = bind.channel();

        try {
            if (config.permissions().isPresent()) {
                Files.setPosixFilePermissions(path, config.permissions().get());
            }
        }
        catch (IOException | UnsupportedOperationException e) {
            serverChannel.close().awaitUninterruptibly();
            shutdownGroups();
            releaseEndpoint();
            throw new BindFailureException("cannot restrict permissions on " + path, e);
        }

        serverChannel.config().setAutoRead(true);
        log.info("Listening on {} (backlog {})", path, config.backlog());
    }

    @Override
    public void stop()
    {
        if (!started.get() || !stopped.compareAndSet(false, true)) {
            return;
        }

        Channel server = serverChannel;
        if (server != null) {
            server.close().awaitUninterruptibly();
        }

        // Cancel all connection handling as a unit: interrupt every
        // dispatcher, then close every channel.
        for (Map.Entry<NettyChannelConnection, FutureTask<Void>> entry : connections.entrySet()) {
            entry.getValue().cancel(true);
            entry.getKey().close();
        }

        ExecutorService executor = connectionExecutor;
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(config.shutdownGracePeriod().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Connection handlers still running after {}", config.shutdownGracePeriod());
                    executor.shutdownNow();
                }
            }
            catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        shutdownGroups();

        try {
            Files.deleteIfExists(config.socketPath());
        }
        catch (IOException e) {
            log.warn("Could not remove endpoint {}", config.socketPath(), e);
        }
        releaseEndpoint();

        log.info("Stopped listening on {}", config.socketPath());
        terminated.countDown();
    }

    @Override
    public void awaitTermination() throws InterruptedException
    {
        terminated.await();
    }

    /** Number of connections whose handlers have not yet returned. */
    public int activeConnections()
    {
        return connections.size();
    }

    private void dispatch(NettyChannelConnection connection, ConnectionHandler handler)
    {
        FutureTask<Void> task = new FutureTask<>(() -> runHandler(connection, handler), null) {
            @Override
            protected void done()
            {
                connections.remove(connection, this);
            }
        };
        connections.put(connection, task);
        try {
            connectionExecutor.execute(task);
        }
        catch (RejectedExecutionException e) {
            // Listener is stopping.
            connections.remove(connection, task);
            connection.close();
        }
    }

    private void runHandler(NettyChannelConnection connection, ConnectionHandler handler)
    {
        try {
            handler.handle(connection);
        }
        catch (RuntimeException e) {
            observabilitySink.onError(new CommandErrorEvent(
                    Instant.now(),
                    "Connection handler for " + connection.id() + " failed",
                    e
            ));
        }
        finally {
            connection.close();
        }
    }

    private void shutdownGroups()
    {
        Duration grace = config.shutdownGracePeriod();
        if (acceptGroup != null) {
            acceptGroup.shutdownGracefully(0, grace.toMillis(), TimeUnit.MILLISECONDS).awaitUninterruptibly();
        }
        if (ioGroup != null) {
            ioGroup.shutdownGracefully(0, grace.toMillis(), TimeUnit.MILLISECONDS).awaitUninterruptibly();
        }
    }

    private void releaseEndpoint()
    {
        EndpointLock lock = endpointLock;
        if (lock == null) {
            return;
        }
        endpointLock = null;
        try {
            lock.close();
        }
        catch (IOException e) {
            log.warn("Could not release endpoint lock {}", lock.path(), e);
        }
    }
}
