package com.questrail.voice.runtime;

import com.questrail.voice.api.CommandPlugin;
import com.questrail.voice.config.CommandServerConfig;
import com.questrail.voice.dispatch.CommandProcessor;
import com.questrail.voice.dispatch.ConnectionDispatcher;
import com.questrail.voice.observability.CommandObservabilitySink;
import com.questrail.voice.observability.NullObservabilitySink;
import com.questrail.voice.registry.CommandRegistry;
import com.questrail.voice.transport.ConnectionListener;
import com.questrail.voice.transport.unix.netty.NettyUnixDomainListener;

import io.netty.util.concurrent.DefaultThreadFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiFunction;

/**
 * CommandServerRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the command server.
 *
 * <pre>
 *   plugins → CommandRegistry.combine → CommandProcessor
 *                                           ↑
 *   ConnectionListener → ConnectionDispatcher (per connection) → TaskScope
 * </pre>
 *
 * <p>All assembly failures (malformed patterns, undefined rules, colliding
 * definitions) surface from {@link Builder#build()}, before any endpoint is
 * bound.</p>
 */
public final class CommandServerRuntime {
    private static final Logger log = LoggerFactory.getLogger(CommandServerRuntime.class);

    private final CommandServerConfig config;
    private final CommandRegistry registry;
    private final ConnectionListener listener;
    private final ConnectionDispatcher dispatcher;
    private final ExecutorService taskExecutor;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private CommandServerRuntime(
            CommandServerConfig config,
            CommandRegistry registry,
            ConnectionListener listener,
            ConnectionDispatcher dispatcher,
            ExecutorService taskExecutor) {
        this.config = config;
        this.registry = registry;
        this.listener = listener;
        this.dispatcher = dispatcher;
        this.taskExecutor = taskExecutor;
    }

    /**
     * Bind the endpoint and begin serving.
     *
     * @throws com.questrail.voice.transport.BindFailureException if the
     *         endpoint cannot be created
     */
    public void start() {
        try {
            listener.start(dispatcher);
        } catch (RuntimeException e) {
            taskExecutor.shutdownNow();
            throw e;
        }
        log.info("Serving {} command patterns from {} on {}",
                registry.patterns().size(), registry.sources(), config.socketPath());
    }

    /** Stop accepting, cancel every connection and command, release the endpoint. Idempotent. */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        listener.stop();
        taskExecutor.shutdownNow();
        try {
            if (!taskExecutor.awaitTermination(config.shutdownGracePeriod().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Command tasks still running after {}", config.shutdownGracePeriod());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Block until the listener has stopped. */
    public void awaitTermination() throws InterruptedException {
        listener.awaitTermination();
    }

    public CommandRegistry registry() {
        return registry;
    }

    public CommandServerConfig config() {
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private CommandServerConfig config;
        private final List<CommandPlugin> plugins = new ArrayList<>();
        private CommandRegistry registry;
        private CommandObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private BiFunction<CommandServerConfig, CommandObservabilitySink, ConnectionListener> listenerFactory =
                NettyUnixDomainListener::new;

        public Builder withConfig(CommandServerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withPlugin(CommandPlugin plugin) {
            this.plugins.add(Objects.requireNonNull(plugin, "plugin"));
            return this;
        }

        public Builder withPlugins(List<CommandPlugin> plugins) {
            plugins.forEach(this::withPlugin);
            return this;
        }

        /** Use an already assembled registry; combined with any plugins added. */
        public Builder withRegistry(CommandRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder withObservabilitySink(CommandObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withListenerFactory(
                BiFunction<CommandServerConfig, CommandObservabilitySink, ConnectionListener> factory) {
            this.listenerFactory = factory;
            return this;
        }

        /**
         * @throws com.questrail.voice.grammar.GrammarException on a malformed
         *         pattern or an undefined rule
         * @throws com.questrail.voice.registry.DuplicateDefinitionException on
         *         colliding definitions
         */
        public CommandServerRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(listenerFactory, "listenerFactory");
            CommandObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            // 1. Assemble the grammar
            List<CommandRegistry> sources = new ArrayList<>();
            if (registry != null) {
                sources.add(registry);
            }
            for (CommandPlugin plugin : plugins) {
                sources.add(plugin.registry());
            }
            if (sources.isEmpty()) {
                throw new IllegalStateException("no plugins or registry configured");
            }
            CommandRegistry combined = CommandRegistry.combine(sources);

            // 2. Command execution
            ExecutorService taskExecutor = Executors.newCachedThreadPool(new DefaultThreadFactory("voice-command"));
            CommandProcessor processor = new CommandProcessor(combined, sink);
            ConnectionDispatcher dispatcher = new ConnectionDispatcher(processor, taskExecutor, config, sink);

            // 3. Transport
            ConnectionListener listener = listenerFactory.apply(config, sink);

            return new CommandServerRuntime(config, combined, listener, dispatcher, taskExecutor);
        }
    }
}
