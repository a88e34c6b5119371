package com.questrail.voice.config;

import com.questrail.voice.protocol.framing.impl.TerminatedFrameReceiver;

import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Aggregated configuration for the command server runtime.
 *
 * @param socketPath               filesystem path of the Unix domain socket
 * @param socketPermissions        permissions applied to the socket file right after bind;
 *                                 {@code null} keeps the process umask default
 * @param maxLineLength            largest accepted command line in bytes, excluding the terminator
 * @param receiveSize              largest single read from a connection
 * @param backlog                  listen backlog
 * @param maxInFlightPerConnection admission limit for concurrently running commands per connection
 * @param shutdownGracePeriod      how long {@code stop()} waits for cancelled work
 */
public record CommandServerConfig(
    Path socketPath,
    Set<PosixFilePermission> socketPermissions,
    int maxLineLength,
    int receiveSize,
    int backlog,
    int maxInFlightPerConnection,
    Duration shutdownGracePeriod
) {
    public static final int DEFAULT_BACKLOG = 100;
    public static final int DEFAULT_MAX_IN_FLIGHT_PER_CONNECTION = 64;
    public static final Duration DEFAULT_SHUTDOWN_GRACE_PERIOD = Duration.ofSeconds(5);

    public CommandServerConfig {
        Objects.requireNonNull(socketPath, "socketPath");
        Objects.requireNonNull(shutdownGracePeriod, "shutdownGracePeriod");
        socketPermissions = socketPermissions == null ? null : Set.copyOf(socketPermissions);
        if (maxLineLength <= 0) {
            throw new IllegalArgumentException("maxLineLength must be > 0");
        }
        if (receiveSize <= 0) {
            throw new IllegalArgumentException("receiveSize must be > 0");
        }
        if (backlog <= 0) {
            throw new IllegalArgumentException("backlog must be > 0");
        }
        if (maxInFlightPerConnection <= 0) {
            throw new IllegalArgumentException("maxInFlightPerConnection must be > 0");
        }
    }

    public Optional<Set<PosixFilePermission>> permissions() {
        return Optional.ofNullable(socketPermissions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path socketPath;
        private Set<PosixFilePermission> socketPermissions;
        private int maxLineLength = TerminatedFrameReceiver.DEFAULT_MAX_FRAME_LENGTH;
        private int receiveSize = TerminatedFrameReceiver.DEFAULT_RECEIVE_SIZE;
        private int backlog = DEFAULT_BACKLOG;
        private int maxInFlightPerConnection = DEFAULT_MAX_IN_FLIGHT_PER_CONNECTION;
        private Duration shutdownGracePeriod = DEFAULT_SHUTDOWN_GRACE_PERIOD;

        public Builder withSocketPath(Path socketPath) {
            this.socketPath = socketPath;
            return this;
        }

        public Builder withSocketPermissions(Set<PosixFilePermission> permissions) {
            this.socketPermissions = permissions;
            return this;
        }

        /**
         * @param permissions symbolic form such as {@code rw-------}
         */
        public Builder withSocketPermissions(String permissions) {
            this.socketPermissions = PosixFilePermissions.fromString(permissions);
            return this;
        }

        public Builder withMaxLineLength(int maxLineLength) {
            this.maxLineLength = maxLineLength;
            return this;
        }

        public Builder withReceiveSize(int receiveSize) {
            this.receiveSize = receiveSize;
            return this;
        }

        public Builder withBacklog(int backlog) {
            this.backlog = backlog;
            return this;
        }

        public Builder withMaxInFlightPerConnection(int maxInFlight) {
            this.maxInFlightPerConnection = maxInFlight;
            return this;
        }

        public Builder withShutdownGracePeriod(Duration gracePeriod) {
            this.shutdownGracePeriod = gracePeriod;
            return this;
        }

        public CommandServerConfig build() {
            return new CommandServerConfig(socketPath, socketPermissions, maxLineLength, receiveSize,
                    backlog, maxInFlightPerConnection, shutdownGracePeriod);
        }
    }
}
