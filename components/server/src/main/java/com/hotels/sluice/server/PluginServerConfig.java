/*
  Copyright (C) 2013-2021 Expedia Inc.

  Licensed under the Apache License, Version 2.0 (the "License");
  you may not use this file except in compliance with the License.
  You may obtain a copy of the License at

  http://www.apache.org/licenses/LICENSE-2.0

  Unless required by applicable law or agreed to in writing, software
  distributed under the License is distributed on an "AS IS" BASIS,
  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
  See the License for the specific language governing permissions and
  limitations under the License.
 */
package com.hotels.sluice.server;

import com.hotels.sluice.api.exceptions.ConfigurationException;
import io.netty.channel.unix.DomainSocketAddress;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Duration;
import java.util.Optional;

import static com.hotels.sluice.wire.WirePipeline.DEFAULT_MAX_FRAME_BYTES;
import static java.util.Objects.requireNonNull;

/**
 * Immutable settings of a plugin runtime server.
 */
public final class PluginServerConfig {
    public static final int DEFAULT_PORT = 50051;
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofMillis(5000);
    public static final Duration DEFAULT_DRAIN_TIMEOUT = Duration.ofMillis(5000);
    public static final int DEFAULT_WORKER_THREADS = 10;

    private final Network network;
    private final String host;
    private final int port;
    private final String socketPath;
    private final Duration callTimeout;
    private final Duration drainTimeout;
    private final int workerThreads;
    private final int maxFrameBytes;

    private PluginServerConfig(Builder builder) {
        this.network = builder.network;
        this.host = builder.host;
        this.port = builder.port;
        this.socketPath = builder.socketPath;
        this.callTimeout = builder.callTimeout;
        this.drainTimeout = builder.drainTimeout;
        this.workerThreads = builder.workerThreads;
        this.maxFrameBytes = builder.maxFrameBytes;
    }

    public static Builder newConfigBuilder() {
        return new Builder();
    }

    public Network network() {
        return network;
    }

    /**
     * Host to bind to. Empty means all interfaces.
     *
     * @return host
     */
    public Optional<String> host() {
        return Optional.ofNullable(host);
    }

    public int port() {
        return port;
    }

    public Optional<String> socketPath() {
        return Optional.ofNullable(socketPath);
    }

    public Duration callTimeout() {
        return callTimeout;
    }

    public Duration drainTimeout() {
        return drainTimeout;
    }

    public int workerThreads() {
        return workerThreads;
    }

    public int maxFrameBytes() {
        return maxFrameBytes;
    }

    public SocketAddress bindAddress() {
        if (network == Network.UNIX) {
            return new DomainSocketAddress(socketPath);
        }
        return host == null ? new InetSocketAddress(port) : new InetSocketAddress(host, port);
    }

    /**
     * Human readable form of the listen endpoint.
     *
     * @return endpoint
     */
    public String endpoint() {
        if (network == Network.UNIX) {
            return "unix:" + socketPath;
        }
        return (host == null ? "*" : host) + ":" + port;
    }

    @Override
    public String toString() {
        return new StringBuilder(160)
                .append(getClass().getSimpleName())
                .append("{endpoint=")
                .append(endpoint())
                .append(", callTimeout=")
                .append(callTimeout.toMillis())
                .append("ms, drainTimeout=")
                .append(drainTimeout.toMillis())
                .append("ms, workerThreads=")
                .append(workerThreads)
                .append(", maxFrameBytes=")
                .append(maxFrameBytes)
                .append('}')
                .toString();
    }

    /**
     * Builds {@link PluginServerConfig}. Invalid values fail with {@link ConfigurationException}.
     */
    public static final class Builder {
        private Network network = Network.TCP;
        private String host;
        private int port = DEFAULT_PORT;
        private String socketPath;
        private Duration callTimeout = DEFAULT_CALL_TIMEOUT;
        private Duration drainTimeout = DEFAULT_DRAIN_TIMEOUT;
        private int workerThreads = DEFAULT_WORKER_THREADS;
        private int maxFrameBytes = DEFAULT_MAX_FRAME_BYTES;

        private Builder() {
        }

        public Builder tcp(String host, int port) {
            if (port < 0 || port > 65535) {
                throw new ConfigurationException("Port must be between 0 and 65535, but was " + port);
            }
            this.network = Network.TCP;
            this.host = host == null || host.isEmpty() ? null : host;
            this.port = port;
            this.socketPath = null;
            return this;
        }

        public Builder unix(String socketPath) {
            if (socketPath == null || socketPath.isEmpty()) {
                throw new ConfigurationException("Unix socket path must not be empty");
            }
            this.network = Network.UNIX;
            this.socketPath = socketPath;
            this.host = null;
            return this;
        }

        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = positive(requireNonNull(callTimeout), "call timeout");
            return this;
        }

        public Builder drainTimeout(Duration drainTimeout) {
            requireNonNull(drainTimeout);
            if (drainTimeout.isNegative()) {
                throw new ConfigurationException("drain timeout must not be negative, but was " + drainTimeout);
            }
            this.drainTimeout = drainTimeout;
            return this;
        }

        public Builder workerThreads(int workerThreads) {
            if (workerThreads < 1) {
                throw new ConfigurationException("worker threads must be at least 1, but was " + workerThreads);
            }
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder maxFrameBytes(int maxFrameBytes) {
            if (maxFrameBytes < 1024 || maxFrameBytes > Integer.MAX_VALUE - 4) {
                throw new ConfigurationException("max frame bytes must be at least 1024, but was " + maxFrameBytes);
            }
            this.maxFrameBytes = maxFrameBytes;
            return this;
        }

        public PluginServerConfig build() {
            return new PluginServerConfig(this);
        }

        private static Duration positive(Duration duration, String name) {
            if (duration.isZero() || duration.isNegative()) {
                throw new ConfigurationException(name + " must be positive, but was " + duration);
            }
            return duration;
        }
    }
}
