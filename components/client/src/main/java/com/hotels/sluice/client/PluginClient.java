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
package com.hotels.sluice.client;

import com.hotels.sluice.NettyExecutor;
import com.hotels.sluice.api.CapabilityDescriptor;
import com.hotels.sluice.api.Decision;
import com.hotels.sluice.api.ExchangeEnvelope;
import com.hotels.sluice.wire.DecisionCodec;
import com.hotels.sluice.wire.DescriptorCodec;
import com.hotels.sluice.wire.EnvelopeCodec;
import com.hotels.sluice.wire.FailureCode;
import com.hotels.sluice.wire.Frame;
import com.hotels.sluice.wire.FrameType;
import com.hotels.sluice.wire.RpcMethod;
import com.hotels.sluice.wire.SettingsCodec;
import com.hotels.sluice.wire.WirePipeline;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.unix.DomainSocketAddress;
import org.slf4j.Logger;

import java.net.SocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

import static io.netty.channel.ChannelOption.ALLOCATOR;
import static io.netty.channel.ChannelOption.CONNECT_TIMEOUT_MILLIS;
import static io.netty.channel.ChannelOption.TCP_NODELAY;
import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Host side of the plugin protocol: one connection to one plugin process.
 * <p>
 * Calls may overlap freely. Every call returns a future that completes with the plugin's
 * reply, or exceptionally with {@link PluginCallException} when the plugin answers with a
 * failure, or {@link PluginUnreachableException} when the connection is lost.
 */
public final class PluginClient implements AutoCloseable {
    private static final Logger LOGGER = getLogger(PluginClient.class);

    private final Channel channel;
    private final ClientChannelHandler handler;
    private final Duration callTimeout;
    private final AtomicLong callIds = new AtomicLong();

    private PluginClient(Channel channel, ClientChannelHandler handler, Duration callTimeout) {
        this.channel = channel;
        this.handler = handler;
        this.callTimeout = callTimeout;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public CompletableFuture<CapabilityDescriptor> describe() {
        return call(RpcMethod.DESCRIBE, null, null, DescriptorCodec::decode);
    }

    public CompletableFuture<Void> configure(Map<String, String> settings) {
        return call(RpcMethod.CONFIGURE, SettingsCodec.encode(settings), null, payload -> null);
    }

    /**
     * Asks the plugin whether it is healthy.
     *
     * @return true if healthy, false if the plugin reports itself unavailable
     */
    public CompletableFuture<Boolean> checkHealth() {
        return probe(RpcMethod.CHECK_HEALTH);
    }

    /**
     * Asks the plugin whether it is ready to take traffic.
     *
     * @return true if ready, false if the plugin reports itself unavailable
     */
    public CompletableFuture<Boolean> checkReady() {
        return probe(RpcMethod.CHECK_READY);
    }

    public ExchangeCall exchange(ExchangeEnvelope envelope) {
        return exchange(envelope, callTimeout);
    }

    /**
     * Sends an envelope to the plugin.
     *
     * @param envelope envelope
     * @param timeout  deadline the plugin should apply, or null for the plugin's default
     * @return the pending call
     */
    public ExchangeCall exchange(ExchangeEnvelope envelope, Duration timeout) {
        long callId = callIds.incrementAndGet();
        CompletableFuture<Frame> reply = handler.register(callId);
        CompletableFuture<Decision> decision = reply.thenApply(frame -> decode(frame, DecisionCodec::decode));

        write(Frame.call(callId, RpcMethod.EXCHANGE, EnvelopeCodec.encode(envelope), timeout), reply);

        return new ExchangeCall(callId, decision, () -> {
            if (!reply.isDone() && decision.cancel(false)) {
                reply.completeExceptionally(new CancellationException("Call " + callId + " cancelled"));
                channel.writeAndFlush(Frame.cancel(callId));
            }
        });
    }

    private CompletableFuture<Boolean> probe(RpcMethod method) {
        return this.<Boolean>call(method, null, null, payload -> true)
                .exceptionally(cause -> {
                    Throwable failure = cause instanceof CompletionException && cause.getCause() != null
                            ? cause.getCause()
                            : cause;
                    if (failure instanceof PluginCallException
                            && ((PluginCallException) failure).code() == FailureCode.UNAVAILABLE) {
                        return false;
                    }
                    throw new CompletionException(failure);
                });
    }

    private <T> CompletableFuture<T> call(RpcMethod method, byte[] payload, Duration timeout, Function<byte[], T> decoder) {
        long callId = callIds.incrementAndGet();
        CompletableFuture<Frame> reply = handler.register(callId);
        write(Frame.call(callId, method, payload, timeout), reply);
        return reply.thenApply(frame -> decode(frame, decoder));
    }

    private void write(Frame frame, CompletableFuture<Frame> reply) {
        channel.writeAndFlush(frame).addListener(future -> {
            if (!future.isSuccess()) {
                reply.completeExceptionally(new PluginUnreachableException(channel.remoteAddress(), future.cause()));
            }
        });
    }

    private static <T> T decode(Frame frame, Function<byte[], T> decoder) {
        if (frame.type().orElse(null) == FrameType.FAILURE) {
            throw new PluginCallException(frame.failureCode().orElse(FailureCode.INTERNAL), frame.failureMessage());
        }
        return decoder.apply(frame.payload());
    }

    public boolean isConnected() {
        return channel.isActive();
    }

    public int pendingCalls() {
        return handler.pendingCalls();
    }

    @Override
    public void close() {
        channel.close().awaitUninterruptibly();
    }

    /**
     * Connects {@link PluginClient} instances.
     */
    public static final class Builder {
        private SocketAddress address;
        private NettyExecutor executor;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration callTimeout;
        private int maxFrameBytes = WirePipeline.DEFAULT_MAX_FRAME_BYTES;

        private Builder() {
        }

        public Builder address(SocketAddress address) {
            this.address = requireNonNull(address);
            return this;
        }

        public Builder executor(NettyExecutor executor) {
            this.executor = requireNonNull(executor);
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = requireNonNull(connectTimeout);
            return this;
        }

        /**
         * Sets the deadline sent with exchange calls. If not set, the plugin applies its own.
         *
         * @param callTimeout call timeout
         * @return this builder
         */
        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        public Builder maxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
            return this;
        }

        public CompletableFuture<PluginClient> connect() {
            requireNonNull(address, "address");
            NettyExecutor eventLoops = executor != null ? executor : NettyExecutor.create("Plugin-Client", 1);
            ClientChannelHandler handler = new ClientChannelHandler(address);

            Bootstrap bootstrap = new Bootstrap()
                    .group(eventLoops.eventLoopGroup())
                    .option(ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                    .option(CONNECT_TIMEOUT_MILLIS, (int) connectTimeout.toMillis())
                    .handler(new ChannelInitializer<Channel>() {
                        @Override
                        protected void initChannel(Channel ch) {
                            WirePipeline.configure(ch.pipeline(), maxFrameBytes);
                            ch.pipeline().addLast("client-handler", handler);
                        }
                    });
            if (address instanceof DomainSocketAddress) {
                bootstrap.channel(eventLoops.clientDomainSocketChannelClass());
            } else {
                bootstrap.channel(eventLoops.clientChannelClass()).option(TCP_NODELAY, true);
            }

            CompletableFuture<PluginClient> client = new CompletableFuture<>();
            ChannelFuture connected = bootstrap.connect(address);
            connected.addListener(future -> {
                if (future.isSuccess()) {
                    LOGGER.debug("Connected to plugin at {}", address);
                    client.complete(new PluginClient(connected.channel(), handler, callTimeout));
                } else {
                    client.completeExceptionally(new PluginUnreachableException(address, future.cause()));
                }
            });
            if (executor == null) {
                client.whenComplete((connection, cause) -> {
                    if (cause != null) {
                        eventLoops.shut();
                    } else {
                        connection.channel.closeFuture().addListener(closed -> eventLoops.shut());
                    }
                });
            }
            return client;
        }
    }
}
