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
package com.hotels.sluice.server.netty;

import com.hotels.sluice.NettyExecutor;
import com.hotels.sluice.server.EndpointBindException;
import com.hotels.sluice.server.Network;
import com.hotels.sluice.server.PluginServerConfig;
import com.hotels.sluice.server.RegisteredPlugin;
import com.hotels.sluice.server.dispatch.ExchangeDispatcher;
import com.hotels.sluice.server.dispatch.RuntimeMetrics;
import com.hotels.sluice.service.AbstractRuntimeService;
import com.hotels.sluice.wire.DescriptorCodec;
import com.hotels.sluice.wire.WirePipeline;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.PooledByteBufAllocator;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.util.concurrent.ImmediateEventExecutor;
import org.slf4j.Logger;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static io.netty.channel.ChannelOption.ALLOCATOR;
import static io.netty.channel.ChannelOption.SO_BACKLOG;
import static io.netty.channel.ChannelOption.SO_KEEPALIVE;
import static io.netty.channel.ChannelOption.SO_REUSEADDR;
import static io.netty.channel.ChannelOption.TCP_NODELAY;
import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Netty server exposing one plugin over the plugin protocol.
 * <p>
 * Stopping the server closes the listener, refuses further calls on open connections,
 * waits for in-flight calls up to the drain timeout and cancels whatever is left, before
 * closing connections and releasing threads.
 */
public final class PluginServer extends AbstractRuntimeService {
    private static final Logger LOGGER = getLogger(PluginServer.class);

    private final PluginServerConfig config;
    private final RegisteredPlugin plugin;
    private final ExchangeDispatcher dispatcher;
    private final NettyExecutor bossExecutor;
    private final NettyExecutor workerExecutor;
    private final ChannelGroup connections = new DefaultChannelGroup(ImmediateEventExecutor.INSTANCE);
    private final byte[] descriptor;

    private volatile Channel serverChannel;
    private volatile SocketAddress address;

    PluginServer(PluginServerBuilder builder, RegisteredPlugin plugin) {
        super("plugin-server:" + plugin.name());
        this.config = requireNonNull(builder.config());
        this.plugin = plugin;
        this.bossExecutor = requireNonNull(builder.bossExecutor());
        this.workerExecutor = requireNonNull(builder.workerExecutor());
        this.dispatcher = new ExchangeDispatcher(plugin, config.callTimeout(), config.workerThreads(),
                new RuntimeMetrics(builder.meterRegistry(), plugin.name()));
        this.descriptor = DescriptorCodec.encode(plugin.descriptor());
    }

    public RegisteredPlugin plugin() {
        return plugin;
    }

    public PluginServerConfig config() {
        return config;
    }

    /**
     * The bound address, once listening.
     *
     * @return bound address
     */
    public Optional<SocketAddress> address() {
        return Optional.ofNullable(address);
    }

    /**
     * The bound TCP address, once listening on TCP.
     *
     * @return bound address or null
     */
    public InetSocketAddress inetAddress() {
        SocketAddress bound = address;
        return bound instanceof InetSocketAddress ? (InetSocketAddress) bound : null;
    }

    @Override
    protected CompletableFuture<Void> startService() {
        LOGGER.debug("starting plugin server {}", config);

        CompletableFuture<Void> serviceFuture = new CompletableFuture<>();

        ServerBootstrap b = new ServerBootstrap();
        boolean tcp = config.network() == Network.TCP;

        b.group(bossExecutor.eventLoopGroup(), workerExecutor.eventLoopGroup())
                .channel(tcp ? bossExecutor.serverChannelClass() : bossExecutor.serverDomainSocketChannelClass())
                .option(SO_BACKLOG, 1024)
                .childOption(ALLOCATOR, PooledByteBufAllocator.DEFAULT)
                .childHandler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        connections.add(ch);
                        WirePipeline.configure(ch.pipeline(), config.maxFrameBytes());
                        ch.pipeline().addLast("rpc-handler", new RpcChannelHandler(plugin, dispatcher, descriptor));
                    }
                });
        if (tcp) {
            b.option(SO_REUSEADDR, true)
                    .childOption(SO_KEEPALIVE, true)
                    .childOption(TCP_NODELAY, true);
        }

        b.bind(config.bindAddress())
                .addListener((ChannelFutureListener) future -> {
                    if (future.isSuccess()) {
                        serverChannel = future.channel();
                        address = serverChannel.localAddress();
                        LOGGER.debug("plugin server bound successfully on {}", address);
                        try {
                            plugin.plugin().runtimeStarting();
                            serviceFuture.complete(null);
                        } catch (RuntimeException e) {
                            serverChannel.close();
                            failStart(serviceFuture, e);
                        }
                    } else {
                        LOGGER.warn("Failed to start service={} cause={}", this, future.cause().toString());
                        failStart(serviceFuture, new EndpointBindException(config.endpoint(), future.cause()));
                    }
                });

        return serviceFuture;
    }

    @Override
    protected CompletableFuture<Void> stopService() {
        return CompletableFuture.runAsync(() -> {
            Channel listener = serverChannel;
            if (listener != null) {
                listener.close().awaitUninterruptibly();
            }
            dispatcher.stopAccepting();

            if (!dispatcher.awaitDrained(config.drainTimeout())) {
                int cancelled = dispatcher.cancelInFlight();
                LOGGER.warn("Cancelled {} calls still in flight after {} ms", cancelled, config.drainTimeout().toMillis());
            }

            connections.close().awaitUninterruptibly();

            try {
                plugin.plugin().runtimeStopping();
            } catch (RuntimeException e) {
                LOGGER.error("Plugin '{}' failed to stop cleanly", plugin.name(), e);
            }

            release();
        });
    }

    private void failStart(CompletableFuture<Void> serviceFuture, Throwable cause) {
        CompletableFuture.runAsync(this::release)
                .whenComplete((na, e) -> {
                    if (e != null) {
                        cause.addSuppressed(e);
                    }
                    serviceFuture.completeExceptionally(cause);
                });
    }

    private void release() {
        dispatcher.close();
        workerExecutor.shut();
        bossExecutor.shut();
        address = null;
    }

    @Override
    public String toString() {
        return "PluginServer{plugin=" + plugin.name() + ", endpoint=" + config.endpoint() + ", status=" + status() + '}';
    }
}
