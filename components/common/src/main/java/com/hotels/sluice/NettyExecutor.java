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
package com.hotels.sluice;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.netty.channel.Channel;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollDomainSocketChannel;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerDomainSocketChannel;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.epoll.EpollSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import org.slf4j.Logger;

import java.util.concurrent.ThreadFactory;

import static org.slf4j.LoggerFactory.getLogger;

/**
 * A Netty event loop group together with the channel classes that run on it.
 * <p>
 * Uses the native epoll transport when it is available, which is also the only transport
 * that supports Unix domain sockets. Falls back to NIO otherwise.
 */
public final class NettyExecutor {
    private static final Logger LOG = getLogger(NettyExecutor.class);

    private final EventLoopGroup eventLoopGroup;
    private final boolean nativeTransport;

    /**
     * Constructs a netty/io event executor.
     *
     * @param name  thread group name
     * @param count thread count, 0 for Netty's default
     * @return a new executor
     */
    public static NettyExecutor create(String name, int count) {
        ThreadFactory threadFactory = new ThreadFactoryBuilder()
                .setNameFormat(name + "-%d-Thread")
                .setDaemon(true)
                .build();

        if (Epoll.isAvailable()) {
            LOG.info("Epoll is available. Using the native socket transport.");
            return new NettyExecutor(new EpollEventLoopGroup(count, threadFactory), true);
        } else {
            LOG.info("Epoll not available. Using nio socket transport.");
            return new NettyExecutor(new NioEventLoopGroup(count, threadFactory), false);
        }
    }

    private NettyExecutor(EventLoopGroup eventLoopGroup, boolean nativeTransport) {
        this.eventLoopGroup = eventLoopGroup;
        this.nativeTransport = nativeTransport;
    }

    public static boolean domainSocketsSupported() {
        return Epoll.isAvailable();
    }

    public void shut() {
        eventLoopGroup.shutdownGracefully();
    }

    public EventLoopGroup eventLoopGroup() {
        return eventLoopGroup;
    }

    public Class<? extends ServerChannel> serverChannelClass() {
        return nativeTransport ? EpollServerSocketChannel.class : NioServerSocketChannel.class;
    }

    public Class<? extends Channel> clientChannelClass() {
        return nativeTransport ? EpollSocketChannel.class : NioSocketChannel.class;
    }

    public Class<? extends ServerChannel> serverDomainSocketChannelClass() {
        requireNativeTransport();
        return EpollServerDomainSocketChannel.class;
    }

    public Class<? extends Channel> clientDomainSocketChannelClass() {
        requireNativeTransport();
        return EpollDomainSocketChannel.class;
    }

    private void requireNativeTransport() {
        if (!nativeTransport) {
            throw new UnsupportedOperationException("Unix domain sockets require the native epoll transport");
        }
    }
}
