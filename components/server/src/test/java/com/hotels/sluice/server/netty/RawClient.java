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
import com.hotels.sluice.wire.Frame;
import com.hotels.sluice.wire.WirePipeline;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.unix.DomainSocketAddress;

import java.net.SocketAddress;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import static java.util.concurrent.TimeUnit.MILLISECONDS;

/**
 * Speaks the frame protocol directly, for driving a server from tests.
 */
class RawClient implements AutoCloseable {
    private final NettyExecutor executor = NettyExecutor.create("Test-Client", 1);
    private final BlockingQueue<Frame> received = new LinkedBlockingQueue<>();
    private final Channel channel;

    RawClient(SocketAddress address) throws InterruptedException {
        Bootstrap bootstrap = new Bootstrap()
                .group(executor.eventLoopGroup())
                .channel(address instanceof DomainSocketAddress
                        ? executor.clientDomainSocketChannelClass()
                        : executor.clientChannelClass())
                .handler(new ChannelInitializer<Channel>() {
                    @Override
                    protected void initChannel(Channel ch) {
                        WirePipeline.configure(ch.pipeline(), WirePipeline.DEFAULT_MAX_FRAME_BYTES);
                        ch.pipeline().addLast(new SimpleChannelInboundHandler<Frame>() {
                            @Override
                            protected void channelRead0(ChannelHandlerContext ctx, Frame frame) {
                                received.add(frame);
                            }
                        });
                    }
                });
        this.channel = bootstrap.connect(address).sync().channel();
    }

    void send(Frame frame) {
        channel.writeAndFlush(frame).syncUninterruptibly();
    }

    Frame receive() throws InterruptedException {
        Frame frame = received.poll(3000, MILLISECONDS);
        if (frame == null) {
            throw new AssertionError("No frame received within 3 seconds");
        }
        return frame;
    }

    Frame poll(long millis) throws InterruptedException {
        return received.poll(millis, MILLISECONDS);
    }

    boolean isActive() {
        return channel.isActive();
    }

    @Override
    public void close() {
        channel.close().syncUninterruptibly();
        executor.shut();
    }
}
