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

import com.hotels.sluice.wire.Frame;
import com.hotels.sluice.wire.FrameType;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import org.slf4j.Logger;

import java.net.SocketAddress;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import static org.slf4j.LoggerFactory.getLogger;

/**
 * Matches replies and failures from the plugin to the calls awaiting them.
 */
class ClientChannelHandler extends SimpleChannelInboundHandler<Frame> {
    private static final Logger LOGGER = getLogger(ClientChannelHandler.class);

    private final SocketAddress address;
    private final Map<Long, CompletableFuture<Frame>> pending = new ConcurrentHashMap<>();

    ClientChannelHandler(SocketAddress address) {
        this.address = address;
    }

    CompletableFuture<Frame> register(long callId) {
        CompletableFuture<Frame> future = new CompletableFuture<>();
        pending.put(callId, future);
        future.whenComplete((frame, cause) -> pending.remove(callId, future));
        return future;
    }

    int pendingCalls() {
        return pending.size();
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Frame frame) {
        Optional<FrameType> type = frame.type();
        if (!type.isPresent() || type.get() == FrameType.CALL || type.get() == FrameType.CANCEL) {
            LOGGER.warn("Ignoring unexpected frame {} from {}", frame, address);
            return;
        }
        CompletableFuture<Frame> future = pending.get(frame.callId());
        if (future == null) {
            LOGGER.debug("No call waiting for {}", frame);
            return;
        }
        future.complete(frame);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        PluginUnreachableException closed = new PluginUnreachableException(address, "Connection closed by");
        pending.values().forEach(future -> future.completeExceptionally(closed));
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.warn("Closing connection to {}", address, cause);
        ctx.close();
    }
}
