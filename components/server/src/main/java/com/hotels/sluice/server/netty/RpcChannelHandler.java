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

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.hotels.sluice.api.Decision;
import com.hotels.sluice.api.ExchangeEnvelope;
import com.hotels.sluice.api.exceptions.ConfigurationException;
import com.hotels.sluice.api.exceptions.ProtocolException;
import com.hotels.sluice.server.RegisteredPlugin;
import com.hotels.sluice.server.dispatch.ExchangeDispatcher;
import com.hotels.sluice.server.dispatch.InFlightCall;
import com.hotels.sluice.wire.DecisionCodec;
import com.hotels.sluice.wire.EnvelopeCodec;
import com.hotels.sluice.wire.FailureCode;
import com.hotels.sluice.wire.Frame;
import com.hotels.sluice.wire.FrameType;
import com.hotels.sluice.wire.RpcMethod;
import com.hotels.sluice.wire.SettingsCodec;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.codec.TooLongFrameException;
import org.slf4j.Logger;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static com.hotels.sluice.wire.FailureCode.CONFIGURATION;
import static com.hotels.sluice.wire.FailureCode.INTERNAL;
import static com.hotels.sluice.wire.FailureCode.PROTOCOL;
import static com.hotels.sluice.wire.FailureCode.UNAVAILABLE;
import static com.hotels.sluice.wire.FailureCode.UNIMPLEMENTED;
import static java.lang.String.format;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Serves the plugin protocol on one host connection.
 * <p>
 * Frames are read on the event loop. Plugin code runs on the dispatcher's worker pool and
 * replies are written from there. Any number of calls may be in flight on the connection;
 * closing it cancels them.
 */
class RpcChannelHandler extends SimpleChannelInboundHandler<Frame> {
    private static final Logger LOGGER = getLogger(RpcChannelHandler.class);
    private static final byte[] EMPTY = new byte[0];

    private final RegisteredPlugin plugin;
    private final ExchangeDispatcher dispatcher;
    private final byte[] descriptor;
    private final Map<Long, InFlightCall> calls = new ConcurrentHashMap<>();

    RpcChannelHandler(RegisteredPlugin plugin, ExchangeDispatcher dispatcher, byte[] descriptor) {
        this.plugin = plugin;
        this.dispatcher = dispatcher;
        this.descriptor = descriptor;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Frame frame) {
        Optional<FrameType> type = frame.type();
        if (!type.isPresent()) {
            fail(ctx, frame.callId(), PROTOCOL, "Unknown frame type " + frame.typeCode());
            return;
        }

        switch (type.get()) {
            case CALL:
                onCall(ctx, frame);
                break;
            case CANCEL:
                onCancel(frame.callId());
                break;
            default:
                fail(ctx, frame.callId(), PROTOCOL, "Unexpected " + type.get() + " frame from host");
        }
    }

    private void onCall(ChannelHandlerContext ctx, Frame frame) {
        long callId = frame.callId();
        Optional<RpcMethod> method = frame.method();
        if (!method.isPresent()) {
            fail(ctx, callId, UNIMPLEMENTED, "Unknown method " + frame.methodCode());
            return;
        }
        if (!dispatcher.isAccepting()) {
            fail(ctx, callId, UNAVAILABLE, "Plugin runtime is shutting down");
            return;
        }

        try {
            switch (method.get()) {
                case DESCRIBE:
                    ctx.writeAndFlush(Frame.reply(callId, descriptor));
                    break;
                case CONFIGURE:
                    configure(ctx, callId, SettingsCodec.decode(frame.payload()));
                    break;
                case CHECK_HEALTH:
                    probe(ctx, callId, dispatcher.submit(plugin::healthy), "unhealthy");
                    break;
                case CHECK_READY:
                    probe(ctx, callId, dispatcher.submit(plugin::ready), "not ready");
                    break;
                case EXCHANGE:
                    exchange(ctx, callId, frame);
                    break;
                default:
                    fail(ctx, callId, UNIMPLEMENTED, "Unsupported method " + method.get());
            }
        } catch (ProtocolException e) {
            LOGGER.debug("Call {} rejected: {}", callId, e.getMessage());
            fail(ctx, callId, PROTOCOL, e.getMessage());
        } catch (RejectedExecutionException e) {
            fail(ctx, callId, UNAVAILABLE, "Plugin runtime is shutting down");
        }
    }

    private void exchange(ChannelHandlerContext ctx, long callId, Frame frame) {
        if (calls.containsKey(callId)) {
            throw new ProtocolException("Call id " + callId + " is already in flight");
        }
        ExchangeEnvelope envelope = EnvelopeCodec.decode(frame.payload());
        InFlightCall call = dispatcher.dispatch(callId, envelope, frame.timeout());
        calls.put(callId, call);

        Futures.addCallback(call.result(), new FutureCallback<Decision>() {
            @Override
            public void onSuccess(Decision decision) {
                calls.remove(callId, call);
                ctx.writeAndFlush(Frame.reply(callId, DecisionCodec.encode(decision)));
            }

            @Override
            public void onFailure(Throwable cause) {
                calls.remove(callId, call);
                if (cause instanceof CancellationException) {
                    LOGGER.debug("Call {} cancelled by host", callId);
                } else {
                    LOGGER.error("Call {} failed unexpectedly", callId, cause);
                    fail(ctx, callId, INTERNAL, cause.getMessage());
                }
            }
        }, directExecutor());
    }

    private void configure(ChannelHandlerContext ctx, long callId, Map<String, String> settings) {
        ListenableFuture<Void> configured = dispatcher.submit(() -> {
            plugin.configure(settings);
            return null;
        });
        reply(ctx, callId, configured, ignored -> EMPTY);
    }

    private void probe(ChannelHandlerContext ctx, long callId, ListenableFuture<Boolean> probe, String negative) {
        reply(ctx, callId, Futures.transform(probe, ok -> {
            if (!ok) {
                throw new ProbeFailedException(format("Plugin '%s' is %s", plugin.name(), negative));
            }
            return EMPTY;
        }, directExecutor()), Function.identity());
    }

    private <T> void reply(ChannelHandlerContext ctx, long callId, ListenableFuture<T> future, Function<T, byte[]> encoder) {
        Futures.addCallback(future, new FutureCallback<T>() {
            @Override
            public void onSuccess(T result) {
                ctx.writeAndFlush(Frame.reply(callId, encoder.apply(result)));
            }

            @Override
            public void onFailure(Throwable cause) {
                if (cause instanceof ProtocolException) {
                    fail(ctx, callId, PROTOCOL, cause.getMessage());
                } else if (cause instanceof ConfigurationException) {
                    LOGGER.warn("Call {} rejected configuration: {}", callId, cause.getMessage());
                    fail(ctx, callId, CONFIGURATION, cause.getMessage());
                } else if (cause instanceof ProbeFailedException) {
                    fail(ctx, callId, UNAVAILABLE, cause.getMessage());
                } else {
                    LOGGER.error("Call {} failed unexpectedly", callId, cause);
                    fail(ctx, callId, INTERNAL, String.valueOf(cause.getMessage()));
                }
            }
        }, directExecutor());
    }

    private void onCancel(long callId) {
        InFlightCall call = calls.remove(callId);
        if (call != null) {
            call.cancel();
        } else {
            LOGGER.debug("Cancel for unknown call {}", callId);
        }
    }

    private static void fail(ChannelHandlerContext ctx, long callId, FailureCode code, String message) {
        ctx.writeAndFlush(Frame.failure(callId, code, message == null ? "" : message));
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (!calls.isEmpty()) {
            LOGGER.debug("Connection {} closed with {} calls in flight", ctx.channel().remoteAddress(), calls.size());
            calls.values().forEach(InFlightCall::cancel);
            calls.clear();
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof TooLongFrameException) {
            LOGGER.warn("Closing connection {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else if (cause instanceof DecoderException) {
            LOGGER.warn("Closing connection {}: unreadable frame", ctx.channel().remoteAddress(), cause);
        } else {
            LOGGER.error("Closing connection {}", ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }

    private static final class ProbeFailedException extends RuntimeException {
        private ProbeFailedException(String message) {
            super(message);
        }
    }
}
