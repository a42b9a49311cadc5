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
package com.hotels.sluice.wire;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageCodec;

import java.util.List;

import static com.hotels.sluice.wire.ProtoSupport.LENGTH_DELIMITED;
import static com.hotels.sluice.wire.ProtoSupport.VARINT;

/**
 * Converts between length-delimited frame bodies and {@link Frame}s.
 * <pre>
 * Frame { 1 call_id uint64; 2 type enum; 3 method enum; 4 payload bytes;
 *         5 timeout_millis uint32; 6 failure_code enum; 7 failure_message string }
 * </pre>
 */
@ChannelHandler.Sharable
public final class FrameCodec extends MessageToMessageCodec<ByteBuf, Frame> {
    public static final FrameCodec INSTANCE = new FrameCodec();

    private static final int CALL_ID = 1 << 3 | VARINT;
    private static final int TYPE = 2 << 3 | VARINT;
    private static final int METHOD = 3 << 3 | VARINT;
    private static final int PAYLOAD = 4 << 3 | LENGTH_DELIMITED;
    private static final int TIMEOUT_MILLIS = 5 << 3 | VARINT;
    private static final int FAILURE_CODE = 6 << 3 | VARINT;
    private static final int FAILURE_MESSAGE = 7 << 3 | LENGTH_DELIMITED;

    private FrameCodec() {
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Frame frame, List<Object> out) {
        out.add(Unpooled.wrappedBuffer(encode(frame)));
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf buf, List<Object> out) {
        out.add(decode(ByteBufUtil.getBytes(buf)));
    }

    public static byte[] encode(Frame frame) {
        return ProtoSupport.write(out -> {
            out.writeUInt64(1, frame.callId());
            out.writeEnum(2, frame.typeCode());
            if (frame.methodCode() != 0) {
                out.writeEnum(3, frame.methodCode());
            }
            if (frame.payload().length > 0) {
                out.writeByteArray(4, frame.payload());
            }
            if (frame.timeoutMillis() > 0) {
                out.writeUInt32(5, frame.timeoutMillis());
            }
            if (frame.failureCode().isPresent()) {
                out.writeEnum(6, frame.failureCode().get().code());
                out.writeString(7, frame.failureMessage());
            }
        });
    }

    public static Frame decode(byte[] bytes) {
        long[] callId = {0};
        int[] codes = {0, 0, 0};
        byte[][] payload = {null};
        FailureCode[] failureCode = {null};
        String[] failureMessage = {null};

        ProtoSupport.read(bytes, "frame", (tag, in) -> {
            switch (tag) {
                case CALL_ID:
                    callId[0] = in.readUInt64();
                    return true;
                case TYPE:
                    codes[0] = in.readEnum();
                    return true;
                case METHOD:
                    codes[1] = in.readEnum();
                    return true;
                case PAYLOAD:
                    payload[0] = in.readByteArray();
                    return true;
                case TIMEOUT_MILLIS:
                    codes[2] = in.readUInt32();
                    return true;
                case FAILURE_CODE:
                    failureCode[0] = FailureCode.fromCode(in.readEnum());
                    return true;
                case FAILURE_MESSAGE:
                    failureMessage[0] = in.readString();
                    return true;
                default:
                    return false;
            }
        });

        return new Frame(callId[0], codes[0], codes[1], payload[0], Math.max(0, codes[2]), failureCode[0], failureMessage[0]);
    }
}
