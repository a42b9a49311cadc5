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

import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;

import static com.hotels.sluice.common.Preconditions.checkArgument;

/**
 * Installs the framing shared by both ends of a connection: a four byte length prefix
 * followed by a protobuf-encoded {@link Frame}.
 */
public final class WirePipeline {
    public static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;

    private static final int LENGTH_FIELD_BYTES = 4;

    private WirePipeline() {
    }

    /**
     * Adds the framing handlers at the end of the pipeline. Application handlers should
     * be added afterwards.
     *
     * @param pipeline      channel pipeline
     * @param maxFrameBytes largest acceptable frame body
     */
    public static void configure(ChannelPipeline pipeline, int maxFrameBytes) {
        checkArgument(maxFrameBytes > 0, "maxFrameBytes must be positive, but was %d", maxFrameBytes);

        pipeline.addLast("frame-decoder", new LengthFieldBasedFrameDecoder(maxFrameBytes + LENGTH_FIELD_BYTES, 0, LENGTH_FIELD_BYTES, 0, LENGTH_FIELD_BYTES));
        pipeline.addLast("frame-prepender", new LengthFieldPrepender(LENGTH_FIELD_BYTES));
        pipeline.addLast("frame-codec", FrameCodec.INSTANCE);
    }
}
