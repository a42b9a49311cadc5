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

import com.google.protobuf.CodedInputStream;
import com.hotels.sluice.api.CapabilityDescriptor;
import com.hotels.sluice.api.Stage;
import com.hotels.sluice.api.exceptions.ConfigurationException;
import com.hotels.sluice.api.exceptions.ProtocolException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.hotels.sluice.api.FailurePolicy.FAIL_CLOSED;
import static com.hotels.sluice.api.FailurePolicy.FAIL_OPEN;
import static com.hotels.sluice.wire.ProtoSupport.LENGTH_DELIMITED;

/**
 * Wire form of a {@link CapabilityDescriptor}.
 * <pre>
 * Descriptor { 1 name; 2 version; 3 description; 4 repeated stage enum; 5 repeated fail_open_stage enum }
 * </pre>
 * Stage codes unknown to this build are ignored. Repeated stages are accepted both packed
 * and unpacked.
 */
public final class DescriptorCodec {
    private static final int NAME = 1 << 3 | LENGTH_DELIMITED;
    private static final int VERSION = 2 << 3 | LENGTH_DELIMITED;
    private static final int DESCRIPTION = 3 << 3 | LENGTH_DELIMITED;

    private DescriptorCodec() {
    }

    public static byte[] encode(CapabilityDescriptor descriptor) {
        return ProtoSupport.write(out -> {
            out.writeString(1, descriptor.name());
            out.writeString(2, descriptor.version());
            if (descriptor.description().isPresent()) {
                out.writeString(3, descriptor.description().get());
            }
            for (Stage stage : descriptor.supportedStages()) {
                out.writeEnum(4, stage.code());
            }
            for (Map.Entry<Stage, ?> entry : descriptor.failurePolicies().entrySet()) {
                if (entry.getValue() == FAIL_OPEN) {
                    out.writeEnum(5, entry.getKey().code());
                }
            }
        });
    }

    /**
     * Decodes a descriptor.
     *
     * @param bytes encoded descriptor
     * @return descriptor
     * @throws ProtocolException if the bytes are malformed or describe an invalid plugin
     */
    public static CapabilityDescriptor decode(byte[] bytes) {
        CapabilityDescriptor.Builder builder = CapabilityDescriptor.newBuilder();
        List<Integer> stages = new ArrayList<>();
        List<Integer> failOpenStages = new ArrayList<>();

        ProtoSupport.read(bytes, "descriptor", (tag, in) -> {
            switch (tag) {
                case NAME:
                    builder.name(in.readString());
                    return true;
                case VERSION:
                    builder.version(in.readString());
                    return true;
                case DESCRIPTION:
                    builder.description(in.readString());
                    return true;
                default:
                    int field = ProtoSupport.fieldNumber(tag);
                    if (field == 4) {
                        return readStageCodes(tag, in, stages);
                    }
                    if (field == 5) {
                        return readStageCodes(tag, in, failOpenStages);
                    }
                    return false;
            }
        });

        for (Integer code : stages) {
            Stage.fromCode(code).ifPresent(stage ->
                    builder.stage(stage, failOpenStages.contains(code) ? FAIL_OPEN : FAIL_CLOSED));
        }

        try {
            return builder.build();
        } catch (ConfigurationException e) {
            throw new ProtocolException("Invalid descriptor: " + e.getMessage(), e);
        }
    }

    private static boolean readStageCodes(int tag, CodedInputStream in, List<Integer> codes) throws IOException {
        int wireType = ProtoSupport.wireType(tag);
        if (wireType == ProtoSupport.VARINT) {
            codes.add(in.readEnum());
            return true;
        }
        if (wireType == LENGTH_DELIMITED) {
            int limit = in.pushLimit(in.readRawVarint32());
            while (in.getBytesUntilLimit() > 0) {
                codes.add(in.readEnum());
            }
            in.popLimit(limit);
            return true;
        }
        return false;
    }
}
