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

import com.hotels.sluice.api.Decision;
import com.hotels.sluice.api.ExchangeEnvelope;
import com.hotels.sluice.api.HttpHeaders;
import com.hotels.sluice.api.exceptions.ProtocolException;

import static com.hotels.sluice.wire.ProtoSupport.LENGTH_DELIMITED;
import static com.hotels.sluice.wire.ProtoSupport.VARINT;

/**
 * Wire form of a {@link Decision}.
 * <pre>
 * Decision { 1 continue bool; 2 mutated Envelope; 3 status int32; 4 body bytes; 5 repeated Header }
 * </pre>
 */
public final class DecisionCodec {
    private static final int CONTINUE = 1 << 3 | VARINT;
    private static final int MUTATED = 2 << 3 | LENGTH_DELIMITED;
    private static final int STATUS = 3 << 3 | VARINT;
    private static final int BODY = 4 << 3 | LENGTH_DELIMITED;
    private static final int HEADER = 5 << 3 | LENGTH_DELIMITED;

    private DecisionCodec() {
    }

    public static byte[] encode(Decision decision) {
        return ProtoSupport.write(out -> {
            out.writeBool(1, decision.isContinue());
            if (decision.mutatedEnvelope().isPresent()) {
                out.writeByteArray(2, EnvelopeCodec.encode(decision.mutatedEnvelope().get()));
            }
            if (decision.shortCircuitStatus().isPresent()) {
                out.writeInt32(3, decision.shortCircuitStatus().get());
            }
            if (decision.shortCircuitBody().isPresent()) {
                out.writeByteArray(4, decision.shortCircuitBody().get());
            }
            if (decision.shortCircuitHeaders().isPresent()) {
                ProtoSupport.writeHeaders(out, 5, decision.shortCircuitHeaders().get());
            }
        });
    }

    /**
     * Decodes a decision.
     *
     * @param bytes encoded decision
     * @return decision
     * @throws ProtocolException if the bytes are malformed or a short-circuit has no valid status
     */
    public static Decision decode(byte[] bytes) {
        boolean[] proceed = {false};
        ExchangeEnvelope[] mutated = {null};
        Integer[] status = {null};
        byte[][] body = {null};
        HttpHeaders.Builder headers = HttpHeaders.newHeadersBuilder();

        ProtoSupport.read(bytes, "decision", (tag, in) -> {
            switch (tag) {
                case CONTINUE:
                    proceed[0] = in.readBool();
                    return true;
                case MUTATED:
                    mutated[0] = EnvelopeCodec.decode(in.readByteArray());
                    return true;
                case STATUS:
                    status[0] = in.readInt32();
                    return true;
                case BODY:
                    body[0] = in.readByteArray();
                    return true;
                case HEADER:
                    ProtoSupport.readHeader(in.readByteArray(), headers);
                    return true;
                default:
                    return false;
            }
        });

        if (proceed[0]) {
            return mutated[0] == null ? Decision.proceed() : Decision.proceed(mutated[0]);
        }
        if (status[0] == null) {
            throw new ProtocolException("Short-circuit decision has no status");
        }
        Decision.ShortCircuitBuilder shortCircuit = Decision.shortCircuit(status[0]).headers(headers.build());
        if (body[0] != null) {
            shortCircuit.body(body[0]);
        }
        return shortCircuit.build();
    }
}
