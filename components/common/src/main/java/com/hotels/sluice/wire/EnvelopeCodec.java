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

import com.hotels.sluice.api.ExchangeEnvelope;
import com.hotels.sluice.api.HttpHeaders;
import com.hotels.sluice.api.Stage;
import com.hotels.sluice.api.exceptions.ProtocolException;

import static com.hotels.sluice.wire.ProtoSupport.LENGTH_DELIMITED;
import static com.hotels.sluice.wire.ProtoSupport.VARINT;

/**
 * Wire form of an {@link ExchangeEnvelope}.
 * <pre>
 * Envelope { 1 stage enum; 2 method; 3 url; 4 path; 5 request_uri; 6 remote_addr;
 *            7 status_code int32; 8 repeated Header; 9 body bytes; 10 repeated Entry metadata }
 * Header   { 1 name; 2 repeated value }
 * Entry    { 1 key; 2 value }
 * </pre>
 * Only fields present on the envelope are written.
 */
public final class EnvelopeCodec {
    private static final int STAGE = 1 << 3 | VARINT;
    private static final int METHOD = 2 << 3 | LENGTH_DELIMITED;
    private static final int URL = 3 << 3 | LENGTH_DELIMITED;
    private static final int PATH = 4 << 3 | LENGTH_DELIMITED;
    private static final int REQUEST_URI = 5 << 3 | LENGTH_DELIMITED;
    private static final int REMOTE_ADDR = 6 << 3 | LENGTH_DELIMITED;
    private static final int STATUS_CODE = 7 << 3 | VARINT;
    private static final int HEADER = 8 << 3 | LENGTH_DELIMITED;
    private static final int BODY = 9 << 3 | LENGTH_DELIMITED;
    private static final int METADATA = 10 << 3 | LENGTH_DELIMITED;

    private EnvelopeCodec() {
    }

    public static byte[] encode(ExchangeEnvelope envelope) {
        return ProtoSupport.write(out -> {
            out.writeEnum(1, envelope.stage().code());
            if (envelope.method().isPresent()) {
                out.writeString(2, envelope.method().get());
            }
            if (envelope.url().isPresent()) {
                out.writeString(3, envelope.url().get());
            }
            if (envelope.path().isPresent()) {
                out.writeString(4, envelope.path().get());
            }
            if (envelope.requestUri().isPresent()) {
                out.writeString(5, envelope.requestUri().get());
            }
            if (envelope.remoteAddress().isPresent()) {
                out.writeString(6, envelope.remoteAddress().get());
            }
            if (envelope.statusCode().isPresent()) {
                out.writeInt32(7, envelope.statusCode().get());
            }
            ProtoSupport.writeHeaders(out, 8, envelope.headers());
            if (envelope.bodyLength() > 0) {
                out.writeByteArray(9, envelope.body());
            }
            ProtoSupport.writeEntries(out, 10, envelope.metadata());
        });
    }

    /**
     * Decodes and validates an envelope.
     *
     * @param bytes encoded envelope
     * @return envelope
     * @throws ProtocolException if the bytes are malformed, the stage is unknown, or a field
     *                           required by the stage is missing
     */
    public static ExchangeEnvelope decode(byte[] bytes) {
        ExchangeEnvelope.Builder builder = ExchangeEnvelope.newEnvelopeBuilder();
        HttpHeaders.Builder headers = HttpHeaders.newHeadersBuilder();

        ProtoSupport.read(bytes, "envelope", (tag, in) -> {
            switch (tag) {
                case STAGE:
                    int code = in.readEnum();
                    builder.stage(Stage.fromCode(code)
                            .orElseThrow(() -> new ProtocolException("Unsupported stage code " + code)));
                    return true;
                case METHOD:
                    builder.method(in.readString());
                    return true;
                case URL:
                    builder.url(in.readString());
                    return true;
                case PATH:
                    builder.path(in.readString());
                    return true;
                case REQUEST_URI:
                    builder.requestUri(in.readString());
                    return true;
                case REMOTE_ADDR:
                    builder.remoteAddress(in.readString());
                    return true;
                case STATUS_CODE:
                    builder.statusCode(in.readInt32());
                    return true;
                case HEADER:
                    ProtoSupport.readHeader(in.readByteArray(), headers);
                    return true;
                case BODY:
                    builder.body(in.readByteArray());
                    return true;
                case METADATA:
                    ProtoSupport.readEntry(in.readByteArray(), builder::metadata);
                    return true;
                default:
                    return false;
            }
        });

        return builder.headers(headers.build()).build();
    }
}
