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
import com.google.protobuf.CodedOutputStream;
import com.google.protobuf.WireFormat;
import com.hotels.sluice.api.HttpHeader;
import com.hotels.sluice.api.HttpHeaders;
import com.hotels.sluice.api.exceptions.ProtocolException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Shared protobuf plumbing for the message codecs.
 * <p>
 * Messages are hand-mapped onto the protobuf wire format with stable field numbers.
 * Readers skip any field they do not recognise, including known field numbers that arrive
 * with an unexpected wire type.
 */
final class ProtoSupport {
    static final int VARINT = WireFormat.WIRETYPE_VARINT;
    static final int LENGTH_DELIMITED = WireFormat.WIRETYPE_LENGTH_DELIMITED;

    private static final int HEADER_NAME = 1 << 3 | LENGTH_DELIMITED;
    private static final int HEADER_VALUE = 2 << 3 | LENGTH_DELIMITED;
    private static final int ENTRY_KEY = 1 << 3 | LENGTH_DELIMITED;
    private static final int ENTRY_VALUE = 2 << 3 | LENGTH_DELIMITED;

    private ProtoSupport() {
    }

    @FunctionalInterface
    interface Writer {
        void writeTo(CodedOutputStream out) throws IOException;
    }

    /**
     * Reads one field. Returns false to have the field skipped.
     */
    @FunctionalInterface
    interface FieldReader {
        boolean read(int tag, CodedInputStream in) throws IOException;
    }

    static byte[] write(Writer writer) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        CodedOutputStream out = CodedOutputStream.newInstance(bytes);
        try {
            writer.writeTo(out);
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    static void read(byte[] bytes, String messageName, FieldReader reader) {
        try {
            CodedInputStream in = CodedInputStream.newInstance(bytes);
            int tag = in.readTag();
            while (tag != 0) {
                if (!reader.read(tag, in)) {
                    in.skipField(tag);
                }
                tag = in.readTag();
            }
        } catch (IOException e) {
            throw new ProtocolException("Malformed " + messageName + ": " + e.getMessage(), e);
        }
    }

    static int fieldNumber(int tag) {
        return WireFormat.getTagFieldNumber(tag);
    }

    static int wireType(int tag) {
        return WireFormat.getTagWireType(tag);
    }

    static void writeHeaders(CodedOutputStream out, int fieldNumber, HttpHeaders headers) throws IOException {
        for (HttpHeader header : headers) {
            out.writeByteArray(fieldNumber, write(nested -> {
                nested.writeString(1, header.name());
                for (String value : header.values()) {
                    nested.writeString(2, value);
                }
            }));
        }
    }

    static void readHeader(byte[] bytes, HttpHeaders.Builder headers) {
        String[] name = new String[1];
        List<String> values = new ArrayList<>();
        read(bytes, "header", (tag, in) -> {
            switch (tag) {
                case HEADER_NAME:
                    name[0] = in.readString();
                    return true;
                case HEADER_VALUE:
                    values.add(in.readString());
                    return true;
                default:
                    return false;
            }
        });
        if (name[0] == null || name[0].isEmpty()) {
            throw new ProtocolException("Header has no name");
        }
        headers.add(name[0], values);
    }

    static void writeEntries(CodedOutputStream out, int fieldNumber, Map<String, String> entries) throws IOException {
        for (Map.Entry<String, String> entry : entries.entrySet()) {
            out.writeByteArray(fieldNumber, write(nested -> {
                nested.writeString(1, entry.getKey());
                nested.writeString(2, entry.getValue());
            }));
        }
    }

    static void readEntry(byte[] bytes, BiConsumer<String, String> consumer) {
        String[] keyValue = {null, ""};
        read(bytes, "entry", (tag, in) -> {
            switch (tag) {
                case ENTRY_KEY:
                    keyValue[0] = in.readString();
                    return true;
                case ENTRY_VALUE:
                    keyValue[1] = in.readString();
                    return true;
                default:
                    return false;
            }
        });
        if (keyValue[0] == null) {
            throw new ProtocolException("Map entry has no key");
        }
        consumer.accept(keyValue[0], keyValue[1]);
    }
}
