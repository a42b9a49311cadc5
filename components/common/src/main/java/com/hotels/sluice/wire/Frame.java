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

import java.time.Duration;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * A single protocol message. Every frame belongs to a call, identified by a host-assigned id.
 * <p>
 * Type and method are kept as raw wire codes so that a peer can answer frames it does not
 * understand instead of dropping them.
 */
public final class Frame {
    private static final byte[] EMPTY = new byte[0];

    private final long callId;
    private final int typeCode;
    private final int methodCode;
    private final byte[] payload;
    private final int timeoutMillis;
    private final FailureCode failureCode;
    private final String failureMessage;

    Frame(long callId, int typeCode, int methodCode, byte[] payload, int timeoutMillis,
          FailureCode failureCode, String failureMessage) {
        this.callId = callId;
        this.typeCode = typeCode;
        this.methodCode = methodCode;
        this.payload = payload == null ? EMPTY : payload;
        this.timeoutMillis = timeoutMillis;
        this.failureCode = failureCode;
        this.failureMessage = failureMessage;
    }

    /**
     * Creates a call frame.
     *
     * @param callId  call id
     * @param method  method to invoke
     * @param payload encoded request message
     * @param timeout how long the caller is prepared to wait, or null for the plugin's default
     * @return a call frame
     */
    public static Frame call(long callId, RpcMethod method, byte[] payload, Duration timeout) {
        int timeoutMillis = timeout == null ? 0 : (int) Math.min(Integer.MAX_VALUE, Math.max(1, timeout.toMillis()));
        return new Frame(callId, FrameType.CALL.code(), method.code(), payload, timeoutMillis, null, null);
    }

    public static Frame reply(long callId, byte[] payload) {
        return new Frame(callId, FrameType.REPLY.code(), 0, payload, 0, null, null);
    }

    public static Frame failure(long callId, FailureCode code, String message) {
        return new Frame(callId, FrameType.FAILURE.code(), 0, null, 0, requireNonNull(code), message);
    }

    public static Frame cancel(long callId) {
        return new Frame(callId, FrameType.CANCEL.code(), 0, null, 0, null, null);
    }

    public long callId() {
        return callId;
    }

    public Optional<FrameType> type() {
        return FrameType.fromCode(typeCode);
    }

    public int typeCode() {
        return typeCode;
    }

    public Optional<RpcMethod> method() {
        return RpcMethod.fromCode(methodCode);
    }

    public int methodCode() {
        return methodCode;
    }

    public byte[] payload() {
        return payload;
    }

    /**
     * The caller's deadline for this call.
     *
     * @return timeout, absent when the caller did not set one
     */
    public Optional<Duration> timeout() {
        return timeoutMillis > 0 ? Optional.of(Duration.ofMillis(timeoutMillis)) : Optional.empty();
    }

    int timeoutMillis() {
        return timeoutMillis;
    }

    public Optional<FailureCode> failureCode() {
        return Optional.ofNullable(failureCode);
    }

    public String failureMessage() {
        return failureMessage == null ? "" : failureMessage;
    }

    @Override
    public String toString() {
        return "Frame{"
                + "callId=" + callId
                + ", type=" + type().map(Enum::name).orElse(String.valueOf(typeCode))
                + (methodCode != 0 ? ", method=" + method().map(Enum::name).orElse(String.valueOf(methodCode)) : "")
                + ", payloadLength=" + payload.length
                + (failureCode != null ? ", failure=" + failureCode + ": " + failureMessage : "")
                + '}';
    }
}
