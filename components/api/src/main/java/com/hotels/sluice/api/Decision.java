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
package com.hotels.sluice.api;

import com.hotels.sluice.api.exceptions.ProtocolException;

import java.nio.charset.Charset;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A plugin's verdict on an {@link ExchangeEnvelope}.
 * <p>
 * A decision either lets the transaction continue, optionally replacing the message with a
 * mutated envelope, or short-circuits it with a synthesized response. A short-circuit always
 * carries a status code between 100 and 599; invalid decisions cannot be constructed.
 *
 * <pre>
 *     Decision.proceed();
 *     Decision.proceed(envelope.newBuilder().header("X-Plugin", "seen").build());
 *     Decision.shortCircuit(401).header("WWW-Authenticate", "Bearer").body("denied", UTF_8).build();
 * </pre>
 */
public final class Decision {
    private static final int MIN_STATUS = 100;
    private static final int MAX_STATUS = 599;
    private static final Decision PROCEED = new Decision(true, null, null, null, null);

    private final boolean proceed;
    private final ExchangeEnvelope mutatedEnvelope;
    private final Integer shortCircuitStatus;
    private final byte[] shortCircuitBody;
    private final HttpHeaders shortCircuitHeaders;

    private Decision(boolean proceed, ExchangeEnvelope mutatedEnvelope, Integer shortCircuitStatus,
                     byte[] shortCircuitBody, HttpHeaders shortCircuitHeaders) {
        this.proceed = proceed;
        this.mutatedEnvelope = mutatedEnvelope;
        this.shortCircuitStatus = shortCircuitStatus;
        this.shortCircuitBody = shortCircuitBody;
        this.shortCircuitHeaders = shortCircuitHeaders;
    }

    /**
     * Lets the message through unchanged.
     *
     * @return a pass-through decision
     */
    public static Decision proceed() {
        return PROCEED;
    }

    /**
     * Lets the transaction continue with a replacement message.
     *
     * @param mutatedEnvelope the message to forward instead of the original
     * @return a continue decision carrying the mutation
     */
    public static Decision proceed(ExchangeEnvelope mutatedEnvelope) {
        return new Decision(true, requireNonNull(mutatedEnvelope), null, null, null);
    }

    /**
     * Starts building a decision that ends the transaction with a synthesized response.
     *
     * @param status HTTP status of the synthesized response
     * @return a builder
     * @throws ProtocolException if the status is outside 100-599
     */
    public static ShortCircuitBuilder shortCircuit(int status) {
        return new ShortCircuitBuilder(status);
    }

    public static boolean isValidStatus(int status) {
        return status >= MIN_STATUS && status <= MAX_STATUS;
    }

    public boolean isContinue() {
        return proceed;
    }

    public Optional<ExchangeEnvelope> mutatedEnvelope() {
        return Optional.ofNullable(mutatedEnvelope);
    }

    public Optional<Integer> shortCircuitStatus() {
        return Optional.ofNullable(shortCircuitStatus);
    }

    public Optional<byte[]> shortCircuitBody() {
        return Optional.ofNullable(shortCircuitBody).map(byte[]::clone);
    }

    public Optional<HttpHeaders> shortCircuitHeaders() {
        return Optional.ofNullable(shortCircuitHeaders);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Decision that = (Decision) o;
        return proceed == that.proceed
                && Objects.equals(mutatedEnvelope, that.mutatedEnvelope)
                && Objects.equals(shortCircuitStatus, that.shortCircuitStatus)
                && Arrays.equals(shortCircuitBody, that.shortCircuitBody)
                && Objects.equals(shortCircuitHeaders, that.shortCircuitHeaders);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(proceed, mutatedEnvelope, shortCircuitStatus, shortCircuitHeaders)
                + Arrays.hashCode(shortCircuitBody);
    }

    @Override
    public String toString() {
        if (proceed) {
            return mutatedEnvelope == null
                    ? "Decision{continue}"
                    : "Decision{continue, mutated=" + mutatedEnvelope + "}";
        }
        return "Decision{shortCircuit=" + shortCircuitStatus
                + ", headers=" + shortCircuitHeaders
                + ", bodyLength=" + (shortCircuitBody == null ? 0 : shortCircuitBody.length)
                + "}";
    }

    /**
     * Builds short-circuit decisions.
     */
    public static final class ShortCircuitBuilder {
        private final int status;
        private final HttpHeaders.Builder headers = HttpHeaders.newHeadersBuilder();
        private byte[] body;

        private ShortCircuitBuilder(int status) {
            if (!isValidStatus(status)) {
                throw new ProtocolException(format("Short-circuit status %d is not a valid HTTP status", status));
            }
            this.status = status;
        }

        public ShortCircuitBuilder header(CharSequence name, String value) {
            headers.add(name, value);
            return this;
        }

        public ShortCircuitBuilder headers(HttpHeaders headers) {
            headers.forEach(this.headers::add);
            return this;
        }

        public ShortCircuitBuilder body(byte[] body) {
            this.body = requireNonNull(body).clone();
            return this;
        }

        public ShortCircuitBuilder body(String body, Charset charset) {
            this.body = body.getBytes(charset);
            return this;
        }

        public Decision build() {
            HttpHeaders builtHeaders = headers.build();
            return new Decision(false, null, status, body, builtHeaders.isEmpty() ? null : builtHeaders);
        }
    }
}
