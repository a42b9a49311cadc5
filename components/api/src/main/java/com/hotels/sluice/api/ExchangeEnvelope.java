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

import com.google.common.collect.ImmutableMap;
import com.hotels.sluice.api.exceptions.ProtocolException;

import java.nio.charset.Charset;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.hotels.sluice.api.Decision.isValidStatus;
import static com.hotels.sluice.api.Stage.REQUEST;
import static com.hotels.sluice.api.Stage.RESPONSE;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One intercepted HTTP message, as seen by a plugin at a particular {@link Stage}.
 * <p>
 * Request-stage envelopes carry the method, URL, path, request URI and remote address.
 * Response-stage envelopes carry the status code. Fields that do not apply to the stage
 * are dropped when the envelope is built; required fields that are missing make
 * {@link Builder#build()} throw a {@link ProtocolException}.
 * <p>
 * Envelopes are immutable. Use {@link #newBuilder()} to derive a mutated copy.
 */
public final class ExchangeEnvelope {
    private static final byte[] NO_BODY = new byte[0];

    private final Stage stage;
    private final String method;
    private final String url;
    private final String path;
    private final String requestUri;
    private final String remoteAddress;
    private final Integer statusCode;
    private final HttpHeaders headers;
    private final byte[] body;
    private final ImmutableMap<String, String> metadata;

    private ExchangeEnvelope(Builder builder) {
        this.stage = builder.stage;
        boolean request = stage == REQUEST;
        this.method = request ? builder.method : null;
        this.url = request ? builder.url : null;
        this.path = request ? builder.path : null;
        this.requestUri = request ? builder.requestUri : null;
        this.remoteAddress = request ? builder.remoteAddress : null;
        this.statusCode = stage == RESPONSE ? builder.statusCode : null;
        this.headers = builder.headers.build();
        this.body = builder.body.clone();
        this.metadata = ImmutableMap.copyOf(builder.metadata);
    }

    /**
     * Creates a builder for a request-stage envelope.
     *
     * @param method HTTP method
     * @param url    request URL
     * @return a new builder
     */
    public static Builder request(String method, String url) {
        return new Builder().stage(REQUEST).method(method).url(url);
    }

    /**
     * Creates a builder for a response-stage envelope.
     *
     * @param statusCode HTTP status code
     * @return a new builder
     */
    public static Builder response(int statusCode) {
        return new Builder().stage(RESPONSE).statusCode(statusCode);
    }

    public static Builder newEnvelopeBuilder() {
        return new Builder();
    }

    public Stage stage() {
        return stage;
    }

    public Optional<String> method() {
        return Optional.ofNullable(method);
    }

    public Optional<String> url() {
        return Optional.ofNullable(url);
    }

    public Optional<String> path() {
        return Optional.ofNullable(path);
    }

    public Optional<String> requestUri() {
        return Optional.ofNullable(requestUri);
    }

    public Optional<String> remoteAddress() {
        return Optional.ofNullable(remoteAddress);
    }

    public Optional<Integer> statusCode() {
        return Optional.ofNullable(statusCode);
    }

    public HttpHeaders headers() {
        return headers;
    }

    public Optional<String> header(CharSequence name) {
        return headers.get(name);
    }

    /**
     * Returns a copy of the message body.
     *
     * @return body bytes, empty when the message has no body
     */
    public byte[] body() {
        return body.clone();
    }

    public int bodyLength() {
        return body.length;
    }

    public String bodyAs(Charset charset) {
        return new String(body, charset);
    }

    public ImmutableMap<String, String> metadata() {
        return metadata;
    }

    public Builder newBuilder() {
        return new Builder(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ExchangeEnvelope that = (ExchangeEnvelope) o;
        return stage == that.stage
                && Objects.equals(method, that.method)
                && Objects.equals(url, that.url)
                && Objects.equals(path, that.path)
                && Objects.equals(requestUri, that.requestUri)
                && Objects.equals(remoteAddress, that.remoteAddress)
                && Objects.equals(statusCode, that.statusCode)
                && Objects.equals(headers, that.headers)
                && Arrays.equals(body, that.body)
                && Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(stage, method, url, path, requestUri, remoteAddress, statusCode, headers, metadata)
                + Arrays.hashCode(body);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(128)
                .append("ExchangeEnvelope{stage=").append(stage);
        if (stage == REQUEST) {
            sb.append(", method=").append(method)
                    .append(", url=").append(url);
        } else {
            sb.append(", statusCode=").append(statusCode);
        }
        return sb.append(", headers=").append(headers)
                .append(", bodyLength=").append(body.length)
                .append('}')
                .toString();
    }

    /**
     * Builds {@link ExchangeEnvelope}s.
     */
    public static final class Builder {
        private Stage stage;
        private String method;
        private String url;
        private String path;
        private String requestUri;
        private String remoteAddress;
        private Integer statusCode;
        private HttpHeaders.Builder headers;
        private byte[] body = NO_BODY;
        private final Map<String, String> metadata = new LinkedHashMap<>();

        private Builder() {
            this.headers = HttpHeaders.newHeadersBuilder();
        }

        private Builder(ExchangeEnvelope envelope) {
            this.stage = envelope.stage;
            this.method = envelope.method;
            this.url = envelope.url;
            this.path = envelope.path;
            this.requestUri = envelope.requestUri;
            this.remoteAddress = envelope.remoteAddress;
            this.statusCode = envelope.statusCode;
            this.headers = envelope.headers.newBuilder();
            this.body = envelope.body;
            this.metadata.putAll(envelope.metadata);
        }

        public Builder stage(Stage stage) {
            this.stage = requireNonNull(stage);
            return this;
        }

        public Builder method(String method) {
            this.method = requireNonNull(method);
            return this;
        }

        public Builder url(String url) {
            this.url = requireNonNull(url);
            return this;
        }

        public Builder path(String path) {
            this.path = requireNonNull(path);
            return this;
        }

        public Builder requestUri(String requestUri) {
            this.requestUri = requireNonNull(requestUri);
            return this;
        }

        public Builder remoteAddress(String remoteAddress) {
            this.remoteAddress = requireNonNull(remoteAddress);
            return this;
        }

        public Builder statusCode(int statusCode) {
            this.statusCode = statusCode;
            return this;
        }

        public Builder headers(HttpHeaders headers) {
            this.headers = headers.newBuilder();
            return this;
        }

        /**
         * Adds a header value, keeping existing values of the same name.
         *
         * @param name  header name
         * @param value header value
         * @return this builder
         */
        public Builder addHeader(CharSequence name, String value) {
            this.headers.add(name, value);
            return this;
        }

        /**
         * Sets a header, replacing existing values of the same name.
         *
         * @param name  header name
         * @param value header value
         * @return this builder
         */
        public Builder header(CharSequence name, String value) {
            this.headers.set(name, value);
            return this;
        }

        public Builder removeHeader(CharSequence name) {
            this.headers.remove(name);
            return this;
        }

        public Builder body(byte[] body) {
            this.body = requireNonNull(body).clone();
            return this;
        }

        public Builder body(String body, Charset charset) {
            this.body = body.getBytes(charset);
            return this;
        }

        public Builder metadata(String key, String value) {
            this.metadata.put(requireNonNull(key), requireNonNull(value));
            return this;
        }

        public Builder metadata(Map<String, String> metadata) {
            metadata.forEach(this::metadata);
            return this;
        }

        /**
         * Validates the fields required by the stage and builds the envelope.
         *
         * @return a new envelope
         * @throws ProtocolException if a field required by the stage is missing or invalid
         */
        public ExchangeEnvelope build() {
            if (stage == null) {
                throw new ProtocolException("Envelope has no stage");
            }
            if (stage == REQUEST) {
                if (method == null || method.isEmpty()) {
                    throw new ProtocolException("Request envelope has no method");
                }
                if (url == null) {
                    throw new ProtocolException("Request envelope has no url");
                }
            }
            if (stage == RESPONSE) {
                if (statusCode == null) {
                    throw new ProtocolException("Response envelope has no status code");
                }
                if (!isValidStatus(statusCode)) {
                    throw new ProtocolException(format("Response envelope has invalid status code %d", statusCode));
                }
            }
            return new ExchangeEnvelope(this);
        }
    }
}
