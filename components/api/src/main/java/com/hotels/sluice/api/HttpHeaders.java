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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import io.netty.handler.codec.http.DefaultHttpHeaders;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static com.google.common.collect.Maps.immutableEntry;
import static com.hotels.sluice.api.HttpHeader.header;
import static java.util.Objects.requireNonNull;
import static java.util.stream.Collectors.joining;

/**
 * An ordered, multi-valued collection of {@link HttpHeader}s from a single HTTP message.
 * <p>
 * Header names are matched case-insensitively. Iteration yields one {@link HttpHeader} per
 * distinct name, in the order each name was first added, with its values in insertion order.
 * Instances are immutable; use {@link #newBuilder()} to derive a modified copy.
 */
public final class HttpHeaders implements Iterable<HttpHeader> {
    private static final HttpHeaders EMPTY = new Builder().build();

    private final DefaultHttpHeaders nettyHeaders;
    private final ImmutableList<HttpHeader> headers;

    private HttpHeaders(Builder builder) {
        this.nettyHeaders = new DefaultHttpHeaders(false);
        this.nettyHeaders.set(builder.nettyHeaders);
        this.headers = group(nettyHeaders);
    }

    // Netty reports names case-sensitively, so entries are grouped here under the first spelling seen.
    private static ImmutableList<HttpHeader> group(DefaultHttpHeaders nettyHeaders) {
        Map<String, String> spellings = new LinkedHashMap<>();
        Map<String, List<String>> values = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : nettyHeaders) {
            String key = fold(entry.getKey());
            spellings.putIfAbsent(key, entry.getKey());
            values.computeIfAbsent(key, ignored -> new ArrayList<>()).add(entry.getValue());
        }
        ImmutableList.Builder<HttpHeader> grouped = ImmutableList.builder();
        spellings.forEach((key, name) -> grouped.add(header(name, values.get(key))));
        return grouped.build();
    }

    private static String fold(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    public static HttpHeaders emptyHeaders() {
        return EMPTY;
    }

    /**
     * Returns the names of all headers, in first-insertion order.
     *
     * @return header names
     */
    public ImmutableSet<String> names() {
        return headers.stream().map(HttpHeader::name).collect(ImmutableSet.toImmutableSet());
    }

    /**
     * Returns the first value of a header, if present.
     *
     * @param name header name
     * @return first header value
     */
    public Optional<String> get(CharSequence name) {
        return Optional.ofNullable(nettyHeaders.get(name));
    }

    public ImmutableList<String> getAll(CharSequence name) {
        return ImmutableList.copyOf(nettyHeaders.getAll(name));
    }

    public boolean contains(CharSequence name) {
        return nettyHeaders.contains(name);
    }

    public boolean isEmpty() {
        return nettyHeaders.isEmpty();
    }

    public int size() {
        return headers.size();
    }

    @Override
    public Iterator<HttpHeader> iterator() {
        return headers.iterator();
    }

    public Builder newBuilder() {
        return new Builder(this);
    }

    public static Builder newHeadersBuilder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return headers.stream()
                .map(HttpHeader::toString)
                .collect(joining(", ", "[", "]"));
    }

    private List<Map.Entry<String, List<String>>> foldedNames() {
        List<Map.Entry<String, List<String>>> folded = new ArrayList<>(headers.size());
        for (HttpHeader header : headers) {
            folded.add(immutableEntry(fold(header.name()), header.values()));
        }
        return folded;
    }

    @Override
    public int hashCode() {
        return foldedNames().hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        HttpHeaders other = (HttpHeaders) obj;
        return foldedNames().equals(other.foldedNames());
    }

    /**
     * Builds headers.
     */
    public static final class Builder {
        private final DefaultHttpHeaders nettyHeaders;

        private Builder() {
            this.nettyHeaders = new DefaultHttpHeaders(false);
        }

        private Builder(HttpHeaders headers) {
            this.nettyHeaders = new DefaultHttpHeaders(false);
            this.nettyHeaders.set(headers.nettyHeaders);
        }

        public List<String> getAll(CharSequence name) {
            return nettyHeaders.getAll(name);
        }

        public String get(CharSequence name) {
            return nettyHeaders.get(name);
        }

        /**
         * Adds a new header value, keeping any existing values of the same name.
         *
         * @param name  header name
         * @param value header value
         * @return this builder
         */
        public Builder add(CharSequence name, String value) {
            nettyHeaders.add(name, requireNonNull(value));
            return this;
        }

        public Builder add(CharSequence name, Iterable<String> values) {
            for (String value : values) {
                add(name, value);
            }
            return this;
        }

        public Builder add(HttpHeader header) {
            return add(header.name(), header.values());
        }

        /**
         * Sets a header, replacing all existing values of the same name.
         *
         * @param name  header name
         * @param value header value
         * @return this builder
         */
        public Builder set(CharSequence name, String value) {
            nettyHeaders.set(name, requireNonNull(value));
            return this;
        }

        public Builder remove(CharSequence name) {
            nettyHeaders.remove(name);
            return this;
        }

        public HttpHeaders build() {
            return new HttpHeaders(this);
        }
    }
}
