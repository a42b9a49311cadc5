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
package com.hotels.sluice.examples;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.hotels.sluice.api.CapabilityDescriptor;
import com.hotels.sluice.api.Decision;
import com.hotels.sluice.api.ExchangeEnvelope;
import com.hotels.sluice.api.plugins.spi.AbstractPlugin;
import com.hotels.sluice.api.plugins.spi.CallContext;
import com.hotels.sluice.server.PluginRuntime;
import org.slf4j.Logger;

import java.io.IOException;
import java.util.Set;

import static com.hotels.sluice.api.Stage.REQUEST;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Adds a {@code _metadata} object to JSON request bodies.
 * <p>
 * Only POST, PUT and PATCH requests with a JSON content type are touched. A body that is
 * not valid JSON is rejected with 400. Any other problem lets the request through as it is.
 */
public class TransformPlugin extends AbstractPlugin {
    static final String NAME = "transform-plugin";
    static final String VERSION = "1.0.0";
    static final String METADATA_FIELD = "_metadata";

    private static final Logger LOGGER = getLogger(TransformPlugin.class);
    private static final Set<String> MUTATING_METHODS = ImmutableSet.of("POST", "PUT", "PATCH");

    private final ObjectMapper mapper = new ObjectMapper();

    public TransformPlugin() {
        handle(REQUEST, this::transform);
    }

    @Override
    public CapabilityDescriptor descriptor() {
        return CapabilityDescriptor.newBuilder()
                .name(NAME)
                .version(VERSION)
                .description("Transforms JSON request bodies by adding metadata fields")
                .stage(REQUEST)
                .build();
    }

    private Decision transform(ExchangeEnvelope request, CallContext context) throws JsonProcessingException {
        LOGGER.info("Processing request: {} {}", request.method().orElse(""), request.url().orElse(""));

        String contentType = request.header("Content-Type").orElse("");
        if (!MUTATING_METHODS.contains(request.method().orElse("")) || !contentType.contains("application/json")) {
            LOGGER.info("Skipping non-JSON or non-mutating request");
            return Decision.proceed();
        }
        if (request.bodyLength() == 0) {
            LOGGER.info("Empty body, skipping transformation");
            return Decision.proceed();
        }

        JsonNode payload;
        try {
            payload = mapper.readTree(request.body());
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to parse JSON body: {}", e.getOriginalMessage());
            return Decision.shortCircuit(400)
                    .header("Content-Type", "application/json")
                    .body(mapper.writeValueAsBytes(ImmutableMap.of("error", "Invalid JSON")))
                    .build();
        } catch (IOException e) {
            LOGGER.error("Unexpected error during transformation", e);
            return Decision.proceed();
        }

        if (!(payload instanceof ObjectNode)) {
            LOGGER.warn("JSON body is not an object, skipping transformation");
            return Decision.proceed();
        }

        ObjectNode body = (ObjectNode) payload;
        body.putObject(METADATA_FIELD)
                .put("processed_by", NAME)
                .put("version", VERSION)
                .put("client_ip", request.remoteAddress().orElse(""));

        byte[] transformed = mapper.writeValueAsBytes(body);
        LOGGER.info("Request body transformed successfully");

        return Decision.proceed(request.newBuilder()
                .body(transformed)
                .header("Content-Length", String.valueOf(transformed.length))
                .build());
    }

    public static void main(String[] args) {
        PluginRuntime.serve(environment -> new TransformPlugin(), args);
    }
}
