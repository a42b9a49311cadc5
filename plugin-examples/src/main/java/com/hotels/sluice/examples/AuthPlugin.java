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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.hotels.sluice.api.CapabilityDescriptor;
import com.hotels.sluice.api.Decision;
import com.hotels.sluice.api.ExchangeEnvelope;
import com.hotels.sluice.api.plugins.spi.AbstractPlugin;
import com.hotels.sluice.api.plugins.spi.CallContext;
import org.slf4j.Logger;

import java.security.MessageDigest;

import static com.hotels.sluice.api.FailurePolicy.FAIL_CLOSED;
import static com.hotels.sluice.api.Stage.REQUEST;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Rejects requests that do not carry the expected bearer token.
 * <p>
 * This is an example of answering a request directly: a rejected request never reaches
 * the origin. Because an unchecked request must not get through either, the REQUEST stage
 * is declared fail-closed.
 */
public class AuthPlugin extends AbstractPlugin {
    static final String MISSING_CREDENTIALS = "Missing or invalid Authorization header";
    static final String INVALID_TOKEN = "Invalid token";

    private static final Logger LOGGER = getLogger(AuthPlugin.class);
    private static final String BEARER_PREFIX = "Bearer ";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final byte[] expectedToken;

    public AuthPlugin(String expectedToken) {
        this.expectedToken = requireNonNull(expectedToken).getBytes(UTF_8);
        handle(REQUEST, this::authenticate);
    }

    @Override
    public CapabilityDescriptor descriptor() {
        return CapabilityDescriptor.newBuilder()
                .name("auth-plugin")
                .version("1.0.0")
                .description("Validates Bearer token authentication")
                .stage(REQUEST, FAIL_CLOSED)
                .build();
    }

    private Decision authenticate(ExchangeEnvelope request, CallContext context) throws JsonProcessingException {
        LOGGER.info("Authenticating request: {} {}", request.method().orElse(""), request.url().orElse(""));

        String authorization = request.header("Authorization").orElse("");
        if (!authorization.startsWith(BEARER_PREFIX)) {
            LOGGER.warn(MISSING_CREDENTIALS);
            return unauthorized(MISSING_CREDENTIALS);
        }

        byte[] token = authorization.substring(BEARER_PREFIX.length()).getBytes(UTF_8);
        if (!MessageDigest.isEqual(token, expectedToken)) {
            LOGGER.warn(INVALID_TOKEN);
            return unauthorized(INVALID_TOKEN);
        }

        LOGGER.info("Authentication successful");
        return Decision.proceed();
    }

    private static Decision unauthorized(String message) throws JsonProcessingException {
        return Decision.shortCircuit(401)
                .header("Content-Type", "application/json")
                .header("WWW-Authenticate", "Bearer")
                .body(MAPPER.writeValueAsBytes(ImmutableMap.of("error", message)))
                .build();
    }
}
