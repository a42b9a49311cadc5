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

import com.google.common.collect.ImmutableSet;
import com.hotels.sluice.api.CapabilityDescriptor;
import com.hotels.sluice.api.Decision;
import com.hotels.sluice.api.ExchangeEnvelope;
import com.hotels.sluice.api.HttpHeader;
import com.hotels.sluice.api.plugins.spi.AbstractPlugin;
import com.hotels.sluice.api.plugins.spi.CallContext;
import com.hotels.sluice.server.PluginRuntime;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

import static com.hotels.sluice.api.FailurePolicy.FAIL_OPEN;
import static com.hotels.sluice.api.Stage.REQUEST;
import static com.hotels.sluice.api.Stage.RESPONSE;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Logs requests and responses as they pass through, without changing them.
 * <p>
 * Both stages are fail-open: losing a log line must never block traffic. Credentials in
 * request headers are masked. Calls run concurrently, so the exchange counter is an
 * {@link AtomicLong}.
 */
public class LoggingPlugin extends AbstractPlugin {
    static final String REDACTED = "***REDACTED***";

    private static final Logger LOGGER = getLogger(LoggingPlugin.class);
    private static final Set<String> SENSITIVE_HEADERS = ImmutableSet.of("authorization", "cookie");
    private static final String RULE = "================================================================================";

    private final AtomicLong exchanges = new AtomicLong();
    private final Counter requests;
    private final Counter responses;

    public LoggingPlugin(MeterRegistry meterRegistry) {
        this.requests = meterRegistry.counter("logging.plugin.exchanges", "stage", "request");
        this.responses = meterRegistry.counter("logging.plugin.exchanges", "stage", "response");
        handle(REQUEST, this::logRequest);
        handle(RESPONSE, this::logResponse);
    }

    @Override
    public CapabilityDescriptor descriptor() {
        return CapabilityDescriptor.newBuilder()
                .name("logging-plugin")
                .version("1.0.0")
                .description("Logs HTTP request and response details for observability")
                .stage(REQUEST, FAIL_OPEN)
                .stage(RESPONSE, FAIL_OPEN)
                .build();
    }

    public long exchangesLogged() {
        return exchanges.get();
    }

    private Decision logRequest(ExchangeEnvelope request, CallContext context) {
        long sequence = exchanges.incrementAndGet();
        requests.increment();

        LOGGER.info(RULE);
        LOGGER.info("INCOMING REQUEST #{}", sequence);
        LOGGER.info("Method: {}", request.method().orElse(""));
        LOGGER.info("URL: {}", request.url().orElse(""));
        LOGGER.info("Path: {}", request.path().orElse(""));
        LOGGER.info("Remote Address: {}", request.remoteAddress().orElse(""));
        logHeaders(request);
        logBodySize(request);
        LOGGER.info(RULE);

        return Decision.proceed();
    }

    private Decision logResponse(ExchangeEnvelope response, CallContext context) {
        long sequence = exchanges.incrementAndGet();
        responses.increment();

        LOGGER.info(RULE);
        LOGGER.info("OUTGOING RESPONSE #{}", sequence);
        LOGGER.info("Status Code: {}", response.statusCode().orElse(0));
        logHeaders(response);
        logBodySize(response);
        LOGGER.info(RULE);

        return Decision.proceed();
    }

    private static void logHeaders(ExchangeEnvelope envelope) {
        LOGGER.info("Headers:");
        for (HttpHeader header : envelope.headers()) {
            LOGGER.info("  {}: {}", header.name(), displayValue(header));
        }
    }

    static String displayValue(HttpHeader header) {
        if (SENSITIVE_HEADERS.contains(header.name().toLowerCase(Locale.ROOT))) {
            return REDACTED;
        }
        return String.join(", ", header.values());
    }

    private static void logBodySize(ExchangeEnvelope envelope) {
        if (envelope.bodyLength() > 0) {
            LOGGER.info("Body size: {} bytes", envelope.bodyLength());
        }
    }

    public static void main(String[] args) {
        PluginRuntime.serve(environment -> new LoggingPlugin(environment.meterRegistry()), args);
    }
}
