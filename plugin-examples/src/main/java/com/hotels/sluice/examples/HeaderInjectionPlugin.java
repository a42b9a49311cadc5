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

import com.hotels.sluice.api.CapabilityDescriptor;
import com.hotels.sluice.api.Decision;
import com.hotels.sluice.api.ExchangeEnvelope;
import com.hotels.sluice.api.plugins.spi.AbstractPlugin;
import com.hotels.sluice.api.plugins.spi.CallContext;
import com.hotels.sluice.server.PluginRuntime;
import org.slf4j.Logger;

import static com.hotels.sluice.api.Stage.REQUEST;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * The smallest useful plugin: it adds a header to every request and lets it through.
 * <p>
 * A mutation is expressed by returning a copy of the envelope. Everything not touched
 * by the builder is carried over unchanged.
 */
public class HeaderInjectionPlugin extends AbstractPlugin {
    static final String HEADER_NAME = "X-Simple-Plugin";
    static final String HEADER_VALUE = "processed";

    private static final Logger LOGGER = getLogger(HeaderInjectionPlugin.class);

    public HeaderInjectionPlugin() {
        handle(REQUEST, this::onRequest);
    }

    @Override
    public CapabilityDescriptor descriptor() {
        return CapabilityDescriptor.newBuilder()
                .name("simple-plugin")
                .version("1.0.0")
                .description("Adds a custom header to HTTP requests")
                .stage(REQUEST)
                .build();
    }

    private Decision onRequest(ExchangeEnvelope request, CallContext context) {
        LOGGER.info("Processing request: {} {}", request.method().orElse(""), request.url().orElse(""));

        return Decision.proceed(request.newBuilder()
                .header(HEADER_NAME, HEADER_VALUE)
                .build());
    }

    public static void main(String[] args) {
        PluginRuntime.serve(environment -> new HeaderInjectionPlugin(), args);
    }
}
