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

import com.hotels.sluice.api.Decision;
import com.hotels.sluice.api.ExchangeEnvelope;
import com.hotels.sluice.api.plugins.spi.CallContext;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static com.hotels.sluice.api.FailurePolicy.FAIL_OPEN;
import static com.hotels.sluice.api.HttpHeader.header;
import static com.hotels.sluice.api.Stage.REQUEST;
import static com.hotels.sluice.api.Stage.RESPONSE;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.mock;

public class LoggingPluginTest {
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final LoggingPlugin plugin = new LoggingPlugin(registry);

    @Test
    public void failsOpenOnBothStages() {
        assertThat(plugin.descriptor().failurePolicy(REQUEST), is(FAIL_OPEN));
        assertThat(plugin.descriptor().failurePolicy(RESPONSE), is(FAIL_OPEN));
    }

    @Test
    public void proceedsAndCountsEveryExchange() throws Exception {
        CallContext context = mock(CallContext.class);

        Decision onRequest = plugin.handlers().get(REQUEST).handle(ExchangeEnvelope.request("GET", "/")
                .header("Authorization", "Bearer secret")
                .build(), context);
        Decision onResponse = plugin.handlers().get(RESPONSE).handle(ExchangeEnvelope.response(200).build(), context);

        assertThat(onRequest, is(Decision.proceed()));
        assertThat(onResponse, is(Decision.proceed()));
        assertThat(plugin.exchangesLogged(), is(2L));
        assertThat(registry.counter("logging.plugin.exchanges", "stage", "request").count(), is(1.0));
        assertThat(registry.counter("logging.plugin.exchanges", "stage", "response").count(), is(1.0));
    }

    @Test
    public void redactsCredentials() {
        assertThat(LoggingPlugin.displayValue(header("Authorization", "Bearer secret")), is(LoggingPlugin.REDACTED));
        assertThat(LoggingPlugin.displayValue(header("cookie", "session=1")), is(LoggingPlugin.REDACTED));
    }

    @Test
    public void showsOtherHeaders() {
        assertThat(LoggingPlugin.displayValue(header("Accept", "text/html", "application/json")),
                is("text/html, application/json"));
    }
}
