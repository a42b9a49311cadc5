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
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.hotels.sluice.api.Stage.REQUEST;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.mock;

public class HeaderInjectionPluginTest {

    @Test
    public void addsHeaderAndKeepsTheRest() throws Exception {
        HeaderInjectionPlugin plugin = new HeaderInjectionPlugin();
        ExchangeEnvelope request = ExchangeEnvelope.request("GET", "/").header("Accept", "*/*").build();

        Decision decision = plugin.handlers().get(REQUEST).handle(request, mock(CallContext.class));

        ExchangeEnvelope mutated = decision.mutatedEnvelope().get();
        assertThat(mutated.header("X-Simple-Plugin"), is(Optional.of("processed")));
        assertThat(mutated.header("Accept"), is(Optional.of("*/*")));
        assertThat(mutated.url(), is(Optional.of("/")));
    }

    @Test
    public void replacesExistingValue() throws Exception {
        HeaderInjectionPlugin plugin = new HeaderInjectionPlugin();
        ExchangeEnvelope request = ExchangeEnvelope.request("GET", "/")
                .header(HeaderInjectionPlugin.HEADER_NAME, "forged")
                .build();

        Decision decision = plugin.handlers().get(REQUEST).handle(request, mock(CallContext.class));

        assertThat(decision.mutatedEnvelope().get().headers().getAll(HeaderInjectionPlugin.HEADER_NAME).size(), is(1));
        assertThat(decision.mutatedEnvelope().get().header(HeaderInjectionPlugin.HEADER_NAME), is(Optional.of("processed")));
    }

    @Test
    public void keepsOtherHeadersWhoseNamesDifferInCase() throws Exception {
        HeaderInjectionPlugin plugin = new HeaderInjectionPlugin();
        ExchangeEnvelope request = ExchangeEnvelope.request("GET", "/")
                .addHeader("X-Trace", "1")
                .addHeader("x-trace", "2")
                .build();

        Decision decision = plugin.handlers().get(REQUEST).handle(request, mock(CallContext.class));

        ExchangeEnvelope mutated = decision.mutatedEnvelope().get();
        assertThat(mutated.headers().getAll("X-Trace"), contains("1", "2"));
        assertThat(mutated.newBuilder().removeHeader(HeaderInjectionPlugin.HEADER_NAME).build(), is(request));
    }
}
