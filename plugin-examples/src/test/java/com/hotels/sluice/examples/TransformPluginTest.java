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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hotels.sluice.api.Decision;
import com.hotels.sluice.api.ExchangeEnvelope;
import com.hotels.sluice.api.plugins.spi.CallContext;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.hotels.sluice.api.Stage.REQUEST;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.mockito.Mockito.mock;

public class TransformPluginTest {
    private final TransformPlugin plugin = new TransformPlugin();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void addsMetadataToJsonObject() throws Exception {
        ExchangeEnvelope request = jsonRequest("POST", "{\"name\":\"test\"}")
                .remoteAddress("192.168.1.1")
                .build();

        Decision decision = transform(request);

        ExchangeEnvelope mutated = decision.mutatedEnvelope().get();
        JsonNode body = mapper.readTree(mutated.body());
        assertThat(body.get("name").asText(), is("test"));
        assertThat(body.get("_metadata").get("processed_by").asText(), is("transform-plugin"));
        assertThat(body.get("_metadata").get("version").asText(), is("1.0.0"));
        assertThat(body.get("_metadata").get("client_ip").asText(), is("192.168.1.1"));
        assertThat(mutated.header("Content-Length"), is(Optional.of(String.valueOf(mutated.bodyLength()))));
    }

    @Test
    public void usesEmptyClientIpWhenUnknown() throws Exception {
        Decision decision = transform(jsonRequest("PATCH", "{}").build());

        JsonNode body = mapper.readTree(decision.mutatedEnvelope().get().body());
        assertThat(body.get("_metadata").get("client_ip").asText(), is(""));
    }

    @Test
    public void rejectsInvalidJson() throws Exception {
        Decision decision = transform(jsonRequest("PUT", "{invalid").build());

        assertThat(decision.shortCircuitStatus(), is(Optional.of(400)));
        assertThat(new String(decision.shortCircuitBody().get(), UTF_8), is("{\"error\":\"Invalid JSON\"}"));
    }

    @Test
    public void leavesNonObjectJsonAlone() throws Exception {
        assertThat(transform(jsonRequest("POST", "[1,2,3]").build()), is(Decision.proceed()));
    }

    @Test
    public void leavesEmptyBodyAlone() throws Exception {
        assertThat(transform(ExchangeEnvelope.request("POST", "/items")
                .header("Content-Type", "application/json")
                .build()), is(Decision.proceed()));
    }

    @Test
    public void leavesReadOnlyMethodsAlone() throws Exception {
        assertThat(transform(jsonRequest("GET", "{\"a\":1}").build()), is(Decision.proceed()));
    }

    @Test
    public void leavesOtherContentTypesAlone() throws Exception {
        ExchangeEnvelope request = ExchangeEnvelope.request("POST", "/items")
                .header("Content-Type", "text/plain")
                .body("{\"a\":1}", UTF_8)
                .build();

        assertThat(transform(request), is(Decision.proceed()));
    }

    @Test
    public void acceptsContentTypeWithCharset() throws Exception {
        ExchangeEnvelope request = ExchangeEnvelope.request("POST", "/items")
                .header("Content-Type", "application/json; charset=utf-8")
                .body("{\"a\":1}", UTF_8)
                .build();

        assertThat(transform(request).mutatedEnvelope().isPresent(), is(true));
    }

    private Decision transform(ExchangeEnvelope request) throws Exception {
        return plugin.handlers().get(REQUEST).handle(request, mock(CallContext.class));
    }

    private static ExchangeEnvelope.Builder jsonRequest(String method, String body) {
        return ExchangeEnvelope.request(method, "/items")
                .header("Content-Type", "application/json")
                .body(body, UTF_8);
    }
}
