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
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static com.hotels.sluice.api.Stage.REQUEST;
import static com.hotels.sluice.api.Stage.RESPONSE;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ExchangeEnvelopeTest {

    @Test
    public void buildsRequestEnvelope() {
        ExchangeEnvelope envelope = ExchangeEnvelope.request("POST", "http://example.org/orders?id=1")
                .path("/orders")
                .requestUri("/orders?id=1")
                .remoteAddress("10.0.0.1")
                .addHeader("Accept", "text/html")
                .addHeader("Accept", "application/json")
                .body("{}", UTF_8)
                .metadata("trace", "abc")
                .build();

        assertThat(envelope.stage(), is(REQUEST));
        assertThat(envelope.method(), is(Optional.of("POST")));
        assertThat(envelope.url(), is(Optional.of("http://example.org/orders?id=1")));
        assertThat(envelope.path(), is(Optional.of("/orders")));
        assertThat(envelope.requestUri(), is(Optional.of("/orders?id=1")));
        assertThat(envelope.remoteAddress(), is(Optional.of("10.0.0.1")));
        assertThat(envelope.statusCode(), is(Optional.empty()));
        assertThat(envelope.headers().getAll("accept"), contains("text/html", "application/json"));
        assertThat(envelope.bodyAs(UTF_8), is("{}"));
        assertThat(envelope.metadata(), is(ImmutableMap.of("trace", "abc")));
    }

    @Test
    public void requestRequiresMethodAndUrl() {
        ProtocolException noMethod = assertThrows(ProtocolException.class,
                () -> ExchangeEnvelope.newEnvelopeBuilder().stage(REQUEST).url("/").build());
        ProtocolException noUrl = assertThrows(ProtocolException.class,
                () -> ExchangeEnvelope.newEnvelopeBuilder().stage(REQUEST).method("GET").build());

        assertThat(noMethod.getMessage(), containsString("method"));
        assertThat(noUrl.getMessage(), containsString("url"));
    }

    @Test
    public void responseRequiresStatusCode() {
        ProtocolException e = assertThrows(ProtocolException.class,
                () -> ExchangeEnvelope.newEnvelopeBuilder().stage(RESPONSE).build());

        assertThat(e.getMessage(), containsString("status code"));
    }

    @Test
    public void responseRejectsStatusOutsideHttpRange() {
        assertThrows(ProtocolException.class, () -> ExchangeEnvelope.response(99).build());
        assertThrows(ProtocolException.class, () -> ExchangeEnvelope.response(600).build());
    }

    @Test
    public void requiresStage() {
        assertThrows(ProtocolException.class, () -> ExchangeEnvelope.newEnvelopeBuilder().method("GET").url("/").build());
    }

    @Test
    public void dropsFieldsThatDoNotApplyToStage() {
        ExchangeEnvelope response = ExchangeEnvelope.response(200)
                .method("GET")
                .url("/ignored")
                .remoteAddress("10.0.0.1")
                .build();

        ExchangeEnvelope request = ExchangeEnvelope.request("GET", "/")
                .statusCode(404)
                .build();

        assertThat(response.method(), is(Optional.empty()));
        assertThat(response.url(), is(Optional.empty()));
        assertThat(response.remoteAddress(), is(Optional.empty()));
        assertThat(request.statusCode(), is(Optional.empty()));
    }

    @Test
    public void newBuilderCopiesEverything() {
        ExchangeEnvelope original = ExchangeEnvelope.request("GET", "/a")
                .path("/a")
                .addHeader("X-One", "1")
                .body("body", UTF_8)
                .metadata("k", "v")
                .build();

        ExchangeEnvelope copy = original.newBuilder().build();
        ExchangeEnvelope changed = original.newBuilder().header("X-Two", "2").build();

        assertThat(copy, is(original));
        assertThat(changed, is(not(original)));
        assertThat(changed.header("X-One"), is(Optional.of("1")));
        assertThat(changed.header("X-Two"), is(Optional.of("2")));
        assertThat(original.header("X-Two"), is(Optional.empty()));
    }

    @Test
    public void headerReplacesWhileAddHeaderAppends() {
        ExchangeEnvelope envelope = ExchangeEnvelope.response(200)
                .addHeader("Set-Cookie", "a=1")
                .addHeader("Set-Cookie", "b=2")
                .header("Cache-Control", "no-cache")
                .header("cache-control", "no-store")
                .build();

        assertThat(envelope.headers().getAll("Set-Cookie"), contains("a=1", "b=2"));
        assertThat(envelope.headers().getAll("Cache-Control"), contains("no-store"));
    }

    @Test
    public void removesHeader() {
        ExchangeEnvelope envelope = ExchangeEnvelope.request("GET", "/")
                .addHeader("Cookie", "secret")
                .removeHeader("cookie")
                .build();

        assertThat(envelope.headers().contains("Cookie"), is(false));
    }

    @Test
    public void bodyIsDefensivelyCopied() {
        byte[] bytes = "abc".getBytes(UTF_8);
        ExchangeEnvelope envelope = ExchangeEnvelope.request("PUT", "/").body(bytes).build();

        bytes[0] = 'z';
        envelope.body()[1] = 'z';

        assertThat(envelope.bodyAs(UTF_8), is("abc"));
        assertThat(envelope.bodyLength(), is(3));
    }
}
