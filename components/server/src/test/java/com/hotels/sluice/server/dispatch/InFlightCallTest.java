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
package com.hotels.sluice.server.dispatch;

import com.google.common.util.concurrent.SettableFuture;
import com.hotels.sluice.api.Decision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.hotels.sluice.api.Stage.REQUEST;
import static com.hotels.sluice.server.dispatch.CallState.CANCELLED;
import static com.hotels.sluice.server.dispatch.CallState.COMPLETED;
import static com.hotels.sluice.server.dispatch.CallState.DISPATCHING;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class InFlightCallTest {
    private DefaultCallContext context;
    private InFlightCall call;

    @BeforeEach
    public void setUp() {
        context = new DefaultCallContext(9, REQUEST, Instant.now().plusSeconds(1));
        call = new InFlightCall(context);
    }

    @Test
    public void startsDispatching() {
        assertThat(call.state(), is(DISPATCHING));
        assertThat(call.callId(), is(9L));
        assertThat(call.stage(), is(REQUEST));
        assertThat(call.result().isDone(), is(false));
    }

    @Test
    public void completesOnce() throws Exception {
        assertThat(call.complete(Decision.proceed()), is(true));
        assertThat(call.complete(Decision.shortCircuit(500).build()), is(false));

        assertThat(call.state(), is(COMPLETED));
        assertThat(call.result().get(), is(Decision.proceed()));
    }

    @Test
    public void cancellationWinsOverLateCompletion() {
        SettableFuture<Decision> handler = SettableFuture.create();
        call.attach(handler);

        assertThat(call.cancel(), is(true));
        assertThat(call.complete(Decision.proceed()), is(false));

        assertThat(call.state(), is(CANCELLED));
        assertThat(call.result().isCancelled(), is(true));
        assertThat(handler.isCancelled(), is(true));
        assertThat(context.isCancelled(), is(true));
    }

    @Test
    public void cancelsHandlerAttachedAfterCancellation() {
        call.cancel();

        SettableFuture<Decision> handler = SettableFuture.create();
        call.attach(handler);

        assertThat(handler.isCancelled(), is(true));
    }
}
