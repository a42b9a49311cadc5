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

import com.hotels.sluice.api.Decision;
import com.hotels.sluice.api.ExchangeEnvelope;
import com.hotels.sluice.api.exceptions.ProtocolException;
import com.hotels.sluice.api.plugins.spi.StageHandler;
import com.hotels.sluice.server.RegisteredPlugin;
import com.hotels.sluice.server.StubPlugin;
import com.hotels.sluice.wire.DecisionCodec;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.hotels.sluice.api.FailurePolicy.FAIL_OPEN;
import static com.hotels.sluice.api.Stage.REQUEST;
import static com.hotels.sluice.api.Stage.RESPONSE;
import static com.hotels.sluice.server.dispatch.CallState.CANCELLED;
import static com.hotels.sluice.server.dispatch.CallState.COMPLETED;
import static java.lang.System.currentTimeMillis;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ExchangeDispatcherTest {
    private static final ExchangeEnvelope REQUEST_ENVELOPE = ExchangeEnvelope.request("GET", "/").build();
    private static final Duration CALL_TIMEOUT = Duration.ofMillis(200);

    private SimpleMeterRegistry registry;
    private ExchangeDispatcher dispatcher;
    private String pluginName;

    @BeforeEach
    public void setUp() {
        registry = new SimpleMeterRegistry();
    }

    @AfterEach
    public void tearDown() {
        if (dispatcher != null) {
            dispatcher.close();
        }
    }

    @Test
    public void answersWithHandlerDecision() throws Exception {
        ExchangeEnvelope mutated = REQUEST_ENVELOPE.newBuilder().header("X-Added", "1").build();
        dispatcher = dispatcherFor(new StubPlugin("stub").on(REQUEST, (envelope, context) -> Decision.proceed(mutated)));

        InFlightCall call = dispatcher.dispatch(1, REQUEST_ENVELOPE, Optional.empty());

        assertThat(call.result().get(1, SECONDS), is(Decision.proceed(mutated)));
        assertThat(call.state(), is(COMPLETED));
        eventually(() -> assertThat(callCount("mutate"), is(1.0)));
        eventually(() -> assertThat(dispatcher.inFlightCount(), is(0)));
    }

    @Test
    public void passesCallContextToHandler() throws Exception {
        dispatcher = dispatcherFor(new StubPlugin("stub").on(REQUEST, (envelope, context) ->
                context.callId() == 42 && context.stage() == REQUEST && !context.isCancelled()
                        ? Decision.proceed()
                        : Decision.shortCircuit(418).build()));

        assertThat(dispatcher.dispatch(42, REQUEST_ENVELOPE, Optional.empty()).result().get(1, SECONDS),
                is(Decision.proceed()));
    }

    @Test
    public void failsClosedWhenHandlerThrows() throws Exception {
        dispatcher = dispatcherFor(new StubPlugin("strict").on(REQUEST, (envelope, context) -> {
            throw new IllegalStateException("boom");
        }));

        Decision decision = dispatcher.dispatch(1, REQUEST_ENVELOPE, Optional.empty()).result().get(1, SECONDS);

        assertThat(decision.isContinue(), is(false));
        assertThat(decision.shortCircuitStatus(), is(Optional.of(500)));
        assertThat(new String(decision.shortCircuitBody().get(), UTF_8), is("{\"error\":\"plugin 'strict' failed\"}"));
        assertThat(decision.shortCircuitHeaders().get().get("Content-Type"), is(Optional.of("application/json")));
        eventually(() -> assertThat(failureCount("error"), is(1.0)));
        eventually(() -> assertThat(callCount("fail_closed"), is(1.0)));
    }

    @Test
    public void failsOpenWhenPolicySaysSo() throws Exception {
        dispatcher = dispatcherFor(new StubPlugin("lenient").on(REQUEST, FAIL_OPEN, (envelope, context) -> {
            throw new IllegalStateException("boom");
        }));

        Decision decision = dispatcher.dispatch(1, REQUEST_ENVELOPE, Optional.empty()).result().get(1, SECONDS);

        assertThat(decision, is(Decision.proceed()));
        eventually(() -> assertThat(callCount("fail_open"), is(1.0)));
    }

    @Test
    public void treatsMissingDecisionAsFailure() throws Exception {
        dispatcher = dispatcherFor(new StubPlugin("stub").on(REQUEST, (envelope, context) -> null));

        Decision decision = dispatcher.dispatch(1, REQUEST_ENVELOPE, Optional.empty()).result().get(1, SECONDS);

        assertThat(decision.shortCircuitStatus(), is(Optional.of(500)));
    }

    @Test
    public void treatsMutationForOtherStageAsFailure() throws Exception {
        dispatcher = dispatcherFor(new StubPlugin("stub").on(REQUEST, FAIL_OPEN, (envelope, context) ->
                Decision.proceed(ExchangeEnvelope.response(200).build())));

        Decision decision = dispatcher.dispatch(1, REQUEST_ENVELOPE, Optional.empty()).result().get(1, SECONDS);

        assertThat(decision, is(Decision.proceed()));
        eventually(() -> assertThat(failureCount("error"), is(1.0)));
    }

    @Test
    public void timesOutSlowHandler() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        AtomicBoolean sawCancellation = new AtomicBoolean();
        dispatcher = dispatcherFor(new StubPlugin("slow").on(REQUEST, (envelope, context) -> {
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                sawCancellation.set(context.isCancelled());
                interrupted.countDown();
                throw e;
            }
            return Decision.proceed();
        }));

        long start = currentTimeMillis();
        Decision decision = dispatcher.dispatch(1, REQUEST_ENVELOPE, Optional.of(Duration.ofMillis(100)))
                .result().get(2, SECONDS);

        assertThat(currentTimeMillis() - start, is(lessThan(2000L)));
        assertThat(decision.shortCircuitStatus(), is(Optional.of(500)));
        assertThat(new String(decision.shortCircuitBody().get(), UTF_8),
                is("{\"error\":\"plugin 'slow' timed out after 100 ms\"}"));
        assertThat(interrupted.await(2, SECONDS), is(true));
        assertThat(sawCancellation.get(), is(true));
        eventually(() -> assertThat(failureCount("timeout"), is(1.0)));
    }

    @Test
    public void hostCannotExtendConfiguredTimeout() throws Exception {
        dispatcher = dispatcherFor(new StubPlugin("slow").on(REQUEST, FAIL_OPEN, (envelope, context) -> {
            Thread.sleep(5000);
            return Decision.shortCircuit(418).build();
        }));

        long start = currentTimeMillis();
        Decision decision = dispatcher.dispatch(1, REQUEST_ENVELOPE, Optional.of(Duration.ofSeconds(30)))
                .result().get(3, SECONDS);

        assertThat(decision, is(Decision.proceed()));
        assertThat(currentTimeMillis() - start, is(lessThan(2000L)));
    }

    @Test
    public void cancelStopsTheHandler() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        dispatcher = dispatcherFor(new StubPlugin("stub").on(REQUEST, (envelope, context) -> {
            started.countDown();
            try {
                Thread.sleep(5000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return Decision.proceed();
        }), Duration.ofSeconds(10));

        InFlightCall call = dispatcher.dispatch(1, REQUEST_ENVELOPE, Optional.empty());
        assertThat(started.await(1, SECONDS), is(true));

        assertThat(call.cancel(), is(true));

        assertThat(call.state(), is(CANCELLED));
        assertThrows(CancellationException.class, () -> call.result().get(1, SECONDS));
        assertThat(interrupted.await(2, SECONDS), is(true));
        eventually(() -> assertThat(callCount("cancelled"), is(1.0)));
        assertThat(dispatcher.inFlightCount(), is(0));
    }

    @Test
    public void cancelAfterCompletionHasNoEffect() throws Exception {
        dispatcher = dispatcherFor(new StubPlugin("stub").on(REQUEST, (envelope, context) -> Decision.proceed()));

        InFlightCall call = dispatcher.dispatch(1, REQUEST_ENVELOPE, Optional.empty());
        call.result().get(1, SECONDS);

        assertThat(call.cancel(), is(false));
        assertThat(call.state(), is(COMPLETED));
        assertThat(call.result().get(), is(Decision.proceed()));
    }

    @Test
    public void rejectsStageThePluginDoesNotHandle() {
        dispatcher = dispatcherFor(new StubPlugin("stub").on(REQUEST, (envelope, context) -> Decision.proceed()));

        assertThrows(ProtocolException.class,
                () -> dispatcher.dispatch(1, ExchangeEnvelope.response(200).build(), Optional.empty()));
    }

    @Test
    public void rejectsCallsOnceDraining() {
        dispatcher = dispatcherFor(new StubPlugin("stub").on(REQUEST, (envelope, context) -> Decision.proceed()));

        dispatcher.stopAccepting();

        assertThat(dispatcher.isAccepting(), is(false));
        assertThrows(RejectedExecutionException.class, () -> dispatcher.dispatch(1, REQUEST_ENVELOPE, Optional.empty()));
        assertThrows(RejectedExecutionException.class, () -> dispatcher.submit(() -> true));
    }

    @Test
    public void drainWaitsForInFlightCalls() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        dispatcher = dispatcherFor(new StubPlugin("stub").on(REQUEST, (envelope, context) -> {
            release.await();
            return Decision.proceed();
        }), Duration.ofSeconds(10));

        InFlightCall call = dispatcher.dispatch(1, REQUEST_ENVELOPE, Optional.empty());
        dispatcher.stopAccepting();

        assertThat(dispatcher.awaitDrained(Duration.ofMillis(100)), is(false));
        assertThat(dispatcher.inFlightCount(), is(1));

        release.countDown();

        assertThat(dispatcher.awaitDrained(Duration.ofSeconds(2)), is(true));
        assertThat(call.result().get(), is(Decision.proceed()));
    }

    @Test
    public void cancelsCallsLeftAfterDrain() throws Exception {
        dispatcher = dispatcherFor(new StubPlugin("stub").on(RESPONSE, (envelope, context) -> {
            Thread.sleep(5000);
            return Decision.proceed();
        }), Duration.ofSeconds(10));

        List<InFlightCall> calls = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            calls.add(dispatcher.dispatch(i, ExchangeEnvelope.response(200).build(), Optional.empty()));
        }

        assertThat(dispatcher.cancelInFlight(), is(3));
        for (InFlightCall call : calls) {
            assertThat(call.state(), is(CANCELLED));
        }
        assertThat(dispatcher.awaitDrained(Duration.ofMillis(100)), is(true));
    }

    @Test
    public void handlesConcurrentCallsInParallel() throws Exception {
        CountDownLatch allStarted = new CountDownLatch(4);
        dispatcher = dispatcherFor(new StubPlugin("stub").on(REQUEST, (envelope, context) -> {
            allStarted.countDown();
            return allStarted.await(2, SECONDS) ? Decision.proceed() : Decision.shortCircuit(503).build();
        }), Duration.ofSeconds(5));

        List<InFlightCall> calls = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            calls.add(dispatcher.dispatch(i, REQUEST_ENVELOPE, Optional.empty()));
        }

        for (InFlightCall call : calls) {
            assertThat(call.result().get(3, SECONDS), is(Decision.proceed()));
        }
    }

    @Test
    public void eachConcurrentCallGetsItsOwnDecision() throws Exception {
        int callCount = 16;
        dispatcher = dispatcherFor(new StubPlugin("echo").on(REQUEST, (envelope, context) -> {
            Thread.sleep(5);
            return Decision.proceed(envelope.newBuilder()
                    .header("X-Echo", envelope.header("X-Call").get() + "@" + context.callId())
                    .build());
        }), Duration.ofSeconds(5));

        List<ExchangeEnvelope> sent = new ArrayList<>();
        List<InFlightCall> calls = new ArrayList<>();
        for (int i = 0; i < callCount; i++) {
            ExchangeEnvelope envelope = REQUEST_ENVELOPE.newBuilder().header("X-Call", "call-" + i).build();
            sent.add(envelope);
            calls.add(dispatcher.dispatch(i, envelope, Optional.empty()));
        }

        for (int i = 0; i < callCount; i++) {
            ExchangeEnvelope expected = sent.get(i).newBuilder().header("X-Echo", "call-" + i + "@" + i).build();
            assertThat(calls.get(i).result().get(3, SECONDS), is(Decision.proceed(expected)));
        }
    }

    @Test
    public void sameEnvelopeGivesEqualDecisions() throws Exception {
        StageHandler pure = (envelope, context) -> envelope.header("Authorization").isPresent()
                ? Decision.proceed(envelope.newBuilder().removeHeader("Authorization").header("X-User", "alice").build())
                : Decision.shortCircuit(401).header("WWW-Authenticate", "Bearer").body("denied", UTF_8).build();
        dispatcher = dispatcherFor(new StubPlugin("pure").on(REQUEST, pure));
        ExchangeEnvelope authorised = REQUEST_ENVELOPE.newBuilder().header("Authorization", "Bearer t").build();

        Decision first = dispatcher.dispatch(1, authorised, Optional.empty()).result().get(1, SECONDS);
        Decision second = dispatcher.dispatch(2, authorised, Optional.empty()).result().get(1, SECONDS);
        Decision firstDenied = dispatcher.dispatch(3, REQUEST_ENVELOPE, Optional.empty()).result().get(1, SECONDS);
        Decision secondDenied = dispatcher.dispatch(4, REQUEST_ENVELOPE, Optional.empty()).result().get(1, SECONDS);

        assertThat(second, is(first));
        assertThat(secondDenied, is(firstDenied));
        assertThat(Arrays.equals(DecisionCodec.encode(second), DecisionCodec.encode(first)), is(true));
        assertThat(Arrays.equals(DecisionCodec.encode(secondDenied), DecisionCodec.encode(firstDenied)), is(true));
    }

    private ExchangeDispatcher dispatcherFor(StubPlugin plugin) {
        return dispatcherFor(plugin, CALL_TIMEOUT);
    }

    private ExchangeDispatcher dispatcherFor(StubPlugin plugin, Duration callTimeout) {
        RegisteredPlugin registered = RegisteredPlugin.register(plugin);
        pluginName = registered.name();
        return new ExchangeDispatcher(registered, callTimeout, 4, new RuntimeMetrics(registry, registered.name()));
    }

    private double callCount(String outcome) {
        return registry.counter(RuntimeMetrics.CALLS, "plugin", pluginName, "stage", "request", "outcome", outcome).count()
                + registry.counter(RuntimeMetrics.CALLS, "plugin", pluginName, "stage", "response", "outcome", outcome).count();
    }

    private double failureCount(String cause) {
        return registry.counter(RuntimeMetrics.FAILURES, "plugin", pluginName, "stage", "request", "cause", cause).count();
    }

    private static void eventually(Runnable block) {
        long startTime = currentTimeMillis();
        while (true) {
            try {
                block.run();
                return;
            } catch (AssertionError e) {
                if (currentTimeMillis() - startTime > 3000) {
                    throw e;
                }
            }
        }
    }
}
