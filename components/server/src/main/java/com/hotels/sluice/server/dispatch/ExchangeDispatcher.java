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

import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.hotels.sluice.api.Decision;
import com.hotels.sluice.api.ExchangeEnvelope;
import com.hotels.sluice.api.Stage;
import com.hotels.sluice.api.exceptions.HandlerException;
import com.hotels.sluice.api.exceptions.HandlerTimeoutException;
import com.hotels.sluice.api.exceptions.ProtocolException;
import com.hotels.sluice.api.plugins.spi.StageHandler;
import com.hotels.sluice.server.RegisteredPlugin;
import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeoutException;

import static com.google.common.util.concurrent.MoreExecutors.directExecutor;
import static com.google.common.util.concurrent.MoreExecutors.listeningDecorator;
import static com.google.common.util.concurrent.MoreExecutors.shutdownAndAwaitTermination;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Runs stage handlers on a bounded worker pool.
 * <p>
 * Each exchange gets a deadline of the configured call timeout, shortened to the host's own
 * timeout when that is smaller. A handler that throws, returns nothing, returns a mutation
 * for another stage, or misses its deadline is answered according to the failure policy
 * of its stage. Such failures are contained to the call.
 */
public final class ExchangeDispatcher implements AutoCloseable {
    private static final Logger LOGGER = getLogger(ExchangeDispatcher.class);

    private final RegisteredPlugin plugin;
    private final Duration callTimeout;
    private final RuntimeMetrics metrics;
    private final ListeningExecutorService workers;
    private final ScheduledExecutorService timer;
    private final Set<InFlightCall> inFlight = ConcurrentHashMap.newKeySet();

    private volatile boolean accepting = true;

    public ExchangeDispatcher(RegisteredPlugin plugin, Duration callTimeout, int workerThreads, RuntimeMetrics metrics) {
        this.plugin = requireNonNull(plugin);
        this.callTimeout = requireNonNull(callTimeout);
        this.metrics = requireNonNull(metrics);
        this.workers = listeningDecorator(Executors.newFixedThreadPool(workerThreads, new ThreadFactoryBuilder()
                .setNameFormat("sluice-worker-%d")
                .setDaemon(true)
                .build()));
        this.timer = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("sluice-call-timer-%d")
                .setDaemon(true)
                .build());
    }

    /**
     * Starts an exchange call.
     *
     * @param callId      host-assigned call id
     * @param envelope    validated envelope
     * @param hostTimeout timeout requested by the host, if any
     * @return the in-flight call
     * @throws ProtocolException          if the plugin did not declare the envelope's stage
     * @throws RejectedExecutionException if the dispatcher no longer accepts calls
     */
    public InFlightCall dispatch(long callId, ExchangeEnvelope envelope, Optional<Duration> hostTimeout) {
        requireNonNull(envelope);
        if (!accepting) {
            throw new RejectedExecutionException("Plugin runtime is shutting down");
        }

        Stage stage = envelope.stage();
        StageHandler handler = plugin.handler(stage)
                .orElseThrow(() -> new ProtocolException(format("Plugin '%s' does not handle stage %s", plugin.name(), stage)));

        Duration timeout = hostTimeout
                .filter(requested -> requested.compareTo(callTimeout) < 0)
                .orElse(callTimeout);

        InFlightCall call = new InFlightCall(new DefaultCallContext(callId, stage, Instant.now().plus(timeout)));
        inFlight.add(call);
        call.result().addListener(() -> inFlight.remove(call), directExecutor());

        ListenableFuture<Decision> handled;
        try {
            handled = workers.submit(() -> invoke(handler, envelope, call.context()));
        } catch (RejectedExecutionException e) {
            inFlight.remove(call);
            throw e;
        }
        ListenableFuture<Decision> timed = Futures.withTimeout(handled, timeout.toMillis(), MILLISECONDS, timer);
        call.attach(timed);

        Futures.addCallback(timed, new FutureCallback<Decision>() {
            @Override
            public void onSuccess(Decision decision) {
                if (call.complete(decision)) {
                    metrics.callCompleted(stage, CallOutcome.of(decision), call.elapsedNanos());
                }
            }

            @Override
            public void onFailure(Throwable cause) {
                if (cause instanceof CancellationException) {
                    metrics.callCompleted(stage, CallOutcome.CANCELLED, call.elapsedNanos());
                    return;
                }
                HandlerException failure = asHandlerFailure(stage, timeout, cause);
                if (failure instanceof HandlerTimeoutException) {
                    call.context().markCancelled();
                }
                Decision decision = FailureDecisions.decide(plugin.descriptor().failurePolicy(stage), failure);
                if (call.complete(decision)) {
                    LOGGER.warn("Plugin '{}' failed call {} at stage {}. Answering with {}",
                            plugin.name(), call.callId(), stage, plugin.descriptor().failurePolicy(stage), failure);
                    metrics.handlerFailed(stage, failure instanceof HandlerTimeoutException ? "timeout" : "error");
                    metrics.callCompleted(stage, decision.isContinue() ? CallOutcome.FAIL_OPEN : CallOutcome.FAIL_CLOSED,
                            call.elapsedNanos());
                }
            }
        }, directExecutor());

        return call;
    }

    private Decision invoke(StageHandler handler, ExchangeEnvelope envelope, DefaultCallContext context) {
        Decision decision;
        try {
            decision = handler.handle(envelope, context);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HandlerException(plugin.name(), context.stage(), e);
        } catch (HandlerException e) {
            throw e;
        } catch (Exception e) {
            throw new HandlerException(plugin.name(), context.stage(), e);
        }

        if (decision == null) {
            throw new HandlerException(plugin.name(), context.stage(), "Handler returned no decision");
        }
        Optional<ExchangeEnvelope> mutated = decision.mutatedEnvelope();
        if (mutated.isPresent() && mutated.get().stage() != envelope.stage()) {
            throw new HandlerException(plugin.name(), context.stage(),
                    format("Mutated envelope is for stage %s, expected %s", mutated.get().stage(), envelope.stage()));
        }
        return decision;
    }

    private HandlerException asHandlerFailure(Stage stage, Duration timeout, Throwable cause) {
        if (cause instanceof TimeoutException) {
            return new HandlerTimeoutException(plugin.name(), stage, timeout);
        }
        if (cause instanceof HandlerException) {
            return (HandlerException) cause;
        }
        return new HandlerException(plugin.name(), stage, cause);
    }

    /**
     * Runs a control call (configuration, health) on the worker pool.
     *
     * @param task task
     * @param <T>  result type
     * @return result future
     * @throws RejectedExecutionException if the dispatcher no longer accepts calls
     */
    public <T> ListenableFuture<T> submit(Callable<T> task) {
        if (!accepting) {
            throw new RejectedExecutionException("Plugin runtime is shutting down");
        }
        return workers.submit(task);
    }

    public boolean isAccepting() {
        return accepting;
    }

    /**
     * Makes subsequent calls fail with {@link RejectedExecutionException}. Calls already in
     * flight carry on.
     */
    public void stopAccepting() {
        accepting = false;
    }

    public int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Waits for the calls that are currently in flight to finish.
     *
     * @param timeout how long to wait
     * @return true if all of them finished in time
     */
    public boolean awaitDrained(Duration timeout) {
        List<ListenableFuture<Decision>> pending = new ArrayList<>();
        for (InFlightCall call : inFlight) {
            pending.add(call.result());
        }
        if (pending.isEmpty()) {
            return true;
        }
        LOGGER.info("Waiting up to {} ms for {} in-flight calls", timeout.toMillis(), pending.size());
        try {
            Futures.whenAllComplete(pending).call(() -> null, directExecutor()).get(timeout.toMillis(), MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Drain failed", e.getCause());
        }
    }

    /**
     * Cancels every call still in flight.
     *
     * @return number of calls cancelled
     */
    public int cancelInFlight() {
        int cancelled = 0;
        for (InFlightCall call : inFlight) {
            if (call.cancel()) {
                cancelled++;
            }
        }
        return cancelled;
    }

    @Override
    public void close() {
        accepting = false;
        shutdownAndAwaitTermination(workers, 1, SECONDS);
        shutdownAndAwaitTermination(timer, 1, SECONDS);
    }
}
