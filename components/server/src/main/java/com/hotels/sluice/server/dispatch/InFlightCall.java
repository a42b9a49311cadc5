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

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.hotels.sluice.api.Decision;
import com.hotels.sluice.api.Stage;
import com.hotels.sluice.common.StateMachine;
import org.slf4j.Logger;

import java.util.concurrent.Future;

import static com.hotels.sluice.server.dispatch.CallState.CANCELLED;
import static com.hotels.sluice.server.dispatch.CallState.COMPLETED;
import static com.hotels.sluice.server.dispatch.CallState.DISPATCHING;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * One exchange call between dispatch and reply.
 * <p>
 * The call completes with exactly one decision, or is cancelled by the host and completes
 * with nothing. Whichever of the two happens first wins; the other is ignored.
 */
public final class InFlightCall {
    private static final Logger LOGGER = getLogger(InFlightCall.class);

    private final long callId;
    private final DefaultCallContext context;
    private final SettableFuture<Decision> result = SettableFuture.create();
    private final StateMachine<CallState> stateMachine;
    private final long startNanos;

    private volatile Future<?> handlerFuture;

    InFlightCall(DefaultCallContext context) {
        this.callId = context.callId();
        this.context = context;
        this.startNanos = System.nanoTime();
        this.stateMachine = new StateMachine.Builder<CallState>()
                .initialState(DISPATCHING)
                .transition(DISPATCHING, HandlerReturned.class, event -> {
                    result.set(event.decision);
                    return COMPLETED;
                })
                .transition(DISPATCHING, HostCancelled.class, event -> {
                    result.cancel(false);
                    context.markCancelled();
                    Future<?> future = handlerFuture;
                    if (future != null) {
                        future.cancel(true);
                    }
                    return CANCELLED;
                })
                .onInappropriateEvent((state, event) -> {
                    LOGGER.debug("Call {} ignored {} in state {}", callId, event, state);
                    return state;
                })
                .debugTransitions("call-" + callId)
                .build();
    }

    public long callId() {
        return callId;
    }

    public Stage stage() {
        return context.stage();
    }

    public CallState state() {
        return stateMachine.currentState();
    }

    /**
     * The decision to send to the host. Cancelled if the host cancels the call first.
     *
     * @return decision future
     */
    public ListenableFuture<Decision> result() {
        return result;
    }

    /**
     * Cancels the call on behalf of the host. The handler is interrupted and no decision is
     * produced.
     *
     * @return true if this cancelled the call, false if it had already completed
     */
    public boolean cancel() {
        return stateMachine.handle(new HostCancelled()) == CANCELLED;
    }

    DefaultCallContext context() {
        return context;
    }

    long elapsedNanos() {
        return System.nanoTime() - startNanos;
    }

    void attach(Future<?> handlerFuture) {
        this.handlerFuture = handlerFuture;
        if (state() == CANCELLED) {
            handlerFuture.cancel(true);
        }
    }

    boolean complete(Decision decision) {
        return stateMachine.handle(new HandlerReturned(decision)) == COMPLETED;
    }

    @Override
    public String toString() {
        return "InFlightCall{callId=" + callId + ", stage=" + context.stage() + ", state=" + state() + '}';
    }

    private static final class HandlerReturned {
        private final Decision decision;

        private HandlerReturned(Decision decision) {
            this.decision = decision;
        }

        @Override
        public String toString() {
            return "HandlerReturned{" + decision + '}';
        }
    }

    private static final class HostCancelled {
        @Override
        public String toString() {
            return "HostCancelled";
        }
    }
}
