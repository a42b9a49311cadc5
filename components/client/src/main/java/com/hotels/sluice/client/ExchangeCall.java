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
package com.hotels.sluice.client;

import com.hotels.sluice.api.Decision;

import java.util.concurrent.CompletableFuture;

/**
 * An exchange call awaiting the plugin's decision.
 */
public final class ExchangeCall {
    private final long callId;
    private final CompletableFuture<Decision> decision;
    private final Runnable canceller;

    ExchangeCall(long callId, CompletableFuture<Decision> decision, Runnable canceller) {
        this.callId = callId;
        this.decision = decision;
        this.canceller = canceller;
    }

    public long callId() {
        return callId;
    }

    public CompletableFuture<Decision> decision() {
        return decision;
    }

    /**
     * Tells the plugin to abandon the call. The decision future completes with a
     * {@link java.util.concurrent.CancellationException}.
     */
    public void cancel() {
        canceller.run();
    }
}
