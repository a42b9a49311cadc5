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

import com.hotels.sluice.api.Stage;
import com.hotels.sluice.api.plugins.spi.CallContext;

import java.time.Instant;

final class DefaultCallContext implements CallContext {
    private final long callId;
    private final Stage stage;
    private final Instant deadline;

    private volatile boolean cancelled;

    DefaultCallContext(long callId, Stage stage, Instant deadline) {
        this.callId = callId;
        this.stage = stage;
        this.deadline = deadline;
    }

    @Override
    public long callId() {
        return callId;
    }

    @Override
    public Stage stage() {
        return stage;
    }

    @Override
    public Instant deadline() {
        return deadline;
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    void markCancelled() {
        this.cancelled = true;
    }

    @Override
    public String toString() {
        return "CallContext{callId=" + callId + ", stage=" + stage + ", deadline=" + deadline + ", cancelled=" + cancelled + '}';
    }
}
