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
package com.hotels.sluice.api.plugins.spi;

import com.hotels.sluice.api.Stage;

import java.time.Instant;

/**
 * Per-call information available to a {@link StageHandler}.
 */
public interface CallContext {

    /**
     * Identifier the host assigned to this call. Unique per connection.
     *
     * @return call id
     */
    long callId();

    Stage stage();

    /**
     * The instant after which the runtime stops waiting for the handler.
     *
     * @return deadline
     */
    Instant deadline();

    /**
     * Returns true once the host has cancelled the call, disconnected, or the deadline has
     * passed. A handler that sees this should release its resources and return; its result
     * is discarded.
     *
     * @return true if the result is no longer wanted
     */
    boolean isCancelled();
}
