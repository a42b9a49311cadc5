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
package com.hotels.sluice.api.exceptions;

import com.hotels.sluice.api.Stage;

import java.time.Duration;

/**
 * Raised when a stage handler does not return a decision before the call deadline.
 */
public class HandlerTimeoutException extends HandlerException {
    private final Duration timeout;

    public HandlerTimeoutException(String pluginName, Stage stage, Duration timeout) {
        super(pluginName, stage, "handler did not complete within " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
