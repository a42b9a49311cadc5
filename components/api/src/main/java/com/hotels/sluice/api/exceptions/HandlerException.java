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

import static java.util.Objects.requireNonNull;

/**
 * A wrapper for failures raised by plugin handler code.
 * <p>
 * The runtime converts these into a decision according to the stage's
 * {@link com.hotels.sluice.api.FailurePolicy}; they are never sent to the host as raw errors.
 */
public class HandlerException extends RuntimeException {
    private final String pluginName;
    private final Stage stage;

    public HandlerException(String pluginName, Stage stage, String message) {
        super(pluginName + ": " + message);
        this.pluginName = requireNonNull(pluginName);
        this.stage = requireNonNull(stage);
    }

    public HandlerException(String pluginName, Stage stage, Throwable cause) {
        super(pluginName + ": " + cause, cause);
        this.pluginName = requireNonNull(pluginName);
        this.stage = requireNonNull(stage);
    }

    public String pluginName() {
        return pluginName;
    }

    public Stage stage() {
        return stage;
    }
}
