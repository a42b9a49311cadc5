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

import com.google.common.collect.ImmutableMap;
import com.hotels.sluice.api.Stage;

import java.util.EnumMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * A helper class for implementing the {@link Plugin} interface.
 * <p>
 * Subclasses register their stage handlers from the constructor:
 *
 * <pre>
 *     public MyPlugin() {
 *         handle(Stage.REQUEST, this::onRequest);
 *     }
 * </pre>
 */
public abstract class AbstractPlugin implements Plugin {
    private final Map<Stage, StageHandler> handlers = new EnumMap<>(Stage.class);

    protected final void handle(Stage stage, StageHandler handler) {
        if (handlers.putIfAbsent(requireNonNull(stage), requireNonNull(handler)) != null) {
            throw new IllegalStateException("Handler for " + stage + " is already registered");
        }
    }

    @Override
    public Map<Stage, StageHandler> handlers() {
        return ImmutableMap.copyOf(handlers);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{stages=" + handlers.keySet() + "}";
    }
}
