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

import com.hotels.sluice.api.CapabilityDescriptor;
import com.hotels.sluice.api.Stage;

import java.util.Map;

/**
 * Sluice plugins intercept HTTP messages that a host proxy forwards to them, one
 * {@link Stage} at a time.
 * <p>
 * They can be used to log/record information, to modify requests and/or responses, or to
 * answer a request directly instead of letting it reach the origin.
 * <p>
 * Every stage named by {@link #descriptor()} must have an entry in {@link #handlers()}.
 * The runtime checks this once at startup and refuses to start otherwise.
 */
public interface Plugin {

    /**
     * Describes the plugin. Called once, when the plugin is registered with the runtime.
     *
     * @return the plugin's capabilities
     */
    CapabilityDescriptor descriptor();

    /**
     * Returns the handler for each supported stage.
     *
     * @return stage handlers
     */
    Map<Stage, StageHandler> handlers();

    /**
     * Receives configuration pushed by the host. At most one call per process.
     *
     * @param configuration configuration entries
     */
    default void configure(Map<String, String> configuration) {
    }

    /**
     * Liveness probe.
     *
     * @return true if the plugin is healthy
     */
    default boolean healthy() {
        return true;
    }

    /**
     * Readiness probe.
     *
     * @return true if the plugin can handle traffic
     */
    default boolean ready() {
        return true;
    }

    /**
     * Invoked after the runtime has bound its endpoint, before the first call is accepted.
     */
    default void runtimeStarting() {
    }

    /**
     * Invoked once in-flight calls have drained during shutdown.
     */
    default void runtimeStopping() {
    }
}
