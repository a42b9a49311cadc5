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
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Locale;

import static java.util.Objects.requireNonNull;
import static java.util.concurrent.TimeUnit.NANOSECONDS;

/**
 * Micrometer instrumentation of exchange calls.
 * <ul>
 * <li>{@code plugin.calls} counter tagged with plugin, stage and outcome</li>
 * <li>{@code plugin.call.latency} timer tagged with plugin and stage</li>
 * <li>{@code plugin.call.failures} counter tagged with plugin, stage and cause</li>
 * </ul>
 */
public final class RuntimeMetrics {
    public static final String CALLS = "plugin.calls";
    public static final String LATENCY = "plugin.call.latency";
    public static final String FAILURES = "plugin.call.failures";

    private final MeterRegistry registry;
    private final String pluginName;

    public RuntimeMetrics(MeterRegistry registry, String pluginName) {
        this.registry = requireNonNull(registry);
        this.pluginName = requireNonNull(pluginName);
    }

    void callCompleted(Stage stage, CallOutcome outcome, long elapsedNanos) {
        registry.counter(CALLS, "plugin", pluginName, "stage", tag(stage), "outcome", outcome.tag()).increment();
        Timer.builder(LATENCY)
                .tags("plugin", pluginName, "stage", tag(stage))
                .register(registry)
                .record(elapsedNanos, NANOSECONDS);
    }

    void handlerFailed(Stage stage, String cause) {
        registry.counter(FAILURES, "plugin", pluginName, "stage", tag(stage), "cause", cause).increment();
    }

    private static String tag(Stage stage) {
        return stage.name().toLowerCase(Locale.ROOT);
    }
}
