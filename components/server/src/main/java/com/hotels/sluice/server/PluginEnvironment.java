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
package com.hotels.sluice.server;

import com.google.common.collect.ImmutableMap;
import com.hotels.sluice.api.exceptions.ConfigurationException;
import com.hotels.sluice.api.plugins.spi.PluginFactory;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Map;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Read-only view of the process environment handed to a {@link PluginFactory}.
 */
public final class PluginEnvironment implements PluginFactory.Environment {
    private final ImmutableMap<String, String> settings;
    private final MeterRegistry meterRegistry;

    public PluginEnvironment(Map<String, String> settings, MeterRegistry meterRegistry) {
        this.settings = ImmutableMap.copyOf(settings);
        this.meterRegistry = requireNonNull(meterRegistry);
    }

    @Override
    public Optional<String> setting(String name) {
        return Optional.ofNullable(settings.get(name));
    }

    @Override
    public String requiredSetting(String name) {
        String value = settings.get(name);
        if (value == null || value.isEmpty()) {
            throw new ConfigurationException("Missing required setting " + name);
        }
        return value;
    }

    @Override
    public MeterRegistry meterRegistry() {
        return meterRegistry;
    }
}
