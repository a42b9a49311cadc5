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

import io.micrometer.core.instrument.MeterRegistry;

import java.util.Optional;

/**
 * A factory that creates {@link Plugin}s.
 */
public interface PluginFactory {
    /**
     * Read-only process settings made available to plugins at startup.
     * The values are captured once and never change while the process runs.
     */
    interface Environment {
        /**
         * Returns a setting, if present.
         *
         * @param name setting name
         * @return setting value
         */
        Optional<String> setting(String name);

        /**
         * Returns a setting, or a default value if it is absent.
         *
         * @param name         setting name
         * @param defaultValue value to use when the setting is absent
         * @return setting value
         */
        default String setting(String name, String defaultValue) {
            return setting(name).orElse(defaultValue);
        }

        /**
         * Returns a setting that the plugin cannot run without.
         *
         * @param name setting name
         * @return setting value
         * @throws com.hotels.sluice.api.exceptions.ConfigurationException if the setting is absent
         */
        String requiredSetting(String name);

        MeterRegistry meterRegistry();
    }

    /**
     * Creates a plugin.
     *
     * @param environment process settings
     * @return the plugin
     */
    Plugin create(Environment environment);
}
