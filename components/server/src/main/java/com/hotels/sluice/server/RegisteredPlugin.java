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
import com.hotels.sluice.api.CapabilityDescriptor;
import com.hotels.sluice.api.Stage;
import com.hotels.sluice.api.exceptions.ConfigurationException;
import com.hotels.sluice.api.exceptions.ProtocolException;
import com.hotels.sluice.api.plugins.spi.Plugin;
import com.hotels.sluice.api.plugins.spi.StageHandler;
import org.slf4j.Logger;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * A plugin that passed startup registration, together with its cached descriptor and the
 * handlers for its declared stages.
 */
public final class RegisteredPlugin {
    private static final Logger LOGGER = getLogger(RegisteredPlugin.class);

    private final Plugin plugin;
    private final CapabilityDescriptor descriptor;
    private final ImmutableMap<Stage, StageHandler> handlers;
    private final AtomicBoolean configured = new AtomicBoolean();

    private RegisteredPlugin(Plugin plugin, CapabilityDescriptor descriptor, ImmutableMap<Stage, StageHandler> handlers) {
        this.plugin = plugin;
        this.descriptor = descriptor;
        this.handlers = handlers;
    }

    /**
     * Obtains the descriptor and handlers of a plugin and checks that they agree.
     *
     * @param plugin plugin
     * @return registered plugin
     * @throws ConfigurationException if the plugin cannot describe itself or a declared stage
     *                                has no handler
     */
    public static RegisteredPlugin register(Plugin plugin) {
        requireNonNull(plugin);

        CapabilityDescriptor descriptor = describe(plugin);
        Map<Stage, StageHandler> declared = handlersOf(plugin);

        ImmutableMap.Builder<Stage, StageHandler> handlers = ImmutableMap.builder();
        for (Stage stage : descriptor.supportedStages()) {
            StageHandler handler = declared.get(stage);
            if (handler == null) {
                throw new ConfigurationException(format("Plugin '%s' declares stage %s but has no handler for it",
                        descriptor.name(), stage));
            }
            handlers.put(stage, handler);
        }

        declared.keySet().stream()
                .filter(stage -> !descriptor.supports(stage))
                .forEach(stage -> LOGGER.warn("Plugin '{}' has a handler for undeclared stage {}. It will not be called.",
                        descriptor.name(), stage));

        LOGGER.info("Registered plugin '{}' version {} for stages {}",
                descriptor.name(), descriptor.version(), descriptor.failurePolicies());

        return new RegisteredPlugin(plugin, descriptor, handlers.build());
    }

    private static CapabilityDescriptor describe(Plugin plugin) {
        CapabilityDescriptor descriptor;
        try {
            descriptor = plugin.descriptor();
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConfigurationException("Plugin " + plugin + " failed to describe itself", e);
        }
        if (descriptor == null) {
            throw new ConfigurationException("Plugin " + plugin + " returned no descriptor");
        }
        return descriptor;
    }

    private static Map<Stage, StageHandler> handlersOf(Plugin plugin) {
        Map<Stage, StageHandler> handlers;
        try {
            handlers = plugin.handlers();
        } catch (RuntimeException e) {
            throw new ConfigurationException("Plugin " + plugin + " failed to provide its handlers", e);
        }
        return handlers == null ? ImmutableMap.of() : handlers;
    }

    public String name() {
        return descriptor.name();
    }

    public CapabilityDescriptor descriptor() {
        return descriptor;
    }

    public Optional<StageHandler> handler(Stage stage) {
        return Optional.ofNullable(handlers.get(stage));
    }

    public Plugin plugin() {
        return plugin;
    }

    /**
     * Passes host configuration to the plugin. Succeeds at most once. A failed attempt may be
     * retried.
     *
     * @param settings configuration entries
     * @throws ProtocolException      if the plugin is already configured
     * @throws ConfigurationException if the plugin rejects the configuration
     */
    public void configure(Map<String, String> settings) {
        if (!configured.compareAndSet(false, true)) {
            throw new ProtocolException(format("Plugin '%s' is already configured", name()));
        }
        try {
            plugin.configure(ImmutableMap.copyOf(settings));
            LOGGER.info("Plugin '{}' configured with keys {}", name(), settings.keySet());
        } catch (RuntimeException e) {
            configured.set(false);
            if (e instanceof ConfigurationException) {
                throw e;
            }
            throw new ConfigurationException(format("Plugin '%s' rejected its configuration: %s", name(), e.getMessage()), e);
        }
    }

    public boolean isConfigured() {
        return configured.get();
    }

    public boolean healthy() {
        return plugin.healthy();
    }

    public boolean ready() {
        return plugin.ready();
    }

    @Override
    public String toString() {
        return "RegisteredPlugin{" + descriptor + '}';
    }
}
