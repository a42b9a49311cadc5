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
package com.hotels.sluice.server.netty;

import com.hotels.sluice.NettyExecutor;
import com.hotels.sluice.api.exceptions.ConfigurationException;
import com.hotels.sluice.api.plugins.spi.Plugin;
import com.hotels.sluice.server.PluginServerConfig;
import com.hotels.sluice.server.RegisteredPlugin;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import static com.hotels.sluice.common.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * A builder of {@link PluginServer} instances.
 */
public final class PluginServerBuilder {
    private PluginServerConfig config = PluginServerConfig.newConfigBuilder().build();
    private Plugin plugin;
    private MeterRegistry meterRegistry;
    private NettyExecutor bossExecutor;
    private NettyExecutor workerExecutor;

    private PluginServerBuilder() {
    }

    public static PluginServerBuilder newBuilder() {
        return new PluginServerBuilder();
    }

    PluginServerConfig config() {
        return config;
    }

    MeterRegistry meterRegistry() {
        return meterRegistry;
    }

    NettyExecutor bossExecutor() {
        return bossExecutor;
    }

    NettyExecutor workerExecutor() {
        return workerExecutor;
    }

    public PluginServerBuilder config(PluginServerConfig config) {
        this.config = requireNonNull(config, "config");
        return this;
    }

    public PluginServerBuilder plugin(Plugin plugin) {
        this.plugin = requireNonNull(plugin, "plugin");
        return this;
    }

    public PluginServerBuilder meterRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = requireNonNull(meterRegistry, "meter registry");
        return this;
    }

    public PluginServerBuilder bossExecutor(NettyExecutor executor) {
        this.bossExecutor = requireNonNull(executor, "boss executor");
        return this;
    }

    public PluginServerBuilder workerExecutor(NettyExecutor executor) {
        this.workerExecutor = requireNonNull(executor, "worker executor");
        return this;
    }

    /**
     * Registers the plugin and builds the server. Nothing is bound until the server is
     * started.
     *
     * @return a new server
     * @throws ConfigurationException if the plugin fails registration
     */
    public PluginServer build() {
        checkArgument(plugin != null, "Must configure a plugin");

        RegisteredPlugin registered = RegisteredPlugin.register(plugin);

        if (meterRegistry == null) {
            meterRegistry = new SimpleMeterRegistry();
        }
        if (bossExecutor == null) {
            bossExecutor = NettyExecutor.create("Plugin-Boss", 1);
        }
        if (workerExecutor == null) {
            workerExecutor = NettyExecutor.create("Plugin-Worker", 0);
        }
        return new PluginServer(this, registered);
    }
}
