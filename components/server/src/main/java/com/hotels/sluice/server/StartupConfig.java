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

import java.time.Duration;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Startup configuration values for {@link PluginRuntime}, read once from the command line
 * and an environment snapshot.
 * <p>
 * Without arguments the runtime listens on TCP port {@code PLUGIN_PORT} on all interfaces.
 * A host that manages the plugin process passes {@code --address <addr>} and optionally
 * {@code --network unix|tcp} (default {@code unix}).
 * <p>
 * The following environment variables are recognised:
 * <ul>
 * <li>PLUGIN_PORT - TCP listen port when no arguments are given</li>
 * <li>PLUGIN_CALL_TIMEOUT_MS - per-call deadline</li>
 * <li>PLUGIN_DRAIN_TIMEOUT_MS - how long shutdown waits for in-flight calls</li>
 * <li>PLUGIN_WORKER_THREADS - size of the handler thread pool</li>
 * <li>PLUGIN_MAX_FRAME_BYTES - largest accepted frame</li>
 * </ul>
 */
public final class StartupConfig {
    static final String PORT_VAR_NAME = "PLUGIN_PORT";
    static final String CALL_TIMEOUT_VAR_NAME = "PLUGIN_CALL_TIMEOUT_MS";
    static final String DRAIN_TIMEOUT_VAR_NAME = "PLUGIN_DRAIN_TIMEOUT_MS";
    static final String WORKER_THREADS_VAR_NAME = "PLUGIN_WORKER_THREADS";
    static final String MAX_FRAME_BYTES_VAR_NAME = "PLUGIN_MAX_FRAME_BYTES";

    private static final String ADDRESS_ARG = "--address";
    private static final String NETWORK_ARG = "--network";

    private final PluginServerConfig serverConfig;
    private final ImmutableMap<String, String> environment;

    private StartupConfig(PluginServerConfig serverConfig, Map<String, String> environment) {
        this.serverConfig = serverConfig;
        this.environment = ImmutableMap.copyOf(environment);
    }

    /**
     * Reads the startup configuration.
     *
     * @param args        command line arguments
     * @param environment environment variables
     * @return startup configuration
     * @throws ConfigurationException if an argument or variable is missing or invalid
     */
    public static StartupConfig load(String[] args, Map<String, String> environment) {
        requireNonNull(args);
        requireNonNull(environment);

        PluginServerConfig.Builder builder = PluginServerConfig.newConfigBuilder();

        if (args.length == 0) {
            builder.tcp(null, intVariable(environment, PORT_VAR_NAME, PluginServerConfig.DEFAULT_PORT));
        } else {
            configureEndpoint(builder, args);
        }

        if (environment.containsKey(CALL_TIMEOUT_VAR_NAME)) {
            builder.callTimeout(Duration.ofMillis(intVariable(environment, CALL_TIMEOUT_VAR_NAME, 0)));
        }
        if (environment.containsKey(DRAIN_TIMEOUT_VAR_NAME)) {
            builder.drainTimeout(Duration.ofMillis(intVariable(environment, DRAIN_TIMEOUT_VAR_NAME, 0)));
        }
        if (environment.containsKey(WORKER_THREADS_VAR_NAME)) {
            builder.workerThreads(intVariable(environment, WORKER_THREADS_VAR_NAME, 0));
        }
        if (environment.containsKey(MAX_FRAME_BYTES_VAR_NAME)) {
            builder.maxFrameBytes(intVariable(environment, MAX_FRAME_BYTES_VAR_NAME, 0));
        }

        return new StartupConfig(builder.build(), environment);
    }

    public PluginServerConfig serverConfig() {
        return serverConfig;
    }

    /**
     * The environment snapshot the configuration was read from. Plugins read their own
     * settings from it.
     *
     * @return environment variables
     */
    public ImmutableMap<String, String> environment() {
        return environment;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{serverConfig=" + serverConfig + '}';
    }

    private static void configureEndpoint(PluginServerConfig.Builder builder, String[] args) {
        String address = null;
        String network = Network.UNIX.argument();

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith(ADDRESS_ARG + "=")) {
                address = arg.substring(ADDRESS_ARG.length() + 1);
            } else if (arg.startsWith(NETWORK_ARG + "=")) {
                network = arg.substring(NETWORK_ARG.length() + 1);
            } else if (arg.equals(ADDRESS_ARG) || arg.equals(NETWORK_ARG)) {
                if (i + 1 >= args.length) {
                    throw new ConfigurationException("Missing value for " + arg);
                }
                if (arg.equals(ADDRESS_ARG)) {
                    address = args[++i];
                } else {
                    network = args[++i];
                }
            } else {
                throw new ConfigurationException("Unrecognised argument: " + arg);
            }
        }

        if (address == null || address.isEmpty()) {
            throw new ConfigurationException(ADDRESS_ARG + " is required when arguments are given");
        }

        String networkValue = network;
        Network selected = Network.fromArgument(networkValue)
                .orElseThrow(() -> new ConfigurationException(
                        "Invalid " + NETWORK_ARG + " '" + networkValue + "', expected unix or tcp"));

        if (selected == Network.UNIX) {
            builder.unix(address);
        } else {
            configureTcp(builder, address);
        }
    }

    private static void configureTcp(PluginServerConfig.Builder builder, String address) {
        int colon = address.lastIndexOf(':');
        if (colon < 0) {
            builder.tcp(null, parsePort(address));
            return;
        }
        String host = address.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        builder.tcp(host, parsePort(address.substring(colon + 1)));
    }

    private static int parsePort(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid port '" + value + "'", e);
        }
    }

    private static int intVariable(Map<String, String> environment, String name, int defaultValue) {
        String value = environment.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + "=" + value + " is not a valid integer", e);
        }
    }
}
