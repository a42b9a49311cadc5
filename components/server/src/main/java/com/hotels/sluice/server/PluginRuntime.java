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

import com.google.common.annotations.VisibleForTesting;
import com.hotels.sluice.api.exceptions.ConfigurationException;
import com.hotels.sluice.api.plugins.spi.Plugin;
import com.hotels.sluice.api.plugins.spi.PluginFactory;
import com.hotels.sluice.server.netty.PluginServer;
import com.hotels.sluice.server.netty.PluginServerBuilder;
import com.hotels.sluice.service.ServiceStatus;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;

import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static java.lang.Runtime.getRuntime;
import static java.util.Objects.requireNonNull;
import static org.slf4j.LoggerFactory.getLogger;

/**
 * Entry point of a plugin process.
 * <p>
 * A plugin's {@code main} method hands its factory to {@link #serve(PluginFactory, String[])},
 * which creates the plugin, starts listening, and blocks until the process is asked to
 * terminate. The process exit code is 0 after a graceful shutdown, 2 for configuration
 * errors and 1 for any other startup failure.
 */
public final class PluginRuntime {
    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_CONFIGURATION_ERROR = 2;

    private static final Logger LOG = getLogger(PluginRuntime.class);

    private final PluginServer server;
    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicBoolean shuttingDown = new AtomicBoolean();

    private PluginRuntime(PluginServer server) {
        this.server = server;
    }

    /**
     * Runs a plugin until the JVM shuts down, then exits the process.
     *
     * @param factory plugin factory
     * @param args    command line arguments
     */
    public static void serve(PluginFactory factory, String[] args) {
        System.exit(run(factory, args, System.getenv(), new SimpleMeterRegistry(), PluginRuntime::installShutdownHook));
    }

    @VisibleForTesting
    static int run(PluginFactory factory, String[] args, Map<String, String> environment, MeterRegistry meterRegistry,
                   Consumer<PluginRuntime> shutdownHook) {
        PluginRuntime runtime;
        try {
            runtime = create(factory, StartupConfig.load(args, environment), meterRegistry);
            shutdownHook.accept(runtime);
            runtime.start();
        } catch (ConfigurationException cause) {
            LOG.error(cause.getMessage(), cause.getCause());
            return EXIT_CONFIGURATION_ERROR;
        } catch (Throwable cause) {
            LOG.error("Error in plugin runtime startup.", cause);
            return EXIT_ERROR;
        }

        runtime.awaitTermination();
        return EXIT_OK;
    }

    // SIGTERM and SIGINT reach the runtime only through this hook. Once the drain has completed the
    // process halts with 0, otherwise the JVM would report the signal as the exit status.
    private static void installShutdownHook(PluginRuntime runtime) {
        getRuntime().addShutdownHook(new Thread(() -> {
            if (runtime.shutdown()) {
                getRuntime().halt(EXIT_OK);
            }
        }, "plugin-runtime-shutdown"));
    }

    /**
     * Creates a runtime around the plugin produced by the factory.
     *
     * @param factory       plugin factory
     * @param startupConfig startup configuration
     * @param meterRegistry registry for runtime and plugin metrics
     * @return an unstarted runtime
     * @throws ConfigurationException if the factory or plugin registration fails
     */
    public static PluginRuntime create(PluginFactory factory, StartupConfig startupConfig, MeterRegistry meterRegistry) {
        requireNonNull(factory);
        LOG.info("Plugin runtime startup config {}", startupConfig);

        Plugin plugin = createPlugin(factory, new PluginEnvironment(startupConfig.environment(), meterRegistry));

        PluginServer server = PluginServerBuilder.newBuilder()
                .config(startupConfig.serverConfig())
                .plugin(plugin)
                .meterRegistry(meterRegistry)
                .build();

        return new PluginRuntime(server);
    }

    private static Plugin createPlugin(PluginFactory factory, PluginFactory.Environment environment) {
        Plugin plugin;
        try {
            plugin = factory.create(environment);
        } catch (ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ConfigurationException("Plugin factory " + factory.getClass().getName() + " failed: " + e.getMessage(), e);
        }
        if (plugin == null) {
            throw new ConfigurationException("Plugin factory " + factory.getClass().getName() + " returned no plugin");
        }
        return plugin;
    }

    /**
     * Binds the endpoint and starts accepting calls.
     *
     * @throws EndpointBindException if the endpoint cannot be bound
     */
    public void start() {
        try {
            server.start().join();
        } catch (CompletionException e) {
            terminated.countDown();
            throw unwrap(e);
        }
        LOG.info("Plugin '{}' version {} listening on {}",
                server.plugin().name(), server.plugin().descriptor().version(), server.address().orElse(null));
    }

    /**
     * Drains in-flight calls and stops the runtime. Does nothing unless the runtime is
     * listening.
     *
     * @return true if this call stopped the runtime
     */
    public boolean shutdown() {
        if (server.status() != ServiceStatus.LISTENING || !shuttingDown.compareAndSet(false, true)) {
            return false;
        }
        LOG.info("Shutting down plugin '{}'", server.plugin().name());
        try {
            server.stop().join();
            LOG.info("Plugin '{}' stopped", server.plugin().name());
        } finally {
            terminated.countDown();
        }
        return true;
    }

    /**
     * Blocks until the runtime has stopped.
     */
    public void awaitTermination() {
        try {
            terminated.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public PluginServer server() {
        return server;
    }

    public ServiceStatus status() {
        return server.status();
    }

    private static RuntimeException unwrap(CompletionException e) {
        for (Throwable cause = e.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof EndpointBindException || cause instanceof ConfigurationException) {
                return (RuntimeException) cause;
            }
        }
        return e.getCause() instanceof RuntimeException ? (RuntimeException) e.getCause() : e;
    }
}
