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
package com.hotels.sluice.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import static com.hotels.sluice.service.ServiceStatus.FAILED;
import static com.hotels.sluice.service.ServiceStatus.LISTENING;
import static com.hotels.sluice.service.ServiceStatus.SHUTTING_DOWN;
import static com.hotels.sluice.service.ServiceStatus.STARTING;
import static com.hotels.sluice.service.ServiceStatus.STOPPED;
import static com.hotels.sluice.service.ServiceStatus.UNSTARTED;
import static java.lang.String.format;

/**
 * A long-running component with an asynchronous start/stop lifecycle.
 * <p>
 * Tracks the {@link ServiceStatus} so that subclasses only provide the start and stop actions.
 * A service is started once and stopped once; it cannot be restarted.
 */
public abstract class AbstractRuntimeService {
    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractRuntimeService.class);

    private final String name;
    private final AtomicReference<ServiceStatus> status = new AtomicReference<>(UNSTARTED);

    protected AbstractRuntimeService(String name) {
        this.name = name;
    }

    public ServiceStatus status() {
        return status.get();
    }

    protected abstract CompletableFuture<Void> startService();

    protected abstract CompletableFuture<Void> stopService();

    /**
     * Starts the service.
     *
     * @return future that completes once the service is listening, or exceptionally with a
     * {@link ServiceFailureException}
     * @throws IllegalStateException if the service has already been started
     */
    public CompletableFuture<Void> start() {
        return transition(UNSTARTED, STARTING, LISTENING, this::startService, "start");
    }

    /**
     * Stops a listening service.
     *
     * @return future that completes once all resources are released, or exceptionally with a
     * {@link ServiceFailureException}
     * @throws IllegalStateException if the service is not listening
     */
    public CompletableFuture<Void> stop() {
        return transition(LISTENING, SHUTTING_DOWN, STOPPED, this::stopService, "stop");
    }

    private CompletableFuture<Void> transition(ServiceStatus from, ServiceStatus via, ServiceStatus to,
                                               Supplier<CompletableFuture<Void>> action, String verb) {
        if (!status.compareAndSet(from, via)) {
            throw new IllegalStateException(format("Cannot %s '%s' in %s state", verb, name, status.get()));
        }
        LOGGER.debug("{} {}", via, name);

        return action.get()
                .handle((na, cause) -> {
                    if (cause != null) {
                        Throwable unwrapped = cause instanceof CompletionException && cause.getCause() != null
                                ? cause.getCause()
                                : cause;
                        LOGGER.error("{} failed to {}", name, verb, unwrapped);
                        status.set(FAILED);
                        throw new ServiceFailureException(format("Service failed to %s.", verb), unwrapped);
                    }
                    status.compareAndSet(via, to);
                    LOGGER.debug("{} {}", to, name);
                    return null;
                });
    }
}
