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

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static com.hotels.sluice.service.ServiceStatus.FAILED;
import static com.hotels.sluice.service.ServiceStatus.LISTENING;
import static com.hotels.sluice.service.ServiceStatus.STOPPED;
import static com.hotels.sluice.service.ServiceStatus.UNSTARTED;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class AbstractRuntimeServiceTest {

    @Test
    public void startsAndStops() {
        TestService service = new TestService(CompletableFuture.completedFuture(null));
        assertThat(service.status(), is(UNSTARTED));

        service.start().join();
        assertThat(service.status(), is(LISTENING));

        service.stop().join();
        assertThat(service.status(), is(STOPPED));
        assertThat(service.stopped, is(true));
    }

    @Test
    public void failsWhenStartActionFails() {
        CompletableFuture<Void> failure = new CompletableFuture<>();
        failure.completeExceptionally(new IllegalStateException("port taken"));
        TestService service = new TestService(failure);

        CompletionException e = assertThrows(CompletionException.class, () -> service.start().join());

        assertThat(e.getCause(), is(instanceOf(ServiceFailureException.class)));
        assertThat(e.getCause().getCause(), is(instanceOf(IllegalStateException.class)));
        assertThat(service.status(), is(FAILED));
    }

    @Test
    public void cannotStartTwice() {
        TestService service = new TestService(CompletableFuture.completedFuture(null));
        service.start().join();

        assertThrows(IllegalStateException.class, service::start);
    }

    @Test
    public void cannotStopUnstartedService() {
        TestService service = new TestService(CompletableFuture.completedFuture(null));

        assertThrows(IllegalStateException.class, service::stop);
        assertThat(service.status(), is(UNSTARTED));
    }

    @Test
    public void failsWhenStopActionFails() {
        CompletableFuture<Void> failure = new CompletableFuture<>();
        failure.completeExceptionally(new IllegalStateException("cannot close"));
        TestService service = new TestService(CompletableFuture.completedFuture(null), failure);
        service.start().join();

        CompletionException e = assertThrows(CompletionException.class, () -> service.stop().join());

        assertThat(e.getCause(), is(instanceOf(ServiceFailureException.class)));
        assertThat(e.getCause().getMessage(), is("Service failed to stop."));
        assertThat(service.status(), is(FAILED));
    }

    private static class TestService extends AbstractRuntimeService {
        private final CompletableFuture<Void> startResult;
        private final CompletableFuture<Void> stopResult;
        private volatile boolean stopped;

        TestService(CompletableFuture<Void> startResult) {
            this(startResult, CompletableFuture.completedFuture(null));
        }

        TestService(CompletableFuture<Void> startResult, CompletableFuture<Void> stopResult) {
            super("test-service");
            this.startResult = startResult;
            this.stopResult = stopResult;
        }

        @Override
        protected CompletableFuture<Void> startService() {
            return startResult;
        }

        @Override
        protected CompletableFuture<Void> stopService() {
            stopped = true;
            return stopResult;
        }
    }
}
