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

/**
 * State of a {@link AbstractRuntimeService}.
 */
public enum ServiceStatus {
    /**
     * The service has been instantiated, but not started.
     */
    UNSTARTED,

    /**
     * start() has been called. The service is binding its endpoint.
     */
    STARTING,

    /**
     * The service is accepting calls.
     */
    LISTENING,

    /**
     * stop() has been called. New calls are refused while in-flight calls drain.
     */
    SHUTTING_DOWN,

    /**
     * The service has been fully stopped.
     */
    STOPPED,

    /**
     * The service failed to start or stop.
     */
    FAILED
}
