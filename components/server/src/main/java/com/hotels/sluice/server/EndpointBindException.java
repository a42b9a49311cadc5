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

/**
 * The runtime could not bind its listen endpoint.
 */
public class EndpointBindException extends RuntimeException {
    private final String endpoint;

    public EndpointBindException(String endpoint, Throwable cause) {
        super("Failed to bind " + endpoint + ": " + cause.getMessage(), cause);
        this.endpoint = endpoint;
    }

    public String endpoint() {
        return endpoint;
    }
}
