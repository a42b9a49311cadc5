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

import java.util.Optional;

/**
 * Kind of endpoint the plugin runtime listens on.
 */
public enum Network {
    TCP("tcp"),
    UNIX("unix");

    private final String argument;

    Network(String argument) {
        this.argument = argument;
    }

    public String argument() {
        return argument;
    }

    static Optional<Network> fromArgument(String value) {
        for (Network network : values()) {
            if (network.argument.equals(value)) {
                return Optional.of(network);
            }
        }
        return Optional.empty();
    }
}
