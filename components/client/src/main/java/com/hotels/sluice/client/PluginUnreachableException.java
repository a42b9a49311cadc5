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
package com.hotels.sluice.client;

import java.net.SocketAddress;

/**
 * The plugin endpoint could not be reached, or the connection to it was lost.
 */
public class PluginUnreachableException extends RuntimeException {
    private final SocketAddress address;

    public PluginUnreachableException(SocketAddress address, String message) {
        super(message + " " + address);
        this.address = address;
    }

    public PluginUnreachableException(SocketAddress address, Throwable cause) {
        super("Plugin at " + address + " is unreachable", cause);
        this.address = address;
    }

    public SocketAddress address() {
        return address;
    }
}
