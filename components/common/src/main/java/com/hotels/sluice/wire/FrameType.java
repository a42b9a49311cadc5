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
package com.hotels.sluice.wire;

import java.util.Optional;

/**
 * Kinds of frame exchanged between host and plugin.
 */
public enum FrameType {
    /**
     * Host to plugin: invoke a method.
     */
    CALL(1),

    /**
     * Plugin to host: successful result of a call.
     */
    REPLY(2),

    /**
     * Plugin to host: the call failed at protocol level.
     */
    FAILURE(3),

    /**
     * Host to plugin: the result of a call is no longer wanted.
     */
    CANCEL(4);

    private final int code;

    FrameType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<FrameType> fromCode(int code) {
        for (FrameType type : values()) {
            if (type.code == code) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
