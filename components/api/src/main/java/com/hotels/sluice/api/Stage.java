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
package com.hotels.sluice.api;

import java.util.Optional;

/**
 * A point in the lifecycle of a proxied HTTP transaction at which a plugin can intercept it.
 * <p>
 * Each stage has a stable numeric code used on the wire. Codes that this build does not know
 * about map to {@link Optional#empty()} so that hosts can introduce new stages without
 * breaking older plugins.
 */
public enum Stage {
    /**
     * An inbound request, before it is forwarded to the origin.
     */
    REQUEST(1),

    /**
     * An origin response, before it is returned to the client.
     */
    RESPONSE(2);

    private final int code;

    Stage(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<Stage> fromCode(int code) {
        for (Stage stage : values()) {
            if (stage.code == code) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }
}
