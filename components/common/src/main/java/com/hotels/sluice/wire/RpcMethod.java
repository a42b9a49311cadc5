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
 * Operations a plugin runtime exposes to its host.
 */
public enum RpcMethod {
    /**
     * Registration call. Empty payload, replies with a capability descriptor.
     */
    DESCRIBE(1),

    /**
     * Pushes host-side configuration. Settings payload, empty reply.
     */
    CONFIGURE(2),

    /**
     * Liveness probe. Empty payload and reply; fails with UNAVAILABLE when unhealthy.
     */
    CHECK_HEALTH(3),

    /**
     * Readiness probe. Empty payload and reply; fails with UNAVAILABLE when not ready.
     */
    CHECK_READY(4),

    /**
     * Envelope payload, replies with a decision.
     */
    EXCHANGE(5);

    private final int code;

    RpcMethod(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static Optional<RpcMethod> fromCode(int code) {
        for (RpcMethod method : values()) {
            if (method.code == code) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }
}
