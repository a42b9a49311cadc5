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
package com.hotels.sluice.server.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.hotels.sluice.api.Decision;
import com.hotels.sluice.api.FailurePolicy;
import com.hotels.sluice.api.exceptions.HandlerException;
import com.hotels.sluice.api.exceptions.HandlerTimeoutException;

import static java.lang.String.format;

/**
 * Turns a failed stage handler into the decision mandated by its stage's failure policy.
 */
final class FailureDecisions {
    static final int FAIL_CLOSED_STATUS = 500;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private FailureDecisions() {
    }

    static Decision decide(FailurePolicy policy, HandlerException failure) {
        if (policy == FailurePolicy.FAIL_OPEN) {
            return Decision.proceed();
        }
        return Decision.shortCircuit(FAIL_CLOSED_STATUS)
                .header("Content-Type", "application/json")
                .body(errorBody(message(failure)))
                .build();
    }

    private static String message(HandlerException failure) {
        if (failure instanceof HandlerTimeoutException) {
            return format("plugin '%s' timed out after %d ms",
                    failure.pluginName(), ((HandlerTimeoutException) failure).timeout().toMillis());
        }
        return format("plugin '%s' failed", failure.pluginName());
    }

    static byte[] errorBody(String message) {
        try {
            return MAPPER.writeValueAsBytes(ImmutableMap.of("error", message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize error body", e);
        }
    }
}
