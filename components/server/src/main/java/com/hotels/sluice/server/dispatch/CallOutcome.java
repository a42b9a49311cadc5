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

import com.hotels.sluice.api.Decision;

/**
 * How an exchange call ended, as reported in metrics.
 */
enum CallOutcome {
    CONTINUE("continue"),
    MUTATE("mutate"),
    SHORT_CIRCUIT("short_circuit"),
    FAIL_OPEN("fail_open"),
    FAIL_CLOSED("fail_closed"),
    CANCELLED("cancelled");

    private final String tag;

    CallOutcome(String tag) {
        this.tag = tag;
    }

    String tag() {
        return tag;
    }

    static CallOutcome of(Decision decision) {
        if (!decision.isContinue()) {
            return SHORT_CIRCUIT;
        }
        return decision.mutatedEnvelope().isPresent() ? MUTATE : CONTINUE;
    }
}
