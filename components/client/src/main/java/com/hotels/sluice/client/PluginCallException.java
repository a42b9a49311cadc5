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

import com.hotels.sluice.wire.FailureCode;

/**
 * A plugin answered a call with a failure instead of a reply.
 */
public class PluginCallException extends RuntimeException {
    private final FailureCode code;

    public PluginCallException(FailureCode code, String message) {
        super(code + ": " + message);
        this.code = code;
    }

    public FailureCode code() {
        return code;
    }
}
