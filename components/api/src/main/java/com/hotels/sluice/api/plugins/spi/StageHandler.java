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
package com.hotels.sluice.api.plugins.spi;

import com.hotels.sluice.api.Decision;
import com.hotels.sluice.api.ExchangeEnvelope;

/**
 * Plugin logic for one stage.
 * <p>
 * Handlers run concurrently on worker threads, one call per thread. A handler may block,
 * but should give up when {@link CallContext#isCancelled()} turns true or the thread is
 * interrupted. Anything thrown is handled by the runtime according to the stage's
 * {@link com.hotels.sluice.api.FailurePolicy}.
 */
@FunctionalInterface
public interface StageHandler {
    Decision handle(ExchangeEnvelope envelope, CallContext context) throws Exception;
}
