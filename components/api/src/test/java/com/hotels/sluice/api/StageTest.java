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

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class StageTest {

    @Test
    public void mapsWireCodes() {
        assertThat(Stage.fromCode(1), is(Optional.of(Stage.REQUEST)));
        assertThat(Stage.fromCode(2), is(Optional.of(Stage.RESPONSE)));
    }

    @Test
    public void unknownCodesAreAbsent() {
        assertThat(Stage.fromCode(0), is(Optional.empty()));
        assertThat(Stage.fromCode(3), is(Optional.empty()));
    }
}
