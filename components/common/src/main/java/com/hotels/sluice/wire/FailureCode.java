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

/**
 * Reason carried by a FAILURE frame.
 */
public enum FailureCode {
    PROTOCOL(1),
    CONFIGURATION(2),
    UNAVAILABLE(3),
    INTERNAL(4),
    UNIMPLEMENTED(5);

    private final int code;

    FailureCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Maps a wire code, treating codes this build does not know as {@link #INTERNAL}.
     *
     * @param code wire code
     * @return failure code
     */
    public static FailureCode fromCode(int code) {
        for (FailureCode failureCode : values()) {
            if (failureCode.code == code) {
                return failureCode;
            }
        }
        return INTERNAL;
    }
}
