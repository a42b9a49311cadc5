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

import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.hotels.sluice.wire.ProtoSupport.LENGTH_DELIMITED;

/**
 * Wire form of host-pushed configuration.
 * <pre>
 * Settings { 1 repeated Entry }
 * </pre>
 */
public final class SettingsCodec {
    private static final int ENTRY = 1 << 3 | LENGTH_DELIMITED;

    private SettingsCodec() {
    }

    public static byte[] encode(Map<String, String> settings) {
        return ProtoSupport.write(out -> ProtoSupport.writeEntries(out, 1, settings));
    }

    public static ImmutableMap<String, String> decode(byte[] bytes) {
        Map<String, String> settings = new LinkedHashMap<>();
        ProtoSupport.read(bytes, "settings", (tag, in) -> {
            if (tag == ENTRY) {
                ProtoSupport.readEntry(in.readByteArray(), settings::put);
                return true;
            }
            return false;
        });
        return ImmutableMap.copyOf(settings);
    }
}
