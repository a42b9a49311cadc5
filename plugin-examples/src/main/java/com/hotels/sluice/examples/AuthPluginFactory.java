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
package com.hotels.sluice.examples;

import com.hotels.sluice.api.plugins.spi.Plugin;
import com.hotels.sluice.api.plugins.spi.PluginFactory;
import com.hotels.sluice.server.PluginRuntime;

/**
 * The factory is used to construct your plugin. Settings come from the process environment,
 * which is captured once when the runtime starts.
 */
public class AuthPluginFactory implements PluginFactory {
    static final String TOKEN_SETTING = "AUTH_TOKEN";
    static final String DEFAULT_TOKEN = "secret-token-123";

    @Override
    public Plugin create(Environment environment) {
        return new AuthPlugin(environment.setting(TOKEN_SETTING, DEFAULT_TOKEN));
    }

    public static void main(String[] args) {
        PluginRuntime.serve(new AuthPluginFactory(), args);
    }
}
