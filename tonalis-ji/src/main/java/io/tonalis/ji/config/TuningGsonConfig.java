package io.tonalis.ji.config;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for pitches and comma tables.
///
/// ## Usage
///
/// ```java
/// Gson gson = TuningGsonConfig.gson();
///
/// String json = gson.toJson(new JustIntonationPitch("3/2"));
/// // {"ratio": "3/2", "exponents": [-1, 1], "concert_pitch": 440.0}
///
/// JustIntonationPitch restored = gson.fromJson(json, JustIntonationPitch.class);
/// ```
///
/// ## Configuration
///
/// | Feature | Setting | Purpose |
/// |---------|---------|---------|
/// | Pretty printing | Enabled | Human-readable comma tables |
/// | HTML escaping | Disabled | Keeps `/` and `'` unescaped |
/// | Tonalis adapters | Registered | Pitch and comma table formats |
///
/// The shared [Gson] instance is thread-safe.
///
/// @see TonalisTypeAdapterFactory
public final class TuningGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private TuningGsonConfig() {
    }

    /// @return the shared pretty-printing Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// Creates a new GsonBuilder with the tonalis adapters, for callers that
    /// need further customization.
    ///
    /// @return a new GsonBuilder
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .registerTypeAdapterFactory(TonalisTypeAdapterFactory.create());
    }

    /// Creates a single-line Gson instance, e.g. for NDJSON output.
    ///
    /// @return a compact Gson instance
    public static Gson compactGson() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .registerTypeAdapterFactory(TonalisTypeAdapterFactory.create())
            .create();
    }
}
