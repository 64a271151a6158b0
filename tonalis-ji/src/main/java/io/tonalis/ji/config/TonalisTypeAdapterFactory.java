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
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import io.tonalis.ji.JustIntonationPitch;
import io.tonalis.ji.comma.PrimeCommaTable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gson {@link TypeAdapterFactory} serving the adapters of all tonalis value types.
 *
 * <p>Register it once on a {@link com.google.gson.GsonBuilder}; see
 * {@link TuningGsonConfig} for the preconfigured instances.
 */
public final class TonalisTypeAdapterFactory implements TypeAdapterFactory {

    private final Map<Class<?>, TypeAdapter<?>> adapters = new LinkedHashMap<>();

    private TonalisTypeAdapterFactory() {
    }

    /**
     * Creates a new factory with all tonalis adapters registered.
     *
     * @return a configured factory
     */
    public static TonalisTypeAdapterFactory create() {
        TonalisTypeAdapterFactory factory = new TonalisTypeAdapterFactory();
        factory.registerAdapter(JustIntonationPitch.class, new JustIntonationPitchTypeAdapter());
        factory.registerAdapter(PrimeCommaTable.class, new PrimeCommaTableTypeAdapter());
        return factory;
    }

    /**
     * @param type the exact value type
     * @param adapter its adapter
     * @param <T> the value type
     * @throws IllegalArgumentException if the type already has an adapter
     */
    public <T> void registerAdapter(Class<T> type, TypeAdapter<T> adapter) {
        if (adapters.containsKey(type)) {
            throw new IllegalArgumentException("Type " + type.getName() + " already has an adapter");
        }
        adapters.put(type, adapter.nullSafe());
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        return (TypeAdapter<T>) adapters.get(type.getRawType());
    }
}
