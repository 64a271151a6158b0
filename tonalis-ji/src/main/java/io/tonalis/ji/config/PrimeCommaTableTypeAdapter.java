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

import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.tonalis.ji.comma.Comma;
import io.tonalis.ji.comma.PrimeCommaTable;
import io.tonalis.ji.ratio.RatioCodec;

import java.io.IOException;
import java.util.Map;
import java.util.TreeMap;

/// Gson adapter for [PrimeCommaTable], written as an object keyed by prime:
///
/// ```json
/// {"5": "80/81", "7": "63/64"}
/// ```
///
/// Tables are validated on read; a key that is not a prime above 3 or a comma
/// that does not notate its prime fails with [JsonParseException].
public final class PrimeCommaTableTypeAdapter extends TypeAdapter<PrimeCommaTable> {

    @Override
    public void write(JsonWriter out, PrimeCommaTable table) throws IOException {
        if (table == null) {
            out.nullValue();
            return;
        }
        out.beginObject();
        for (Map.Entry<Integer, Comma> entry : table.asMap().entrySet()) {
            out.name(entry.getKey().toString()).value(RatioCodec.format(entry.getValue().getRatio()));
        }
        out.endObject();
    }

    @Override
    public PrimeCommaTable read(JsonReader in) throws IOException {
        if (in.peek() == JsonToken.NULL) {
            in.nextNull();
            return null;
        }
        Map<Integer, Comma> commas = new TreeMap<>();
        in.beginObject();
        while (in.hasNext()) {
            String key = in.nextName();
            String ratio = in.nextString();
            try {
                commas.put(Integer.parseInt(key.trim()), Comma.of(ratio));
            } catch (IllegalArgumentException e) {
                throw new JsonParseException("Invalid comma entry '" + key + "': '" + ratio + "': " + e.getMessage(), e);
            }
        }
        in.endObject();

        try {
            return PrimeCommaTable.of(commas);
        } catch (IllegalArgumentException e) {
            throw new JsonParseException("Invalid comma table: " + e.getMessage(), e);
        }
    }
}
