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
import io.tonalis.ji.DirectPitch;
import io.tonalis.ji.JustIntonationPitch;
import io.tonalis.ji.Pitch;
import io.tonalis.ji.ratio.ExponentVector;
import io.tonalis.ji.ratio.RatioCodec;
import io.tonalis.ji.ratio.RatioSource;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/// Gson adapter for [JustIntonationPitch].
///
/// ## JSON Format
///
/// ```json
/// {"ratio": "3/2", "exponents": [-1, 1], "concert_pitch": 440.0}
/// ```
///
/// Both `ratio` and `exponents` are written. On read, `ratio` wins when present,
/// otherwise `exponents` is used; at least one of them is required. A missing
/// `concert_pitch` falls back to the configured concert pitch.
public final class JustIntonationPitchTypeAdapter extends TypeAdapter<JustIntonationPitch> {

    static final String RATIO_FIELD = "ratio";
    static final String EXPONENTS_FIELD = "exponents";
    static final String CONCERT_PITCH_FIELD = "concert_pitch";

    @Override
    public void write(JsonWriter out, JustIntonationPitch pitch) throws IOException {
        if (pitch == null) {
            out.nullValue();
            return;
        }
        out.beginObject();
        out.name(RATIO_FIELD).value(RatioCodec.format(pitch.getRatio()));
        out.name(EXPONENTS_FIELD).beginArray();
        for (int exponent : pitch.getExponentVector().toArray()) {
            out.value(exponent);
        }
        out.endArray();
        out.name(CONCERT_PITCH_FIELD).value(pitch.getConcertPitch().getFrequency());
        out.endObject();
    }

    @Override
    public JustIntonationPitch read(JsonReader in) throws IOException {
        if (in.peek() == JsonToken.NULL) {
            in.nextNull();
            return null;
        }
        String ratio = null;
        List<Integer> exponents = null;
        Double concertPitch = null;

        in.beginObject();
        while (in.hasNext()) {
            String name = in.nextName();
            switch (name) {
                case RATIO_FIELD:
                    ratio = in.nextString();
                    break;
                case EXPONENTS_FIELD:
                    exponents = new ArrayList<>();
                    in.beginArray();
                    while (in.hasNext()) {
                        exponents.add(in.nextInt());
                    }
                    in.endArray();
                    break;
                case CONCERT_PITCH_FIELD:
                    concertPitch = in.nextDouble();
                    break;
                default:
                    in.skipValue();
            }
        }
        in.endObject();

        RatioSource source;
        if (ratio != null) {
            source = RatioSource.literal(ratio);
        } else if (exponents != null) {
            source = new RatioSource.ExponentSequence(ExponentVector.of(exponents));
        } else {
            throw new JsonParseException(
                "Pitch requires a '" + RATIO_FIELD + "' or '" + EXPONENTS_FIELD + "' field");
        }

        try {
            Pitch concert = concertPitch != null ? new DirectPitch(concertPitch) : null;
            return new JustIntonationPitch(source, concert, TuningConfiguration.current());
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new JsonParseException("Invalid pitch: " + e.getMessage(), e);
        }
    }
}
