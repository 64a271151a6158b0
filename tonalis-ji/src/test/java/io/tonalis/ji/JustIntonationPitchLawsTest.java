package io.tonalis.ji;

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

import io.tonalis.ji.ratio.RatioCodec;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Algebraic laws every pitch must satisfy, checked over a fixed set of ratios
 * from several prime limits.
 */
@Tag("unit")
public class JustIntonationPitchLawsTest {

    private static final List<String> RATIOS = List.of(
        "1/1", "2/1", "1/2", "3/2", "4/3", "5/4", "6/5", "7/4", "9/8", "11/8",
        "13/8", "15/8", "16/15", "25/24", "81/80", "135/128", "243/128", "17/16",
        "1/7", "31/1", "2176/2187", "1024/729");

    static Stream<String> ratios() {
        return RATIOS.stream();
    }

    static Stream<Arguments> ratioPairs() {
        List<Arguments> pairs = new ArrayList<>();
        for (int i = 0; i < RATIOS.size(); i += 3) {
            for (int j = 1; j < RATIOS.size(); j += 4) {
                pairs.add(Arguments.of(RATIOS.get(i), RATIOS.get(j)));
            }
        }
        return pairs.stream();
    }

    @ParameterizedTest
    @MethodSource("ratios")
    void ratioRoundTripsThroughTheExponentVector(String ratio) {
        JustIntonationPitch pitch = new JustIntonationPitch(ratio);
        assertEquals(RatioCodec.parse(ratio), pitch.getRatio());
        assertEquals(pitch, JustIntonationPitch.of(pitch.getExponentVector()));
    }

    @ParameterizedTest
    @MethodSource("ratios")
    void normalizeIsIdempotent(String ratio) {
        JustIntonationPitch once = new JustIntonationPitch(ratio).normalize();

        assertEquals(once, once.normalize());
        assertEquals(0, once.getOctave());
    }

    @ParameterizedTest
    @MethodSource("ratios")
    void inverseIsAnInvolution(String ratio) {
        JustIntonationPitch pitch = new JustIntonationPitch(ratio);

        assertEquals(pitch, pitch.inverse().inverse());
        assertEquals(pitch, pitch.inverse(pitch));
    }

    @ParameterizedTest
    @MethodSource("ratioPairs")
    void subtractUndoesAdd(String first, String second) {
        JustIntonationPitch p = new JustIntonationPitch(first);
        JustIntonationPitch q = new JustIntonationPitch(second);

        assertEquals(p, p.add(q).subtract(q));
        assertEquals(p.add(q), q.add(p));
    }

    @ParameterizedTest
    @MethodSource("ratioPairs")
    void intersectionIsSymmetricAndBounded(String first, String second) {
        JustIntonationPitch p = new JustIntonationPitch(first);
        JustIntonationPitch q = new JustIntonationPitch(second);
        JustIntonationPitch common = p.intersection(q);

        assertEquals(common, q.intersection(p));
        assertEquals(common, common.intersection(p));
        assertTrue(common.getHarmonicityTenney() <= Math.min(p.getHarmonicityTenney(), q.getHarmonicityTenney()) + 1e-12);
    }

    @ParameterizedTest
    @MethodSource("ratioPairs")
    void closestRegisterLiesWithinOneOctaveOfTheReference(String first, String second) {
        JustIntonationPitch p = new JustIntonationPitch(first);
        JustIntonationPitch reference = new JustIntonationPitch(second);

        JustIntonationPitch moved = p.moveToClosestRegister(reference);

        assertEquals(p.normalize(), moved.normalize());
        assertTrue(Math.abs(moved.getInterval() - reference.getInterval()) <= 1200 + 1e-9);
    }
}
