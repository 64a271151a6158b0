package io.tonalis.ji.comma;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/// Diatonic pitch names on the cycle of fifths.
///
/// ## Naming
///
/// A pitch name is a lowercase diatonic letter followed by accidentals, `s` for
/// each sharp and `f` for each flat: `"c"`, `"fs"`, `"bf"`, `"ass"`.
///
/// ## Spelling by Fifths
///
/// Moving `n` fifths from a reference walks the cycle below, wrapping around
/// with one extra sharp (or flat, walking backwards) per full turn:
///
/// ```
///   position │ 0 │ 1 │ 2 │ 3 │ 4 │ 5 │ 6
///   letter   │ f │ c │ g │ d │ a │ e │ b
/// ```
public final class DiatonicSpelling {

    private static final Logger logger = LogManager.getLogger(DiatonicSpelling.class);

    public static final List<String> CYCLE_OF_FIFTHS = List.of("f", "c", "g", "d", "a", "e", "b");

    public static final char SHARP = 's';
    public static final char FLAT = 'f';

    private DiatonicSpelling() {
    }

    /// Spells the pitch that lies a number of pure fifths away from a reference.
    ///
    /// @param reference reference pitch name, e.g. `"c"` or `"bf"`
    /// @param fifths signed number of fifths, negative for fourths
    /// @return the resulting pitch name
    /// @throws IllegalArgumentException if the reference does not start with a diatonic letter
    public static String spell(String reference, int fifths) {
        if (reference == null || reference.isEmpty()) {
            throw new IllegalArgumentException("Reference pitch name must not be empty");
        }
        int position = positionInCycleOfFifths(reference.substring(0, 1));
        int referenceAccidentals = countAccidentals(reference.substring(1));

        String letter = CYCLE_OF_FIFTHS.get((position + Math.floorMod(fifths, 7)) % 7);
        int accidentals = Math.floorDiv(position + fifths, 7) + referenceAccidentals;
        return letter + accidentals(accidentals);
    }

    /// @param letter one of `f c g d a e b`
    /// @return its zero-based position on the cycle of fifths
    public static int positionInCycleOfFifths(String letter) {
        int position = CYCLE_OF_FIFTHS.indexOf(letter);
        if (position < 0) {
            throw new IllegalArgumentException(
                "Unknown diatonic pitch name '" + letter + "', expected one of " + CYCLE_OF_FIFTHS);
        }
        return position;
    }

    /// Counts sharps as +1 and flats as −1. Any other character is ignored.
    ///
    /// @param accidentals accidental suffix of a pitch name
    /// @return the signed accidental count
    public static int countAccidentals(String accidentals) {
        int count = 0;
        for (char accidental : accidentals.toCharArray()) {
            if (accidental == SHARP) {
                count++;
            } else if (accidental == FLAT) {
                count--;
            } else {
                logger.warn("Ignoring unknown accidental '{}' in '{}'", accidental, accidentals);
            }
        }
        return count;
    }

    /// @param count signed accidental count
    /// @return `"s"` repeated for positive counts, `"f"` repeated for negative ones
    public static String accidentals(int count) {
        char accidental = count < 0 ? FLAT : SHARP;
        return String.valueOf(accidental).repeat(Math.abs(count));
    }
}
