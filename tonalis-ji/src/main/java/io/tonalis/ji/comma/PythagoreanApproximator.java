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

import io.tonalis.ji.JustIntonationPitch;
import io.tonalis.ji.Pitch;
import io.tonalis.ji.config.TuningConfiguration;
import io.tonalis.ji.ratio.RatioSource;
import org.apache.commons.math3.fraction.BigFraction;

import java.util.Objects;

/// Splits a just pitch into its closest pythagorean (3-limit) interval and the
/// commas that correct it.
///
/// ## Decomposition
///
/// Every prime above 3 in the pitch is notated by one comma of the table. Taking
/// the commas out and folding the rest into one octave leaves an interval built
/// from 2 and 3 only:
///
/// ```
///   5/4  − 80/81 → 81/64   (4 fifths, "e" above "c")
///   11/8 − 33/32 → 4/3     (−1 fifth, "a" above "e")
///   8/7  + 63/64 → 9/8     (2 fifths)
/// ```
///
/// ## Deviation from equal temperament
///
/// The cent deviation of a pitch from its closest 12-tone equal tempered pitch
/// class is the size of the comma product plus, for every fifth of the
/// pythagorean interval, the difference between a pure fifth and 700 cents.
public final class PythagoreanApproximator {

    private static final double PURE_FIFTH_DEVIATION =
        Pitch.ratioToCents(new BigFraction(3, 2)) - 700;

    private final PrimeCommaTable table;

    public PythagoreanApproximator(PrimeCommaTable table) {
        this.table = Objects.requireNonNull(table, "table cannot be null");
    }

    /// @return an approximator using the comma table of [TuningConfiguration#current()]
    public static PythagoreanApproximator withDefaults() {
        return new PythagoreanApproximator(TuningConfiguration.current().getPrimeCommaTable());
    }

    public PrimeCommaTable getTable() {
        return table;
    }

    /// @param pitch the pitch to notate
    /// @return one comma power per prime above 3 occurring in the pitch
    /// @throws IllegalArgumentException if the table lacks one of those primes
    public CommaCompound commasOf(JustIntonationPitch pitch) {
        return CommaCompound.of(
            pitch.getExponentVector(), pitch.getConfiguration().getPrimes(), table);
    }

    /// @param pitch the pitch to approximate
    /// @return an octave-normalized interval using only the primes 2 and 3
    public JustIntonationPitch closestPythagoreanInterval(JustIntonationPitch pitch) {
        CommaCompound commas = commasOf(pitch);
        if (commas.isEmpty()) {
            return pitch.normalize();
        }
        JustIntonationPitch commaPitch = new JustIntonationPitch(
            RatioSource.fraction(commas.getRatio()), pitch.getConcertPitch(), pitch.getConfiguration());
        return pitch.subtract(commaPitch).normalize();
    }

    /// @param pitch the pitch to measure
    /// @return its deviation in cents from the closest equal tempered pitch class
    public double centDeviationFromClosestWesternPitchClass(JustIntonationPitch pitch) {
        double commaDeviation = Pitch.ratioToCents(commasOf(pitch).getRatio());
        int fifths = closestPythagoreanInterval(pitch).getExponentVector().get(1);
        return commaDeviation + fifths * PURE_FIFTH_DEVIATION;
    }

    /// Names the closest pythagorean pitch, treating the pitch as an interval
    /// above a reference pitch name.
    ///
    /// @param pitch the interval above the reference
    /// @param reference name of the pitch 1/1 stands for, e.g. `"c"` or `"bf"`
    /// @return the diatonic name with accidentals
    public String closestPythagoreanPitchName(JustIntonationPitch pitch, String reference) {
        int fifths = closestPythagoreanInterval(pitch).getExponentVector().get(1);
        return DiatonicSpelling.spell(reference, fifths);
    }
}
