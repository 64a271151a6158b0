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

import org.apache.commons.math3.fraction.BigFraction;
import org.apache.commons.math3.fraction.FractionConversionException;

import java.math.BigInteger;

/// A sounding pitch with a frequency in Hertz.
///
/// ## Conversions
///
/// The static helpers convert between frequencies, ratios and cents:
///
/// ```
///   hertzToCents(440, 880)       = 1200.0
///   ratioToCents(3/2)            ≈ 701.955
///   centsToRatio(1200)           = 2/1
///   centsToRatio(100)            ≈ 2^(1/12), denominator below 2^19
/// ```
public interface Pitch {

    /// @return the frequency in Hertz
    double getFrequency();

    /// Returns the (possibly fractional) MIDI note number of this pitch, where
    /// 69 is A4 at 440 Hz.
    ///
    /// @return the MIDI pitch number
    default double getMidiPitchNumber() {
        return TuningConstants.MIDI_REFERENCE_PITCH_NUMBER
            + 12 * (Math.log(getFrequency() / TuningConstants.MIDI_REFERENCE_FREQUENCY_HZ) / Math.log(2));
    }

    /// Returns the interval from this pitch up to another pitch.
    ///
    /// @param other the target pitch
    /// @return the interval, negative if the other pitch is lower
    default PitchInterval getPitchInterval(Pitch other) {
        return new DirectPitchInterval(hertzToCents(getFrequency(), other.getFrequency()));
    }

    /// @param lower frequency of the first pitch in Hz
    /// @param upper frequency of the second pitch in Hz
    /// @return the distance from `lower` to `upper` in cents
    static double hertzToCents(double lower, double upper) {
        return ratioToCents(upper / lower);
    }

    /// @param ratio a positive frequency ratio
    /// @return its size in cents
    static double ratioToCents(double ratio) {
        return TuningConstants.CENT_CALCULATION_CONSTANT * Math.log10(ratio);
    }

    /// Converts an exact ratio to cents. Ratios whose terms exceed the double
    /// range are measured through their logarithms instead.
    ///
    /// @param ratio a positive frequency ratio
    /// @return its size in cents
    static double ratioToCents(BigFraction ratio) {
        double value = ratio.doubleValue();
        if (Double.isFinite(value) && value > 0) {
            return ratioToCents(value);
        }
        return TuningConstants.CENT_CALCULATION_CONSTANT
            * (log10(ratio.getNumerator()) - log10(ratio.getDenominator()));
    }

    /// Converts cents to a ratio with the default denominator bound.
    ///
    /// @param cents interval size in cents
    /// @return the ratio as a fraction
    /// @see #centsToRatio(double, int)
    static BigFraction centsToRatio(double cents) {
        return centsToRatio(cents, TuningConstants.CENTS_APPROXIMATION_MAX_DENOMINATOR);
    }

    /// Converts cents to a ratio approximating `2^(cents/1200)`.
    ///
    /// Whole octaves are exact powers of two. The rest of the interval, which
    /// lies within one octave, becomes the closest continued-fraction convergent
    /// whose denominator stays below `maxDenominator`:
    ///
    /// ```
    ///   centsToRatio(1200, n)      = 2/1
    ///   centsToRatio(100, 17)      = 17/16
    ///   centsToRatio(1600, 5)      = 5/2
    /// ```
    ///
    /// @param cents interval size in cents
    /// @param maxDenominator exclusive bound on the denominator of the within-octave part, at least 1
    /// @return the ratio as a fraction
    /// @throws IllegalArgumentException if the cents are not finite or the bound is below 1
    /// @throws ArithmeticException if the interval spans more octaves than an `int` holds
    static BigFraction centsToRatio(double cents, int maxDenominator) {
        if (!Double.isFinite(cents)) {
            throw new IllegalArgumentException("Cents must be finite, got: " + cents);
        }
        if (maxDenominator < 1) {
            throw new IllegalArgumentException("Denominator bound must be at least 1, got: " + maxDenominator);
        }
        double octaves = Math.floor(cents / TuningConstants.OCTAVE_IN_CENTS);
        double value = Math.pow(2, cents / TuningConstants.OCTAVE_IN_CENTS - octaves);
        BigFraction withinOctave = approximate(value, maxDenominator);
        int octaveCount = Math.toIntExact((long) octaves);
        BigInteger power = BigInteger.ONE.shiftLeft(Math.abs(octaveCount));
        return octaveCount >= 0 ? withinOctave.multiply(power) : withinOctave.divide(power);
    }

    private static BigFraction approximate(double value, int maxDenominator) {
        if (value == Math.rint(value)) {
            return new BigFraction((long) value);
        }
        BigFraction convergent;
        try {
            convergent = new BigFraction(value, maxDenominator);
        } catch (FractionConversionException e) {
            // The next convergent overflows an int only when the current one is already within this epsilon.
            convergent = new BigFraction(value, 1e-9, 100);
        }
        BigInteger bound = BigInteger.valueOf(maxDenominator);
        if (convergent.getNumerator().signum() > 0 && convergent.getDenominator().signum() > 0
            && convergent.getDenominator().compareTo(bound) <= 0) {
            return convergent;
        }
        return new BigFraction(BigInteger.valueOf(Math.round(value * maxDenominator)), bound);
    }

    private static double log10(BigInteger value) {
        int excessBits = Math.max(value.bitLength() - 1000, 0);
        return Math.log10(value.shiftRight(excessBits).doubleValue()) + excessBits * Math.log10(2);
    }
}
