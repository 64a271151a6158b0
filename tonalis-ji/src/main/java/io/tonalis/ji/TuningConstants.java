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

/// Shared numeric constants for pitch and interval arithmetic.
public final class TuningConstants {

    /// Reference frequency of A4 when no concert pitch is configured.
    public static final double DEFAULT_CONCERT_PITCH_HZ = 440.0;

    public static final double OCTAVE_IN_CENTS = 1200.0;

    /// Factor turning a decimal logarithm of a ratio into cents: `1200 / log10(2)`.
    public static final double CENT_CALCULATION_CONSTANT = OCTAVE_IN_CENTS / Math.log10(2);

    /// Largest denominator used when a cent value is turned into a ratio.
    public static final int CENTS_APPROXIMATION_MAX_DENOMINATOR = 1 << 19;

    /// MIDI note number of the tuning reference A4.
    public static final int MIDI_REFERENCE_PITCH_NUMBER = 69;

    public static final double MIDI_REFERENCE_FREQUENCY_HZ = 440.0;

    /// Diatonic reference name used when spelling a pitch without an explicit reference.
    public static final String DEFAULT_REFERENCE_PITCH_NAME = "a";

    private TuningConstants() {
    }
}
