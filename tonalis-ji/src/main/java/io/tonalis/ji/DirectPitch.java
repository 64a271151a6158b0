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

import java.util.Objects;

/**
 * A pitch given directly by its frequency.
 *
 * <p>Used as the concert pitch of a {@link JustIntonationPitch} and as the
 * generic pitch representation for collaborators that do not work with ratios.
 */
public final class DirectPitch implements Pitch {

    private final double frequency;

    /**
     * @param frequency frequency in Hz, must be positive and finite
     */
    public DirectPitch(double frequency) {
        if (!(frequency > 0) || Double.isInfinite(frequency)) {
            throw new IllegalArgumentException("Frequency must be positive and finite, got: " + frequency);
        }
        this.frequency = frequency;
    }

    /**
     * Creates a pitch from a MIDI note number, 69 being A4 at 440 Hz.
     *
     * @param midiPitchNumber the (possibly fractional) MIDI note number
     * @return the pitch
     */
    public static DirectPitch ofMidiPitchNumber(double midiPitchNumber) {
        double semitones = midiPitchNumber - TuningConstants.MIDI_REFERENCE_PITCH_NUMBER;
        return new DirectPitch(TuningConstants.MIDI_REFERENCE_FREQUENCY_HZ * Math.pow(2, semitones / 12));
    }

    @Override
    public double getFrequency() {
        return frequency;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DirectPitch)) return false;
        return Double.compare(frequency, ((DirectPitch) o).frequency) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(frequency);
    }

    @Override
    public String toString() {
        return "DirectPitch(" + frequency + ")";
    }
}
