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

/// A distance between two pitches, expressed in cents.
///
/// [JustIntonationPitch] is both a pitch and an exact interval; other
/// implementations such as [DirectPitchInterval] only carry the cents value and
/// are handled through a cents-based fallback when combined with exact pitches.
public interface PitchInterval {

    /// @return the interval size in cents; 1200 is one octave
    double getInterval();
}
