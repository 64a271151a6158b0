package io.tonalis.ji.harmonicity;

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

import io.tonalis.ji.ratio.RatioFactors;

/// A numeric score of how consonant or complex a rational interval is.
///
/// ## Contract
///
/// Every metric is a pure function of the split prime factorization of a ratio
/// ([RatioFactors]); none of them looks at the concert pitch or mutates anything.
///
/// ## Direction
///
/// Metrics disagree on direction, so callers must not compare scores across
/// metrics:
///
/// | Metric                         | Name                | 1/1   | Higher means     |
/// |--------------------------------|---------------------|-------|------------------|
/// | [BarlowHarmonicity]            | `barlow`            | +∞    | more harmonic    |
/// | [SimplifiedBarlowHarmonicity]  | `simplified_barlow` | 1     | more harmonic    |
/// | [EulerGradusSuavitatis]        | `euler`             | 1     | more complex     |
/// | [TenneyHeight]                 | `tenney`            | 0     | more complex     |
/// | [VogelComplexity]              | `vogel`             | 1     | more complex     |
/// | [WilsonComplexity]             | `wilson`            | 1     | more complex     |
///
/// @see HarmonicityMetrics
public interface HarmonicityMetric {

    /// Returns the registry name of this metric.
    ///
    /// @return the metric name, e.g. "barlow"
    String getMetricName();

    /// Scores a factorized ratio.
    ///
    /// @param factors the split prime factorization
    /// @return the score
    double evaluate(RatioFactors factors);
}
