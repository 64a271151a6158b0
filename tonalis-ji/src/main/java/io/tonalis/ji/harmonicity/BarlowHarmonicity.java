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

/**
 * Barlow harmonicity of an interval.
 *
 * <p>Follows Clarence Barlow's definition from "The Ratio Book" (1992):
 *
 * <pre>{@code
 *   H(n/d) = sgn(ξ(n) − ξ(d)) / (ξ(n) + ξ(d))
 * }</pre>
 *
 * <p>where ξ is the {@link Indigestibility}. A higher absolute value means a more
 * harmonic interval; the sign is negative when the denominator is the more
 * indigestible term. The unison 1/1 is infinitely harmonic.
 *
 * <ul>
 *   <li>3/2 → 0.27272727272727276</li>
 *   <li>5/4 → 0.11904761904761904</li>
 *   <li>8/5 → -0.10638297872340426</li>
 * </ul>
 */
@MetricName(BarlowHarmonicity.METRIC_NAME)
public final class BarlowHarmonicity implements HarmonicityMetric {

    public static final String METRIC_NAME = "barlow";

    @Override
    public String getMetricName() {
        return METRIC_NAME;
    }

    @Override
    public double evaluate(RatioFactors factors) {
        double numerator = Indigestibility.ofFactors(factors.getNumeratorFactors());
        double denominator = Indigestibility.ofFactors(factors.getDenominatorFactors());
        if (numerator == 0 && denominator == 0) {
            return Double.POSITIVE_INFINITY;
        }
        int sign = numerator - denominator < 0 ? -1 : 1;
        return sign / (numerator + denominator);
    }
}
