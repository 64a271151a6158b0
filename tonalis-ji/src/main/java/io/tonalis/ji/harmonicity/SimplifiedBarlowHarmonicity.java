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
 * Barlow harmonicity folded to a finite, non-negative range: the absolute
 * value of {@link BarlowHarmonicity}, with the unison mapped to 1 instead of
 * infinity.
 */
@MetricName(SimplifiedBarlowHarmonicity.METRIC_NAME)
public final class SimplifiedBarlowHarmonicity implements HarmonicityMetric {

    public static final String METRIC_NAME = "simplified_barlow";

    private final BarlowHarmonicity barlow = new BarlowHarmonicity();

    @Override
    public String getMetricName() {
        return METRIC_NAME;
    }

    @Override
    public double evaluate(RatioFactors factors) {
        double harmonicity = Math.abs(barlow.evaluate(factors));
        if (Double.isInfinite(harmonicity)) {
            return 1;
        }
        return harmonicity;
    }
}
