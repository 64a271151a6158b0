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
 * Martin Vogel's complexity: the sum of all odd prime factors plus one for
 * every factor 2, taken over numerator and denominator with multiplicity.
 */
@MetricName(VogelComplexity.METRIC_NAME)
public final class VogelComplexity implements HarmonicityMetric {

    public static final String METRIC_NAME = "vogel";

    @Override
    public String getMetricName() {
        return METRIC_NAME;
    }

    @Override
    public double evaluate(RatioFactors factors) {
        return complexity(factors);
    }

    public int complexity(RatioFactors factors) {
        int summed = 0;
        for (int factor : factors.getFactorised()) {
            summed += factor == 2 ? 1 : factor;
        }
        return summed;
    }
}
