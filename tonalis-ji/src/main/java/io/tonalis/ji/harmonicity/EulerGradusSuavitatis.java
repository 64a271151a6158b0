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
 * Euler's "gradus suavitatis" (degree of sweetness).
 *
 * <pre>{@code
 *   Γ(n/d) = 1 + Σ k·(p − 1)   over all prime powers p^k of n·d
 * }</pre>
 *
 * <p>A higher number means a less consonant interval. Γ(1/1) = 1, Γ(3/2) = 4,
 * Γ(5/4) = 7, Γ(8/5) = 8.
 */
@MetricName(EulerGradusSuavitatis.METRIC_NAME)
public final class EulerGradusSuavitatis implements HarmonicityMetric {

    public static final String METRIC_NAME = "euler";

    @Override
    public String getMetricName() {
        return METRIC_NAME;
    }

    @Override
    public double evaluate(RatioFactors factors) {
        return gradus(factors);
    }

    /**
     * @param factors the split prime factorization
     * @return the gradus suavitatis as an integer
     */
    public int gradus(RatioFactors factors) {
        int gradus = 1;
        for (int factor : factors.getFactorised()) {
            gradus += factor - 1;
        }
        return gradus;
    }
}
