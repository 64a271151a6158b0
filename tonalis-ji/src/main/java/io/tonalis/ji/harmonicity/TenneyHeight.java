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

import java.math.BigInteger;

/**
 * Tenney height: {@code log2(n·d)} of a reduced ratio {@code n/d}.
 *
 * <p>A higher number means a more complex interval; the unison has height 0.
 */
@MetricName(TenneyHeight.METRIC_NAME)
public final class TenneyHeight implements HarmonicityMetric {

    public static final String METRIC_NAME = "tenney";

    private static final double LOG_2 = Math.log(2);

    @Override
    public String getMetricName() {
        return METRIC_NAME;
    }

    @Override
    public double evaluate(RatioFactors factors) {
        return log2(factors.getNumerator().multiply(factors.getDenominator()));
    }

    static double log2(BigInteger value) {
        int excessBits = value.bitLength() - 1000;
        if (excessBits <= 0) {
            return Math.log(value.doubleValue()) / LOG_2;
        }
        // shift into double range, then add the shifted octaves back
        return Math.log(value.shiftRight(excessBits).doubleValue()) / LOG_2 + excessBits;
    }
}
