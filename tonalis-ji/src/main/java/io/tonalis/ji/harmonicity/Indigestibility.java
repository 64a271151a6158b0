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

import io.tonalis.ji.config.TuningConfiguration;
import io.tonalis.ji.ratio.PrimeFactorizer;

import java.math.BigInteger;
import java.util.Map;

/// Clarence Barlow's indigestibility of integers, as defined in "The Ratio Book" (1992).
///
/// For a prime power `p^k` the indigestibility is `2·k·(p−1)²/p`; a composite
/// integer sums the contributions of its prime factors:
///
/// ```
///   ξ(1) = 0
///   ξ(2) = 1.0
///   ξ(3) = 2.6666666666666665
///   ξ(6) = ξ(2) + ξ(3) = 3.6666666666666665
/// ```
public final class Indigestibility {

    private Indigestibility() {
    }

    /// @param value a positive integer
    /// @return its indigestibility
    public static double of(long value) {
        return of(BigInteger.valueOf(value), TuningConfiguration.current().getCodec().getFactorizer());
    }

    /// @param value a positive integer
    /// @param factorizer factorizer bound to the active prime sequence
    /// @return its indigestibility
    public static double of(BigInteger value, PrimeFactorizer factorizer) {
        return ofFactors(factorizer.factorize(value));
    }

    /// Sums the indigestibility of already factorized primes.
    ///
    /// @param factors prime to multiplicity; the pseudo-prime 1 contributes nothing
    /// @return the indigestibility
    public static double ofFactors(Map<Integer, Integer> factors) {
        double summed = 0;
        for (Map.Entry<Integer, Integer> entry : factors.entrySet()) {
            long prime = entry.getKey();
            long power = entry.getValue();
            summed += (double) (power * (prime - 1) * (prime - 1)) / prime;
        }
        return 2 * summed;
    }
}
