package io.tonalis.ji.ratio;

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

import java.math.BigInteger;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Trial-division prime factorization bounded by a {@link PrimeSequence}.
 *
 * <p>Candidate divisors are taken from the sequence in ascending order until the
 * square of the candidate exceeds the remaining cofactor. A remaining cofactor
 * above the prime ceiling must contain a prime outside the sequence, so it is
 * rejected instead of being searched further.
 *
 * <p>Values that fit into a {@code long} are factored with primitive arithmetic;
 * larger values fall back to {@link BigInteger} division.
 */
public final class PrimeFactorizer {

    private static final BigInteger LONG_LIMIT = BigInteger.valueOf(Long.MAX_VALUE);

    private final PrimeSequence primes;

    public PrimeFactorizer(PrimeSequence primes) {
        this.primes = Objects.requireNonNull(primes, "primes cannot be null");
    }

    /**
     * Factorizes a positive integer.
     *
     * @param value the value to factor; 1 yields an empty map
     * @return prime to multiplicity, ascending by prime
     * @throws IllegalArgumentException if the value is not positive
     * @throws PrimeLimitExceededException if a factor lies above the prime ceiling
     */
    public SortedMap<Integer, Integer> factorize(BigInteger value) {
        Objects.requireNonNull(value, "value cannot be null");
        if (value.signum() <= 0) {
            throw new IllegalArgumentException("Only positive integers can be factorized, got: " + value);
        }
        if (value.compareTo(LONG_LIMIT) <= 0) {
            return factorize(value.longValue());
        }
        TreeMap<Integer, Integer> factors = new TreeMap<>();
        BigInteger remaining = value;
        int index = 0;
        while (remaining.bitLength() > 62 && primes.hasPrimeAt(index)) {
            int prime = primes.primeAt(index++);
            BigInteger divisor = BigInteger.valueOf(prime);
            BigInteger[] qr = remaining.divideAndRemainder(divisor);
            while (qr[1].signum() == 0) {
                factors.merge(prime, 1, Integer::sum);
                remaining = qr[0];
                qr = remaining.divideAndRemainder(divisor);
            }
        }
        if (remaining.bitLength() > 62) {
            throw new PrimeLimitExceededException(
                "Cofactor " + remaining + " of " + value + " has prime factors above the ceiling "
                    + primes.getCeiling(), primes.getCeiling());
        }
        factorize(remaining.longValue()).forEach((p, e) -> factors.merge(p, e, Integer::sum));
        return Collections.unmodifiableSortedMap(factors);
    }

    /**
     * Factorizes a positive long.
     *
     * @param value the value to factor; 1 yields an empty map
     * @return prime to multiplicity, ascending by prime
     */
    public SortedMap<Integer, Integer> factorize(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Only positive integers can be factorized, got: " + value);
        }
        TreeMap<Integer, Integer> factors = new TreeMap<>();
        long remaining = value;
        int index = 0;
        while (remaining > 1 && primes.hasPrimeAt(index)) {
            long prime = primes.primeAt(index++);
            if (prime * prime > remaining) {
                break;
            }
            while (remaining % prime == 0) {
                factors.merge((int) prime, 1, Integer::sum);
                remaining /= prime;
            }
        }
        if (remaining > 1) {
            // every prime up to min(sqrt(remaining), ceiling) has been divided out
            if (remaining > primes.getCeiling()) {
                throw new PrimeLimitExceededException(
                    "Factor " + remaining + " of " + value + " exceeds the prime ceiling "
                        + primes.getCeiling(), primes.getCeiling());
            }
            factors.merge((int) remaining, 1, Integer::sum);
        }
        return Collections.unmodifiableSortedMap(factors);
    }

    public PrimeSequence getPrimes() {
        return primes;
    }
}
