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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Prime factorization of a ratio, split into numerator and denominator.
 *
 * <p>This is the common input of every harmonicity metric. Factors are kept as
 * prime to multiplicity maps, ascending by prime:
 *
 * <pre>{@code
 *   15/8  →  numerator {3=1, 5=1}   denominator {2=3}
 *   1/1   →  numerator {}           denominator {}
 * }</pre>
 *
 * <p>The flattened factor list of the unison is the single pseudo-factor
 * {@code 1}, which keeps Euler, Vogel and Wilson at 1 for 1/1.
 */
public final class RatioFactors {

    private final SortedMap<Integer, Integer> numeratorFactors;
    private final SortedMap<Integer, Integer> denominatorFactors;
    private final BigInteger numerator;
    private final BigInteger denominator;

    public RatioFactors(SortedMap<Integer, Integer> numeratorFactors,
                        SortedMap<Integer, Integer> denominatorFactors) {
        this.numeratorFactors = Collections.unmodifiableSortedMap(
            new TreeMap<>(Objects.requireNonNull(numeratorFactors, "numeratorFactors cannot be null")));
        this.denominatorFactors = Collections.unmodifiableSortedMap(
            new TreeMap<>(Objects.requireNonNull(denominatorFactors, "denominatorFactors cannot be null")));
        this.numerator = product(this.numeratorFactors);
        this.denominator = product(this.denominatorFactors);
    }

    /**
     * Reads the factorization directly off an exponent vector.
     *
     * @param vector the exponent vector
     * @param primes the prime sequence giving each position its prime
     * @return the split factorization
     */
    public static RatioFactors of(ExponentVector vector, PrimeSequence primes) {
        TreeMap<Integer, Integer> numerator = new TreeMap<>();
        TreeMap<Integer, Integer> denominator = new TreeMap<>();
        for (int i = 0; i < vector.size(); i++) {
            int exponent = vector.get(i);
            if (exponent > 0) {
                numerator.put(primes.primeAt(i), exponent);
            } else if (exponent < 0) {
                denominator.put(primes.primeAt(i), -exponent);
            }
        }
        return new RatioFactors(numerator, denominator);
    }

    /**
     * Factorizes a single positive integer as the numerator of {@code n/1}.
     *
     * @param value the integer
     * @param factorizer the factorizer to use
     * @return the factorization with an empty denominator
     */
    public static RatioFactors ofInteger(BigInteger value, PrimeFactorizer factorizer) {
        return new RatioFactors(factorizer.factorize(value), new TreeMap<>());
    }

    public SortedMap<Integer, Integer> getNumeratorFactors() {
        return numeratorFactors;
    }

    public SortedMap<Integer, Integer> getDenominatorFactors() {
        return denominatorFactors;
    }

    public BigInteger getNumerator() {
        return numerator;
    }

    public BigInteger getDenominator() {
        return denominator;
    }

    /** @return true for the ratio 1/1 */
    public boolean isUnison() {
        return numeratorFactors.isEmpty() && denominatorFactors.isEmpty();
    }

    /**
     * Returns all prime factors of numerator and denominator with multiplicity,
     * ascending by prime. The unison yields {@code [1]}.
     *
     * @return the flattened factor list
     */
    public List<Integer> getFactorised() {
        if (isUnison()) {
            return List.of(1);
        }
        TreeMap<Integer, Integer> combined = new TreeMap<>(numeratorFactors);
        denominatorFactors.forEach((prime, count) -> combined.merge(prime, count, Integer::sum));
        return flatten(combined);
    }

    /**
     * Returns the numerator factors with multiplicity. The unison yields {@code [1]}.
     *
     * @return the numerator factor list
     */
    public List<Integer> getNumeratorFactorList() {
        if (isUnison()) {
            return List.of(1);
        }
        return flatten(numeratorFactors);
    }

    /** @return the denominator factors with multiplicity */
    public List<Integer> getDenominatorFactorList() {
        return flatten(denominatorFactors);
    }

    private static List<Integer> flatten(Map<Integer, Integer> factors) {
        List<Integer> flattened = new ArrayList<>();
        factors.forEach((prime, count) -> {
            for (int i = 0; i < count; i++) {
                flattened.add(prime);
            }
        });
        return Collections.unmodifiableList(flattened);
    }

    private static BigInteger product(Map<Integer, Integer> factors) {
        BigInteger result = BigInteger.ONE;
        for (Map.Entry<Integer, Integer> entry : factors.entrySet()) {
            result = result.multiply(BigInteger.valueOf(entry.getKey()).pow(entry.getValue()));
        }
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RatioFactors)) return false;
        RatioFactors that = (RatioFactors) o;
        return numeratorFactors.equals(that.numeratorFactors)
            && denominatorFactors.equals(that.denominatorFactors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(numeratorFactors, denominatorFactors);
    }

    @Override
    public String toString() {
        return "RatioFactors{numerator=" + numeratorFactors + ", denominator=" + denominatorFactors + "}";
    }
}
