package io.tonalis.ji.comma;

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

import io.tonalis.ji.ratio.RatioCodec;
import org.apache.commons.math3.fraction.BigFraction;
import org.apache.commons.math3.primes.Primes;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/// Immutable mapping from prime numbers above 3 to the [Comma] that notates them.
///
/// ## Comma Invariant
///
/// Every comma must notate exactly its own prime: after removing the factors 2
/// and 3, the only prime left in the comma is its key, with exponent +1 (in the
/// numerator). For example 7 → 63/64 is valid (63 = 3²·7), while 7 → 64/63 or
/// 7 → 80/81 is rejected.
///
/// ## Default Table
///
/// [#HELMHOLTZ_ELLIS] holds the commas of the Helmholtz-Ellis just intonation
/// notation for the primes 5 to 47:
///
/// | Prime | Comma     | Prime | Comma     |
/// |-------|-----------|-------|-----------|
/// | 5     | 80/81     | 29    | 261/256   |
/// | 7     | 63/64     | 31    | 31/32     |
/// | 11    | 33/32     | 37    | 37/36     |
/// | 13    | 26/27     | 41    | 82/81     |
/// | 17    | 2176/2187 | 43    | 129/128   |
/// | 19    | 513/512   | 47    | 752/729   |
/// | 23    | 736/729   |       |           |
public final class PrimeCommaTable {

    public static final PrimeCommaTable HELMHOLTZ_ELLIS = builder()
        .put(5, "80/81")
        .put(7, "63/64")
        .put(11, "33/32")
        .put(13, "26/27")
        .put(17, "2176/2187")
        .put(19, "513/512")
        .put(23, "736/729")
        .put(29, "261/256")
        .put(31, "31/32")
        .put(37, "37/36")
        .put(41, "82/81")
        .put(43, "129/128")
        .put(47, "752/729")
        .build();

    private final SortedMap<Integer, Comma> commas;

    private PrimeCommaTable(SortedMap<Integer, Comma> commas) {
        this.commas = Collections.unmodifiableSortedMap(commas);
    }

    /// Creates a validated table.
    ///
    /// @param commas prime to comma
    /// @return the table
    /// @throws IllegalArgumentException if a key is not a prime above 3 or a
    ///     comma does not notate its own prime
    public static PrimeCommaTable of(Map<Integer, Comma> commas) {
        Objects.requireNonNull(commas, "commas cannot be null");
        SortedMap<Integer, Comma> sorted = new TreeMap<>();
        for (Map.Entry<Integer, Comma> entry : commas.entrySet()) {
            validate(entry.getKey(), entry.getValue());
            sorted.put(entry.getKey(), entry.getValue());
        }
        return new PrimeCommaTable(sorted);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @param prime a prime above 3
    /// @return the comma for that prime
    /// @throws IllegalArgumentException if the table has no comma for the prime
    public Comma get(int prime) {
        Comma comma = commas.get(prime);
        if (comma == null) {
            throw new IllegalArgumentException(
                "No comma defined for prime " + prime + ", known primes: " + commas.keySet());
        }
        return comma;
    }

    public boolean contains(int prime) {
        return commas.containsKey(prime);
    }

    /// @return the notated primes in ascending order
    public SortedSet<Integer> primes() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(commas.keySet()));
    }

    public SortedMap<Integer, Comma> asMap() {
        return commas;
    }

    public int size() {
        return commas.size();
    }

    /// Returns a copy of this table with one comma added or replaced.
    ///
    /// @param prime a prime above 3
    /// @param comma the comma notating it
    /// @return the new table
    public PrimeCommaTable with(int prime, Comma comma) {
        validate(prime, comma);
        SortedMap<Integer, Comma> copy = new TreeMap<>(commas);
        copy.put(prime, comma);
        return new PrimeCommaTable(copy);
    }

    private static void validate(Integer prime, Comma comma) {
        Objects.requireNonNull(prime, "prime cannot be null");
        Objects.requireNonNull(comma, "comma cannot be null for prime " + prime);
        if (prime < 5 || !Primes.isPrime(prime)) {
            throw new IllegalArgumentException("Comma keys must be primes above 3, got: " + prime);
        }
        BigFraction ratio = comma.getRatio();
        Map<Integer, Integer> exponents = new HashMap<>();
        accumulate(exponents, ratio.getNumerator(), 1, prime);
        accumulate(exponents, ratio.getDenominator(), -1, prime);
        exponents.remove(2);
        exponents.remove(3);
        exponents.values().removeIf(exponent -> exponent == 0);
        if (!exponents.equals(Map.of(prime, 1))) {
            throw new IllegalArgumentException(
                "Comma " + RatioCodec.format(ratio) + " does not notate prime " + prime
                    + ", its prime exponents beyond 3 are " + exponents);
        }
    }

    private static void accumulate(Map<Integer, Integer> exponents, BigInteger term, int sign, int prime) {
        if (term.equals(BigInteger.ONE)) {
            return;
        }
        if (term.bitLength() > 31) {
            throw new IllegalArgumentException(
                "Comma term " + term + " for prime " + prime + " is too large");
        }
        List<Integer> factors = Primes.primeFactors(term.intValue());
        for (int factor : factors) {
            exponents.merge(factor, sign, Integer::sum);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrimeCommaTable)) return false;
        return commas.equals(((PrimeCommaTable) o).commas);
    }

    @Override
    public int hashCode() {
        return commas.hashCode();
    }

    @Override
    public String toString() {
        return "PrimeCommaTable" + commas;
    }

    /// Collects commas by prime and validates them on [#build()].
    public static final class Builder {
        private final Map<Integer, Comma> commas = new TreeMap<>();

        private Builder() {
        }

        public Builder put(int prime, Comma comma) {
            commas.put(prime, comma);
            return this;
        }

        public Builder put(int prime, String ratio) {
            return put(prime, Comma.of(ratio));
        }

        public Builder putAll(PrimeCommaTable table) {
            commas.putAll(table.asMap());
            return this;
        }

        public PrimeCommaTable build() {
            return PrimeCommaTable.of(commas);
        }
    }
}
