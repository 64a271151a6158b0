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

import io.tonalis.ji.ratio.ExponentVector;
import io.tonalis.ji.ratio.PrimeSequence;
import io.tonalis.ji.ratio.RatioCodec;
import org.apache.commons.math3.fraction.BigFraction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/// A frozen product of commas, one power per prime above 3.
///
/// ```
///   11/10 = (−1, 0, −1, 0, 1)
///   commas: 5 → (80/81)^−1, 11 → (33/32)^1
///   ratio : 81/80 · 33/32 = 2673/2560
/// ```
///
/// Iterating yields each comma ratio raised to its exponent, in ascending prime
/// order. The empty compound has the ratio 1/1.
public final class CommaCompound implements Iterable<BigFraction> {

    private final SortedMap<Integer, Integer> primeToExponent;
    private final PrimeCommaTable table;

    /// @param primeToExponent prime to comma exponent; primes 2 and 3 and zero
    ///     exponents are dropped
    /// @param table commas to use for each prime
    /// @throws IllegalArgumentException if the table lacks a prime
    public CommaCompound(Map<Integer, Integer> primeToExponent, PrimeCommaTable table) {
        Objects.requireNonNull(primeToExponent, "primeToExponent cannot be null");
        this.table = Objects.requireNonNull(table, "table cannot be null");
        SortedMap<Integer, Integer> kept = new TreeMap<>();
        primeToExponent.forEach((prime, exponent) -> {
            if (prime != 2 && prime != 3 && exponent != 0) {
                table.get(prime);
                kept.put(prime, exponent);
            }
        });
        this.primeToExponent = Collections.unmodifiableSortedMap(kept);
    }

    /// Collects the commas needed to notate every prime above 3 that occurs in
    /// an exponent vector.
    ///
    /// @param vector exponent vector of a pitch
    /// @param primes prime sequence the vector is indexed by
    /// @param table commas to use for each prime
    /// @return the compound
    public static CommaCompound of(ExponentVector vector, PrimeSequence primes, PrimeCommaTable table) {
        SortedMap<Integer, Integer> exponents = new TreeMap<>();
        for (int i = 2; i < vector.size(); i++) {
            exponents.put(primes.primeAt(i), vector.get(i));
        }
        return new CommaCompound(exponents, table);
    }

    public SortedMap<Integer, Integer> getPrimeToExponent() {
        return primeToExponent;
    }

    public PrimeCommaTable getTable() {
        return table;
    }

    /// @return the product of all powered commas, 1/1 when empty
    public BigFraction getRatio() {
        BigFraction ratio = BigFraction.ONE;
        for (BigFraction powered : this) {
            ratio = ratio.multiply(powered);
        }
        return ratio;
    }

    /// @return the number of commas, counting each power separately
    public int size() {
        int size = 0;
        for (int exponent : primeToExponent.values()) {
            size += Math.abs(exponent);
        }
        return size;
    }

    public boolean isEmpty() {
        return primeToExponent.isEmpty();
    }

    @Override
    public Iterator<BigFraction> iterator() {
        List<BigFraction> powered = new ArrayList<>(primeToExponent.size());
        primeToExponent.forEach((prime, exponent) ->
            powered.add(table.get(prime).getRatio().pow(exponent)));
        return Collections.unmodifiableList(powered).iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CommaCompound)) return false;
        CommaCompound that = (CommaCompound) o;
        return primeToExponent.equals(that.primeToExponent) && table.equals(that.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(primeToExponent, table);
    }

    @Override
    public String toString() {
        return "CommaCompound" + primeToExponent + " = " + RatioCodec.format(getRatio());
    }
}
