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

import java.util.Arrays;
import java.util.BitSet;
import java.util.List;
import java.util.stream.Collectors;

/// Ascending sequence of prime numbers backing the positions of an [ExponentVector].
///
/// ## Positional Indexing
///
/// Exponent vectors are positional: index 0 is prime 2, index 1 is prime 3,
/// index 2 is prime 5 and so on. This class answers both directions of that
/// mapping:
///
/// ```
///   index  │ 0 │ 1 │ 2 │ 3 │ 4  │ 5  │ 6  │ ...
///   ───────┼───┼───┼───┼───┼────┼────┼────┼────
///   prime  │ 2 │ 3 │ 5 │ 7 │ 11 │ 13 │ 17 │ ...
/// ```
///
/// ## Growth
///
/// Primes are produced by a sieve of Eratosthenes that starts small and doubles
/// its range on demand, up to a fixed ceiling. A prime above the ceiling cannot
/// be given a position and is reported with [PrimeLimitExceededException].
///
/// ## Thread Safety
///
/// Lookups read a published immutable array; growth is synchronized and
/// replaces that array atomically, so concurrent readers are safe.
public final class PrimeSequence {

    /// Default largest prime an exponent vector may reference.
    public static final int DEFAULT_PRIME_CEILING = 1 << 20;

    private static final int INITIAL_SIEVE_LIMIT = 1 << 10;

    private final int ceiling;
    private volatile int[] primes;
    private volatile int sievedUpTo;

    /// Creates a sequence limited to primes not larger than the given ceiling.
    ///
    /// @param ceiling the largest number the sieve may reach; must be at least 2
    /// @throws IllegalArgumentException if ceiling is smaller than 2
    public PrimeSequence(int ceiling) {
        if (ceiling < 2) {
            throw new IllegalArgumentException("Prime ceiling must be at least 2, got: " + ceiling);
        }
        this.ceiling = ceiling;
        int initial = Math.min(INITIAL_SIEVE_LIMIT, ceiling);
        this.primes = sieve(initial);
        this.sievedUpTo = initial;
    }

    /// @return the largest number this sequence will sieve
    public int getCeiling() {
        return ceiling;
    }

    /// Returns the prime at the given position.
    ///
    /// @param index zero-based position (0 → 2, 1 → 3, ...)
    /// @return the prime at that position
    /// @throws PrimeLimitExceededException if the position lies beyond the ceiling
    public int primeAt(int index) {
        if (index < 0) {
            throw new IndexOutOfBoundsException("Prime index must not be negative: " + index);
        }
        int[] current = primes;
        while (index >= current.length) {
            if (!grow()) {
                throw new PrimeLimitExceededException(
                    "Prime #" + index + " lies beyond the prime ceiling " + ceiling, ceiling);
            }
            current = primes;
        }
        return current[index];
    }

    /// Returns the position of a prime in the sequence.
    ///
    /// @param prime a prime number
    /// @return its zero-based position
    /// @throws IllegalArgumentException if the number is not prime
    /// @throws PrimeLimitExceededException if the prime is above the ceiling
    public int indexOf(long prime) {
        if (prime > ceiling) {
            throw new PrimeLimitExceededException(
                "Prime " + prime + " exceeds the prime ceiling " + ceiling, ceiling);
        }
        ensureSievedTo((int) prime);
        int index = Arrays.binarySearch(primes, (int) prime);
        if (index < 0) {
            throw new IllegalArgumentException(prime + " is not a prime number");
        }
        return index;
    }

    /// Returns whether the given position can be served without exceeding the ceiling.
    ///
    /// @param index zero-based prime position
    /// @return true if [#primeAt(int)] would succeed
    public boolean hasPrimeAt(int index) {
        int[] current = primes;
        while (index >= current.length) {
            if (!grow()) {
                return false;
            }
            current = primes;
        }
        return true;
    }

    /// Returns the first `count` primes in ascending order.
    ///
    /// @param count how many primes to return
    /// @return an immutable list of primes
    public List<Integer> firstPrimes(int count) {
        if (count > 0) {
            primeAt(count - 1);
        }
        return Arrays.stream(primes, 0, Math.max(count, 0))
            .boxed()
            .collect(Collectors.toUnmodifiableList());
    }

    private void ensureSievedTo(int value) {
        while (sievedUpTo < value) {
            if (!grow()) {
                return;
            }
        }
    }

    private synchronized boolean grow() {
        if (sievedUpTo >= ceiling) {
            return false;
        }
        int next = (int) Math.min((long) sievedUpTo * 2L, ceiling);
        primes = sieve(next);
        sievedUpTo = next;
        return true;
    }

    private static int[] sieve(int limit) {
        BitSet composite = new BitSet(limit + 1);
        for (int i = 2; (long) i * i <= limit; i++) {
            if (!composite.get(i)) {
                for (int j = i * i; j <= limit; j += i) {
                    composite.set(j);
                }
            }
        }
        int[] found = new int[limit + 1 - composite.cardinality()];
        int count = 0;
        for (int i = 2; i <= limit; i++) {
            if (!composite.get(i)) {
                found[count++] = i;
            }
        }
        return Arrays.copyOf(found, count);
    }
}
