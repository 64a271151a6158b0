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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class PrimeSequenceTest {

    @Test
    void positionsMapToAscendingPrimes() {
        PrimeSequence primes = new PrimeSequence(PrimeSequence.DEFAULT_PRIME_CEILING);

        assertEquals(2, primes.primeAt(0));
        assertEquals(3, primes.primeAt(1));
        assertEquals(11, primes.primeAt(4));
        assertEquals(4, primes.indexOf(11));
        assertEquals(List.of(2, 3, 5, 7, 11), primes.firstPrimes(5));
        assertEquals(List.of(), primes.firstPrimes(0));
    }

    @Test
    void sieveGrowsOnDemand() {
        PrimeSequence primes = new PrimeSequence(PrimeSequence.DEFAULT_PRIME_CEILING);

        assertEquals(7919, primes.primeAt(999));
        assertEquals(999, primes.indexOf(7919));
    }

    @Test
    void compositesHaveNoPosition() {
        PrimeSequence primes = new PrimeSequence(1000);
        assertThrows(IllegalArgumentException.class, () -> primes.indexOf(9));
        assertThrows(IllegalArgumentException.class, () -> primes.indexOf(1));
    }

    @Test
    void ceilingLimitsThePositions() {
        PrimeSequence primes = new PrimeSequence(30);

        assertEquals(30, primes.getCeiling());
        assertEquals(29, primes.primeAt(9));
        assertTrue(primes.hasPrimeAt(9));
        assertFalse(primes.hasPrimeAt(10));
        PrimeLimitExceededException e = assertThrows(PrimeLimitExceededException.class, () -> primes.primeAt(10));
        assertEquals(30, e.getPrimeCeiling());
        assertThrows(PrimeLimitExceededException.class, () -> primes.indexOf(31));
    }

    @Test
    void ceilingMustAllowAtLeastOnePrime() {
        assertThrows(IllegalArgumentException.class, () -> new PrimeSequence(1));
    }
}
