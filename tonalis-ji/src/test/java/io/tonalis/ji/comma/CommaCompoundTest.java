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
import org.apache.commons.math3.fraction.BigFraction;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class CommaCompoundTest {

    private static final PrimeSequence PRIMES = new PrimeSequence(PrimeSequence.DEFAULT_PRIME_CEILING);

    @Test
    void collectsOneCommaPowerPerHigherPrime() {
        // 11/10
        CommaCompound compound = CommaCompound.of(
            ExponentVector.of(-1, 0, -1, 0, 1), PRIMES, PrimeCommaTable.HELMHOLTZ_ELLIS);

        assertEquals(Map.of(5, -1, 11, 1), compound.getPrimeToExponent());
        assertEquals(new BigFraction(2673, 2560), compound.getRatio());
        assertEquals(2, compound.size());
    }

    @Test
    void iteratesPoweredCommasInPrimeOrder() {
        CommaCompound compound = new CommaCompound(Map.of(7, 1, 5, -2), PrimeCommaTable.HELMHOLTZ_ELLIS);

        List<BigFraction> powered = new ArrayList<>();
        compound.forEach(powered::add);

        assertEquals(List.of(new BigFraction(6561, 6400), new BigFraction(63, 64)), powered);
        assertEquals(3, compound.size());
    }

    @Test
    void dropsLowPrimesAndZeroExponents() {
        CommaCompound compound = new CommaCompound(Map.of(2, 4, 3, -1, 5, 0), PrimeCommaTable.HELMHOLTZ_ELLIS);

        assertTrue(compound.isEmpty());
        assertEquals(0, compound.size());
        assertEquals(BigFraction.ONE, compound.getRatio());
    }

    @Test
    void pythagoreanPitchesHaveNoCommas() {
        assertTrue(CommaCompound.of(ExponentVector.of(-6, 4), PRIMES, PrimeCommaTable.HELMHOLTZ_ELLIS).isEmpty());
    }

    @Test
    void primesMissingFromTheTableAreRejected() {
        int[] exponents = new int[16];
        exponents[15] = 1;

        assertThrows(IllegalArgumentException.class,
            () -> CommaCompound.of(ExponentVector.of(exponents), PRIMES, PrimeCommaTable.HELMHOLTZ_ELLIS));
    }

    @Test
    void describesItself() {
        CommaCompound compound = new CommaCompound(Map.of(5, 1), PrimeCommaTable.HELMHOLTZ_ELLIS);
        assertThat(compound.toString()).contains("80/81");
    }
}
