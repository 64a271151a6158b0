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

import io.tonalis.ji.ratio.PrimeFactorizer;
import io.tonalis.ji.ratio.PrimeSequence;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class IndigestibilityTest {

    @ParameterizedTest
    @CsvSource({
        "1, 0.0",
        "2, 1.0",
        "3, 2.6666666666666665",
        "4, 2.0",
        "5, 6.4",
        "6, 3.6666666666666665",
        "8, 3.0"
    })
    void matchesBarlowsReferenceValues(long value, double expected) {
        assertEquals(expected, Indigestibility.of(value));
    }

    @Test
    void sumsPrimePowerContributions() {
        // 2·(2·1/2 + 1·16/5)
        assertEquals(8.4, Indigestibility.ofFactors(Map.of(2, 2, 5, 1)), 1e-12);
        assertEquals(0.0, Indigestibility.ofFactors(Map.of()));
    }

    @Test
    void usesTheGivenFactorizer() {
        PrimeFactorizer factorizer = new PrimeFactorizer(new PrimeSequence(1000));
        assertEquals(Indigestibility.of(45), Indigestibility.of(BigInteger.valueOf(45), factorizer));
    }
}
