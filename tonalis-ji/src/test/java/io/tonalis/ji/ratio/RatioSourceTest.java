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

import org.apache.commons.math3.fraction.BigFraction;
import org.apache.commons.math3.fraction.Fraction;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class RatioSourceTest {

    @Test
    void adaptsTextAndFractions() {
        assertEquals(new RatioSource.RatioLiteral("3/2"), RatioSource.from("3/2"));
        assertEquals(new RatioSource.FractionValue(new BigFraction(3, 2)), RatioSource.from(new BigFraction(3, 2)));
        assertEquals(new RatioSource.FractionValue(new BigFraction(3, 2)), RatioSource.from(new Fraction(3, 2)));
        assertEquals(new RatioSource.FractionValue(new BigFraction(7)), RatioSource.from(7));
        assertEquals(new RatioSource.FractionValue(new BigFraction(7)), RatioSource.from(BigInteger.valueOf(7)));
    }

    @Test
    void adaptsExponentSequences() {
        RatioSource expected = new RatioSource.ExponentSequence(ExponentVector.of(-1, 1));

        assertEquals(expected, RatioSource.from(new int[]{-1, 1}));
        assertEquals(expected, RatioSource.from(List.of(-1, 1)));
        assertEquals(expected, RatioSource.from(ExponentVector.of(-1, 1)));
        assertEquals(expected, RatioSource.exponents(-1, 1, 0));
    }

    @Test
    void passesRatioSourcesThrough() {
        RatioSource source = RatioSource.literal("5/4");
        assertSame(source, RatioSource.from(source));
    }

    @Test
    void rejectsUnsupportedTypes() {
        UnsupportedRatioSourceException e = assertThrows(UnsupportedRatioSourceException.class,
            () -> RatioSource.from(1.5));
        assertEquals(Double.class, e.getRejectedType());
        assertThat(e).hasMessageContaining("java.lang.Double");

        assertThrows(UnsupportedRatioSourceException.class, () -> RatioSource.from(List.of(1, 2.5)));
        assertNull(assertThrows(UnsupportedRatioSourceException.class, () -> RatioSource.from(null)).getRejectedType());
    }

    @Test
    void literalRejectsNullText() {
        assertThrows(RatioParseException.class, () -> new RatioSource.RatioLiteral(null));
    }
}
