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

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class ExponentVectorTest {

    @Test
    void trailingZerosAreTrimmed() {
        assertEquals(ExponentVector.of(1, 0, -1), ExponentVector.of(1, 0, -1, 0));
        assertArrayEquals(new int[]{1, 0, -1}, ExponentVector.of(1, 0, -1, 0).toArray());
        assertTrue(ExponentVector.of(0, 0, 0).isEmpty());
        assertSame(ExponentVector.empty(), ExponentVector.of());
        assertArrayEquals(new int[0], ExponentVector.trim(new int[0]));
    }

    @Test
    void listFactoryMatchesArrayFactory() {
        assertEquals(ExponentVector.of(-1, 1), ExponentVector.of(List.of(-1, 1, 0)));
        assertEquals(List.of(-1, 1), ExponentVector.of(-1, 1).toList());
    }

    @Test
    void padDoesNotModifyOperands() {
        ExponentVector shorter = ExponentVector.of(1);
        ExponentVector longer = ExponentVector.of(0, 0, 2);

        int[][] padded = ExponentVector.pad(shorter, longer);

        assertArrayEquals(new int[]{1, 0, 0}, padded[0]);
        assertArrayEquals(new int[]{0, 0, 2}, padded[1]);
        assertEquals(1, shorter.size());
    }

    @Test
    void arithmeticPadsAndTrims() {
        ExponentVector fifth = ExponentVector.of(-1, 1);
        ExponentVector third = ExponentVector.of(-2, 0, 1);

        assertEquals(ExponentVector.of(-3, 1, 1), fifth.add(third));
        assertEquals(ExponentVector.of(1, 1, -1), fifth.subtract(third));
        assertEquals(ExponentVector.of(1, -1), fifth.negate());
        assertTrue(fifth.subtract(fifth).isEmpty());
    }

    @Test
    void getBeyondTheEndIsZero() {
        ExponentVector vector = ExponentVector.of(3, -2);
        assertEquals(-2, vector.get(1));
        assertEquals(0, vector.get(7));
    }

    @Test
    void intersectionKeepsSharedSameSignExponents() {
        ExponentVector fiveThirds = ExponentVector.of(0, -1, 1);
        ExponentVector sevenSixths = ExponentVector.of(-1, -1, 0, 1);
        assertEquals(ExponentVector.of(0, -1), fiveThirds.intersect(sevenSixths, false));

        assertEquals(ExponentVector.of(0, 2), ExponentVector.of(0, 3).intersect(ExponentVector.of(0, 2), false));
        assertTrue(ExponentVector.of(0, 3).intersect(ExponentVector.of(0, 2), true).isEmpty());
        assertTrue(ExponentVector.of(2).intersect(ExponentVector.of(-2), false).isEmpty());
    }

    @Test
    void extremaAndLookup() {
        ExponentVector vector = ExponentVector.of(0, -2, 0, 0, 1);
        assertEquals(1, vector.max());
        assertEquals(-2, vector.min());
        assertEquals(1, vector.indexOf(-2));
        assertEquals(-1, vector.indexOf(5));
        assertEquals(0, ExponentVector.empty().max());
    }

    @Test
    void toStringListsExponents() {
        assertThat(ExponentVector.of(-1, 1)).hasToString("(-1, 1)");
        assertThat(ExponentVector.empty()).hasToString("()");
    }

    @Test
    void exponentOverflowIsReported() {
        ExponentVector largest = ExponentVector.of(Integer.MAX_VALUE);
        ExponentVector smallest = ExponentVector.of(0, Integer.MIN_VALUE);

        assertThrows(ArithmeticException.class, () -> largest.add(ExponentVector.of(1)));
        assertThrows(ArithmeticException.class, () -> smallest.subtract(ExponentVector.of(0, 1)));
        assertThrows(ArithmeticException.class, smallest::negate);
        assertEquals(ExponentVector.of(-Integer.MAX_VALUE), largest.negate());
    }
}
