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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class DiatonicSpellingTest {

    @Test
    void walksTheCycleOfFifths() {
        assertEquals("g", DiatonicSpelling.spell("c", 1));
        assertEquals("f", DiatonicSpelling.spell("c", -1));
        assertEquals("fs", DiatonicSpelling.spell("b", 1));
        assertEquals("bf", DiatonicSpelling.spell("f", -1));
        assertEquals("cs", DiatonicSpelling.spell("c", 7));
        assertEquals("cf", DiatonicSpelling.spell("c", -7));
        assertEquals("c", DiatonicSpelling.spell("c", 0));
    }

    @Test
    void keepsReferenceAccidentals() {
        assertEquals("f", DiatonicSpelling.spell("bf", 1));
        assertEquals("ef", DiatonicSpelling.spell("bf", -1));
        assertEquals("gss", DiatonicSpelling.spell("gs", 7));
    }

    @Test
    void countsAccidentals() {
        assertEquals(2, DiatonicSpelling.countAccidentals("ss"));
        assertEquals(-1, DiatonicSpelling.countAccidentals("f"));
        assertEquals(0, DiatonicSpelling.countAccidentals("sf"));
        assertEquals(1, DiatonicSpelling.countAccidentals("s#"));
        assertEquals("sss", DiatonicSpelling.accidentals(3));
        assertEquals("ff", DiatonicSpelling.accidentals(-2));
        assertEquals("", DiatonicSpelling.accidentals(0));
    }

    @Test
    void rejectsUnknownLetters() {
        assertThatThrownBy(() -> DiatonicSpelling.spell("h", 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("'h'");
        assertThrows(IllegalArgumentException.class, () -> DiatonicSpelling.spell("", 1));
        assertEquals(3, DiatonicSpelling.positionInCycleOfFifths("d"));
    }
}
