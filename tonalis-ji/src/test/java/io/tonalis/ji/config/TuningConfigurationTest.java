package io.tonalis.ji.config;

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

import io.tonalis.ji.JustIntonationPitch;
import io.tonalis.ji.comma.Comma;
import io.tonalis.ji.comma.PrimeCommaTable;
import io.tonalis.ji.ratio.PrimeSequence;
import io.tonalis.ji.ratio.RatioSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class TuningConfigurationTest {

    @AfterEach
    void restoreDefaults() {
        TuningConfiguration.install(TuningConfiguration.defaults());
    }

    @Test
    void builtInDefaults() {
        TuningConfiguration defaults = TuningConfiguration.defaults();

        assertEquals(440.0, defaults.getConcertPitch());
        assertEquals(PrimeCommaTable.HELMHOLTZ_ELLIS, defaults.getPrimeCommaTable());
        assertEquals(PrimeSequence.DEFAULT_PRIME_CEILING, defaults.getPrimeCeiling());
        assertSame(defaults, TuningConfiguration.current());
    }

    @Test
    void readsProperties(@TempDir Path tempDir) throws IOException {
        Path commas = tempDir.resolve("commas.json");
        Files.writeString(commas, "{\"5\": \"5/4\"}", StandardCharsets.UTF_8);

        Properties properties = new Properties();
        properties.setProperty(TuningConfiguration.CONCERT_PITCH_PROPERTY, "432");
        properties.setProperty(TuningConfiguration.PRIME_CEILING_PROPERTY, " 1000 ");
        properties.setProperty(TuningConfiguration.COMMA_TABLE_PROPERTY, commas.toString());

        TuningConfiguration configuration = TuningConfiguration.fromProperties(properties);

        assertEquals(432.0, configuration.getConcertPitch());
        assertEquals(1000, configuration.getPrimeCeiling());
        assertEquals(Comma.of("5/4"), configuration.getPrimeCommaTable().get(5));
        assertEquals(1, configuration.getPrimeCommaTable().size());
    }

    @Test
    void unreadablePropertiesKeepTheDefaults(@TempDir Path tempDir) {
        Properties properties = new Properties();
        properties.setProperty(TuningConfiguration.CONCERT_PITCH_PROPERTY, "concert");
        properties.setProperty(TuningConfiguration.PRIME_CEILING_PROPERTY, "1");
        properties.setProperty(TuningConfiguration.COMMA_TABLE_PROPERTY, tempDir.resolve("missing.json").toString());

        assertEquals(TuningConfiguration.defaults(), TuningConfiguration.fromProperties(properties));
    }

    @Test
    void negativeConcertPitchIsIgnored() {
        Properties properties = new Properties();
        properties.setProperty(TuningConfiguration.CONCERT_PITCH_PROPERTY, "-440");

        assertEquals(440.0, TuningConfiguration.fromProperties(properties).getConcertPitch());
    }

    @Test
    void emptyPropertiesGiveTheDefaults() {
        assertEquals(TuningConfiguration.defaults(), TuningConfiguration.fromProperties(new Properties()));
    }

    @Test
    void installedConfigurationReachesNewPitches() {
        TuningConfiguration baroque = TuningConfiguration.defaults().withConcertPitch(415.0);

        TuningConfiguration previous = TuningConfiguration.install(baroque);

        assertSame(TuningConfiguration.defaults(), previous);
        assertSame(baroque, TuningConfiguration.current());
        assertEquals(622.5, new JustIntonationPitch("3/2").getFrequency(), 1e-9);
    }

    @Test
    void withersReturnNewValues() {
        TuningConfiguration defaults = TuningConfiguration.defaults();

        assertSame(defaults, defaults.withPrimeCeiling(PrimeSequence.DEFAULT_PRIME_CEILING));
        assertNotEquals(defaults, defaults.withPrimeCeiling(500));
        assertEquals(defaults, defaults.withConcertPitch(440.0));
        assertThrows(IllegalArgumentException.class, () -> defaults.withConcertPitch(0));
        assertEquals(440.0, defaults.getConcertPitchAsPitch().getFrequency());
    }

    @Test
    void pitchesUseTheirOwnConfiguration() {
        TuningConfiguration tiny = TuningConfiguration.defaults().withPrimeCeiling(10);

        JustIntonationPitch seven = new JustIntonationPitch(
            RatioSource.literal("7/4"), null, tiny);

        assertSame(tiny, seven.getConfiguration());
        assertEquals(440.0, seven.getConcertPitch().getFrequency());
        assertThrows(ArithmeticException.class, () -> new JustIntonationPitch(
            RatioSource.literal("11/8"), null, tiny));
    }
}
