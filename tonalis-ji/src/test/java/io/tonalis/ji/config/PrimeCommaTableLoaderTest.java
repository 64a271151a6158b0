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

import io.tonalis.ji.comma.Comma;
import io.tonalis.ji.comma.PrimeCommaTable;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class PrimeCommaTableLoaderTest {

    @Test
    void loadsClasspathResource() throws IOException {
        PrimeCommaTable table = PrimeCommaTableLoader.loadResource("commas/custom-commas.json");

        assertEquals(4, table.size());
        assertEquals(Comma.of("1053/1024"), table.get(13));
        assertEquals(Comma.of("80/81"), table.get(5));
    }

    @Test
    void rejectsResourceViolatingTheCommaInvariant() {
        assertThatThrownBy(() -> PrimeCommaTableLoader.loadResource("commas/invalid-commas.json"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("prime 7");
    }

    @Test
    void missingResourceIsReported() {
        assertThatThrownBy(() -> PrimeCommaTableLoader.loadResource("commas/absent.json"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("absent.json");
    }

    @Test
    void loadsFile(@TempDir Path tempDir) throws IOException {
        Path file = tempDir.resolve("table.json");
        Files.writeString(file, "{\"11\": \"33/32\"}", StandardCharsets.UTF_8);

        assertEquals(PrimeCommaTable.builder().put(11, "33/32").build(), PrimeCommaTableLoader.load(file));
    }

    @Test
    void missingFileFailsWithIOException(@TempDir Path tempDir) {
        assertThrows(IOException.class, () -> PrimeCommaTableLoader.load(tempDir.resolve("none.json")));
    }

    @Test
    void malformedJsonIsAnArgumentError() {
        assertThrows(IllegalArgumentException.class, () -> PrimeCommaTableLoader.load(new StringReader("{\"5\": ")));
        assertThrows(IllegalArgumentException.class, () -> PrimeCommaTableLoader.load(new StringReader("")));
    }
}
