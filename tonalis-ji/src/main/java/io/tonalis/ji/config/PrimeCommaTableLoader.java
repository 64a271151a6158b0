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

import com.google.gson.JsonParseException;
import io.tonalis.ji.comma.PrimeCommaTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/// Loads [PrimeCommaTable]s from JSON files, readers and classpath resources.
///
/// ```json
/// {"5": "80/81", "7": "63/64", "11": "33/32"}
/// ```
///
/// Malformed JSON and tables violating the comma invariant are reported as
/// [IllegalArgumentException]; read failures propagate as [IOException].
public final class PrimeCommaTableLoader {

    private static final Logger logger = LogManager.getLogger(PrimeCommaTableLoader.class);

    private PrimeCommaTableLoader() {
    }

    /// @param path JSON file
    /// @return the validated table
    /// @throws IOException if the file cannot be read
    public static PrimeCommaTable load(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            PrimeCommaTable table = load(reader);
            logger.debug("Loaded {} commas from {}", table.size(), path);
            return table;
        }
    }

    /// @param reader JSON source, not closed by this method
    /// @return the validated table
    public static PrimeCommaTable load(Reader reader) {
        Objects.requireNonNull(reader, "reader cannot be null");
        PrimeCommaTable table;
        try {
            table = TuningGsonConfig.gson().fromJson(reader, PrimeCommaTable.class);
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Invalid comma table JSON: " + e.getMessage(), e);
        }
        if (table == null) {
            throw new IllegalArgumentException("Comma table JSON is empty");
        }
        return table;
    }

    /// @param resource classpath resource name, e.g. `"commas/custom-commas.json"`
    /// @return the validated table
    /// @throws IOException if the resource cannot be read
    /// @throws IllegalArgumentException if the resource does not exist
    public static PrimeCommaTable loadResource(String resource) throws IOException {
        Objects.requireNonNull(resource, "resource cannot be null");
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = PrimeCommaTableLoader.class.getClassLoader();
        }
        try (InputStream stream = loader.getResourceAsStream(resource)) {
            if (stream == null) {
                throw new IllegalArgumentException("Comma table resource not found: " + resource);
            }
            PrimeCommaTable table = load(new InputStreamReader(stream, StandardCharsets.UTF_8));
            logger.debug("Loaded {} commas from resource {}", table.size(), resource);
            return table;
        }
    }
}
