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

import io.tonalis.ji.DirectPitch;
import io.tonalis.ji.TuningConstants;
import io.tonalis.ji.comma.PrimeCommaTable;
import io.tonalis.ji.ratio.PrimeSequence;
import io.tonalis.ji.ratio.RatioCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

/// Process-wide tuning defaults: concert pitch, comma table and prime ceiling.
///
/// ## Lifecycle
///
/// A configuration is an immutable value. One instance is the process default,
/// read through [#current()] by every pitch constructed without an explicit
/// configuration. Host applications replace it once at startup:
///
/// ```java
/// TuningConfiguration.install(TuningConfiguration.fromSystemProperties());
/// ```
///
/// ## System Properties
///
/// | Property                 | Type   | Default                 |
/// |--------------------------|--------|-------------------------|
/// | `tonalis.concert-pitch`  | double | 440.0                   |
/// | `tonalis.comma-table`    | path   | Helmholtz-Ellis commas  |
/// | `tonalis.prime-ceiling`  | int    | 1048576                 |
///
/// Values that cannot be read are logged and replaced by their default.
public final class TuningConfiguration {

    private static final Logger logger = LogManager.getLogger(TuningConfiguration.class);

    public static final String CONCERT_PITCH_PROPERTY = "tonalis.concert-pitch";
    public static final String COMMA_TABLE_PROPERTY = "tonalis.comma-table";
    public static final String PRIME_CEILING_PROPERTY = "tonalis.prime-ceiling";

    private static final TuningConfiguration DEFAULTS = new TuningConfiguration(
        TuningConstants.DEFAULT_CONCERT_PITCH_HZ,
        PrimeCommaTable.HELMHOLTZ_ELLIS,
        new PrimeSequence(PrimeSequence.DEFAULT_PRIME_CEILING));

    private static final AtomicReference<TuningConfiguration> CURRENT = new AtomicReference<>(DEFAULTS);

    private final double concertPitch;
    private final PrimeCommaTable primeCommaTable;
    private final PrimeSequence primes;
    private final RatioCodec codec;

    private TuningConfiguration(double concertPitch, PrimeCommaTable primeCommaTable, PrimeSequence primes) {
        if (!(concertPitch > 0) || Double.isInfinite(concertPitch)) {
            throw new IllegalArgumentException("Concert pitch must be positive and finite, got: " + concertPitch);
        }
        this.concertPitch = concertPitch;
        this.primeCommaTable = Objects.requireNonNull(primeCommaTable, "primeCommaTable cannot be null");
        this.primes = primes;
        this.codec = new RatioCodec(primes);
    }

    /// @return the built-in configuration: 440 Hz, Helmholtz-Ellis commas, primes up to 2^20
    public static TuningConfiguration defaults() {
        return DEFAULTS;
    }

    /// @return the installed process default
    public static TuningConfiguration current() {
        return CURRENT.get();
    }

    /// Installs a configuration as the process default.
    ///
    /// @param configuration the new default
    /// @return the previously installed default
    public static TuningConfiguration install(TuningConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration cannot be null");
        TuningConfiguration previous = CURRENT.getAndSet(configuration);
        if (!configuration.equals(DEFAULTS)) {
            logger.info("Installed tuning configuration {}", configuration);
        }
        return previous;
    }

    /// @return a configuration built from the JVM system properties
    public static TuningConfiguration fromSystemProperties() {
        return fromProperties(System.getProperties());
    }

    /// Builds a configuration from properties, keeping the default for every
    /// missing or unreadable value.
    ///
    /// @param properties source properties
    /// @return the configuration
    public static TuningConfiguration fromProperties(Properties properties) {
        TuningConfiguration configuration = DEFAULTS;

        String concertPitch = properties.getProperty(CONCERT_PITCH_PROPERTY);
        if (concertPitch != null) {
            try {
                configuration = configuration.withConcertPitch(Double.parseDouble(concertPitch.trim()));
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring {}='{}': {}", CONCERT_PITCH_PROPERTY, concertPitch, e.getMessage());
            }
        }

        String primeCeiling = properties.getProperty(PRIME_CEILING_PROPERTY);
        if (primeCeiling != null) {
            try {
                configuration = configuration.withPrimeCeiling(Integer.parseInt(primeCeiling.trim()));
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring {}='{}': {}", PRIME_CEILING_PROPERTY, primeCeiling, e.getMessage());
            }
        }

        String commaTable = properties.getProperty(COMMA_TABLE_PROPERTY);
        if (commaTable != null) {
            try {
                configuration = configuration.withPrimeCommaTable(PrimeCommaTableLoader.load(Path.of(commaTable.trim())));
            } catch (IOException | IllegalArgumentException e) {
                logger.warn("Ignoring {}='{}': {}", COMMA_TABLE_PROPERTY, commaTable, e.getMessage());
            }
        }
        return configuration;
    }

    public TuningConfiguration withConcertPitch(double concertPitch) {
        return new TuningConfiguration(concertPitch, primeCommaTable, primes);
    }

    public TuningConfiguration withPrimeCommaTable(PrimeCommaTable primeCommaTable) {
        return new TuningConfiguration(concertPitch, primeCommaTable, primes);
    }

    /// @param primeCeiling largest prime exponent vectors may reference, at least 2
    /// @return a configuration with its own prime sequence
    public TuningConfiguration withPrimeCeiling(int primeCeiling) {
        if (primeCeiling == primes.getCeiling()) {
            return this;
        }
        return new TuningConfiguration(concertPitch, primeCommaTable, new PrimeSequence(primeCeiling));
    }

    /// @return the concert pitch in Hz
    public double getConcertPitch() {
        return concertPitch;
    }

    public DirectPitch getConcertPitchAsPitch() {
        return new DirectPitch(concertPitch);
    }

    public PrimeCommaTable getPrimeCommaTable() {
        return primeCommaTable;
    }

    public int getPrimeCeiling() {
        return primes.getCeiling();
    }

    public PrimeSequence getPrimes() {
        return primes;
    }

    public RatioCodec getCodec() {
        return codec;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TuningConfiguration)) return false;
        TuningConfiguration that = (TuningConfiguration) o;
        return Double.compare(concertPitch, that.concertPitch) == 0
            && primes.getCeiling() == that.primes.getCeiling()
            && primeCommaTable.equals(that.primeCommaTable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(concertPitch, primes.getCeiling(), primeCommaTable);
    }

    @Override
    public String toString() {
        return "TuningConfiguration{concertPitch=" + concertPitch
            + ", primeCeiling=" + primes.getCeiling()
            + ", commaPrimes=" + primeCommaTable.primes() + "}";
    }
}
