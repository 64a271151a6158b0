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

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;

/// Lossless conversion between ratio literals, exact fractions and exponent vectors.
///
/// ## Conversion Paths
///
/// ```
/// ┌──────────────┐  parse   ┌──────────────┐  toExponentVector  ┌────────────────┐
/// │   "15/8"     │ ───────► │ BigFraction  │ ─────────────────► │ (-3, 1, 1)     │
/// │ RatioLiteral │ ◄─────── │   15/8       │ ◄───────────────── │ ExponentVector │
/// └──────────────┘  format  └──────────────┘     toFraction     └────────────────┘
/// ```
///
/// ## Round-Trip Laws
///
/// - `toFraction(toExponentVector(f)).equals(f)` for every positive fraction `f`
/// - `toExponentVector(toFraction(v)).equals(v)` for every vector `v`
///
/// Instances are immutable and thread-safe.
public final class RatioCodec {

    private final PrimeSequence primes;
    private final PrimeFactorizer factorizer;

    public RatioCodec(PrimeSequence primes) {
        this.primes = Objects.requireNonNull(primes, "primes cannot be null");
        this.factorizer = new PrimeFactorizer(primes);
    }

    public PrimeSequence getPrimes() {
        return primes;
    }

    public PrimeFactorizer getFactorizer() {
        return factorizer;
    }

    /// Parses `"numerator/denominator"` into a reduced fraction.
    ///
    /// Whitespace around either term is ignored. Both terms must be positive
    /// integers.
    ///
    /// @param text the ratio literal
    /// @return the reduced fraction
    /// @throws RatioParseException if the text is malformed
    public static BigFraction parse(String text) {
        if (text == null) {
            throw new RatioParseException("null", "ratio text is null");
        }
        String[] terms = text.split("/", -1);
        if (terms.length != 2) {
            throw new RatioParseException(text, "expected exactly one '/' separating numerator and denominator");
        }
        BigInteger numerator = parseTerm(text, terms[0], "numerator");
        BigInteger denominator = parseTerm(text, terms[1], "denominator");
        return new BigFraction(numerator, denominator);
    }

    private static BigInteger parseTerm(String text, String term, String role) {
        BigInteger value;
        try {
            value = new BigInteger(term.trim());
        } catch (NumberFormatException e) {
            throw new RatioParseException(text, role + " '" + term + "' is not an integer", e);
        }
        if (value.signum() <= 0) {
            throw new RatioParseException(text, role + " must be positive");
        }
        return value;
    }

    /// Formats a fraction as `"numerator/denominator"`; integers print as `"n/1"`.
    ///
    /// @param fraction the fraction
    /// @return the ratio literal
    public static String format(BigFraction fraction) {
        return fraction.getNumerator() + "/" + fraction.getDenominator();
    }

    /// Folds a ratio into the window `[1, border)`.
    ///
    /// While the ratio is at least `border` it is divided by `border`; while it is
    /// below 1 it is multiplied by `border`. A border of 1 or less leaves the ratio
    /// untouched. The operation is idempotent.
    ///
    /// @param ratio the ratio to fold
    /// @param border the period, 2 for octaves
    /// @return the folded ratio
    public static BigFraction adjustRatio(BigFraction ratio, int border) {
        if (border <= 1) {
            return ratio;
        }
        BigFraction period = new BigFraction(border);
        BigFraction adjusted = ratio;
        while (adjusted.compareTo(period) >= 0) {
            adjusted = adjusted.divide(border);
        }
        while (adjusted.compareTo(BigFraction.ONE) < 0) {
            adjusted = adjusted.multiply(border);
        }
        return adjusted;
    }

    /// Decomposes a positive fraction into its canonical exponent vector.
    ///
    /// @param fraction a positive fraction
    /// @return the exponent vector
    /// @throws RatioParseException if the fraction is not positive
    /// @throws PrimeLimitExceededException if a factor lies above the prime ceiling
    public ExponentVector toExponentVector(BigFraction fraction) {
        Objects.requireNonNull(fraction, "fraction cannot be null");
        if (fraction.getNumerator().signum() <= 0 || fraction.getDenominator().signum() <= 0) {
            throw new RatioParseException(format(fraction), "only positive ratios have an exponent vector");
        }
        SortedMap<Integer, Integer> numerator = factorizer.factorize(fraction.getNumerator());
        SortedMap<Integer, Integer> denominator = factorizer.factorize(fraction.getDenominator());

        int largest = 0;
        if (!numerator.isEmpty()) {
            largest = Math.max(largest, numerator.lastKey());
        }
        if (!denominator.isEmpty()) {
            largest = Math.max(largest, denominator.lastKey());
        }
        if (largest == 0) {
            return ExponentVector.empty();
        }

        int[] exponents = new int[primes.indexOf(largest) + 1];
        for (Map.Entry<Integer, Integer> entry : numerator.entrySet()) {
            exponents[primes.indexOf(entry.getKey())] += entry.getValue();
        }
        for (Map.Entry<Integer, Integer> entry : denominator.entrySet()) {
            exponents[primes.indexOf(entry.getKey())] -= entry.getValue();
        }
        return ExponentVector.of(exponents);
    }

    /// Resolves any [RatioSource] variant to its exponent vector.
    ///
    /// @param source the ratio description
    /// @return the canonical exponent vector
    /// @throws RatioParseException if a literal or fraction is malformed
    public ExponentVector toExponentVector(RatioSource source) {
        Objects.requireNonNull(source, "source cannot be null");
        if (source instanceof RatioSource.RatioLiteral literal) {
            return toExponentVector(parse(literal.text()));
        }
        if (source instanceof RatioSource.FractionValue value) {
            return toExponentVector(value.fraction());
        }
        if (source instanceof RatioSource.ExponentSequence sequence) {
            ExponentVector vector = sequence.exponents();
            if (!vector.isEmpty()) {
                primes.primeAt(vector.size() - 1);
            }
            return vector;
        }
        throw new UnsupportedRatioSourceException(source);
    }

    /// @param vector exponent vector
    /// @return product of `prime^exponent` over the positive exponents
    public BigInteger toNumerator(ExponentVector vector) {
        BigInteger numerator = BigInteger.ONE;
        for (int i = 0; i < vector.size(); i++) {
            int exponent = vector.get(i);
            if (exponent > 0) {
                numerator = numerator.multiply(BigInteger.valueOf(primes.primeAt(i)).pow(exponent));
            }
        }
        return numerator;
    }

    /// @param vector exponent vector
    /// @return product of `prime^|exponent|` over the negative exponents
    public BigInteger toDenominator(ExponentVector vector) {
        BigInteger denominator = BigInteger.ONE;
        for (int i = 0; i < vector.size(); i++) {
            int exponent = vector.get(i);
            if (exponent < 0) {
                denominator = denominator.multiply(BigInteger.valueOf(primes.primeAt(i)).pow(-exponent));
            }
        }
        return denominator;
    }

    /// Rebuilds the reduced fraction of an exponent vector.
    ///
    /// @param vector exponent vector
    /// @return the fraction, never folded into an octave
    public BigFraction toFraction(ExponentVector vector) {
        Objects.requireNonNull(vector, "vector cannot be null");
        return adjustRatio(new BigFraction(toNumerator(vector), toDenominator(vector)), 1);
    }

    /// Parses a ratio literal straight into its exponent vector.
    ///
    /// @param text ratio literal such as `"9/8"`
    /// @return the canonical exponent vector
    public ExponentVector toExponentVector(String text) {
        return toExponentVector(parse(text));
    }

    /// Formats an exponent vector as a ratio literal.
    ///
    /// @param vector exponent vector
    /// @return `"numerator/denominator"`
    public String format(ExponentVector vector) {
        return format(toFraction(vector));
    }
}
