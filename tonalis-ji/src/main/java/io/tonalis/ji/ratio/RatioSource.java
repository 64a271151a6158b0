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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/// The three accepted ways of describing a just-intonation ratio.
///
/// ## Variants
///
/// | Variant              | Example                        | Meaning                   |
/// |----------------------|--------------------------------|---------------------------|
/// | [RatioLiteral]       | `"3/2"`                        | numerator/denominator text |
/// | [FractionValue]      | `new BigFraction(3, 2)`        | exact fraction            |
/// | [ExponentSequence]   | `(-1, 1)`                      | prime exponents           |
///
/// [RatioCodec#toExponentVector(RatioSource)] consumes all variants through one
/// explicit dispatch. [#from(Object)] adapts loosely typed input from callers
/// that only hold an `Object`.
public sealed interface RatioSource
    permits RatioSource.RatioLiteral, RatioSource.FractionValue, RatioSource.ExponentSequence {

    /// A ratio written as `"numerator/denominator"`.
    record RatioLiteral(String text) implements RatioSource {
        public RatioLiteral {
            if (text == null) {
                throw new RatioParseException("null", "ratio text is null");
            }
        }
    }

    /// A ratio given as an exact fraction.
    record FractionValue(BigFraction fraction) implements RatioSource {
        public FractionValue {
            Objects.requireNonNull(fraction, "fraction cannot be null");
        }
    }

    /// A ratio given as prime exponents.
    record ExponentSequence(ExponentVector exponents) implements RatioSource {
        public ExponentSequence {
            Objects.requireNonNull(exponents, "exponents cannot be null");
        }
    }

    static RatioSource literal(String text) {
        return new RatioLiteral(text);
    }

    static RatioSource fraction(BigFraction fraction) {
        return new FractionValue(fraction);
    }

    static RatioSource exponents(int... exponents) {
        return new ExponentSequence(ExponentVector.of(exponents));
    }

    /// Adapts an arbitrary object to a ratio source.
    ///
    /// Accepted: [RatioSource], [String], [BigFraction], [Fraction],
    /// integral numbers (`n/1`), [ExponentVector], `int[]` and collections of
    /// integral numbers (exponent sequences).
    ///
    /// @param value the object to adapt
    /// @return the matching variant
    /// @throws UnsupportedRatioSourceException for any other type
    static RatioSource from(Object value) {
        if (value instanceof RatioSource source) {
            return source;
        }
        if (value instanceof String text) {
            return new RatioLiteral(text);
        }
        if (value instanceof BigFraction fraction) {
            return new FractionValue(fraction);
        }
        if (value instanceof Fraction fraction) {
            return new FractionValue(new BigFraction(fraction.getNumerator(), fraction.getDenominator()));
        }
        if (value instanceof BigInteger integer) {
            return new FractionValue(new BigFraction(integer));
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return new FractionValue(new BigFraction(((Number) value).longValue()));
        }
        if (value instanceof ExponentVector vector) {
            return new ExponentSequence(vector);
        }
        if (value instanceof int[] array) {
            return new ExponentSequence(ExponentVector.of(array));
        }
        if (value instanceof Collection<?> collection) {
            List<Number> exponents = new ArrayList<>(collection.size());
            for (Object element : collection) {
                if (!(element instanceof Integer || element instanceof Long
                    || element instanceof Short || element instanceof Byte)) {
                    throw new UnsupportedRatioSourceException(value);
                }
                exponents.add((Number) element);
            }
            return new ExponentSequence(ExponentVector.of(exponents));
        }
        throw new UnsupportedRatioSourceException(value);
    }
}
