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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.IntBinaryOperator;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/// Immutable vector of signed prime exponents describing a positive rational number.
///
/// ## Encoding
///
/// Position `i` holds the exponent of the `i`-th prime (see [PrimeSequence]).
/// Positive exponents belong to the numerator, negative ones to the denominator:
///
/// ```
///   (-1, 1)      →  2⁻¹ · 3¹            =  3/2
///   (2, 0, -1)   →  2² · 3⁰ · 5⁻¹       =  4/5
///   ()           →  1                   =  1/1
/// ```
///
/// ## Canonical Form
///
/// Trailing zero entries are always trimmed on construction, so two vectors
/// describing the same ratio are equal by [#equals(Object)] regardless of how
/// they were built. Arithmetic between vectors of different length pads the
/// shorter one with zeros on the fly without touching either operand.
public final class ExponentVector {

    private static final ExponentVector EMPTY = new ExponentVector(new int[0]);

    private final int[] exponents;

    private ExponentVector(int[] trimmed) {
        this.exponents = trimmed;
    }

    /// @return the vector of the ratio 1/1
    public static ExponentVector empty() {
        return EMPTY;
    }

    /// Creates a canonical vector from raw exponents; trailing zeros are dropped.
    ///
    /// @param exponents exponents indexed by prime position
    /// @return the canonical vector
    public static ExponentVector of(int... exponents) {
        Objects.requireNonNull(exponents, "exponents cannot be null");
        int[] trimmed = trim(exponents);
        return trimmed.length == 0 ? EMPTY : new ExponentVector(trimmed);
    }

    /// Creates a canonical vector from a list of exponents.
    ///
    /// @param exponents exponents indexed by prime position; null entries are rejected
    /// @return the canonical vector
    public static ExponentVector of(List<? extends Number> exponents) {
        Objects.requireNonNull(exponents, "exponents cannot be null");
        int[] values = new int[exponents.size()];
        for (int i = 0; i < values.length; i++) {
            Number n = Objects.requireNonNull(exponents.get(i), "exponent at position " + i + " is null");
            values[i] = Math.toIntExact(n.longValue());
        }
        return of(values);
    }

    /// Returns a copy of the given exponents without trailing zero entries.
    ///
    /// @param exponents raw exponents
    /// @return the trimmed copy; `trim([])` is `[]`
    public static int[] trim(int[] exponents) {
        int end = exponents.length;
        while (end > 0 && exponents[end - 1] == 0) {
            end--;
        }
        return Arrays.copyOf(exponents, end);
    }

    /// Right-pads the shorter of two vectors with zeros so both have equal length.
    ///
    /// @param a first vector
    /// @param b second vector
    /// @return two fresh arrays of equal length; the inputs are not modified
    public static int[][] pad(ExponentVector a, ExponentVector b) {
        int length = Math.max(a.size(), b.size());
        return new int[][]{
            Arrays.copyOf(a.exponents, length),
            Arrays.copyOf(b.exponents, length)
        };
    }

    /// @return number of stored positions, i.e. index of the highest prime + 1
    public int size() {
        return exponents.length;
    }

    /// @return true if this is the vector of 1/1
    public boolean isEmpty() {
        return exponents.length == 0;
    }

    /// Returns the exponent at a prime position; positions beyond the end read as 0.
    ///
    /// @param index prime position
    /// @return the exponent
    public int get(int index) {
        if (index < 0) {
            throw new IndexOutOfBoundsException("Negative prime position: " + index);
        }
        return index < exponents.length ? exponents[index] : 0;
    }

    /// @return a copy of the exponents
    public int[] toArray() {
        return exponents.clone();
    }

    /// @return the exponents as an immutable list
    public List<Integer> toList() {
        return IntStream.of(exponents).boxed().collect(Collectors.toUnmodifiableList());
    }

    /// @param other the vector to add
    /// @return the element-wise sum
    /// @throws ArithmeticException if an exponent overflows an `int`
    public ExponentVector add(ExponentVector other) {
        return combine(other, Math::addExact);
    }

    /// @param other the vector to subtract
    /// @return the element-wise difference
    /// @throws ArithmeticException if an exponent overflows an `int`
    public ExponentVector subtract(ExponentVector other) {
        return combine(other, Math::subtractExact);
    }

    /// @return the reciprocal ratio's vector
    /// @throws ArithmeticException if an exponent is `Integer.MIN_VALUE`
    public ExponentVector negate() {
        int[] negated = new int[exponents.length];
        for (int i = 0; i < negated.length; i++) {
            negated[i] = Math.negateExact(exponents[i]);
        }
        return of(negated);
    }

    /// Builds the shared part of two vectors, position by position.
    ///
    /// A position keeps a non-zero exponent only when both sides are non-zero
    /// with the same sign; the result is the exponent closer to zero. In strict
    /// mode the two exponents must additionally be equal.
    ///
    /// ```
    ///   5/3  = ( 0, -1, 1)
    ///   7/6  = (-1, -1, 0, 1)
    ///   ∩    = ( 0, -1)      = 1/3
    /// ```
    ///
    /// @param other the vector to intersect with
    /// @param strict only keep exponents that are identical on both sides
    /// @return the intersection
    public ExponentVector intersect(ExponentVector other, boolean strict) {
        return combine(other, (x, y) -> {
            if (x == 0 || y == 0) {
                return 0;
            }
            if (strict && x != y) {
                return 0;
            }
            if (x < 0 && y < 0) {
                return Math.max(x, y);
            }
            if (x > 0 && y > 0) {
                return Math.min(x, y);
            }
            return 0;
        });
    }

    /// @return the largest exponent, or 0 for the empty vector
    public int max() {
        return IntStream.of(exponents).max().orElse(0);
    }

    /// @return the smallest exponent, or 0 for the empty vector
    public int min() {
        return IntStream.of(exponents).min().orElse(0);
    }

    /// @param value exponent to look up
    /// @return first position holding the value, or -1
    public int indexOf(int value) {
        for (int i = 0; i < exponents.length; i++) {
            if (exponents[i] == value) {
                return i;
            }
        }
        return -1;
    }

    private ExponentVector combine(ExponentVector other, IntBinaryOperator operation) {
        Objects.requireNonNull(other, "other cannot be null");
        int[][] padded = pad(this, other);
        int[] result = new int[padded[0].length];
        for (int i = 0; i < result.length; i++) {
            result[i] = operation.applyAsInt(padded[0][i], padded[1][i]);
        }
        return of(result);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExponentVector)) return false;
        return Arrays.equals(exponents, ((ExponentVector) o).exponents);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(exponents);
    }

    @Override
    public String toString() {
        return IntStream.of(exponents)
            .mapToObj(Integer::toString)
            .collect(Collectors.joining(", ", "(", ")"));
    }
}
