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

import io.tonalis.ji.Pitch;
import io.tonalis.ji.ratio.RatioCodec;
import org.apache.commons.math3.fraction.BigFraction;

import java.util.Objects;

/**
 * A small reference interval used to notate one prime above 3 as a
 * pythagorean interval plus a correction, e.g. the syntonic comma 80/81 for
 * prime 5.
 */
public final class Comma {

    private final BigFraction ratio;

    /**
     * @param ratio a positive ratio
     * @throws IllegalArgumentException if the ratio is not positive
     */
    public Comma(BigFraction ratio) {
        Objects.requireNonNull(ratio, "ratio cannot be null");
        if (ratio.getNumerator().signum() <= 0 || ratio.getDenominator().signum() <= 0) {
            throw new IllegalArgumentException("Comma ratio must be positive, got: " + RatioCodec.format(ratio));
        }
        this.ratio = ratio;
    }

    /**
     * @param ratio ratio literal such as {@code "80/81"}
     * @return the comma
     */
    public static Comma of(String ratio) {
        return new Comma(RatioCodec.parse(ratio));
    }

    public BigFraction getRatio() {
        return ratio;
    }

    /** @return the comma size in cents, negative for commas below 1/1 */
    public double getCents() {
        return Pitch.ratioToCents(ratio);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Comma)) return false;
        return ratio.equals(((Comma) o).ratio);
    }

    @Override
    public int hashCode() {
        return ratio.hashCode();
    }

    @Override
    public String toString() {
        return "Comma(" + RatioCodec.format(ratio) + ")";
    }
}
