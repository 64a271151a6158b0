package io.tonalis.ji;

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

import java.util.Objects;

/**
 * An interval given directly in cents.
 */
public final class DirectPitchInterval implements PitchInterval {

    private final double interval;

    public DirectPitchInterval(double interval) {
        if (!Double.isFinite(interval)) {
            throw new IllegalArgumentException("Interval must be finite, got: " + interval);
        }
        this.interval = interval;
    }

    @Override
    public double getInterval() {
        return interval;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DirectPitchInterval)) return false;
        return Double.compare(interval, ((DirectPitchInterval) o).interval) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(interval);
    }

    @Override
    public String toString() {
        return "DirectPitchInterval(" + interval + ")";
    }
}
