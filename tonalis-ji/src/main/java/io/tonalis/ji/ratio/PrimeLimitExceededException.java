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

/// Thrown when a ratio contains a prime factor that lies above the prime ceiling
/// of the active [PrimeSequence], so it cannot be given a position in an
/// exponent vector.
public class PrimeLimitExceededException extends ArithmeticException {

    private final int primeCeiling;

    public PrimeLimitExceededException(String message, int primeCeiling) {
        super(message);
        this.primeCeiling = primeCeiling;
    }

    public int getPrimeCeiling() {
        return primeCeiling;
    }
}
