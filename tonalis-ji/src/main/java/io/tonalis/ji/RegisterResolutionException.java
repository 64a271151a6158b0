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

/// Thrown when [JustIntonationPitch#moveToClosestRegister(JustIntonationPitch)]
/// cannot rank any candidate register, e.g. because every cents distance is
/// non-finite.
public class RegisterResolutionException extends RuntimeException {

    private final int candidateCount;

    public RegisterResolutionException(String message, int candidateCount) {
        super(message);
        this.candidateCount = candidateCount;
    }

    /// @return how many candidate registers were evaluated
    public int getCandidateCount() {
        return candidateCount;
    }
}
