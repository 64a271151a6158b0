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

/// Thrown by [RatioSource#from(Object)] when handed an object that is neither a
/// ratio literal, a fraction, an integer nor a sequence of exponents.
public class UnsupportedRatioSourceException extends IllegalArgumentException {

    private final Class<?> rejectedType;

    public UnsupportedRatioSourceException(Object rejected) {
        super(String.format("Unsupported ratio source of type '%s': %s",
            rejected == null ? "null" : rejected.getClass().getName(), rejected));
        this.rejectedType = rejected == null ? null : rejected.getClass();
    }

    /// @return the class of the rejected value, or null if the value was null
    public Class<?> getRejectedType() {
        return rejectedType;
    }
}
