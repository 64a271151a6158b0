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

/// Thrown when a ratio literal or fraction cannot be interpreted as a positive
/// rational number, e.g. `"3:2"`, `"x/2"` or `"1/0"`.
public class RatioParseException extends IllegalArgumentException {

    private final String input;

    public RatioParseException(String input, String reason) {
        super(String.format("Cannot parse ratio '%s': %s", input, reason));
        this.input = input;
    }

    public RatioParseException(String input, String reason, Throwable cause) {
        super(String.format("Cannot parse ratio '%s': %s", input, reason), cause);
        this.input = input;
    }

    /// @return the text that failed to parse
    public String getInput() {
        return input;
    }
}
