/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.fsmregex.api;

import java.util.Objects;

/**
 * Applies a {@link Pattern} to one input string.
 *
 * <p>A matcher holds no engine state between calls: each query starts a fresh attempt, so calling
 * {@link #matches()} and {@link #find()} in any order, any number of times, gives the same answers.
 * Nothing needs closing.
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * Matcher m = Pattern.compile("ab+").matcher("xxabbby");
 * m.matches(); // false
 * m.find();    // true
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Matcher {
    private final Pattern pattern;
    private final String input;

    Matcher(Pattern pattern, String input) {
        this.pattern = Objects.requireNonNull(pattern, "pattern cannot be null");
        this.input = Objects.requireNonNull(input, "input cannot be null");
    }

    /**
     * Tests whether the entire input matches.
     */
    public boolean matches() {
        return pattern.fullMatch(input);
    }

    /**
     * Tests whether the input contains a matching substring.
     */
    public boolean find() {
        return pattern.partialMatch(input);
    }

    public Pattern pattern() {
        return pattern;
    }

    public String input() {
        return input;
    }
}
