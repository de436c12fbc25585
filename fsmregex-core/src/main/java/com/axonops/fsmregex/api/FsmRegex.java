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

/**
 * Main entry point for the FsmRegex library.
 *
 * <p>Static convenience methods over {@link Pattern}. Patterns are compiled through the global
 * cache, so repeating a pattern string is cheap.
 *
 * <p>Example usage:
 * <pre>{@code
 * boolean ok = FsmRegex.matches("[a-z]+[0-9]*", "build42");   // true
 * boolean hit = FsmRegex.find("ab+", "xxabbby");              // true
 *
 * Pattern p = FsmRegex.compile("a.c");
 * p.matches("abc");                                           // true
 * }</pre>
 *
 * @since 1.0.0
 */
public final class FsmRegex {

    private FsmRegex() {
        // Utility class
    }

    /**
     * Compiles a pattern.
     *
     * @param pattern pattern string
     * @return compiled pattern (possibly cached)
     * @throws PatternCompilationException if the pattern is malformed
     */
    public static Pattern compile(String pattern) {
        return Pattern.compile(pattern);
    }

    /**
     * Compiles {@code pattern} and tests whether it matches the whole input.
     *
     * @throws PatternCompilationException if the pattern is malformed
     */
    public static boolean matches(String pattern, String input) {
        return Pattern.compile(pattern).matches(input);
    }

    /**
     * Compiles {@code pattern} and tests whether it matches any substring of the input.
     *
     * @throws PatternCompilationException if the pattern is malformed
     */
    public static boolean find(String pattern, String input) {
        return Pattern.compile(pattern).find(input);
    }
}
