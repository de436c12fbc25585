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
 * Base of the exceptions this library throws. Each one concerns a single pattern, available from
 * {@link #getPattern()}; the message quotes it cut to {@value #MAX_QUOTED_LENGTH} characters.
 *
 * @since 1.0.0
 */
public abstract sealed class FsmRegexException extends RuntimeException
    permits PatternCompilationException {

    static final int MAX_QUOTED_LENGTH = 100;

    private final String pattern;

    protected FsmRegexException(String pattern, String message) {
        super(message + " (pattern: " + quote(pattern) + ")");
        this.pattern = pattern;
    }

    /** The pattern in full, even when the message shows it truncated. */
    public String getPattern() {
        return pattern;
    }

    private static String quote(String pattern) {
        if (pattern == null || pattern.length() <= MAX_QUOTED_LENGTH) {
            return pattern;
        }
        return pattern.substring(0, MAX_QUOTED_LENGTH - 3) + "...";
    }
}
