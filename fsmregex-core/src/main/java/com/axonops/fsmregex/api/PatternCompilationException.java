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
 * Thrown when a pattern fails to compile, for example an unclosed class, a stray {@code ]} or a
 * pattern longer than the configured maximum.
 *
 * @since 1.0.0
 */
public final class PatternCompilationException extends FsmRegexException {

    private final int index;

    /**
     * @param pattern the rejected pattern
     * @param message what is wrong with it
     * @param index position of the offending character, or -1 if the pattern as a whole is at fault
     */
    public PatternCompilationException(String pattern, String message, int index) {
        super(pattern, "FsmRegex: Pattern compilation failed: " + message
            + (index >= 0 ? " at index " + index : ""));
        this.index = index;
    }

    public PatternCompilationException(String pattern, String message) {
        this(pattern, message, -1);
    }

    public int getIndex() {
        return index;
    }
}
