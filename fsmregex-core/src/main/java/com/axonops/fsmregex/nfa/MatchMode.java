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

package com.axonops.fsmregex.nfa;

/**
 * How a simulation run treats the ends of its input.
 *
 * @since 1.0.0
 */
public enum MatchMode {
    /**
     * Input must be fully consumed.
     *
     * <p>The run fails as soon as no state survives, and succeeds only if the termination state is
     * active after the last character.
     */
    FULL,

    /**
     * Any prefix of the input counts.
     *
     * <p>The run succeeds the moment the termination state becomes active, including before the
     * first character, and fails when no state survives or the input runs out.
     */
    SEARCH
}
