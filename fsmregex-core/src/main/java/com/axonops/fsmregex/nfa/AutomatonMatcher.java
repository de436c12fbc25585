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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs the full-match and substring-search queries over a compiled {@link Automaton}.
 *
 * <p>Both queries drive the same {@link Simulation#advance(char)} primitive; they differ only in
 * the {@link MatchMode} of each run and in how many start offsets are tried.
 *
 * <p>Thread-safe: holds only the immutable automaton and its closure engine. Every run creates
 * its own {@link Simulation}.
 *
 * @since 1.0.0
 */
public final class AutomatonMatcher {
    private static final Logger logger = LoggerFactory.getLogger(AutomatonMatcher.class);

    private final Automaton automaton;
    private final EpsilonClosure epsilonClosure;

    public AutomatonMatcher(Automaton automaton) {
        this.automaton = Objects.requireNonNull(automaton, "automaton cannot be null");
        this.epsilonClosure = new EpsilonClosure(automaton);
    }

    public Automaton automaton() {
        return automaton;
    }

    /**
     * Tests whether the whole text matches, anchored at both ends.
     */
    public boolean matches(CharSequence text) {
        Objects.requireNonNull(text, "text cannot be null");
        return run(text, 0, MatchMode.FULL);
    }

    /**
     * Tests whether some substring of the text matches.
     *
     * <p>Tries a full match first, then restarts a {@link MatchMode#SEARCH} run at every offset
     * from left to right. Worst case O(n^2 * m) for text length n and automaton size m.
     */
    public boolean find(CharSequence text) {
        return findOffset(text) >= 0;
    }

    /**
     * Same search as {@link #find(CharSequence)}, reporting where it succeeded.
     *
     * @return the smallest start offset at which a substring matches, 0 when the whole text
     *     matches, or -1 when no substring matches
     */
    public int findOffset(CharSequence text) {
        Objects.requireNonNull(text, "text cannot be null");
        if (run(text, 0, MatchMode.FULL)) {
            return 0;
        }
        for (int offset = 0; offset < text.length(); offset++) {
            if (run(text, offset, MatchMode.SEARCH)) {
                logger.trace("FsmRegex: Substring match found at offset {}", offset);
                return offset;
            }
        }
        return -1;
    }

    /**
     * Runs one attempt starting at {@code from}.
     *
     * @param text input
     * @param from index of the first character to consume
     * @param mode anchoring behavior
     * @return whether this attempt matched
     */
    public boolean run(CharSequence text, int from, MatchMode mode) {
        Objects.requireNonNull(text, "text cannot be null");
        Objects.requireNonNull(mode, "mode cannot be null");
        if (from < 0 || from > text.length()) {
            throw new IndexOutOfBoundsException("from " + from + " outside text of length " + text.length());
        }

        Simulation simulation = new Simulation(automaton, epsilonClosure);
        // The empty substring counts: a pattern that accepts "" is found in every text
        if (mode == MatchMode.SEARCH && simulation.isAccepting()) {
            return true;
        }
        for (int i = from; i < text.length(); i++) {
            if (!simulation.advance(text.charAt(i))) {
                return false;
            }
            if (mode == MatchMode.SEARCH && simulation.isAccepting()) {
                return true;
            }
        }
        return mode == MatchMode.FULL && simulation.isAccepting();
    }
}
