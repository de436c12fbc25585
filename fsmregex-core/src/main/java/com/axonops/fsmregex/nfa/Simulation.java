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

import java.util.BitSet;
import java.util.Objects;

/**
 * One matching attempt: the active state set plus the progress that belongs to this attempt only.
 *
 * <p>A simulation starts at the epsilon closure of the start state and moves forward one input
 * character at a time. The automaton itself is never written to; in particular, which quantifier
 * loops have consumed at least one character is recorded here, so two attempts over the same
 * automaton can never see each other's progress.
 *
 * <p>Not thread-safe. Create one per attempt.
 *
 * @since 1.0.0
 */
public final class Simulation {

    private final Automaton automaton;
    private final EpsilonClosure epsilonClosure;
    private final BitSet firedLoops;
    private BitSet active;
    private int consumed;

    Simulation(Automaton automaton, EpsilonClosure epsilonClosure) {
        this.automaton = Objects.requireNonNull(automaton, "automaton cannot be null");
        this.epsilonClosure = Objects.requireNonNull(epsilonClosure, "epsilonClosure cannot be null");
        this.firedLoops = new BitSet(automaton.stateCount());
        this.active = epsilonClosure.closure(automaton.start());
    }

    /**
     * Starts a fresh attempt on {@code automaton}.
     */
    public static Simulation begin(Automaton automaton) {
        return new Simulation(automaton, new EpsilonClosure(automaton));
    }

    /**
     * Consumes one character.
     *
     * <p>A state {@code t} one edge away from an active state becomes active when
     * {@code t.accepts(c)}: each state stands for "the atom it represents was just consumed". The
     * result is then closed under epsilon edges.
     *
     * @param c next input character
     * @return false if no state survived, in which case this attempt cannot succeed any more
     */
    public boolean advance(char c) {
        BitSet next = new BitSet(automaton.stateCount());
        for (int s = active.nextSetBit(0); s >= 0; s = active.nextSetBit(s + 1)) {
            for (int t : automaton.successors(s)) {
                if (!next.get(t) && automaton.state(t).accepts(c)) {
                    next.set(t);
                    int loop = automaton.loopOf(t);
                    if (loop >= 0) {
                        firedLoops.set(loop);
                    }
                }
            }
        }
        active = epsilonClosure.closure(next);
        consumed++;
        return !active.isEmpty();
    }

    /** True when the termination state is active. */
    public boolean isAccepting() {
        return active.get(automaton.termination());
    }

    /** True when no state is active. */
    public boolean isExhausted() {
        return active.isEmpty();
    }

    /**
     * Tests whether the quantifier at {@code loopIndex} has consumed a character in this attempt.
     */
    public boolean hasFired(int loopIndex) {
        return firedLoops.get(loopIndex);
    }

    /** Copy of the active state indices. */
    public BitSet activeStates() {
        return (BitSet) active.clone();
    }

    /** Copy of the indices of quantifier nodes that fired in this attempt. */
    public BitSet firedLoops() {
        return (BitSet) firedLoops.clone();
    }

    /** Number of characters consumed so far. */
    public int consumed() {
        return consumed;
    }
}
