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

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.Objects;

/**
 * Closes state sets under epsilon edges.
 *
 * <p>Reads only the epsilon targets of the automaton and never modifies its input, so one
 * instance can serve any number of concurrent attempts.
 *
 * @since 1.0.0
 */
public final class EpsilonClosure {

    private final Automaton automaton;

    public EpsilonClosure(Automaton automaton) {
        this.automaton = Objects.requireNonNull(automaton, "automaton cannot be null");
    }

    /**
     * Computes the smallest superset of {@code states} closed under epsilon edges.
     *
     * <p>Work-list traversal, O(V+E) over the reachable subgraph.
     *
     * @param states seed state indices (not modified)
     * @return a new set containing the seeds and everything epsilon-reachable from them
     */
    public BitSet closure(BitSet states) {
        BitSet result = (BitSet) states.clone();
        Deque<Integer> work = new ArrayDeque<>();
        for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
            work.push(s);
        }
        while (!work.isEmpty()) {
            int s = work.pop();
            for (int t : automaton.epsilonTargets(s)) {
                if (!result.get(t)) {
                    result.set(t);
                    work.push(t);
                }
            }
        }
        return result;
    }

    /** Closure of a single state. */
    public BitSet closure(int state) {
        BitSet seed = new BitSet(automaton.stateCount());
        seed.set(state);
        return closure(seed);
    }
}
