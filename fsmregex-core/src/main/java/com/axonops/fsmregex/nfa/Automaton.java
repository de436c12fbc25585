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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compiled state graph of a pattern.
 *
 * <p>States live in an arena and are addressed by stable integer indices; every edge (labeled or
 * epsilon) is an index set, so quantifier loops need no object cycles. An automaton is immutable
 * once built and may be shared freely between threads and matching attempts.
 *
 * <p>Exactly one {@link State.Start} and one {@link State.Termination} exist per automaton. Neither
 * is ever entered by consuming a character, and the termination state has no outgoing edges.
 *
 * @since 1.0.0
 */
public final class Automaton {

    private static final int NO_LOOP = -1;

    private final List<State> states;
    private final List<Map<String, int[]>> transitions;
    private final List<int[]> epsilonTargets;
    private final List<int[]> successors;
    private final int[] loopOf;
    private final int start;
    private final int termination;

    private Automaton(Builder builder) {
        int size = builder.states.size();
        this.states = List.copyOf(builder.states);
        this.start = builder.start;
        this.termination = builder.termination;
        int[] owners = new int[size];
        Arrays.fill(owners, NO_LOOP);
        builder.loops.forEach((body, loop) -> owners[body] = loop);
        this.loopOf = owners;

        List<Map<String, int[]>> labeled = new ArrayList<>(size);
        List<int[]> epsilon = new ArrayList<>(size);
        List<int[]> all = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            Map<String, int[]> byLabel = new LinkedHashMap<>();
            Set<Integer> union = new LinkedHashSet<>();
            for (Map.Entry<String, Set<Integer>> e : builder.transitions.get(i).entrySet()) {
                byLabel.put(e.getKey(), toArray(e.getValue()));
                union.addAll(e.getValue());
            }
            Set<Integer> eps = builder.epsilon.get(i);
            union.addAll(eps);
            labeled.add(Collections.unmodifiableMap(byLabel));
            epsilon.add(toArray(eps));
            all.add(toArray(union));
        }
        this.transitions = List.copyOf(labeled);
        this.epsilonTargets = List.copyOf(epsilon);
        this.successors = List.copyOf(all);
    }

    /** Creates a builder holding just the start and termination states. */
    public static Builder builder() {
        return new Builder();
    }

    public int start() {
        return start;
    }

    public int termination() {
        return termination;
    }

    public int stateCount() {
        return states.size();
    }

    public State state(int index) {
        return states.get(index);
    }

    /**
     * Labeled transitions out of a state.
     *
     * @param index source state
     * @return unmodifiable map from label to target indices; the arrays must not be modified
     */
    public Map<String, int[]> transitions(int index) {
        return transitions.get(index);
    }

    /**
     * Epsilon targets of a state (the array must not be modified).
     */
    public int[] epsilonTargets(int index) {
        return epsilonTargets.get(index);
    }

    /**
     * Every state one edge away from {@code index}, labeled or epsilon, without duplicates.
     */
    int[] successors(int index) {
        return successors.get(index);
    }

    /**
     * Quantifier node owning {@code index}, for loop bodies and loop nodes alike.
     *
     * @return index of the {@link State.Star} or {@link State.Plus} node, or -1
     */
    int loopOf(int index) {
        return loopOf[index];
    }

    /**
     * Renders the graph one state per line, for logs and test diagnostics.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < states.size(); i++) {
            sb.append(i).append(' ').append(states.get(i));
            transitions.get(i).forEach((label, targets) ->
                sb.append(" -[").append(label).append("]-> ").append(Arrays.toString(targets)));
            int[] eps = epsilonTargets.get(i);
            if (eps.length > 0) {
                sb.append(" -eps-> ").append(Arrays.toString(eps));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Automaton[states=" + states.size() + ", start=" + start + ", termination=" + termination + "]";
    }

    private static int[] toArray(Set<Integer> set) {
        int[] out = new int[set.size()];
        int i = 0;
        for (int v : set) {
            out[i++] = v;
        }
        return out;
    }

    /**
     * Mutable construction side of {@link Automaton}.
     *
     * <p>Not thread-safe. Edge sets are deduplicated, so adding the same edge twice is harmless.
     */
    public static final class Builder {
        private final List<State> states = new ArrayList<>();
        private final List<Map<String, Set<Integer>>> transitions = new ArrayList<>();
        private final List<Set<Integer>> epsilon = new ArrayList<>();
        private final Map<Integer, Integer> loops = new HashMap<>();
        private final int start;
        private final int termination;

        private Builder() {
            this.start = addNode(new State.Start());
            this.termination = addNode(new State.Termination());
        }

        public int start() {
            return start;
        }

        public int termination() {
            return termination;
        }

        /**
         * Adds a state to the arena.
         *
         * @param state any variant except start and termination, which the builder owns
         * @return index of the new state
         */
        public int addState(State state) {
            Objects.requireNonNull(state, "state cannot be null");
            if (state instanceof State.Start || state instanceof State.Termination) {
                throw new IllegalArgumentException("Automaton already has its " + state + " state");
            }
            return addNode(state);
        }

        /**
         * Adds a consuming edge. The target must be a state that accepts at least one character
         * kind, so start and termination are rejected as targets.
         */
        public void addTransition(int from, String label, int to) {
            Objects.requireNonNull(label, "label cannot be null");
            checkSource(from);
            checkIndex(to);
            if (to == start || to == termination) {
                throw new IllegalArgumentException("Consuming edge cannot enter state " + to);
            }
            transitions.get(from).computeIfAbsent(label, k -> new LinkedHashSet<>()).add(to);
        }

        public void addEpsilon(int from, int to) {
            checkSource(from);
            checkIndex(to);
            if (to == start) {
                throw new IllegalArgumentException("Epsilon edge cannot enter the start state");
            }
            epsilon.get(from).add(to);
        }

        /**
         * Records that {@code body} and {@code loop} belong to the quantifier {@code loop}.
         */
        public void addLoop(int body, int loop) {
            checkIndex(body);
            checkIndex(loop);
            loops.put(body, loop);
            loops.put(loop, loop);
        }

        public Automaton build() {
            return new Automaton(this);
        }

        private int addNode(State state) {
            states.add(state);
            transitions.add(new LinkedHashMap<>());
            epsilon.add(new LinkedHashSet<>());
            return states.size() - 1;
        }

        private void checkSource(int from) {
            checkIndex(from);
            if (from == termination) {
                throw new IllegalArgumentException("Termination state cannot have outgoing edges");
            }
        }

        private void checkIndex(int index) {
            if (index < 0 || index >= states.size()) {
                throw new IndexOutOfBoundsException("No state " + index + " (size " + states.size() + ")");
            }
        }
    }
}
