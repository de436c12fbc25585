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

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A node kind of the compiled automaton.
 *
 * <p>Every variant answers a single question: can this state consume the given character.
 * {@link #accepts(char)} is the only place that decides it; the simulation never inspects the
 * concrete kind.
 *
 * <p>States carry no matching progress and are safe to share between threads.
 *
 * @since 1.0.0
 */
public sealed interface State
    permits State.Start,
            State.Termination,
            State.Wildcard,
            State.Literal,
            State.CharClass,
            State.Star,
            State.Plus {

    /**
     * Tests whether this state consumes {@code c}.
     *
     * @param c input character
     * @return true if a transition into this state may consume {@code c}
     */
    boolean accepts(char c);

    /** Sole entry point of an automaton. */
    record Start() implements State {
        @Override
        public boolean accepts(char c) {
            return false;
        }
    }

    /** Sole accept marker of an automaton. */
    record Termination() implements State {
        @Override
        public boolean accepts(char c) {
            return false;
        }
    }

    /** The {@code .} atom. */
    record Wildcard() implements State {
        @Override
        public boolean accepts(char c) {
            return true;
        }
    }

    /** A single literal character. */
    record Literal(char symbol) implements State {
        @Override
        public boolean accepts(char c) {
            return c == symbol;
        }
    }

    /**
     * A bracketed character class such as {@code [a-z0-9_]}.
     *
     * @param members every character the class accepts
     */
    record CharClass(Set<Character> members) implements State {

        public CharClass {
            members = Set.copyOf(members);
        }

        /**
         * Expands a class definition (the text between {@code [} and {@code ]}).
         *
         * <p>{@code X-Y} adds every character from X to Y inclusive. A dash with nothing after it
         * is a literal member, and a reversed range adds nothing.
         *
         * @param definition class body without brackets
         * @return the expanded class
         */
        public static CharClass parse(String definition) {
            Objects.requireNonNull(definition, "definition cannot be null");
            Set<Character> members = new LinkedHashSet<>();
            int i = 0;
            while (i < definition.length()) {
                if (i + 2 < definition.length() && definition.charAt(i + 1) == '-') {
                    char from = definition.charAt(i);
                    char to = definition.charAt(i + 2);
                    for (int c = from; c <= to; c++) {
                        members.add((char) c);
                    }
                    i += 3;
                } else {
                    members.add(definition.charAt(i));
                    i++;
                }
            }
            return new CharClass(members);
        }

        @Override
        public boolean accepts(char c) {
            return members.contains(c);
        }
    }

    /**
     * Loop node of {@code atom*}.
     *
     * <p>Zero repetitions are wired structurally by the compiler; the predicate only mirrors the
     * repeated atom.
     */
    record Star(State inner) implements State {

        public Star {
            Objects.requireNonNull(inner, "inner cannot be null");
        }

        @Override
        public boolean accepts(char c) {
            return inner.accepts(c);
        }
    }

    /**
     * Loop node of {@code atom+}.
     *
     * <p>Whether the loop has fired during a match is tracked by {@link Simulation}, not here.
     */
    record Plus(State inner) implements State {

        public Plus {
            Objects.requireNonNull(inner, "inner cannot be null");
        }

        @Override
        public boolean accepts(char c) {
            return inner.accepts(c);
        }
    }
}
