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

import com.axonops.fsmregex.api.PatternCompilationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Builds an {@link Automaton} from a pattern string.
 *
 * <p>Supported grammar: literal characters, the wildcard {@code .}, bracketed classes with ranges
 * ({@code [a-z0-9]}), and the postfix quantifiers {@code *} and {@code +} applied to the atom
 * right before them. There is no alternation or grouping, so concatenation is the only combinator
 * besides repetition and a single frontier state is enough: each atom is wired from the frontier,
 * then becomes (or its quantifier becomes) the new frontier.
 *
 * <p>Wiring per atom {@code A} with node {@code base}:
 * <pre>
 *   A     frontier -[A]-> base                                    frontier := base
 *   A*    frontier -eps-> q, frontier -[A]-> base,
 *         base -eps-> q, q -eps-> base                            frontier := q
 *   A+    frontier -[A]-> base, base -eps-> q, q -eps-> base      frontier := q
 * </pre>
 * The final frontier gets an epsilon edge to the termination state.
 *
 * @since 1.0.0
 */
public final class PatternCompiler {
    private static final Logger logger = LoggerFactory.getLogger(PatternCompiler.class);

    private final String pattern;
    private final Automaton.Builder builder = Automaton.builder();
    private int frontier;
    private int pos;

    private PatternCompiler(String pattern) {
        this.pattern = pattern;
        this.frontier = builder.start();
    }

    /**
     * Compiles a pattern.
     *
     * @param pattern pattern text; the empty pattern matches only the empty string
     * @return the compiled automaton
     * @throws PatternCompilationException if a quantifier has no atom to apply to, a class is not
     *     closed, or a {@code ]} appears outside a class
     */
    public static Automaton compile(String pattern) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        Automaton automaton = new PatternCompiler(pattern).run();
        logger.trace("FsmRegex: Compiled pattern - length: {}, states: {}", pattern.length(), automaton.stateCount());
        return automaton;
    }

    private Automaton run() {
        if (pattern.isEmpty()) {
            builder.addEpsilon(builder.start(), builder.termination());
            return builder.build();
        }

        while (pos < pattern.length()) {
            char c = pattern.charAt(pos);
            switch (c) {
                case '*', '+' -> throw new PatternCompilationException(pattern,
                    "Quantifier '" + c + "' has no preceding atom", pos);
                case ']' -> throw new PatternCompilationException(pattern, "Unmatched ']'", pos);
                case '[' -> charClass();
                case '.' -> atom(new State.Wildcard(), ".", pos + 1);
                default -> atom(new State.Literal(c), String.valueOf(c), pos + 1);
            }
        }

        builder.addEpsilon(frontier, builder.termination());
        return builder.build();
    }

    private void charClass() {
        int close = pattern.indexOf(']', pos + 1);
        if (close == -1) {
            throw new PatternCompilationException(pattern, "Unclosed character class", pos);
        }
        String definition = pattern.substring(pos + 1, close);
        atom(State.CharClass.parse(definition), pattern.substring(pos, close + 1), close + 1);
    }

    /**
     * Wires one atom, and its quantifier if the next character is one.
     *
     * @param state the atom's state
     * @param label source text of the atom, used as the transition label
     * @param next position right after the atom
     */
    private void atom(State state, String label, int next) {
        int base = builder.addState(state);
        builder.addTransition(frontier, label, base);
        pos = next;

        if (pos < pattern.length() && (pattern.charAt(pos) == '*' || pattern.charAt(pos) == '+')) {
            boolean star = pattern.charAt(pos) == '*';
            int loop = builder.addState(star ? new State.Star(state) : new State.Plus(state));
            if (star) {
                builder.addEpsilon(frontier, loop);
            }
            builder.addEpsilon(base, loop);
            builder.addEpsilon(loop, base);
            builder.addLoop(base, loop);
            frontier = loop;
            pos++;
        } else {
            frontier = base;
        }
    }
}
