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

import org.junit.jupiter.api.Test;

import java.util.BitSet;

import static org.assertj.core.api.Assertions.*;

class EpsilonClosureTest {

    private static BitSet bits(int... indices) {
        BitSet set = new BitSet();
        for (int i : indices) {
            set.set(i);
        }
        return set;
    }

    @Test
    void testClosureFollowsChains() {
        Automaton.Builder builder = Automaton.builder();
        int a = builder.addState(new State.Literal('a'));
        int b = builder.addState(new State.Literal('b'));
        int c = builder.addState(new State.Literal('c'));
        builder.addEpsilon(a, b);
        builder.addEpsilon(b, c);
        builder.addEpsilon(c, builder.termination());
        Automaton automaton = builder.build();

        EpsilonClosure closure = new EpsilonClosure(automaton);

        assertThat(closure.closure(a)).isEqualTo(bits(a, b, c, automaton.termination()));
        assertThat(closure.closure(c)).isEqualTo(bits(c, automaton.termination()));
    }

    @Test
    void testClosureTerminatesOnCycles() {
        Automaton automaton = PatternCompiler.compile("a*");
        EpsilonClosure closure = new EpsilonClosure(automaton);

        // start -eps-> loop <-eps-> base, loop -eps-> termination
        assertThat(closure.closure(automaton.start())).isEqualTo(bits(0, 1, 2, 3));
    }

    @Test
    void testClosureIgnoresLabeledEdges() {
        Automaton automaton = PatternCompiler.compile("ab");
        EpsilonClosure closure = new EpsilonClosure(automaton);

        assertThat(closure.closure(automaton.start())).isEqualTo(bits(automaton.start()));
    }

    @Test
    void testClosureDoesNotModifyInput() {
        Automaton automaton = PatternCompiler.compile("a+");
        EpsilonClosure closure = new EpsilonClosure(automaton);
        BitSet seed = bits(2);

        BitSet result = closure.closure(seed);

        assertThat(seed).isEqualTo(bits(2));
        assertThat(result).isEqualTo(bits(1, 2, 3));
    }

    @Test
    void testClosureIsIdempotent() {
        Automaton automaton = PatternCompiler.compile("a*b*c");
        EpsilonClosure closure = new EpsilonClosure(automaton);

        BitSet once = closure.closure(automaton.start());
        assertThat(closure.closure(once)).isEqualTo(once);
    }

    @Test
    void testEmptySeed() {
        EpsilonClosure closure = new EpsilonClosure(PatternCompiler.compile("a"));

        assertThat(closure.closure(new BitSet()).isEmpty()).isTrue();
    }
}
