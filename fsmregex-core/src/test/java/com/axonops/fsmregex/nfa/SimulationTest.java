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

import static org.assertj.core.api.Assertions.*;

class SimulationTest {

    private static int plusNode(Automaton automaton) {
        for (int i = 0; i < automaton.stateCount(); i++) {
            if (automaton.state(i) instanceof State.Plus) {
                return i;
            }
        }
        throw new AssertionError("No Plus node in " + automaton.describe());
    }

    @Test
    void testInitialSetIsStartClosure() {
        Automaton automaton = PatternCompiler.compile("a*");
        Simulation simulation = Simulation.begin(automaton);

        assertThat(simulation.activeStates()).isEqualTo(new EpsilonClosure(automaton).closure(automaton.start()));
        assertThat(simulation.isAccepting()).isTrue();
        assertThat(simulation.consumed()).isZero();
    }

    @Test
    void testAdvanceMovesThroughLiterals() {
        Simulation simulation = Simulation.begin(PatternCompiler.compile("ab"));

        assertThat(simulation.isAccepting()).isFalse();
        assertThat(simulation.advance('a')).isTrue();
        assertThat(simulation.isAccepting()).isFalse();
        assertThat(simulation.advance('b')).isTrue();
        assertThat(simulation.isAccepting()).isTrue();
        assertThat(simulation.consumed()).isEqualTo(2);
    }

    @Test
    void testAdvanceExhausts() {
        Simulation simulation = Simulation.begin(PatternCompiler.compile("ab"));

        assertThat(simulation.advance('x')).isFalse();
        assertThat(simulation.isExhausted()).isTrue();
        assertThat(simulation.isAccepting()).isFalse();
    }

    @Test
    void testSecondLiteralRequiresItsOwnCharacter() {
        // "aa" must not satisfy "ab": the b node is entered only on 'b'
        Simulation simulation = Simulation.begin(PatternCompiler.compile("ab"));

        simulation.advance('a');
        assertThat(simulation.advance('a')).isFalse();
    }

    @Test
    void testPlusFiresOnFirstRepetition() {
        Automaton automaton = PatternCompiler.compile("ab+");
        int plus = plusNode(automaton);
        Simulation simulation = Simulation.begin(automaton);

        simulation.advance('a');
        assertThat(simulation.hasFired(plus)).isFalse();

        simulation.advance('b');
        assertThat(simulation.hasFired(plus)).isTrue();
        assertThat(simulation.firedLoops().get(plus)).isTrue();
        assertThat(simulation.isAccepting()).isTrue();
    }

    @Test
    void testFiredLoopsAreScopedToOneAttempt() {
        Automaton automaton = PatternCompiler.compile("a+");
        int plus = plusNode(automaton);

        Simulation first = Simulation.begin(automaton);
        first.advance('a');
        first.advance('a');
        assertThat(first.hasFired(plus)).isTrue();

        Simulation second = Simulation.begin(automaton);
        assertThat(second.hasFired(plus)).isFalse();
        assertThat(second.firedLoops().isEmpty()).isTrue();
        assertThat(second.isAccepting()).isFalse();
    }

    @Test
    void testSnapshotsAreCopies() {
        Simulation simulation = Simulation.begin(PatternCompiler.compile("a"));

        simulation.activeStates().clear();
        simulation.firedLoops().set(0);

        assertThat(simulation.activeStates().isEmpty()).isFalse();
        assertThat(simulation.firedLoops().isEmpty()).isTrue();
    }

    @Test
    void testAutomatonUnchangedByMatching() {
        Automaton automaton = PatternCompiler.compile("x[a-c]*y+");
        String before = automaton.describe();

        Simulation simulation = Simulation.begin(automaton);
        for (char c : "xabcyyy".toCharArray()) {
            simulation.advance(c);
        }

        assertThat(simulation.isAccepting()).isTrue();
        assertThat(automaton.describe()).isEqualTo(before);
    }
}
