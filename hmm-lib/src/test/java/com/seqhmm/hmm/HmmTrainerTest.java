/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for 
 *  additional information regarding copyright ownership.
 * 
 *  GraphHopper GmbH licenses this file to you under the Apache License, 
 *  Version 2.0 (the "License"); you may not use this file except in 
 *  compliance with the License. You may obtain a copy of the License at
 * 
 *       http://www.apache.org/licenses/LICENSE-2.0
 * 
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package com.seqhmm.hmm;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class HmmTrainerTest {

    private static final double DELTA = 1e-10;

    private static List<LabeledSequence> simpleData() {
        return Arrays.asList(
                new LabeledSequence(Arrays.asList("a", "b"), Arrays.asList("X", "Y")),
                new LabeledSequence(Arrays.asList("a", "a"), Arrays.asList("X", "X")),
                new LabeledSequence(Arrays.asList("b"), Arrays.asList("Y")));
    }

    @Test
    public void testCounts() {
        HiddenMarkovModel model = new HmmTrainer().train(simpleData());

        assertEquals(Arrays.asList("a", "b"), model.getAlphabet());
        assertEquals(Arrays.asList("X", "Y"), model.getStateNames());
        assertFalse(model.hasTerminalState());

        State x = model.getState("X");
        assertEquals(2.0 / 3, x.getInitialProbability(), DELTA);
        assertEquals(1.0, x.getEmissionProbability("a"), DELTA);
        assertFalse(x.getEmissionProbabilities().containsKey("b"));
        assertEquals(0.5, x.getTransitionProbability("X"), DELTA);
        assertEquals(0.5, x.getTransitionProbability("Y"), DELTA);
        assertEquals(0.0, x.getTerminationProbability());

        State y = model.getState("Y");
        assertEquals(1.0 / 3, y.getInitialProbability(), DELTA);
        assertEquals(1.0, y.getEmissionProbability("b"), DELTA);
    }

    @Test
    public void testStateOnlyAtTheEnd() {
        // Y never occurs at a non-final position, so there is nothing to normalize its transitions with
        State y = new HmmTrainer().train(simpleData()).getState("Y");
        assertTrue(y.getTransitionProbabilities().isEmpty());
        assertEquals(0.0, y.getTerminationProbability());
    }

    @Test
    public void testTerminalState() {
        HmmTrainer trainer = new HmmTrainer().setIncludeTerminalState(true);
        assertTrue(trainer.isIncludeTerminalState());
        HiddenMarkovModel model = trainer.train(simpleData());
        assertTrue(model.hasTerminalState());
        assertEquals(Arrays.asList("X", "Y"), model.getTerminatingStates());

        // X: two transitions and one sample ending in X
        State x = model.getState("X");
        assertEquals(1.0 / 3, x.getTransitionProbability("X"), DELTA);
        assertEquals(1.0 / 3, x.getTransitionProbability("Y"), DELTA);
        assertEquals(1.0 / 3, x.getTerminationProbability(), DELTA);

        State y = model.getState("Y");
        assertTrue(y.getTransitionProbabilities().isEmpty());
        assertEquals(1.0, y.getTerminationProbability(), DELTA);

        assertTrue(model.score(Arrays.asList("X", "X"), Arrays.asList("a", "a")).isValid());
        assertEquals(Arrays.asList("X", "Y"), model.viterbi(Arrays.asList("a", "b")).getSequence());
    }

    @Test
    public void testTerminalStateAsArgument() {
        HmmTrainer trainer = new HmmTrainer();
        HiddenMarkovModel model = trainer.train(simpleData(), true);
        assertTrue(model.hasTerminalState());
        assertEquals(1.0 / 3, model.getState("X").getTerminationProbability(), DELTA);
        assertTrue(trainer.isIncludeTerminalState());

        assertFalse(trainer.train(simpleData(), false).hasTerminalState());
        assertFalse(trainer.train(simpleData()).hasTerminalState());
    }

    @Test
    public void testInvalidTrainingData() {
        assertThrows(IllegalArgumentException.class,
                () -> new HmmTrainer().train(Collections.<LabeledSequence>emptyList()));
        assertThrows(IllegalArgumentException.class,
                () -> new LabeledSequence(Arrays.asList("a", "b"), Arrays.asList("X")));
        assertThrows(IllegalArgumentException.class,
                () -> new LabeledSequence(Collections.<String>emptyList(), Collections.<String>emptyList()));
    }

    @Test
    public void testConvergesToSampledModel() {
        HiddenMarkovModel casino = HmmTestModels.casino();
        List<LabeledSequence> data = new SequenceSampler(casino, new Random(42)).sample(2000, 50);
        HiddenMarkovModel model = new HmmTrainer().train(data);

        assertEquals(HmmTestModels.DICE, model.getAlphabet());
        assertEquals(Arrays.asList("Fair", "Loaded"), model.getStateNames());
        for (String name : model.getStateNames()) {
            State expected = casino.getState(name);
            State actual = model.getState(name);
            assertEquals(expected.getInitialProbability(), actual.getInitialProbability(), 0.05, name);
            for (String side : HmmTestModels.DICE) {
                assertEquals(expected.getEmissionProbability(side), actual.getEmissionProbability(side), 0.02,
                        name + " " + side);
            }
            for (String target : model.getStateNames()) {
                assertEquals(expected.getTransitionProbability(target), actual.getTransitionProbability(target), 0.01,
                        name + " -> " + target);
            }
        }
    }

    @Test
    public void testConvergesWithTerminalState() {
        HiddenMarkovModel terminal = HmmTestModels.terminal();
        List<LabeledSequence> data = new SequenceSampler(terminal, new Random(7)).sample(5000, 0);
        HiddenMarkovModel model = new HmmTrainer().setIncludeTerminalState(true).train(data);

        assertEquals(Arrays.asList("B"), model.getTerminatingStates());
        State a = model.getState("A");
        State b = model.getState("B");
        assertEquals(1.0, a.getInitialProbability(), DELTA);
        assertEquals(0.5, a.getTransitionProbability("B"), 0.02);
        assertEquals(0.5, b.getTerminationProbability(), 0.02);
        assertEquals(0.5, b.getTransitionProbability("B"), 0.02);
        assertEquals(0.5, b.getEmissionProbability("y"), 0.02);
    }
}
