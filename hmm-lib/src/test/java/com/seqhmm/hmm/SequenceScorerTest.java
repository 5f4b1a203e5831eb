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

import com.seqhmm.hmm.SequenceScore.InvalidReason;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.seqhmm.hmm.HmmTestModels.map;
import static java.lang.Math.log10;
import static org.junit.jupiter.api.Assertions.*;

public class SequenceScorerTest {

    private static final double DELTA = 1e-10;

    @Test
    public void testLogProbabilitiesAreAdded() {
        HiddenMarkovModel model = HmmTestModels.casino();
        List<String> states = Arrays.asList("Fair", "Fair", "Loaded", "Loaded");
        List<String> observations = Arrays.asList("3", "6", "6", "1");

        SequenceScore score = model.score(states, observations);
        assertTrue(score.isValid());

        double product = 0.5 * (1.0 / 6) * 0.95 * (1.0 / 6) * 0.05 * 0.5 * 0.95 * 0.1;
        assertEquals(product, Math.pow(10, score.getLog10Probability()), 1e-12);
        double sum = log10(0.5) + log10(1.0 / 6) + log10(0.95) + log10(1.0 / 6) + log10(0.05) + log10(0.5)
                + log10(0.95) + log10(0.1);
        assertEquals(sum, score.getLog10Probability(), DELTA);
    }

    @Test
    public void testZeroInitialProbability() {
        State zero = new State("A", 0.0, map("x", 1.0), map("A", 1.0));
        HiddenMarkovModel model = new HiddenMarkovModel(Arrays.asList("x"),
                Arrays.asList(zero, new State("B", 1.0, map("x", 1.0), map("A", 1.0))));

        SequenceScore score = model.score(Arrays.asList("A", "A"), Arrays.asList("x", "x"));
        assertFalse(score.isValid());
        assertEquals(InvalidReason.ZERO_INITIAL, score.getInvalidReason());
        assertEquals(0, score.getPosition());
    }

    @Test
    public void testZeroAndMissingTransitionBehaveTheSame() {
        HiddenMarkovModel explicitZero = new HiddenMarkovModel(Arrays.asList("x"), Arrays.asList(
                new State("A", 1.0, map("x", 1.0), map("A", 1.0, "B", 0.0)),
                new State("B", 0.0, map("x", 1.0), map("B", 1.0))));
        HiddenMarkovModel missingKey = new HiddenMarkovModel(Arrays.asList("x"), Arrays.asList(
                new State("A", 1.0, map("x", 1.0), map("A", 1.0)),
                new State("B", 0.0, map("x", 1.0), map("B", 1.0))));

        List<String> states = Arrays.asList("A", "A", "B");
        List<String> observations = Arrays.asList("x", "x", "x");
        for (HiddenMarkovModel model : Arrays.asList(explicitZero, missingKey)) {
            SequenceScore score = model.score(states, observations);
            assertFalse(score.isValid());
            assertEquals(InvalidReason.ZERO_TRANSITION, score.getInvalidReason());
            assertEquals(2, score.getPosition());
        }
    }

    @Test
    public void testZeroAndMissingEmissionBehaveTheSame() {
        HiddenMarkovModel explicitZero = new HiddenMarkovModel(Arrays.asList("x", "y"), Arrays.asList(
                new State("A", 1.0, map("x", 1.0, "y", 0.0), map("A", 1.0))));
        HiddenMarkovModel missingKey = new HiddenMarkovModel(Arrays.asList("x", "y"), Arrays.asList(
                new State("A", 1.0, map("x", 1.0), map("A", 1.0))));

        for (HiddenMarkovModel model : Arrays.asList(explicitZero, missingKey)) {
            SequenceScore score = model.score(Arrays.asList("A", "A"), Arrays.asList("x", "y"));
            assertFalse(score.isValid());
            assertEquals(InvalidReason.ZERO_EMISSION, score.getInvalidReason());
            assertEquals(1, score.getPosition());
        }
    }

    @Test
    public void testTerminalStateGating() {
        HiddenMarkovModel model = HmmTestModels.terminal();

        SequenceScore score = model.score(Arrays.asList("A", "B"), Arrays.asList("x", "y"));
        assertTrue(score.isValid());
        // the termination probability is not part of the score
        assertEquals(log10(1.0 * 1.0 * 0.5 * 0.5), score.getLog10Probability(), DELTA);

        score = model.score(Arrays.asList("A"), Arrays.asList("x"));
        assertFalse(score.isValid());
        assertEquals(InvalidReason.NOT_TERMINATING, score.getInvalidReason());

        score = model.score(Arrays.asList("A", "A"), Arrays.asList("x", "x"));
        assertEquals(InvalidReason.NOT_TERMINATING, score.getInvalidReason());
        assertEquals(1, score.getPosition());
    }

    @Test
    public void testUnknownState() {
        SequenceScore score = HmmTestModels.casino().score(Arrays.asList("Fair", "Cheat"), Arrays.asList("1", "2"));
        assertEquals(InvalidReason.UNKNOWN_STATE, score.getInvalidReason());
        assertEquals(1, score.getPosition());
    }

    @Test
    public void testEmptySequence() {
        SequenceScore score = HmmTestModels.casino().score(Collections.<String>emptyList(),
                Collections.<String>emptyList());
        assertTrue(score.isValid());
        assertEquals(0.0, score.getLog10Probability());

        score = HmmTestModels.terminal().score(Collections.<String>emptyList(), Collections.<String>emptyList());
        assertEquals(InvalidReason.NOT_TERMINATING, score.getInvalidReason());
    }

    @Test
    public void testDifferentLengths() {
        assertThrows(IllegalArgumentException.class,
                () -> HmmTestModels.casino().score(Arrays.asList("Fair"), Arrays.asList("1", "2")));
    }

    @Test
    public void testInvalidScoreHasNoProbability() {
        SequenceScore score = HmmTestModels.casino().score(Arrays.asList("Fair"), Arrays.asList("7"));
        assertFalse(score.isValid());
        assertThrows(IllegalStateException.class, score::getLog10Probability);
        assertEquals("invalid: ZERO_EMISSION at 0", score.toString());
    }
}
