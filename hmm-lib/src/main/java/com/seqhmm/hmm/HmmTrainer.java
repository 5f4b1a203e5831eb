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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Creates a new {@link HiddenMarkovModel} based solely on annotated training data. Both the
 * topology of the state interconnections and the probabilities of the emissions and transitions
 * are inferred by counting (maximum likelihood, no smoothing).
 * <p>
 * The transition probabilities of a state s are normalized by the number of non-final positions
 * labeled s. If the implicit terminal state is included, every sample ending in s counts as a
 * transition of s into the terminal state: it adds to the denominator and to the termination
 * probability of s.
 * <p>
 * A state that never occurs at a non-final position has no outgoing transitions. Without
 * terminal state its transition and termination probabilities are all zero.
 */
public class HmmTrainer {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private boolean includeTerminalState = false;

    /**
     * Whether an implicit terminal state should be included in the trained model.
     */
    public HmmTrainer setIncludeTerminalState(boolean includeTerminalState) {
        this.includeTerminalState = includeTerminalState;
        return this;
    }

    public boolean isIncludeTerminalState() {
        return includeTerminalState;
    }

    /**
     * Sets whether a terminal state is included and trains the model. The setting is kept for
     * later calls of {@link #train(Collection)}.
     */
    public HiddenMarkovModel train(Collection<LabeledSequence> trainingData, boolean includeTerminalState) {
        return setIncludeTerminalState(includeTerminalState).train(trainingData);
    }

    /**
     * @throws IllegalArgumentException if there are no training samples
     */
    public HiddenMarkovModel train(Collection<LabeledSequence> trainingData) {
        if (trainingData == null) {
            throw new NullPointerException();
        }
        if (trainingData.isEmpty()) {
            throw new IllegalArgumentException("Training data must not be empty");
        }

        // determine the states and the alphabet of symbols
        TreeSet<String> alphabet = new TreeSet<>();
        TreeSet<String> stateNames = new TreeSet<>();
        for (LabeledSequence sample : trainingData) {
            alphabet.addAll(sample.getObservations());
            stateNames.addAll(sample.getLabels());
        }

        Map<String, StateCounts> counts = new TreeMap<>();
        for (String name : stateNames) {
            counts.put(name, new StateCounts());
        }
        for (LabeledSequence sample : trainingData) {
            List<String> labels = sample.getLabels();
            List<String> observations = sample.getObservations();
            counts.get(sample.getFirstLabel()).initial++;
            for (int i = 0; i < labels.size(); i++) {
                StateCounts stateCounts = counts.get(labels.get(i));
                stateCounts.positions++;
                increment(stateCounts.emissions, observations.get(i));
                if (i < labels.size() - 1) {
                    stateCounts.transitionsOut++;
                    increment(stateCounts.transitions, labels.get(i + 1));
                }
            }
            if (includeTerminalState) {
                counts.get(sample.getLastLabel()).terminations++;
            }
        }

        List<State> states = new ArrayList<>(stateNames.size());
        for (Map.Entry<String, StateCounts> entry : counts.entrySet()) {
            states.add(entry.getValue().toState(entry.getKey(), trainingData.size()));
        }

        logger.info("Trained model from " + trainingData.size() + " samples, states: " + stateNames.size()
                + ", symbols: " + alphabet.size() + ", terminal state: " + includeTerminalState);
        return new HiddenMarkovModel(alphabet, states);
    }

    private static void increment(Map<String, Integer> map, String key) {
        map.merge(key, 1, Integer::sum);
    }

    private class StateCounts {
        int initial;
        int positions;
        int transitionsOut;
        int terminations;
        final Map<String, Integer> emissions = new TreeMap<>();
        final Map<String, Integer> transitions = new TreeMap<>();

        State toState(String name, int samples) {
            Map<String, Double> emissionProbabilities = normalize(emissions, positions);

            int denominator = transitionsOut + terminations;
            Map<String, Double> transitionProbabilities;
            double terminationProbability;
            if (denominator == 0) {
                logger.debug("State " + name + " only occurs at the end of samples, it has no outgoing transitions");
                transitionProbabilities = new TreeMap<>();
                terminationProbability = 0.0;
            } else {
                transitionProbabilities = normalize(transitions, denominator);
                terminationProbability = includeTerminalState ? terminations / (double) denominator : 0.0;
            }
            return new State(name, initial / (double) samples, emissionProbabilities, transitionProbabilities,
                    terminationProbability);
        }

        private Map<String, Double> normalize(Map<String, Integer> counts, int total) {
            Map<String, Double> result = new TreeMap<>();
            for (Map.Entry<String, Integer> entry : counts.entrySet()) {
                result.put(entry.getKey(), entry.getValue() / (double) total);
            }
            return result;
        }
    }
}
