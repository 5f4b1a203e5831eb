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
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Generates labeled sequences by running the generative process of a model: draw the first
 * state from the initial probabilities, let every state emit a symbol and move on along the
 * transition probabilities. The result can be used as synthetic training data.
 * <p>
 * If a state has no outgoing transition the sequence ends early.
 */
public class SequenceSampler {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final HiddenMarkovModel model;
    private final Random random;
    private int maxLength = 1000;

    public SequenceSampler(HiddenMarkovModel model, Random random) {
        if (model == null || random == null) {
            throw new NullPointerException();
        }
        this.model = model;
        this.random = random;
    }

    /**
     * Upper bound for the length of sequences sampled with {@link #sample()}.
     */
    public SequenceSampler setMaxLength(int maxLength) {
        if (maxLength < 1) {
            throw new IllegalArgumentException("maxLength must be positive but was " + maxLength);
        }
        this.maxLength = maxLength;
        return this;
    }

    /**
     * Samples a sequence with the specified length. Termination probabilities are ignored, the
     * next state is drawn from the transition probabilities scaled to 1.
     *
     * @throws IllegalStateException if the model has no initial state or a state cannot emit any
     *                               symbol
     */
    public LabeledSequence sample(int length) {
        if (length < 1) {
            throw new IllegalArgumentException("length must be positive but was " + length);
        }
        return sample(length, false);
    }

    /**
     * Samples a sequence of a model with terminal state. After each emission the sequence ends
     * with the termination probability of the current state, otherwise it continues along the
     * transitions. Sequences are cut at {@link #setMaxLength(int)}.
     *
     * @throws IllegalStateException if the model has no terminal state
     */
    public LabeledSequence sample() {
        if (!model.hasTerminalState()) {
            throw new IllegalStateException("Model has no terminal state, specify a sequence length");
        }
        return sample(maxLength, true);
    }

    /**
     * @param length the length of each sequence or 0 to let the termination probabilities of a
     *               model with terminal state decide
     */
    public List<LabeledSequence> sample(int count, int length) {
        List<LabeledSequence> result = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            result.add(model.hasTerminalState() && length <= 0 ? sample() : sample(length));
        }
        return result;
    }

    private LabeledSequence sample(int length, boolean terminate) {
        List<String> labels = new ArrayList<>();
        List<String> observations = new ArrayList<>();

        String state = drawInitialState();
        while (true) {
            labels.add(state);
            observations.add(drawSymbol(state));
            if (labels.size() >= length) {
                if (terminate)
                    logger.debug("Sequence cut at maximum length " + length);
                break;
            }

            State current = model.getState(state);
            List<String> targets = new ArrayList<>();
            List<Double> weights = new ArrayList<>();
            if (terminate) {
                targets.add(null);
                weights.add(current.getTerminationProbability());
            }
            for (Map.Entry<String, Double> entry : current.getTransitionProbabilities().entrySet()) {
                targets.add(entry.getKey());
                weights.add(entry.getValue());
            }
            int index = Utils.drawIndex(weights, random.nextDouble());
            if (index < 0 || targets.get(index) == null)
                break;
            state = targets.get(index);
        }
        return new LabeledSequence(observations, labels);
    }

    private String drawInitialState() {
        List<String> names = model.getInitialStates();
        List<Double> weights = new ArrayList<>(names.size());
        for (String name : names) {
            weights.add(model.getState(name).getInitialProbability());
        }
        int index = Utils.drawIndex(weights, random.nextDouble());
        if (index < 0) {
            throw new IllegalStateException("Model has no initial state");
        }
        return names.get(index);
    }

    private String drawSymbol(String state) {
        Map<String, Double> emissions = model.getState(state).getEmissionProbabilities();
        List<String> symbols = new ArrayList<>(emissions.keySet());
        int index = Utils.drawIndex(new ArrayList<>(emissions.values()), random.nextDouble());
        if (index < 0) {
            throw new IllegalStateException("State " + state + " cannot emit any symbol");
        }
        return symbols.get(index);
    }
}
