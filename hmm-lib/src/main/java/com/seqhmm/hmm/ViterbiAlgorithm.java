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
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static java.lang.Math.log10;

/**
 * Implementation of the Viterbi algorithm for a stationary hidden Markov model, described e.g.
 * in Rabiner, Juang, An introduction to Hidden Markov Models, IEEE ASSP Mag., pp 4-16, June 1986.
 * <p>
 * The forward pass fills a {@link Trellis} column by column. The most likely sequence is then
 * recovered backwards: starting with the best state of the last column, each step picks the
 * predecessor of the already chosen state from a read-only snapshot of the previous column.
 * <p>
 * All computations use log10 probabilities to prevent arithmetic underflows for long sequences.
 * A probability of zero and a missing probability are treated the same, both mean there is no
 * edge or emission.
 * <p>
 * States are processed in the order of {@link HiddenMarkovModel#getStateNames()} and a candidate
 * only replaces the current best if it is strictly more likely. So if several candidates are
 * equally likely the one with the smallest name is chosen.
 * <p>
 * Runs in O(t*n²) for t observations and n states. Instances hold no state between calls.
 */
public class ViterbiAlgorithm {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final HiddenMarkovModel model;
    private final List<String> stateNames;

    public ViterbiAlgorithm(HiddenMarkovModel model) {
        if (model == null) {
            throw new NullPointerException();
        }
        this.model = model;
        this.stateNames = model.getStateNames();
    }

    /**
     * Computes the most likely state sequence for the specified observations.
     *
     * @return the sequence and its log10 probability or a broken result if no state sequence can
     * explain the observations
     */
    public ViterbiResult compute(List<String> observations) {
        Trellis trellis = computeTrellis(observations);
        if (trellis.isEmpty()) {
            return ViterbiResult.broken(0, trellis);
        }

        int last = trellis.size() - 1;
        int lastState = mostLikelyState(trellis, last);
        if (lastState < 0) {
            int brokenAt = firstBrokenColumn(trellis);
            logger.debug("No state sequence for {} observations, trellis broken at column {}", trellis.size(), brokenAt);
            return ViterbiResult.broken(brokenAt, trellis);
        }

        // Retrieve most likely state sequence in reverse order
        List<String> sequence = new ArrayList<>(trellis.size());
        String nextState = stateNames.get(lastState);
        sequence.add(nextState);
        for (int t = last - 1; t >= 0; t--) {
            String state = bestPredecessor(trellis.column(t), nextState);
            if (state == null) {
                logger.warn("No predecessor for {} in column {}", nextState, t);
                return ViterbiResult.broken(t, trellis);
            }
            sequence.add(state);
            nextState = state;
        }
        Collections.reverse(sequence);
        return ViterbiResult.found(sequence, trellis.get(last, lastState), trellis);
    }

    /**
     * Computes the trellis for the specified observations. The observations are not checked
     * against the alphabet of the model, unknown symbols simply cannot be emitted.
     */
    public Trellis computeTrellis(List<String> observations) {
        if (observations == null) {
            throw new NullPointerException();
        }

        List<String> obs = new ArrayList<>(observations); // Defensive copy.
        double[][] cells = new double[obs.size()][];
        for (int t = 0; t < obs.size(); t++) {
            if (t == 0) {
                cells[t] = initialColumn(obs.get(t));
            } else {
                cells[t] = forwardStep(cells[t - 1], obs.get(t));
            }

            // the last column can only include those states that can transition to the
            // implicit terminal state, if one exists
            if (t == obs.size() - 1 && model.hasTerminalState()) {
                terminate(cells[t]);
            }
        }
        return new Trellis(stateNames, obs, cells);
    }

    /**
     * Only states with a non-zero initial probability that can emit the first observation get a
     * defined value.
     */
    private double[] initialColumn(String observation) {
        double[] column = new double[stateNames.size()];
        for (int i = 0; i < column.length; i++) {
            State state = model.getState(stateNames.get(i));
            if (state.isInitial() && state.canEmit(observation)) {
                column[i] = log10(state.getInitialProbability()) + log10(state.getEmissionProbability(observation));
            } else {
                column[i] = Double.NEGATIVE_INFINITY;
            }
        }
        return column;
    }

    /**
     * Computes the next column from the previous one.
     */
    private double[] forwardStep(double[] prevColumn, String observation) {
        double[] column = new double[stateNames.size()];
        for (int i = 0; i < column.length; i++) {
            String curState = stateNames.get(i);
            double emission = model.emissionProbability(curState, observation);
            double maxLogProbability = Double.NEGATIVE_INFINITY;
            if (emission > 0.0) {
                for (int j = 0; j < prevColumn.length; j++) {
                    if (prevColumn[j] == Double.NEGATIVE_INFINITY)
                        continue;
                    double transition = model.transitionProbability(stateNames.get(j), curState);
                    if (transition <= 0.0)
                        continue;

                    double logProbability = prevColumn[j] + log10(emission) + log10(transition);
                    if (logProbability > maxLogProbability) {
                        maxLogProbability = logProbability;
                    }
                }
            }
            column[i] = maxLogProbability;
        }
        return column;
    }

    private void terminate(double[] column) {
        for (int i = 0; i < column.length; i++) {
            State state = model.getState(stateNames.get(i));
            if (!state.isTerminating()) {
                column[i] = Double.NEGATIVE_INFINITY;
            } else if (column[i] != Double.NEGATIVE_INFINITY) {
                column[i] += log10(state.getTerminationProbability());
            }
        }
    }

    /**
     * Retrieves the index of the first state of the column with maximum probability or -1 if no
     * cell is defined.
     */
    private int mostLikelyState(Trellis trellis, int column) {
        int result = -1;
        double maxLogProbability = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < stateNames.size(); i++) {
            double value = trellis.get(column, i);
            if (value > maxLogProbability) {
                result = i;
                maxLogProbability = value;
            }
        }
        return result;
    }

    /**
     * Picks the state of the column that leads to nextState with maximum probability. Only states
     * with a defined cell and an edge to nextState are candidates. Returns null if there is no
     * candidate.
     */
    private String bestPredecessor(Map<String, Double> column, String nextState) {
        String result = null;
        double maxLogProbability = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> entry : column.entrySet()) {
            if (!model.connected(entry.getKey(), nextState))
                continue;

            double logProbability = entry.getValue() + log10(model.transitionProbability(entry.getKey(), nextState));
            if (result == null || logProbability > maxLogProbability) {
                result = entry.getKey();
                maxLogProbability = logProbability;
            }
        }
        return result;
    }

    private int firstBrokenColumn(Trellis trellis) {
        for (int t = 0; t < trellis.size(); t++) {
            if (trellis.isBroken(t))
                return t;
        }
        return trellis.size() - 1;
    }
}
