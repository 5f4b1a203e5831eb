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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A hidden Markov model over a discrete alphabet of observable symbols.
 * <p>
 * The initial distribution (usually referred to as pi) is described by the states with a
 * non-zero initial probability. If at least one state has a non-zero termination probability
 * then there is an implicit end state and only those states with a non-zero termination
 * probability can be the last state of a valid state sequence.
 * <p>
 * States are always iterated in ascending order of their names. This order decides which state
 * wins if two candidates have exactly the same probability, so results are reproducible.
 * <p>
 * Instances are immutable and can be shared between threads.
 */
public class HiddenMarkovModel {

    private final List<String> alphabet;
    private final SortedMap<String, State> states;
    private final List<String> stateNames;
    private final List<String> initialStates;
    private final List<String> terminatingStates;

    /**
     * @param alphabet symbols that can possibly be emitted by any of the states, for instance
     *                 A, C, G and T for genomic data. Duplicates are ignored.
     * @throws IllegalArgumentException if two states have the same name
     */
    public HiddenMarkovModel(Collection<String> alphabet, Collection<State> states) {
        if (alphabet == null || states == null) {
            throw new NullPointerException();
        }

        this.alphabet = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(alphabet)));
        TreeMap<String, State> map = new TreeMap<>();
        List<String> initial = new ArrayList<>();
        List<String> terminating = new ArrayList<>();
        for (State state : states) {
            if (map.put(state.getName(), state) != null) {
                throw new IllegalArgumentException("Duplicate state name " + state.getName());
            }
        }
        for (State state : map.values()) {
            if (state.isInitial())
                initial.add(state.getName());
            if (state.isTerminating())
                terminating.add(state.getName());
        }
        this.states = Collections.unmodifiableSortedMap(map);
        this.stateNames = Collections.unmodifiableList(new ArrayList<>(map.keySet()));
        this.initialStates = Collections.unmodifiableList(initial);
        this.terminatingStates = Collections.unmodifiableList(terminating);
    }

    public List<String> getAlphabet() {
        return alphabet;
    }

    /**
     * All states keyed by their name, iterated in ascending name order.
     */
    public SortedMap<String, State> getStates() {
        return states;
    }

    public List<String> getStateNames() {
        return stateNames;
    }

    /**
     * Returns the state with the specified name or null if there is no such state.
     */
    public State getState(String name) {
        return states.get(name);
    }

    public List<String> getInitialStates() {
        return initialStates;
    }

    public List<String> getTerminatingStates() {
        return terminatingStates;
    }

    /**
     * Returns true if any state has a non-zero termination probability. Then a valid sequence
     * has to end in one of {@link #getTerminatingStates()}.
     */
    public boolean hasTerminalState() {
        return !terminatingStates.isEmpty();
    }

    /**
     * Probability of the specified state emitting the specified symbol. Returns 0 for an unknown
     * state.
     */
    double emissionProbability(String state, String symbol) {
        State s = states.get(state);
        return s == null ? 0.0 : s.getEmissionProbability(symbol);
    }

    double transitionProbability(String fromState, String toState) {
        State s = states.get(fromState);
        return s == null ? 0.0 : s.getTransitionProbability(toState);
    }

    /**
     * Returns whether there is an edge with non-zero probability between the two states.
     */
    boolean connected(String fromState, String toState) {
        return transitionProbability(fromState, toState) > 0.0;
    }

    /**
     * Calculates the log10 probability of observing the specified states together with the
     * specified symbols. See {@link SequenceScorer}.
     */
    public SequenceScore score(List<String> stateSequence, List<String> observations) {
        return new SequenceScorer(this).score(stateSequence, observations);
    }

    /**
     * Computes the most probable state sequence explaining the observations.
     * See {@link ViterbiAlgorithm}.
     */
    public ViterbiResult viterbi(List<String> observations) {
        return new ViterbiAlgorithm(this).compute(observations);
    }

    public Trellis trellis(List<String> observations) {
        return new ViterbiAlgorithm(this).computeTrellis(observations);
    }

    /**
     * Scores every possible state sequence. Expensive, see {@link BruteForceEnumeration}.
     */
    public List<ScoredSequence> enumerate(List<String> observations) {
        return new BruteForceEnumeration(this).enumerate(observations);
    }

    /**
     * Returns the best valid state sequence found by enumerating all of them or null if there is
     * none. Expensive, see {@link BruteForceEnumeration}.
     */
    public ScoredSequence bestByEnumeration(List<String> observations) {
        return new BruteForceEnumeration(this).best(observations);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("HiddenMarkovModel(\n");
        sb.append(alphabet).append(",\n");
        sb.append("[\n");
        for (Map.Entry<String, State> entry : states.entrySet()) {
            sb.append(entry.getValue()).append(",\n");
        }
        sb.append("]\n");
        sb.append(")");
        return sb.toString();
    }
}
