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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A hidden state of a {@link HiddenMarkovModel} with its initial, emission, transition and
 * termination probabilities.
 * <p>
 * A missing key in the emission or transition map means a probability of zero. An explicit
 * 0.0 entry behaves exactly like a missing key for every accessor of this class.
 * <p>
 * The probabilities are not validated. The caller is responsible that the emission
 * probabilities sum up to 1 and that the transition probabilities plus the termination
 * probability sum up to 1.
 */
public class State {

    private final String name;
    private final double initialProbability;
    private final Map<String, Double> emissionProbabilities;
    private final Map<String, Double> transitionProbabilities;
    private final double terminationProbability;

    public State(String name, double initialProbability, Map<String, Double> emissionProbabilities,
                 Map<String, Double> transitionProbabilities) {
        this(name, initialProbability, emissionProbabilities, transitionProbabilities, 0.0);
    }

    /**
     * @param emissionProbabilities   probability of emitting a symbol of the alphabet, keyed by symbol
     * @param transitionProbabilities probability of moving to another state, keyed by state name
     * @param terminationProbability  probability that a sequence ends in this state. A non-zero value
     *                                in any state of the model makes the implicit terminal state active.
     */
    public State(String name, double initialProbability, Map<String, Double> emissionProbabilities,
                 Map<String, Double> transitionProbabilities, double terminationProbability) {
        if (name == null) {
            throw new NullPointerException("State name must not be null");
        }

        this.name = name;
        this.initialProbability = initialProbability;
        this.emissionProbabilities = copy(emissionProbabilities);
        this.transitionProbabilities = copy(transitionProbabilities);
        this.terminationProbability = terminationProbability;
    }

    private static Map<String, Double> copy(Map<String, Double> map) {
        if (map == null || map.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    public String getName() {
        return name;
    }

    public double getInitialProbability() {
        return initialProbability;
    }

    public Map<String, Double> getEmissionProbabilities() {
        return emissionProbabilities;
    }

    public Map<String, Double> getTransitionProbabilities() {
        return transitionProbabilities;
    }

    public double getTerminationProbability() {
        return terminationProbability;
    }

    /**
     * Returns the probability of emitting the specified symbol or 0 if this state cannot emit it.
     */
    public double getEmissionProbability(String symbol) {
        Double p = emissionProbabilities.get(symbol);
        return p == null ? 0.0 : p;
    }

    /**
     * Returns the probability of the transition to the specified state or 0 if there is no such edge.
     */
    public double getTransitionProbability(String targetState) {
        Double p = transitionProbabilities.get(targetState);
        return p == null ? 0.0 : p;
    }

    public boolean canEmit(String symbol) {
        return getEmissionProbability(symbol) > 0.0;
    }

    public boolean canTransitionTo(String targetState) {
        return getTransitionProbability(targetState) > 0.0;
    }

    public boolean isInitial() {
        return initialProbability > 0.0;
    }

    public boolean isTerminating() {
        return terminationProbability > 0.0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, initialProbability, emissionProbabilities, transitionProbabilities,
                terminationProbability);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        State other = (State) obj;
        return name.equals(other.name)
                && Double.compare(initialProbability, other.initialProbability) == 0
                && Double.compare(terminationProbability, other.terminationProbability) == 0
                && emissionProbabilities.equals(other.emissionProbabilities)
                && transitionProbabilities.equals(other.transitionProbabilities);
    }

    /**
     * Human readable dump of all parameters, one per line, in constructor argument order.
     */
    @Override
    public String toString() {
        return "State(\n"
                + "'" + name + "',\n"
                + String.format(Locale.ROOT, "%f", initialProbability) + ",\n"
                + emissionProbabilities + ",\n"
                + transitionProbabilities + ",\n"
                + String.format(Locale.ROOT, "%f", terminationProbability) + "\n"
                + ")";
    }
}
