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

import java.util.List;

import static java.lang.Math.log10;

/**
 * Calculates the log (base 10) of the probability of observing a sequence of states together
 * with a sequence of observed symbols. Probabilities are never multiplied, only their
 * logarithms are added.
 * <p>
 * The termination probability of the last state is not part of the score. If the model has a
 * terminal state it is only checked that the last state can terminate.
 */
public class SequenceScorer {

    private final HiddenMarkovModel model;

    public SequenceScorer(HiddenMarkovModel model) {
        if (model == null) {
            throw new NullPointerException();
        }
        this.model = model;
    }

    /**
     * @param stateSequence ordered sequence of state names
     * @param observations  ordered sequence of observed symbols, same length as stateSequence. The
     *                      symbols are not checked against the alphabet of the model.
     * @return the log10 probability or an invalid score if the first state cannot start a
     * sequence, two consecutive states are not connected, a state cannot emit its symbol or the
     * last state cannot terminate a sequence of a model with terminal state
     * @throws IllegalArgumentException if both sequences differ in length
     */
    public SequenceScore score(List<String> stateSequence, List<String> observations) {
        if (stateSequence == null || observations == null) {
            throw new NullPointerException();
        }
        if (stateSequence.size() != observations.size()) {
            throw new IllegalArgumentException("State sequence has length " + stateSequence.size()
                    + " but observation sequence has length " + observations.size());
        }

        int last = stateSequence.size() - 1;
        if (model.hasTerminalState()) {
            if (last < 0)
                return SequenceScore.invalid(InvalidReason.NOT_TERMINATING, -1);

            State lastState = model.getState(stateSequence.get(last));
            if (lastState != null && !lastState.isTerminating())
                return SequenceScore.invalid(InvalidReason.NOT_TERMINATING, last);
        }

        double p = 0.0;
        State prevState = null;
        for (int i = 0; i <= last; i++) {
            State curState = model.getState(stateSequence.get(i));
            if (curState == null)
                return SequenceScore.invalid(InvalidReason.UNKNOWN_STATE, i);

            if (i == 0) {
                if (!curState.isInitial())
                    return SequenceScore.invalid(InvalidReason.ZERO_INITIAL, i);

                p += log10(curState.getInitialProbability());
            } else {
                if (!prevState.canTransitionTo(curState.getName()))
                    return SequenceScore.invalid(InvalidReason.ZERO_TRANSITION, i);

                p += log10(prevState.getTransitionProbability(curState.getName()));
            }

            String symbol = observations.get(i);
            if (!curState.canEmit(symbol))
                return SequenceScore.invalid(InvalidReason.ZERO_EMISSION, i);

            p += log10(curState.getEmissionProbability(symbol));
            prevState = curState;
        }
        return SequenceScore.valid(p);
    }
}
