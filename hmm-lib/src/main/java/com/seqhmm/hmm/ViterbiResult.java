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
import java.util.List;

/**
 * Contains the most likely state sequence and additional results of the Viterbi algorithm.
 */
public class ViterbiResult {

    private final List<String> sequence;
    private final double log10Probability;
    private final int brokenAt;
    private final Trellis trellis;

    private ViterbiResult(List<String> sequence, double log10Probability, int brokenAt, Trellis trellis) {
        this.sequence = Collections.unmodifiableList(sequence);
        this.log10Probability = log10Probability;
        this.brokenAt = brokenAt;
        this.trellis = trellis;
    }

    static ViterbiResult found(List<String> sequence, double log10Probability, Trellis trellis) {
        return new ViterbiResult(sequence, log10Probability, -1, trellis);
    }

    static ViterbiResult broken(int brokenAt, Trellis trellis) {
        return new ViterbiResult(Collections.<String>emptyList(), Double.NEGATIVE_INFINITY, brokenAt, trellis);
    }

    /**
     * The most likely state sequence, one state name per observation. Empty if the HMM is broken.
     */
    public List<String> getSequence() {
        return sequence;
    }

    /**
     * The log10 probability of the most likely sequence together with the observations. This
     * includes the termination probability of the last state if the model has a terminal state.
     * NEGATIVE_INFINITY if the HMM is broken.
     */
    public double getLog10Probability() {
        return log10Probability;
    }

    /**
     * Returns whether no state sequence can explain the observations. This is the case for an
     * empty observation sequence, if no cell of the last trellis column is defined or if the back
     * tracking finds no predecessor.
     */
    public boolean isBroken() {
        return brokenAt >= 0;
    }

    /**
     * The trellis column where the computation broke or -1.
     */
    public int getBrokenAt() {
        return brokenAt;
    }

    public Trellis getTrellis() {
        return trellis;
    }

    @Override
    public String toString() {
        if (isBroken())
            return "broken at column " + brokenAt;
        return sequence + ": " + log10Probability;
    }
}
