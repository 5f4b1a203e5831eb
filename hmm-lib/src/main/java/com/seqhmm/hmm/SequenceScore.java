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

import java.util.Locale;

/**
 * Result of {@link SequenceScorer#score}: either the log10 probability of a state sequence
 * together with its observations, or the reason why the state sequence is impossible.
 */
public class SequenceScore {

    public enum InvalidReason {
        /**
         * A state name is not part of the model.
         */
        UNKNOWN_STATE,
        /**
         * The first state has an initial probability of zero.
         */
        ZERO_INITIAL,
        /**
         * Two consecutive states are not connected by an edge.
         */
        ZERO_TRANSITION,
        /**
         * A state cannot emit the symbol observed at its position.
         */
        ZERO_EMISSION,
        /**
         * The model has a terminal state but the last state of the sequence is not terminating.
         */
        NOT_TERMINATING
    }

    private final double log10Probability;
    private final InvalidReason invalidReason;
    private final int position;

    private SequenceScore(double log10Probability, InvalidReason invalidReason, int position) {
        this.log10Probability = log10Probability;
        this.invalidReason = invalidReason;
        this.position = position;
    }

    public static SequenceScore valid(double log10Probability) {
        return new SequenceScore(log10Probability, null, -1);
    }

    public static SequenceScore invalid(InvalidReason reason, int position) {
        if (reason == null) {
            throw new NullPointerException("reason must not be null");
        }
        return new SequenceScore(Double.NEGATIVE_INFINITY, reason, position);
    }

    public boolean isValid() {
        return invalidReason == null;
    }

    /**
     * @throws IllegalStateException if the sequence is invalid
     */
    public double getLog10Probability() {
        if (!isValid()) {
            throw new IllegalStateException("Sequence is invalid: " + invalidReason + " at position " + position);
        }
        return log10Probability;
    }

    /**
     * Null if the sequence is valid.
     */
    public InvalidReason getInvalidReason() {
        return invalidReason;
    }

    /**
     * Index of the state that made the sequence invalid or -1.
     */
    public int getPosition() {
        return position;
    }

    @Override
    public String toString() {
        if (isValid())
            return String.format(Locale.ROOT, "%f", log10Probability);
        return "invalid: " + invalidReason + (position < 0 ? "" : " at " + position);
    }
}
