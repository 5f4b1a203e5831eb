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
import java.util.Locale;
import java.util.Objects;

/**
 * A valid state sequence together with its log10 probability.
 */
public class ScoredSequence {

    public final List<String> states;
    public final double log10Probability;

    public ScoredSequence(List<String> states, double log10Probability) {
        this.states = Collections.unmodifiableList(states);
        this.log10Probability = log10Probability;
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, log10Probability);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        ScoredSequence other = (ScoredSequence) obj;
        return states.equals(other.states) && Double.compare(log10Probability, other.log10Probability) == 0;
    }

    @Override
    public String toString() {
        return states + ": " + String.format(Locale.ROOT, "%f", log10Probability);
    }
}
