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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A training sample: a sequence of observed symbols and the sequence of states that best
 * explains it, one label per symbol.
 */
public class LabeledSequence {

    private final List<String> observations;
    private final List<String> labels;

    /**
     * @throws IllegalArgumentException if the sequences are empty or differ in length
     */
    public LabeledSequence(List<String> observations, List<String> labels) {
        if (observations == null || labels == null) {
            throw new NullPointerException();
        }
        if (observations.size() != labels.size()) {
            throw new IllegalArgumentException(observations.size() + " observations but " + labels.size() + " labels");
        }
        if (observations.isEmpty()) {
            throw new IllegalArgumentException("A labeled sequence must not be empty");
        }

        this.observations = Collections.unmodifiableList(new ArrayList<>(observations));
        this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
    }

    public List<String> getObservations() {
        return observations;
    }

    public List<String> getLabels() {
        return labels;
    }

    public int size() {
        return labels.size();
    }

    public String getFirstLabel() {
        return labels.get(0);
    }

    public String getLastLabel() {
        return labels.get(labels.size() - 1);
    }

    @Override
    public int hashCode() {
        return Objects.hash(observations, labels);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        LabeledSequence other = (LabeledSequence) obj;
        return observations.equals(other.observations) && labels.equals(other.labels);
    }

    @Override
    public String toString() {
        return "observations=" + observations + ", labels=" + labels;
    }
}
