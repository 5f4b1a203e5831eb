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
import java.util.List;
import java.util.Map;

/**
 * The grid of best-path log10 probabilities computed by the {@link ViterbiAlgorithm}: one column
 * per observation and one cell per state of the model.
 * <p>
 * get(t, s) is the log10 probability of the most likely state sequence ending in state s with
 * the given observations o_0, ..., o_t. Formally, this is max log10 p(s_0, ..., s_t, o_0, ..., o_t)
 * w.r.t. s_0, ..., s_{t-1}. In the last column the termination probability is included if the
 * model has a terminal state.
 * <p>
 * A cell is undefined if no valid state sequence ends in it. Undefined cells are stored as
 * {@link Double#NEGATIVE_INFINITY}.
 */
public class Trellis {

    private final List<String> stateNames;
    private final List<String> observations;
    private final double[][] cells;

    /**
     * @param cells cells[t][i] belongs to observation t and stateNames.get(i). Not copied.
     */
    Trellis(List<String> stateNames, List<String> observations, double[][] cells) {
        if (cells.length != observations.size()) {
            throw new IllegalArgumentException("Expected " + observations.size() + " columns but got " + cells.length);
        }
        this.stateNames = Collections.unmodifiableList(stateNames);
        this.observations = Collections.unmodifiableList(observations);
        this.cells = cells;
    }

    /**
     * Number of columns, which equals the number of observations.
     */
    public int size() {
        return cells.length;
    }

    public boolean isEmpty() {
        return cells.length == 0;
    }

    public List<String> getStateNames() {
        return stateNames;
    }

    public List<String> getObservations() {
        return observations;
    }

    /**
     * Returns the log10 probability of the cell or NEGATIVE_INFINITY if the cell is undefined or
     * the state is unknown.
     */
    public double get(int column, String state) {
        int index = stateNames.indexOf(state);
        return index < 0 ? Double.NEGATIVE_INFINITY : cells[column][index];
    }

    double get(int column, int stateIndex) {
        return cells[column][stateIndex];
    }

    public boolean isDefined(int column, String state) {
        return get(column, state) != Double.NEGATIVE_INFINITY;
    }

    /**
     * Returns a snapshot of the defined cells of the specified column, keyed by state name in
     * the iteration order of the model.
     */
    public Map<String, Double> column(int column) {
        Map<String, Double> result = new LinkedHashMap<>(Utils.initialHashMapCapacity(stateNames.size()));
        for (int i = 0; i < stateNames.size(); i++) {
            if (cells[column][i] != Double.NEGATIVE_INFINITY) {
                result.put(stateNames.get(i), cells[column][i]);
            }
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Returns whether the specified column has no defined cell, which means no state sequence
     * can explain the observations up to this column.
     */
    public boolean isBroken(int column) {
        for (double value : cells[column]) {
            if (value != Double.NEGATIVE_INFINITY)
                return false;
        }
        return true;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("Trellis with log10 probabilities\n\n");
        for (int t = 0; t < cells.length; t++) {
            sb.append("Column ").append(t).append(" (").append(observations.get(t)).append(")\n");
            for (int i = 0; i < stateNames.size(); i++) {
                sb.append(stateNames.get(i)).append(": ");
                sb.append(cells[t][i] == Double.NEGATIVE_INFINITY ? "undefined" : String.valueOf(cells[t][i]));
                sb.append("\n");
            }
            sb.append("\n");
        }
        return sb.toString();
    }
}
