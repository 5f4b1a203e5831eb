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

import java.util.List;

class Utils {

    private Utils() {
    }

    /**
     * Capacity of a hash map that holds the specified number of elements without rehashing.
     */
    static int initialHashMapCapacity(int maxElements) {
        // Default load factor of HashMaps is 0.75
        return (int) (maxElements / 0.75) + 1;
    }

    /**
     * Draws an index of the specified weights with probability proportional to its weight.
     * Returns -1 if all weights are zero.
     *
     * @param uniform random number in [0, 1)
     */
    static int drawIndex(List<Double> weights, double uniform) {
        double total = 0;
        for (double weight : weights) {
            total += weight;
        }
        if (total <= 0)
            return -1;

        double threshold = uniform * total;
        double sum = 0;
        int lastPositive = -1;
        for (int i = 0; i < weights.size(); i++) {
            double weight = weights.get(i);
            if (weight <= 0)
                continue;
            lastPositive = i;
            sum += weight;
            if (threshold < sum)
                return i;
        }
        // rounding errors
        return lastPositive;
    }
}
