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
import java.util.Arrays;
import java.util.List;

/**
 * Scores every possible state sequence that could explain an observation sequence. This is
 * meant to validate the {@link ViterbiAlgorithm} on small models.
 * <p>
 * Enumerating all state sequences is very expensive for models with many states and for long
 * observation sequences: the number of state sequences is n^t for n states and t observations.
 * <p>
 * Sequences are enumerated like an odometer over the sorted state names, the last position
 * changes fastest.
 */
public class BruteForceEnumeration {

    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final HiddenMarkovModel model;
    private final SequenceScorer scorer;

    public BruteForceEnumeration(HiddenMarkovModel model) {
        this.model = model;
        this.scorer = new SequenceScorer(model);
    }

    /**
     * Returns all valid state sequences with their log10 probability in enumeration order.
     */
    public List<ScoredSequence> enumerate(List<String> observations) {
        final List<ScoredSequence> result = new ArrayList<>();
        forEachSequence(observations, scored -> result.add(scored));
        return result;
    }

    /**
     * Returns the most likely valid state sequence or null if no state sequence is valid. The first
     * enumerated sequence wins if several sequences are equally likely.
     */
    public ScoredSequence best(List<String> observations) {
        final ScoredSequence[] best = new ScoredSequence[1];
        forEachSequence(observations, scored -> {
            if (best[0] == null || scored.log10Probability > best[0].log10Probability)
                best[0] = scored;
        });
        if (best[0] == null) {
            logger.debug("No valid state sequence for {}", observations);
        } else {
            logger.debug("BEST: {}", best[0]);
        }
        return best[0];
    }

    private interface Visitor {
        void visit(ScoredSequence scoredSequence);
    }

    private void forEachSequence(List<String> observations, Visitor visitor) {
        if (observations == null) {
            throw new NullPointerException();
        }

        List<String> names = model.getStateNames();
        int length = observations.size();
        if (names.isEmpty() && length > 0)
            return;

        int[] digits = new int[length];
        String[] sequence = new String[length];
        while (true) {
            for (int i = 0; i < length; i++) {
                sequence[i] = names.get(digits[i]);
            }
            List<String> candidate = Arrays.asList(sequence.clone());
            SequenceScore score = scorer.score(candidate, observations);
            if (score.isValid()) {
                ScoredSequence scored = new ScoredSequence(candidate, score.getLog10Probability());
                logger.debug("{}", scored);
                visitor.visit(scored);
            }

            // advance the odometer
            int pos = length - 1;
            while (pos >= 0 && ++digits[pos] == names.size()) {
                digits[pos] = 0;
                pos--;
            }
            if (pos < 0)
                return;
        }
    }
}
