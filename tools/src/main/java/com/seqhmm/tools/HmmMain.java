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
package com.seqhmm.tools;

import com.seqhmm.hmm.HiddenMarkovModel;
import com.seqhmm.hmm.HmmTrainer;
import com.seqhmm.hmm.LabeledSequence;
import com.seqhmm.hmm.ScoredSequence;
import com.seqhmm.hmm.SequenceSampler;
import com.seqhmm.hmm.SequenceScore;
import com.seqhmm.hmm.ViterbiResult;
import com.seqhmm.util.Helper;
import com.seqhmm.util.PMap;
import com.seqhmm.util.StopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Random;

/**
 * Trains a model from labeled JSON data and decodes, scores, enumerates or samples with it.
 * Arguments are key=value pairs, e.g.
 * <pre>
 * action=decode training_data=casino.json observations=1,6,6
 * </pre>
 */
public class HmmMain {

    public static void main(String[] args) {
        int status = new HmmMain(new PrintStream(System.out, true, Helper.UTF_CS)).start(args);
        if (status != 0)
            System.exit(status);
    }

    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final PrintStream out;

    public HmmMain(PrintStream out) {
        this.out = out;
    }

    /**
     * @param args key=value pairs
     * @return the exit status, 0 on success
     */
    public int start(String[] args) {
        HmmConfig config;
        try {
            config = HmmConfig.load(PMap.read(args));
        } catch (Exception ex) {
            logger.error("Cannot load configuration: " + ex.getMessage(), ex);
            return 1;
        }
        logger.info("Configuration: " + config);
        String action = Helper.toLowerCase(config.getString("action", ""));

        try {
            if (action.equals("train")) {
                out.println(train(config));
            } else if (action.equals("decode")) {
                decode(train(config), config);
            } else if (action.equals("score")) {
                score(train(config), config);
            } else if (action.equals("enumerate")) {
                enumerate(train(config), config);
            } else if (action.equals("sample")) {
                sample(train(config), config);
            } else {
                printUsage();
                return action.isEmpty() ? 0 : 2;
            }
        } catch (Exception ex) {
            logger.error("Action '" + action + "' failed: " + ex.getMessage(), ex);
            return 1;
        }
        return 0;
    }

    HiddenMarkovModel train(HmmConfig config) {
        String location = config.getString("training_data", "");
        if (location.isEmpty())
            throw new IllegalArgumentException("Specify training_data=<file.json>");

        StopWatch readSW = new StopWatch("read").start();
        List<LabeledSequence> data = new TrainingDataReader().read(new File(location));
        readSW.stop();

        StopWatch trainSW = new StopWatch("train").start();
        HiddenMarkovModel model = new HmmTrainer().
                setIncludeTerminalState(config.getBool("include_terminal_state", false)).
                train(data);
        trainSW.stop();
        logger.info("Trained on " + data.size() + " sequences, " + readSW + ", " + trainSW);
        return model;
    }

    private void decode(HiddenMarkovModel model, HmmConfig config) {
        List<String> observations = observations(config);
        StopWatch sw = new StopWatch("viterbi").start();
        ViterbiResult result = model.viterbi(observations);
        sw.stop();
        logger.info("Decoded " + observations.size() + " observations, " + sw);

        if (config.getBool("print_trellis", false))
            out.println(result.getTrellis());

        if (result.isBroken()) {
            out.println("no path, broken at column " + result.getBrokenAt());
        } else {
            out.println("path: " + String.join(",", result.getSequence()));
            out.println("log10 probability: " + result.getLog10Probability());
        }
    }

    private void score(HiddenMarkovModel model, HmmConfig config) {
        List<String> states = config.getList("states");
        SequenceScore score = model.score(states, observations(config));
        out.println("score: " + score);
    }

    private void enumerate(HiddenMarkovModel model, HmmConfig config) {
        List<String> observations = observations(config);
        for (ScoredSequence candidate : model.enumerate(observations)) {
            out.println(String.join(",", candidate.states) + "\t" + candidate.log10Probability);
        }
        ScoredSequence best = model.bestByEnumeration(observations);
        out.println("best: " + (best == null ? "none" : String.join(",", best.states) + "\t" + best.log10Probability));
    }

    private void sample(HiddenMarkovModel model, HmmConfig config) throws IOException {
        int count = config.getInt("sample_count", 10);
        // 0 means sampling until a terminating state ends the sequence
        int length = config.getInt("sample_length", model.hasTerminalState() ? 0 : 20);
        Random random = config.has("sample_seed") ? new Random(config.getLong("sample_seed", 0)) : new Random();
        SequenceSampler sampler = new SequenceSampler(model, random);
        if (config.has("sample_max_length"))
            sampler.setMaxLength(config.getInt("sample_max_length", 1000));

        List<LabeledSequence> samples = sampler.sample(count, length);
        new TrainingDataReader().write(samples, out);
        out.println();
    }

    private List<String> observations(HmmConfig config) {
        if (!config.has("observations"))
            throw new IllegalArgumentException("Specify observations=<comma separated symbols>");
        return config.getList("observations");
    }

    private void printUsage() {
        out.println("Usage: train a model from labeled data, then use it\n"
                + "./hmm action=train training_data=data.json [include_terminal_state=true]\n"
                + "./hmm action=decode training_data=data.json observations=1,6,6 [print_trellis=true]\n"
                + "./hmm action=score training_data=data.json states=Fair,Loaded observations=1,6\n"
                + "./hmm action=enumerate training_data=data.json observations=1,6,6\n"
                + "./hmm action=sample training_data=data.json sample_count=10 sample_length=20 sample_seed=1\n\n"
                + "All arguments can also be given in a YAML file via config=hmm.yml");
    }
}
