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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.seqhmm.hmm.LabeledSequence;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes labeled training data as a JSON array of objects with the properties
 * <code>observations</code> and <code>labels</code>.
 */
public class TrainingDataReader {
    private final ObjectMapper objectMapper;

    public TrainingDataReader() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        // the CLI writes to System.out
        this.objectMapper.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    public List<LabeledSequence> read(File file) {
        try {
            return toSequences(objectMapper.readValue(file, new TypeReference<List<Sample>>() {
            }), file.getName());
        } catch (IOException ex) {
            throw new RuntimeException("Cannot read training data " + file.getAbsolutePath(), ex);
        }
    }

    public List<LabeledSequence> read(InputStream is) throws IOException {
        return toSequences(objectMapper.readValue(is, new TypeReference<List<Sample>>() {
        }), "stream");
    }

    public void write(List<LabeledSequence> sequences, OutputStream os) throws IOException {
        List<Sample> samples = new ArrayList<>(sequences.size());
        for (LabeledSequence sequence : sequences) {
            samples.add(new Sample(sequence.getObservations(), sequence.getLabels()));
        }
        objectMapper.writeValue(os, samples);
    }

    private static List<LabeledSequence> toSequences(List<Sample> samples, String source) {
        if (samples == null)
            throw new IllegalArgumentException("No training data in " + source);

        List<LabeledSequence> result = new ArrayList<>(samples.size());
        for (int i = 0; i < samples.size(); i++) {
            Sample sample = samples.get(i);
            if (sample == null || sample.observations == null || sample.labels == null)
                throw new IllegalArgumentException("Entry " + i + " in " + source + " needs observations and labels");
            result.add(new LabeledSequence(sample.observations, sample.labels));
        }
        return result;
    }

    public static class Sample {
        @JsonProperty("observations")
        final List<String> observations;
        @JsonProperty("labels")
        final List<String> labels;

        @JsonCreator
        public Sample(@JsonProperty("observations") List<String> observations,
               @JsonProperty("labels") List<String> labels) {
            this.observations = observations;
            this.labels = labels;
        }
    }
}
