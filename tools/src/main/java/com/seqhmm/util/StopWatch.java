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
package com.seqhmm.util;

/**
 * Sums up the time of one phase like reading, training or decoding. A watch can be started and
 * stopped several times.
 */
public class StopWatch {
    private final String name;
    private long startedAt;
    private long totalNanos;
    private boolean running;

    public StopWatch(String name) {
        this.name = name;
    }

    public StopWatch start() {
        startedAt = System.nanoTime();
        running = true;
        return this;
    }

    /**
     * Adds the time since the last start. Does nothing if the watch is not running.
     */
    public StopWatch stop() {
        if (running) {
            totalNanos += System.nanoTime() - startedAt;
            running = false;
        }
        return this;
    }

    public float getSeconds() {
        return totalNanos / 1e9f;
    }

    @Override
    public String toString() {
        return (Helper.isEmpty(name) ? "" : name + " ") + "took " + getSeconds() + "s";
    }
}
