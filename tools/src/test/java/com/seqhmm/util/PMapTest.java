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

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class PMapTest {

    @Test
    public void argumentsAreParsedIntoTypedValues() {
        PMap subject = PMap.read(new String[]{"action=decode", "--sample_seed=42", "print_trellis=true",
                "big=12345678901", "ignored"});

        assertEquals("decode", subject.getString("action", ""));
        assertEquals(42, subject.getInt("sample_seed", 0));
        assertEquals(42L, subject.getLong("sample_seed", 0));
        assertTrue(subject.getBool("print_trellis", false));
        assertEquals(12345678901L, subject.getLong("big", 0));
        assertFalse(subject.has("ignored"));
    }

    @Test
    public void camelCaseKeysAreStoredInSnakeCase() {
        PMap subject = PMap.read(new String[]{"includeTerminalState=true"});
        assertTrue(subject.getBool("include_terminal_state", false));

        subject.putObject("sampleCount", 3);
        assertEquals(3, subject.getInt("sample_count", 0));
    }

    @Test
    public void valuesOfTheWrongTypeGiveTheDefault() {
        PMap subject = PMap.read(new String[]{"observations=1,6,6", "count=3"});

        assertEquals(7, subject.getInt("observations", 7));
        assertFalse(subject.getBool("count", false));
        assertEquals("3", subject.getString("count", ""));
        assertEquals("1,6,6", subject.getString("observations", ""));
        assertEquals("none", subject.getString("missing", "none"));
        assertEquals(Arrays.asList("a"), subject.getObject("missing", Arrays.asList("a")));
    }

    @Test
    public void duplicateKeysAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> PMap.read(new String[]{"a=1", "a=2"}));
    }

    @Test
    public void putAllOverwrites() {
        PMap subject = new PMap().putObject("a", 1).putObject("b", 2);
        subject.putAll(PMap.read(new String[]{"b=3"}));

        assertEquals(1, subject.getInt("a", 0));
        assertEquals(3, subject.getInt("b", 0));
        assertEquals("3", subject.getString("b", ""));
        assertFalse(subject.has("c"));
    }

    @Test
    public void getStringKeepsTheArgumentText() {
        PMap subject = PMap.read(new String[]{"observations=06", "ratio=1.50", "big=1e2", "flag=TRUE"});

        assertEquals(6, subject.getInt("observations", 0));
        assertEquals("06", subject.getString("observations", ""));
        assertEquals("1.50", subject.getString("ratio", ""));
        assertEquals("1e2", subject.getString("big", ""));
        assertEquals("TRUE", subject.getString("flag", ""));

        // a converted value replaces the text
        subject.putObject("observations", 7);
        assertEquals("7", subject.getString("observations", ""));

        PMap merged = new PMap().putObject("ratio", 2).putAll(subject);
        assertEquals("1.50", merged.getString("ratio", ""));
        assertEquals("7", new PMap().putObject("observations", "x").putAll(subject).getString("observations", ""));
    }
}
