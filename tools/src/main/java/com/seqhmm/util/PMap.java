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

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A properties map (String to Object) with convenient methods to access the content.
 * Keys in camel case are stored in snake case. Values read from arguments are converted to
 * booleans and numbers, their original text stays available through {@link #getString}.
 */
public class PMap {
    private final LinkedHashMap<String, Object> map = new LinkedHashMap<>();
    // argument text before the conversion, e.g. "06" for the value 6
    private final Map<String, String> rawValues = new HashMap<>();

    /**
     * Reads a PMap from a string array consisting of key=value pairs, e.g. the arguments of the
     * main method. Leading dashes of a key are ignored.
     *
     * @throws IllegalArgumentException if a key occurs twice
     */
    public static PMap read(String[] args) {
        PMap map = new PMap();
        for (String arg : args) {
            int index = arg.indexOf("=");
            if (index <= 0) {
                continue;
            }

            String key = arg.substring(0, index);
            while (key.startsWith("-")) {
                key = key.substring(1);
            }

            String value = arg.substring(index + 1);
            key = Helper.camelCaseToUnderScore(key);
            Object old = map.map.put(key, Helper.toObject(value));
            if (old != null)
                throw new IllegalArgumentException("Pair '" + key + "'='" + value + "' not possible to " +
                        "add to the PMap-object as the key already exists with '" + old + "'");
            map.rawValues.put(key, value);
        }
        return map;
    }

    /**
     * Adds all entries of the specified map. Existing keys are overwritten.
     */
    public PMap putAll(PMap other) {
        for (Map.Entry<String, Object> entry : other.map.entrySet()) {
            map.put(entry.getKey(), entry.getValue());
            String raw = other.rawValues.get(entry.getKey());
            if (raw == null)
                rawValues.remove(entry.getKey());
            else
                rawValues.put(entry.getKey(), raw);
        }
        return this;
    }

    public boolean has(String key) {
        return map.containsKey(key);
    }

    public boolean getBool(String key, boolean _default) {
        Object object = map.get(key);
        return object instanceof Boolean ? (Boolean) object : _default;
    }

    public int getInt(String key, int _default) {
        Object object = map.get(key);
        return object instanceof Number ? ((Number) object).intValue() : _default;
    }

    public long getLong(String key, long _default) {
        Object object = map.get(key);
        return object instanceof Number ? ((Number) object).longValue() : _default;
    }

    /**
     * Returns the value as string. For values read from arguments this is the text as given, so
     * "observations=06" stays "06" although the value is the number 6.
     */
    public String getString(String key, String _default) {
        String raw = rawValues.get(key);
        if (raw != null)
            return raw;

        Object object = map.get(key);
        return object == null ? _default : object.toString();
    }

    @SuppressWarnings("unchecked")
    public <T> T getObject(String key, T _default) {
        Object object = map.get(key);
        return object == null ? _default : (T) object;
    }

    public PMap putObject(String key, Object object) {
        key = Helper.camelCaseToUnderScore(key);
        map.put(key, object);
        rawValues.remove(key);
        return this;
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
