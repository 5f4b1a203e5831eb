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

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.seqhmm.util.Helper;
import com.seqhmm.util.PMap;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Configuration of the command line tools. Every key of the YAML file ends up in the
 * underlying {@link PMap}, command line arguments override them.
 */
public class HmmConfig {
    private final PMap map;

    public HmmConfig() {
        this(new PMap());
    }

    public HmmConfig(PMap pMap) {
        this.map = pMap;
    }

    /**
     * Reads the configuration from the file named by the <code>config</code> argument (if any)
     * and merges the arguments over it.
     */
    public static HmmConfig load(PMap args) {
        String configLocation = args.getString("config", "");
        HmmConfig config = configLocation.isEmpty() ? new HmmConfig() : readYaml(new File(configLocation));
        config.map.putAll(args);
        return config;
    }

    public static HmmConfig readYaml(File file) {
        ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
        try {
            return yaml.readValue(file, HmmConfig.class);
        } catch (IOException ex) {
            throw new RuntimeException("Cannot read configuration " + file.getAbsolutePath(), ex);
        }
    }

    // everything is stored in the PMap, the getters below only add defaults
    @JsonAnySetter
    public HmmConfig putObject(String key, Object value) {
        map.putObject(key, value);
        return this;
    }

    public boolean has(String key) {
        return map.has(key);
    }

    public String getString(String key, String _default) {
        return map.getString(key, _default);
    }

    public boolean getBool(String key, boolean _default) {
        return map.getBool(key, _default);
    }

    public int getInt(String key, int _default) {
        return map.getInt(key, _default);
    }

    public long getLong(String key, long _default) {
        return map.getLong(key, _default);
    }

    /**
     * Returns a list of symbols or state names. The value is either a YAML list or a comma
     * separated string like "1,6,6". Arguments are split as given, symbols like "06" in a YAML
     * file need quotes to stay strings.
     */
    public List<String> getList(String key) {
        Object object = map.getObject(key, null);
        if (object == null)
            return Collections.emptyList();
        if (object instanceof List) {
            List<String> result = new ArrayList<>();
            for (Object item : (List<?>) object) {
                result.add(String.valueOf(item));
            }
            return result;
        }
        return Helper.parseList(map.getString(key, ""));
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
