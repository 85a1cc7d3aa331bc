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
package com.trellisdecoder.config;

import com.trellisdecoder.hmm.ProbabilitySpace;
import com.trellisdecoder.hmm.State;
import com.trellisdecoder.hmm.ViterbiEngine;
import com.trellisdecoder.hmm.ViterbiPath;
import com.trellisdecoder.hmm.model.TableProbabilityModel;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ViterbiConfigParserTest {

    private final ViterbiConfigParser parser = new ViterbiConfigParser();

    @Test
    public void testDeserializeConfig() {
        ViterbiConfig config = parser.parse(getClass().getResourceAsStream("viterbi-config.yml"));
        assertFalse(config.isLogarithmic());
        assertEquals(ProbabilitySpace.LINEAR, config.getProbabilitySpace());
        assertTrue(config.isParallel());
        assertTrue(config.isKeepMessageHistory());
    }

    @Test
    public void testDefaults() {
        ViterbiConfig config = parser.parse("parallel: false");
        assertEquals(new ViterbiConfig(), config);
        assertTrue(config.isLogarithmic());
        assertFalse(config.isKeepMessageHistory());
        assertEquals("logarithmic=true|parallel=false|keepMessageHistory=false", config.toString());
    }

    @Test
    public void testInvalidYaml() {
        assertThrows(UncheckedIOException.class, () -> parser.parse("logarithmic: [1, 2"));
        assertThrows(UncheckedIOException.class, () -> parser.parse("logarithmic: maybe"));
    }

    @Test
    public void testNullInput() {
        assertThrows(NullPointerException.class, () -> parser.parse((String) null));
        assertThrows(NullPointerException.class, () -> parser.parse((InputStream) null));
    }

    @Test
    public void testEngineUsesParsedConfig() {
        ViterbiConfig config = parser.parse(getClass().getResourceAsStream("viterbi-config.yml"));
        TableProbabilityModel<String> model = TableProbabilityModel.<String>builder()
                .initial("a", 0.5).initial("b", 0.5)
                .emission("a", "x", 0.9).emission("b", "x", 0.1)
                .defaultTransition(0.5)
                .build();
        List<State<String>> states = model.createStates("a", "b");
        ViterbiEngine<String> engine = new ViterbiEngine<>(states, Arrays.asList("x", "x"), config);
        assertEquals(config, engine.getConfig());

        ViterbiPath<String> path = engine.solve();
        assertEquals(ProbabilitySpace.LINEAR, path.getProbabilitySpace());
        assertEquals(0.2025, path.getProbability(), 1e-12);
        assertEquals(2, path.getMessageHistory().size());

        // the engine keeps its own copy
        config.setLogarithmic(true);
        assertFalse(engine.getConfig().isLogarithmic());
    }
}
