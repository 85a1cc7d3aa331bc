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
package com.trellisdecoder.hmm;

import com.trellisdecoder.util.exceptions.NoViableSequenceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Checks which questions the engine asks the probability models.
 */
public class ProbabilityModelCallsTest {

    private ProbabilityModel<String> modelA;
    private ProbabilityModel<String> modelB;
    private State<String> a;
    private State<String> b;

    @BeforeEach
    @SuppressWarnings("unchecked")
    public void setUp() {
        modelA = mock(ProbabilityModel.class);
        modelB = mock(ProbabilityModel.class);
        a = State.of("a", modelA);
        b = State.of("b", modelB);
    }

    @Test
    public void testZeroEmissionSkipsTransitions() {
        when(modelA.initialProbability(a, "o1")).thenReturn(1.0);
        when(modelA.emissionProbability(a, "o1")).thenReturn(1.0);
        when(modelA.emissionProbability(a, "o2")).thenReturn(0.0);

        NoViableSequenceException ex = assertThrows(NoViableSequenceException.class,
                () -> new ViterbiEngine<>(Arrays.asList(a), Arrays.asList("o1", "o2"), true).solve());
        assertEquals(2, ex.getPath().size());

        verify(modelA).emissionProbability(a, "o2");
        verify(modelA, never()).transitionProbability(any(), anyString(), any(), anyString());
    }

    @Test
    public void testEachStateAsksItsOwnModel() {
        for (ProbabilityModel<String> model : Arrays.asList(modelA, modelB)) {
            when(model.initialProbability(any(), anyString())).thenReturn(0.5);
            when(model.emissionProbability(any(), anyString())).thenReturn(0.5);
            when(model.transitionProbability(any(), anyString(), any(), anyString())).thenReturn(0.5);
        }
        List<String> observations = Arrays.asList("o1", "o2", "o3");
        ViterbiPath<String> path = new ViterbiEngine<>(Arrays.asList(a, b), observations, false).solve();
        assertEquals(Arrays.asList(a, a, a), path.getStates());

        verify(modelA).initialProbability(a, "o1");
        verify(modelB).initialProbability(b, "o1");
        verify(modelA).emissionProbability(a, "o2");
        verify(modelB).emissionProbability(b, "o2");
        // transitions are answered by the model of the source state
        verify(modelA).transitionProbability(a, "o1", b, "o2");
        verify(modelB).transitionProbability(b, "o1", a, "o2");
        verify(modelA).transitionProbability(a, "o2", a, "o3");
        verify(modelB, never()).transitionProbability(eq(a), anyString(), any(), anyString());
        // two time steps with 2 x 2 transitions
        verify(modelA, times(4)).transitionProbability(any(), anyString(), any(), anyString());
        verify(modelB, times(4)).transitionProbability(any(), anyString(), any(), anyString());
    }

    @Test
    public void testInitialProbabilityOnlyAtFirstTimeStep() {
        when(modelA.initialProbability(any(), anyString())).thenReturn(0.5);
        when(modelA.emissionProbability(any(), anyString())).thenReturn(0.5);
        when(modelA.transitionProbability(any(), anyString(), any(), anyString())).thenReturn(1.0);

        ViterbiPath<String> path = new ViterbiEngine<>(Arrays.asList(a), Arrays.asList("o1", "o2", "o3"), true).solve();
        assertEquals(3, path.size());
        assertEquals(-4, path.getProbability(), 1e-12);
        verify(modelA, times(1)).initialProbability(any(), anyString());
        verify(modelA, times(3)).emissionProbability(any(), anyString());
    }
}
