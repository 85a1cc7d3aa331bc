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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static com.trellisdecoder.hmm.ProbabilitySpace.LINEAR;
import static com.trellisdecoder.hmm.ProbabilitySpace.LOGARITHMIC;
import static org.junit.jupiter.api.Assertions.*;

public class ProbabilitySpaceTest {

    @Test
    public void testLogarithmic() {
        assertEquals(Double.NEGATIVE_INFINITY, LOGARITHMIC.impossible());
        assertEquals(Double.NEGATIVE_INFINITY, LOGARITHMIC.convert(0));
        assertEquals(0, LOGARITHMIC.convert(1), 1e-12);
        assertEquals(-1, LOGARITHMIC.convert(0.5), 1e-12);
        assertEquals(-3, LOGARITHMIC.convert(0.125), 1e-12);
        assertEquals(-4, LOGARITHMIC.combine(-1, -3), 1e-12);
        assertEquals(0.25, LOGARITHMIC.toProbability(-2), 1e-12);
        assertEquals(0, LOGARITHMIC.toProbability(Double.NEGATIVE_INFINITY));
    }

    @Test
    public void testLinear() {
        assertEquals(0, LINEAR.impossible());
        assertEquals(0.3, LINEAR.convert(0.3));
        assertEquals(0.06, LINEAR.combine(0.2, 0.3), 1e-12);
        assertEquals(0.3, LINEAR.toProbability(0.3));
    }

    @Test
    public void testImpossibleNeverProducesNaN() {
        // -Infinity + Infinity would be NaN
        assertEquals(Double.NEGATIVE_INFINITY, LOGARITHMIC.combine(Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY));
        assertEquals(Double.NEGATIVE_INFINITY, LOGARITHMIC.combine(Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY));
        // 0 * Infinity would be NaN
        assertEquals(0, LINEAR.combine(0, Double.POSITIVE_INFINITY));
        assertEquals(0, LINEAR.combine(Double.POSITIVE_INFINITY, 0));
    }

    @ParameterizedTest
    @EnumSource(ProbabilitySpace.class)
    public void testImpossibleIsNeverBetter(ProbabilitySpace space) {
        double impossible = space.impossible();
        assertTrue(space.isImpossible(space.convert(0)));
        assertTrue(space.isImpossible(space.combine(impossible, space.convert(1))));
        assertFalse(space.combine(impossible, space.convert(0.9)) > impossible);
        assertTrue(space.convert(1e-300) > impossible);
    }

    @Test
    public void testOf() {
        assertSame(LOGARITHMIC, ProbabilitySpace.of(true));
        assertSame(LINEAR, ProbabilitySpace.of(false));
    }
}
