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

/**
 * The arithmetic used for the probabilities stored in the trellis.
 * <p>
 * {@link #LOGARITHMIC} stores base-2 logarithms and adds them, which prevents arithmetic
 * underflows for long observation sequences. {@link #LINEAR} stores plain probabilities and
 * multiplies them, it is only suitable for short sequences or to compare results.
 * <p>
 * Combining anything with the impossible value yields the impossible value again, so
 * -Infinity never takes part in further arithmetic and no NaN can appear.
 */
public enum ProbabilitySpace {

    LOGARITHMIC {
        @Override
        public double impossible() {
            return LOG_IMPOSSIBLE;
        }

        @Override
        public double convert(double probability) {
            if (probability == 0)
                return LOG_IMPOSSIBLE;
            return Math.log(probability) / LN_2;
        }

        @Override
        public double combine(double a, double b) {
            if (a == LOG_IMPOSSIBLE || b == LOG_IMPOSSIBLE)
                return LOG_IMPOSSIBLE;
            return a + b;
        }
    },

    LINEAR {
        @Override
        public double impossible() {
            return 0;
        }

        @Override
        public double convert(double probability) {
            return probability;
        }

        @Override
        public double combine(double a, double b) {
            if (a == 0 || b == 0)
                return 0;
            return a * b;
        }
    };

    /**
     * log2(0). Used instead of whatever the math library returns for the logarithm of zero.
     */
    public static final double LOG_IMPOSSIBLE = Double.NEGATIVE_INFINITY;

    private static final double LN_2 = Math.log(2);

    public static ProbabilitySpace of(boolean logarithmic) {
        return logarithmic ? LOGARITHMIC : LINEAR;
    }

    /**
     * @return the value representing a probability of zero in this space
     */
    public abstract double impossible();

    /**
     * Converts a plain probability as returned by a {@link ProbabilityModel} into this space.
     */
    public abstract double convert(double probability);

    /**
     * Returns the probability of two independent events, i.e. the sum of logarithms or the
     * product of plain probabilities.
     */
    public abstract double combine(double a, double b);

    public boolean isImpossible(double value) {
        return value == impossible();
    }

    /**
     * Converts a value of this space back into a plain probability.
     */
    public double toProbability(double value) {
        if (this == LINEAR)
            return value;
        return value == LOG_IMPOSSIBLE ? 0 : Math.pow(2, value);
    }
}
