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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trellisdecoder.hmm.ProbabilitySpace;

import java.util.Objects;

/**
 * Options of a {@link com.trellisdecoder.hmm.ViterbiEngine}. Can be created in code with the
 * fluent setters or read from a YAML file via {@link ViterbiConfigParser}, see
 * `viterbi-config.yml` in the test resources for an example.
 */
public class ViterbiConfig {
    private boolean logarithmic = true;
    private boolean parallel = false;
    private boolean keepMessageHistory = false;

    public ViterbiConfig() {
    }

    public ViterbiConfig(ViterbiConfig config) {
        this.logarithmic = config.logarithmic;
        this.parallel = config.parallel;
        this.keepMessageHistory = config.keepMessageHistory;
    }

    public boolean isLogarithmic() {
        return logarithmic;
    }

    /**
     * Whether to compute with base-2 log probabilities (default) or plain probabilities. Plain
     * probabilities underflow for long observation sequences.
     */
    @JsonProperty("logarithmic")
    public ViterbiConfig setLogarithmic(boolean logarithmic) {
        this.logarithmic = logarithmic;
        return this;
    }

    public ProbabilitySpace getProbabilitySpace() {
        return ProbabilitySpace.of(logarithmic);
    }

    public boolean isParallel() {
        return parallel;
    }

    /**
     * Whether the states of one time step are computed in parallel. Only worthwhile for many
     * states and expensive probability models.
     */
    @JsonProperty("parallel")
    public ViterbiConfig setParallel(boolean parallel) {
        this.parallel = parallel;
        return this;
    }

    public boolean isKeepMessageHistory() {
        return keepMessageHistory;
    }

    /**
     * Whether to store the probabilities of all states for every time step in the result, for
     * debugging.
     */
    @JsonProperty("keep_message_history")
    public ViterbiConfig setKeepMessageHistory(boolean keepMessageHistory) {
        this.keepMessageHistory = keepMessageHistory;
        return this;
    }

    @Override
    public String toString() {
        return "logarithmic=" + logarithmic + "|parallel=" + parallel + "|keepMessageHistory=" + keepMessageHistory;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ViterbiConfig that = (ViterbiConfig) o;
        return logarithmic == that.logarithmic && parallel == that.parallel
                && keepMessageHistory == that.keepMessageHistory;
    }

    @Override
    public int hashCode() {
        return Objects.hash(logarithmic, parallel, keepMessageHistory);
    }
}
