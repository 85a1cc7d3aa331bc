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

import java.util.Objects;

/**
 * One time step of the most likely sequence.
 *
 * @param <O> observation type
 */
public class SequenceState<O> {

    public static final int UNREACHABLE = -1;

    /**
     * Null if the time step is unreachable.
     */
    public final State<O> state;

    /**
     * Index of {@link #state} in the state list passed to the engine or {@link #UNREACHABLE}.
     */
    public final int stateIndex;

    public final O observation;

    public final int timeStep;

    /**
     * Probability of the most likely sequence up to this time step, in the probability space of
     * the solve. The impossible value of that space if the time step is unreachable.
     */
    public final double probability;

    public SequenceState(State<O> state, int stateIndex, O observation, int timeStep, double probability) {
        this.state = state;
        this.stateIndex = stateIndex;
        this.observation = observation;
        this.timeStep = timeStep;
        this.probability = probability;
    }

    static <O> SequenceState<O> unreachable(O observation, int timeStep, ProbabilitySpace space) {
        return new SequenceState<>(null, UNREACHABLE, observation, timeStep, space.impossible());
    }

    public boolean isUnreachable() {
        return state == null;
    }

    @Override
    public String toString() {
        return "SequenceState [timeStep=" + timeStep + ", state=" + (state == null ? "unreachable" : state)
                + ", observation=" + observation + ", probability=" + probability + "]";
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, stateIndex, observation, timeStep, probability);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        @SuppressWarnings("unchecked")
        SequenceState<O> other = (SequenceState<O>) obj;
        return stateIndex == other.stateIndex && timeStep == other.timeStep
                && Double.compare(probability, other.probability) == 0
                && Objects.equals(state, other.state) && Objects.equals(observation, other.observation);
    }
}
