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
package com.trellisdecoder.hmm.model;

import com.trellisdecoder.hmm.ProbabilityModel;
import com.trellisdecoder.hmm.State;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A stationary {@link ProbabilityModel} backed by probability tables and keyed by state name.
 * Emission probabilities depend on state and observation, transition probabilities on the pair
 * of states and initial probabilities on the state only. Missing entries have probability zero,
 * except for transitions if a default transition probability is set.
 * <p>
 * One instance is meant to be shared by all states it describes, see {@link #createStates(String...)}.
 * The tables are not validated, e.g. probabilities of a row do not need to sum up to 1.
 *
 * @param <O> observation type
 */
public class TableProbabilityModel<O> implements ProbabilityModel<O> {

    private final Map<String, Map<O, Double>> emissions;
    private final Map<Transition, Double> transitions;
    private final Map<String, Double> initials;
    private final double defaultTransition;

    private TableProbabilityModel(Builder<O> builder) {
        this.emissions = new HashMap<>();
        for (Map.Entry<String, Map<O, Double>> entry : builder.emissions.entrySet()) {
            emissions.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        this.transitions = new HashMap<>(builder.transitions);
        this.initials = new HashMap<>(builder.initials);
        this.defaultTransition = builder.defaultTransition;
    }

    public static <O> Builder<O> builder() {
        return new Builder<>();
    }

    /**
     * Creates one state per name, all bound to this model, in the order of the names.
     */
    public List<State<O>> createStates(String... names) {
        List<State<O>> states = new ArrayList<>(names.length);
        for (String name : names) {
            states.add(new State<>(name, this));
        }
        return states;
    }

    @Override
    public double emissionProbability(State<O> state, O observation) {
        Map<O, Double> row = emissions.get(state.getName());
        if (row == null)
            return 0;
        Double probability = row.get(observation);
        return probability == null ? 0 : probability;
    }

    @Override
    public double transitionProbability(State<O> sourceState, O sourceObservation, State<O> targetState, O targetObservation) {
        Double probability = transitions.get(new Transition(sourceState.getName(), targetState.getName()));
        return probability == null ? defaultTransition : probability;
    }

    @Override
    public double initialProbability(State<O> state, O observation) {
        Double probability = initials.get(state.getName());
        return probability == null ? 0 : probability;
    }

    public static class Builder<O> {
        private final Map<String, Map<O, Double>> emissions = new LinkedHashMap<>();
        private final Map<Transition, Double> transitions = new LinkedHashMap<>();
        private final Map<String, Double> initials = new LinkedHashMap<>();
        private double defaultTransition = 0;

        private Builder() {
        }

        public Builder<O> emission(String state, O observation, double probability) {
            if (state == null || observation == null)
                throw new NullPointerException("state and observation must not be null");
            emissions.computeIfAbsent(state, k -> new LinkedHashMap<>()).put(observation, probability);
            return this;
        }

        public Builder<O> emissions(String state, Map<O, Double> probabilities) {
            for (Map.Entry<O, Double> entry : probabilities.entrySet()) {
                emission(state, entry.getKey(), entry.getValue());
            }
            return this;
        }

        public Builder<O> transition(String fromState, String toState, double probability) {
            transitions.put(new Transition(fromState, toState), probability);
            return this;
        }

        public Builder<O> initial(String state, double probability) {
            if (state == null)
                throw new NullPointerException("state must not be null");
            initials.put(state, probability);
            return this;
        }

        /**
         * Sets the probability returned for transitions without an explicit entry, zero by default.
         */
        public Builder<O> defaultTransition(double probability) {
            this.defaultTransition = probability;
            return this;
        }

        public TableProbabilityModel<O> build() {
            return new TableProbabilityModel<>(this);
        }
    }
}
