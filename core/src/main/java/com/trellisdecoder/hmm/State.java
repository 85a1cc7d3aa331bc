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
 * A hidden state candidate together with the probability model bound to it. Two states are
 * equal only if they are the same instance, the name is used for display only.
 *
 * @param <O> observation type
 */
public final class State<O> {

    private final String name;
    private final ProbabilityModel<O> model;

    public State(String name, ProbabilityModel<O> model) {
        if (name == null || model == null) {
            throw new NullPointerException("name and model must not be null");
        }
        this.name = name;
        this.model = model;
    }

    public static <O> State<O> of(String name, ProbabilityModel<O> model) {
        return new State<>(name, model);
    }

    public String getName() {
        return name;
    }

    public ProbabilityModel<O> getModel() {
        return model;
    }

    public double emissionProbability(O observation) {
        return model.emissionProbability(this, observation);
    }

    public double transitionProbability(O observation, State<O> targetState, O targetObservation) {
        return model.transitionProbability(this, observation, targetState, targetObservation);
    }

    public double initialProbability(O observation) {
        return model.initialProbability(this, observation);
    }

    @Override
    public String toString() {
        return name;
    }
}
