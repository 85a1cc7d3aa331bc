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
 * This interface needs to be implemented by the caller and bound to each {@link State} to
 * specify emission, transition and initial probabilities. The same instance may be bound to
 * several states.
 * <p>
 * All methods return plain probabilities in [0, 1], not logarithms. The engine converts them
 * into the configured {@link ProbabilitySpace}. A return value of exactly 0 means impossible.
 * Implementations must be pure and deterministic; values outside [0, 1] are not detected and
 * lead to undefined results.
 *
 * @param <O> observation type
 */
public interface ProbabilityModel<O> {

    /**
     * Returns the probability of making the specified observation in the specified state, i.e.
     * p(observation|state).
     */
    double emissionProbability(State<O> state, O observation);

    /**
     * Returns the probability of the transition from the source state, in which the source
     * observation was made, to the target state, in which the target observation is made.
     * The engine asks the model bound to the source state.
     */
    double transitionProbability(State<O> sourceState, O sourceObservation,
                                 State<O> targetState, O targetObservation);

    /**
     * Returns the probability of starting in the specified state given the first observation.
     */
    double initialProbability(State<O> state, O observation);
}
