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

import com.trellisdecoder.util.exceptions.InvalidInputException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The grid of {@link TrellisCell}s with one row per observation and one column per state. All
 * cells are allocated up front, the probabilities are computed row by row via
 * {@link #computeInitialProbability(int)} and {@link #computeProbability(int, int)}.
 * <p>
 * A trellis belongs to a single solve and is not thread-safe, except that the cells of one row
 * may be computed concurrently once the previous row is complete.
 *
 * @param <O> observation type
 */
public class Trellis<O> {

    private final List<State<O>> states;
    private final List<O> observations;
    private final ProbabilitySpace space;
    private final TrellisCell[][] rows;

    /**
     * @throws InvalidInputException if states or observations are empty
     */
    public Trellis(List<State<O>> states, List<O> observations, ProbabilitySpace space) {
        checkInput(states, observations);
        if (space == null)
            throw new NullPointerException("probability space must not be null");

        this.states = Collections.unmodifiableList(new ArrayList<>(states));
        this.observations = Collections.unmodifiableList(new ArrayList<>(observations));
        this.space = space;
        this.rows = new TrellisCell[observations.size()][states.size()];
        for (int t = 0; t < rows.length; t++) {
            for (int s = 0; s < rows[t].length; s++) {
                rows[t][s] = new TrellisCell(t, s);
            }
        }
    }

    static void checkInput(List<?> states, List<?> observations) {
        if (states == null || observations == null)
            throw new NullPointerException("states and observations must not be null");
        if (states.isEmpty() || observations.isEmpty())
            throw new InvalidInputException("At least one state and one observation is required, got "
                    + states.size() + " states and " + observations.size() + " observations",
                    states.size(), observations.size());
    }

    public int getTimeSteps() {
        return rows.length;
    }

    public int getStateCount() {
        return states.size();
    }

    public ProbabilitySpace getProbabilitySpace() {
        return space;
    }

    public State<O> getState(int stateIndex) {
        return states.get(stateIndex);
    }

    public List<State<O>> getStates() {
        return states;
    }

    public O getObservation(int timeStep) {
        return observations.get(timeStep);
    }

    public TrellisCell getCell(int timeStep, int stateIndex) {
        return rows[timeStep][stateIndex];
    }

    /**
     * Sets the cell of the first time step to initial probability times emission probability.
     * Cells of the first time step never get a back pointer.
     */
    public void computeInitialProbability(int stateIndex) {
        State<O> state = states.get(stateIndex);
        O observation = observations.get(0);
        double probability = space.combine(space.convert(state.initialProbability(observation)),
                space.convert(state.emissionProbability(observation)));
        rows[0][stateIndex].finish(probability, TrellisCell.NO_BACK_POINTER);
    }

    /**
     * Computes the probability of the most likely sequence ending in the specified cell and
     * stores the predecessor of that sequence as back pointer. All cells of the previous time
     * step must be finalized.
     * <p>
     * If the emission probability is zero the cell becomes impossible without looking at the
     * predecessors. Among equally probable predecessors the one with the lowest state index
     * wins. A predecessor is only selected if its combined probability is not impossible.
     */
    public void computeProbability(int timeStep, int stateIndex) {
        if (timeStep < 1)
            throw new IllegalArgumentException("Use computeInitialProbability for the first time step");

        TrellisCell cell = rows[timeStep][stateIndex];
        State<O> state = states.get(stateIndex);
        O observation = observations.get(timeStep);
        double emission = state.emissionProbability(observation);
        if (emission == 0) {
            cell.finish(space.impossible(), TrellisCell.NO_BACK_POINTER);
            return;
        }

        O prevObservation = observations.get(timeStep - 1);
        TrellisCell[] prevRow = rows[timeStep - 1];
        double maxProbability = space.impossible();
        int maxPrevState = TrellisCell.NO_BACK_POINTER;
        for (TrellisCell prevCell : prevRow) {
            State<O> prevState = states.get(prevCell.getStateIndex());
            double transition = space.convert(
                    prevState.transitionProbability(prevObservation, state, observation));
            double probability = space.combine(prevCell.getProbability(), transition);
            if (probability > maxProbability) {
                maxProbability = probability;
                maxPrevState = prevCell.getStateIndex();
            }
        }
        cell.finish(space.combine(space.convert(emission), maxProbability), maxPrevState);
    }

    /**
     * Retrieves the first cell of the specified time step with maximum probability or null if
     * all cells of the time step are impossible.
     */
    public TrellisCell mostLikelyCell(int timeStep) {
        TrellisCell result = null;
        double maxProbability = space.impossible();
        for (TrellisCell cell : rows[timeStep]) {
            if (cell.getProbability() > maxProbability) {
                maxProbability = cell.getProbability();
                result = cell;
            }
        }
        return result;
    }
}
