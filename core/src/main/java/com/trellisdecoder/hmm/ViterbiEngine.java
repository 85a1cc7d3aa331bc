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

import com.trellisdecoder.config.ViterbiConfig;
import com.trellisdecoder.util.StopWatch;
import com.trellisdecoder.util.exceptions.InvalidInputException;
import com.trellisdecoder.util.exceptions.NoViableSequenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.IntStream;

/**
 * Implementation of the Viterbi algorithm, which computes the most likely sequence of hidden
 * states for a sequence of observations. The algorithm is described e.g. in Rabiner, Juang, An
 * introduction to Hidden Markov Models, IEEE ASSP Mag., pp 4-16, June 1986.
 * <p>
 * The probabilities are supplied by the {@link ProbabilityModel} bound to each {@link State}.
 * The same states are candidates at every time step. Each call of {@link #solve()} builds a new
 * {@link Trellis}, runs the forward pass time step by time step and retrieves the most likely
 * sequence by following the back pointers from the most likely state of the last time step.
 * <p>
 * Ties are broken in favour of the state that comes first in the state list, both when
 * selecting a predecessor and when selecting the last state. Pass states with a predictable
 * order to get deterministic results.
 * <p>
 * Instances are immutable, {@link #solve()} can be called concurrently if the probability
 * models are thread-safe.
 *
 * @param <O> observation type
 */
public class ViterbiEngine<O> {
    private final Logger logger = LoggerFactory.getLogger(getClass());

    private final List<State<O>> states;
    private final List<O> observations;
    private final ViterbiConfig config;

    /**
     * @param logarithmic whether to compute with log probabilities, which is recommended as
     *                    plain probabilities underflow for long observation sequences
     * @throws InvalidInputException if states or observations are empty
     */
    public ViterbiEngine(List<State<O>> states, List<O> observations, boolean logarithmic) {
        this(states, observations, new ViterbiConfig().setLogarithmic(logarithmic));
    }

    /**
     * @throws InvalidInputException if states or observations are empty
     */
    public ViterbiEngine(List<State<O>> states, List<O> observations, ViterbiConfig config) {
        Trellis.checkInput(states, observations);
        if (config == null)
            throw new NullPointerException("config must not be null");

        this.states = new ArrayList<>(states); // Defensive copy.
        this.observations = new ArrayList<>(observations);
        this.config = new ViterbiConfig(config);
    }

    public ViterbiConfig getConfig() {
        return new ViterbiConfig(config);
    }

    /**
     * Returns the most likely state sequence, with exactly one entry per observation.
     * <p>
     * Formally, this is argmax p(s_0, ..., s_T, o_0, ..., o_T) with respect to s_0, ..., s_T,
     * where s_t is a state at time step t and o_t is the observation at time step t.
     *
     * @throws NoViableSequenceException if every state of the last time step has zero probability
     */
    public ViterbiPath<O> solve() {
        final ProbabilitySpace space = config.getProbabilitySpace();
        final Trellis<O> trellis = new Trellis<>(states, observations, space);
        final List<Map<State<O>, Double>> messageHistory = config.isKeepMessageHistory()
                ? new ArrayList<>(observations.size()) : null;

        StopWatch forwardSW = StopWatch.started("forward");
        // Forward pass
        for (int t = 0; t < trellis.getTimeSteps(); t++) {
            computeTimeStep(trellis, t);
            if (messageHistory != null) {
                messageHistory.add(message(trellis, t));
            }
        }
        forwardSW.stop();

        final int lastTimeStep = trellis.getTimeSteps() - 1;
        final TrellisCell lastCell = trellis.mostLikelyCell(lastTimeStep);
        if (lastCell == null) {
            logger.debug("No viable sequence for {} observations and {} states, {}", observations.size(),
                    states.size(), forwardSW);
            ViterbiPath<O> unreachablePath = new ViterbiPath<>(unreachableSequence(trellis), space,
                    states.size(), messageHistory);
            throw new NoViableSequenceException("All " + states.size() + " states have zero probability at the last "
                    + "time step " + lastTimeStep, unreachablePath);
        }

        StopWatch tracebackSW = StopWatch.started("traceback");
        List<SequenceState<O>> sequence = retrieveMostLikelySequence(trellis, lastCell);
        tracebackSW.stop();

        ViterbiPath<O> path = new ViterbiPath<>(sequence, space, states.size(), messageHistory);
        if (logger.isDebugEnabled()) {
            logger.debug("Solved {} observations and {} states with {} probabilities, probability: {}, {}, {}",
                    observations.size(), states.size(), space.name().toLowerCase(Locale.ROOT), path.getProbability(),
                    forwardSW, tracebackSW);
        }
        return path;
    }

    /**
     * Computes all cells of the specified time step. Cells of the same time step only read the
     * previous time step, so they can be computed in parallel.
     */
    private void computeTimeStep(Trellis<O> trellis, int timeStep) {
        IntStream stateIndices = IntStream.range(0, trellis.getStateCount());
        if (config.isParallel())
            stateIndices = stateIndices.parallel();

        if (timeStep == 0) {
            stateIndices.forEach(trellis::computeInitialProbability);
        } else {
            stateIndices.forEach(s -> trellis.computeProbability(timeStep, s));
        }
    }

    private Map<State<O>, Double> message(Trellis<O> trellis, int timeStep) {
        final Map<State<O>, Double> message = new LinkedHashMap<>();
        for (int s = 0; s < trellis.getStateCount(); s++) {
            message.put(trellis.getState(s), trellis.getCell(timeStep, s).getProbability());
        }
        return message;
    }

    /**
     * Retrieves the most likely sequence ending in the specified cell of the last time step by
     * following the back pointers. The traversal stops at the first cell without back pointer,
     * which is a cell of the first time step unless the chain was cut by a zero emission
     * probability. Time steps before such a cut remain unreachable.
     */
    static <O> List<SequenceState<O>> retrieveMostLikelySequence(Trellis<O> trellis, TrellisCell lastCell) {
        final ProbabilitySpace space = trellis.getProbabilitySpace();
        @SuppressWarnings("unchecked")
        final SequenceState<O>[] result = new SequenceState[trellis.getTimeSteps()];
        for (int t = 0; t < result.length; t++) {
            result[t] = SequenceState.unreachable(trellis.getObservation(t), t, space);
        }

        TrellisCell cell = lastCell;
        while (cell != null) {
            final int t = cell.getTimeStep();
            result[t] = new SequenceState<>(trellis.getState(cell.getStateIndex()), cell.getStateIndex(),
                    trellis.getObservation(t), t, cell.getProbability());
            cell = cell.hasBackPointer() && t > 0 ? trellis.getCell(t - 1, cell.getBackPointer()) : null;
        }
        return Arrays.asList(result);
    }

    private static <O> List<SequenceState<O>> unreachableSequence(Trellis<O> trellis) {
        final List<SequenceState<O>> result = new ArrayList<>(trellis.getTimeSteps());
        for (int t = 0; t < trellis.getTimeSteps(); t++) {
            result.add(SequenceState.unreachable(trellis.getObservation(t), t, trellis.getProbabilitySpace()));
        }
        return result;
    }
}
