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
 * One (time step, state) pair of the {@link Trellis}. Stores the probability of the most likely
 * sequence ending in this state at this time step and the back pointer to the previous state of
 * that sequence.
 * <p>
 * The back pointer is the state index of a cell in the previous row, not a reference. A cell is
 * finalized exactly once during the forward pass and read-only afterwards.
 */
public class TrellisCell {

    public static final int NO_BACK_POINTER = -1;

    private final int timeStep;
    private final int stateIndex;
    private double probability;
    private int backPointer = NO_BACK_POINTER;
    private boolean finalized;

    TrellisCell(int timeStep, int stateIndex) {
        this.timeStep = timeStep;
        this.stateIndex = stateIndex;
    }

    public int getTimeStep() {
        return timeStep;
    }

    public int getStateIndex() {
        return stateIndex;
    }

    /**
     * @return the probability in the {@link ProbabilitySpace} of the trellis
     * @throws IllegalStateException if the forward pass did not reach this cell yet
     */
    public double getProbability() {
        if (!finalized)
            throw new IllegalStateException("Probability of " + this + " is not computed yet");
        return probability;
    }

    /**
     * @return the state index of the predecessor cell at time step - 1 or {@link #NO_BACK_POINTER}
     */
    public int getBackPointer() {
        return backPointer;
    }

    public boolean hasBackPointer() {
        return backPointer != NO_BACK_POINTER;
    }

    public boolean isFinalized() {
        return finalized;
    }

    void finish(double probability, int backPointer) {
        if (finalized)
            throw new IllegalStateException("Probability of " + this + " was already computed");
        if (timeStep == 0 && backPointer != NO_BACK_POINTER)
            throw new IllegalStateException("A cell of the first time step cannot have a back pointer");

        this.probability = probability;
        this.backPointer = backPointer;
        this.finalized = true;
    }

    @Override
    public String toString() {
        return "cell(" + timeStep + "," + stateIndex + ")";
    }
}
