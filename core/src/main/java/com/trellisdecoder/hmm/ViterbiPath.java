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

import com.carrotsearch.hppc.IntArrayList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Contains the most likely sequence and additional results of a solve. The sequence has exactly
 * one entry per observation, entries that could not be reached via back pointers are
 * unreachable.
 *
 * @param <O> observation type
 */
public class ViterbiPath<O> {

    private final List<SequenceState<O>> sequence;
    private final ProbabilitySpace space;
    private final int stateCount;
    private final List<Map<State<O>, Double>> messageHistory;

    public ViterbiPath(List<SequenceState<O>> sequence, ProbabilitySpace space, int stateCount,
                       List<Map<State<O>, Double>> messageHistory) {
        this.sequence = Collections.unmodifiableList(new ArrayList<>(sequence));
        this.space = space;
        this.stateCount = stateCount;
        this.messageHistory = messageHistory == null ? null : Collections.unmodifiableList(new ArrayList<>(messageHistory));
    }

    public List<SequenceState<O>> getSequence() {
        return sequence;
    }

    /**
     * @return the state of each time step, null for unreachable time steps
     */
    public List<State<O>> getStates() {
        List<State<O>> states = new ArrayList<>(sequence.size());
        for (SequenceState<O> ss : sequence) {
            states.add(ss.state);
        }
        return states;
    }

    /**
     * @return the state index of each time step, {@link SequenceState#UNREACHABLE} for
     * unreachable time steps
     */
    public IntArrayList getStateIndices() {
        IntArrayList indices = new IntArrayList(sequence.size());
        for (SequenceState<O> ss : sequence) {
            indices.add(ss.stateIndex);
        }
        return indices;
    }

    public int size() {
        return sequence.size();
    }

    public int getStateCount() {
        return stateCount;
    }

    public ProbabilitySpace getProbabilitySpace() {
        return space;
    }

    /**
     * @return the probability of the whole sequence in the probability space of the solve
     */
    public double getProbability() {
        if (sequence.isEmpty())
            return space.impossible();
        return sequence.get(sequence.size() - 1).probability;
    }

    /**
     * @return true if every time step was reached by the back pointer traversal
     */
    public boolean isComplete() {
        for (SequenceState<O> ss : sequence) {
            if (ss.isUnreachable())
                return false;
        }
        return true;
    }

    public boolean isUnreachable() {
        for (SequenceState<O> ss : sequence) {
            if (!ss.isUnreachable())
                return false;
        }
        return true;
    }

    /**
     * For each time step t, getMessageHistory().get(t).get(s) contains the probability of the
     * most likely sequence ending in state s with the observations up to t. Null if the message
     * history was not kept.
     */
    public List<Map<State<O>, Double>> getMessageHistory() {
        return messageHistory;
    }

    public String messageHistoryString() {
        if (messageHistory == null) {
            throw new IllegalStateException("Message history was not recorded.");
        }

        final StringBuilder sb = new StringBuilder();
        sb.append("Message history with ").append(space.name().toLowerCase(Locale.ROOT)).append(" probabilities\n\n");
        int i = 0;
        for (Map<State<O>, Double> message : messageHistory) {
            sb.append("Time step ").append(i).append("\n");
            i++;
            for (Map.Entry<State<O>, Double> entry : message.entrySet()) {
                sb.append(entry.getKey()).append(": ").append(entry.getValue()).append("\n");
            }
            sb.append("\n");
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (SequenceState<O> ss : sequence) {
            if (sb.length() > 0)
                sb.append(", ");
            sb.append(ss.isUnreachable() ? "unreachable" : ss.state.toString());
        }
        return "[" + sb + "]";
    }
}
