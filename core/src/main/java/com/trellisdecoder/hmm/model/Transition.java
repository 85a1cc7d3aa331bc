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

import java.util.Objects;

/**
 * Represents the transition between two states, identified by their names.
 */
public class Transition {
    public final String fromState;
    public final String toState;

    public Transition(String fromState, String toState) {
        if (fromState == null || toState == null)
            throw new NullPointerException("state names must not be null");
        this.fromState = fromState;
        this.toState = toState;
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromState, toState);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        Transition other = (Transition) obj;
        return fromState.equals(other.fromState) && toState.equals(other.toState);
    }

    @Override
    public String toString() {
        return fromState + "->" + toState;
    }
}
