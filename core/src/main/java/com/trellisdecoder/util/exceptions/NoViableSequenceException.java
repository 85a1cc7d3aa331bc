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
package com.trellisdecoder.util.exceptions;

import com.trellisdecoder.hmm.ViterbiPath;

import java.util.HashMap;
import java.util.Map;

/**
 * Thrown if every state of the last time step has zero probability, i.e. no state sequence can
 * explain the observations under the supplied model. The path attached to this exception has
 * the full length but every slot is unreachable.
 */
public class NoViableSequenceException extends IllegalStateException implements ViterbiException {

    private final ViterbiPath<?> path;

    public NoViableSequenceException(String message, ViterbiPath<?> path) {
        super(message);
        this.path = path;
    }

    /**
     * @return the all-unreachable path with one slot per observation
     */
    public ViterbiPath<?> getPath() {
        return path;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new HashMap<>(2);
        details.put("time_steps", path.size());
        details.put("states", path.getStateCount());
        return details;
    }
}
