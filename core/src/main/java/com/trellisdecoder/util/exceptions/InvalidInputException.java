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

import java.util.HashMap;
import java.util.Map;

/**
 * Thrown before any computation if the state set or the observation sequence is empty.
 */
public class InvalidInputException extends IllegalArgumentException implements ViterbiException {

    private final int stateCount;
    private final int observationCount;

    public InvalidInputException(String message, int stateCount, int observationCount) {
        super(message);
        this.stateCount = stateCount;
        this.observationCount = observationCount;
    }

    public int getStateCount() {
        return stateCount;
    }

    public int getObservationCount() {
        return observationCount;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new HashMap<>(2);
        details.put("states", stateCount);
        details.put("observations", observationCount);
        return details;
    }
}
