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
package com.trellisdecoder.util;

/**
 * Measures the time spent in the phases of a solve, e.g. the forward pass and the traceback.
 */
public class StopWatch {
    private final String name;
    private long lastTime = -1;
    private long elapsedNanos;

    public StopWatch(String name) {
        this.name = name;
    }

    public static StopWatch started(String name) {
        return new StopWatch(name).start();
    }

    public StopWatch start() {
        lastTime = System.nanoTime();
        return this;
    }

    public StopWatch stop() {
        if (lastTime < 0)
            return this;

        elapsedNanos += System.nanoTime() - lastTime;
        lastTime = -1;
        return this;
    }

    public long getNanos() {
        return elapsedNanos;
    }

    public String getTimeString() {
        if (elapsedNanos < 1e3) {
            return elapsedNanos + "ns";
        } else if (elapsedNanos < 1e6) {
            return String.format("%.2fµs", elapsedNanos / 1.e3);
        } else if (elapsedNanos < 1e9) {
            return String.format("%.2fms", elapsedNanos / 1.e6);
        }
        return String.format("%.2fs", elapsedNanos / 1e9);
    }

    @Override
    public String toString() {
        return name + " time:" + getTimeString();
    }
}
