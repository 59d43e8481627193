/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.biosynth.model;

import java.util.Arrays;
import java.util.stream.DoubleStream;

/// Sorted event times in seconds, each within `[0, duration)`.
///
/// Beats, saccades, blinks and firings are scheduled as an EventSchedule
/// before any kernel is rendered.
public final class EventSchedule {

    private final double[] times;

    private EventSchedule(double[] times) {
        this.times = times;
    }

    /// Builds a schedule, discarding times outside `[0, duration)` and sorting the rest.
    ///
    /// @param duration the signal duration in seconds
    /// @param times candidate event times
    /// @return the schedule
    public static EventSchedule of(double duration, double... times) {
        double[] kept = Arrays.stream(times)
            .filter(t -> t >= 0.0 && t < duration)
            .sorted()
            .toArray();
        return new EventSchedule(kept);
    }

    public static EventSchedule empty() {
        return new EventSchedule(new double[0]);
    }

    public int size() {
        return times.length;
    }

    public boolean isEmpty() {
        return times.length == 0;
    }

    public double get(int index) {
        return times[index];
    }

    public double[] toArray() {
        return Arrays.copyOf(times, times.length);
    }

    public DoubleStream stream() {
        return Arrays.stream(times);
    }

    /// @return the differences between consecutive events, one fewer than size
    public double[] intervals() {
        if (times.length < 2) {
            return new double[0];
        }
        double[] d = new double[times.length - 1];
        for (int i = 1; i < times.length; i++) {
            d[i - 1] = times[i] - times[i - 1];
        }
        return d;
    }

    @Override
    public String toString() {
        return "EventSchedule[size=" + times.length + "]";
    }
}
