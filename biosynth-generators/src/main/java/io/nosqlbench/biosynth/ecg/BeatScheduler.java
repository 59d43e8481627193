package io.nosqlbench.biosynth.ecg;

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

import io.nosqlbench.biosynth.model.EventSchedule;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.random.SynthRandom;

import java.util.Arrays;
import java.util.function.DoubleSupplier;

/**
 * Beat times for one record. The first beat is at t = 0 and beats continue
 * while {@code t < duration}.
 */
final class BeatScheduler {

    /** Shortest RR interval a perturbed schedule may produce, in seconds. */
    static final double MIN_RR = 0.2;

    private BeatScheduler() {
    }

    /**
     * Regular rhythm with gaussian beat-to-beat variability.
     *
     * @param heartRate bpm
     * @param hrvStd RR standard deviation in seconds, 0 for a fixed rhythm
     */
    static EventSchedule sinus(TimeBase tb, double heartRate, double hrvStd, SynthRandom rng) {
        double base = 60.0 / heartRate;
        if (hrvStd == 0.0) {
            return build(tb, 0.0, () -> base);
        }
        return build(tb, 0.0, () -> Math.max(MIN_RR, base + rng.gaussian(0.0, hrvStd)));
    }

    /** Irregular rhythm with RR intervals uniform in {@code [minRr, maxRr)}. */
    static EventSchedule uniform(TimeBase tb, double minRr, double maxRr, SynthRandom rng) {
        return build(tb, 0.0, () -> rng.uniform(minRr, maxRr));
    }

    /** Fixed-rate rhythm starting at {@code first}. */
    static EventSchedule fixed(TimeBase tb, double first, double heartRate) {
        double rr = 60.0 / heartRate;
        return build(tb, first, () -> rr);
    }

    private static EventSchedule build(TimeBase tb, double first, DoubleSupplier rr) {
        double[] times = new double[16];
        int count = 0;
        double t = first;
        while (t < tb.duration()) {
            if (count == times.length) {
                times = Arrays.copyOf(times, count * 2);
            }
            times[count++] = t;
            t += rr.getAsDouble();
        }
        return EventSchedule.of(tb.duration(), Arrays.copyOf(times, count));
    }
}
