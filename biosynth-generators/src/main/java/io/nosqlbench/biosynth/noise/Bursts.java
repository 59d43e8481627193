package io.nosqlbench.biosynth.noise;

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

import io.nosqlbench.biosynth.model.ParameterChecks;
import io.nosqlbench.biosynth.model.PlacementPolicy;
import io.nosqlbench.biosynth.model.SignalBuffer;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.random.SynthRandom;

/// Common plumbing for layers made of short, randomly placed bursts.
///
/// A burst of `window` seconds starts at `U(0, duration - window)`, so with the
/// default [PlacementPolicy#CLIP] a burst only loses samples to rounding at
/// the end of the record.
final class Bursts {

    private final TimeBase timeBase;
    private final SynthRandom rng;
    private final SignalBuffer buffer;
    private final PlacementPolicy policy;
    private final double window;
    private final int windowSamples;

    private Bursts(TimeBase timeBase, SynthRandom rng, PlacementPolicy policy, double window) {
        this.timeBase = timeBase;
        this.rng = rng;
        this.buffer = new SignalBuffer(timeBase);
        this.policy = policy;
        this.window = window;
        this.windowSamples = timeBase.samplesFor(window);
    }

    /// @param defaultWindow burst length in seconds when `duration` is absent
    /// @throws io.nosqlbench.biosynth.model.exceptions.InvalidParameterException
    ///     if the window is not positive or not shorter than the record
    static Bursts of(TimeBase timeBase, SynthParams params, SynthRandom rng, double defaultWindow) {
        double window = ParameterChecks.windowWithin("duration",
            params.getDouble("duration", defaultWindow), timeBase.duration());
        return new Bursts(timeBase, rng, PlacementPolicy.from(params, PlacementPolicy.CLIP), window);
    }

    /// Reads a non-negative event count from the first present key.
    static int count(SynthParams params, int defaultCount, String... keys) {
        return ParameterChecks.nonNegative(keys[0], params.getInt(defaultCount, keys));
    }

    int windowSamples() {
        return windowSamples;
    }

    double window() {
        return window;
    }

    SignalBuffer buffer() {
        return buffer;
    }

    PlacementPolicy policy() {
        return policy;
    }

    TimeBase timeBase() {
        return timeBase;
    }

    /// @return a random start index for one burst
    int randomStart() {
        return timeBase.indexOf(rng.uniform(0.0, timeBase.duration() - window));
    }

    /// Places one kernel at a fresh random start.
    void placeRandom(double[] kernel) {
        buffer.place(kernel, randomStart(), policy);
    }

    double[] toArray() {
        return buffer.toSignal().toArray();
    }
}
