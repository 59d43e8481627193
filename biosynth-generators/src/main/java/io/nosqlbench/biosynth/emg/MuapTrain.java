package io.nosqlbench.biosynth.emg;

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

import io.nosqlbench.biosynth.model.PlacementPolicy;
import io.nosqlbench.biosynth.model.SignalBuffer;
import io.nosqlbench.biosynth.model.random.SynthRandom;

/// Stochastic motor-unit firing.
///
/// At every sample of a segment, one Bernoulli trial with probability
/// `min(1, (50 + 450 I) / fs)` decides whether a MUAP starts there; a fired
/// MUAP is scaled by `(0.7 + 0.3 I) * U(0.9, 1.1)`, where `I` is the
/// activation at that sample.
final class MuapTrain {

    static final double BASE_RATE = 50.0;
    static final double RATE_SPAN = 450.0;

    private final double[] muap;
    private final double samplingRate;
    private final PlacementPolicy policy;
    private int fired;

    MuapTrain(double[] muap, double samplingRate, PlacementPolicy policy) {
        this.muap = muap;
        this.samplingRate = samplingRate;
        this.policy = policy;
    }

    static double firingProbability(double intensity, double samplingRate) {
        return Math.min(1.0, (BASE_RATE + RATE_SPAN * intensity) / samplingRate);
    }

    void fire(SignalBuffer buffer, ActivationSegment segment, SynthRandom rng) {
        for (int i = 0; i < segment.length(); i++) {
            double intensity = segment.intensityAt(i);
            if (rng.uniform01() < firingProbability(intensity, samplingRate)) {
                double amplitude = (0.7 + 0.3 * intensity) * rng.uniform(0.9, 1.1);
                buffer.place(muap, segment.offset() + i, amplitude, policy);
                fired++;
            }
        }
    }

    int firedCount() {
        return fired;
    }
}
