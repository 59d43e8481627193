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

import io.nosqlbench.biosynth.model.ParameterChecks;
import io.nosqlbench.biosynth.model.PlacementPolicy;
import io.nosqlbench.biosynth.model.SignalBuffer;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.WaveformKernel;
import io.nosqlbench.biosynth.model.random.SynthRandom;

/// Everything a [CardiacCondition] needs to render one record.
final class BeatContext {

    private final TimeBase timeBase;
    private final SynthParams params;
    private final SynthRandom rng;
    private final WaveMorphology morphology;
    private final PlacementPolicy policy;
    private final SignalBuffer buffer;

    BeatContext(TimeBase timeBase, SynthParams params, SynthRandom rng,
                WaveMorphology morphology, PlacementPolicy policy) {
        this.timeBase = timeBase;
        this.params = params;
        this.rng = rng;
        this.morphology = morphology;
        this.policy = policy;
        this.buffer = new SignalBuffer(timeBase);
    }

    TimeBase timeBase() {
        return timeBase;
    }

    SynthParams params() {
        return params;
    }

    SynthRandom rng() {
        return rng;
    }

    WaveMorphology morphology() {
        return morphology;
    }

    SignalBuffer buffer() {
        return buffer;
    }

    double samplingRate() {
        return timeBase.samplingRate();
    }

    double heartRate() {
        return ParameterChecks.positive("heart_rate", params.getDouble("heart_rate", 75.0));
    }

    double hrvStd() {
        return ParameterChecks.nonNegative("hrv_std", params.getDouble("hrv_std", 0.0));
    }

    double severity() {
        return ParameterChecks.unitInterval("severity", params.getDouble("severity", 0.5));
    }

    /// Places a kernel at `beatTime` plus its own offset.
    void place(WaveformKernel kernel, double beatTime) {
        buffer.place(kernel, beatTime, timeBase, policy);
    }

    /// Places raw samples starting at `startTime`.
    void placeAt(double[] samples, double startTime, double scale) {
        buffer.place(samples, timeBase.indexOf(startTime), scale, policy);
    }

    /// Adds a constant over `[startTime, startTime + seconds)`.
    void constant(double startTime, double seconds, double value) {
        buffer.addConstant(timeBase.indexOf(startTime), timeBase.samplesFor(seconds), value, policy);
    }

    /// P, QRS and T of one normal beat.
    void normalBeat(double beatTime) {
        place(morphology.pWave(), beatTime);
        place(morphology.qrs(), beatTime);
        place(morphology.tWave(), beatTime);
    }

    /// QRS and T without an atrial wave.
    void ventricularBeat(double beatTime) {
        place(morphology.qrs(), beatTime);
        place(morphology.tWave(), beatTime);
    }
}
