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

import io.nosqlbench.biosynth.TypeNames;
import io.nosqlbench.biosynth.kernels.WaveformKernels;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.random.SynthRandom;

/// Motion artifacts selected by `artifact_type`.
///
/// Keys shared by every type: `n_artifacts` (alias `n_events`, default 3),
/// `amplitude` (1.0) and `duration` (0.2 s per artifact).
public enum MotionArtifactType implements NoiseRenderer {

    /// Signed jump with exponential recovery.
    ELECTRODE_MOVEMENT {
        @Override
        void burst(Bursts bursts, double amplitude, SynthRandom rng) {
            double[] recovery = WaveformKernels.exponentialDecay(bursts.windowSamples(), 5.0);
            bursts.placeRandom(NoiseType.scaled(recovery, amplitude * rng.sign()));
        }
    },
    /// Hanning-windowed tone between 10 and 30 Hz.
    CABLE_MOTION {
        @Override
        void burst(Bursts bursts, double amplitude, SynthRandom rng) {
            int n = bursts.windowSamples();
            double fs = bursts.timeBase().samplingRate();
            double[] tone = WaveformKernels.tone(n, rng.uniform(10.0, 30.0), 0.0, amplitude, fs);
            double[] envelope = WaveformKernels.hanning(n);
            for (int i = 0; i < n; i++) {
                tone[i] *= envelope[i];
            }
            bursts.placeRandom(tone);
        }
    },
    /// 2, 5 and 8 Hz mixture riding on a random offset.
    SUBJECT_MOVEMENT {
        @Override
        void burst(Bursts bursts, double amplitude, SynthRandom rng) {
            int n = bursts.windowSamples();
            double fs = bursts.timeBase().samplingRate();
            double[] movement = new double[n];
            for (double frequency : new double[]{2.0, 5.0, 8.0}) {
                double[] tone = WaveformKernels.tone(n, frequency, rng.uniform(0.0, 2.0 * Math.PI), amplitude / 3.0, fs);
                for (int i = 0; i < n; i++) {
                    movement[i] += tone[i];
                }
            }
            double shift = rng.uniform(-amplitude / 2.0, amplitude / 2.0);
            for (int i = 0; i < n; i++) {
                movement[i] += shift;
            }
            bursts.placeRandom(movement);
        }
    },
    /// Signed step, or with probability 0.5 a linear recovery from the step back to zero.
    BASELINE_SHIFT {
        @Override
        void burst(Bursts bursts, double amplitude, SynthRandom rng) {
            int n = bursts.windowSamples();
            double shift = amplitude * rng.sign();
            int start = bursts.randomStart();
            if (rng.bernoulli(0.5)) {
                bursts.buffer().place(WaveformKernels.linspace(shift, 0.0, n), start, bursts.policy());
            } else {
                bursts.buffer().addConstant(start, n, shift, bursts.policy());
            }
        }
    };

    public static final String PARAM = "artifact_type";

    abstract void burst(Bursts bursts, double amplitude, SynthRandom rng);

    @Override
    public double[] render(TimeBase tb, SynthParams params, SynthRandom rng) {
        int count = Bursts.count(params, 3, "n_artifacts", "n_events");
        double amplitude = NoiseType.amplitude(params);
        Bursts bursts = Bursts.of(tb, params, rng, 0.2);
        for (int i = 0; i < count; i++) {
            burst(bursts, amplitude, rng);
        }
        return bursts.toArray();
    }

    public String paramName() {
        return TypeNames.paramName(this);
    }

    public static MotionArtifactType fromName(String name) {
        return TypeNames.fromName("motion artifact type", MotionArtifactType.class, name);
    }
}
