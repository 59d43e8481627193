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
import io.nosqlbench.biosynth.model.ParameterChecks;
import io.nosqlbench.biosynth.model.PlacementPolicy;
import io.nosqlbench.biosynth.model.SignalBuffer;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.random.SynthRandom;

/// Interference from other sources, selected by `interference_type`.
/// All types honor `amplitude` (1.0).
public enum InterferenceType implements NoiseRenderer {

    /// Muscle crosstalk: `n_bursts` (5) Hanning-windowed bursts of `duration`
    /// (0.2 s), each a sum of ten tones between 20 and 500 Hz.
    EMG {
        @Override
        public double[] render(TimeBase tb, SynthParams params, SynthRandom rng) {
            int count = Bursts.count(params, 5, "n_bursts");
            double amplitude = NoiseType.amplitude(params);
            Bursts bursts = Bursts.of(tb, params, rng, 0.2);
            int n = bursts.windowSamples();
            for (int b = 0; b < count; b++) {
                double[] burst = new double[n];
                for (int c = 0; c < 10; c++) {
                    double[] tone = WaveformKernels.tone(n, rng.uniform(20.0, 500.0),
                        rng.uniform(0.0, 2.0 * Math.PI), 1.0, tb.samplingRate());
                    for (int i = 0; i < n; i++) {
                        burst[i] += tone[i];
                    }
                }
                double[] envelope = WaveformKernels.hanning(n);
                for (int i = 0; i < n; i++) {
                    burst[i] *= amplitude * envelope[i];
                }
                bursts.placeRandom(burst);
            }
            return bursts.toArray();
        }
    },
    /// Cardiac pickup: a QRS-like template repeated at `heart_rate` (60 bpm).
    /// A template that would run past the end of the record is dropped.
    ECG {
        @Override
        public double[] render(TimeBase tb, SynthParams params, SynthRandom rng) {
            double heartRate = ParameterChecks.positive("heart_rate", params.getDouble("heart_rate", 60.0));
            double amplitude = NoiseType.amplitude(params);
            double[] template = qrsTemplate(tb.samplingRate());
            int interval = Math.max(1, (int) (tb.samplingRate() * 60.0 / heartRate));
            SignalBuffer buffer = new SignalBuffer(tb);
            for (int start = 0; start < tb.nSamples(); start += interval) {
                buffer.place(template, start, amplitude, PlacementPolicy.SKIP);
            }
            return buffer.toSignal().toArray();
        }
    },
    /// Mains at `frequency` (50 Hz) with its second and third harmonic, plus
    /// five random tones between 100 and 1000 Hz.
    ENVIRONMENTAL {
        @Override
        public double[] render(TimeBase tb, SynthParams params, SynthRandom rng) {
            double frequency = ParameterChecks.positive("frequency", params.getDouble("frequency", 50.0));
            double amplitude = NoiseType.amplitude(params);
            double[] out = new double[tb.nSamples()];
            for (int h = 1; h <= 3; h++) {
                NoiseType.addSine(out, tb, frequency * h, 0.0, amplitude / h);
            }
            for (int c = 0; c < 5; c++) {
                NoiseType.addSine(out, tb, rng.uniform(100.0, 1000.0), 0.0, 0.1 * amplitude);
            }
            return out;
        }
    },
    /// Switching noise: a square wave at `switching_freq` (1000 Hz) with
    /// `duty_cycle` (0.1), plus `n_spikes` (20) flat spikes of 5 to 9 samples.
    DEVICE {
        @Override
        public double[] render(TimeBase tb, SynthParams params, SynthRandom rng) {
            double switching = ParameterChecks.positive("switching_freq", params.getDouble("switching_freq", 1000.0));
            double duty = ParameterChecks.unitInterval("duty_cycle", params.getDouble("duty_cycle", 0.1));
            int spikes = Bursts.count(params, 20, "n_spikes");
            double amplitude = NoiseType.amplitude(params);
            int n = tb.nSamples();
            SignalBuffer buffer = new SignalBuffer(tb);
            double[] square = new double[n];
            for (int i = 0; i < n; i++) {
                double cycle = tb.timeAt(i) * switching;
                square[i] = 0.5 * amplitude * (cycle - Math.floor(cycle) < duty ? 1.0 : -1.0);
            }
            buffer.add(square);
            for (int s = 0; s < spikes; s++) {
                int start = rng.nextInt(0, Math.max(1, n - 10));
                int width = rng.nextInt(5, 10);
                buffer.addConstant(start, width, amplitude * rng.uniform(0.5, 1.0), PlacementPolicy.CLIP);
            }
            return buffer.toSignal().toArray();
        }
    };

    public static final String PARAM = "interference_type";

    public String paramName() {
        return TypeNames.paramName(this);
    }

    public static InterferenceType fromName(String name) {
        return TypeNames.fromName("interference type", InterferenceType.class, name);
    }

    /// Q dip, sharp R, S undershoot and recovery: 20, 10, 10 and 60 ms.
    static double[] qrsTemplate(double samplingRate) {
        double[][] segments = {
            {0.0, -0.2, 0.020},
            {-0.2, 1.0, 0.010},
            {1.0, -0.3, 0.010},
            {-0.3, 0.0, 0.060}
        };
        double[][] parts = new double[segments.length][];
        int total = 0;
        for (int s = 0; s < segments.length; s++) {
            int n = Math.max(1, WaveformKernels.sampleCount(segments[s][2], samplingRate));
            parts[s] = WaveformKernels.linspace(segments[s][0], segments[s][1], n);
            total += n;
        }
        double[] template = new double[total];
        int at = 0;
        for (double[] part : parts) {
            System.arraycopy(part, 0, template, at, part.length);
            at += part.length;
        }
        return template;
    }
}
