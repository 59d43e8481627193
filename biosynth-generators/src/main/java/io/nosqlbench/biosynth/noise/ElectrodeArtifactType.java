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
import io.nosqlbench.biosynth.model.PlacementPolicy;
import io.nosqlbench.biosynth.model.SignalBuffer;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.random.SynthRandom;

/**
 * Electrode artifacts selected by {@code electrode_artifact}.
 *
 * <p>Keys: {@code n_events}, {@code amplitude} (1.0) and {@code duration}, with
 * per-type defaults for the event count and length.
 */
public enum ElectrodeArtifactType implements NoiseRenderer {

    /** Noise bursts with 30% dropout. */
    POOR_CONTACT(3, 0.2) {
        @Override
        public double[] render(TimeBase tb, SynthParams params, SynthRandom rng) {
            return eachEvent(tb, params, rng, (bursts, amplitude) -> {
                int n = bursts.windowSamples();
                double[] contact = rng.gaussians(n, 0.0, amplitude);
                for (int i = 0; i < n; i++) {
                    if (rng.uniform01() < 0.3) {
                        contact[i] = 0.0;
                    }
                }
                bursts.placeRandom(contact);
            });
        }
    },
    /** Signed exponential decay. */
    ELECTRODE_POP(2, 0.05) {
        @Override
        public double[] render(TimeBase tb, SynthParams params, SynthRandom rng) {
            return eachEvent(tb, params, rng, (bursts, amplitude) -> {
                double[] pop = WaveformKernels.exponentialDecay(bursts.windowSamples(), 5.0);
                bursts.placeRandom(NoiseType.scaled(pop, amplitude * rng.sign()));
            });
        }
    },
    /** Ramp from zero to {@code amplitude}, modulated by multiplicative noise. */
    IMPEDANCE_CHANGE(2, 0.5) {
        @Override
        public double[] render(TimeBase tb, SynthParams params, SynthRandom rng) {
            return eachEvent(tb, params, rng, (bursts, amplitude) -> {
                int n = bursts.windowSamples();
                double[] transition = WaveformKernels.linspace(0.0, 1.0, n);
                double[] noise = rng.gaussians(n, 0.0, 0.2 * Math.abs(amplitude));
                for (int i = 0; i < n; i++) {
                    transition[i] = amplitude * transition[i] * (1.0 + noise[i]);
                }
                bursts.placeRandom(transition);
            });
        }
    },
    /**
     * Base offset plus a slow sinusoidal drift at {@code drift_frequency} (0.1 Hz),
     * with {@code n_events} step changes that persist to the end of the record.
     */
    DC_OFFSET(3, 0.0) {
        @Override
        public double[] render(TimeBase tb, SynthParams params, SynthRandom rng) {
            int count = Bursts.count(params, defaultCount, "n_events");
            double amplitude = NoiseType.amplitude(params);
            double driftFrequency = params.getDouble("drift_frequency", 0.1);
            int n = tb.nSamples();
            SignalBuffer buffer = new SignalBuffer(tb);
            double baseOffset = amplitude * rng.uniform(-1.0, 1.0);
            buffer.addConstant(0, n, baseOffset, PlacementPolicy.CLIP);
            double[] drift = new double[n];
            NoiseType.addSine(drift, tb, driftFrequency, 0.0, 0.5 * amplitude);
            buffer.add(drift);
            for (int i = 0; i < count; i++) {
                int start = tb.indexOf(rng.uniform(0.0, tb.duration()));
                buffer.addConstant(start, n - start, amplitude * rng.uniform(-0.5, 0.5), PlacementPolicy.CLIP);
            }
            return buffer.toSignal().toArray();
        }
    };

    public static final String PARAM = "electrode_artifact";

    final int defaultCount;
    final double defaultWindow;

    ElectrodeArtifactType(int defaultCount, double defaultWindow) {
        this.defaultCount = defaultCount;
        this.defaultWindow = defaultWindow;
    }

    /** One localized event, placed through the shared burst window. */
    @FunctionalInterface
    interface BurstEvent {
        void place(Bursts bursts, double amplitude);
    }

    double[] eachEvent(TimeBase tb, SynthParams params, SynthRandom rng, BurstEvent event) {
        int count = Bursts.count(params, defaultCount, "n_events");
        double amplitude = NoiseType.amplitude(params);
        Bursts bursts = Bursts.of(tb, params, rng, defaultWindow);
        for (int i = 0; i < count; i++) {
            event.place(bursts, amplitude);
        }
        return bursts.toArray();
    }

    public String paramName() {
        return TypeNames.paramName(this);
    }

    public static ElectrodeArtifactType fromName(String name) {
        return TypeNames.fromName("electrode artifact", ElectrodeArtifactType.class, name);
    }
}
