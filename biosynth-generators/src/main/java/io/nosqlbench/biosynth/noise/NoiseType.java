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
import io.nosqlbench.biosynth.model.ParameterChecks;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.random.SynthRandom;

/// Stationary noise layers selected by `noise_type`.
///
/// Every type honors `amplitude` (default 1.0) except `gaussian`, which is
/// scaled by `std` instead.
public enum NoiseType implements NoiseRenderer {

    /// White noise, `N(0, std)`.
    GAUSSIAN {
        @Override
        public double[] render(TimeBase tb, SynthParams params, SynthRandom rng) {
            double std = ParameterChecks.nonNegative("std", params.getDouble("std", 1.0));
            return rng.gaussians(tb.nSamples(), 0.0, std);
        }
    },
    /// Power falling as `1/|f|`.
    PINK {
        @Override
        public double[] render(TimeBase tb, SynthParams params, SynthRandom rng) {
            return scaled(SpectralShaper.powerLaw(tb.nSamples(), SpectralShaper.PINK, rng), amplitude(params));
        }
    },
    /// Power falling as `1/f^2`.
    BROWN {
        @Override
        public double[] render(TimeBase tb, SynthParams params, SynthRandom rng) {
            return scaled(SpectralShaper.powerLaw(tb.nSamples(), SpectralShaper.BROWN, rng), amplitude(params));
        }
    },
    /// Mains hum plus harmonics, harmonic h at `amplitude / h`.
    POWERLINE {
        @Override
        public double[] render(TimeBase tb, SynthParams params, SynthRandom rng) {
            double frequency = ParameterChecks.positive("frequency", params.getDouble("frequency", 50.0));
            int harmonics = ParameterChecks.positive("harmonics", params.getInt("harmonics", 2));
            double amplitude = amplitude(params);
            double[] out = new double[tb.nSamples()];
            for (int h = 1; h <= harmonics; h++) {
                addSine(out, tb, frequency * h, 0.0, amplitude / h);
            }
            return out;
        }
    },
    /// Three slow sinusoids at f, f/2 and f/3 with random phases.
    BASELINE_WANDER {
        @Override
        public double[] render(TimeBase tb, SynthParams params, SynthRandom rng) {
            double f = ParameterChecks.positive("drift_frequency", params.getDouble("drift_frequency", 0.5));
            double amplitude = amplitude(params);
            double[] out = new double[tb.nSamples()];
            for (double component : new double[]{f, f / 2.0, f / 3.0}) {
                addSine(out, tb, component, rng.uniform(0.0, 2.0 * Math.PI), amplitude / 3.0);
            }
            return out;
        }
    },
    /// `n_components` sinusoids at uniform frequencies in `[min_freq, max_freq)`.
    HIGH_FREQUENCY {
        @Override
        public double[] render(TimeBase tb, SynthParams params, SynthRandom rng) {
            double min = ParameterChecks.positive("min_freq", params.getDouble("min_freq", 100.0));
            double max = ParameterChecks.greaterThan("max_freq", params.getDouble("max_freq", 500.0), min);
            int components = ParameterChecks.positive("n_components", params.getInt("n_components", 10));
            double amplitude = amplitude(params);
            double[] out = new double[tb.nSamples()];
            for (int c = 0; c < components; c++) {
                double frequency = rng.uniform(min, max);
                addSine(out, tb, frequency, rng.uniform(0.0, 2.0 * Math.PI), amplitude / components);
            }
            return out;
        }
    };

    public static final String PARAM = "noise_type";

    public String paramName() {
        return TypeNames.paramName(this);
    }

    public static NoiseType fromName(String name) {
        return TypeNames.fromName("noise type", NoiseType.class, name);
    }

    static double amplitude(SynthParams params) {
        return ParameterChecks.finite("amplitude", params.getDouble("amplitude", 1.0));
    }

    static double[] scaled(double[] values, double factor) {
        for (int i = 0; i < values.length; i++) {
            values[i] *= factor;
        }
        return values;
    }

    static void addSine(double[] out, TimeBase tb, double frequency, double phase, double amplitude) {
        double w = 2.0 * Math.PI * frequency;
        for (int i = 0; i < out.length; i++) {
            out[i] += amplitude * Math.sin(w * tb.timeAt(i) + phase);
        }
    }
}
