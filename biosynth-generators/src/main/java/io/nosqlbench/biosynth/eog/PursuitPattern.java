package io.nosqlbench.biosynth.eog;

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
import io.nosqlbench.biosynth.kernels.Resampling;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.exceptions.InvalidParameterException;

/// Smooth pursuit target trajectories, selected by `pattern`.
public enum PursuitPattern {

    /// Sawtooth from `-amplitude` to `+amplitude` once per period.
    LINEAR {
        @Override
        double[] trajectory(TimeBase tb, SynthParams params, double amplitude, double frequency, GazeDirection direction) {
            double[] out = new double[tb.nSamples()];
            for (int i = 0; i < out.length; i++) {
                double cycle = frequency * tb.timeAt(i);
                out[i] = amplitude * (2.0 * (cycle - Math.floor(cycle)) - 1.0);
            }
            return out;
        }
    },
    SINUSOIDAL {
        @Override
        double[] trajectory(TimeBase tb, SynthParams params, double amplitude, double frequency, GazeDirection direction) {
            double[] out = new double[tb.nSamples()];
            for (int i = 0; i < out.length; i++) {
                out[i] = amplitude * Math.sin(2.0 * Math.PI * frequency * tb.timeAt(i));
            }
            return out;
        }
    },
    /// One axis of a circular target: cosine for horizontal gaze, sine for vertical.
    CIRCULAR {
        @Override
        double[] trajectory(TimeBase tb, SynthParams params, double amplitude, double frequency, GazeDirection direction) {
            double[] out = new double[tb.nSamples()];
            for (int i = 0; i < out.length; i++) {
                double phase = 2.0 * Math.PI * frequency * tb.timeAt(i);
                out[i] = amplitude * (direction == GazeDirection.HORIZONTAL ? Math.cos(phase) : Math.sin(phase));
            }
            return out;
        }
    },
    /// A caller-supplied `trajectory` (alias `custom_trajectory`), stretched
    /// over the record by linear interpolation.
    CUSTOM {
        @Override
        double[] trajectory(TimeBase tb, SynthParams params, double amplitude, double frequency, GazeDirection direction) {
            double[] points = params.has("trajectory") ? params.getDoubles("trajectory") : params.getDoubles("custom_trajectory");
            if (points == null || points.length == 0) {
                throw new InvalidParameterException("trajectory", "a custom pursuit pattern needs a non-empty trajectory");
            }
            return Resampling.linear(points, tb.nSamples());
        }
    };

    abstract double[] trajectory(TimeBase tb, SynthParams params, double amplitude, double frequency, GazeDirection direction);

    public String paramName() {
        return TypeNames.paramName(this);
    }

    public static PursuitPattern fromName(String name) {
        return TypeNames.fromName("pursuit pattern", PursuitPattern.class, name);
    }
}
