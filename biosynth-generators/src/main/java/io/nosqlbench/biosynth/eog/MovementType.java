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
import io.nosqlbench.biosynth.model.ParameterChecks;
import io.nosqlbench.biosynth.model.PlacementPolicy;
import io.nosqlbench.biosynth.model.SignalBuffer;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.exceptions.InvalidParameterException;
import io.nosqlbench.biosynth.model.random.SynthRandom;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/// Eye movement types, selected by `movement_type`.
public enum MovementType {

    /// A sequence of saccades, 50 ms apart.
    ///
    /// Keys: `amplitudes` (degrees; when absent, `n_saccades` (5) draws from
    /// `U(-amplitude, amplitude)` with `amplitude` 10), `directions` (one per
    /// saccade) or `direction`/`pattern` for all, optional `durations` and
    /// `peak_velocities` (a single value applies to all), `hold_position` (true).
    SACCADES {
        @Override
        void render(TimeBase tb, SynthParams params, SynthRandom rng, SignalBuffer buffer) {
            double[] amplitudes = params.getDoubles("amplitudes");
            if (amplitudes == null) {
                int n = ParameterChecks.nonNegative("n_saccades", params.getInt("n_saccades", 5));
                double range = Math.abs(ParameterChecks.finite("amplitude", params.getDouble("amplitude", 10.0)));
                amplitudes = n == 0 ? new double[0] : rng.uniforms(n, -range, range);
            }
            List<GazeDirection> directions = directions(params, amplitudes.length);
            double[] durations = perSaccade(params, "durations", amplitudes.length);
            double[] velocities = perSaccade(params, "peak_velocities", amplitudes.length);

            SaccadePlacer placer = new SaccadePlacer(tb, buffer,
                PlacementPolicy.from(params, PlacementPolicy.SKIP), params.getBoolean("hold_position", true));
            double t = 0.0;
            for (int i = 0; i < amplitudes.length; i++) {
                double amplitude = directions.get(i).sign() * amplitudes[i];
                double duration = durations != null ? durations[i] : SaccadePlacer.mainSequenceDuration(amplitude);
                double velocity = velocities != null ? velocities[i] : SaccadePlacer.mainSequenceVelocity(amplitude);
                placer.place(t, amplitude, duration, velocity);
                t += duration + SaccadePlacer.GAP;
            }
        }
    },

    /// Smooth pursuit of a moving target.
    ///
    /// Keys: `pattern` ([PursuitPattern], `linear`), `direction`
    /// (`horizontal`), `amplitude` (10), `frequency` (0.5 Hz). A linear
    /// pursuit adds a catch-up saccade of 10% of the amplitude over 20 ms
    /// ending at each period boundary.
    PURSUIT {
        @Override
        void render(TimeBase tb, SynthParams params, SynthRandom rng, SignalBuffer buffer) {
            PursuitPattern pattern = PursuitPattern.fromName(params.getString("pattern", PursuitPattern.LINEAR.paramName()));
            GazeDirection direction = GazeDirection.fromName(params.getString("direction", GazeDirection.HORIZONTAL.paramName()));
            double amplitude = ParameterChecks.finite("amplitude", params.getDouble("amplitude", 10.0));
            double frequency = ParameterChecks.positive("frequency", params.getDouble("frequency", 0.5));

            double[] position = pattern.trajectory(tb, params, amplitude, frequency, direction);
            for (int i = 0; i < position.length; i++) {
                position[i] *= direction.sign();
            }
            buffer.add(position);

            if (pattern == PursuitPattern.LINEAR) {
                SaccadePlacer catchUp = new SaccadePlacer(tb, buffer, PlacementPolicy.from(params, PlacementPolicy.SKIP), false);
                double saccadeAmplitude = 0.1 * amplitude * direction.sign();
                double saccadeDuration = 0.02;
                int saccadeSamples = tb.samplesFor(saccadeDuration);
                int periodSamples = (int) (tb.samplingRate() / frequency);
                for (int i = 0; periodSamples > 0 && i < tb.nSamples() - periodSamples; i += periodSamples) {
                    int start = i + periodSamples - saccadeSamples;
                    catchUp.place(start / tb.samplingRate(), saccadeAmplitude, saccadeDuration,
                        SaccadePlacer.mainSequenceVelocity(saccadeAmplitude));
                }
            }
        }
    },

    /// Fixation with random-walk drift, 80 and 160 Hz tremor, and
    /// microsaccades at exponentially distributed intervals.
    ///
    /// Keys: `drift_amplitude` (0.5), `tremor_amplitude` (0.1),
    /// `microsaccade_rate` (2 per second), `microsaccade_amplitude` (0.2),
    /// `hold_position` (true).
    FIXATION {
        @Override
        void render(TimeBase tb, SynthParams params, SynthRandom rng, SignalBuffer buffer) {
            double driftAmplitude = ParameterChecks.nonNegative("drift_amplitude", params.getDouble("drift_amplitude", 0.5));
            double tremorAmplitude = ParameterChecks.nonNegative("tremor_amplitude", params.getDouble("tremor_amplitude", 0.1));
            double rate = ParameterChecks.nonNegative("microsaccade_rate", params.getDouble("microsaccade_rate", 2.0));
            double microAmplitude = ParameterChecks.nonNegative("microsaccade_amplitude",
                params.getDouble("microsaccade_amplitude", 0.2));
            int n = tb.nSamples();
            double fs = tb.samplingRate();

            double[] steps = rng.gaussians(n, 0.0, driftAmplitude / tb.duration());
            double[] fixation = new double[n];
            double drift = 0.0;
            for (int i = 0; i < n; i++) {
                drift += steps[i] / fs;
                double t = tb.timeAt(i);
                fixation[i] = drift
                    + tremorAmplitude * Math.sin(2.0 * Math.PI * 80.0 * t)
                    + 0.5 * tremorAmplitude * Math.sin(2.0 * Math.PI * 160.0 * t);
            }
            buffer.add(fixation);

            if (rate > 0.0) {
                SaccadePlacer placer = new SaccadePlacer(tb, buffer,
                    PlacementPolicy.from(params, PlacementPolicy.SKIP), params.getBoolean("hold_position", true));
                double t = rng.exponential(1.0 / rate);
                while (t < tb.duration()) {
                    double amplitude = rng.uniform(-microAmplitude, microAmplitude);
                    placer.place(t, amplitude, 0.02, SaccadePlacer.mainSequenceVelocity(amplitude));
                    t += rng.exponential(1.0 / rate);
                }
            }
        }
    };

    public static final String PARAM = "movement_type";

    abstract void render(TimeBase tb, SynthParams params, SynthRandom rng, SignalBuffer buffer);

    public String paramName() {
        return TypeNames.paramName(this);
    }

    public static MovementType fromName(String name) {
        return TypeNames.fromName("eye movement type", MovementType.class, name);
    }

    static List<GazeDirection> directions(SynthParams params, int count) {
        List<GazeDirection> out = new ArrayList<>(count);
        List<String> names = params.getStrings("directions");
        if (names != null && names.isEmpty()) {
            throw new InvalidParameterException("directions", "must not be empty");
        }
        if (names != null && names.size() > 1) {
            if (names.size() != count) {
                throw new InvalidParameterException("directions",
                    "expected " + count + " directions to match the amplitudes, got " + names.size());
            }
            for (String name : names) {
                out.add(GazeDirection.fromName(name));
            }
            return out;
        }
        String single = names != null ? names.get(0)
            : params.getString("direction", params.getString("pattern", GazeDirection.HORIZONTAL.paramName()));
        GazeDirection direction = GazeDirection.fromName(single);
        for (int i = 0; i < count; i++) {
            out.add(direction);
        }
        return out;
    }

    static double[] perSaccade(SynthParams params, String key, int count) {
        double[] values = params.getDoubles(key);
        if (values == null) {
            return null;
        }
        if (values.length == 1 && count != 1) {
            double[] broadcast = new double[count];
            Arrays.fill(broadcast, values[0]);
            return broadcast;
        }
        if (values.length != count) {
            throw new InvalidParameterException(key, "expected " + count + " values to match the amplitudes, got " + values.length);
        }
        return values;
    }
}
