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

import io.nosqlbench.biosynth.TypeNames;
import io.nosqlbench.biosynth.kernels.Resampling;
import io.nosqlbench.biosynth.model.ParameterChecks;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.exceptions.InvalidParameterException;
import io.nosqlbench.biosynth.model.exceptions.UnsupportedTypeException;

import java.util.List;
import java.util.Locale;

/// Muscle activation patterns selected by `pattern_type`.
///
/// | Pattern | Keys | Activation |
/// |---------|------|------------|
/// | isometric | `intensity` (alias `activation_level`, 0.5), `duration` | constant from t = 0 for `duration` seconds |
/// | dynamic | `ramp_type` (`ramp`, `sine`), `max_intensity` (0.8), `envelope_frequency` (1 Hz), `envelope` | ramp, sine or resampled custom envelope over the whole record |
/// | repetitive | `frequency` (1 Hz), `duty_cycle` (0.5), `intensity` (0.7), `rest_intensity` (0.1) | `intensity` during the duty part of each cycle, `rest_intensity` otherwise |
/// | complex | see [MovementSequence] | one segment per movement |
///
/// All activation levels are in `[0, 1]`.
public enum ContractionPattern {

    ISOMETRIC {
        @Override
        List<ActivationSegment> segments(TimeBase tb, SynthParams params) {
            double intensity = intensity("intensity", params.getDouble(0.5, "intensity", "activation_level"));
            double duration = params.getDouble("duration", tb.duration());
            ParameterChecks.inRange("duration", duration, 0.0, tb.duration());
            return List.of(ActivationSegment.constant(0, tb.samplesFor(duration), intensity));
        }
    },
    DYNAMIC {
        @Override
        List<ActivationSegment> segments(TimeBase tb, SynthParams params) {
            return List.of(new ActivationSegment(0, dynamicEnvelope(tb, params)));
        }
    },
    REPETITIVE {
        @Override
        List<ActivationSegment> segments(TimeBase tb, SynthParams params) {
            double frequency = ParameterChecks.positive("frequency", params.getDouble("frequency", 1.0));
            double duty = ParameterChecks.unitInterval("duty_cycle", params.getDouble("duty_cycle", 0.5));
            double active = intensity("intensity", params.getDouble("intensity", 0.7));
            double rest = intensity("rest_intensity", params.getDouble("rest_intensity", 0.1));
            return List.of(new ActivationSegment(0, cycles(tb.nSamples(), tb.samplingRate(), frequency, duty, active, rest)));
        }
    },
    COMPLEX {
        @Override
        List<ActivationSegment> segments(TimeBase tb, SynthParams params) {
            return MovementSequence.from(params).segments(tb);
        }
    };

    public static final String PARAM = "pattern_type";

    abstract List<ActivationSegment> segments(TimeBase tb, SynthParams params);

    public String paramName() {
        return TypeNames.paramName(this);
    }

    public static ContractionPattern fromName(String name) {
        return TypeNames.fromName("contraction pattern", ContractionPattern.class, name);
    }

    static double intensity(String name, double value) {
        return ParameterChecks.unitInterval(name, value);
    }

    /// Linear ramp from 0 to `max` over `n` samples.
    static double[] ramp(int n, double max) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = n == 1 ? 0.0 : max * i / (n - 1);
        }
        return out;
    }

    /// Square activation: `active` while the cycle phase is below `duty`, else `rest`.
    static double[] cycles(int n, double samplingRate, double frequency, double duty, double active, double rest) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            double cycle = i / samplingRate * frequency;
            out[i] = cycle - Math.floor(cycle) < duty ? active : rest;
        }
        return out;
    }

    private static double[] dynamicEnvelope(TimeBase tb, SynthParams params) {
        int n = tb.nSamples();
        double[] custom = params.getDoubles("envelope");
        if (custom != null) {
            if (custom.length == 0) {
                throw new InvalidParameterException("envelope", "must not be empty");
            }
            for (double v : custom) {
                intensity("envelope", v);
            }
            return Resampling.linear(custom, n);
        }
        double max = intensity("max_intensity", params.getDouble("max_intensity", 0.8));
        String rampType = params.getString("ramp_type", "ramp");
        switch (rampType.trim().toLowerCase(Locale.ROOT)) {
            case "ramp":
                return ramp(n, max);
            case "sine": {
                double f = ParameterChecks.positive("envelope_frequency", params.getDouble("envelope_frequency", 1.0));
                double[] out = new double[n];
                for (int i = 0; i < n; i++) {
                    out[i] = max / 2.0 * (1.0 + Math.sin(2.0 * Math.PI * f * tb.timeAt(i)));
                }
                return out;
            }
            default:
                throw new UnsupportedTypeException("ramp type", rampType, List.of("ramp", "sine"));
        }
    }
}
