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

import io.nosqlbench.biosynth.model.ParameterChecks;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.exceptions.InvalidParameterException;
import io.nosqlbench.biosynth.model.exceptions.UnsupportedTypeException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/// The movements of a `complex` contraction.
///
/// Accepted forms:
/// - `movements` as a list of maps `{type, duration, intensity}`
/// - `movements` (or `movement_types`) as a list of type names, with parallel
///   `durations` and `intensities` lists
///
/// Movement types are `isometric` (constant), `dynamic` (ramp from 0 to the
/// movement's intensity) and `repetitive` (1 Hz, duty 0.5, rest 0.1). Without
/// `overlap`, movements follow one another from t = 0 and their durations
/// must sum to at most the record length; with `overlap` they all start at
/// t = 0 and only the longest must fit.
final class MovementSequence {

    static final List<String> TYPES = List.of("isometric", "dynamic", "repetitive");

    private final List<String> types;
    private final double[] durations;
    private final double[] intensities;
    private final boolean overlap;

    private MovementSequence(List<String> types, double[] durations, double[] intensities, boolean overlap) {
        this.types = types;
        this.durations = durations;
        this.intensities = intensities;
        this.overlap = overlap;
    }

    static MovementSequence from(SynthParams params) {
        boolean overlap = params.getBoolean("overlap", false);
        if (params.isParamsList("movements")) {
            List<SynthParams> moves = params.getParamsList("movements");
            List<String> types = new ArrayList<>();
            double[] durations = new double[moves.size()];
            double[] intensities = new double[moves.size()];
            for (int i = 0; i < moves.size(); i++) {
                SynthParams move = moves.get(i);
                String type = move.getString("type", null);
                if (type == null || !move.has("duration")) {
                    throw new InvalidParameterException("movements",
                        "movement " + i + " needs a type and a duration");
                }
                types.add(type);
                durations[i] = move.getDouble("duration", 0.0);
                intensities[i] = move.getDouble("intensity", 0.5);
            }
            return new MovementSequence(types, durations, intensities, overlap);
        }
        List<String> types = params.has("movements") ? params.getStrings("movements") : params.getStrings("movement_types");
        double[] durations = params.getDoubles("durations");
        double[] intensities = params.getDoubles("intensities");
        if (types == null || durations == null || intensities == null) {
            throw new InvalidParameterException("movements",
                "complex patterns need movements, durations and intensities");
        }
        if (types.size() != durations.length || types.size() != intensities.length) {
            throw new InvalidParameterException("movements",
                "movements, durations and intensities must have the same length, got "
                    + types.size() + ", " + durations.length + ", " + intensities.length);
        }
        return new MovementSequence(types, durations, intensities, overlap);
    }

    List<ActivationSegment> segments(TimeBase tb) {
        double total = 0.0;
        for (int i = 0; i < types.size(); i++) {
            String type = types.get(i).trim().toLowerCase(Locale.ROOT);
            if (!TYPES.contains(type)) {
                throw new UnsupportedTypeException("movement type", types.get(i), TYPES);
            }
            ParameterChecks.positive("durations", durations[i]);
            ContractionPattern.intensity("intensities", intensities[i]);
            total = overlap ? Math.max(total, durations[i]) : total + durations[i];
        }
        if (total > tb.duration() + 1e-9) {
            throw new InvalidParameterException("durations",
                "total movement duration " + total + "s exceeds the signal duration " + tb.duration() + "s");
        }

        List<ActivationSegment> segments = new ArrayList<>();
        double start = 0.0;
        for (int i = 0; i < types.size(); i++) {
            int offset = overlap ? 0 : tb.indexOf(start);
            int length = Math.min(tb.samplesFor(durations[i]), tb.nSamples() - offset);
            segments.add(new ActivationSegment(offset, envelope(types.get(i), length, tb.samplingRate(), intensities[i])));
            start += durations[i];
        }
        return segments;
    }

    private static double[] envelope(String type, int length, double samplingRate, double intensity) {
        switch (type.trim().toLowerCase(Locale.ROOT)) {
            case "dynamic":
                return ContractionPattern.ramp(length, intensity);
            case "repetitive":
                return ContractionPattern.cycles(length, samplingRate, 1.0, 0.5, intensity, 0.1);
            default:
                double[] constant = new double[length];
                Arrays.fill(constant, intensity);
                return constant;
        }
    }
}
