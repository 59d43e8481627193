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

import io.nosqlbench.biosynth.Synthesizer;
import io.nosqlbench.biosynth.SynthesizerName;
import io.nosqlbench.biosynth.SynthesizerProvider;
import io.nosqlbench.biosynth.kernels.WaveformKernels;
import io.nosqlbench.biosynth.model.ParameterChecks;
import io.nosqlbench.biosynth.model.PlacementPolicy;
import io.nosqlbench.biosynth.model.Signal;
import io.nosqlbench.biosynth.model.SignalBuffer;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.random.SynthRandom;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/// Surface EMG from stochastic motor-unit action potential trains.
///
/// The contraction is chosen by `pattern_type` (see [ContractionPattern],
/// default `isometric`). Each pattern yields activation segments; [MuapTrain]
/// turns activation into MUAP firings, and an optional fatigue envelope
/// `exp(-fatigue_rate * t / duration)` is applied afterwards. `fatigue=true`
/// without an explicit `fatigue_rate` uses a rate of 2.0.
///
/// MUAPs running past the end of the record are clipped unless
/// `placement_policy=skip`.
public class EmgSynthesizer extends Synthesizer {

    private static final Logger logger = LogManager.getLogger(EmgSynthesizer.class);

    public static final String FAMILY = "emg";
    public static final double DEFAULT_FATIGUE_RATE = 2.0;

    public EmgSynthesizer(double samplingRate, double duration) {
        super(samplingRate, duration);
    }

    public EmgSynthesizer(double samplingRate, double duration, SynthRandom random) {
        super(samplingRate, duration, random);
    }

    @Override
    public String family() {
        return FAMILY;
    }

    @Override
    protected Signal render(TimeBase timeBase, SynthParams params, SynthRandom rng) {
        ContractionPattern pattern = ContractionPattern.fromName(
            params.getString(ContractionPattern.PARAM, ContractionPattern.ISOMETRIC.paramName()));
        List<ActivationSegment> segments = pattern.segments(timeBase, params);
        double fatigueRate = fatigueRate(params);
        PlacementPolicy policy = PlacementPolicy.from(params, PlacementPolicy.CLIP);

        SignalBuffer buffer = new SignalBuffer(timeBase);
        MuapTrain train = new MuapTrain(WaveformKernels.muap(timeBase.samplingRate()), timeBase.samplingRate(), policy);
        for (ActivationSegment segment : segments) {
            train.fire(buffer, segment, rng);
        }
        if (fatigueRate > 0.0) {
            buffer.multiply(fatigueEnvelope(timeBase, fatigueRate));
        }
        logger.debug("{} contraction: {} MUAPs fired, {} clipped, {} skipped",
            pattern.paramName(), train.firedCount(), buffer.clippedCount(), buffer.skippedCount());
        return buffer.toSignal();
    }

    static double fatigueRate(SynthParams params) {
        if (params.has("fatigue_rate")) {
            return ParameterChecks.nonNegative("fatigue_rate", params.getDouble("fatigue_rate", 0.0));
        }
        return params.getBoolean("fatigue", false) ? DEFAULT_FATIGUE_RATE : 0.0;
    }

    static double[] fatigueEnvelope(TimeBase timeBase, double rate) {
        double[] envelope = new double[timeBase.nSamples()];
        for (int i = 0; i < envelope.length; i++) {
            envelope[i] = Math.exp(-rate * timeBase.timeAt(i) / timeBase.duration());
        }
        return envelope;
    }

    @SynthesizerName(FAMILY)
    public static final class Provider implements SynthesizerProvider {
        @Override
        public Synthesizer create(double samplingRate, double duration) {
            return new EmgSynthesizer(samplingRate, duration);
        }
    }
}
