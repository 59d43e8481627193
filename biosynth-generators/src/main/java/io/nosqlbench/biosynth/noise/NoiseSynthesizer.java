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

import io.nosqlbench.biosynth.Synthesizer;
import io.nosqlbench.biosynth.SynthesizerName;
import io.nosqlbench.biosynth.SynthesizerProvider;
import io.nosqlbench.biosynth.model.Signal;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.random.SynthRandom;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Standalone noise, artifact and interference generator.
///
/// The layer is chosen by the first key present among `artifact_type`,
/// `electrode_artifact`, `interference_type` and `noise_type`; with none of
/// them, white gaussian noise is produced.
///
/// ```java
/// Synthesizer noise = new NoiseSynthesizer(1000, 5);
/// Signal pink = noise.generate(SynthParams.of("noise_type", "pink", "amplitude", 0.2));
/// Signal pops = noise.generate(SynthParams.of("electrode_artifact", "electrode_pop", "n_events", 4));
/// ```
public class NoiseSynthesizer extends Synthesizer {

    private static final Logger logger = LogManager.getLogger(NoiseSynthesizer.class);

    public static final String FAMILY = "noise";

    public NoiseSynthesizer(double samplingRate, double duration) {
        super(samplingRate, duration);
    }

    public NoiseSynthesizer(double samplingRate, double duration, SynthRandom random) {
        super(samplingRate, duration, random);
    }

    @Override
    public String family() {
        return FAMILY;
    }

    @Override
    protected Signal render(TimeBase timeBase, SynthParams params, SynthRandom rng) {
        NoiseRenderer renderer = select(params);
        logger.trace("rendering {} on {}", renderer, timeBase);
        return Signal.of(renderer.render(timeBase, params, rng));
    }

    static NoiseRenderer select(SynthParams params) {
        if (params.has(MotionArtifactType.PARAM)) {
            return MotionArtifactType.fromName(params.getString(MotionArtifactType.PARAM, null));
        }
        if (params.has(ElectrodeArtifactType.PARAM)) {
            return ElectrodeArtifactType.fromName(params.getString(ElectrodeArtifactType.PARAM, null));
        }
        if (params.has(InterferenceType.PARAM)) {
            return InterferenceType.fromName(params.getString(InterferenceType.PARAM, null));
        }
        return NoiseType.fromName(params.getString(NoiseType.PARAM, NoiseType.GAUSSIAN.paramName()));
    }

    @SynthesizerName(FAMILY)
    public static final class Provider implements SynthesizerProvider {
        @Override
        public Synthesizer create(double samplingRate, double duration) {
            return new NoiseSynthesizer(samplingRate, duration);
        }
    }
}
