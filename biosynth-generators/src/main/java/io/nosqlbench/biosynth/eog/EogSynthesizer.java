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

import io.nosqlbench.biosynth.Synthesizer;
import io.nosqlbench.biosynth.SynthesizerName;
import io.nosqlbench.biosynth.SynthesizerProvider;
import io.nosqlbench.biosynth.model.Signal;
import io.nosqlbench.biosynth.model.SignalBuffer;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.random.SynthRandom;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Synthetic electrooculogram: saccades, smooth pursuit or fixation, selected
/// by `movement_type` (default `saccades`), with optional blinks
/// (`add_blinks`).
///
/// Blink feasibility is checked before any eye movement is drawn, so an
/// impossible blink request fails without consuming randomness.
public class EogSynthesizer extends Synthesizer {

    private static final Logger logger = LogManager.getLogger(EogSynthesizer.class);

    public static final String FAMILY = "eog";

    public EogSynthesizer(double samplingRate, double duration) {
        super(samplingRate, duration);
    }

    public EogSynthesizer(double samplingRate, double duration, SynthRandom random) {
        super(samplingRate, duration, random);
    }

    @Override
    public String family() {
        return FAMILY;
    }

    @Override
    protected Signal render(TimeBase timeBase, SynthParams params, SynthRandom rng) {
        MovementType movement = MovementType.fromName(
            params.getString(MovementType.PARAM, MovementType.SACCADES.paramName()));
        BlinkScheduler blinks = null;
        if (params.getBoolean("add_blinks", false)) {
            blinks = BlinkScheduler.from(params);
            blinks.checkFeasible(timeBase);
        }
        SignalBuffer buffer = new SignalBuffer(timeBase);
        movement.render(timeBase, params, rng, buffer);
        int blinkCount = blinks == null ? 0 : blinks.render(timeBase, rng, buffer);
        logger.debug("{} with {} blinks: {} kernels skipped, {} clipped",
            movement.paramName(), blinkCount, buffer.skippedCount(), buffer.clippedCount());
        return buffer.toSignal();
    }

    @SynthesizerName(FAMILY)
    public static final class Provider implements SynthesizerProvider {
        @Override
        public Synthesizer create(double samplingRate, double duration) {
            return new EogSynthesizer(samplingRate, duration);
        }
    }
}
