package io.nosqlbench.biosynth.ecg;

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
import io.nosqlbench.biosynth.model.PlacementPolicy;
import io.nosqlbench.biosynth.model.Signal;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.random.SynthRandom;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Consumer;

/// Synthetic single-lead ECG.
///
/// Beats are scheduled at `60 / heart_rate` second intervals, each interval
/// perturbed by `N(0, hrv_std)` and floored at 0.2 s. Each normal beat is a
/// P wave, QRS complex and T wave shaped by [WaveMorphology]. The
/// `condition` key selects a [CardiacCondition] that changes the rhythm or
/// the morphology.
///
/// Waves that do not fit entirely inside the record are dropped unless
/// `placement_policy=clip`.
public class EcgSynthesizer extends Synthesizer {

    private static final Logger logger = LogManager.getLogger(EcgSynthesizer.class);

    public static final String FAMILY = "ecg";

    private static final Map<CardiacCondition, Consumer<BeatContext>> strategies = new EnumMap<>(CardiacCondition.class);

    static {
        for (CardiacCondition condition : CardiacCondition.values()) {
            strategies.put(condition, condition::render);
        }
    }

    public EcgSynthesizer(double samplingRate, double duration) {
        super(samplingRate, duration);
    }

    public EcgSynthesizer(double samplingRate, double duration, SynthRandom random) {
        super(samplingRate, duration, random);
    }

    @Override
    public String family() {
        return FAMILY;
    }

    @Override
    protected Signal render(TimeBase timeBase, SynthParams params, SynthRandom rng) {
        CardiacCondition condition = CardiacCondition.fromName(params.getString(CardiacCondition.PARAM, null));
        WaveMorphology morphology = WaveMorphology.from(params, timeBase.samplingRate());
        BeatContext ctx = new BeatContext(timeBase, params, rng, morphology,
            PlacementPolicy.from(params, PlacementPolicy.SKIP));
        strategies.get(condition).accept(ctx);
        logger.debug("{} rhythm with {}: {} waves skipped, {} clipped", condition.paramName(), morphology,
            ctx.buffer().skippedCount(), ctx.buffer().clippedCount());
        return ctx.buffer().toSignal();
    }

    @SynthesizerName(FAMILY)
    public static final class Provider implements SynthesizerProvider {
        @Override
        public Synthesizer create(double samplingRate, double duration) {
            return new EcgSynthesizer(samplingRate, duration);
        }
    }
}
