package io.nosqlbench.biosynth;

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

import io.nosqlbench.biosynth.model.Signal;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.config.SynthesisRecipe;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for composing a complete record: one family signal, then its
 * noise layers in order, then its transient artifacts in order.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * SynthesisRecipe recipe = SynthesisRecipe.load(Path.of("af-with-hum.json"));
 * Signal signal = BiosignalSimulator.render(recipe);
 * }</pre>
 *
 * <p>When the recipe carries a {@code random_seed}, noise layer {@code i} that
 * has no seed of its own is seeded with {@code random_seed + i + 1}, so the
 * whole record is reproducible from the single seed.
 */
public final class BiosignalSimulator {

    private static final Logger logger = LogManager.getLogger(BiosignalSimulator.class);

    private BiosignalSimulator() {
    }

    /**
     * @param recipe a validated recipe
     * @return the composed signal
     * @throws io.nosqlbench.biosynth.model.exceptions.SynthesisException for
     *     unknown families or layer types and invalid parameters
     */
    public static Signal render(SynthesisRecipe recipe) {
        recipe.validate();
        Synthesizer synthesizer = SynthesizerIO.create(recipe.getFamily(), recipe.getSamplingRate(), recipe.getDuration());
        Signal signal = synthesizer.generate(recipe.getParams());

        List<SynthesisRecipe.NoiseLayer> layers = recipe.getNoise();
        for (int i = 0; i < layers.size(); i++) {
            SynthesisRecipe.NoiseLayer layer = layers.get(i);
            SynthParams layerParams = layer.getParams();
            if (recipe.getRandomSeed() != null && !layerParams.has(SynthParams.RANDOM_SEED)) {
                layerParams = layerParams.with(SynthParams.RANDOM_SEED, recipe.getRandomSeed() + i + 1);
            }
            signal = synthesizer.addNoise(signal, layer.getType(), layerParams);
        }
        for (SynthesisRecipe.ArtifactSpec artifact : recipe.getArtifacts()) {
            signal = synthesizer.addArtifact(signal, artifact.getType(), artifact.getStartTime(),
                artifact.getDuration(), artifact.getAmplitude());
        }
        logger.info("rendered {} record: {} samples at {} Hz, {} noise layers, {} artifacts",
            recipe.getFamily(), signal.length(), recipe.getSamplingRate(), layers.size(), recipe.getArtifacts().size());
        return signal;
    }

    /**
     * Loads a JSON recipe and renders it.
     *
     * @throws IOException if the file cannot be read
     */
    public static Signal render(Path recipePath) throws IOException {
        return render(SynthesisRecipe.load(recipePath));
    }

    /**
     * Generates one family signal without any layers.
     */
    public static Signal generate(String family, double samplingRate, double duration, SynthParams params) {
        return SynthesizerIO.create(family, samplingRate, duration).generate(params);
    }
}
