package io.nosqlbench.biosynth.model.config;

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

import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.exceptions.InvalidParameterException;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Declarative description of one synthetic recording: a base signal family,
/// its generation parameters, and the noise and artifact layers added on top.
///
/// ## JSON form
///
/// ```json
/// {
///   "family": "ecg",
///   "sampling_rate": 500,
///   "duration": 10,
///   "random_seed": 7,
///   "params": {"condition": "af", "heart_rate": 80},
///   "noise": [{"type": "powerline", "params": {"amplitude": 0.05}}],
///   "artifacts": [{"type": "spike", "start_time": 2.0, "duration": 0.0, "amplitude": 1.5}]
/// }
/// ```
///
/// ## Usage
///
/// ```java
/// SynthesisRecipe recipe = SynthesisRecipe.load(Path.of("af.json"));
/// Signal signal = BiosignalSimulator.render(recipe);
/// ```
///
/// When `random_seed` is set it is applied to the base signal, and each noise
/// layer without its own seed receives `random_seed + layer index + 1`, so the
/// whole recipe renders bit-identically.
public class SynthesisRecipe {

    @SerializedName("family")
    private String family;

    @SerializedName("sampling_rate")
    private Double samplingRate;

    @SerializedName("duration")
    private Double duration;

    @SerializedName("random_seed")
    private Long randomSeed;

    @SerializedName("params")
    private Map<String, Object> params;

    @SerializedName("noise")
    private List<NoiseLayer> noise;

    @SerializedName("artifacts")
    private List<ArtifactSpec> artifacts;

    public SynthesisRecipe() {
    }

    public SynthesisRecipe(String family, double samplingRate, double duration) {
        this.family = family;
        this.samplingRate = samplingRate;
        this.duration = duration;
    }

    /// Parses and validates a recipe.
    ///
    /// @param reader JSON source
    /// @return the recipe
    /// @throws InvalidParameterException if the JSON is malformed or a required field is missing
    public static SynthesisRecipe fromJson(Reader reader) {
        SynthesisRecipe recipe;
        try {
            recipe = BiosynthGsonConfig.gson().fromJson(reader, SynthesisRecipe.class);
        } catch (JsonParseException e) {
            throw new InvalidParameterException("recipe", "malformed JSON: " + e.getMessage(), e);
        }
        if (recipe == null) {
            throw new InvalidParameterException("recipe", "empty document");
        }
        return recipe.validate();
    }

    /// @param json JSON text
    /// @return the recipe
    public static SynthesisRecipe fromJson(String json) {
        return fromJson(new StringReader(json));
    }

    /// @param path a UTF-8 JSON file
    /// @return the recipe
    /// @throws IOException if the file cannot be read
    public static SynthesisRecipe load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        }
    }

    public String toJson() {
        return BiosynthGsonConfig.gson().toJson(this);
    }

    /// Checks required fields and the shape of every layer.
    ///
    /// @return this recipe
    /// @throws InvalidParameterException naming the first bad field
    public SynthesisRecipe validate() {
        if (family == null || family.isBlank()) {
            throw new InvalidParameterException("family", "is required");
        }
        if (samplingRate == null) {
            throw new InvalidParameterException("sampling_rate", "is required");
        }
        if (duration == null) {
            throw new InvalidParameterException("duration", "is required");
        }
        for (int i = 0; i < getNoise().size(); i++) {
            NoiseLayer layer = getNoise().get(i);
            if (layer == null || layer.getType() == null || layer.getType().isBlank()) {
                throw new InvalidParameterException("noise[" + i + "].type", "is required");
            }
        }
        for (int i = 0; i < getArtifacts().size(); i++) {
            ArtifactSpec spec = getArtifacts().get(i);
            if (spec == null || spec.getType() == null || spec.getType().isBlank()) {
                throw new InvalidParameterException("artifacts[" + i + "].type", "is required");
            }
            if (spec.startTime == null) {
                throw new InvalidParameterException("artifacts[" + i + "].start_time", "is required");
            }
        }
        return this;
    }

    public String getFamily() {
        return family;
    }

    public double getSamplingRate() {
        return samplingRate;
    }

    public double getDuration() {
        return duration;
    }

    public Long getRandomSeed() {
        return randomSeed;
    }

    public SynthesisRecipe withRandomSeed(Long seed) {
        this.randomSeed = seed;
        return this;
    }

    /// @return the generation parameters, with `random_seed` folded in when set
    public SynthParams getParams() {
        SynthParams p = SynthParams.from(params);
        if (randomSeed != null && !p.has(SynthParams.RANDOM_SEED)) {
            p = p.with(SynthParams.RANDOM_SEED, randomSeed);
        }
        return p;
    }

    public SynthesisRecipe withParam(String key, Object value) {
        if (params == null) {
            params = new LinkedHashMap<>();
        }
        params.put(key, value);
        return this;
    }

    public List<NoiseLayer> getNoise() {
        return noise == null ? Collections.emptyList() : noise;
    }

    public SynthesisRecipe addNoise(String type, Map<String, ?> layerParams) {
        if (noise == null) {
            noise = new ArrayList<>();
        }
        noise.add(new NoiseLayer(type, layerParams));
        return this;
    }

    public List<ArtifactSpec> getArtifacts() {
        return artifacts == null ? Collections.emptyList() : artifacts;
    }

    public SynthesisRecipe addArtifact(String type, double startTime, double artifactDuration, double amplitude) {
        if (artifacts == null) {
            artifacts = new ArrayList<>();
        }
        artifacts.add(new ArtifactSpec(type, startTime, artifactDuration, amplitude));
        return this;
    }

    /// One additive noise layer.
    public static class NoiseLayer {
        @SerializedName("type")
        private String type;

        @SerializedName("params")
        private Map<String, Object> params;

        public NoiseLayer() {
        }

        public NoiseLayer(String type, Map<String, ?> params) {
            this.type = type;
            this.params = params == null ? null : new LinkedHashMap<>(params);
        }

        public String getType() {
            return type;
        }

        public SynthParams getParams() {
            return SynthParams.from(params);
        }
    }

    /// One transient artifact at a fixed time.
    public static class ArtifactSpec {
        @SerializedName("type")
        private String type;

        @SerializedName("start_time")
        private Double startTime;

        @SerializedName("duration")
        private Double duration;

        @SerializedName("amplitude")
        private Double amplitude;

        public ArtifactSpec() {
        }

        public ArtifactSpec(String type, double startTime, double duration, double amplitude) {
            this.type = type;
            this.startTime = startTime;
            this.duration = duration;
            this.amplitude = amplitude;
        }

        public String getType() {
            return type;
        }

        public double getStartTime() {
            return startTime;
        }

        public double getDuration() {
            return duration == null ? 0.0 : duration;
        }

        public double getAmplitude() {
            return amplitude == null ? 1.0 : amplitude;
        }
    }
}
