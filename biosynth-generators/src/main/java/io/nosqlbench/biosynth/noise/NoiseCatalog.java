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

import io.nosqlbench.biosynth.model.Signal;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.exceptions.UnsupportedTypeException;
import io.nosqlbench.biosynth.model.random.SynthRandom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Every additive layer by name: noise types, motion artifacts, electrode
/// artifacts and interference. Names are unique across the four families, so
/// a single name is enough to select a layer.
public final class NoiseCatalog {

    private static final Map<String, Entry> entries = new LinkedHashMap<>();

    static {
        for (NoiseType t : NoiseType.values()) {
            register(new Entry(t.paramName(), NoiseType.PARAM, t));
        }
        for (MotionArtifactType t : MotionArtifactType.values()) {
            register(new Entry(t.paramName(), MotionArtifactType.PARAM, t));
        }
        for (ElectrodeArtifactType t : ElectrodeArtifactType.values()) {
            register(new Entry(t.paramName(), ElectrodeArtifactType.PARAM, t));
        }
        for (InterferenceType t : InterferenceType.values()) {
            register(new Entry(t.paramName(), InterferenceType.PARAM, t));
        }
        register(alias("emg_crosstalk", InterferenceType.EMG));
        register(alias("ecg_interference", InterferenceType.ECG));
        register(alias("device_artifact", InterferenceType.DEVICE));
    }

    private NoiseCatalog() {
    }

    private static Entry alias(String name, InterferenceType type) {
        return new Entry(name, InterferenceType.PARAM, type);
    }

    private static void register(Entry entry) {
        if (entries.putIfAbsent(entry.name(), entry) != null) {
            throw new IllegalStateException("duplicate layer name: " + entry.name());
        }
    }

    /// @param name any registered layer name, case-insensitive
    /// @return the layer
    /// @throws UnsupportedTypeException for unknown names
    public static Entry resolve(String name) {
        Entry entry = name == null ? null : entries.get(name.trim().toLowerCase(Locale.ROOT));
        if (entry == null) {
            throw new UnsupportedTypeException("noise type", name, names());
        }
        return entry;
    }

    /// @return all registered layer names, noise types first
    public static List<String> names() {
        return Collections.unmodifiableList(new ArrayList<>(entries.keySet()));
    }

    /// One named layer and the parameter key that selects it within its family.
    public static final class Entry {
        private final String name;
        private final String familyKey;
        private final NoiseRenderer renderer;

        Entry(String name, String familyKey, NoiseRenderer renderer) {
            this.name = name;
            this.familyKey = familyKey;
            this.renderer = renderer;
        }

        public String name() {
            return name;
        }

        /// @return `noise_type`, `artifact_type`, `electrode_artifact` or `interference_type`
        public String familyKey() {
            return familyKey;
        }

        public Signal render(TimeBase timeBase, SynthParams params, SynthRandom rng) {
            return Signal.of(renderer.render(timeBase, params, rng));
        }

        @Override
        public String toString() {
            return name + "(" + familyKey + ")";
        }
    }
}
