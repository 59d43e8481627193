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

/// # Biosynth generators
///
/// Synthetic EMG, ECG and EOG with additive noise, artifacts and interference.
///
/// Families are discovered through [io.nosqlbench.biosynth.SynthesizerIO]:
///
/// | Family | Synthesizer | Selector key |
/// |--------|-------------|--------------|
/// | `emg` | [io.nosqlbench.biosynth.emg.EmgSynthesizer] | `pattern_type` |
/// | `ecg` | [io.nosqlbench.biosynth.ecg.EcgSynthesizer] | `condition` |
/// | `eog` | [io.nosqlbench.biosynth.eog.EogSynthesizer] | `movement_type` |
/// | `noise` | [io.nosqlbench.biosynth.noise.NoiseSynthesizer] | `noise_type`, `artifact_type`, `electrode_artifact`, `interference_type` |
///
/// A complete record with layers is described by a
/// [io.nosqlbench.biosynth.model.config.SynthesisRecipe] and rendered by
/// [io.nosqlbench.biosynth.BiosignalSimulator].
package io.nosqlbench.biosynth;
