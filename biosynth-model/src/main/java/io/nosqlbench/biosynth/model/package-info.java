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

/// # Biosynth model
///
/// Value types shared by every signal generator.
///
/// ```text
///   TimeBase ──▶ SignalBuffer ◀── WaveformKernel (placed at EventSchedule times)
///                     │
///                     ▼
///                  Signal (immutable)
/// ```
///
/// - [io.nosqlbench.biosynth.model.TimeBase]: sampling grid of one generation call
/// - [io.nosqlbench.biosynth.model.SignalBuffer]: the single kernel placement primitive
/// - [io.nosqlbench.biosynth.model.PlacementPolicy]: skip or clip kernels at the edges
/// - [io.nosqlbench.biosynth.model.SynthParams]: typed access to named knobs
package io.nosqlbench.biosynth.model;
