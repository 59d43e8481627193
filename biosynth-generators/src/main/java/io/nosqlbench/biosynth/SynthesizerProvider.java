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

/// Service interface for creating synthesizers of one family.
///
/// Implementations are registered in
/// `META-INF/services/io.nosqlbench.biosynth.SynthesizerProvider` and carry a
/// [SynthesizerName] annotation.
public interface SynthesizerProvider {

    /// @param samplingRate Hz, positive
    /// @param duration seconds, positive
    /// @return a new synthesizer with its own random stream
    Synthesizer create(double samplingRate, double duration);
}
