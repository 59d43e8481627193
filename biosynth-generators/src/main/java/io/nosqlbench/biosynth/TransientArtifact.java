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

import io.nosqlbench.biosynth.kernels.WaveformKernels;
import io.nosqlbench.biosynth.model.PlacementPolicy;
import io.nosqlbench.biosynth.model.SignalBuffer;
import io.nosqlbench.biosynth.model.exceptions.UnsupportedTypeException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/// Single artifacts placed at a caller-chosen time by
/// [Synthesizer#addArtifact(io.nosqlbench.biosynth.model.Signal, String, double, double, double)].
///
/// | Type | Shape over the artifact window |
/// |------|--------------------------------|
/// | spike | one sample of `amplitude` at the start index; duration ignored |
/// | step | constant `amplitude` |
/// | exponential_decay | `amplitude * exp(-5 x)`, x from 0 to 1 |
/// | ramp | linear rise from 0 to `amplitude` |
///
/// Windows running past the end of the signal are clipped.
public enum TransientArtifact {

    SPIKE {
        @Override
        void render(SignalBuffer buffer, int start, int length, double amplitude) {
            buffer.addAt(start, amplitude);
        }
    },
    STEP {
        @Override
        void render(SignalBuffer buffer, int start, int length, double amplitude) {
            buffer.addConstant(start, length, amplitude, PlacementPolicy.CLIP);
        }
    },
    EXPONENTIAL_DECAY {
        @Override
        void render(SignalBuffer buffer, int start, int length, double amplitude) {
            buffer.place(WaveformKernels.exponentialDecay(length, 5.0), start, amplitude, PlacementPolicy.CLIP);
        }
    },
    RAMP {
        @Override
        void render(SignalBuffer buffer, int start, int length, double amplitude) {
            buffer.place(WaveformKernels.linspace(0.0, amplitude, length), start, PlacementPolicy.CLIP);
        }
    };

    abstract void render(SignalBuffer buffer, int start, int length, double amplitude);

    public String paramName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TransientArtifact fromName(String name) {
        if (name != null) {
            for (TransientArtifact a : values()) {
                if (a.paramName().equalsIgnoreCase(name.trim())) {
                    return a;
                }
            }
        }
        throw new UnsupportedTypeException("artifact type", name,
            Arrays.stream(values()).map(TransientArtifact::paramName).collect(Collectors.toList()));
    }
}
