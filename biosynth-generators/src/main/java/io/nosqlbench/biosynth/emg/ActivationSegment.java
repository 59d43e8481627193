package io.nosqlbench.biosynth.emg;

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

import java.util.Arrays;

/**
 * A run of per-sample activation levels starting at a fixed sample index.
 * Samples outside every segment carry no motor-unit activity.
 */
final class ActivationSegment {

    private final int offset;
    private final double[] intensity;

    ActivationSegment(int offset, double[] intensity) {
        this.offset = offset;
        this.intensity = intensity;
    }

    static ActivationSegment constant(int offset, int length, double level) {
        double[] intensity = new double[Math.max(0, length)];
        Arrays.fill(intensity, level);
        return new ActivationSegment(offset, intensity);
    }

    int offset() {
        return offset;
    }

    int length() {
        return intensity.length;
    }

    double intensityAt(int i) {
        return intensity[i];
    }
}
