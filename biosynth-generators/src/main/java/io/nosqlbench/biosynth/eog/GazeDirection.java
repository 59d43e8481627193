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

import io.nosqlbench.biosynth.TypeNames;

/// Gaze axis of an eye movement. `up` is accepted for [#VERTICAL]; [#DOWN]
/// is a vertical movement with its sign flipped.
public enum GazeDirection {
    HORIZONTAL(1.0),
    VERTICAL(1.0),
    DOWN(-1.0);

    private final double sign;

    GazeDirection(double sign) {
        this.sign = sign;
    }

    public double sign() {
        return sign;
    }

    public String paramName() {
        return TypeNames.paramName(this);
    }

    public static GazeDirection fromName(String name) {
        if (name != null && name.trim().equalsIgnoreCase("up")) {
            return VERTICAL;
        }
        return TypeNames.fromName("gaze direction", GazeDirection.class, name);
    }
}
