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

package io.nosqlbench.biosynth.model;

import io.nosqlbench.biosynth.model.exceptions.InvalidParameterException;

/// Range checks shared by every synthesizer. Each method returns its argument
/// so checks can be used inline:
///
/// ```java
/// double hr = ParameterChecks.positive("heart_rate", params.getDouble("heart_rate", 75.0));
/// ```
///
/// NaN fails every check.
public final class ParameterChecks {

    private ParameterChecks() {
    }

    public static double positive(String name, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new InvalidParameterException(name, "must be positive, got: " + value);
        }
        return value;
    }

    public static int positive(String name, int value) {
        if (value <= 0) {
            throw new InvalidParameterException(name, "must be positive, got: " + value);
        }
        return value;
    }

    public static double nonNegative(String name, double value) {
        if (!(value >= 0) || Double.isInfinite(value)) {
            throw new InvalidParameterException(name, "must not be negative, got: " + value);
        }
        return value;
    }

    public static int nonNegative(String name, int value) {
        if (value < 0) {
            throw new InvalidParameterException(name, "must not be negative, got: " + value);
        }
        return value;
    }

    /// @return value, which must lie in [0, 1]
    public static double unitInterval(String name, double value) {
        return inRange(name, value, 0.0, 1.0);
    }

    /// @return value, which must lie in [min, max]
    public static double inRange(String name, double value, double min, double max) {
        if (!(value >= min && value <= max)) {
            throw new InvalidParameterException(name,
                "must be in [" + min + ", " + max + "], got: " + value);
        }
        return value;
    }

    public static int inRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new InvalidParameterException(name,
                "must be in [" + min + ", " + max + "], got: " + value);
        }
        return value;
    }

    public static double finite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidParameterException(name, "must be finite, got: " + value);
        }
        return value;
    }

    /// Checks that an event window fits strictly inside a signal.
    ///
    /// @param name parameter name reported on failure
    /// @param window window length in seconds, positive
    /// @param signalDuration signal duration in seconds
    /// @return the window
    public static double windowWithin(String name, double window, double signalDuration) {
        positive(name, window);
        if (window >= signalDuration) {
            throw new InvalidParameterException(name,
                "must be shorter than the signal duration " + signalDuration + "s, got: " + window);
        }
        return window;
    }

    /// @return value, which must be finite and greater than bound
    public static double greaterThan(String name, double value, double bound) {
        if (!(value > bound) || Double.isInfinite(value)) {
            throw new InvalidParameterException(name, "must be greater than " + bound + ", got: " + value);
        }
        return value;
    }
}
