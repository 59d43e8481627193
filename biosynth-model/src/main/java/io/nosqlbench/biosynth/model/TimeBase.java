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

import java.util.Objects;

/// Uniform sampling grid shared by every generator within one generation call.
///
/// # Overview
///
/// A TimeBase is derived from `(samplingRate, duration)`:
///
/// ```text
///   nSamples = round(samplingRate * duration)
///   time[i]  = i / samplingRate            for i in [0, nSamples)
/// ```
///
/// All kernels, noise layers and artifacts composed into one signal must be
/// rendered on the same instance so that they align sample for sample.
///
/// # Usage
///
/// ```java
/// TimeBase tb = TimeBase.of(1000.0, 2.0);
/// int n = tb.nSamples();          // 2000
/// int idx = tb.indexOf(0.25);     // 250
/// TimeBase first = tb.withDuration(0.5);
/// ```
public final class TimeBase {

    /// Guards index computation against representation error, e.g. 0.3 * 1000 = 299.99999999999994
    private static final double INDEX_EPSILON = 1e-9;

    private final double samplingRate;
    private final double duration;
    private final int nSamples;

    private TimeBase(double samplingRate, double duration, int nSamples) {
        this.samplingRate = samplingRate;
        this.duration = duration;
        this.nSamples = nSamples;
    }

    /// Creates a time base.
    ///
    /// @param samplingRate sampling frequency in Hz; must be positive and finite
    /// @param duration signal duration in seconds; must be positive and finite
    /// @return the time base
    /// @throws InvalidParameterException if either argument is out of range,
    ///     or if the combination yields no samples
    public static TimeBase of(double samplingRate, double duration) {
        if (!(samplingRate > 0) || Double.isInfinite(samplingRate)) {
            throw new InvalidParameterException("sampling_rate",
                "must be a positive finite number, got " + samplingRate);
        }
        if (!(duration > 0) || Double.isInfinite(duration)) {
            throw new InvalidParameterException("duration",
                "must be a positive finite number, got " + duration);
        }
        double exact = samplingRate * duration;
        if (exact > Integer.MAX_VALUE) {
            throw new InvalidParameterException("duration",
                "too many samples requested: " + exact);
        }
        int n = (int) Math.round(exact);
        if (n < 1) {
            throw new InvalidParameterException("duration",
                "sampling_rate * duration must yield at least one sample, got " + exact);
        }
        return new TimeBase(samplingRate, duration, n);
    }

    public double samplingRate() {
        return samplingRate;
    }

    public double duration() {
        return duration;
    }

    public int nSamples() {
        return nSamples;
    }

    /// @return the sampling period in seconds
    public double samplePeriod() {
        return 1.0 / samplingRate;
    }

    /// @param index sample index
    /// @return the time in seconds of the given sample
    public double timeAt(int index) {
        return index / samplingRate;
    }

    /// Returns the full time vector as a signal.
    ///
    /// @return a signal where element i is `i / samplingRate`
    public Signal time() {
        double[] t = new double[nSamples];
        for (int i = 0; i < nSamples; i++) {
            t[i] = i / samplingRate;
        }
        return Signal.wrap(t);
    }

    /// Converts a time in seconds to the sample index at or before it.
    ///
    /// The result is not clamped; callers place kernels through
    /// [SignalBuffer], which applies the placement policy.
    ///
    /// @param seconds a time, possibly negative
    /// @return the floor sample index
    public int indexOf(double seconds) {
        return (int) Math.floor(seconds * samplingRate + INDEX_EPSILON);
    }

    /// Number of samples covering a span of time at this rate.
    ///
    /// @param seconds span length in seconds, non-negative
    /// @return `round(seconds * samplingRate)`
    public int samplesFor(double seconds) {
        return (int) Math.round(seconds * samplingRate);
    }

    /// Derives a time base with the same rate and a different duration.
    ///
    /// @param newDuration the duration of the derived time base
    /// @return a new time base
    public TimeBase withDuration(double newDuration) {
        return of(samplingRate, newDuration);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeBase)) return false;
        TimeBase that = (TimeBase) o;
        return Double.compare(that.samplingRate, samplingRate) == 0
            && Double.compare(that.duration, duration) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(samplingRate, duration);
    }

    @Override
    public String toString() {
        return "TimeBase[samplingRate=" + samplingRate + ", duration=" + duration
            + ", nSamples=" + nSamples + "]";
    }
}
