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

import java.util.Arrays;

/// Mutable accumulator that kernels are added into before the result is
/// frozen as a [Signal].
///
/// Placement is additive: overlapping kernels sum. A kernel whose window is
/// not fully inside `[0, length)` is handled by the [PlacementPolicy].
///
/// ```java
/// SignalBuffer buf = new SignalBuffer(tb);
/// buf.place(qrs, tb.indexOf(beat), PlacementPolicy.SKIP);
/// Signal ecg = buf.toSignal();
/// ```
public final class SignalBuffer {

    private final double[] data;
    private int skipped;
    private int clipped;

    public SignalBuffer(int length) {
        if (length < 0) {
            throw new InvalidParameterException("length", "must not be negative, got " + length);
        }
        this.data = new double[length];
    }

    public SignalBuffer(TimeBase timeBase) {
        this(timeBase.nSamples());
    }

    public int length() {
        return data.length;
    }

    public double get(int index) {
        return data[index];
    }

    /// Adds a kernel starting at the given sample index.
    ///
    /// @param kernel kernel samples
    /// @param start index of the first kernel sample, possibly negative
    /// @param policy boundary handling
    /// @return true if any part of the kernel was rendered
    public boolean place(double[] kernel, int start, PlacementPolicy policy) {
        return place(kernel, start, 1.0, policy);
    }

    /// Adds a scaled kernel starting at the given sample index.
    ///
    /// @param kernel kernel samples
    /// @param start index of the first kernel sample, possibly negative
    /// @param scale multiplier applied to every kernel sample
    /// @param policy boundary handling
    /// @return true if any part of the kernel was rendered
    public boolean place(double[] kernel, int start, double scale, PlacementPolicy policy) {
        long end = (long) start + kernel.length;
        boolean fits = start >= 0 && end <= data.length;
        if (!fits) {
            if (policy == PlacementPolicy.SKIP || end <= 0 || start >= data.length) {
                skipped++;
                return false;
            }
            clipped++;
        }
        int from = Math.max(0, start);
        int to = (int) Math.min(data.length, end);
        for (int i = from; i < to; i++) {
            data[i] += kernel[i - start] * scale;
        }
        return to > from;
    }

    /// Adds a kernel at the given event time, honoring the kernel's own offset.
    ///
    /// @param kernel the kernel
    /// @param eventTime event time in seconds
    /// @param timeBase the grid shared with this buffer
    /// @param policy boundary handling
    /// @return true if any part of the kernel was rendered
    public boolean place(WaveformKernel kernel, double eventTime, TimeBase timeBase, PlacementPolicy policy) {
        int start = timeBase.indexOf(eventTime + kernel.offsetSeconds());
        return place(kernel.raw(), start, 1.0, policy);
    }

    /// Adds a constant over `[start, start + count)`, clipped or skipped per policy.
    public boolean addConstant(int start, int count, double value, PlacementPolicy policy) {
        double[] block = new double[Math.max(0, count)];
        Arrays.fill(block, value);
        return place(block, start, 1.0, policy);
    }

    /// Adds value to a single sample if the index is in range.
    public void addAt(int index, double value) {
        if (index >= 0 && index < data.length) {
            data[index] += value;
        }
    }

    /// Adds a whole signal sample for sample.
    ///
    /// @throws InvalidParameterException if the lengths differ
    public SignalBuffer add(Signal signal) {
        if (signal.length() != data.length) {
            throw new InvalidParameterException("signal",
                "length mismatch: " + data.length + " vs " + signal.length());
        }
        for (int i = 0; i < data.length; i++) {
            data[i] += signal.get(i);
        }
        return this;
    }

    /// Adds an array sample for sample.
    ///
    /// @throws InvalidParameterException if the lengths differ
    public SignalBuffer add(double[] values) {
        if (values.length != data.length) {
            throw new InvalidParameterException("signal",
                "length mismatch: " + data.length + " vs " + values.length);
        }
        for (int i = 0; i < data.length; i++) {
            data[i] += values[i];
        }
        return this;
    }

    /// Multiplies the buffer sample for sample by an envelope.
    public SignalBuffer multiply(double[] envelope) {
        if (envelope.length != data.length) {
            throw new InvalidParameterException("envelope",
                "length mismatch: " + data.length + " vs " + envelope.length);
        }
        for (int i = 0; i < data.length; i++) {
            data[i] *= envelope[i];
        }
        return this;
    }

    /// @return how many placements were dropped at the boundary
    public int skippedCount() {
        return skipped;
    }

    /// @return how many placements were truncated at the boundary
    public int clippedCount() {
        return clipped;
    }

    /// @return a signal holding a copy of the current contents
    public Signal toSignal() {
        return Signal.wrap(Arrays.copyOf(data, data.length));
    }
}
