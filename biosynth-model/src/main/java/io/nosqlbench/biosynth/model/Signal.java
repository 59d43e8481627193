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
import java.util.stream.DoubleStream;

/// Immutable, fixed-length sequence of samples.
///
/// Signals are never mutated after construction. Composition always yields a
/// new instance:
///
/// ```java
/// Signal noisy = ecg.plus(powerline).plus(wander);
/// double[] raw = noisy.toArray();   // copy
/// ```
public final class Signal {

    private final double[] samples;

    private Signal(double[] samples) {
        this.samples = samples;
    }

    /// Creates a signal from a copy of the given samples.
    ///
    /// @param samples sample values
    /// @return a new signal
    public static Signal of(double... samples) {
        return new Signal(Arrays.copyOf(samples, samples.length));
    }

    /// Creates a signal taking ownership of the array. Only for callers that
    /// drop every other reference to it.
    static Signal wrap(double[] samples) {
        return new Signal(samples);
    }

    /// @param length number of samples
    /// @return the all-zero signal of the given length
    public static Signal zeros(int length) {
        return new Signal(new double[length]);
    }

    /// @param timeBase the time base
    /// @return the all-zero signal covering the time base
    public static Signal zeros(TimeBase timeBase) {
        return zeros(timeBase.nSamples());
    }

    public int length() {
        return samples.length;
    }

    public double get(int index) {
        return samples[index];
    }

    /// @return a copy of the sample values
    public double[] toArray() {
        return Arrays.copyOf(samples, samples.length);
    }

    public DoubleStream stream() {
        return Arrays.stream(samples);
    }

    /// Sample-wise sum of two equal-length signals.
    ///
    /// @param other the signal to add
    /// @return a new signal
    /// @throws InvalidParameterException if the lengths differ
    public Signal plus(Signal other) {
        if (other.samples.length != samples.length) {
            throw new InvalidParameterException("signal",
                "length mismatch: " + samples.length + " vs " + other.samples.length);
        }
        double[] sum = new double[samples.length];
        for (int i = 0; i < sum.length; i++) {
            sum[i] = samples[i] + other.samples[i];
        }
        return new Signal(sum);
    }

    /// @param factor multiplier
    /// @return a new signal with every sample multiplied by factor
    public Signal scale(double factor) {
        double[] scaled = new double[samples.length];
        for (int i = 0; i < scaled.length; i++) {
            scaled[i] = samples[i] * factor;
        }
        return new Signal(scaled);
    }

    public double max() {
        return stream().max().orElse(Double.NaN);
    }

    public double min() {
        return stream().min().orElse(Double.NaN);
    }

    /// @return the largest absolute sample value
    public double peakAbs() {
        double peak = 0.0;
        for (double v : samples) {
            peak = Math.max(peak, Math.abs(v));
        }
        return peak;
    }

    public double mean() {
        return stream().average().orElse(Double.NaN);
    }

    /// @return the population standard deviation
    public double stdDev() {
        double mean = mean();
        double acc = 0.0;
        for (double v : samples) {
            acc += (v - mean) * (v - mean);
        }
        return Math.sqrt(acc / samples.length);
    }

    /// @return the number of samples that are not exactly zero
    public int countNonZero() {
        int count = 0;
        for (double v : samples) {
            if (v != 0.0) {
                count++;
            }
        }
        return count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Signal)) return false;
        return Arrays.equals(samples, ((Signal) o).samples);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "Signal[length=" + samples.length + "]";
    }
}
