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

import java.util.Arrays;

/// A short analytic pulse plus the offset of its first sample relative to the
/// start of the beat or event it belongs to.
///
/// ```text
///   event start
///        |
///   -----+------------------------------
///   [ P ]          offset = -0.2s
///        [ QRS ]   offset =  0.0s
///              [  T  ] offset = +0.2s
/// ```
///
/// Kernels are regenerated from closed-form expressions on every use and
/// never cached.
public final class WaveformKernel {

    private final double[] samples;
    private final double offsetSeconds;

    private WaveformKernel(double[] samples, double offsetSeconds) {
        this.samples = samples;
        this.offsetSeconds = offsetSeconds;
    }

    /// @param samples the kernel samples; copied
    /// @param offsetSeconds position of the first sample relative to the event start
    /// @return the kernel
    public static WaveformKernel of(double[] samples, double offsetSeconds) {
        return new WaveformKernel(Arrays.copyOf(samples, samples.length), offsetSeconds);
    }

    /// @param samples the kernel samples; copied
    /// @return a kernel anchored at the event start
    public static WaveformKernel anchored(double[] samples) {
        return of(samples, 0.0);
    }

    public double offsetSeconds() {
        return offsetSeconds;
    }

    public int length() {
        return samples.length;
    }

    public double get(int index) {
        return samples[index];
    }

    /// @return a copy of the samples
    public double[] samples() {
        return Arrays.copyOf(samples, samples.length);
    }

    /// @param factor multiplier
    /// @return a scaled copy with the same offset
    public WaveformKernel scaled(double factor) {
        double[] s = new double[samples.length];
        for (int i = 0; i < s.length; i++) {
            s[i] = samples[i] * factor;
        }
        return new WaveformKernel(s, offsetSeconds);
    }

    /// @param newOffset the new offset in seconds
    /// @return a copy anchored at another offset
    public WaveformKernel withOffset(double newOffset) {
        return new WaveformKernel(samples, newOffset);
    }

    /// @return the kernel duration at the given rate
    public double durationAt(double samplingRate) {
        return samples.length / samplingRate;
    }

    double[] raw() {
        return samples;
    }

    @Override
    public String toString() {
        return "WaveformKernel[length=" + samples.length + ", offset=" + offsetSeconds + "s]";
    }
}
