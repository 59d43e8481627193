package io.nosqlbench.biosynth.kernels;

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

/**
 * Closed-form pulse shapes composed into full-length signals.
 *
 * <h2>Kernels</h2>
 *
 * <pre>{@code
 *   muap            -t * exp(-2000 t^2)                 t in [-2ms, 2ms]
 *   gaussianBump    a * exp(-100 t^2)                    t in [-d/2, d/2]
 *   qrsComplex      sum of three lobes exp(-50 ((t-c)/d)^2), c = -d/4, 0, +d/4
 *   saccadeVelocity pv * exp(-(t - d/3)^2 / (0.2 d)^2)   t in [0, d]
 *   saccadePosition cumulative sum of the velocity, rescaled to end at the amplitude
 *   blinkProfile    fast closing exp(-100 (t/(d/6))^2) then slow opening exp(-50 (t/(d/3))^2)
 * }</pre>
 *
 * <p>Every kernel has {@code round(duration * samplingRate)} samples. All methods
 * are pure: identical arguments give bit-identical arrays.
 */
public final class WaveformKernels {

    /** Half-width of the MUAP window in seconds. */
    public static final double MUAP_HALF_WIDTH = 0.002;

    private WaveformKernels() {
    }

    /**
     * Evenly spaced samples over a closed interval, endpoints included.
     * A single sample is the start value.
     *
     * @param start first value
     * @param end last value
     * @param n number of samples
     * @return the samples
     */
    public static double[] linspace(double start, double end, int n) {
        if (n <= 0) {
            return new double[0];
        }
        double[] out = new double[n];
        if (n == 1) {
            out[0] = start;
            return out;
        }
        double step = (end - start) / (n - 1);
        for (int i = 0; i < n; i++) {
            out[i] = start + i * step;
        }
        out[n - 1] = end;
        return out;
    }

    /**
     * Number of kernel samples covering a duration.
     *
     * @param duration seconds
     * @param samplingRate Hz
     * @return {@code round(duration * samplingRate)}, never negative
     */
    public static int sampleCount(double duration, double samplingRate) {
        return (int) Math.max(0, Math.round(duration * samplingRate));
    }

    /**
     * Biphasic motor unit action potential.
     *
     * @param samplingRate Hz
     * @return {@code -t * exp(-2000 t^2)} sampled over 4 ms
     */
    public static double[] muap(double samplingRate) {
        double[] t = linspace(-MUAP_HALF_WIDTH, MUAP_HALF_WIDTH,
            sampleCount(2 * MUAP_HALF_WIDTH, samplingRate));
        double[] out = new double[t.length];
        for (int i = 0; i < t.length; i++) {
            out[i] = -t[i] * Math.exp(-2000.0 * t[i] * t[i]);
        }
        return out;
    }

    /**
     * Gaussian bump used for P and T waves.
     *
     * @param amplitude peak value
     * @param duration window length in seconds
     * @param samplingRate Hz
     * @return the bump
     */
    public static double[] gaussianBump(double amplitude, double duration, double samplingRate) {
        double[] t = linspace(-duration / 2, duration / 2, sampleCount(duration, samplingRate));
        double[] out = new double[t.length];
        for (int i = 0; i < t.length; i++) {
            out[i] = amplitude * Math.exp(-100.0 * t[i] * t[i]);
        }
        return out;
    }

    /**
     * Triphasic QRS complex. The lobe width is applied to time normalized by
     * the complex duration, so a wider complex keeps three distinct lobes.
     *
     * @param qAmp amplitude of the leading lobe
     * @param rAmp amplitude of the central lobe
     * @param sAmp amplitude of the trailing lobe
     * @param duration complex length in seconds
     * @param samplingRate Hz
     * @return the complex
     */
    public static double[] qrsComplex(double qAmp, double rAmp, double sAmp,
                                      double duration, double samplingRate) {
        double[] t = linspace(-duration / 2, duration / 2, sampleCount(duration, samplingRate));
        double[] out = new double[t.length];
        for (int i = 0; i < t.length; i++) {
            out[i] = qAmp * lobe(t[i], -duration / 4, duration)
                + rAmp * lobe(t[i], 0.0, duration)
                + sAmp * lobe(t[i], duration / 4, duration);
        }
        return out;
    }

    private static double lobe(double t, double center, double duration) {
        double u = (t - center) / duration;
        return Math.exp(-50.0 * u * u);
    }

    /**
     * Asymmetric saccade velocity profile peaking at one third of the duration.
     *
     * @param duration saccade duration in seconds
     * @param peakVelocity peak velocity in degrees per second
     * @param samplingRate Hz
     * @return velocity samples
     */
    public static double[] saccadeVelocity(double duration, double peakVelocity, double samplingRate) {
        double[] t = linspace(0.0, duration, sampleCount(duration, samplingRate));
        double width = 0.2 * duration;
        double[] out = new double[t.length];
        for (int i = 0; i < t.length; i++) {
            double x = t[i] - duration / 3;
            out[i] = peakVelocity * Math.exp(-(x * x) / (width * width));
        }
        return out;
    }

    /**
     * Saccade position trace: the integrated velocity profile rescaled so the
     * last sample equals the amplitude.
     *
     * @param amplitude signed displacement in degrees
     * @param duration saccade duration in seconds
     * @param peakVelocity peak velocity in degrees per second
     * @param samplingRate Hz
     * @return position samples, monotonic from near zero to amplitude
     */
    public static double[] saccadePosition(double amplitude, double duration,
                                           double peakVelocity, double samplingRate) {
        double[] v = saccadeVelocity(duration, peakVelocity, samplingRate);
        double[] pos = new double[v.length];
        double acc = 0.0;
        for (int i = 0; i < v.length; i++) {
            acc += v[i] / samplingRate;
            pos[i] = acc;
        }
        if (pos.length == 0 || acc == 0.0) {
            return pos;
        }
        for (int i = 0; i < pos.length; i++) {
            pos[i] = amplitude * pos[i] / acc;
        }
        pos[pos.length - 1] = amplitude;
        return pos;
    }

    /**
     * Asymmetric blink: fast closing before the midpoint, slower opening after.
     *
     * @param amplitude peak value
     * @param duration blink length in seconds
     * @param samplingRate Hz
     * @return the blink profile
     */
    public static double[] blinkProfile(double amplitude, double duration, double samplingRate) {
        double[] t = linspace(-duration / 2, duration / 2, sampleCount(duration, samplingRate));
        double closing = duration / 6;
        double opening = duration / 3;
        double[] out = new double[t.length];
        for (int i = 0; i < t.length; i++) {
            if (t[i] < 0) {
                double u = t[i] / closing;
                out[i] = amplitude * Math.exp(-100.0 * u * u);
            } else {
                double u = t[i] / opening;
                out[i] = amplitude * Math.exp(-50.0 * u * u);
            }
        }
        return out;
    }

    /**
     * Hann window, zero at both ends. A single sample is 1.
     *
     * @param n window length
     * @return the window
     */
    public static double[] hanning(int n) {
        if (n <= 0) {
            return new double[0];
        }
        if (n == 1) {
            return new double[]{1.0};
        }
        double[] w = new double[n];
        for (int i = 0; i < n; i++) {
            w[i] = 0.5 - 0.5 * Math.cos(2 * Math.PI * i / (n - 1));
        }
        return w;
    }

    /**
     * Exponential decay from 1 to {@code exp(-span)}.
     *
     * @param n number of samples
     * @param span decay exponent reached at the last sample
     * @return the decay
     */
    public static double[] exponentialDecay(int n, double span) {
        double[] x = linspace(0.0, span, n);
        for (int i = 0; i < x.length; i++) {
            x[i] = Math.exp(-x[i]);
        }
        return x;
    }

    /**
     * Sinusoid sampled on a local time axis {@code t = i / samplingRate}.
     *
     * @param n number of samples
     * @param frequency Hz
     * @param phase radians
     * @param amplitude peak value
     * @param samplingRate Hz
     * @return the tone
     */
    public static double[] tone(int n, double frequency, double phase, double amplitude, double samplingRate) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = amplitude * Math.sin(2 * Math.PI * frequency * i / samplingRate + phase);
        }
        return out;
    }
}
