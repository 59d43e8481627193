package io.nosqlbench.biosynth.noise;

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

import io.nosqlbench.biosynth.model.random.SynthRandom;
import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

/**
 * Colored noise by frequency-domain shaping.
 *
 * <p>A random-phase spectrum with magnitude {@code |f|^-exponent} is built on
 * the next power-of-two length at or above {@code n}, inverse transformed, and
 * the real part of the first {@code n} samples is kept. The DC bin is zero, so
 * the output has no offset term. The result is normalized to unit standard
 * deviation.
 *
 * <p>An exponent of 0.5 gives pink noise (power {@code 1/|f|}); 1.0 gives
 * brown noise (power {@code 1/f^2}).
 */
public final class SpectralShaper {

    public static final double PINK = 0.5;
    public static final double BROWN = 1.0;

    private static final FastFourierTransformer fft = new FastFourierTransformer(DftNormalization.STANDARD);

    private SpectralShaper() {
    }

    /**
     * @param n output length
     * @param exponent magnitude exponent, applied as {@code |f|^-exponent}
     * @param rng phase source
     * @return {@code n} samples with zero mean and unit standard deviation,
     *     or all zeros when {@code n < 2}
     */
    public static double[] powerLaw(int n, double exponent, SynthRandom rng) {
        double[] out = new double[Math.max(0, n)];
        if (n < 2) {
            return out;
        }
        int m = nextPowerOfTwo(n);
        Complex[] spectrum = new Complex[m];
        for (int k = 0; k < m; k++) {
            double f = (k < m / 2 ? k : k - m) / (double) m;
            double phase = rng.uniform(0.0, 2.0 * Math.PI);
            if (f == 0.0) {
                spectrum[k] = Complex.ZERO;
            } else {
                double magnitude = Math.pow(Math.abs(f), -exponent);
                spectrum[k] = new Complex(magnitude * Math.cos(phase), magnitude * Math.sin(phase));
            }
        }
        Complex[] time = fft.transform(spectrum, TransformType.INVERSE);
        double mean = 0.0;
        for (int i = 0; i < n; i++) {
            out[i] = time[i].getReal();
            mean += out[i];
        }
        mean /= n;
        double variance = 0.0;
        for (int i = 0; i < n; i++) {
            out[i] -= mean;
            variance += out[i] * out[i];
        }
        double std = Math.sqrt(variance / n);
        if (std == 0.0) {
            return new double[n];
        }
        for (int i = 0; i < n; i++) {
            out[i] /= std;
        }
        return out;
    }

    static int nextPowerOfTwo(int n) {
        int m = Integer.highestOneBit(n);
        return m == n ? m : m << 1;
    }
}
