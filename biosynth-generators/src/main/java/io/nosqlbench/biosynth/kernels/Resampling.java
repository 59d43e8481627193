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

import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

import java.util.Arrays;

/// Stretches a caller-supplied curve (an EMG intensity envelope, an EOG
/// trajectory) to the length of the output signal.
///
/// Both the source points and the output samples are placed evenly on
/// `[0, 1]`; output values are linearly interpolated between neighbouring
/// source points. The first and last source values are reproduced exactly.
public final class Resampling {

    private Resampling() {
    }

    /// @param values source points, at least one
    /// @param n output length
    /// @return the resampled curve
    public static double[] linear(double[] values, int n) {
        if (n <= 0) {
            return new double[0];
        }
        if (values.length == 1) {
            double[] out = new double[n];
            Arrays.fill(out, values[0]);
            return out;
        }
        double[] knots = WaveformKernels.linspace(0.0, 1.0, values.length);
        PolynomialSplineFunction f = new LinearInterpolator().interpolate(knots, values);
        double[] x = WaveformKernels.linspace(0.0, 1.0, n);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = f.value(Math.min(1.0, Math.max(0.0, x[i])));
        }
        return out;
    }
}
