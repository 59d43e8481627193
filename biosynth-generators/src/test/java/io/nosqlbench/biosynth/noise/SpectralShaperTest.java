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
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Spectral accuracy of the power-law shaper. The log-log slope of the power
 * spectrum, averaged over octave bands, must be close to -1 for pink noise
 * and -2 for brown noise.
 */
public class SpectralShaperTest {

    private static final int N = 1 << 14;

    @Test
    @Tag("unit")
    public void testShortInputs() {
        SynthRandom rng = SynthRandom.seeded(1L);
        assertArrayEquals(new double[0], SpectralShaper.powerLaw(0, SpectralShaper.PINK, rng));
        assertArrayEquals(new double[1], SpectralShaper.powerLaw(1, SpectralShaper.PINK, rng));
        assertEquals(2, SpectralShaper.powerLaw(2, SpectralShaper.BROWN, rng).length);
    }

    @Test
    @Tag("unit")
    public void testNextPowerOfTwo() {
        assertEquals(1, SpectralShaper.nextPowerOfTwo(1));
        assertEquals(1024, SpectralShaper.nextPowerOfTwo(1000));
        assertEquals(1024, SpectralShaper.nextPowerOfTwo(1024));
        assertEquals(2048, SpectralShaper.nextPowerOfTwo(1025));
    }

    @Test
    @Tag("unit")
    public void testNonPowerOfTwoLengthIsNormalized() {
        double[] x = SpectralShaper.powerLaw(3001, SpectralShaper.PINK, SynthRandom.seeded(4L));
        assertEquals(3001, x.length);
        double sum = 0;
        double squares = 0;
        for (double v : x) {
            sum += v;
            squares += v * v;
        }
        assertThat(sum / x.length).isCloseTo(0.0, within(1e-9));
        assertThat(Math.sqrt(squares / x.length)).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @Tag("unit")
    public void testShortRecordSlopesFall() {
        double pink = spectralSlope(2048, SpectralShaper.PINK, 31L);
        double brown = spectralSlope(2048, SpectralShaper.BROWN, 31L);
        assertThat(pink).isNegative().isLessThan(-0.5);
        assertThat(brown).isLessThan(pink);
    }

    @Test
    @Tag("accuracy")
    public void testPinkSlope() {
        assertThat(spectralSlope(SpectralShaper.PINK, 21L)).isCloseTo(-1.0, within(0.2));
    }

    @Test
    @Tag("accuracy")
    public void testBrownSlope() {
        assertThat(spectralSlope(SpectralShaper.BROWN, 22L)).isCloseTo(-2.0, within(0.2));
    }

    @Test
    @Tag("accuracy")
    public void testBrownIsSteeperThanPink() {
        assertThat(spectralSlope(SpectralShaper.BROWN, 5L)).isLessThan(spectralSlope(SpectralShaper.PINK, 5L) - 0.5);
    }

    private static double spectralSlope(double exponent, long seed) {
        return spectralSlope(N, exponent, seed);
    }

    private static double spectralSlope(int n, double exponent, long seed) {
        double[] x = SpectralShaper.powerLaw(n, exponent, SynthRandom.seeded(seed));
        Complex[] spectrum = new FastFourierTransformer(DftNormalization.STANDARD).transform(x, TransformType.FORWARD);
        SimpleRegression regression = new SimpleRegression();
        for (int lo = 8; lo < n / 2; lo *= 2) {
            int hi = Math.min(2 * lo, n / 2);
            double power = 0.0;
            for (int k = lo; k < hi; k++) {
                double magnitude = spectrum[k].abs();
                power += magnitude * magnitude;
            }
            power /= (hi - lo);
            regression.addData(Math.log10(Math.sqrt((double) lo * hi)), Math.log10(power));
        }
        return regression.getSlope();
    }
}
