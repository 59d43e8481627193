package io.nosqlbench.biosynth.model.random;

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

import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;

import java.util.Arrays;

/// Explicit random stream owned by one synthesizer instance.
///
/// Every stochastic draw made while generating a signal goes through a
/// SynthRandom, so two instances never share state and reseeding one never
/// disturbs another.
///
/// ```java
/// SynthRandom rng = SynthRandom.seeded(42L);
/// double phase = rng.uniform(0, 2 * Math.PI);
/// rng.reseed(42L);                 // restart the same sequence
/// ```
///
/// Not thread-safe.
public final class SynthRandom {

    private final RandomGenerators.Algorithm algorithm;
    private long seed;
    private RestorableUniformRandomProvider provider;
    private ContinuousSampler gaussian;
    private ContinuousSampler exponential;

    public SynthRandom(RandomGenerators.Algorithm algorithm, long seed) {
        this.algorithm = algorithm;
        reseed(seed);
    }

    public static SynthRandom seeded(long seed) {
        return new SynthRandom(RandomGenerators.Algorithm.XO_SHI_RO_256_PP, seed);
    }

    /// @return a stream seeded from the library's seed factory
    public static SynthRandom unseeded() {
        return seeded(RandomGenerators.freshSeed());
    }

    /// Restarts the stream from the given seed.
    ///
    /// @param newSeed the seed
    public void reseed(long newSeed) {
        this.seed = newSeed;
        this.provider = RandomGenerators.create(algorithm, newSeed);
        this.gaussian = ZigguratSampler.NormalizedGaussian.of(provider);
        this.exponential = ZigguratSampler.Exponential.of(provider);
    }

    /// @return the seed this stream was last started from
    public long seed() {
        return seed;
    }

    public RestorableUniformRandomProvider provider() {
        return provider;
    }

    /// @return a uniform draw in [0, 1)
    public double uniform01() {
        return provider.nextDouble();
    }

    /// @return a uniform draw in [lo, hi)
    public double uniform(double lo, double hi) {
        return lo + (hi - lo) * provider.nextDouble();
    }

    /// @return n uniform draws in [lo, hi)
    public double[] uniforms(int n, double lo, double hi) {
        ContinuousSampler sampler = RandomGenerators.createUniformSampler(provider, lo, hi);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = sampler.sample();
        }
        return out;
    }

    /// @return a standard normal draw
    public double gaussian() {
        return gaussian.sample();
    }

    /// @return a normal draw with the given mean and standard deviation
    public double gaussian(double mean, double std) {
        return mean + std * gaussian.sample();
    }

    /// @return n normal draws; every value is exactly mean when std is zero
    public double[] gaussians(int n, double mean, double std) {
        double[] out = new double[n];
        if (std == 0.0) {
            Arrays.fill(out, mean);
            return out;
        }
        for (int i = 0; i < n; i++) {
            out[i] = mean + std * gaussian.sample();
        }
        return out;
    }

    /// @param mean the mean of the distribution, positive
    /// @return an exponential draw
    public double exponential(double mean) {
        return mean * exponential.sample();
    }

    /// @param p success probability
    /// @return true with probability p
    public boolean bernoulli(double p) {
        return provider.nextDouble() < p;
    }

    /// @return +1 or -1 with equal probability
    public double sign() {
        return provider.nextBoolean() ? 1.0 : -1.0;
    }

    /// @return a uniform integer in [lo, hi)
    public int nextInt(int lo, int hi) {
        return provider.nextInt(lo, hi);
    }

    @Override
    public String toString() {
        return "SynthRandom[" + algorithm + ", seed=" + seed + "]";
    }
}
