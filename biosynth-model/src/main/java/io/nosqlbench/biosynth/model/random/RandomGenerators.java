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
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.ContinuousUniformSampler;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Factory for the pseudo-random providers behind every synthesizer stream.
 * Backed by Apache Commons RNG.
 */
public final class RandomGenerators {

    /**
     * Supported PRNG algorithms.
     */
    public enum Algorithm {
        /**
         * XorShiRo256++ - 256-bit state, the default for synthesis streams.
         */
        XO_SHI_RO_256_PP(RandomSource.XO_SHI_RO_256_PP);

        private final RandomSource source;

        Algorithm(RandomSource source) {
            this.source = source;
        }

        RandomSource getSource() {
            return source;
        }
    }

    private RandomGenerators() {
    }

    /**
     * Creates a provider with the given algorithm and seed.
     *
     * @param algorithm the PRNG algorithm
     * @param seed the seed
     * @return a restorable provider
     */
    public static RestorableUniformRandomProvider create(Algorithm algorithm, long seed) {
        return (RestorableUniformRandomProvider) algorithm.getSource().create(seed);
    }

    /**
     * @return a fresh seed drawn from the library's seed factory
     */
    public static long freshSeed() {
        return RandomSource.createLong();
    }

    /**
     * Creates a continuous uniform sampler for the specified range.
     *
     * @param rng the provider
     * @param lower the lower bound (inclusive)
     * @param upper the upper bound (exclusive)
     * @return a continuous uniform sampler
     */
    public static ContinuousSampler createUniformSampler(UniformRandomProvider rng,
                                                         double lower, double upper) {
        return ContinuousUniformSampler.of(rng, lower, upper);
    }
}
