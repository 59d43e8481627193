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

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class SynthRandomTest {

    @Test
    void sameSeedSameStream() {
        SynthRandom a = SynthRandom.seeded(1234L);
        SynthRandom b = SynthRandom.seeded(1234L);
        for (int i = 0; i < 100; i++) {
            assertEquals(a.uniform01(), b.uniform01());
            assertEquals(a.gaussian(), b.gaussian());
            assertEquals(a.nextInt(0, 10), b.nextInt(0, 10));
        }
        assertThat(a.gaussians(50, 0, 1)).containsExactly(b.gaussians(50, 0, 1));
    }

    @Test
    void reseedRestartsTheStream() {
        SynthRandom rng = SynthRandom.seeded(7L);
        double first = rng.uniform01();
        rng.uniform01();
        rng.reseed(7L);
        assertEquals(first, rng.uniform01());
        assertEquals(7L, rng.seed());
    }

    @Test
    void differentSeedsDiverge() {
        double[] a = SynthRandom.seeded(1L).uniforms(20, 0, 1);
        double[] b = SynthRandom.seeded(2L).uniforms(20, 0, 1);
        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void zeroStdYieldsTheMeanExactly() {
        assertThat(SynthRandom.seeded(3L).gaussians(10, 0.25, 0.0)).containsOnly(0.25);
    }

    @Test
    void drawsStayInRange() {
        SynthRandom rng = SynthRandom.seeded(99L);
        for (int i = 0; i < 1000; i++) {
            double u = rng.uniform(-2.0, 3.0);
            assertTrue(u >= -2.0 && u < 3.0);
            int k = rng.nextInt(5, 10);
            assertTrue(k >= 5 && k < 10);
            assertTrue(rng.exponential(0.5) >= 0.0);
            assertEquals(1.0, Math.abs(rng.sign()));
        }
    }

    @Test
    void seededStreamsUseXoShiRo256PlusPlus() {
        assertThat(RandomGenerators.Algorithm.values()).containsExactly(RandomGenerators.Algorithm.XO_SHI_RO_256_PP);
        UniformRandomProvider reference = RandomSource.XO_SHI_RO_256_PP.create(42L);
        SynthRandom rng = SynthRandom.seeded(42L);
        for (int i = 0; i < 20; i++) {
            assertEquals(reference.nextLong(), rng.provider().nextLong());
        }
    }
}
