package io.nosqlbench.biosynth;

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

import io.nosqlbench.biosynth.model.Signal;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.exceptions.InvalidParameterException;
import io.nosqlbench.biosynth.model.exceptions.UnsupportedTypeException;
import io.nosqlbench.biosynth.model.random.SynthRandom;
import io.nosqlbench.biosynth.noise.NoiseSynthesizer;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

/// Layering operations shared by every family.
@Tag("unit")
public class SynthesizerTest {

    private final Synthesizer synth = new NoiseSynthesizer(100, 1.0, SynthRandom.seeded(1L));
    private final Signal flat = Signal.zeros(100);

    @Test
    void spikeTouchesOneSample() {
        Signal out = synth.addArtifact(flat, "spike", 0.5, 0.3, 2.0);
        assertEquals(1, out.countNonZero());
        assertEquals(2.0, out.get(50));
        assertEquals(0, flat.countNonZero());
    }

    @Test
    void stepIsClippedAtTheEnd() {
        Signal out = synth.addArtifact(flat, "step", 0.9, 0.5, 1.5);
        assertEquals(10, out.countNonZero());
        assertEquals(1.5, out.get(99));
        assertEquals(0.0, out.get(89));
    }

    @Test
    void rampRisesToAmplitude() {
        Signal out = synth.addArtifact(flat, "RAMP", 0.2, 0.1, 1.0);
        assertEquals(0.0, out.get(20));
        assertEquals(1.0, out.get(29));
        assertThat(out.get(25)).isBetween(0.0, 1.0);
        assertEquals(0.0, out.get(30));
    }

    @Test
    void exponentialDecayStartsAtAmplitude() {
        Signal out = synth.addArtifact(flat, "exponential_decay", 0.1, 0.2, 3.0);
        assertEquals(3.0, out.get(10), 1e-12);
        assertThat(out.get(29)).isCloseTo(3.0 * Math.exp(-5.0), within(1e-9));
        assertThat(out.get(15)).isLessThan(out.get(11));
    }

    @Test
    void artifactArgumentsAreChecked() {
        assertEquals("start_time", assertThrows(InvalidParameterException.class,
            () -> synth.addArtifact(flat, "spike", 1.0, 0.0, 1.0)).getParameter());
        assertThrows(InvalidParameterException.class, () -> synth.addArtifact(flat, "spike", -0.1, 0.0, 1.0));
        assertEquals("duration", assertThrows(InvalidParameterException.class,
            () -> synth.addArtifact(flat, "step", 0.0, 1.0, 1.0)).getParameter());
        assertThrows(InvalidParameterException.class, () -> synth.addArtifact(flat, "step", 0.0, 0.1, Double.NaN));
        assertThrows(UnsupportedTypeException.class, () -> synth.addArtifact(flat, "sawtooth", 0.0, 0.1, 1.0));
        assertEquals("signal", assertThrows(InvalidParameterException.class,
            () -> synth.addArtifact(Signal.zeros(99), "spike", 0.0, 0.0, 1.0)).getParameter());
    }

    @Test
    void powerlineLayerIsAddedToTheInput() {
        Synthesizer fast = new NoiseSynthesizer(1000, 1.0);
        Signal base = Signal.zeros(1000);
        Signal out = fast.addNoise(base, "powerline", SynthParams.of("amplitude", 0.5, "harmonics", 1));
        assertThat(out.peakAbs()).isCloseTo(0.5, within(1e-3));
        assertEquals(0.0, out.get(0), 1e-12);
        assertEquals(0.0, out.get(10), 1e-9);
        assertEquals(0, base.countNonZero());
    }

    @Test
    void seededLayersRepeat() {
        SynthParams params = SynthParams.of("noise_type", "pink", SynthParams.RANDOM_SEED, 5);
        Signal a = synth.addNoise(flat, "pink", params);
        Signal b = synth.addNoise(flat, "pink", params);
        assertEquals(a, b);
    }

    @Test
    void unknownLayerAndWrongLengthAreRejected() {
        UnsupportedTypeException e = assertThrows(UnsupportedTypeException.class,
            () -> synth.addNoise(flat, "purple", SynthParams.empty()));
        assertThat(e.getMessage()).contains("gaussian", "powerline", "electrode_pop");
        assertThrows(InvalidParameterException.class,
            () -> synth.addNoise(Signal.zeros(10), "gaussian", SynthParams.empty()));
    }

    @Test
    void renderedLengthIsEnforced() {
        Synthesizer broken = new Synthesizer(100, 1.0) {
            @Override
            public String family() {
                return "broken";
            }

            @Override
            protected Signal render(TimeBase timeBase, SynthParams params, SynthRandom rng) {
                return Signal.zeros(timeBase.nSamples() - 1);
            }
        };
        assertThrows(IllegalStateException.class, broken::generate);
    }

    @Test
    void constructorValidatesTimeBase() {
        assertThrows(InvalidParameterException.class, () -> new NoiseSynthesizer(0, 1));
        assertThrows(InvalidParameterException.class, () -> new NoiseSynthesizer(100, 0.001));
    }
}
