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

import io.nosqlbench.biosynth.model.Signal;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.exceptions.InvalidParameterException;
import io.nosqlbench.biosynth.model.exceptions.UnsupportedTypeException;
import io.nosqlbench.biosynth.model.random.SynthRandom;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class NoiseSynthesizerTest {

    private final NoiseSynthesizer noise = new NoiseSynthesizer(1000, 2.0, SynthRandom.seeded(11L));

    static List<String> layerNames() {
        return NoiseCatalog.names();
    }

    @ParameterizedTest
    @MethodSource("layerNames")
    void everyLayerRendersFiniteSamples(String name) {
        Signal out = noise.addNoise(Signal.zeros(2000), name, SynthParams.of("random_seed", 3));
        assertEquals(2000, out.length());
        assertTrue(out.stream().allMatch(Double::isFinite), name);
        assertThat(out.countNonZero()).as(name).isPositive();
    }

    @Test
    void catalogNamesAreUniqueAndResolve() {
        List<String> names = NoiseCatalog.names();
        assertThat(names).doesNotHaveDuplicates()
            .contains("gaussian", "pink", "brown", "powerline", "baseline_wander", "high_frequency",
                "electrode_movement", "cable_motion", "subject_movement", "baseline_shift",
                "poor_contact", "electrode_pop", "impedance_change", "dc_offset",
                "emg", "ecg", "environmental", "device", "emg_crosstalk", "ecg_interference", "device_artifact");
        assertEquals(InterferenceType.PARAM, NoiseCatalog.resolve("ECG_Interference").familyKey());
        assertEquals("pink", NoiseCatalog.resolve(" Pink ").name());
        assertThrows(UnsupportedTypeException.class, () -> NoiseCatalog.resolve(null));
    }

    @Test
    void defaultIsUnitGaussian() {
        Signal out = new NoiseSynthesizer(1000, 10.0).generate(SynthParams.of("random_seed", 5));
        assertThat(out.stdDev()).isCloseTo(1.0, within(0.05));
        assertThat(out.mean()).isCloseTo(0.0, within(0.05));
    }

    @Test
    void zeroStdGivesSilence() {
        Signal out = noise.generate(SynthParams.of("noise_type", "gaussian", "std", 0.0));
        assertEquals(0, out.countNonZero());
        assertThrows(InvalidParameterException.class,
            () -> noise.generate(SynthParams.of("noise_type", "gaussian", "std", -1.0)));
    }

    @Test
    void colouredNoiseIsScaledToAmplitude() {
        Signal pink = noise.generate(SynthParams.of("noise_type", "pink", "amplitude", 0.2));
        Signal brown = noise.generate(SynthParams.of("noise_type", "brown", "amplitude", 3.0));
        assertThat(pink.stdDev()).isCloseTo(0.2, within(1e-9));
        assertThat(brown.stdDev()).isCloseTo(3.0, within(1e-9));
        assertThat(pink.mean()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void powerlineHarmonicsDecay() {
        Signal one = noise.generate(SynthParams.of("noise_type", "powerline", "frequency", 60, "harmonics", 1));
        assertThat(one.peakAbs()).isCloseTo(1.0, within(0.01));
        assertThrows(InvalidParameterException.class,
            () -> noise.generate(SynthParams.of("noise_type", "powerline", "harmonics", 0)));
    }

    @Test
    void highFrequencyNeedsAnOrderedBand() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
            () -> noise.generate(SynthParams.of("noise_type", "high_frequency", "min_freq", 300, "max_freq", 200)));
        assertEquals("max_freq", e.getParameter());
    }

    @Test
    void burstWindowMustBeShorterThanTheRecord() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
            () -> noise.generate(SynthParams.of("artifact_type", "electrode_movement", "duration", 2.0)));
        assertEquals("duration", e.getParameter());
        assertThrows(InvalidParameterException.class,
            () -> noise.generate(SynthParams.of("electrode_artifact", "poor_contact", "duration", 0.0)));
    }

    @Test
    void zeroEventsGiveSilence() {
        Signal out = noise.generate(SynthParams.of("artifact_type", "cable_motion", "n_artifacts", 0));
        assertEquals(0, out.countNonZero());
        Signal alias = noise.generate(SynthParams.of("electrode_artifact", "electrode_pop", "n_events", 0));
        assertEquals(0, alias.countNonZero());
    }

    @Test
    void electrodeMovementBurstsStayWithinAmplitude() {
        Signal out = noise.generate(SynthParams.of("artifact_type", "electrode_movement",
            "n_artifacts", 1, "amplitude", 2.0, "random_seed", 9));
        assertThat(out.peakAbs()).isCloseTo(2.0, within(1e-9));
        assertThat(out.countNonZero()).isBetween(190, 200);
    }

    @Test
    void dcOffsetPersistsToTheEnd() {
        Signal out = noise.generate(SynthParams.of("electrode_artifact", "dc_offset", "random_seed", 2));
        assertNotEquals(0.0, out.get(out.length() - 1));
    }

    @Test
    void selectionPrecedence() {
        assertSame(MotionArtifactType.BASELINE_SHIFT, NoiseSynthesizer.select(
            SynthParams.of("noise_type", "pink", "artifact_type", "baseline_shift", "interference_type", "emg")));
        assertSame(ElectrodeArtifactType.ELECTRODE_POP, NoiseSynthesizer.select(
            SynthParams.of("noise_type", "pink", "electrode_artifact", "electrode_pop")));
        assertSame(InterferenceType.DEVICE, NoiseSynthesizer.select(
            SynthParams.of("noise_type", "pink", "interference_type", "device")));
        assertSame(NoiseType.GAUSSIAN, NoiseSynthesizer.select(SynthParams.empty()));
    }

    @Test
    void unknownTypesAreRejected() {
        assertThrows(UnsupportedTypeException.class,
            () -> noise.generate(SynthParams.of("noise_type", "violet")));
        assertThrows(UnsupportedTypeException.class,
            () -> noise.generate(SynthParams.of("interference_type", "radio")));
        assertThrows(UnsupportedTypeException.class,
            () -> noise.generate(SynthParams.of("electrode_artifact", "loose")));
    }

    @Test
    void sameSeedSameNoise() {
        SynthParams params = SynthParams.of("interference_type", "environmental", "random_seed", 77);
        assertArrayEquals(noise.generate(params).toArray(),
            new NoiseSynthesizer(1000, 2.0).generate(params).toArray());
        double[] other = noise.generate(params.with("random_seed", 78)).toArray();
        assertFalse(Arrays.equals(other, noise.generate(params).toArray()));
    }
}
