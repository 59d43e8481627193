package io.nosqlbench.biosynth.eog;

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
import io.nosqlbench.biosynth.model.exceptions.InsufficientDurationException;
import io.nosqlbench.biosynth.model.exceptions.InvalidParameterException;
import io.nosqlbench.biosynth.model.exceptions.UnsupportedTypeException;
import io.nosqlbench.biosynth.model.random.SynthRandom;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link EogSynthesizer}: saccades, pursuit, fixation and blinks.
 */
@Tag("unit")
public class EogSynthesizerTest {

    private final EogSynthesizer eog = new EogSynthesizer(1000, 1.0, SynthRandom.seeded(5L));

    @Test
    void singleSaccadeReachesAndHoldsItsAmplitude() {
        Signal out = eog.generate(SynthParams.of("amplitudes", List.of(20)));
        assertEquals(0.0, out.get(0), 0.5);
        assertThat(out.max()).isCloseTo(20.0, within(1e-9));
        assertEquals(20.0, out.get(out.length() - 1), 1e-9);
        assertThat(out.get(30)).isBetween(0.0, 20.0);
    }

    @Test
    void releasedSaccadeReturnsToZero() {
        Signal out = eog.generate(SynthParams.of("amplitudes", List.of(20), "hold_position", false));
        assertThat(out.max()).isCloseTo(20.0, within(1e-9));
        assertEquals(0.0, out.get(out.length() - 1));
    }

    @Test
    void downwardSaccadesAreNegative() {
        Signal down = eog.generate(SynthParams.of("amplitudes", List.of(20), "directions", List.of("down")));
        assertEquals(-20.0, down.get(down.length() - 1), 1e-9);
        Signal pattern = eog.generate(SynthParams.of("amplitudes", List.of(20), "pattern", "down"));
        assertEquals(down, pattern);
    }

    @Test
    void upThenDownEndsAtRest() {
        Signal out = eog.generate(SynthParams.of(
            "amplitudes", List.of(10, 10),
            "directions", List.of("up", "down")));
        assertThat(out.max()).isCloseTo(10.0, within(1e-9));
        assertEquals(0.0, out.get(out.length() - 1), 1e-9);
    }

    @Test
    void perSaccadeListsMustMatch() {
        InvalidParameterException directions = assertThrows(InvalidParameterException.class,
            () -> eog.generate(SynthParams.of("amplitudes", List.of(10, 10),
                "directions", List.of("up", "down", "horizontal"))));
        assertEquals("directions", directions.getParameter());
        InvalidParameterException durations = assertThrows(InvalidParameterException.class,
            () -> eog.generate(SynthParams.of("amplitudes", List.of(10), "durations", List.of(0.05, 0.06))));
        assertEquals("durations", durations.getParameter());
        assertThrows(InvalidParameterException.class,
            () -> eog.generate(SynthParams.of("amplitudes", List.of(10), "peak_velocities", List.of(0))));

        Signal broadcast = eog.generate(SynthParams.of("amplitudes", List.of(5, 5), "durations", List.of(0.1)));
        assertEquals(10.0, broadcast.get(broadcast.length() - 1), 1e-9);
    }

    @Test
    void saccadeCrossingTheEndIsSkippedByDefault() {
        EogSynthesizer brief = new EogSynthesizer(1000, 0.1);
        SynthParams params = SynthParams.of("amplitudes", List.of(10, 10));
        Signal skipped = brief.generate(params);
        assertEquals(10.0, skipped.get(99), 1e-9);
        Signal clipped = brief.generate(params.with("placement_policy", "clip"));
        assertThat(clipped.get(99)).isGreaterThan(10.0);
    }

    @Test
    void randomSaccadesStayWithinAmplitude() {
        Signal out = eog.generate(SynthParams.of("n_saccades", 3, "amplitude", 5, "hold_position", false, "random_seed", 8));
        assertThat(out.peakAbs()).isLessThanOrEqualTo(5.0 + 1e-9);
        assertEquals(0, eog.generate(SynthParams.of("n_saccades", 0)).countNonZero());
    }

    @Test
    void customPursuitNeedsATrajectory() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
            () -> eog.generate(SynthParams.of("movement_type", "pursuit", "pattern", "custom")));
        assertEquals("trajectory", e.getParameter());

        Signal out = eog.generate(SynthParams.of("movement_type", "pursuit", "pattern", "custom",
            "trajectory", List.of(0, 10)));
        assertEquals(0.0, out.get(0), 1e-12);
        assertEquals(10.0, out.get(out.length() - 1), 1e-12);
        assertThat(out.get(500)).isCloseTo(5.0, within(0.02));

        Signal alias = eog.generate(SynthParams.of("movement_type", "pursuit", "pattern", "custom",
            "custom_trajectory", List.of(0, 10), "direction", "down"));
        assertEquals(-10.0, alias.get(alias.length() - 1), 1e-12);
    }

    @Test
    void pursuitPatterns() {
        EogSynthesizer slow = new EogSynthesizer(250, 4.0);
        Signal sine = slow.generate(SynthParams.of("movement_type", "pursuit", "pattern", "sinusoidal",
            "amplitude", 5));
        assertThat(sine.peakAbs()).isCloseTo(5.0, within(1e-9));

        Signal circle = slow.generate(SynthParams.of("movement_type", "pursuit", "pattern", "circular", "amplitude", 5));
        assertEquals(5.0, circle.get(0), 1e-12);
        Signal vertical = slow.generate(SynthParams.of("movement_type", "pursuit", "pattern", "circular",
            "amplitude", 5, "direction", "vertical"));
        assertEquals(0.0, vertical.get(0), 1e-12);

        Signal linear = slow.generate(SynthParams.of("movement_type", "pursuit"));
        assertEquals(-10.0, linear.get(0), 1e-12);
        assertThat(linear.max()).isGreaterThan(9.0);
        assertThrows(UnsupportedTypeException.class,
            () -> slow.generate(SynthParams.of("movement_type", "pursuit", "pattern", "zigzag")));
    }

    @Test
    void fixationWithoutDriftIsTremor() {
        Signal out = eog.generate(SynthParams.of("movement_type", "fixation",
            "drift_amplitude", 0, "microsaccade_rate", 0, "tremor_amplitude", 0.1));
        assertThat(out.peakAbs()).isLessThanOrEqualTo(0.15 + 1e-12).isGreaterThan(0.05);

        Signal full = eog.generate(SynthParams.of("movement_type", "fixation", "random_seed", 4));
        assertTrue(full.stream().allMatch(Double::isFinite));
        assertThrows(InvalidParameterException.class,
            () -> eog.generate(SynthParams.of("movement_type", "fixation", "microsaccade_rate", -1)));
    }

    @Test
    void blinksAreAddedAndSeparated() {
        EogSynthesizer calm = new EogSynthesizer(250, 5.0);
        Signal out = calm.generate(SynthParams.of("n_saccades", 0, "add_blinks", true, "n_blinks", 3,
            "natural_blink_variability", false, "random_seed", 6));
        assertThat(out.max()).isLessThanOrEqualTo(1.2 + 1e-12).isGreaterThan(1.0);
        int rising = 0;
        for (int i = 1; i < out.length(); i++) {
            if (out.get(i - 1) < 0.6 && out.get(i) >= 0.6) {
                rising++;
            }
        }
        assertEquals(3, rising);
    }

    @Test
    void impossibleBlinksFailBeforeRendering() {
        EogSynthesizer tight = new EogSynthesizer(250, 2.0);
        InsufficientDurationException e = assertThrows(InsufficientDurationException.class,
            () -> tight.generate(SynthParams.of("add_blinks", true, "n_blinks", 10)));
        assertThat(e.getRequired()).isCloseTo(6.5, within(1e-9));
        assertEquals(2.0, e.getAvailable());
        assertThrows(InvalidParameterException.class,
            () -> tight.generate(SynthParams.of("add_blinks", true, "blink_amplitude_range", List.of(1.2, 0.8))));
    }

    @Test
    void directionNames() {
        assertSame(GazeDirection.VERTICAL, GazeDirection.fromName("UP"));
        assertEquals(-1.0, GazeDirection.DOWN.sign());
        assertThrows(UnsupportedTypeException.class, () -> GazeDirection.fromName("left"));
        assertThrows(UnsupportedTypeException.class,
            () -> eog.generate(SynthParams.of("movement_type", "vergence")));
    }
}
