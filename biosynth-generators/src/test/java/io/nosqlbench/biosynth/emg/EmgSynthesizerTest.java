package io.nosqlbench.biosynth.emg;

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
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link EmgSynthesizer} and its contraction patterns.
 */
@Tag("unit")
public class EmgSynthesizerTest {

    private final EmgSynthesizer emg = new EmgSynthesizer(1000, 2.0, SynthRandom.seeded(17L));

    @ParameterizedTest
    @EnumSource(value = ContractionPattern.class, names = {"ISOMETRIC", "DYNAMIC", "REPETITIVE"})
    void simplePatternsRender(ContractionPattern pattern) {
        Signal out = emg.generate(SynthParams.of("pattern_type", pattern.paramName(), "random_seed", 1));
        assertEquals(2000, out.length());
        assertThat(out.countNonZero()).isPositive();
    }

    @Test
    void strongerContractionIsLouder() {
        Signal weak = emg.generate(SynthParams.of("intensity", 0.0, "random_seed", 2));
        Signal strong = emg.generate(SynthParams.of("intensity", 1.0, "random_seed", 2));
        assertThat(strong.stdDev()).isGreaterThan(weak.stdDev());
        assertThat(strong.countNonZero()).isGreaterThan(weak.countNonZero());
    }

    @Test
    void activationLevelIsAnAliasForIntensity() {
        Signal a = emg.generate(SynthParams.of("activation_level", 0.9, "random_seed", 4));
        Signal b = emg.generate(SynthParams.of("intensity", 0.9, "random_seed", 4));
        assertEquals(a, b);
    }

    @Test
    void shortIsometricContractionLeavesTheRestSilent() {
        Signal out = emg.generate(SynthParams.of("intensity", 0.8, "duration", 0.5, "random_seed", 3));
        for (int i = 510; i < out.length(); i++) {
            assertEquals(0.0, out.get(i), "sample " + i);
        }
        assertThat(out.countNonZero()).isPositive();
        assertThrows(InvalidParameterException.class,
            () -> emg.generate(SynthParams.of("duration", 2.5)));
    }

    @Test
    void intensityOutsideTheUnitIntervalIsRejected() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
            () -> emg.generate(SynthParams.of("intensity", 1.2)));
        assertEquals("intensity", e.getParameter());
        assertThrows(InvalidParameterException.class,
            () -> emg.generate(SynthParams.of("pattern_type", "repetitive", "rest_intensity", -0.1)));
    }

    @Test
    void dynamicPatternOptions() {
        Signal sine = emg.generate(SynthParams.of("pattern_type", "dynamic", "ramp_type", "sine", "random_seed", 5));
        assertEquals(2000, sine.length());
        Signal custom = emg.generate(SynthParams.of("pattern_type", "dynamic",
            "envelope", List.of(0.0, 1.0, 0.0), "random_seed", 5));
        assertEquals(2000, custom.length());
        assertThrows(UnsupportedTypeException.class,
            () -> emg.generate(SynthParams.of("pattern_type", "dynamic", "ramp_type", "square")));
        assertThrows(InvalidParameterException.class,
            () -> emg.generate(SynthParams.of("pattern_type", "dynamic", "envelope", List.of())));
    }

    @Test
    void complexPatternFromParallelLists() {
        Signal out = emg.generate(SynthParams.of("pattern_type", "complex",
            "movement_types", List.of("isometric", "dynamic", "repetitive"),
            "durations", List.of(0.5, 0.5, 0.5),
            "intensities", List.of(0.6, 0.8, 0.4),
            "random_seed", 6));
        assertEquals(2000, out.length());
        for (int i = 1510; i < out.length(); i++) {
            assertEquals(0.0, out.get(i), "sample " + i);
        }
    }

    @Test
    void complexPatternFromMovementMaps() {
        Signal out = emg.generate(SynthParams.of("pattern_type", "complex",
            "movements", List.of(
                Map.of("type", "isometric", "duration", 1.0, "intensity", 0.7),
                Map.of("type", "dynamic", "duration", 1.0)),
            "random_seed", 6));
        assertThat(out.countNonZero()).isPositive();

        assertThrows(InvalidParameterException.class, () -> emg.generate(SynthParams.of("pattern_type", "complex",
            "movements", List.of(Map.of("type", "isometric")))));
    }

    @Test
    void complexPatternMustFitTheRecord() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
            () -> emg.generate(SynthParams.of("pattern_type", "complex",
                "movement_types", List.of("isometric", "dynamic"),
                "durations", List.of(1.5, 1.0),
                "intensities", List.of(0.5, 0.5))));
        assertEquals("durations", e.getParameter());

        Signal overlapping = emg.generate(SynthParams.of("pattern_type", "complex",
            "movement_types", List.of("isometric", "dynamic"),
            "durations", List.of(1.5, 1.0),
            "intensities", List.of(0.5, 0.5),
            "overlap", true));
        assertEquals(2000, overlapping.length());
    }

    @Test
    void complexPatternListsMustAgree() {
        InvalidParameterException e = assertThrows(InvalidParameterException.class,
            () -> emg.generate(SynthParams.of("pattern_type", "complex",
                "movement_types", List.of("isometric", "dynamic"),
                "durations", List.of(1.0),
                "intensities", List.of(0.5, 0.5))));
        assertEquals("movements", e.getParameter());
        assertThrows(UnsupportedTypeException.class, () -> emg.generate(SynthParams.of("pattern_type", "complex",
            "movement_types", List.of("sprint"), "durations", List.of(1.0), "intensities", List.of(0.5))));
        assertThrows(InvalidParameterException.class, () -> emg.generate(SynthParams.of("pattern_type", "complex")));
    }

    @Test
    void fatigueScalesTheSameFirings() {
        Signal fresh = emg.generate(SynthParams.of("intensity", 0.7, "random_seed", 8));
        Signal tired = emg.generate(SynthParams.of("intensity", 0.7, "fatigue_rate", 2.0, "random_seed", 8));
        Signal flagged = emg.generate(SynthParams.of("intensity", 0.7, "fatigue", true, "random_seed", 8));
        TimeBase tb = emg.timeBase();
        for (int i = 0; i < fresh.length(); i++) {
            double expected = fresh.get(i) * Math.exp(-2.0 * tb.timeAt(i) / tb.duration());
            assertEquals(expected, tired.get(i), 1e-12);
        }
        assertEquals(tired, flagged);
    }

    @Test
    void fatigueRateMustNotBeNegative() {
        assertThrows(InvalidParameterException.class,
            () -> emg.generate(SynthParams.of("fatigue_rate", -1.0)));
        assertEquals(0.0, EmgSynthesizer.fatigueRate(SynthParams.empty()));
        assertEquals(EmgSynthesizer.DEFAULT_FATIGUE_RATE, EmgSynthesizer.fatigueRate(SynthParams.of("fatigue", true)));
        double[] envelope = EmgSynthesizer.fatigueEnvelope(emg.timeBase(), 1.0);
        assertEquals(1.0, envelope[0]);
        assertThat(envelope[envelope.length - 1]).isCloseTo(Math.exp(-1.0), within(1e-3));
    }

    @Test
    void firingProbabilityFollowsIntensity() {
        assertThat(MuapTrain.firingProbability(0.0, 1000)).isCloseTo(0.05, within(1e-12));
        assertThat(MuapTrain.firingProbability(1.0, 1000)).isCloseTo(0.5, within(1e-12));
        assertEquals(1.0, MuapTrain.firingProbability(1.0, 100));
    }

    @Test
    void unknownPatternIsRejected() {
        assertThrows(UnsupportedTypeException.class,
            () -> emg.generate(SynthParams.of("pattern_type", "explosive")));
    }
}
