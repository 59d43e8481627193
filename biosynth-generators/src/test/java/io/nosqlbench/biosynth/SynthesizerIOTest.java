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

import io.nosqlbench.biosynth.ecg.EcgSynthesizer;
import io.nosqlbench.biosynth.eog.EogSynthesizer;
import io.nosqlbench.biosynth.model.exceptions.UnsupportedTypeException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the SPI-based {@link SynthesizerIO} factory.
 */
@Tag("unit")
public class SynthesizerIOTest {

    @Test
    void testAllFamiliesRegistered() {
        assertThat(SynthesizerIO.getAvailableNames()).containsExactly("noise", "emg", "ecg", "eog");
    }

    @Test
    void testLookupIgnoresCase() {
        assertTrue(SynthesizerIO.isAvailable("EOG"));
        assertTrue(SynthesizerIO.get(" ecg ").isPresent());
        assertFalse(SynthesizerIO.get(null).isPresent());

        Synthesizer ecg = SynthesizerIO.create("ECG", 500, 2);
        assertInstanceOf(EcgSynthesizer.class, ecg);
        assertEquals("ecg", ecg.family());
        assertEquals(1000, ecg.nSamples());
        assertInstanceOf(EogSynthesizer.class, SynthesizerIO.create("eog", 250, 1));
    }

    @Test
    void testUnknownFamily() {
        UnsupportedTypeException e = assertThrows(UnsupportedTypeException.class,
            () -> SynthesizerIO.create("eeg", 250, 1));
        assertEquals("eeg", e.getTypeName());
        assertThat(e.getMessage()).contains("emg", "ecg", "eog", "noise");
    }

    @Test
    void testReloadKeepsProviders() {
        SynthesizerIO.reload();
        assertThat(SynthesizerIO.getAvailableNames()).hasSize(4);
    }
}
