package io.nosqlbench.biosynth.model;

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

import io.nosqlbench.biosynth.model.exceptions.InvalidParameterException;
import io.nosqlbench.biosynth.model.exceptions.SynthesisException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class TimeBaseTest {

    @ParameterizedTest
    @CsvSource({
        "1000, 1.0, 1000",
        "500, 10.0, 5000",
        "250, 0.5, 125",
        "333, 1.0, 333",
        "100, 0.004, 0",
        "44.1, 3.0, 132"
    })
    void sampleCountIsRoundedProduct(double rate, double duration, int expected) {
        if (expected == 0) {
            assertThrows(InvalidParameterException.class, () -> TimeBase.of(rate, duration));
            return;
        }
        TimeBase tb = TimeBase.of(rate, duration);
        assertEquals(expected, tb.nSamples());
        assertEquals(expected, tb.time().length());
    }

    @Test
    void timeVectorStartsAtZeroAndStepsByPeriod() {
        TimeBase tb = TimeBase.of(200, 2.0);
        Signal t = tb.time();
        assertEquals(0.0, t.get(0));
        assertEquals(0.005, t.get(1), 1e-12);
        assertEquals((tb.nSamples() - 1) / 200.0, t.get(tb.nSamples() - 1), 1e-12);
        assertEquals(tb.samplePeriod(), tb.timeAt(1), 1e-15);
    }

    @Test
    void indexOfFloorsAndToleratesRepresentationError() {
        TimeBase tb = TimeBase.of(1000, 1.0);
        assertEquals(300, tb.indexOf(0.3));
        assertEquals(12, tb.indexOf(0.0129));
        assertEquals(-200, tb.indexOf(-0.2));
        assertEquals(1000, tb.indexOf(1.0));
    }

    @Test
    void samplesForRounds() {
        TimeBase tb = TimeBase.of(250, 4.0);
        assertEquals(25, tb.samplesFor(0.1));
        assertEquals(0, tb.samplesFor(0.0));
        assertEquals(1, tb.samplesFor(0.003));
    }

    @Test
    void rejectsNonPositiveOrNonFiniteInputs() {
        InvalidParameterException rate = assertThrows(InvalidParameterException.class, () -> TimeBase.of(0, 1));
        assertEquals("sampling_rate", rate.getParameter());
        assertThrows(InvalidParameterException.class, () -> TimeBase.of(Double.NaN, 1));
        InvalidParameterException duration = assertThrows(InvalidParameterException.class, () -> TimeBase.of(100, -1));
        assertEquals("duration", duration.getParameter());
        assertThrows(SynthesisException.class, () -> TimeBase.of(100, Double.POSITIVE_INFINITY));
    }

    @Test
    void withDurationKeepsRate() {
        TimeBase tb = TimeBase.of(100, 1.0).withDuration(2.5);
        assertEquals(100, tb.samplingRate());
        assertEquals(250, tb.nSamples());
    }
}
