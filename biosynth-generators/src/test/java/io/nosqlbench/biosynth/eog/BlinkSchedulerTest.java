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

import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.random.SynthRandom;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class BlinkSchedulerTest {

    @ParameterizedTest
    @ValueSource(longs = {1L, 2L, 3L, 4L, 5L})
    void startsAreSortedSpacedAndInside(long seed) {
        TimeBase tb = TimeBase.of(250, 10.0);
        BlinkScheduler blinks = BlinkScheduler.from(SynthParams.of("n_blinks", 6, "min_blink_interval", 1.0));
        assertSpaced(blinks.startTimes(tb, SynthRandom.seeded(seed)), 6, 1.0, 10.0 - 0.2);
    }

    @Test
    void tightScheduleStillHonorsTheInterval() {
        TimeBase tb = TimeBase.of(250, 2.4);
        BlinkScheduler blinks = BlinkScheduler.from(SynthParams.of("n_blinks", 4));
        assertSpaced(blinks.startTimes(tb, SynthRandom.seeded(9L)), 4, 0.5, 2.4 - 0.2);
    }

    @Test
    void zeroBlinksAlwaysFit() {
        TimeBase tb = TimeBase.of(250, 0.1);
        BlinkScheduler blinks = BlinkScheduler.from(SynthParams.of("n_blinks", 0));
        blinks.checkFeasible(tb);
        assertEquals(0, blinks.startTimes(tb, SynthRandom.seeded(1L)).length);
    }

    private static void assertSpaced(double[] starts, int count, double interval, double latest) {
        assertEquals(count, starts.length);
        for (int i = 0; i < starts.length; i++) {
            assertThat(starts[i]).isBetween(0.0, latest);
            if (i > 0) {
                assertThat(starts[i] - starts[i - 1]).isGreaterThanOrEqualTo(interval - 1e-9);
            }
        }
    }
}
