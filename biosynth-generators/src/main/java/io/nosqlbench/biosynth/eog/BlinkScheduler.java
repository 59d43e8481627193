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

import io.nosqlbench.biosynth.kernels.WaveformKernels;
import io.nosqlbench.biosynth.model.ParameterChecks;
import io.nosqlbench.biosynth.model.PlacementPolicy;
import io.nosqlbench.biosynth.model.SignalBuffer;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.exceptions.InsufficientDurationException;
import io.nosqlbench.biosynth.model.exceptions.InvalidParameterException;
import io.nosqlbench.biosynth.model.random.SynthRandom;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/// Eye blinks added on top of an EOG record.
///
/// | Key | Default |
/// |-----|---------|
/// | `n_blinks` | 3 |
/// | `blink_duration` | 0.2 s |
/// | `blink_amplitude_range` | [0.8, 1.2] |
/// | `min_blink_interval` | 0.5 s between blink starts |
/// | `natural_blink_variability` | true |
///
/// Start times are drawn from `U(0, duration - blink_duration)` and rejected
/// when closer than `min_blink_interval` to an accepted start. With natural
/// variability each blink's duration is jittered by `U(0.8, 1.2)`, its
/// amplitude drawn from the range, and one blink in five is a partial blink
/// scaled by `U(0.3, 0.7)`; without it every blink has the nominal duration
/// and the upper amplitude. Blinks running past the end of the record are
/// clipped.
final class BlinkScheduler {

    private static final Logger logger = LogManager.getLogger(BlinkScheduler.class);

    static final int MAX_ATTEMPTS_PER_BLINK = 1000;

    private final int count;
    private final double blinkDuration;
    private final double minAmplitude;
    private final double maxAmplitude;
    private final double minInterval;
    private final boolean naturalVariability;

    private BlinkScheduler(int count, double blinkDuration, double minAmplitude, double maxAmplitude,
                           double minInterval, boolean naturalVariability) {
        this.count = count;
        this.blinkDuration = blinkDuration;
        this.minAmplitude = minAmplitude;
        this.maxAmplitude = maxAmplitude;
        this.minInterval = minInterval;
        this.naturalVariability = naturalVariability;
    }

    static BlinkScheduler from(SynthParams params) {
        int count = ParameterChecks.nonNegative("n_blinks", params.getInt("n_blinks", 3));
        double duration = ParameterChecks.positive("blink_duration", params.getDouble("blink_duration", 0.2));
        double[] range = params.getDoubles("blink_amplitude_range");
        if (range == null) {
            range = new double[]{0.8, 1.2};
        }
        if (range.length != 2 || !(range[0] <= range[1])) {
            throw new InvalidParameterException("blink_amplitude_range",
                "expected [min, max] with min <= max, got " + Arrays.toString(range));
        }
        double minInterval = ParameterChecks.nonNegative("min_blink_interval", params.getDouble("min_blink_interval", 0.5));
        boolean natural = params.getBoolean("natural_blink_variability", true);
        return new BlinkScheduler(count, duration, range[0], range[1], minInterval, natural);
    }

    /// Checks that the blinks fit before anything is drawn.
    ///
    /// @throws InsufficientDurationException if `n * blink_duration + (n - 1) * min_blink_interval`
    ///     exceeds the record
    void checkFeasible(TimeBase tb) {
        if (count == 0) {
            return;
        }
        double required = count * blinkDuration + (count - 1) * minInterval;
        if (required > tb.duration()) {
            throw new InsufficientDurationException("n_blinks", required, tb.duration());
        }
    }

    /// @return sorted start times in seconds
    double[] startTimes(TimeBase tb, SynthRandom rng) {
        checkFeasible(tb);
        double latest = tb.duration() - blinkDuration;
        double[] starts = new double[count];
        int accepted = 0;
        int attempts = 0;
        while (accepted < count && attempts < MAX_ATTEMPTS_PER_BLINK * count) {
            attempts++;
            double candidate = rng.uniform(0.0, latest);
            if (spacedFrom(candidate, starts, accepted)) {
                starts[accepted++] = candidate;
            }
        }
        if (accepted < count) {
            logger.warn("placed {} of {} blinks after {} attempts, spreading them evenly over the slack instead",
                accepted, count, attempts);
            return spread(latest, rng);
        }
        Arrays.sort(starts);
        return starts;
    }

    private boolean spacedFrom(double candidate, double[] starts, int accepted) {
        for (int i = 0; i < accepted; i++) {
            if (Math.abs(candidate - starts[i]) < minInterval) {
                return false;
            }
        }
        return true;
    }

    /// Sorted uniform offsets within the slack, each pushed back by one interval per predecessor.
    private double[] spread(double latest, SynthRandom rng) {
        double slack = Math.max(0.0, latest - (count - 1) * minInterval);
        double[] offsets = slack > 0.0 ? rng.uniforms(count, 0.0, slack) : new double[count];
        Arrays.sort(offsets);
        for (int i = 0; i < count; i++) {
            offsets[i] += i * minInterval;
        }
        return offsets;
    }

    /// Schedules and renders all blinks into the buffer.
    ///
    /// @return how many blinks were drawn
    int render(TimeBase tb, SynthRandom rng, SignalBuffer buffer) {
        double[] starts = startTimes(tb, rng);
        for (double start : starts) {
            double duration = blinkDuration;
            double amplitude = maxAmplitude;
            if (naturalVariability) {
                duration *= rng.uniform(0.8, 1.2);
                amplitude = minAmplitude == maxAmplitude ? minAmplitude : rng.uniform(minAmplitude, maxAmplitude);
                if (rng.bernoulli(0.2)) {
                    amplitude *= rng.uniform(0.3, 0.7);
                }
            }
            double[] blink = WaveformKernels.blinkProfile(amplitude, duration, tb.samplingRate());
            buffer.place(blink, tb.indexOf(start), PlacementPolicy.CLIP);
        }
        return starts.length;
    }
}
