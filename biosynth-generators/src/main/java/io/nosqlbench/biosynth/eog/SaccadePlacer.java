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
import io.nosqlbench.biosynth.model.TimeBase;

/**
 * Places saccade position kernels and, optionally, holds the gaze at the
 * reached position until the end of the record.
 *
 * <p>Saccade timing follows the main sequence unless overridden: duration
 * {@code 0.02 + 0.002 |A|} seconds and peak velocity {@code 200 + 20 |A|}
 * degrees per second for an amplitude of {@code A} degrees.
 */
final class SaccadePlacer {

    /** Pause between consecutive saccades of a sequence, in seconds. */
    static final double GAP = 0.05;

    private final TimeBase timeBase;
    private final SignalBuffer buffer;
    private final PlacementPolicy policy;
    private final boolean holdPosition;

    SaccadePlacer(TimeBase timeBase, SignalBuffer buffer, PlacementPolicy policy, boolean holdPosition) {
        this.timeBase = timeBase;
        this.buffer = buffer;
        this.policy = policy;
        this.holdPosition = holdPosition;
    }

    static double mainSequenceDuration(double amplitude) {
        return 0.02 + 0.002 * Math.abs(amplitude);
    }

    static double mainSequenceVelocity(double amplitude) {
        return 200.0 + 20.0 * Math.abs(amplitude);
    }

    /**
     * @param startTime seconds
     * @param amplitude signed displacement in degrees
     * @param duration seconds
     * @param peakVelocity degrees per second
     * @return true if the saccade was rendered
     */
    boolean place(double startTime, double amplitude, double duration, double peakVelocity) {
        ParameterChecks.positive("durations", duration);
        ParameterChecks.positive("peak_velocities", peakVelocity);
        double[] position = WaveformKernels.saccadePosition(amplitude, duration, peakVelocity, timeBase.samplingRate());
        if (position.length == 0) {
            return false;
        }
        int start = timeBase.indexOf(startTime);
        boolean placed = buffer.place(position, start, policy);
        if (placed && holdPosition) {
            int end = start + position.length;
            if (end < timeBase.nSamples()) {
                buffer.addConstant(end, timeBase.nSamples() - end, position[position.length - 1], PlacementPolicy.CLIP);
            }
        }
        return placed;
    }
}
