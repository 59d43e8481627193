package io.nosqlbench.biosynth.ecg;

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
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.WaveformKernel;

/// Shape of the P wave, QRS complex and T wave of one normal beat.
///
/// | Key (alias) | Fields | Defaults |
/// |-------------|--------|----------|
/// | `p_wave` (`p_wave_params`) | `amplitude`, `duration` | 0.2, 0.1 s |
/// | `qrs` (`qrs_params`) | `q_amp`, `r_amp`, `s_amp`, `duration` | -0.5, 1.0, -0.2, 0.1 s |
/// | `t_wave` (`t_wave_params`) | `amplitude`, `duration` | 0.3, 0.14 s |
///
/// Relative to the beat time, the P wave starts at -0.2 s, the QRS at 0 and
/// the T wave at +0.2 s.
public final class WaveMorphology {

    public static final double P_OFFSET = -0.2;
    public static final double T_OFFSET = 0.2;

    private final double pAmplitude;
    private final double pDuration;
    private final double qAmplitude;
    private final double rAmplitude;
    private final double sAmplitude;
    private final double qrsDuration;
    private final double tAmplitude;
    private final double tDuration;

    private final WaveformKernel pWave;
    private final WaveformKernel qrs;
    private final WaveformKernel tWave;

    private WaveMorphology(SynthParams p, SynthParams q, SynthParams t, double samplingRate) {
        this.pAmplitude = ParameterChecks.finite("p_wave.amplitude", p.getDouble("amplitude", 0.2));
        this.pDuration = ParameterChecks.positive("p_wave.duration", p.getDouble("duration", 0.1));
        this.qAmplitude = ParameterChecks.finite("qrs.q_amp", q.getDouble("q_amp", -0.5));
        this.rAmplitude = ParameterChecks.finite("qrs.r_amp", q.getDouble("r_amp", 1.0));
        this.sAmplitude = ParameterChecks.finite("qrs.s_amp", q.getDouble("s_amp", -0.2));
        this.qrsDuration = ParameterChecks.positive("qrs.duration", q.getDouble("duration", 0.1));
        this.tAmplitude = ParameterChecks.finite("t_wave.amplitude", t.getDouble("amplitude", 0.3));
        this.tDuration = ParameterChecks.positive("t_wave.duration", t.getDouble("duration", 0.14));

        this.pWave = WaveformKernel.of(WaveformKernels.gaussianBump(pAmplitude, pDuration, samplingRate), P_OFFSET);
        this.qrs = WaveformKernel.anchored(
            WaveformKernels.qrsComplex(qAmplitude, rAmplitude, sAmplitude, qrsDuration, samplingRate));
        this.tWave = WaveformKernel.of(WaveformKernels.gaussianBump(tAmplitude, tDuration, samplingRate), T_OFFSET);
    }

    public static WaveMorphology from(SynthParams params, double samplingRate) {
        return new WaveMorphology(
            nested(params, "p_wave", "p_wave_params"),
            nested(params, "qrs", "qrs_params"),
            nested(params, "t_wave", "t_wave_params"),
            samplingRate);
    }

    public static WaveMorphology defaults(double samplingRate) {
        return from(SynthParams.empty(), samplingRate);
    }

    private static SynthParams nested(SynthParams params, String key, String alias) {
        return params.has(key) ? params.getParams(key) : params.getParams(alias);
    }

    public WaveformKernel pWave() {
        return pWave;
    }

    public WaveformKernel qrs() {
        return qrs;
    }

    public WaveformKernel tWave() {
        return tWave;
    }

    public double qrsDuration() {
        return qrsDuration;
    }

    public double tAmplitude() {
        return tAmplitude;
    }

    @Override
    public String toString() {
        return "WaveMorphology{p=" + pAmplitude + "/" + pDuration
            + ", qrs=" + qAmplitude + "/" + rAmplitude + "/" + sAmplitude + "/" + qrsDuration
            + ", t=" + tAmplitude + "/" + tDuration + "}";
    }
}
