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

import io.nosqlbench.biosynth.TypeNames;
import io.nosqlbench.biosynth.kernels.WaveformKernels;
import io.nosqlbench.biosynth.model.EventSchedule;
import io.nosqlbench.biosynth.model.ParameterChecks;
import io.nosqlbench.biosynth.model.WaveformKernel;
import io.nosqlbench.biosynth.model.exceptions.InvalidParameterException;

/**
 * Cardiac conditions selected by {@code condition}. An absent condition, or
 * {@code none} or {@code normal}, renders normal sinus rhythm.
 *
 * <p>Every condition reads {@code heart_rate} (75 bpm) and {@code hrv_std}
 * (0 s) unless noted; ischemic and conduction conditions also read
 * {@code severity} in {@code [0, 1]} (0.5).
 */
public enum CardiacCondition {

    NORMAL {
        @Override
        void render(BeatContext ctx) {
            sinus(ctx, ctx.heartRate());
        }
    },

    /** Premature ventricular contractions: with probability {@code pvc_frequency} a beat is a 2.5x QRS alone. */
    PVC {
        @Override
        void render(BeatContext ctx) {
            double pvcFrequency = ParameterChecks.unitInterval("pvc_frequency",
                ctx.params().getDouble("pvc_frequency", 0.2));
            WaveformKernel pvc = ctx.morphology().qrs().scaled(2.5);
            for (double beat : schedule(ctx, ctx.heartRate()).toArray()) {
                if (ctx.rng().bernoulli(pvcFrequency)) {
                    ctx.place(pvc, beat);
                } else {
                    ctx.normalBeat(beat);
                }
            }
        }
    },

    /**
     * Atrial fibrillation: no P waves, ventricular response uniform between
     * {@code af_rate_min} and {@code af_rate_max} bpm (80 and 160), also
     * accepted as a two-element {@code af_rate} list.
     */
    AF {
        @Override
        void render(BeatContext ctx) {
            double[] range = ctx.params().getDoubles("af_rate");
            double min;
            double max;
            if (range != null) {
                if (range.length != 2) {
                    throw new InvalidParameterException("af_rate", "expected [min, max], got " + range.length + " values");
                }
                min = range[0];
                max = range[1];
            } else {
                min = ctx.params().getDouble("af_rate_min", 80.0);
                max = ctx.params().getDouble("af_rate_max", 160.0);
            }
            ParameterChecks.positive("af_rate_min", min);
            ParameterChecks.greaterThan("af_rate_max", max, min);
            EventSchedule beats = BeatScheduler.uniform(ctx.timeBase(), 60.0 / max, 60.0 / min, ctx.rng());
            for (double beat : beats.toArray()) {
                ctx.ventricularBeat(beat);
            }
        }
    },

    /** Sinus bradycardia at 45 bpm. */
    BRADY {
        @Override
        void render(BeatContext ctx) {
            sinus(ctx, 45.0);
        }
    },

    /** Sinus tachycardia at 120 bpm. */
    TACHY {
        @Override
        void render(BeatContext ctx) {
            sinus(ctx, 120.0);
        }
    },

    /**
     * AV block of {@code heart_block_degree} 1 to 3. First degree delays the
     * QRS to 0.3 s after the P wave; second degree drops every other
     * ventricular response; third degree dissociates the ventricles, which
     * beat at {@code escape_rate} (heart_rate / 2.5) from a first escape
     * 0.2 to 0.4 s into the record.
     */
    HEART_BLOCK {
        @Override
        void render(BeatContext ctx) {
            int degree = ParameterChecks.inRange("heart_block_degree",
                ctx.params().getInt("heart_block_degree", 1), 1, 3);
            double heartRate = ctx.heartRate();
            double[] beats = schedule(ctx, heartRate).toArray();
            WaveMorphology m = ctx.morphology();
            for (int i = 0; i < beats.length; i++) {
                ctx.place(m.pWave(), beats[i]);
                if (degree == 1) {
                    ctx.ventricularBeat(beats[i] + 0.1);
                } else if (degree == 2 && i % 2 == 0) {
                    ctx.ventricularBeat(beats[i]);
                }
            }
            if (degree == 3) {
                double escapeRate = ParameterChecks.positive("escape_rate",
                    ctx.params().getDouble("escape_rate", heartRate / 2.5));
                double first = ctx.rng().uniform(0.2, 0.4);
                for (double escape : BeatScheduler.fixed(ctx.timeBase(), first, escapeRate).toArray()) {
                    ctx.ventricularBeat(escape);
                }
            }
        }
    },

    /** ST segment raised by {@code 0.3 * severity} for 0.1 s from 0.1 s after each beat. */
    ST_ELEVATION {
        @Override
        void render(BeatContext ctx) {
            stShift(ctx, 0.3 * ctx.severity());
        }
    },

    /** ST segment lowered by {@code 0.2 * severity}. */
    ST_DEPRESSION {
        @Override
        void render(BeatContext ctx) {
            stShift(ctx, -0.2 * ctx.severity());
        }
    },

    /** T wave replaced by {@code -severity} times itself. */
    T_WAVE_INVERSION {
        @Override
        void render(BeatContext ctx) {
            WaveMorphology m = ctx.morphology();
            WaveformKernel inverted = m.tWave().scaled(-ctx.severity());
            for (double beat : schedule(ctx, ctx.heartRate()).toArray()) {
                ctx.place(m.pWave(), beat);
                ctx.place(m.qrs(), beat);
                ctx.place(inverted, beat);
            }
        }
    },

    /** Pathological Q: a {@code -0.4 * severity} pulse for 40 ms ending at the QRS. */
    Q_WAVE {
        @Override
        void render(BeatContext ctx) {
            double depth = -0.4 * ctx.severity();
            for (double beat : schedule(ctx, ctx.heartRate()).toArray()) {
                ctx.normalBeat(beat);
                ctx.constant(beat - 0.04, 0.04, depth);
            }
        }
    },

    /** Left bundle branch block: widened notched QRS, lobes 0.8, 1, 0.8. */
    LBBB {
        @Override
        void render(BeatContext ctx) {
            bundleBranchBlock(ctx, 0.8, 1.0, 0.8);
        }
    },

    /** Right bundle branch block: widened QRS, lobes -0.5, 1, 0.7. */
    RBBB {
        @Override
        void render(BeatContext ctx) {
            bundleBranchBlock(ctx, -0.5, 1.0, 0.7);
        }
    },

    /** Pre-excitation: short PR of 0.08 s and a delta ramp before the QRS. */
    WPW {
        @Override
        void render(BeatContext ctx) {
            double severity = ctx.severity();
            WaveMorphology m = ctx.morphology();
            WaveformKernel p = m.pWave().withOffset(0.0);
            int deltaSamples = ctx.timeBase().samplesFor(0.04 * severity);
            double[] delta = WaveformKernels.linspace(0.0, 0.3 * severity, deltaSamples);
            double deltaSeconds = deltaSamples / ctx.samplingRate();
            for (double beat : schedule(ctx, ctx.heartRate()).toArray()) {
                double deltaStart = beat + 0.08;
                double qrsStart = deltaStart + deltaSeconds;
                ctx.place(p, beat);
                ctx.placeAt(delta, deltaStart, 1.0);
                ctx.place(m.qrs(), qrsStart);
                ctx.placeAt(m.tWave().samples(), qrsStart + m.qrsDuration() + 0.05, 1.0);
            }
        }
    },

    /** Left anterior fascicular block: small q, tall R of 1.5, small s; PR 0.16 s. */
    LAFB {
        @Override
        void render(BeatContext ctx) {
            double qrsDuration = 0.08 + 0.04 * ctx.severity();
            double[] qrs = WaveformKernels.qrsComplex(-0.2, 1.5, -0.3, qrsDuration, ctx.samplingRate());
            conductionBeats(ctx, qrs, qrsDuration, 0.16);
        }
    };

    public static final String PARAM = "condition";

    abstract void render(BeatContext ctx);

    public String paramName() {
        return TypeNames.paramName(this);
    }

    /**
     * @param name condition name; null, {@code none} and {@code normal} select {@link #NORMAL}
     * @return the condition
     */
    public static CardiacCondition fromName(String name) {
        if (name == null || name.isBlank() || name.trim().equalsIgnoreCase("none")) {
            return NORMAL;
        }
        return TypeNames.fromName("cardiac condition", CardiacCondition.class, name);
    }

    static EventSchedule schedule(BeatContext ctx, double heartRate) {
        return BeatScheduler.sinus(ctx.timeBase(), heartRate, ctx.hrvStd(), ctx.rng());
    }

    static void sinus(BeatContext ctx, double heartRate) {
        for (double beat : schedule(ctx, heartRate).toArray()) {
            ctx.normalBeat(beat);
        }
    }

    static void stShift(BeatContext ctx, double shift) {
        for (double beat : schedule(ctx, ctx.heartRate()).toArray()) {
            ctx.normalBeat(beat);
            ctx.constant(beat + 0.1, 0.1, shift);
        }
    }

    static void bundleBranchBlock(BeatContext ctx, double q, double r, double s) {
        double qrsDuration = 0.12 + 0.08 * ctx.severity();
        double[] qrs = WaveformKernels.qrsComplex(q, r, s, qrsDuration, ctx.samplingRate());
        conductionBeats(ctx, qrs, qrsDuration, 0.04);
    }

    /** P at its usual offset, a custom QRS at {@code qrsDelay}, and the T wave 50 ms after the QRS ends. */
    static void conductionBeats(BeatContext ctx, double[] qrs, double qrsDuration, double qrsDelay) {
        WaveMorphology m = ctx.morphology();
        double[] t = m.tWave().samples();
        for (double beat : schedule(ctx, ctx.heartRate()).toArray()) {
            ctx.place(m.pWave(), beat);
            ctx.placeAt(qrs, beat + qrsDelay, 1.0);
            ctx.placeAt(t, beat + qrsDelay + qrsDuration + 0.05, 1.0);
        }
    }
}
