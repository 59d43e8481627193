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

import io.nosqlbench.biosynth.model.Signal;
import io.nosqlbench.biosynth.model.SignalBuffer;
import io.nosqlbench.biosynth.model.SynthParams;
import io.nosqlbench.biosynth.model.TimeBase;
import io.nosqlbench.biosynth.model.exceptions.InvalidParameterException;
import io.nosqlbench.biosynth.model.random.SynthRandom;
import io.nosqlbench.biosynth.noise.NoiseCatalog;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/// Shared base of the EMG, ECG, EOG and noise generators.
///
/// # Contract
///
/// A synthesizer is bound to one `(samplingRate, duration)` pair for its
/// whole life. Every signal it returns has exactly
/// `round(samplingRate * duration)` samples, and every noise layer or
/// artifact it adds is rendered on the same [TimeBase], so composition lines
/// up sample for sample.
///
/// ```java
/// Synthesizer ecg = new EcgSynthesizer(500, 10);
/// Signal clean = ecg.generate(SynthParams.of("heart_rate", 72, "random_seed", 7));
/// Signal noisy = ecg.addNoise(clean, "powerline", SynthParams.of("amplitude", 0.05));
/// Signal marked = ecg.addArtifact(noisy, "spike", 2.0, 0.0, 1.5);
/// ```
///
/// # Randomness
///
/// Each instance owns one [SynthRandom]. A `random_seed` entry in the
/// parameters restarts that stream immediately before generation; the
/// stream then continues from there for later calls on the same instance.
/// Instances are not thread-safe; use one per thread.
///
/// # Errors
///
/// Parameters are validated before any sample is rendered. A failing call
/// throws a [io.nosqlbench.biosynth.model.exceptions.SynthesisException]
/// and never returns a partial signal.
public abstract class Synthesizer {

    private static final Logger logger = LogManager.getLogger(Synthesizer.class);

    private final TimeBase timeBase;
    private final SynthRandom random;

    protected Synthesizer(double samplingRate, double duration) {
        this(samplingRate, duration, SynthRandom.unseeded());
    }

    protected Synthesizer(double samplingRate, double duration, SynthRandom random) {
        this.timeBase = TimeBase.of(samplingRate, duration);
        this.random = random;
    }

    public TimeBase timeBase() {
        return timeBase;
    }

    public double samplingRate() {
        return timeBase.samplingRate();
    }

    public double duration() {
        return timeBase.duration();
    }

    public int nSamples() {
        return timeBase.nSamples();
    }

    /// @return this instance's random stream
    public SynthRandom random() {
        return random;
    }

    /// @return the family name, as registered with [SynthesizerIO]
    public abstract String family();

    /// Generates one signal.
    ///
    /// @param params family-specific knobs, optionally `random_seed`
    /// @return a signal of `nSamples()` samples
    public final Signal generate(SynthParams params) {
        params.randomSeed().ifPresent(random::reseed);
        Signal signal = render(timeBase, params, random);
        if (signal.length() != timeBase.nSamples()) {
            throw new IllegalStateException(family() + " rendered " + signal.length()
                + " samples, expected " + timeBase.nSamples());
        }
        logger.debug("{} generated {} samples with {}", family(), signal.length(), params);
        return signal;
    }

    public final Signal generate() {
        return generate(SynthParams.empty());
    }

    /// Renders one signal on the given time base. Implementations take all
    /// randomness from `rng` and all sizing from `timeBase`.
    protected abstract Signal render(TimeBase timeBase, SynthParams params, SynthRandom rng);

    /// Adds one noise, artifact or interference layer to a signal.
    ///
    /// @param signal base signal of `nSamples()` samples
    /// @param noiseType any type name known to [NoiseCatalog]
    /// @param noiseParams layer knobs, optionally `random_seed`
    /// @return a new signal; the input is unchanged
    public Signal addNoise(Signal signal, String noiseType, SynthParams noiseParams) {
        requireLength(signal);
        NoiseCatalog.Entry entry = NoiseCatalog.resolve(noiseType);
        noiseParams.randomSeed().ifPresent(random::reseed);
        Signal noise = entry.render(timeBase, noiseParams, random);
        logger.debug("{} added {} noise layer", family(), entry.name());
        return signal.plus(noise);
    }

    /// Adds a single transient artifact.
    ///
    /// @param signal base signal of `nSamples()` samples
    /// @param artifactType one of [TransientArtifact]
    /// @param startTime seconds, in `[0, duration)`
    /// @param artifactDuration seconds, non-negative and shorter than the signal
    /// @param amplitude artifact amplitude
    /// @return a new signal; the input is unchanged
    public Signal addArtifact(Signal signal, String artifactType, double startTime,
                              double artifactDuration, double amplitude) {
        requireLength(signal);
        TransientArtifact artifact = TransientArtifact.fromName(artifactType);
        if (!(startTime >= 0) || startTime >= timeBase.duration()) {
            throw new InvalidParameterException("start_time",
                "must be in [0, " + timeBase.duration() + "), got: " + startTime);
        }
        if (!(artifactDuration >= 0) || artifactDuration >= timeBase.duration()) {
            throw new InvalidParameterException("duration",
                "must be in [0, " + timeBase.duration() + "), got: " + artifactDuration);
        }
        if (!Double.isFinite(amplitude)) {
            throw new InvalidParameterException("amplitude", "must be finite, got: " + amplitude);
        }
        SignalBuffer buffer = new SignalBuffer(timeBase);
        buffer.add(signal);
        artifact.render(buffer, timeBase.indexOf(startTime), timeBase.samplesFor(artifactDuration), amplitude);
        logger.debug("{} added {} artifact at {}s for {}s", family(), artifact.paramName(), startTime, artifactDuration);
        return buffer.toSignal();
    }

    private void requireLength(Signal signal) {
        if (signal.length() != timeBase.nSamples()) {
            throw new InvalidParameterException("signal",
                "expected " + timeBase.nSamples() + " samples, got " + signal.length());
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + timeBase + "]";
    }
}
