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

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@link SynthesizerProvider} with the signal family it creates.
 *
 * <p>{@link SynthesizerIO} matches this value when looking a family up by name.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * @SynthesizerName("ecg")
 * public static final class Provider implements SynthesizerProvider {
 *     public Synthesizer create(double samplingRate, double duration) {
 *         return new EcgSynthesizer(samplingRate, duration);
 *     }
 * }
 * }</pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface SynthesizerName {
    /**
     * @return the family name, e.g. {@code "ecg"}
     */
    String value();
}
