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

import io.nosqlbench.biosynth.model.exceptions.UnsupportedTypeException;

import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Factory class for discovering synthesizer families via SPI.
 *
 * <p>Uses {@link ServiceLoader} to discover every registered {@link SynthesizerProvider}
 * and finds them by the value of their {@link SynthesizerName} annotation.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * Synthesizer eog = SynthesizerIO.create("eog", 250, 10);
 * List<String> families = SynthesizerIO.getAvailableNames();
 * }</pre>
 *
 * @see SynthesizerProvider
 * @see SynthesizerName
 */
public final class SynthesizerIO {

    private static final ServiceLoader<SynthesizerProvider> serviceLoader =
        ServiceLoader.load(SynthesizerProvider.class);

    private SynthesizerIO() {
    }

    /**
     * Gets a provider by family name, ignoring case.
     *
     * @param name the family name to find
     * @return an Optional containing the provider, or empty if not found
     */
    public static Optional<SynthesizerProvider> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return providers()
            .filter(provider -> name.trim().equalsIgnoreCase(getFamilyName(provider)))
            .findFirst()
            .map(ServiceLoader.Provider::get);
    }

    /**
     * Creates a synthesizer by family name.
     *
     * @param name the family name
     * @param samplingRate Hz
     * @param duration seconds
     * @return a new synthesizer
     * @throws UnsupportedTypeException if no family with the given name is registered
     */
    public static Synthesizer create(String name, double samplingRate, double duration) {
        SynthesizerProvider provider = get(name)
            .orElseThrow(() -> new UnsupportedTypeException("synthesizer family", name, getAvailableNames()));
        return provider.create(samplingRate, duration);
    }

    /**
     * Gets the names of all registered families.
     *
     * @return list of family names, in registration order
     */
    public static List<String> getAvailableNames() {
        return providers()
            .map(SynthesizerIO::getFamilyName)
            .filter(n -> n != null)
            .collect(Collectors.toList());
    }

    /**
     * Checks if a family with the given name is registered.
     *
     * @param name the family name to check
     * @return true if a provider with that name exists
     */
    public static boolean isAvailable(String name) {
        return get(name).isPresent();
    }

    /**
     * Reloads the service loader to discover newly added providers.
     */
    public static void reload() {
        serviceLoader.reload();
    }

    private static Stream<ServiceLoader.Provider<SynthesizerProvider>> providers() {
        return serviceLoader.stream();
    }

    private static String getFamilyName(ServiceLoader.Provider<SynthesizerProvider> provider) {
        SynthesizerName annotation = provider.type().getAnnotation(SynthesizerName.class);
        return annotation != null ? annotation.value() : null;
    }
}
