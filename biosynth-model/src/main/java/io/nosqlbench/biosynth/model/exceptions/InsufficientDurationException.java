package io.nosqlbench.biosynth.model.exceptions;

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

/// Thrown when the requested number of events and their spacing cannot fit
/// into the configured signal duration.
///
/// This is a kind of [InvalidParameterException], so callers that only
/// handle parameter errors still see it.
public class InsufficientDurationException extends InvalidParameterException {

    private final double required;
    private final double available;

    public InsufficientDurationException(String parameter, double required, double available) {
        super(parameter, String.format("requires at least %.4fs but only %.4fs is available",
            required, available));
        this.required = required;
        this.available = available;
    }

    public double getRequired() {
        return required;
    }

    public double getAvailable() {
        return available;
    }
}
