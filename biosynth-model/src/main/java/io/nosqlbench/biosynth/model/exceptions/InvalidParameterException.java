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

/// Thrown when a numeric parameter is out of range or contradicts another one,
/// for example a non-positive sampling rate or an event window longer than
/// the signal.
public class InvalidParameterException extends SynthesisException {

    private final String parameter;

    public InvalidParameterException(String parameter, String message) {
        super(parameter + ": " + message);
        this.parameter = parameter;
    }

    public InvalidParameterException(String parameter, String message, Throwable cause) {
        super(parameter + ": " + message, cause);
        this.parameter = parameter;
    }

    /// @return the name of the offending parameter
    public String getParameter() {
        return parameter;
    }
}
