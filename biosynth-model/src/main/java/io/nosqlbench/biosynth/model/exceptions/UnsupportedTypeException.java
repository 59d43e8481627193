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

import java.util.Collection;

/// Thrown for an unknown noise, artifact, condition or movement type name.
public class UnsupportedTypeException extends SynthesisException {

    private final String typeName;

    public UnsupportedTypeException(String kind, String typeName, Collection<String> supported) {
        super("Unsupported " + kind + ": '" + typeName + "'. Supported: " + supported);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
