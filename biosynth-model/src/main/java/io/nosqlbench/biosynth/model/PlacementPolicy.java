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

package io.nosqlbench.biosynth.model;

import io.nosqlbench.biosynth.model.exceptions.UnsupportedTypeException;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/// What to do with a kernel whose window does not lie entirely inside the
/// output buffer.
///
/// | Policy | Kernel partly outside | Kernel entirely outside |
/// |--------|-----------------------|-------------------------|
/// | SKIP   | dropped               | dropped                 |
/// | CLIP   | overlapping part kept | dropped                 |
public enum PlacementPolicy {

    /// Drop the whole kernel unless it fits completely.
    SKIP,

    /// Render the part of the kernel that overlaps the buffer.
    CLIP;

    /// Parameter key used by every synthesizer to override its default policy.
    public static final String PARAM = "placement_policy";

    public String paramName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// @param name policy name, case-insensitive
    /// @return the policy
    /// @throws UnsupportedTypeException for unknown names
    public static PlacementPolicy fromName(String name) {
        if (name != null) {
            for (PlacementPolicy policy : values()) {
                if (policy.name().equalsIgnoreCase(name.trim())) {
                    return policy;
                }
            }
        }
        throw new UnsupportedTypeException("placement policy", name,
            Arrays.stream(values()).map(PlacementPolicy::paramName).collect(Collectors.toList()));
    }

    /// Reads [#PARAM] from the parameters.
    ///
    /// @param params caller parameters
    /// @param defaultPolicy the policy used when the key is absent
    /// @return the requested or default policy
    public static PlacementPolicy from(SynthParams params, PlacementPolicy defaultPolicy) {
        String name = params.getString(PARAM, null);
        return name == null ? defaultPolicy : fromName(name);
    }
}
