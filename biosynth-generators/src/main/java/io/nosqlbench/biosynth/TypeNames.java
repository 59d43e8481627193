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

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/// Maps the lower-case names used in parameter maps onto enum constants.
public final class TypeNames {

    private TypeNames() {
    }

    /// @return the constant's parameter-map spelling, e.g. `BASELINE_WANDER` to `baseline_wander`
    public static String paramName(Enum<?> constant) {
        return constant.name().toLowerCase(Locale.ROOT);
    }

    /// @param kind what is being looked up, used in the error message
    /// @param type the enum class
    /// @param name the name to match, case-insensitive
    /// @throws UnsupportedTypeException if nothing matches
    public static <E extends Enum<E>> E fromName(String kind, Class<E> type, String name) {
        if (name != null) {
            String wanted = name.trim();
            for (E constant : type.getEnumConstants()) {
                if (paramName(constant).equalsIgnoreCase(wanted)) {
                    return constant;
                }
            }
        }
        throw new UnsupportedTypeException(kind, name, names(type));
    }

    public static <E extends Enum<E>> List<String> names(Class<E> type) {
        return Arrays.stream(type.getEnumConstants()).map(TypeNames::paramName).collect(Collectors.toList());
    }
}
