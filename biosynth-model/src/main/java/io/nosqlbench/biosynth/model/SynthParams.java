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

import io.nosqlbench.biosynth.model.exceptions.InvalidParameterException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Flat, immutable set of named generation knobs.
///
/// # Overview
///
/// Keys are snake_case strings as they appear in recipes, e.g. `heart_rate`,
/// `pattern_type`, `random_seed`. Values may be numbers, booleans, strings,
/// lists, or nested maps (wave morphology overrides, movement lists).
///
/// Values loaded from JSON arrive as `Double` regardless of how they were
/// written, so every numeric accessor accepts any [Number] and integer
/// accessors require an integral value.
///
/// # Usage
///
/// ```java
/// SynthParams p = SynthParams.of("condition", "af", "heart_rate", 80);
/// double hr = p.getDouble("heart_rate", 75.0);
/// double intensity = p.getDouble(0.5, "intensity", "activation_level");
/// SynthParams qrs = p.getParams("qrs");       // empty if absent
/// ```
///
/// Accessors never clamp. A value of the wrong type fails with
/// [InvalidParameterException] naming the key.
public final class SynthParams {

    public static final String RANDOM_SEED = "random_seed";

    private static final SynthParams EMPTY = new SynthParams(Collections.emptyMap());

    private final Map<String, Object> values;

    private SynthParams(Map<String, Object> values) {
        this.values = values;
    }

    public static SynthParams empty() {
        return EMPTY;
    }

    /// Creates a parameter set from alternating keys and values.
    ///
    /// @param keysAndValues `key1, value1, key2, value2, ...`
    /// @return the parameter set
    /// @throws InvalidParameterException if the arguments are not key/value pairs
    public static SynthParams of(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new InvalidParameterException("params",
                "expected key/value pairs, got " + keysAndValues.length + " arguments");
        }
        Builder builder = builder();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            if (!(keysAndValues[i] instanceof String)) {
                throw new InvalidParameterException("params",
                    "key at position " + i + " is not a string: " + keysAndValues[i]);
            }
            builder.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return builder.build();
    }

    /// @param map source values; null values are dropped
    /// @return a parameter set holding a copy of the map
    public static SynthParams from(Map<String, ?> map) {
        if (map == null || map.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        map.forEach(builder::put);
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// @return a copy with one value added or replaced
    public SynthParams with(String key, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        if (value == null) {
            copy.remove(key);
        } else {
            copy.put(key, value);
        }
        return new SynthParams(Collections.unmodifiableMap(copy));
    }

    /// @return a copy holding every entry of both sets, the other winning on conflicts
    public SynthParams merge(SynthParams other) {
        Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.putAll(other.values);
        return new SynthParams(Collections.unmodifiableMap(copy));
    }

    public boolean has(String key) {
        return values.containsKey(key);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public Optional<Object> raw(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /// @return the seed if `random_seed` is present
    public Optional<Long> randomSeed() {
        return has(RANDOM_SEED) ? Optional.of(getLong(RANDOM_SEED, 0L)) : Optional.empty();
    }

    public double getDouble(String key, double defaultValue) {
        Object v = values.get(key);
        return v == null ? defaultValue : toDouble(key, v);
    }

    /// Reads the first present key among aliases.
    ///
    /// @param defaultValue value used when no alias is present
    /// @param keys the key and its aliases, in order of preference
    /// @return the value
    public double getDouble(double defaultValue, String... keys) {
        for (String key : keys) {
            if (values.containsKey(key)) {
                return toDouble(key, values.get(key));
            }
        }
        return defaultValue;
    }

    public int getInt(String key, int defaultValue) {
        Object v = values.get(key);
        return v == null ? defaultValue : toInt(key, v);
    }

    public int getInt(int defaultValue, String... keys) {
        for (String key : keys) {
            if (values.containsKey(key)) {
                return toInt(key, values.get(key));
            }
        }
        return defaultValue;
    }

    public long getLong(String key, long defaultValue) {
        Object v = values.get(key);
        if (v == null) {
            return defaultValue;
        }
        double d = toDouble(key, v);
        if (v instanceof Long || v instanceof Integer) {
            return ((Number) v).longValue();
        }
        if (d != Math.rint(d) || Double.isInfinite(d)) {
            throw new InvalidParameterException(key, "expected an integer, got " + v);
        }
        return (long) d;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object v = values.get(key);
        if (v == null) {
            return defaultValue;
        }
        if (v instanceof Boolean) {
            return (Boolean) v;
        }
        if (v instanceof String) {
            String s = ((String) v).trim();
            if (s.equalsIgnoreCase("true")) {
                return true;
            }
            if (s.equalsIgnoreCase("false")) {
                return false;
            }
        }
        throw new InvalidParameterException(key, "expected a boolean, got " + v);
    }

    public String getString(String key, String defaultValue) {
        Object v = values.get(key);
        if (v == null) {
            return defaultValue;
        }
        if (v instanceof String) {
            return (String) v;
        }
        if (v instanceof Enum) {
            return ((Enum<?>) v).name();
        }
        throw new InvalidParameterException(key, "expected a string, got " + v);
    }

    /// Reads a numeric list. A single number is treated as a one-element list.
    ///
    /// @return the values, or null when the key is absent
    public double[] getDoubles(String key) {
        Object v = values.get(key);
        if (v == null) {
            return null;
        }
        if (v instanceof double[]) {
            double[] arr = (double[]) v;
            return Arrays.copyOf(arr, arr.length);
        }
        if (v instanceof Number || v instanceof String) {
            return new double[]{toDouble(key, v)};
        }
        if (v instanceof List) {
            List<?> list = (List<?>) v;
            double[] out = new double[list.size()];
            for (int i = 0; i < out.length; i++) {
                Object item = list.get(i);
                if (item == null) {
                    throw new InvalidParameterException(key, "null element at index " + i);
                }
                out[i] = toDouble(key, item);
            }
            return out;
        }
        throw new InvalidParameterException(key, "expected a number or list of numbers, got " + v);
    }

    /// Reads a string list. A single string is treated as a one-element list.
    ///
    /// @return the values, or null when the key is absent
    public List<String> getStrings(String key) {
        Object v = values.get(key);
        if (v == null) {
            return null;
        }
        if (v instanceof String) {
            return List.of((String) v);
        }
        if (v instanceof List) {
            List<String> out = new ArrayList<>();
            for (Object item : (List<?>) v) {
                if (!(item instanceof String)) {
                    throw new InvalidParameterException(key, "expected a list of strings, got element " + item);
                }
                out.add((String) item);
            }
            return Collections.unmodifiableList(out);
        }
        throw new InvalidParameterException(key, "expected a string or list of strings, got " + v);
    }

    /// Reads a nested map.
    ///
    /// @return the nested parameters, empty when the key is absent
    public SynthParams getParams(String key) {
        Object v = values.get(key);
        if (v == null) {
            return EMPTY;
        }
        if (v instanceof SynthParams) {
            return (SynthParams) v;
        }
        if (v instanceof Map) {
            return from(stringKeyed(key, (Map<?, ?>) v));
        }
        throw new InvalidParameterException(key, "expected a nested map, got " + v);
    }

    /// Reads a list of nested maps.
    ///
    /// @return the nested parameter sets, or null when the key is absent
    public List<SynthParams> getParamsList(String key) {
        Object v = values.get(key);
        if (v == null) {
            return null;
        }
        if (!(v instanceof List)) {
            throw new InvalidParameterException(key, "expected a list of maps, got " + v);
        }
        List<SynthParams> out = new ArrayList<>();
        for (Object item : (List<?>) v) {
            if (item instanceof SynthParams) {
                out.add((SynthParams) item);
            } else if (item instanceof Map) {
                out.add(from(stringKeyed(key, (Map<?, ?>) item)));
            } else {
                out.add(null);
            }
        }
        return Collections.unmodifiableList(out);
    }

    /// @return true if the value under key is a list whose elements are all maps
    public boolean isParamsList(String key) {
        Object v = values.get(key);
        if (!(v instanceof List) || ((List<?>) v).isEmpty()) {
            return false;
        }
        for (Object item : (List<?>) v) {
            if (!(item instanceof Map) && !(item instanceof SynthParams)) {
                return false;
            }
        }
        return true;
    }

    private static Map<String, Object> stringKeyed(String key, Map<?, ?> map) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : map.entrySet()) {
            if (!(e.getKey() instanceof String)) {
                throw new InvalidParameterException(key, "nested key is not a string: " + e.getKey());
            }
            out.put((String) e.getKey(), e.getValue());
        }
        return out;
    }

    private static double toDouble(String key, Object v) {
        if (v instanceof Number) {
            return ((Number) v).doubleValue();
        }
        if (v instanceof String) {
            try {
                return Double.parseDouble(((String) v).trim());
            } catch (NumberFormatException e) {
                throw new InvalidParameterException(key, "expected a number, got '" + v + "'", e);
            }
        }
        throw new InvalidParameterException(key, "expected a number, got " + v);
    }

    private static int toInt(String key, Object v) {
        double d = toDouble(key, v);
        if (d != Math.rint(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) {
            throw new InvalidParameterException(key, "expected an integer, got " + v);
        }
        return (int) d;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SynthParams)) return false;
        return values.equals(((SynthParams) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "SynthParams" + values;
    }

    /// Mutable builder; [#build()] freezes the entries.
    public static final class Builder {
        private final Map<String, Object> values = new LinkedHashMap<>();

        private Builder() {
        }

        /// Adds an entry; a null value removes the key.
        public Builder put(String key, Object value) {
            Objects.requireNonNull(key, "key");
            if (value == null) {
                values.remove(key);
            } else {
                values.put(key, value);
            }
            return this;
        }

        public SynthParams build() {
            return new SynthParams(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        }
    }
}
