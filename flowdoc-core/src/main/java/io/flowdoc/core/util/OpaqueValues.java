package io.flowdoc.core.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Helpers for the opaque, order-preserving values carried by documents (`config`,
/// `metadata`, `triggers` and unknown fields).
///
/// The engine never interprets these values. It only needs them frozen so that a
/// document cannot be mutated through a map handed out by an accessor, and it needs
/// them to keep their key order so that serialization round-trips.
public final class OpaqueValues {

    private OpaqueValues() {}

    /// Returns a deep, unmodifiable copy of the given value.
    ///
    /// Maps are copied into insertion-ordered maps and lists into lists; nested
    /// containers are copied recursively. Scalars are returned unchanged. Null values
    /// are allowed at any depth.
    ///
    /// @param value the value to freeze, may be null
    /// @return frozen copy, or null if `value` was null
    public static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            return freezeList(list);
        }
        return value;
    }

    /// Returns a deep, unmodifiable, insertion-ordered copy of the given map.
    ///
    /// Keys are converted with `String.valueOf`.
    ///
    /// @param map the map to freeze, may be null
    /// @return frozen copy, or null if `map` was null
    public static Map<String, Object> freezeMap(Map<?, ?> map) {
        if (map == null) {
            return null;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        map.forEach((key, value) -> copy.put(String.valueOf(key), freeze(value)));
        return Collections.unmodifiableMap(copy);
    }

    /// Returns a deep, unmodifiable copy of the given list.
    ///
    /// @param list the list to freeze, may be null
    /// @return frozen copy, or null if `list` was null
    public static List<Object> freezeList(List<?> list) {
        if (list == null) {
            return null;
        }
        List<Object> copy = new ArrayList<>(list.size());
        for (Object element : list) {
            copy.add(freeze(element));
        }
        return Collections.unmodifiableList(copy);
    }
}
