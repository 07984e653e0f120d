package io.flowdoc.core.document;

import io.flowdoc.core.util.OpaqueValues;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/// A directed edge between two blocks.
///
/// Endpoints are block ids and are not resolved against the document's blocks;
/// a connection may point at an id that does not exist.
///
/// @param from source block id, may be null when missing from the text
/// @param to target block id, may be null when missing from the text
/// @param condition optional branch label such as `"true"` or `"success"`, may be null
/// @param extras unrecognized fields in document order, never null
/// @param nullFields schema fields written with an explicit null, never null
public record Connection(
        String from,
        String to,
        String condition,
        Map<String, Object> extras,
        Set<String> nullFields) {

    public Connection {
        extras = extras != null ? OpaqueValues.freezeMap(extras) : Map.of();
        nullFields = nullFields != null ? Set.copyOf(nullFields) : Set.of();
    }

    public Connection(String from, String to, String condition, Map<String, Object> extras) {
        this(from, to, condition, extras, null);
    }

    public static Connection of(String from, String to) {
        return new Connection(from, to, null, null);
    }

    public static Connection of(String from, String to, String condition) {
        return new Connection(from, to, condition, null);
    }

    /// Returns whether the field was written, with a value or an explicit null.
    public boolean declares(String field) {
        return asFields().containsKey(field);
    }

    /// Returns the connection as an ordered field map, omitting absent fields.
    ///
    /// Fields written with an explicit null are kept with a null value.
    ///
    /// @return fields in order `from`, `to`, `condition`, then extras; unmodifiable
    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        putField(fields, "from", from);
        putField(fields, "to", to);
        putField(fields, "condition", condition);
        fields.putAll(extras);
        return Collections.unmodifiableMap(fields);
    }

    private void putField(Map<String, Object> fields, String field, String value) {
        if (value != null || nullFields.contains(field)) {
            fields.put(field, value);
        }
    }
}
