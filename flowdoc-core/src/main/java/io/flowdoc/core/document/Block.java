package io.flowdoc.core.document;

import io.flowdoc.core.util.OpaqueValues;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// A single node of a workflow document.
///
/// Every field is nullable because documents are modelled as written: a block that is
/// missing its `id` or `type` still parses, and the validator reports the omission.
/// `config` is opaque to the engine and kept exactly as written, including key order,
/// whatever its shape. Fields the schema does not name are kept in `extras` so that
/// writing the document back does not lose them.
///
/// A field written with an explicit null (`id: ~`) is present but empty. Such fields
/// read as null like absent ones and are listed in `nullFields`; the validator counts
/// them as present.
///
/// @param id identifier, unique within a document, may be null
/// @param type type string, see {@link BlockType} for the recognized values, may be null
/// @param name human-readable name, may be null
/// @param config opaque block configuration, null when absent
/// @param position canvas coordinate, null until laid out
/// @param extras unrecognized fields in document order, never null
/// @param nullFields schema fields written with an explicit null, never null
public record Block(
        String id,
        String type,
        String name,
        Object config,
        Position position,
        Map<String, Object> extras,
        Set<String> nullFields) {

    public Block {
        config = OpaqueValues.freeze(config);
        extras = extras != null ? OpaqueValues.freezeMap(extras) : Map.of();
        nullFields = nullFields != null ? Set.copyOf(nullFields) : Set.of();
    }

    public Block(
            String id,
            String type,
            String name,
            Object config,
            Position position,
            Map<String, Object> extras) {
        this(id, type, name, config, position, extras, null);
    }

    /// Creates a block with only the identifying fields set.
    public static Block of(String id, String type, String name) {
        return new Block(id, type, name, null, null, null);
    }

    /// Returns the recognized type of this block.
    ///
    /// @return the block type, or empty when the type is missing or not recognized
    public Optional<BlockType> blockType() {
        return BlockType.fromValue(type);
    }

    /// Returns whether this block is typed `trigger`.
    public boolean isTrigger() {
        return BlockType.TRIGGER.value().equals(type);
    }

    /// Returns a copy of this block placed at the given position.
    ///
    /// @param position the new position, may be null to clear it
    /// @return new block, never null
    public Block withPosition(Position position) {
        Set<String> remaining = nullFields;
        if (position != null && nullFields.contains("position")) {
            remaining = new LinkedHashSet<>(nullFields);
            remaining.remove("position");
        }
        return new Block(id, type, name, config, position, extras, remaining);
    }

    /// Returns whether the field was written on this block, with a value or an
    /// explicit null.
    ///
    /// @param field schema field name such as `id` or `type`
    public boolean declares(String field) {
        return asFields().containsKey(field);
    }

    /// Returns the fields present on this block, in schema order followed by extras.
    ///
    /// Absent fields are omitted and explicit nulls are kept, so two blocks compare
    /// field-by-field the same way their text would. `position` is rendered as an
    /// `{x, y}` map.
    ///
    /// @return unmodifiable ordered map of field name to value, never null
    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        putField(fields, "id", id);
        putField(fields, "type", type);
        putField(fields, "name", name);
        putField(fields, "config", config);
        putField(fields, "position", position != null ? position.asMap() : null);
        fields.putAll(extras);
        return Collections.unmodifiableMap(fields);
    }

    private void putField(Map<String, Object> fields, String field, Object value) {
        if (value != null || nullFields.contains(field)) {
            fields.put(field, value);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link Block}.
    public static final class Builder {
        private String id;
        private String type;
        private String name;
        private Object config;
        private Position position;
        private Map<String, Object> extras;
        private final Set<String> nullFields = new LinkedHashSet<>();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder type(BlockType type) {
            this.type = type.value();
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder config(Object config) {
            this.config = config;
            return this;
        }

        public Builder position(Position position) {
            this.position = position;
            return this;
        }

        public Builder extras(Map<String, Object> extras) {
            this.extras = extras;
            return this;
        }

        /// Records that a schema field was written with an explicit null.
        ///
        /// @param field one of `id`, `type`, `name`, `config` or `position`
        /// @return this builder for chaining
        public Builder nullField(String field) {
            this.nullFields.add(field);
            return this;
        }

        public Block build() {
            return new Block(id, type, name, config, position, extras, nullFields);
        }
    }
}
