package io.flowdoc.core.document;

import java.util.Optional;

/// Block types the engine recognizes, with their complexity weights.
///
/// Documents may use any type string. Types outside this enum are accepted
/// everywhere and only affect scoring, where they get the default weight.
public enum BlockType {
    TRIGGER("trigger", 1.0),
    ACTION("action", 1.2),
    CONDITION("condition", 1.5),
    LOOP("loop", 2.0),
    PARALLEL("parallel", 1.8);

    private final String value;
    private final double weight;

    BlockType(String value, double weight) {
        this.value = value;
        this.weight = weight;
    }

    /// Returns the type string as it appears in document text.
    ///
    /// @return lowercase type name, never null
    public String value() {
        return value;
    }

    /// Returns the complexity weight added per block of this type.
    ///
    /// @return positive weight
    public double weight() {
        return weight;
    }

    /// Looks up a recognized type by its document value.
    ///
    /// @param value type string from a block, may be null
    /// @return the matching type, or empty if `value` is null or not recognized
    public static Optional<BlockType> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (BlockType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
