package io.flowdoc.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonValue;

/// Writes engine enums by their wire name (`value()`) instead of the constant name.
///
/// Applied to `FieldDiff.Kind` and `LayoutAlgorithm`.
public abstract class EnumValueMixin {

    @JsonValue
    public abstract String value();
}
