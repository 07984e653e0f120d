package io.flowdoc.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonProperty;

/// Adds the derived `fellBack` flag to serialized `LayoutResult`s.
public abstract class LayoutResultMixin {

    @JsonProperty("fellBack")
    public abstract boolean fellBack();
}
