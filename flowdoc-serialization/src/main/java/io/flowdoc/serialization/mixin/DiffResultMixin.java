package io.flowdoc.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/// Hides the derived `empty` flag of `DiffResult`.
@JsonIgnoreProperties({"empty"})
public abstract class DiffResultMixin {}
