package io.flowdoc.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/// Hides the derived `valid` flag of `ConversionResult`; it is part of `validation`.
@JsonIgnoreProperties({"valid"})
public abstract class ConversionResultMixin {}
