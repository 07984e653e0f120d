package io.flowdoc.core.conversion;

import io.flowdoc.core.validation.ValidationResult;
import java.util.Objects;

/// Final document text of a conversion together with its validation.
///
/// A result may carry an invalid document; accepting it is the caller's decision.
///
/// @param text final document text, never null
/// @param validation validation of `text`, never null
/// @param repaired whether the canonical re-serialization pass was applied
/// @param generatedBlocks number of blocks in `text`, 0 if it does not parse
/// @param hasTriggers whether `text` contains a trigger block
/// @param complexityScore complexity of `text`, 0 if it does not parse
public record ConversionResult(
        String text,
        ValidationResult validation,
        boolean repaired,
        int generatedBlocks,
        boolean hasTriggers,
        double complexityScore) {

    public ConversionResult {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(validation, "validation must not be null");
    }

    public boolean isValid() {
        return validation.valid();
    }
}
