package io.flowdoc.core.validation;

import java.util.List;

/// Structured outcome of validating a workflow document.
///
/// Validation problems are data, never exceptions: every rule violation is collected
/// so callers can display all of them at once. Warnings never affect validity.
///
/// @param valid `true` iff `errors` is empty
/// @param errors rule violations that make the document invalid, never null
/// @param warnings non-fatal findings, never null
/// @param blockCount number of `blocks` entries including malformed ones, 0 when the
///     field is absent or not a sequence
/// @param connectionCount number of `connections` entries, counted the same way
/// @param hasTrigger whether any block is typed `trigger`
public record ValidationResult(
        boolean valid,
        List<String> errors,
        List<String> warnings,
        int blockCount,
        int connectionCount,
        boolean hasTrigger) {

    public ValidationResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    /// Creates a result from collected findings; validity is derived from the error list.
    public static ValidationResult of(
            List<String> errors,
            List<String> warnings,
            int blockCount,
            int connectionCount,
            boolean hasTrigger) {
        return new ValidationResult(
                errors.isEmpty(), errors, warnings, blockCount, connectionCount, hasTrigger);
    }

    /// Creates the result for a document that could not be decoded at all.
    ///
    /// @param error the single fatal error, not null
    /// @return invalid result with no counts, never null
    public static ValidationResult fatal(String error) {
        return new ValidationResult(false, List.of(error), List.of(), 0, 0, false);
    }
}
