package io.flowdoc.core.document;

/// Turns document text into a {@link WorkflowDocument}.
///
/// Decouples parsing from any specific text library so that `flowdoc-core` stays
/// dependency-free. The YAML implementation lives in `flowdoc-serialization`.
///
/// ### Contracts
/// - Never throws for bad input: malformed syntax and a root that is not a mapping
///   are reported as {@link ParseResult.Failed}.
/// - Missing required fields are not parse errors; they are left for the validator.
/// - Side-effect free and safe to call concurrently.
///
/// @see DocumentWriter for the inverse operation
public interface DocumentParser {

    /// Parses document text.
    ///
    /// @param text the document text, not null
    /// @return the parsed document or the parse error, never null
    ParseResult parse(String text);
}
