package io.flowdoc.core.document;

/// Renders a {@link WorkflowDocument} as text in canonical formatting.
///
/// Canonical output uses block style, two-space indentation and schema field order,
/// and re-parses to an equal document. Auto-repair relies on this: re-writing a
/// parseable but badly formatted document normalizes it.
///
/// @see DocumentParser for the inverse operation
public interface DocumentWriter {

    /// Writes the document.
    ///
    /// @param document the document to write, not null
    /// @return canonical text, never null
    /// @throws IllegalArgumentException if the document contains values that cannot be written
    String write(WorkflowDocument document);
}
