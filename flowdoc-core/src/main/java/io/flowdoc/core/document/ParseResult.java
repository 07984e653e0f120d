package io.flowdoc.core.document;

import java.util.Objects;
import java.util.Optional;

/// Outcome of parsing document text.
///
/// Parsing either yields a {@link Parsed} document or a {@link Failed} result carrying
/// the {@link ParseError}. A parse failure is final: no partially-read document is
/// returned.
///
/// {@snippet :
/// ParseResult result = parser.parse(text);
/// if (result instanceof ParseResult.Parsed parsed) {
///     WorkflowDocument document = parsed.document();
/// } else if (result instanceof ParseResult.Failed failed) {
///     log(failed.error().message());
/// }
/// }
///
/// @see DocumentParser
public sealed interface ParseResult permits ParseResult.Parsed, ParseResult.Failed {

    /// Returns the parsed document if parsing succeeded.
    ///
    /// @return the document, or empty on failure
    Optional<WorkflowDocument> document();

    /// Returns whether parsing succeeded.
    default boolean isSuccess() {
        return this instanceof Parsed;
    }

    static ParseResult parsed(WorkflowDocument document) {
        return new Parsed(document);
    }

    static ParseResult failed(String message) {
        return new Failed(new ParseError(message));
    }

    /// Successful parse.
    ///
    /// @param value the parsed document, not null
    record Parsed(WorkflowDocument value) implements ParseResult {

        public Parsed {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Optional<WorkflowDocument> document() {
            return Optional.of(value);
        }
    }

    /// Failed parse.
    ///
    /// @param error what went wrong, not null
    record Failed(ParseError error) implements ParseResult {

        public Failed {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public Optional<WorkflowDocument> document() {
            return Optional.empty();
        }
    }
}
