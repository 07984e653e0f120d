package io.flowdoc.core.document;

import java.util.Objects;

/// Describes why document text could not be parsed.
///
/// @param message human-readable description including the location when known, not null
public record ParseError(String message) {

    public ParseError {
        Objects.requireNonNull(message, "message must not be null");
    }
}
