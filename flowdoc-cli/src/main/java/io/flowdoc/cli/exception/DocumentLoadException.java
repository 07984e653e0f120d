package io.flowdoc.cli.exception;

import java.io.Serial;

/// Thrown when a document file given on the command line cannot be used.
///
/// Common causes:
/// - File does not exist or is not readable
/// - File content is not a parseable workflow document
///
/// @see io.flowdoc.cli.commands.FlowdocCommand
public class DocumentLoadException extends Exception {

    @Serial private static final long serialVersionUID = 4618203357719826314L;

    /// Creates an exception with the specified detail message.
    ///
    /// @param message description of why the document could not be loaded, not null
    public DocumentLoadException(String message) {
        super(message);
    }

    /// Creates an exception with the specified detail message and cause.
    ///
    /// @param message description of why the document could not be loaded, not null
    /// @param cause underlying I/O failure, may be null
    public DocumentLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
