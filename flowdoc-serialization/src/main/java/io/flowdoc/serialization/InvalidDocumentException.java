package io.flowdoc.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import java.io.Serial;

/// Well-formed YAML whose shape cannot be represented as a workflow document.
///
/// The message is reported to callers verbatim, without a parser prefix.
final class InvalidDocumentException extends JsonProcessingException {
    @Serial private static final long serialVersionUID = 3054718827091136612L;

    InvalidDocumentException(String message) {
        super(message);
    }
}
