package io.flowdoc.core.conversion;

import java.io.Serial;

/// Thrown when generated text cannot be turned into a workflow document, or when
/// the text-generation call itself fails.
public class ConversionException extends Exception {
    @Serial private static final long serialVersionUID = 7702215843307124650L;

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
