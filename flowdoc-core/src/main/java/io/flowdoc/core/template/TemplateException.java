package io.flowdoc.core.template;

import java.io.Serial;

/// Thrown when a template cannot be instantiated.
public class TemplateException extends Exception {
    @Serial private static final long serialVersionUID = -2871465390127734511L;

    public TemplateException(String message) {
        super(message);
    }
}
