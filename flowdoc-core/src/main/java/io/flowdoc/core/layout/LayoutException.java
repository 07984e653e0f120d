package io.flowdoc.core.layout;

import java.io.Serial;

/// Signals that a layout algorithm could not place the graph.
///
/// Never escapes {@link LayoutEngine}, which recovers by falling back to the grid.
public class LayoutException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4198520312846507193L;

    public LayoutException(String message) {
        super(message);
    }
}
