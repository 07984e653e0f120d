package io.flowdoc.core.document;

import java.util.LinkedHashMap;
import java.util.Map;

/// Two-dimensional canvas coordinate of a block.
///
/// Populated by the layout engine; documents written by hand usually carry none.
///
/// @param x horizontal coordinate in pixels
/// @param y vertical coordinate in pixels
public record Position(double x, double y) {

    /// Returns the position as an ordered `{x, y}` map, the shape it takes in document text.
    ///
    /// @return map with keys `x` and `y`, never null
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("x", x);
        map.put("y", y);
        return map;
    }
}
