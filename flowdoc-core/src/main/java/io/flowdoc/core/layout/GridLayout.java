package io.flowdoc.core.layout;

import io.flowdoc.core.document.Position;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Square-ish grid in declaration order: `cols = ceil(sqrt(n))`.
///
/// Never fails, which makes it the fallback of every other algorithm.
public final class GridLayout implements LayoutStrategy {

    private final double horizontalSpacing;
    private final double verticalSpacing;

    public GridLayout(double horizontalSpacing, double verticalSpacing) {
        this.horizontalSpacing = horizontalSpacing;
        this.verticalSpacing = verticalSpacing;
    }

    @Override
    public Map<String, Position> place(DirectedGraph graph) {
        List<String> nodes = graph.nodes();
        Map<String, Position> positions = new LinkedHashMap<>();
        if (nodes.isEmpty()) {
            return positions;
        }

        int cols = (int) Math.ceil(Math.sqrt(nodes.size()));
        for (int i = 0; i < nodes.size(); i++) {
            positions.put(
                    nodes.get(i),
                    new Position((i % cols) * horizontalSpacing, (i / cols) * verticalSpacing));
        }
        return positions;
    }
}
