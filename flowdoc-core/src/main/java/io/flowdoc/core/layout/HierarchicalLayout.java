package io.flowdoc.core.layout;

import io.flowdoc.core.document.Position;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Layered layout of an acyclic graph.
///
/// A node's level is `0` without predecessors, else one more than the deepest
/// predecessor. Nodes on the same level are placed left to right in topological
/// order: `x = slot * horizontalSpacing`, `y = level * verticalSpacing`.
///
/// {@snippet :
/// // b1 -> b2 -> b3
/// // b1 = (0, 0), b2 = (0, 150), b3 = (0, 300)
/// }
public final class HierarchicalLayout implements LayoutStrategy {

    private final double horizontalSpacing;
    private final double verticalSpacing;

    public HierarchicalLayout(double horizontalSpacing, double verticalSpacing) {
        this.horizontalSpacing = horizontalSpacing;
        this.verticalSpacing = verticalSpacing;
    }

    /// @throws LayoutException if the graph contains a cycle
    @Override
    public Map<String, Position> place(DirectedGraph graph) {
        List<String> order =
                graph.topologicalOrder()
                        .orElseThrow(() -> new LayoutException("Graph contains a cycle"));

        Map<String, Integer> levels = new HashMap<>();
        Map<Integer, Integer> slotsUsed = new HashMap<>();
        Map<String, Position> placed = new HashMap<>();
        for (String node : order) {
            int level = 0;
            for (String predecessor : graph.predecessors(node)) {
                level = Math.max(level, levels.get(predecessor) + 1);
            }
            levels.put(node, level);

            int slot = slotsUsed.merge(level, 1, Integer::sum) - 1;
            placed.put(node, new Position(slot * horizontalSpacing, level * verticalSpacing));
        }

        Map<String, Position> positions = new LinkedHashMap<>();
        for (String node : graph.nodes()) {
            positions.put(node, placed.get(node));
        }
        return positions;
    }
}
