package io.flowdoc.core.layout;

import io.flowdoc.core.document.Position;
import java.util.Map;

/// One auto-layout algorithm.
///
/// Implementations must assign exactly one position to every node of the graph and
/// must not depend on state outside the call.
@FunctionalInterface
public interface LayoutStrategy {

    /// Places the nodes of a graph.
    ///
    /// @param graph graph to place, not null
    /// @return position per node id, in node order, never null
    /// @throws LayoutException if the algorithm cannot place this graph
    Map<String, Position> place(DirectedGraph graph);
}
