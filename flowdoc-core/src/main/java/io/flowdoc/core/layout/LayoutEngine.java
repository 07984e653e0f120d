package io.flowdoc.core.layout;

import io.flowdoc.core.FlowdocConfig;
import io.flowdoc.core.document.Block;
import io.flowdoc.core.document.Position;
import io.flowdoc.core.document.WorkflowDocument;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Assigns 2-D coordinates to the blocks of a workflow document.
///
/// ### Algorithms
/// - `hierarchical`: layered by longest path from a source, see {@link HierarchicalLayout}
/// - `force_directed`: spring embedder, see {@link ForceDirectedLayout}
/// - `grid`: square-ish grid in declaration order, see {@link GridLayout}
///
/// Layout never fails. When the requested algorithm throws (a cycle for
/// `hierarchical`, a diverging simulation for `force_directed`) or the name is not
/// recognized, the grid is used instead and {@link LayoutResult#algorithmUsed()}
/// reports it.
///
/// Blocks without an id are not positioned. Connections to unknown ids are ignored.
///
/// @implNote Stateless and thread-safe; strategies are immutable.
/// @see #apply(WorkflowDocument, LayoutResult)
public class LayoutEngine {

    private static final Logger logger = Logger.getLogger(LayoutEngine.class.getName());

    private final Map<LayoutAlgorithm, LayoutStrategy> strategies;

    /// Creates an engine with explicit strategies.
    ///
    /// @param strategies strategy per algorithm, must contain {@link LayoutAlgorithm#GRID}
    public LayoutEngine(Map<LayoutAlgorithm, LayoutStrategy> strategies) {
        Objects.requireNonNull(strategies, "strategies must not be null");
        if (!strategies.containsKey(LayoutAlgorithm.GRID)) {
            throw new IllegalArgumentException("A grid strategy is required as fallback");
        }
        this.strategies = new EnumMap<>(strategies);
    }

    /// Creates an engine whose strategies use the geometry of a configuration.
    ///
    /// @param config engine configuration, not null
    /// @return a new engine, never null
    public static LayoutEngine fromConfig(FlowdocConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        Map<LayoutAlgorithm, LayoutStrategy> strategies = new EnumMap<>(LayoutAlgorithm.class);
        strategies.put(
                LayoutAlgorithm.HIERARCHICAL,
                new HierarchicalLayout(config.getHorizontalSpacing(), config.getVerticalSpacing()));
        strategies.put(
                LayoutAlgorithm.FORCE_DIRECTED,
                new ForceDirectedLayout(
                        config.getForceIterations(), config.getForceScale(), config.getForceSeed()));
        strategies.put(
                LayoutAlgorithm.GRID,
                new GridLayout(config.getHorizontalSpacing(), config.getVerticalSpacing()));
        return new LayoutEngine(strategies);
    }

    /// Creates an engine with default geometry.
    public static LayoutEngine withDefaults() {
        return fromConfig(new FlowdocConfig());
    }

    /// Lays out a document.
    ///
    /// @param document document to lay out, not null
    /// @param algorithm wire name of the algorithm, unrecognized names use the grid
    /// @return positions plus the algorithm actually used, never null
    public LayoutResult layout(WorkflowDocument document, String algorithm) {
        Objects.requireNonNull(document, "document must not be null");
        long start = System.currentTimeMillis();

        DirectedGraph graph = DirectedGraph.of(document);
        LayoutAlgorithm requested =
                LayoutAlgorithm.fromValue(algorithm)
                        .orElseGet(
                                () -> {
                                    logger.warning(
                                            "Unknown layout algorithm '"
                                                    + algorithm
                                                    + "', using grid");
                                    return LayoutAlgorithm.GRID;
                                });

        LayoutAlgorithm used = requested;
        Map<String, Position> positions;
        LayoutStrategy strategy =
                strategies.getOrDefault(requested, strategies.get(LayoutAlgorithm.GRID));
        try {
            positions = strategy.place(graph);
        } catch (LayoutException e) {
            logger.warning(
                    "Layout '" + requested.value() + "' failed (" + e.getMessage() + "), using grid");
            used = LayoutAlgorithm.GRID;
            positions = strategies.get(LayoutAlgorithm.GRID).place(graph);
        }

        long elapsed = System.currentTimeMillis() - start;
        logger.fine(
                "Laid out "
                        + positions.size()
                        + " blocks with "
                        + used.value()
                        + " in "
                        + elapsed
                        + "ms");
        return new LayoutResult(positions, algorithm, used, positions.size(), elapsed);
    }

    /// Lays out a document with the given algorithm.
    ///
    /// @param document document to lay out, not null
    /// @param algorithm algorithm to use, not null
    /// @return positions plus the algorithm actually used, never null
    public LayoutResult layout(WorkflowDocument document, LayoutAlgorithm algorithm) {
        return layout(document, algorithm.value());
    }

    /// Returns a copy of a document with the positions of a layout result applied.
    ///
    /// Blocks the result has no position for keep their current one.
    ///
    /// @param document document the result was computed for, not null
    /// @param result layout to apply, not null
    /// @return new document, the input is not modified
    public WorkflowDocument apply(WorkflowDocument document, LayoutResult result) {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(result, "result must not be null");
        if (document.getBlocks() == null) {
            return document;
        }

        List<Block> positioned = new ArrayList<>(document.getBlocks().size());
        for (Block block : document.getBlocks()) {
            Position position = block.id() != null ? result.positions().get(block.id()) : null;
            positioned.add(position != null ? block.withPosition(position) : block);
        }
        return document.withBlocks(positioned);
    }
}
