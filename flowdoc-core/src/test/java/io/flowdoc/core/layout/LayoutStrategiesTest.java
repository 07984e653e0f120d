package io.flowdoc.core.layout;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.flowdoc.core.TestDocuments;
import io.flowdoc.core.document.Position;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LayoutStrategiesTest {

    @Nested
    class Hierarchical {

        private final HierarchicalLayout layout = new HierarchicalLayout(200.0, 150.0);

        @Test
        void shouldStackChainVertically() {
            Map<String, Position> positions = layout.place(DirectedGraph.of(TestDocuments.chain(3)));

            assertThat(positions)
                    .containsExactly(
                            Map.entry("b1", new Position(0, 0)),
                            Map.entry("b2", new Position(0, 150)),
                            Map.entry("b3", new Position(0, 300)));
        }

        @Test
        void shouldSpreadSiblingsHorizontally() {
            DirectedGraph graph = new DirectedGraph();
            graph.addNode("root");
            graph.addNode("left");
            graph.addNode("right");
            graph.addEdge("root", "left");
            graph.addEdge("root", "right");

            Map<String, Position> positions = layout.place(graph);

            assertThat(positions.get("root")).isEqualTo(new Position(0, 0));
            assertThat(positions.get("left")).isEqualTo(new Position(0, 150));
            assertThat(positions.get("right")).isEqualTo(new Position(200, 150));
        }

        @Test
        void shouldPlaceNodeBelowItsDeepestPredecessor() {
            DirectedGraph graph = new DirectedGraph();
            graph.addNode("a");
            graph.addNode("b");
            graph.addNode("c");
            graph.addEdge("a", "b");
            graph.addEdge("b", "c");
            graph.addEdge("a", "c");

            assertThat(layout.place(graph).get("c").y()).isEqualTo(300.0);
        }

        @Test
        void shouldRejectCycle() {
            assertThatThrownBy(() -> layout.place(DirectedGraph.of(TestDocuments.cycle())))
                    .isInstanceOf(LayoutException.class)
                    .hasMessageContaining("cycle");
        }
    }

    @Nested
    class Grid {

        @Test
        void shouldFillRowsOfCeilSqrtColumns() {
            Map<String, Position> positions =
                    new GridLayout(200.0, 150.0).place(DirectedGraph.of(TestDocuments.chain(5)));

            assertThat(positions)
                    .containsExactly(
                            Map.entry("b1", new Position(0, 0)),
                            Map.entry("b2", new Position(200, 0)),
                            Map.entry("b3", new Position(400, 0)),
                            Map.entry("b4", new Position(0, 150)),
                            Map.entry("b5", new Position(200, 150)));
        }

        @Test
        void shouldReturnNothingForEmptyGraph() {
            assertThat(new GridLayout(1, 1).place(new DirectedGraph())).isEmpty();
        }
    }

    @Nested
    class ForceDirected {

        @Test
        void shouldBeDeterministicForSameSeed() {
            DirectedGraph graph = DirectedGraph.of(TestDocuments.cycle());

            Map<String, Position> first = new ForceDirectedLayout(50, 300.0, 42L).place(graph);
            Map<String, Position> second = new ForceDirectedLayout(50, 300.0, 42L).place(graph);

            assertThat(first).isEqualTo(second);
        }

        @Test
        void shouldKeepCoordinatesWithinScale() {
            Map<String, Position> positions =
                    new ForceDirectedLayout(50, 300.0, 7L)
                            .place(DirectedGraph.of(TestDocuments.chain(6)));

            assertThat(positions).hasSize(6);
            assertThat(positions.values())
                    .allSatisfy(
                            position -> {
                                assertThat(Math.abs(position.x())).isLessThanOrEqualTo(300.0 + 1e-9);
                                assertThat(Math.abs(position.y())).isLessThanOrEqualTo(300.0 + 1e-9);
                            });
        }

        @Test
        void shouldPlaceSingleNodeAtOrigin() {
            DirectedGraph graph = new DirectedGraph();
            graph.addNode("only");

            assertThat(new ForceDirectedLayout(10, 300.0, 1L).place(graph))
                    .containsExactly(Map.entry("only", new Position(0, 0)));
        }

        @Test
        void shouldRejectNonPositiveIterations() {
            assertThatThrownBy(() -> new ForceDirectedLayout(0, 1.0, 1L))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
