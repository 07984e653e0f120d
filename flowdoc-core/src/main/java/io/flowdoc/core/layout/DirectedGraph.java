package io.flowdoc.core.layout;

import io.flowdoc.core.document.Block;
import io.flowdoc.core.document.Connection;
import io.flowdoc.core.document.WorkflowDocument;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Minimal directed graph over block ids.
///
/// Nodes and edges keep insertion order, so every traversal is deterministic for a
/// given document. Parallel edges collapse into one; self-loops are kept.
///
/// @implNote **Not thread-safe** while being built. Layout algorithms only read it.
public final class DirectedGraph {

    private final Map<String, Set<String>> successors = new LinkedHashMap<>();
    private final Map<String, Set<String>> predecessors = new LinkedHashMap<>();

    /// Builds the graph of a document.
    ///
    /// Every block with an id becomes a node, in declaration order. Connections whose
    /// endpoints are not both known block ids are ignored.
    ///
    /// @param document source document, not null
    /// @return graph of the document, never null
    public static DirectedGraph of(WorkflowDocument document) {
        DirectedGraph graph = new DirectedGraph();
        for (Block block : document.blocksOrEmpty()) {
            if (block.id() != null) {
                graph.addNode(block.id());
            }
        }
        for (Connection connection : document.connectionsOrEmpty()) {
            graph.addEdge(connection.from(), connection.to());
        }
        return graph;
    }

    /// Adds a node; adding an existing node is a no-op.
    ///
    /// @param id node id, not null
    public void addNode(String id) {
        successors.computeIfAbsent(id, k -> new LinkedHashSet<>());
        predecessors.computeIfAbsent(id, k -> new LinkedHashSet<>());
    }

    /// Adds an edge between two existing nodes.
    ///
    /// @param from source node id, may be null
    /// @param to target node id, may be null
    /// @return `true` if both endpoints are nodes of this graph
    public boolean addEdge(String from, String to) {
        if (from == null || to == null || !contains(from) || !contains(to)) {
            return false;
        }
        successors.get(from).add(to);
        predecessors.get(to).add(from);
        return true;
    }

    public boolean contains(String id) {
        return successors.containsKey(id);
    }

    /// @return node ids in insertion order, unmodifiable
    public List<String> nodes() {
        return List.copyOf(successors.keySet());
    }

    public int size() {
        return successors.size();
    }

    public Set<String> successors(String id) {
        return Collections.unmodifiableSet(successors.getOrDefault(id, Set.of()));
    }

    public Set<String> predecessors(String id) {
        return Collections.unmodifiableSet(predecessors.getOrDefault(id, Set.of()));
    }

    /// Returns a topological ordering of the nodes.
    ///
    /// Uses Kahn's algorithm seeded with the source nodes in insertion order, so
    /// independent branches come out in declaration order.
    ///
    /// @return the ordering, or empty if the graph contains a cycle
    public Optional<List<String>> topologicalOrder() {
        Map<String, Integer> inDegree = new HashMap<>();
        Deque<String> ready = new ArrayDeque<>();
        for (String node : successors.keySet()) {
            int degree = predecessors.get(node).size();
            inDegree.put(node, degree);
            if (degree == 0) {
                ready.add(node);
            }
        }

        List<String> order = new ArrayList<>(size());
        while (!ready.isEmpty()) {
            String node = ready.poll();
            order.add(node);
            for (String next : successors.get(node)) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }

        return order.size() == size() ? Optional.of(order) : Optional.empty();
    }
}
