package io.flowdoc.core;

import io.flowdoc.core.document.Block;
import io.flowdoc.core.document.Connection;
import io.flowdoc.core.document.WorkflowDocument;
import java.util.ArrayList;
import java.util.List;

/// Shared document fixtures for core tests.
public final class TestDocuments {

    private TestDocuments() {}

    /// Trigger `t1` connected to action `a1`, named "W".
    public static WorkflowDocument triggerAction() {
        return WorkflowDocument.builder()
                .name("W")
                .blocks(List.of(Block.of("t1", "trigger", "Start"), Block.of("a1", "action", "Do")))
                .connections(List.of(Connection.of("t1", "a1")))
                .build();
    }

    /// Linear chain `b1 -> b2 -> ... -> bN`, all actions.
    public static WorkflowDocument chain(int length) {
        List<Block> blocks = new ArrayList<>();
        List<Connection> connections = new ArrayList<>();
        for (int i = 1; i <= length; i++) {
            blocks.add(Block.of("b" + i, "action", "Step " + i));
            if (i > 1) {
                connections.add(Connection.of("b" + (i - 1), "b" + i));
            }
        }
        return WorkflowDocument.builder()
                .name("Chain")
                .blocks(blocks)
                .connections(connections)
                .build();
    }

    /// Three blocks wired `c1 -> c2 -> c3 -> c1`.
    public static WorkflowDocument cycle() {
        return WorkflowDocument.builder()
                .name("Cycle")
                .blocks(
                        List.of(
                                Block.of("c1", "trigger", "One"),
                                Block.of("c2", "action", "Two"),
                                Block.of("c3", "loop", "Three")))
                .connections(
                        List.of(
                                Connection.of("c1", "c2"),
                                Connection.of("c2", "c3"),
                                Connection.of("c3", "c1")))
                .build();
    }
}
