package com.purchasingpower.fanout.backend;

import java.util.List;

/**
 * Nodes and edges reachable from a start entity within a depth bound.
 *
 * @param degraded true when the serving backend had no graph support and only the start node was looked up
 */
public record GraphTraversal(String startId, int depth, List<Node> nodes, List<Edge> edges, boolean degraded) {

    public record Node(String id, String type, String name) {
    }

    public record Edge(String source, String target, String type) {
    }

    public static GraphTraversal startOnly(String startId, IndexedDocument start) {
        List<Node> nodes = start == null
                ? List.of()
                : List.of(new Node(start.getId(), start.getType(), start.getLabel()));
        return new GraphTraversal(startId, 0, nodes, List.of(), true);
    }
}
