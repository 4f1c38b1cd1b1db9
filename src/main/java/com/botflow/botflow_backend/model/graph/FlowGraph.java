package com.botflow.botflow_backend.model.graph;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, live-only view of one bot's graph: nodes in storage order (legacy position first,
 * then id) and edges in id order. Every edge's endpoints are present in {@link #nodes()}.
 * This is the value the read cache holds, so it must stay JSON-serializable.
 */
public record FlowGraph(
    Long botId,
    String name,
    List<GraphNode> nodes,
    List<GraphEdge> edges
) {

    public FlowGraph {
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    public Optional<GraphNode> node(Long nodeId) {
        if (nodeId == null) return Optional.empty();
        return nodes.stream().filter(n -> Objects.equals(n.id(), nodeId)).findFirst();
    }

    public List<GraphEdge> outgoing(Long nodeId) {
        return edges.stream().filter(e -> Objects.equals(e.sourceNodeId(), nodeId)).toList();
    }
}
