package com.botflow.botflow_backend.model.dto;

import java.util.List;

/**
 * Outcome of one graph write. {@code droppedEdges} counts edges skipped because an endpoint
 * did not resolve to a submitted (or live) node.
 */
public record SyncResult(
    int nodesCreated,
    int nodesUpdated,
    int nodesDeleted,
    int edgesCreated,
    int edgesUpdated,
    int edgesDeleted,
    int droppedEdges,
    List<String> droppedEdgeIds
) {}
