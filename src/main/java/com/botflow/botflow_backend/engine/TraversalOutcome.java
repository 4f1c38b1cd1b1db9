package com.botflow.botflow_backend.engine;

import com.botflow.botflow_backend.model.dto.ChatOption;
import com.botflow.botflow_backend.model.graph.GraphNode;

import java.util.List;

/**
 * Result of one traversal step. {@code nextNode} is null when nothing resolved; the caller then
 * answers with its fallback text and keeps the stored pointer as it was.
 */
public record TraversalOutcome(
    GraphNode nextNode,
    boolean decision,
    List<ChatOption> options
) {

    public TraversalOutcome {
        options = options != null ? List.copyOf(options) : List.of();
    }

    public static TraversalOutcome none() {
        return new TraversalOutcome(null, false, List.of());
    }

    public boolean exhausted() {
        return nextNode == null;
    }
}
