package com.botflow.botflow_backend.model.graph;

import com.botflow.botflow_backend.model.domain.FlowEdge;

import java.util.Map;

public record GraphEdge(
    Long id,
    String frontendId,
    Long sourceNodeId,
    Long targetNodeId,
    String condition,
    String label,
    String edgeType,
    String sourceHandle,
    String targetHandle,
    boolean animated,
    Map<String, Object> style,
    Map<String, Object> metadata
) {

    public static GraphEdge of(FlowEdge edge) {
        return new GraphEdge(
                edge.getId(),
                edge.getFrontendId(),
                edge.getSourceNodeId(),
                edge.getTargetNodeId(),
                edge.getCondition(),
                edge.getLabel(),
                edge.getEdgeType(),
                edge.getSourceHandle(),
                edge.getTargetHandle(),
                edge.isAnimated(),
                edge.getStyle(),
                edge.getMetadata()
        );
    }

    public String externalId() {
        return frontendId != null && !frontendId.isBlank() ? frontendId : String.valueOf(id);
    }

    /** The text user input is matched against: the condition, or the label when no condition is set. */
    public String effectiveCondition() {
        if (condition != null && !condition.isBlank()) return condition;
        return label != null && !label.isBlank() ? label : null;
    }
}
