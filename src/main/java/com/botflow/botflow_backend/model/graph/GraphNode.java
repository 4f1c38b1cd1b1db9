package com.botflow.botflow_backend.model.graph;

import com.botflow.botflow_backend.model.domain.FlowNode;
import com.botflow.botflow_backend.model.domain.NodeType;

import java.util.Map;

public record GraphNode(
    Long id,
    String frontendId,
    String nodeType,
    String userMessage,
    String botResponse,
    Integer position,
    Double positionX,
    Double positionY,
    Map<String, Object> metadata
) {

    public static GraphNode of(FlowNode node) {
        return new GraphNode(
                node.getId(),
                node.getFrontendId(),
                node.getNodeType(),
                node.getUserMessage(),
                node.getBotResponse(),
                node.getPosition(),
                node.getPositionX(),
                node.getPositionY(),
                node.getMetadata()
        );
    }

    public String externalId() {
        return frontendId != null && !frontendId.isBlank() ? frontendId : String.valueOf(id);
    }

    public boolean hasType(NodeType type) {
        return type.matches(nodeType);
    }
}
