package com.botflow.botflow_backend.service;

import com.botflow.botflow_backend.model.dto.CanvasSaveDto;
import com.botflow.botflow_backend.model.dto.FlowEdgeDto;
import com.botflow.botflow_backend.model.dto.FlowNodeDto;
import com.botflow.botflow_backend.model.dto.NodeDataDto;
import com.botflow.botflow_backend.model.dto.PositionDto;
import com.botflow.botflow_backend.model.graph.FlowGraph;
import com.botflow.botflow_backend.model.graph.GraphEdge;
import com.botflow.botflow_backend.model.graph.GraphNode;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Graph to editor shape. Edge endpoints are rewritten from storage ids to the nodes' external ids,
 * which is what lets a read (or a backup snapshot) be sent straight back as a write.
 */
@Component
public class CanvasMapper {

    public CanvasSaveDto toCanvas(FlowGraph graph) {
        Map<Long, String> externalIds = new HashMap<>();
        graph.nodes().forEach(n -> externalIds.put(n.id(), n.externalId()));

        List<FlowNodeDto> nodes = graph.nodes().stream().map(CanvasMapper::toNodeDto).toList();
        List<FlowEdgeDto> edges = graph.edges().stream()
                .map(e -> toEdgeDto(e, externalIds))
                .toList();
        return CanvasSaveDto.full(nodes, edges, graph.name());
    }

    private static FlowNodeDto toNodeDto(GraphNode node) {
        return new FlowNodeDto(
                node.externalId(),
                node.nodeType(),
                new PositionDto(
                        node.positionX() != null ? node.positionX() : 0.0,
                        node.positionY() != null ? node.positionY() : 0.0),
                new NodeDataDto(
                        node.userMessage() != null ? node.userMessage() : "",
                        node.botResponse() != null ? node.botResponse() : ""),
                emptyToNull(node.metadata())
        );
    }

    private static FlowEdgeDto toEdgeDto(GraphEdge edge, Map<Long, String> externalIds) {
        return new FlowEdgeDto(
                edge.externalId(),
                externalIds.get(edge.sourceNodeId()),
                externalIds.get(edge.targetNodeId()),
                edge.sourceHandle(),
                edge.targetHandle(),
                edge.edgeType() != null ? edge.edgeType() : "default",
                edge.animated(),
                edge.label(),
                edge.condition(),
                emptyToNull(edge.style()),
                emptyToNull(edge.metadata())
        );
    }

    private static Map<String, Object> emptyToNull(Map<String, Object> map) {
        return map == null || map.isEmpty() ? null : map;
    }
}
