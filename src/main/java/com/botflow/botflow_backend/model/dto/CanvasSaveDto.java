package com.botflow.botflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Body of PATCH /api/flows/{botId} and the body of GET /api/flows/{botId}.
 * A write carries either the complete {@code nodes} and {@code edges} lists or a {@code diff}.
 * Backups store exactly this shape so a restore replays like an editor save.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CanvasSaveDto(
    List<FlowNodeDto> nodes,
    List<FlowEdgeDto> edges,
    String name,
    FlowDiffDto diff
) {
    public static CanvasSaveDto full(List<FlowNodeDto> nodes, List<FlowEdgeDto> edges, String name) {
        return new CanvasSaveDto(nodes, edges, name, null);
    }
}
