package com.botflow.botflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonAlias;

import java.util.Collections;
import java.util.List;

/**
 * Incremental change set computed by the editor. Deletions are lists of frontend ids.
 * Null lists are treated as empty.
 */
public record FlowDiffDto(
    @JsonAlias("nodes_to_create") List<FlowNodeDto> nodesToCreate,
    @JsonAlias("nodes_to_update") List<FlowNodeDto> nodesToUpdate,
    @JsonAlias("nodes_to_delete") List<String> nodesToDelete,
    @JsonAlias("edges_to_create") List<FlowEdgeDto> edgesToCreate,
    @JsonAlias("edges_to_update") List<FlowEdgeDto> edgesToUpdate,
    @JsonAlias("edges_to_delete") List<String> edgesToDelete
) {
    public List<FlowNodeDto> nodesToCreate() {
        return nodesToCreate != null ? nodesToCreate : Collections.emptyList();
    }

    public List<FlowNodeDto> nodesToUpdate() {
        return nodesToUpdate != null ? nodesToUpdate : Collections.emptyList();
    }

    public List<String> nodesToDelete() {
        return nodesToDelete != null ? nodesToDelete : Collections.emptyList();
    }

    public List<FlowEdgeDto> edgesToCreate() {
        return edgesToCreate != null ? edgesToCreate : Collections.emptyList();
    }

    public List<FlowEdgeDto> edgesToUpdate() {
        return edgesToUpdate != null ? edgesToUpdate : Collections.emptyList();
    }

    public List<String> edgesToDelete() {
        return edgesToDelete != null ? edgesToDelete : Collections.emptyList();
    }
}
