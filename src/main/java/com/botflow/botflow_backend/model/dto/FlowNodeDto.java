package com.botflow.botflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Node as the editor sends and receives it. {@code id} is the stable frontend id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlowNodeDto(
    String id,
    String type,
    PositionDto position,
    NodeDataDto data,
    Map<String, Object> metadata
) {}
