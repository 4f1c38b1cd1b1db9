package com.botflow.botflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Edge as the editor sends and receives it. {@code source} and {@code target} are node frontend ids.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FlowEdgeDto(
    String id,
    String source,
    String target,
    String sourceHandle,
    String targetHandle,
    String type,
    Boolean animated,
    String label,
    String condition,
    Map<String, Object> style,
    Map<String, Object> metadata
) {}
