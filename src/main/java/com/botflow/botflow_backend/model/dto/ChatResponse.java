package com.botflow.botflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public record ChatResponse(
    String status,
    String response,
    @JsonProperty("conversation_history") List<Map<String, Object>> conversationHistory,
    @JsonProperty("current_flow_id") Long currentFlowId,
    @JsonProperty("is_decision") boolean decision,
    List<ChatOption> options
) {}
