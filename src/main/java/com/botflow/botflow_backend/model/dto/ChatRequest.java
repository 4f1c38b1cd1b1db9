package com.botflow.botflow_backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One inbound chat message. With {@code contact} set the pointer is read from the stored
 * conversation state; otherwise {@code current_flow_id} from the widget is used.
 */
public record ChatRequest(
    String message,
    @JsonProperty("current_flow_id") Long currentFlowId,
    @JsonProperty("conversation_history") List<Map<String, Object>> conversationHistory,
    String contact
) {}
