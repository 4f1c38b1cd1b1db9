package com.botflow.botflow_backend.dispatch;

import com.botflow.botflow_backend.model.dto.ChatOption;

import java.util.List;

/**
 * A reply produced by one committed chat step. {@code contact} is null for the stateless web
 * widget, which reads the reply from the HTTP response instead.
 */
public record OutboundReply(
    Long botId,
    String contact,
    Long nodeId,
    String text,
    List<ChatOption> options
) {}
