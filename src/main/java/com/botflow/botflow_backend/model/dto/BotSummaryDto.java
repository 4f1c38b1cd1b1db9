package com.botflow.botflow_backend.model.dto;

import com.botflow.botflow_backend.model.domain.Bot;

import java.util.UUID;

public record BotSummaryDto(
    Long id,
    String name,
    UUID ownerId,
    boolean webchatEnabled,
    long messageCount,
    long conversationCount
) {
    public static BotSummaryDto of(Bot bot) {
        return new BotSummaryDto(bot.getId(), bot.getName(), bot.getOwnerId(), bot.isWebchatEnabled(),
                bot.getMessageCount(), bot.getConversationCount());
    }
}
