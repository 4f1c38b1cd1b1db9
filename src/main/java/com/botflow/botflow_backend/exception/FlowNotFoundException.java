package com.botflow.botflow_backend.exception;

/** A bot, backup or node that does not exist or is not visible to the caller. */
public class FlowNotFoundException extends RuntimeException {

    public FlowNotFoundException(String message) {
        super(message);
    }

    public static FlowNotFoundException bot(Long botId) {
        return new FlowNotFoundException("Bot not found: " + botId);
    }
}
