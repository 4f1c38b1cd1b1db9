package com.botflow.botflow_backend.exception;

public class BotUnavailableException extends RuntimeException {

    public BotUnavailableException(Long botId) {
        super("Bot " + botId + " is not available for web chat");
    }
}
