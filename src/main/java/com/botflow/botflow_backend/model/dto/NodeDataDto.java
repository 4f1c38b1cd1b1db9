package com.botflow.botflow_backend.model.dto;

/** {@code label} is the trigger phrase, {@code message} the bot's reply. */
public record NodeDataDto(String label, String message) {}
