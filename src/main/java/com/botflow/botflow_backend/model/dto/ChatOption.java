package com.botflow.botflow_backend.model.dto;

public record ChatOption(Long id, String label, String message) {}
