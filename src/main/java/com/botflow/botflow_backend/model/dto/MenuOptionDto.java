package com.botflow.botflow_backend.model.dto;

public record MenuOptionDto(String label, String action) {}
