package com.botflow.botflow_backend.model.dto;

public record PositionDto(Double x, Double y) {}
