package com.botflow.botflow_backend.model.dto;

import java.util.UUID;

/** {@code timestamp} is epoch seconds with fractional part. */
public record BackupSummaryDto(UUID id, long version, double timestamp) {}
