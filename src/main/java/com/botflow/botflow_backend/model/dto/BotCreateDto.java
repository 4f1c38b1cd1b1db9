package com.botflow.botflow_backend.model.dto;

import java.util.Collections;
import java.util.List;

public record BotCreateDto(
    String name,
    Boolean webchatEnabled,
    List<MenuOptionDto> menuOptions
) {
    public List<MenuOptionDto> menuOptions() {
        return menuOptions != null ? menuOptions : Collections.emptyList();
    }
}
