package com.botflow.botflow_backend.controller;

import com.botflow.botflow_backend.model.dto.BotCreateDto;
import com.botflow.botflow_backend.model.dto.BotSummaryDto;
import com.botflow.botflow_backend.service.BotService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/bots")
@RequiredArgsConstructor
public class BotController {

    private final BotService botService;

    @PostMapping
    public ResponseEntity<BotSummaryDto> createBot(
            @RequestBody BotCreateDto body,
            @RequestHeader(value = "X-User-Id", required = false) UUID userId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(botService.createBot(body, userId));
    }

    @GetMapping("/{botId}")
    public ResponseEntity<BotSummaryDto> getBot(
            @PathVariable Long botId,
            @RequestHeader(value = "X-User-Id", required = false) UUID userId) {
        return ResponseEntity.ok(botService.getBot(botId, userId));
    }
}
