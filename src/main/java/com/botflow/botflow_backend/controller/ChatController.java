package com.botflow.botflow_backend.controller;

import com.botflow.botflow_backend.model.dto.ChatRequest;
import com.botflow.botflow_backend.model.dto.ChatResponse;
import com.botflow.botflow_backend.service.ChatService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
public class ChatController {

    private final ChatService chatService;

    /** Web widget. Stateless unless the body carries a {@code contact}. */
    @PostMapping("/{botId}/message")
    public ResponseEntity<ChatResponse> message(@PathVariable Long botId, @RequestBody ChatRequest request) {
        return ResponseEntity.ok(chatService.handleMessage(botId, null, request));
    }

    /** Channel webhooks: the pointer is always read from and written to the contact's state. */
    @PostMapping("/{botId}/contacts/{contact}/message")
    public ResponseEntity<ChatResponse> contactMessage(
            @PathVariable Long botId,
            @PathVariable String contact,
            @RequestBody ChatRequest request) {
        return ResponseEntity.ok(chatService.handleMessage(botId, contact, request));
    }
}
