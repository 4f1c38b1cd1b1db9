package com.botflow.botflow_backend.controller;

import com.botflow.botflow_backend.model.dto.BackupSummaryDto;
import com.botflow.botflow_backend.model.dto.CanvasSaveDto;
import com.botflow.botflow_backend.model.dto.SyncResult;
import com.botflow.botflow_backend.service.FlowCanvasService;
import com.botflow.botflow_backend.service.FlowCanvasService.CanvasView;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Editor endpoints for one bot's graph. {@code X-User-Id}, when present, restricts access to the
 * bot's owner; anything else answers 404.
 */
@RestController
@RequestMapping("/api/flows")
@RequiredArgsConstructor
public class FlowController {

    private final FlowCanvasService canvasService;

    @GetMapping("/{botId}")
    public ResponseEntity<Map<String, Object>> getCanvas(
            @PathVariable Long botId,
            @RequestHeader(value = "X-User-Id", required = false) UUID userId) {

        CanvasView view = canvasService.getCanvas(botId, userId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("data", view.canvas());
        if (view.fromCache()) {
            body.put("source", "cache");
        }
        return ResponseEntity.ok(body);
    }

    /**
     * Full save ({@code nodes} + {@code edges}) or incremental save ({@code diff}).
     * Node ids are frontend ids; edges reference nodes by those ids.
     */
    @RequestMapping(value = "/{botId}", method = {RequestMethod.PATCH, RequestMethod.PUT})
    public ResponseEntity<Map<String, Object>> saveCanvas(
            @PathVariable Long botId,
            @RequestHeader(value = "X-User-Id", required = false) UUID userId,
            @RequestBody CanvasSaveDto body) {

        SyncResult result = canvasService.saveCanvas(botId, userId, body);
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Flow saved",
                "result", result));
    }

    @GetMapping("/{botId}/backups")
    public ResponseEntity<Map<String, Object>> listBackups(
            @PathVariable Long botId,
            @RequestHeader(value = "X-User-Id", required = false) UUID userId) {

        List<BackupSummaryDto> backups = canvasService.listBackups(botId, userId);
        return ResponseEntity.ok(Map.of("status", "success", "backups", backups));
    }

    @PostMapping("/{botId}/backups/{backupId}")
    public ResponseEntity<Map<String, Object>> restoreBackup(
            @PathVariable Long botId,
            @PathVariable UUID backupId,
            @RequestHeader(value = "X-User-Id", required = false) UUID userId) {

        SyncResult result = canvasService.restoreBackup(botId, userId, backupId);
        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Backup " + backupId + " restored",
                "result", result));
    }
}
