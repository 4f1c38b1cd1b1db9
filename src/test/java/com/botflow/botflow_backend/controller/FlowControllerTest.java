package com.botflow.botflow_backend.controller;

import com.botflow.botflow_backend.exception.FlowNotFoundException;
import com.botflow.botflow_backend.exception.FlowValidationException;
import com.botflow.botflow_backend.model.dto.BackupSummaryDto;
import com.botflow.botflow_backend.model.dto.CanvasSaveDto;
import com.botflow.botflow_backend.model.dto.FlowNodeDto;
import com.botflow.botflow_backend.model.dto.NodeDataDto;
import com.botflow.botflow_backend.model.dto.PositionDto;
import com.botflow.botflow_backend.model.dto.SyncResult;
import com.botflow.botflow_backend.service.FlowCanvasService;
import com.botflow.botflow_backend.service.FlowCanvasService.CanvasView;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(FlowController.class)
class FlowControllerTest {

    private static final UUID USER = UUID.fromString("7f000000-0000-0000-0000-000000000001");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FlowCanvasService canvasService;

    @Test
    void readReturnsCanvasAndMarksCacheHits() throws Exception {
        CanvasSaveDto canvas = CanvasSaveDto.full(
                List.of(new FlowNodeDto("a", "start", new PositionDto(1.0, 2.0), new NodeDataDto("", "Hi"), null)),
                List.of(), "Shop bot");
        when(canvasService.getCanvas(1L, USER)).thenReturn(new CanvasView(canvas, true));

        mockMvc.perform(get("/api/flows/1").header("X-User-Id", USER.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.source").value("cache"))
                .andExpect(jsonPath("$.data.name").value("Shop bot"))
                .andExpect(jsonPath("$.data.nodes[0].id").value("a"))
                .andExpect(jsonPath("$.data.nodes[0].position.x").value(1.0))
                .andExpect(jsonPath("$.data.nodes[0].data.message").value("Hi"))
                .andExpect(jsonPath("$.data.diff").doesNotExist());
    }

    @Test
    void freshReadHasNoSource() throws Exception {
        when(canvasService.getCanvas(1L, null)).thenReturn(new CanvasView(CanvasSaveDto.full(List.of(), List.of(), "b"), false));

        mockMvc.perform(get("/api/flows/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").doesNotExist());
    }

    @Test
    void patchAcceptsFullGraphAndReportsDroppedEdges() throws Exception {
        when(canvasService.saveCanvas(eq(1L), isNull(), any()))
                .thenReturn(new SyncResult(2, 0, 0, 1, 0, 0, 1, List.of("bad")));

        mockMvc.perform(patch("/api/flows/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"nodes":[{"id":"a","type":"start","position":{"x":0,"y":0},"data":{"label":"","message":"Hi"}},
                                          {"id":"b","data":{"label":"hola","message":"Hello"}}],
                                 "edges":[{"id":"e1","source":"a","target":"b","condition":"hola"},
                                          {"id":"bad","source":"a","target":"ghost"}],
                                 "name":"Renamed"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.result.nodesCreated").value(2))
                .andExpect(jsonPath("$.result.droppedEdges").value(1))
                .andExpect(jsonPath("$.result.droppedEdgeIds[0]").value("bad"));

        ArgumentCaptor<CanvasSaveDto> body = ArgumentCaptor.forClass(CanvasSaveDto.class);
        verify(canvasService).saveCanvas(eq(1L), isNull(), body.capture());
        assertThat(body.getValue().nodes()).hasSize(2);
        assertThat(body.getValue().edges().get(0).condition()).isEqualTo("hola");
        assertThat(body.getValue().name()).isEqualTo("Renamed");
    }

    @Test
    void putAcceptsSnakeCaseDiff() throws Exception {
        when(canvasService.saveCanvas(eq(1L), eq(USER), any()))
                .thenReturn(new SyncResult(0, 0, 1, 0, 0, 2, 0, List.of()));

        mockMvc.perform(put("/api/flows/1")
                        .header("X-User-Id", USER.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"diff\":{\"nodes_to_delete\":[\"b\"]}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.edgesDeleted").value(2));

        ArgumentCaptor<CanvasSaveDto> body = ArgumentCaptor.forClass(CanvasSaveDto.class);
        verify(canvasService).saveCanvas(eq(1L), eq(USER), body.capture());
        assertThat(body.getValue().diff().nodesToDelete()).containsExactly("b");
        assertThat(body.getValue().diff().nodesToCreate()).isEmpty();
    }

    @Test
    void validationErrorIsBadRequest() throws Exception {
        when(canvasService.saveCanvas(eq(1L), isNull(), any()))
                .thenThrow(new FlowValidationException("Two nodes share the id 'a'. Each node id must be unique."));

        mockMvc.perform(patch("/api/flows/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"nodes\":[],\"edges\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message").value("Two nodes share the id 'a'. Each node id must be unique."));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(patch("/api/flows/1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"nodes\": [oops"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void unknownBotIsNotFound() throws Exception {
        when(canvasService.getCanvas(99L, null)).thenThrow(FlowNotFoundException.bot(99L));

        mockMvc.perform(get("/api/flows/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Bot not found: 99"));
    }

    @Test
    void invalidUserHeaderIsBadRequest() throws Exception {
        mockMvc.perform(get("/api/flows/1").header("X-User-Id", "not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void backupsAreListedNewestFirst() throws Exception {
        UUID newest = UUID.randomUUID();
        UUID older = UUID.randomUUID();
        when(canvasService.listBackups(1L, null)).thenReturn(List.of(
                new BackupSummaryDto(newest, 2, 1714557600.5),
                new BackupSummaryDto(older, 1, 1714557500.0)));

        mockMvc.perform(get("/api/flows/1/backups"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.backups[0].id").value(newest.toString()))
                .andExpect(jsonPath("$.backups[0].version").value(2))
                .andExpect(jsonPath("$.backups[1].timestamp").value(1714557500.0));
    }

    @Test
    void restoreReturnsSyncResult() throws Exception {
        UUID backupId = UUID.randomUUID();
        when(canvasService.restoreBackup(1L, null, backupId)).thenReturn(new SyncResult(0, 3, 1, 0, 2, 0, 0, List.of()));

        mockMvc.perform(post("/api/flows/1/backups/" + backupId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.result.nodesUpdated").value(3));
    }

    @Test
    void restoreOfForeignBackupIsNotFound() throws Exception {
        UUID backupId = UUID.randomUUID();
        when(canvasService.restoreBackup(1L, null, backupId)).thenThrow(new FlowNotFoundException("Backup not found: " + backupId));

        mockMvc.perform(post("/api/flows/1/backups/" + backupId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("error"));
    }
}
