package com.botflow.botflow_backend.service;

import com.botflow.botflow_backend.cache.CacheKeys;
import com.botflow.botflow_backend.cache.FlowGraphChangedEvent;
import com.botflow.botflow_backend.cache.GraphCache;
import com.botflow.botflow_backend.exception.FlowNotFoundException;
import com.botflow.botflow_backend.exception.FlowValidationException;
import com.botflow.botflow_backend.model.domain.Bot;
import com.botflow.botflow_backend.model.dto.BackupSummaryDto;
import com.botflow.botflow_backend.model.dto.CanvasSaveDto;
import com.botflow.botflow_backend.model.dto.SyncResult;
import com.botflow.botflow_backend.model.graph.FlowGraph;
import com.botflow.botflow_backend.repository.BotRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Editor-facing operations on a bot's graph: cached reads, full or incremental writes, backup
 * listing and restore.
 *
 * <p>Every write locks the bot row first, snapshots the current graph, and publishes a
 * {@link FlowGraphChangedEvent} that clears the read cache once the transaction commits.
 */
@Slf4j
@Service
public class FlowCanvasService {

    private final BotRepository botRepository;
    private final GraphStore graphStore;
    private final CanvasMapper canvasMapper;
    private final GraphCache graphCache;
    private final FlowSyncService syncService;
    private final FlowBackupService backupService;
    private final ApplicationEventPublisher eventPublisher;
    private final Duration cacheTtl;

    public FlowCanvasService(BotRepository botRepository,
                             GraphStore graphStore,
                             CanvasMapper canvasMapper,
                             GraphCache graphCache,
                             FlowSyncService syncService,
                             FlowBackupService backupService,
                             ApplicationEventPublisher eventPublisher,
                             @Value("${app.flow.cache.ttl-seconds:300}") long cacheTtlSeconds) {
        this.botRepository = botRepository;
        this.graphStore = graphStore;
        this.canvasMapper = canvasMapper;
        this.graphCache = graphCache;
        this.syncService = syncService;
        this.backupService = backupService;
        this.eventPublisher = eventPublisher;
        this.cacheTtl = Duration.ofSeconds(Math.max(1, cacheTtlSeconds));
    }

    /** Editor read view plus whether it was served from the cache. */
    public record CanvasView(CanvasSaveDto canvas, boolean fromCache) {}

    // ── Reads ────────────────────────────────────────────────────────────────

    @Transactional(readOnly = true)
    public CanvasView getCanvas(Long botId, UUID userId) {
        Bot bot = requireBot(botId, userId);
        String key = graphKey(botId);
        Optional<FlowGraph> cached = graphCache.get(key, FlowGraph.class);
        if (cached.isPresent()) {
            return new CanvasView(canvasMapper.toCanvas(cached.get()), true);
        }
        FlowGraph graph = graphStore.load(bot);
        graphCache.put(key, graph, cacheTtl);
        return new CanvasView(canvasMapper.toCanvas(graph), false);
    }

    /** Live graph for the chat runtime, through the same cache entry the editor read uses. */
    public FlowGraph loadGraph(Bot bot) {
        String key = graphKey(bot.getId());
        return graphCache.get(key, FlowGraph.class).orElseGet(() -> {
            FlowGraph graph = graphStore.load(bot);
            graphCache.put(key, graph, cacheTtl);
            return graph;
        });
    }

    @Transactional(readOnly = true)
    public List<BackupSummaryDto> listBackups(Long botId, UUID userId) {
        requireBot(botId, userId);
        return backupService.listBackups(botId);
    }

    // ── Writes ───────────────────────────────────────────────────────────────

    @Transactional
    public SyncResult saveCanvas(Long botId, UUID userId, CanvasSaveDto body) {
        if (body == null) {
            throw new FlowValidationException("Missing request body");
        }
        if (body.diff() == null && (body.nodes() == null || body.edges() == null)) {
            throw new FlowValidationException("Payload must contain both 'nodes' and 'edges' lists, or a 'diff'");
        }
        Bot bot = lockBot(botId, userId);
        backupService.createBackup(bot);

        SyncResult result = body.diff() != null
                ? syncService.applyDiff(botId, body.diff())
                : syncService.replaceGraph(botId, body.nodes(), body.edges());
        rename(bot, body.name());

        eventPublisher.publishEvent(new FlowGraphChangedEvent(botId, body.diff() != null ? "diff" : "sync"));
        return result;
    }

    @Transactional
    public SyncResult restoreBackup(Long botId, UUID userId, UUID backupId) {
        Bot bot = lockBot(botId, userId);
        CanvasSaveDto snapshot = backupService.loadSnapshot(botId, backupId);
        backupService.createBackup(bot, backupId);

        SyncResult result = syncService.replaceGraph(botId,
                snapshot.nodes() != null ? snapshot.nodes() : List.of(),
                snapshot.edges() != null ? snapshot.edges() : List.of());
        rename(bot, snapshot.name());

        log.info("Bot {}: restored backup {}", botId, backupId);
        eventPublisher.publishEvent(new FlowGraphChangedEvent(botId, "restore " + backupId));
        return result;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    static String graphKey(Long botId) {
        return CacheKeys.forBot(CacheKeys.FLOW_NAMESPACE, botId, "graph");
    }

    private Bot requireBot(Long botId, UUID userId) {
        return botRepository.findById(botId)
                .filter(bot -> bot.isOwnedBy(userId))
                .orElseThrow(() -> FlowNotFoundException.bot(botId));
    }

    private Bot lockBot(Long botId, UUID userId) {
        return botRepository.findByIdForUpdate(botId)
                .filter(bot -> bot.isOwnedBy(userId))
                .orElseThrow(() -> FlowNotFoundException.bot(botId));
    }

    private static void rename(Bot bot, String name) {
        if (name != null && !name.isBlank()) {
            bot.setName(name.trim());
        }
    }
}
