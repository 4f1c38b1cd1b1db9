package com.botflow.botflow_backend.service;

import com.botflow.botflow_backend.exception.FlowNotFoundException;
import com.botflow.botflow_backend.model.domain.Bot;
import com.botflow.botflow_backend.model.domain.FlowBackup;
import com.botflow.botflow_backend.model.dto.BackupSummaryDto;
import com.botflow.botflow_backend.model.dto.CanvasSaveDto;
import com.botflow.botflow_backend.model.graph.FlowGraph;
import com.botflow.botflow_backend.repository.FlowBackupRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Versioned snapshots of a bot's graph, taken right before a graph write.
 *
 * <p>Snapshots are stored in the editor-write shape with node references expressed as frontend
 * ids, so {@link #loadSnapshot} can be fed straight back through the sync path. At most
 * {@code app.flow.backup.max-per-bot} snapshots are kept per bot; the oldest goes first, unless it
 * is the one being restored.
 *
 * <p>Callers hold the bot's row lock (see {@code BotRepository#findByIdForUpdate}), which keeps
 * version numbering and eviction consistent between concurrent writers.
 */
@Slf4j
@Service
public class FlowBackupService {

    private final FlowBackupRepository backupRepository;
    private final GraphStore graphStore;
    private final CanvasMapper canvasMapper;
    private final ObjectMapper objectMapper;
    private final int maxPerBot;

    public FlowBackupService(FlowBackupRepository backupRepository,
                             GraphStore graphStore,
                             CanvasMapper canvasMapper,
                             ObjectMapper objectMapper,
                             @Value("${app.flow.backup.max-per-bot:10}") int maxPerBot) {
        this.backupRepository = backupRepository;
        this.graphStore = graphStore;
        this.canvasMapper = canvasMapper;
        this.objectMapper = objectMapper;
        this.maxPerBot = Math.max(1, maxPerBot);
    }

    @Transactional
    public UUID createBackup(Bot bot) {
        return createBackup(bot, null);
    }

    /**
     * Same as {@link #createBackup(Bot)}, but eviction passes over {@code retainedId}. A restore
     * uses this so the backup being restored stays in the list.
     */
    @Transactional
    @SuppressWarnings("unchecked")
    public UUID createBackup(Bot bot, UUID retainedId) {
        FlowGraph graph = graphStore.load(bot);
        CanvasSaveDto canvas = canvasMapper.toCanvas(graph);

        long version = backupRepository.findTopByBotIdOrderByVersionDesc(bot.getId())
                .map(b -> b.getVersion() + 1)
                .orElse(1L);

        FlowBackup backup = new FlowBackup();
        backup.setBotId(bot.getId());
        backup.setVersion(version);
        backup.setSnapshot(objectMapper.convertValue(canvas, Map.class));
        backup.setCreatedAt(Instant.now());
        backup = backupRepository.save(backup);

        evictOldest(bot.getId(), retainedId);
        log.info("Bot {}: backup {} created (version {}, {} nodes, {} edges)",
                bot.getId(), backup.getId(), version, graph.nodes().size(), graph.edges().size());
        return backup.getId();
    }

    @Transactional(readOnly = true)
    public List<BackupSummaryDto> listBackups(Long botId) {
        return backupRepository.findByBotIdOrderByVersionDesc(botId).stream()
                .map(b -> new BackupSummaryDto(b.getId(), b.getVersion(), toEpochSeconds(b.getCreatedAt())))
                .toList();
    }

    /**
     * @throws FlowNotFoundException when the backup is missing or belongs to another bot
     */
    @Transactional(readOnly = true)
    public CanvasSaveDto loadSnapshot(Long botId, UUID backupId) {
        FlowBackup backup = backupRepository.findById(backupId)
                .filter(b -> b.getBotId().equals(botId))
                .orElseThrow(() -> new FlowNotFoundException("Backup not found: " + backupId));
        return objectMapper.convertValue(backup.getSnapshot(), CanvasSaveDto.class);
    }

    private void evictOldest(Long botId, UUID retainedId) {
        long count = backupRepository.countByBotId(botId);
        if (count <= maxPerBot) {
            return;
        }
        List<FlowBackup> candidates = backupRepository.findByBotIdOrderByCreatedAtAscVersionAsc(botId).stream()
                .filter(b -> !b.getId().equals(retainedId))
                .toList();
        List<FlowBackup> evicted = candidates.subList(0, (int) Math.min(count - maxPerBot, candidates.size()));
        backupRepository.deleteAll(evicted);
        evicted.forEach(b -> log.info("Bot {}: evicted backup {} (version {})", botId, b.getId(), b.getVersion()));
    }

    private static double toEpochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }
}
