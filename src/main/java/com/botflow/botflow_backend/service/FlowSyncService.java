package com.botflow.botflow_backend.service;

import com.botflow.botflow_backend.exception.FlowNotFoundException;
import com.botflow.botflow_backend.exception.FlowValidationException;
import com.botflow.botflow_backend.model.domain.FlowEdge;
import com.botflow.botflow_backend.model.domain.FlowNode;
import com.botflow.botflow_backend.model.domain.NodeType;
import com.botflow.botflow_backend.model.dto.FlowDiffDto;
import com.botflow.botflow_backend.model.dto.FlowEdgeDto;
import com.botflow.botflow_backend.model.dto.FlowNodeDto;
import com.botflow.botflow_backend.model.dto.NodeDataDto;
import com.botflow.botflow_backend.model.dto.PositionDto;
import com.botflow.botflow_backend.model.dto.SyncResult;
import com.botflow.botflow_backend.repository.FlowEdgeRepository;
import com.botflow.botflow_backend.repository.FlowNodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Reconciles editor payloads with the persisted graph of one bot.
 *
 * <p>{@link #replaceGraph} is replace-by-identity: the payload is the complete graph, nodes and
 * edges are matched to live rows by frontend id, matches are updated in place, the rest are
 * inserted, and live rows missing from the payload are soft-deleted. {@link #applyDiff} applies an
 * editor-computed change set with the same identity rules.
 *
 * <p>Edges whose endpoints cannot be resolved are skipped and reported in the {@link SyncResult};
 * they never fail the write. Everything else runs in the caller's transaction, so any exception
 * leaves the graph untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FlowSyncService {

    static final int MAX_FRONTEND_ID_LENGTH = 100;

    private final FlowNodeRepository nodeRepository;
    private final FlowEdgeRepository edgeRepository;

    // ── Full replace ──────────────────────────────────────────────────────────

    @Transactional
    public SyncResult replaceGraph(Long botId, List<FlowNodeDto> nodes, List<FlowEdgeDto> edges) {
        if (nodes == null || edges == null) {
            throw new FlowValidationException("Payload must contain both 'nodes' and 'edges' lists");
        }
        validateIds(nodes.stream().map(FlowNodeDto::id).toList(), "node");
        validateIds(edges.stream().map(FlowEdgeDto::id).toList(), "edge");

        Counter counter = new Counter();

        List<FlowNode> liveNodes = nodeRepository.findByBotIdAndDeletedFalseOrderByIdAsc(botId);
        Map<String, FlowNode> existingNodes = new HashMap<>();
        for (FlowNode node : liveNodes) {
            existingNodes.putIfAbsent(node.externalId(), node);
        }

        // Only nodes submitted in this request may anchor an edge
        Map<String, FlowNode> submitted = new LinkedHashMap<>();
        for (FlowNodeDto dto : nodes) {
            String key = hasText(dto.id()) ? dto.id().trim() : generateFrontendId("node");
            FlowNode node = existingNodes.get(key);
            if (node != null) {
                node.setFrontendId(key);
                applyNodeFields(node, dto);
                counter.nodesUpdated++;
            } else {
                node = newNode(botId, key);
                applyNodeFields(node, dto);
                node = nodeRepository.save(node);
                counter.nodesCreated++;
                log.debug("Bot {}: created node {} (frontend id {})", botId, node.getId(), key);
            }
            submitted.put(key, node);
        }

        Set<FlowNode> keptNodes = identitySet(submitted.values());
        for (FlowNode node : liveNodes) {
            if (!keptNodes.contains(node)) {
                node.setDeleted(true);
                counter.nodesDeleted++;
            }
        }

        List<FlowEdge> liveEdges = edgeRepository.findByBotIdAndDeletedFalseOrderByIdAsc(botId);
        Map<String, FlowEdge> existingEdges = new HashMap<>();
        for (FlowEdge edge : liveEdges) {
            existingEdges.putIfAbsent(edge.externalId(), edge);
        }

        Set<FlowEdge> kept = identitySet(List.of());
        for (FlowEdgeDto dto : edges) {
            FlowNode source = dto.source() != null ? submitted.get(dto.source().trim()) : null;
            FlowNode target = dto.target() != null ? submitted.get(dto.target().trim()) : null;
            if (source == null || target == null) {
                log.warn("Bot {}: skipping edge {} with unresolvable endpoints {} -> {}",
                        botId, dto.id(), dto.source(), dto.target());
                counter.drop(dto.id());
                continue;
            }
            String key = hasText(dto.id()) ? dto.id().trim() : generateFrontendId("edge");
            FlowEdge edge = existingEdges.get(key);
            if (edge != null) {
                edge.setFrontendId(key);
                applyEdgeFields(edge, dto, source, target);
                counter.edgesUpdated++;
            } else {
                edge = newEdge(botId, key);
                applyEdgeFields(edge, dto, source, target);
                edge = edgeRepository.save(edge);
                counter.edgesCreated++;
            }
            kept.add(edge);
        }

        for (FlowEdge edge : liveEdges) {
            if (!kept.contains(edge)) {
                edge.setDeleted(true);
                counter.edgesDeleted++;
            }
        }

        SyncResult result = counter.toResult();
        log.info("Bot {}: graph replaced (nodes +{} ~{} -{}, edges +{} ~{} -{}, dropped {})", botId,
                result.nodesCreated(), result.nodesUpdated(), result.nodesDeleted(),
                result.edgesCreated(), result.edgesUpdated(), result.edgesDeleted(), result.droppedEdges());
        return result;
    }

    // ── Incremental diff ─────────────────────────────────────────────────────

    @Transactional
    public SyncResult applyDiff(Long botId, FlowDiffDto diff) {
        if (diff == null) {
            throw new FlowValidationException("Missing diff");
        }
        validateIds(diff.nodesToCreate().stream().map(FlowNodeDto::id).toList(), "node");
        validateIds(diff.edgesToCreate().stream().map(FlowEdgeDto::id).toList(), "edge");

        Counter counter = new Counter();

        Map<String, FlowNode> liveNodes = new HashMap<>();
        for (FlowNode node : nodeRepository.findByBotIdAndDeletedFalseOrderByIdAsc(botId)) {
            liveNodes.putIfAbsent(node.externalId(), node);
        }
        Map<String, FlowEdge> liveEdges = new LinkedHashMap<>();
        for (FlowEdge edge : edgeRepository.findByBotIdAndDeletedFalseOrderByIdAsc(botId)) {
            liveEdges.putIfAbsent(edge.externalId(), edge);
        }

        for (FlowNodeDto dto : diff.nodesToCreate()) {
            String key = hasText(dto.id()) ? dto.id().trim() : generateFrontendId("node");
            FlowNode existing = liveNodes.get(key);
            if (existing != null) {
                log.info("Bot {}: node {} already exists, applying create as update", botId, key);
                mergeNodeFields(existing, dto);
                counter.nodesUpdated++;
                continue;
            }
            FlowNode node = newNode(botId, key);
            applyNodeFields(node, dto);
            liveNodes.put(key, nodeRepository.save(node));
            counter.nodesCreated++;
        }

        for (FlowNodeDto dto : diff.nodesToUpdate()) {
            FlowNode node = dto.id() != null ? liveNodes.get(dto.id().trim()) : null;
            if (node == null) {
                throw new FlowNotFoundException("Node not found for update: " + dto.id());
            }
            mergeNodeFields(node, dto);
            counter.nodesUpdated++;
        }

        for (String nodeId : diff.nodesToDelete()) {
            FlowNode node = nodeId != null ? liveNodes.remove(nodeId.trim()) : null;
            if (node == null) {
                log.warn("Bot {}: node {} not found for delete", botId, nodeId);
                continue;
            }
            node.setDeleted(true);
            counter.nodesDeleted++;
            // Edges may not outlive their endpoints
            liveEdges.values().removeIf(edge -> {
                if (node.getId().equals(edge.getSourceNodeId()) || node.getId().equals(edge.getTargetNodeId())) {
                    edge.setDeleted(true);
                    counter.edgesDeleted++;
                    return true;
                }
                return false;
            });
        }
        if (counter.nodesDeleted > 0) {
            // Cascaded soft deletes must reach the live-id unique index before an id is reused below
            edgeRepository.flush();
        }

        for (FlowEdgeDto dto : diff.edgesToCreate()) {
            FlowNode source = dto.source() != null ? liveNodes.get(dto.source().trim()) : null;
            FlowNode target = dto.target() != null ? liveNodes.get(dto.target().trim()) : null;
            if (source == null || target == null) {
                log.warn("Bot {}: skipping new edge {} with unresolvable endpoints {} -> {}",
                        botId, dto.id(), dto.source(), dto.target());
                counter.drop(dto.id());
                continue;
            }
            String key = hasText(dto.id()) ? dto.id().trim() : generateFrontendId("edge");
            FlowEdge edge = liveEdges.get(key);
            boolean created = edge == null;
            if (created) {
                edge = newEdge(botId, key);
            }
            applyEdgeFields(edge, dto, source, target);
            if (created) {
                liveEdges.put(key, edgeRepository.save(edge));
                counter.edgesCreated++;
            } else {
                counter.edgesUpdated++;
            }
        }

        for (FlowEdgeDto dto : diff.edgesToUpdate()) {
            FlowEdge edge = dto.id() != null ? liveEdges.get(dto.id().trim()) : null;
            if (edge == null) {
                log.warn("Bot {}: edge {} not found for update", botId, dto.id());
                counter.drop(dto.id());
                continue;
            }
            FlowNode source = dto.source() != null ? liveNodes.get(dto.source().trim()) : null;
            FlowNode target = dto.target() != null ? liveNodes.get(dto.target().trim()) : null;
            if ((dto.source() != null && source == null) || (dto.target() != null && target == null)) {
                log.warn("Bot {}: skipping update of edge {}, endpoints {} -> {} do not resolve",
                        botId, dto.id(), dto.source(), dto.target());
                counter.drop(dto.id());
                continue;
            }
            mergeEdgeFields(edge, dto, source, target);
            counter.edgesUpdated++;
        }

        for (String edgeId : diff.edgesToDelete()) {
            FlowEdge edge = edgeId != null ? liveEdges.remove(edgeId.trim()) : null;
            if (edge == null) {
                log.warn("Bot {}: edge {} not found for delete", botId, edgeId);
                continue;
            }
            edge.setDeleted(true);
            counter.edgesDeleted++;
        }

        SyncResult result = counter.toResult();
        log.info("Bot {}: diff applied (nodes +{} ~{} -{}, edges +{} ~{} -{}, dropped {})", botId,
                result.nodesCreated(), result.nodesUpdated(), result.nodesDeleted(),
                result.edgesCreated(), result.edgesUpdated(), result.edgesDeleted(), result.droppedEdges());
        return result;
    }

    // ── Field mapping ────────────────────────────────────────────────────────

    private static FlowNode newNode(Long botId, String frontendId) {
        FlowNode node = new FlowNode();
        node.setBotId(botId);
        node.setFrontendId(frontendId);
        return node;
    }

    private static FlowEdge newEdge(Long botId, String frontendId) {
        FlowEdge edge = new FlowEdge();
        edge.setBotId(botId);
        edge.setFrontendId(frontendId);
        return edge;
    }

    /** Full overwrite of every editor-owned field; absent values fall back to defaults. */
    private static void applyNodeFields(FlowNode node, FlowNodeDto dto) {
        PositionDto position = dto.position() != null ? dto.position() : new PositionDto(0.0, 0.0);
        NodeDataDto data = dto.data() != null ? dto.data() : new NodeDataDto("", "");
        node.setNodeType(hasText(dto.type()) ? dto.type().trim() : NodeType.MESSAGE.wireName());
        node.setPositionX(position.x() != null ? position.x() : 0.0);
        node.setPositionY(position.y() != null ? position.y() : 0.0);
        node.setUserMessage(data.label() != null ? data.label() : "");
        node.setBotResponse(data.message() != null ? data.message() : "");
        node.setMetadata(dto.metadata() != null ? new HashMap<>(dto.metadata()) : new HashMap<>());
    }

    /** Overwrites only supplied fields; metadata is merged into what is already stored. */
    private static void mergeNodeFields(FlowNode node, FlowNodeDto dto) {
        if (hasText(dto.type())) node.setNodeType(dto.type().trim());
        if (dto.position() != null) {
            if (dto.position().x() != null) node.setPositionX(dto.position().x());
            if (dto.position().y() != null) node.setPositionY(dto.position().y());
        }
        if (dto.data() != null) {
            if (dto.data().label() != null) node.setUserMessage(dto.data().label());
            if (dto.data().message() != null) node.setBotResponse(dto.data().message());
        }
        if (dto.metadata() != null) {
            Map<String, Object> merged = node.getMetadata() != null ? new HashMap<>(node.getMetadata()) : new HashMap<>();
            merged.putAll(dto.metadata());
            node.setMetadata(merged);
        }
    }

    private static void applyEdgeFields(FlowEdge edge, FlowEdgeDto dto, FlowNode source, FlowNode target) {
        edge.setSourceNodeId(source.getId());
        edge.setTargetNodeId(target.getId());
        edge.setSourceHandle(blankToNull(dto.sourceHandle()));
        edge.setTargetHandle(blankToNull(dto.targetHandle()));
        edge.setEdgeType(hasText(dto.type()) ? dto.type().trim() : "default");
        edge.setAnimated(dto.animated() == null || dto.animated());
        edge.setLabel(blankToNull(dto.label()));
        edge.setCondition(blankToNull(dto.condition()));
        edge.setStyle(dto.style() != null ? new HashMap<>(dto.style()) : new HashMap<>());
        edge.setMetadata(dto.metadata() != null ? new HashMap<>(dto.metadata()) : new HashMap<>());
    }

    private static void mergeEdgeFields(FlowEdge edge, FlowEdgeDto dto, FlowNode source, FlowNode target) {
        if (source != null) edge.setSourceNodeId(source.getId());
        if (target != null) edge.setTargetNodeId(target.getId());
        if (dto.sourceHandle() != null) edge.setSourceHandle(blankToNull(dto.sourceHandle()));
        if (dto.targetHandle() != null) edge.setTargetHandle(blankToNull(dto.targetHandle()));
        if (hasText(dto.type())) edge.setEdgeType(dto.type().trim());
        if (dto.animated() != null) edge.setAnimated(dto.animated());
        if (dto.label() != null) edge.setLabel(blankToNull(dto.label()));
        if (dto.condition() != null) edge.setCondition(blankToNull(dto.condition()));
        if (dto.style() != null) edge.setStyle(new HashMap<>(dto.style()));
        if (dto.metadata() != null) {
            Map<String, Object> merged = edge.getMetadata() != null ? new HashMap<>(edge.getMetadata()) : new HashMap<>();
            merged.putAll(dto.metadata());
            edge.setMetadata(merged);
        }
    }

    // ── Validation ───────────────────────────────────────────────────────────

    private static void validateIds(List<String> ids, String kind) {
        Set<String> seen = new HashSet<>();
        for (String raw : ids) {
            if (!hasText(raw)) continue;
            String id = raw.trim();
            if (id.length() > MAX_FRONTEND_ID_LENGTH) {
                throw new FlowValidationException("The " + kind + " id '" + id.substring(0, 20)
                        + "...' is longer than " + MAX_FRONTEND_ID_LENGTH + " characters");
            }
            if (!seen.add(id)) {
                throw new FlowValidationException("Two " + kind + "s share the id '" + id + "'. Each " + kind + " id must be unique.");
            }
        }
    }

    // Entities use value equality over mutable fields, so membership is tracked by identity
    private static <T> Set<T> identitySet(Collection<T> initial) {
        Set<T> set = Collections.newSetFromMap(new IdentityHashMap<>());
        set.addAll(initial);
        return set;
    }

    static String generateFrontendId(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String blankToNull(String value) {
        return hasText(value) ? value.trim() : null;
    }

    private static final class Counter {
        int nodesCreated;
        int nodesUpdated;
        int nodesDeleted;
        int edgesCreated;
        int edgesUpdated;
        int edgesDeleted;
        final List<String> dropped = new ArrayList<>();

        void drop(String edgeId) {
            dropped.add(edgeId != null ? edgeId : "(unnamed)");
        }

        SyncResult toResult() {
            return new SyncResult(nodesCreated, nodesUpdated, nodesDeleted,
                    edgesCreated, edgesUpdated, edgesDeleted, dropped.size(), List.copyOf(dropped));
        }
    }
}
