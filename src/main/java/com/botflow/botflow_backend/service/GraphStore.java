package com.botflow.botflow_backend.service;

import com.botflow.botflow_backend.model.domain.Bot;
import com.botflow.botflow_backend.model.domain.FlowEdge;
import com.botflow.botflow_backend.model.domain.FlowNode;
import com.botflow.botflow_backend.model.graph.FlowGraph;
import com.botflow.botflow_backend.model.graph.GraphEdge;
import com.botflow.botflow_backend.model.graph.GraphNode;
import com.botflow.botflow_backend.repository.FlowEdgeRepository;
import com.botflow.botflow_backend.repository.FlowNodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the live graph of a bot. Soft-deleted rows are invisible here, and an edge whose
 * endpoints are not both live nodes of the bot is treated as corrupt: it is logged and dropped
 * rather than failing the load.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GraphStore {

    static final Comparator<FlowNode> STORAGE_ORDER = Comparator
            .comparing(FlowNode::getPosition, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(FlowNode::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final FlowNodeRepository nodeRepository;
    private final FlowEdgeRepository edgeRepository;

    public FlowGraph load(Bot bot) {
        Long botId = bot.getId();
        List<FlowNode> nodes = new ArrayList<>(nodeRepository.findByBotIdAndDeletedFalseOrderByIdAsc(botId));
        nodes.sort(STORAGE_ORDER);

        Set<Long> liveNodeIds = new HashSet<>();
        nodes.forEach(n -> liveNodeIds.add(n.getId()));

        List<GraphEdge> edges = new ArrayList<>();
        for (FlowEdge edge : edgeRepository.findByBotIdAndDeletedFalseOrderByIdAsc(botId)) {
            if (!liveNodeIds.contains(edge.getSourceNodeId()) || !liveNodeIds.contains(edge.getTargetNodeId())) {
                log.warn("Bot {}: dropping corrupt edge {} ({} -> {}), endpoint is not a live node",
                        botId, edge.getId(), edge.getSourceNodeId(), edge.getTargetNodeId());
                continue;
            }
            edges.add(GraphEdge.of(edge));
        }

        return new FlowGraph(botId, bot.getName(), nodes.stream().map(GraphNode::of).toList(), edges);
    }
}
