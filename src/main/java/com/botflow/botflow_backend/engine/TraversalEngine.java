package com.botflow.botflow_backend.engine;

import com.botflow.botflow_backend.model.domain.NodeType;
import com.botflow.botflow_backend.model.dto.ChatOption;
import com.botflow.botflow_backend.model.graph.FlowGraph;
import com.botflow.botflow_backend.model.graph.GraphEdge;
import com.botflow.botflow_backend.model.graph.GraphNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The conversation state machine. Given a bot's live graph, the node a contact currently stands
 * on and the message they just sent, it picks the node to move to.
 *
 * <p>Stateless and side-effect free: the same inputs always produce the same outcome. Loading
 * the graph, reading and storing the pointer and counting messages are the caller's concern.
 *
 * <p>Order of resolution:
 * <ol>
 *   <li>from the current node: an outgoing edge whose condition equals the message, then one
 *       whose condition contains it, then the first outgoing edge; an {@code end} node with no
 *       way out restarts the flow</li>
 *   <li>otherwise the first node whose trigger phrase contains the message</li>
 *   <li>otherwise the entry node</li>
 * </ol>
 */
@Slf4j
@Component
public class TraversalEngine {

    static final String DEFAULT_OPTION_LABEL = "Option";

    public TraversalOutcome next(FlowGraph graph, Long currentNodeId, String message) {
        String normalized = normalize(message);

        Optional<GraphNode> next = fromCurrentNode(graph, currentNodeId, normalized)
                .or(() -> byTrigger(graph, normalized))
                .or(() -> entryNode(graph));

        if (next.isEmpty()) {
            log.debug("Bot {}: traversal exhausted (current node {})", graph.botId(), currentNodeId);
            return TraversalOutcome.none();
        }

        GraphNode node = next.get();
        boolean decision = node.hasType(NodeType.DECISION);
        return new TraversalOutcome(node, decision, decision ? options(graph, node) : List.of());
    }

    /**
     * The node a new conversation lands on: the target of the first {@code start} node's first
     * edge (or the start node itself when it has none), else the first {@code message} node.
     */
    public Optional<GraphNode> entryNode(FlowGraph graph) {
        Optional<GraphNode> start = graph.nodes().stream().filter(n -> n.hasType(NodeType.START)).findFirst();
        if (start.isPresent()) {
            GraphNode startNode = start.get();
            List<GraphEdge> outgoing = graph.outgoing(startNode.id());
            if (!outgoing.isEmpty()) {
                return graph.node(outgoing.get(0).targetNodeId()).or(() -> Optional.of(startNode));
            }
            return Optional.of(startNode);
        }
        return graph.nodes().stream().filter(n -> n.hasType(NodeType.MESSAGE)).findFirst();
    }

    // ── Transition rules ─────────────────────────────────────────────────────

    private Optional<GraphNode> fromCurrentNode(FlowGraph graph, Long currentNodeId, String message) {
        Optional<GraphNode> current = graph.node(currentNodeId);
        if (current.isEmpty()) {
            if (currentNodeId != null) {
                log.debug("Bot {}: current node {} is not live, ignoring it", graph.botId(), currentNodeId);
            }
            return Optional.empty();
        }

        List<GraphEdge> outgoing = graph.outgoing(currentNodeId);
        if (outgoing.isEmpty()) {
            return current.get().hasType(NodeType.END) ? entryNode(graph) : Optional.empty();
        }

        GraphEdge chosen = chooseEdge(outgoing, message);
        return graph.node(chosen.targetNodeId());
    }

    private static GraphEdge chooseEdge(List<GraphEdge> outgoing, String message) {
        for (GraphEdge edge : outgoing) {
            String condition = edge.effectiveCondition();
            if (condition != null && message.equals(normalize(condition))) {
                return edge;
            }
        }
        if (!message.isEmpty()) {
            for (GraphEdge edge : outgoing) {
                String condition = edge.effectiveCondition();
                if (condition != null && normalize(condition).contains(message)) {
                    return edge;
                }
            }
        }
        return outgoing.get(0);
    }

    private Optional<GraphNode> byTrigger(FlowGraph graph, String message) {
        if (message.isEmpty()) {
            return Optional.empty();
        }
        return graph.nodes().stream()
                .filter(n -> n.userMessage() != null && normalize(n.userMessage()).contains(message))
                .findFirst();
    }

    private List<ChatOption> options(FlowGraph graph, GraphNode decisionNode) {
        List<ChatOption> options = new ArrayList<>();
        for (GraphEdge edge : graph.outgoing(decisionNode.id())) {
            graph.node(edge.targetNodeId()).ifPresent(target -> {
                String label = edge.effectiveCondition() != null ? edge.effectiveCondition() : DEFAULT_OPTION_LABEL;
                options.add(new ChatOption(target.id(), label, target.userMessage()));
            });
        }
        return options;
    }

    private static String normalize(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }
}
