package com.botflow.botflow_backend.service;

import com.botflow.botflow_backend.exception.FlowNotFoundException;
import com.botflow.botflow_backend.exception.FlowValidationException;
import com.botflow.botflow_backend.model.domain.FlowEdge;
import com.botflow.botflow_backend.model.domain.FlowNode;
import com.botflow.botflow_backend.model.dto.FlowDiffDto;
import com.botflow.botflow_backend.model.dto.FlowEdgeDto;
import com.botflow.botflow_backend.model.dto.FlowNodeDto;
import com.botflow.botflow_backend.model.dto.NodeDataDto;
import com.botflow.botflow_backend.model.dto.PositionDto;
import com.botflow.botflow_backend.model.dto.SyncResult;
import com.botflow.botflow_backend.repository.FlowEdgeRepository;
import com.botflow.botflow_backend.repository.FlowNodeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class FlowSyncServiceTest {

    private static final Long BOT_ID = 5L;

    @Mock
    private FlowNodeRepository nodeRepository;

    @Mock
    private FlowEdgeRepository edgeRepository;

    private final List<FlowNode> nodeRows = new ArrayList<>();
    private final List<FlowEdge> edgeRows = new ArrayList<>();
    private final AtomicLong ids = new AtomicLong(100);

    private FlowSyncService service;

    @BeforeEach
    void setUp() {
        lenient().when(nodeRepository.findByBotIdAndDeletedFalseOrderByIdAsc(eq(BOT_ID)))
                .thenAnswer(inv -> nodeRows.stream().filter(n -> !n.isDeleted()).toList());
        lenient().when(edgeRepository.findByBotIdAndDeletedFalseOrderByIdAsc(eq(BOT_ID)))
                .thenAnswer(inv -> edgeRows.stream().filter(e -> !e.isDeleted()).toList());
        lenient().when(nodeRepository.save(any(FlowNode.class))).thenAnswer(inv -> {
            FlowNode node = inv.getArgument(0);
            if (node.getId() == null) {
                node.setId(ids.incrementAndGet());
                nodeRows.add(node);
            }
            return node;
        });
        lenient().when(edgeRepository.save(any(FlowEdge.class))).thenAnswer(inv -> {
            FlowEdge edge = inv.getArgument(0);
            if (edge.getId() == null) {
                edge.setId(ids.incrementAndGet());
                edgeRows.add(edge);
            }
            return edge;
        });
        service = new FlowSyncService(nodeRepository, edgeRepository);
    }

    @Test
    void renamedNodeIsUpdatedInPlaceAndNewNodeIsCreated() {
        FlowNode a = storedNode(1L, "a", "start", "", "Welcome");
        FlowNode b = storedNode(2L, "b", "message", "hola", "Hi!");
        storedEdge(10L, "e1", a, b, "hola");

        SyncResult result = service.replaceGraph(BOT_ID,
                List.of(nodeDto("a", "start", "", "Welcome"),
                        nodeDto("b", "message", "hola", "Hello again"),
                        nodeDto("c", "message", "sí", "Great")),
                List.of(edgeDto("e1", "a", "b", "hola"), edgeDto("e2", "b", "c", "sí")));

        assertThat(liveNodes()).hasSize(3);
        assertThat(b.getId()).isEqualTo(2L);
        assertThat(b.getBotResponse()).isEqualTo("Hello again");
        FlowNode c = liveNodes().stream().filter(n -> "c".equals(n.getFrontendId())).findFirst().orElseThrow();

        assertThat(liveEdges()).hasSize(2);
        FlowEdge e2 = liveEdges().stream().filter(e -> "e2".equals(e.getFrontendId())).findFirst().orElseThrow();
        assertThat(e2.getSourceNodeId()).isEqualTo(2L);
        assertThat(e2.getTargetNodeId()).isEqualTo(c.getId());

        assertThat(result.nodesCreated()).isEqualTo(1);
        assertThat(result.nodesUpdated()).isEqualTo(2);
        assertThat(result.nodesDeleted()).isZero();
        assertThat(result.edgesCreated()).isEqualTo(1);
        assertThat(result.edgesUpdated()).isEqualTo(1);
        assertThat(result.droppedEdges()).isZero();
    }

    @Test
    void resubmittingSameGraphKeepsStorageIds() {
        service.replaceGraph(BOT_ID,
                List.of(nodeDto("a", "start", "", "Welcome"), nodeDto("b", "message", "x", "y")),
                List.of(edgeDto("e1", "a", "b", null)));
        List<Long> nodeIds = liveNodes().stream().map(FlowNode::getId).toList();
        List<Long> edgeIds = liveEdges().stream().map(FlowEdge::getId).toList();

        SyncResult second = service.replaceGraph(BOT_ID,
                List.of(nodeDto("a", "start", "", "Welcome"), nodeDto("b", "message", "x", "y")),
                List.of(edgeDto("e1", "a", "b", null)));

        assertThat(liveNodes()).extracting(FlowNode::getId).containsExactlyElementsOf(nodeIds);
        assertThat(liveEdges()).extracting(FlowEdge::getId).containsExactlyElementsOf(edgeIds);
        assertThat(second.nodesCreated()).isZero();
        assertThat(second.edgesCreated()).isZero();
    }

    @Test
    void nodesAndEdgesMissingFromPayloadAreSoftDeleted() {
        FlowNode a = storedNode(1L, "a", "start", "", "Welcome");
        FlowNode b = storedNode(2L, "b", "message", "", "Bye");
        FlowEdge edge = storedEdge(10L, "e1", a, b, null);

        SyncResult result = service.replaceGraph(BOT_ID, List.of(nodeDto("a", "start", "", "Welcome")), List.of());

        assertThat(b.isDeleted()).isTrue();
        assertThat(edge.isDeleted()).isTrue();
        assertThat(liveNodes()).containsExactly(a);
        assertThat(liveEdges()).isEmpty();
        assertThat(result.nodesDeleted()).isEqualTo(1);
        assertThat(result.edgesDeleted()).isEqualTo(1);
    }

    @Test
    void edgeWithUnknownEndpointIsDroppedNotFatal() {
        SyncResult result = service.replaceGraph(BOT_ID,
                List.of(nodeDto("a", "start", "", "Welcome")),
                List.of(edgeDto("bad", "a", "ghost", null)));

        assertThat(result.droppedEdges()).isEqualTo(1);
        assertThat(result.droppedEdgeIds()).containsExactly("bad");
        assertThat(liveNodes()).hasSize(1);
        assertThat(liveEdges()).isEmpty();
    }

    @Test
    void edgeCannotAnchorOnLiveNodeThatWasNotSubmitted() {
        storedNode(1L, "a", "start", "", "Welcome");

        SyncResult result = service.replaceGraph(BOT_ID,
                List.of(nodeDto("b", "message", "", "Hi")),
                List.of(edgeDto("e1", "a", "b", null)));

        assertThat(result.droppedEdges()).isEqualTo(1);
        assertThat(liveEdges()).isEmpty();
    }

    @Test
    void legacyNodeWithoutFrontendIdIsMatchedByStorageId() {
        FlowNode legacy = storedNode(3L, null, "message", "hi", "old");

        service.replaceGraph(BOT_ID, List.of(nodeDto("3", "message", "hi", "new")), List.of());

        assertThat(liveNodes()).containsExactly(legacy);
        assertThat(legacy.getFrontendId()).isEqualTo("3");
        assertThat(legacy.getBotResponse()).isEqualTo("new");
    }

    @Test
    void nodesWithoutIdGetGeneratedFrontendIds() {
        service.replaceGraph(BOT_ID, List.of(nodeDto(null, "message", "", "x")), List.of());

        assertThat(liveNodes()).singleElement()
                .satisfies(n -> assertThat(n.getFrontendId()).startsWith("node-"));
    }

    @Test
    void duplicateNodeIdsAreRejected() {
        assertThatThrownBy(() -> service.replaceGraph(BOT_ID,
                List.of(nodeDto("a", "message", "", "x"), nodeDto("a", "message", "", "y")), List.of()))
                .isInstanceOf(FlowValidationException.class)
                .hasMessageContaining("'a'");
    }

    @Test
    void missingEdgeListIsRejected() {
        assertThatThrownBy(() -> service.replaceGraph(BOT_ID, List.of(), null))
                .isInstanceOf(FlowValidationException.class);
    }

    @Test
    void diffNodeDeleteCascadesToItsEdges() {
        FlowNode a = storedNode(1L, "a", "start", "", "Welcome");
        FlowNode b = storedNode(2L, "b", "message", "", "Hi");
        FlowNode c = storedNode(3L, "c", "message", "", "Other");
        FlowEdge ab = storedEdge(10L, "ab", a, b, null);
        FlowEdge ac = storedEdge(11L, "ac", a, c, null);

        SyncResult result = service.applyDiff(BOT_ID,
                new FlowDiffDto(null, null, List.of("b"), null, null, null));

        assertThat(b.isDeleted()).isTrue();
        assertThat(ab.isDeleted()).isTrue();
        assertThat(ac.isDeleted()).isFalse();
        assertThat(result.nodesDeleted()).isEqualTo(1);
        assertThat(result.edgesDeleted()).isEqualTo(1);
    }

    @Test
    void diffFlushesCascadedDeletesBeforeReusingTheirEdgeIds() {
        FlowNode a = storedNode(1L, "a", "start", "", "Welcome");
        FlowNode b = storedNode(2L, "b", "message", "", "Hi");
        storedNode(3L, "c", "message", "", "Other");
        FlowEdge ab = storedEdge(10L, "ab", a, b, null);

        SyncResult result = service.applyDiff(BOT_ID, new FlowDiffDto(null, null, List.of("b"),
                List.of(edgeDto("ab", "a", "c", null)), null, null));

        InOrder order = inOrder(edgeRepository);
        order.verify(edgeRepository).flush();
        order.verify(edgeRepository).save(any(FlowEdge.class));
        assertThat(ab.isDeleted()).isTrue();
        assertThat(liveEdges()).singleElement().satisfies(edge -> {
            assertThat(edge.getId()).isNotEqualTo(10L);
            assertThat(edge.getFrontendId()).isEqualTo("ab");
            assertThat(edge.getTargetNodeId()).isEqualTo(3L);
        });
        assertThat(result.edgesCreated()).isEqualTo(1);
        assertThat(result.edgesDeleted()).isEqualTo(1);
    }

    @Test
    void diffWithoutNodeDeletesDoesNotFlush() {
        storedNode(1L, "a", "start", "", "Welcome");

        service.applyDiff(BOT_ID, new FlowDiffDto(List.of(nodeDto("b", "message", "", "Hi")),
                null, null, null, null, null));

        verify(edgeRepository, never()).flush();
    }

    @Test
    void diffUpdateOverwritesOnlySuppliedFields() {
        FlowNode a = storedNode(1L, "a", "message", "hello", "Hi there");
        a.setMetadata(Map.of("color", "red"));

        service.applyDiff(BOT_ID, new FlowDiffDto(null,
                List.of(new FlowNodeDto("a", null, null, new NodeDataDto(null, "Hey"), Map.of("size", 2))),
                null, null, null, null));

        assertThat(a.getUserMessage()).isEqualTo("hello");
        assertThat(a.getBotResponse()).isEqualTo("Hey");
        assertThat(a.getMetadata()).containsEntry("color", "red").containsEntry("size", 2);
    }

    @Test
    void diffUpdateOfMissingNodeIsNotFound() {
        assertThatThrownBy(() -> service.applyDiff(BOT_ID, new FlowDiffDto(null,
                List.of(nodeDto("ghost", "message", "", "x")), null, null, null, null)))
                .isInstanceOf(FlowNotFoundException.class);
    }

    @Test
    void diffCreatesNodesAndEdgesReferencingThem() {
        storedNode(1L, "a", "start", "", "Welcome");

        SyncResult result = service.applyDiff(BOT_ID, new FlowDiffDto(
                List.of(nodeDto("b", "message", "", "Hi")), null, null,
                List.of(edgeDto("ab", "a", "b", null), edgeDto("bx", "b", "missing", null)), null, null));

        assertThat(result.nodesCreated()).isEqualTo(1);
        assertThat(result.edgesCreated()).isEqualTo(1);
        assertThat(result.droppedEdgeIds()).containsExactly("bx");
        assertThat(liveEdges()).singleElement()
                .satisfies(e -> assertThat(e.getSourceNodeId()).isEqualTo(1L));
    }

    private FlowNode storedNode(Long id, String frontendId, String type, String trigger, String response) {
        FlowNode node = new FlowNode();
        node.setId(id);
        node.setBotId(BOT_ID);
        node.setFrontendId(frontendId);
        node.setNodeType(type);
        node.setUserMessage(trigger);
        node.setBotResponse(response);
        nodeRows.add(node);
        return node;
    }

    private FlowEdge storedEdge(Long id, String frontendId, FlowNode source, FlowNode target, String condition) {
        FlowEdge edge = new FlowEdge();
        edge.setId(id);
        edge.setBotId(BOT_ID);
        edge.setFrontendId(frontendId);
        edge.setSourceNodeId(source.getId());
        edge.setTargetNodeId(target.getId());
        edge.setCondition(condition);
        edgeRows.add(edge);
        return edge;
    }

    private List<FlowNode> liveNodes() {
        return nodeRows.stream().filter(n -> !n.isDeleted()).toList();
    }

    private List<FlowEdge> liveEdges() {
        return edgeRows.stream().filter(e -> !e.isDeleted()).toList();
    }

    private static FlowNodeDto nodeDto(String id, String type, String trigger, String response) {
        return new FlowNodeDto(id, type, new PositionDto(10.0, 20.0), new NodeDataDto(trigger, response), null);
    }

    private static FlowEdgeDto edgeDto(String id, String source, String target, String condition) {
        return new FlowEdgeDto(id, source, target, null, null, "default", true, null, condition, null, null);
    }
}
