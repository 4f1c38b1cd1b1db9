package com.botflow.botflow_backend.service;

import com.botflow.botflow_backend.dispatch.OutboundReply;
import com.botflow.botflow_backend.engine.TraversalEngine;
import com.botflow.botflow_backend.engine.TraversalOutcome;
import com.botflow.botflow_backend.exception.BotUnavailableException;
import com.botflow.botflow_backend.exception.FlowNotFoundException;
import com.botflow.botflow_backend.exception.FlowValidationException;
import com.botflow.botflow_backend.model.domain.Bot;
import com.botflow.botflow_backend.model.domain.ConversationState;
import com.botflow.botflow_backend.model.dto.ChatRequest;
import com.botflow.botflow_backend.model.dto.ChatResponse;
import com.botflow.botflow_backend.model.graph.FlowGraph;
import com.botflow.botflow_backend.repository.BotRepository;
import com.botflow.botflow_backend.repository.ConversationStateRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One chat step: load the contact's pointer, walk the graph one node, store the new pointer and
 * count the message. Nothing is kept between requests; every step starts from the database.
 */
@Slf4j
@Service
public class ChatService {

    static final int MAX_CONTACT_LENGTH = 100;

    private final BotRepository botRepository;
    private final ConversationStateRepository stateRepository;
    private final FlowCanvasService canvasService;
    private final TraversalEngine traversalEngine;
    private final ApplicationEventPublisher eventPublisher;
    private final String fallbackMessage;

    public ChatService(BotRepository botRepository,
                       ConversationStateRepository stateRepository,
                       FlowCanvasService canvasService,
                       TraversalEngine traversalEngine,
                       ApplicationEventPublisher eventPublisher,
                       @Value("${app.chat.fallback-message:Sorry, I didn't understand your message. Could you rephrase it?}")
                       String fallbackMessage) {
        this.botRepository = botRepository;
        this.stateRepository = stateRepository;
        this.canvasService = canvasService;
        this.traversalEngine = traversalEngine;
        this.eventPublisher = eventPublisher;
        this.fallbackMessage = fallbackMessage;
    }

    /**
     * @param contact explicit contact identifier (webhook path); when null the request body's
     *                {@code contact} is used, and when that is blank too the step is stateless
     */
    @Transactional
    public ChatResponse handleMessage(Long botId, String contact, ChatRequest request) {
        if (request == null || request.message() == null || request.message().isBlank()) {
            throw new FlowValidationException("Message is required");
        }
        Bot bot = botRepository.findById(botId).orElseThrow(() -> FlowNotFoundException.bot(botId));
        if (!bot.isWebchatEnabled()) {
            throw new BotUnavailableException(botId);
        }

        String contactId = resolveContact(contact != null ? contact : request.contact());
        String message = request.message().trim();

        ConversationState state = contactId != null
                ? stateRepository.findByBotIdAndContactIdentifier(botId, contactId).orElse(null)
                : null;
        Long pointer = contactId != null
                ? (state != null ? state.getCurrentNodeId() : null)
                : request.currentFlowId();

        FlowGraph graph = canvasService.loadGraph(bot);
        TraversalOutcome outcome = traversalEngine.next(graph, pointer, message);

        // An exhausted step never opens a conversation, in either mode
        boolean newConversation;
        if (contactId != null) {
            newConversation = state == null && !outcome.exhausted();
            if (!outcome.exhausted()) {
                storePointer(state, botId, contactId, outcome.nextNode().id());
            }
        } else {
            newConversation = !outcome.exhausted()
                    && request.currentFlowId() == null
                    && (request.conversationHistory() == null || request.conversationHistory().isEmpty());
        }

        botRepository.incrementMessageCount(botId);
        if (newConversation) {
            botRepository.incrementConversationCount(botId);
        }

        String responseText;
        Long nextPointer;
        if (outcome.exhausted()) {
            log.info("Bot {}: no node matched '{}' (pointer {}), answering with fallback", botId, message, pointer);
            responseText = fallbackMessage;
            nextPointer = pointer;
        } else {
            responseText = outcome.nextNode().botResponse() != null ? outcome.nextNode().botResponse() : "";
            nextPointer = outcome.nextNode().id();
        }

        eventPublisher.publishEvent(new OutboundReply(botId, contactId,
                outcome.exhausted() ? null : nextPointer, responseText, outcome.options()));

        return new ChatResponse(
                "success",
                responseText,
                appendHistory(request.conversationHistory(), message, responseText, nextPointer),
                nextPointer,
                outcome.decision(),
                outcome.options()
        );
    }

    private void storePointer(ConversationState state, Long botId, String contactId, Long nodeId) {
        if (state == null) {
            state = new ConversationState();
            state.setBotId(botId);
            state.setContactIdentifier(contactId);
            log.info("Bot {}: new conversation with {}", botId, contactId);
        }
        state.setCurrentNodeId(nodeId);
        stateRepository.save(state);
    }

    private static String resolveContact(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String contact = raw.trim();
        if (contact.length() > MAX_CONTACT_LENGTH) {
            throw new FlowValidationException("Contact identifier is longer than " + MAX_CONTACT_LENGTH + " characters");
        }
        return contact;
    }

    private static List<Map<String, Object>> appendHistory(List<Map<String, Object>> history,
                                                           String message, String response, Long flowId) {
        List<Map<String, Object>> updated = history != null ? new ArrayList<>(history) : new ArrayList<>();

        Map<String, Object> userEntry = new LinkedHashMap<>();
        userEntry.put("role", "user");
        userEntry.put("message", message);
        updated.add(userEntry);

        Map<String, Object> botEntry = new LinkedHashMap<>();
        botEntry.put("role", "bot");
        botEntry.put("message", response);
        botEntry.put("flow_id", flowId);
        updated.add(botEntry);
        return updated;
    }
}
