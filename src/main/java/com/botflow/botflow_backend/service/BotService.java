package com.botflow.botflow_backend.service;

import com.botflow.botflow_backend.exception.FlowNotFoundException;
import com.botflow.botflow_backend.exception.FlowValidationException;
import com.botflow.botflow_backend.model.domain.Bot;
import com.botflow.botflow_backend.model.domain.FlowNode;
import com.botflow.botflow_backend.model.domain.NodeType;
import com.botflow.botflow_backend.model.dto.BotCreateDto;
import com.botflow.botflow_backend.model.dto.BotSummaryDto;
import com.botflow.botflow_backend.model.dto.MenuOptionDto;
import com.botflow.botflow_backend.repository.BotRepository;
import com.botflow.botflow_backend.repository.FlowNodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class BotService {

    static final int MAX_MENU_OPTIONS = 3;

    private final BotRepository botRepository;
    private final FlowNodeRepository nodeRepository;

    /**
     * Creates a bot and, when menu options are given, one {@code menu_option} node per option
     * laid out left to right on the canvas.
     */
    @Transactional
    public BotSummaryDto createBot(BotCreateDto body, UUID ownerId) {
        if (body == null || body.name() == null || body.name().isBlank()) {
            throw new FlowValidationException("Bot name is required");
        }
        List<MenuOptionDto> options = body.menuOptions();
        if (options.size() > MAX_MENU_OPTIONS) {
            throw new FlowValidationException("At most " + MAX_MENU_OPTIONS + " menu options are allowed");
        }
        for (MenuOptionDto option : options) {
            if (option == null || option.label() == null || option.label().isBlank()) {
                throw new FlowValidationException("Every menu option needs a label");
            }
        }

        Bot bot = new Bot();
        bot.setName(body.name().trim());
        bot.setOwnerId(ownerId);
        bot.setWebchatEnabled(body.webchatEnabled() == null || body.webchatEnabled());
        bot = botRepository.save(bot);

        for (int index = 0; index < options.size(); index++) {
            nodeRepository.save(menuNode(bot.getId(), options.get(index), index));
        }

        log.info("Created bot {} '{}' with {} menu options", bot.getId(), bot.getName(), options.size());
        return BotSummaryDto.of(bot);
    }

    @Transactional(readOnly = true)
    public BotSummaryDto getBot(Long botId, UUID userId) {
        return botRepository.findById(botId)
                .filter(bot -> bot.isOwnedBy(userId))
                .map(BotSummaryDto::of)
                .orElseThrow(() -> FlowNotFoundException.bot(botId));
    }

    static FlowNode menuNode(Long botId, MenuOptionDto option, int index) {
        String label = option.label().trim();
        FlowNode node = new FlowNode();
        node.setBotId(botId);
        node.setFrontendId("menu-" + index);
        node.setNodeType(NodeType.MENU_OPTION.wireName());
        node.setUserMessage(label.toLowerCase(Locale.ROOT));
        node.setBotResponse("You selected " + label + ". How can I help you with this?");
        node.setPosition(index);
        node.setPositionX(100.0 * index);
        node.setPositionY(100.0);
        node.setMetadata(new HashMap<>());
        return node;
    }
}
