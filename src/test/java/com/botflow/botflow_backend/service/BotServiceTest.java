package com.botflow.botflow_backend.service;

import com.botflow.botflow_backend.exception.FlowNotFoundException;
import com.botflow.botflow_backend.exception.FlowValidationException;
import com.botflow.botflow_backend.model.domain.Bot;
import com.botflow.botflow_backend.model.domain.FlowNode;
import com.botflow.botflow_backend.model.dto.BotCreateDto;
import com.botflow.botflow_backend.model.dto.BotSummaryDto;
import com.botflow.botflow_backend.model.dto.MenuOptionDto;
import com.botflow.botflow_backend.repository.BotRepository;
import com.botflow.botflow_backend.repository.FlowNodeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BotServiceTest {

    @Mock
    private BotRepository botRepository;

    @Mock
    private FlowNodeRepository nodeRepository;

    private BotService service;

    @BeforeEach
    void setUp() {
        service = new BotService(botRepository, nodeRepository);
    }

    @Test
    void menuOptionsBecomeMenuNodes() {
        UUID owner = UUID.randomUUID();
        when(botRepository.save(any(Bot.class))).thenAnswer(inv -> {
            Bot bot = inv.getArgument(0);
            bot.setId(77L);
            return bot;
        });

        BotSummaryDto summary = service.createBot(new BotCreateDto("  Pizza bot ", null, List.of(
                new MenuOptionDto("Order Pizza", "order"),
                new MenuOptionDto("Opening Hours", "hours"))), owner);

        assertThat(summary.id()).isEqualTo(77L);
        assertThat(summary.name()).isEqualTo("Pizza bot");
        assertThat(summary.ownerId()).isEqualTo(owner);
        assertThat(summary.webchatEnabled()).isTrue();

        ArgumentCaptor<FlowNode> nodes = ArgumentCaptor.forClass(FlowNode.class);
        verify(nodeRepository, times(2)).save(nodes.capture());
        FlowNode second = nodes.getAllValues().get(1);
        assertThat(second.getBotId()).isEqualTo(77L);
        assertThat(second.getNodeType()).isEqualTo("menu_option");
        assertThat(second.getFrontendId()).isEqualTo("menu-1");
        assertThat(second.getUserMessage()).isEqualTo("opening hours");
        assertThat(second.getBotResponse()).isEqualTo("You selected Opening Hours. How can I help you with this?");
        assertThat(second.getPosition()).isEqualTo(1);
        assertThat(second.getPositionX()).isEqualTo(100.0);
        assertThat(second.getPositionY()).isEqualTo(100.0);
    }

    @Test
    void moreThanThreeMenuOptionsAreRejected() {
        List<MenuOptionDto> options = List.of(new MenuOptionDto("a", "a"), new MenuOptionDto("b", "b"),
                new MenuOptionDto("c", "c"), new MenuOptionDto("d", "d"));

        assertThatThrownBy(() -> service.createBot(new BotCreateDto("Bot", true, options), null))
                .isInstanceOf(FlowValidationException.class)
                .hasMessageContaining("3");
        verifyNoInteractions(botRepository, nodeRepository);
    }

    @Test
    void blankNameIsRejected() {
        assertThatThrownBy(() -> service.createBot(new BotCreateDto(" ", null, null), null))
                .isInstanceOf(FlowValidationException.class);
    }

    @Test
    void botOfAnotherOwnerIsNotFound() {
        Bot bot = new Bot();
        bot.setId(5L);
        bot.setName("Private");
        bot.setOwnerId(UUID.randomUUID());
        when(botRepository.findById(5L)).thenReturn(Optional.of(bot));

        assertThatThrownBy(() -> service.getBot(5L, UUID.randomUUID()))
                .isInstanceOf(FlowNotFoundException.class);
        assertThat(service.getBot(5L, null).name()).isEqualTo("Private");
    }
}
