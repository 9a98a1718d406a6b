package com.mondayBi.biAgent.orchestrator.service;

import com.mondayBi.biAgent.llm.dto.GroqApiRequest;
import com.mondayBi.biAgent.orchestrator.model.ConversationTurn;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConversationHistoryTest {

    @Test
    public void shouldKeepOnlyTheMostRecentTurns() {
        List<ConversationTurn> history = new ArrayList<>();
        for (int i = 0; i < 14; i++) {
            history.add(new ConversationTurn(i % 2 == 0 ? ConversationTurn.Role.USER : ConversationTurn.Role.ASSISTANT,
                    "turn " + i));
        }

        List<ConversationTurn> window = ConversationHistory.trailingWindow(history);

        assertEquals(ConversationHistory.WINDOW, window.size());
        assertEquals("turn 4", window.get(0).getContent());
        assertEquals("turn 13", window.get(window.size() - 1).getContent());
        assertEquals(14, history.size());
    }

    @Test
    public void shouldHandleMissingHistory() {
        assertTrue(ConversationHistory.trailingWindow(null).isEmpty());
    }

    @Test
    public void shouldAppendCurrentQuestionAsUserMessage() {
        List<ConversationTurn> history = List.of(
                new ConversationTurn(ConversationTurn.Role.USER, "How many deals?"),
                new ConversationTurn(ConversationTurn.Role.ASSISTANT, "There are 12 deals."));

        List<GroqApiRequest.Message> messages = ConversationHistory.toMessages(history, "And in mining?");

        assertEquals(3, messages.size());
        assertEquals("assistant", messages.get(1).getRole());
        assertEquals(GroqApiRequest.Message.user("And in mining?"), messages.get(2));
    }
}
