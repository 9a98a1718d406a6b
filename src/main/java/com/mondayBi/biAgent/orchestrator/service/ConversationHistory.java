package com.mondayBi.biAgent.orchestrator.service;

import com.mondayBi.biAgent.llm.dto.GroqApiRequest;
import com.mondayBi.biAgent.orchestrator.model.ConversationTurn;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversation history as sent to the language model: only the most recent turns are used.
 */
public final class ConversationHistory {

    public static final int WINDOW = 10;

    private ConversationHistory() {}

    /**
     * Keeps the last {@link #WINDOW} usable turns. The caller's list is not modified.
     *
     * @param history Full history, oldest first, may be null
     * @return New list with at most {@link #WINDOW} turns
     */
    public static List<ConversationTurn> trailingWindow(List<ConversationTurn> history) {
        if (history == null || history.isEmpty()) {
            return new ArrayList<>();
        }
        List<ConversationTurn> usable = history.stream()
                .filter(turn -> turn != null && turn.getRole() != null && turn.getContent() != null)
                .toList();
        return new ArrayList<>(usable.subList(Math.max(0, usable.size() - WINDOW), usable.size()));
    }

    /**
     * Converts the history to chat messages and appends the current user message.
     */
    public static List<GroqApiRequest.Message> toMessages(List<ConversationTurn> history, String userMessage) {
        List<GroqApiRequest.Message> messages = new ArrayList<>();
        for (ConversationTurn turn : history) {
            messages.add(new GroqApiRequest.Message(turn.getRole().getValue(), turn.getContent()));
        }
        messages.add(GroqApiRequest.Message.user(userMessage));
        return messages;
    }
}
