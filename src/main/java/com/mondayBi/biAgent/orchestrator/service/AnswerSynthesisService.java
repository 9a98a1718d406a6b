package com.mondayBi.biAgent.orchestrator.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mondayBi.biAgent.board.model.BoardTag;
import com.mondayBi.biAgent.cleaning.model.CleanedItem;
import com.mondayBi.biAgent.llm.service.GroqApiClient;
import com.mondayBi.biAgent.orchestrator.model.BoardResult;
import com.mondayBi.biAgent.orchestrator.model.OrchestrationState;
import com.mondayBi.biAgent.orchestrator.prompt.AnswerSynthesisPrompt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Service for the synthesis call - turns computed board metrics into a prose briefing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerSynthesisService {

    public static final int MAX_SAMPLE_ITEMS = 15;

    private final GroqApiClient groqApiClient;
    private final ObjectMapper objectMapper;

    @Value("${groq.api.synthesis.max-completion-tokens:2048}")
    private int synthesisMaxTokens = 2048;

    /**
     * Step REQUEST_SYNTHESIS. The model's reply is used as the answer unchanged.
     *
     * @param state Current orchestration state with plan, board results and merged quality report
     * @return Updated state with the answer
     */
    public OrchestrationState synthesize(OrchestrationState state) {
        String correlationId = state.getCorrelationId();
        log.debug("Step REQUEST_SYNTHESIS - correlationId: {}", correlationId);

        String systemPrompt = AnswerSynthesisPrompt.getSystemPrompt(
                state.getQualityReport().getSummary(), state.getToday());
        String userMessage = AnswerSynthesisPrompt.getUserMessage(
                state.getQuestion(),
                toPrettyJson(state.getExecutablePlan()),
                toPrettyJson(buildDataSummary(state.getBoardResults())));

        log.info("Calling Groq API for answer synthesis - correlationId: {}, boards: {}, payload length: {}",
                correlationId, state.getBoardResults().size(), userMessage.length());

        String answer = groqApiClient.chat(
                systemPrompt,
                ConversationHistory.toMessages(state.getHistory(), userMessage),
                synthesisMaxTokens);

        state.setAnswer(answer);
        log.info("Answer synthesized - correlationId: {}, answer length: {}", correlationId, answer.length());
        return state;
    }

    /**
     * Per board: its metrics, how many items matched, and up to {@link #MAX_SAMPLE_ITEMS} of them.
     */
    Map<String, Object> buildDataSummary(Map<BoardTag, BoardResult> boardResults) {
        Map<String, Object> summary = new LinkedHashMap<>();
        boardResults.forEach((board, result) -> {
            Map<String, Object> boardSummary = new LinkedHashMap<>();
            boardSummary.put("metrics", result.getMetrics());
            boardSummary.put("total_items_queried", result.getFilteredItems().size());
            boardSummary.put("sample_items", result.getFilteredItems().stream()
                    .limit(MAX_SAMPLE_ITEMS)
                    .map(CleanedItem::toSummary)
                    .collect(Collectors.toList()));
            summary.put(board.getTag(), boardSummary);
        });
        return summary;
    }

    private String toPrettyJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize synthesis payload: " + e.getOriginalMessage(), e);
        }
    }
}
