package com.mondayBi.biAgent.orchestrator.service;

import com.mondayBi.biAgent.board.model.BoardTag;
import com.mondayBi.biAgent.config.BoardProperties;
import com.mondayBi.biAgent.llm.service.GroqApiClient;
import com.mondayBi.biAgent.orchestrator.model.ClarificationRequest;
import com.mondayBi.biAgent.orchestrator.model.ExecutablePlan;
import com.mondayBi.biAgent.orchestrator.model.OrchestrationState;
import com.mondayBi.biAgent.orchestrator.model.PlanOutcome;
import com.mondayBi.biAgent.orchestrator.prompt.QueryPlanningPrompt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Service for the planning call - asks the language model how to answer the question.
 *
 * Handles:
 * - Building the planning prompt from board schemas and available filter values
 * - Sending the trimmed conversation history with the question
 * - Parsing the reply into an executable plan or a clarification request
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueryPlanningService {

    private final GroqApiClient groqApiClient;
    private final QueryPlanParser queryPlanParser;
    private final BoardProperties boardProperties;

    @Value("${groq.api.planning.max-completion-tokens:1024}")
    private int planningMaxTokens = 1024;

    /**
     * Step REQUEST_PLAN.
     *
     * @param state Current orchestration state with schemas and available values
     * @return Updated state with the plan outcome
     * @throws com.mondayBi.biAgent.orchestrator.exception.PlanParseException if the reply is not a usable plan
     */
    public OrchestrationState requestPlan(OrchestrationState state) {
        String correlationId = state.getCorrelationId();
        log.debug("Step REQUEST_PLAN - correlationId: {}", correlationId);

        String systemPrompt = QueryPlanningPrompt.getSystemPrompt(
                boardProperties.get(BoardTag.DEALS).getId(),
                state.getSchemas().get(BoardTag.DEALS).describe(),
                boardProperties.get(BoardTag.WORKORDERS).getId(),
                state.getSchemas().get(BoardTag.WORKORDERS).describe(),
                state.getAvailableValues(),
                state.getToday());

        log.info("Calling Groq API for query planning - correlationId: {}, history turns: {}",
                correlationId, state.getHistory().size());

        String planText = groqApiClient.chat(
                systemPrompt,
                ConversationHistory.toMessages(state.getHistory(), state.getQuestion()),
                planningMaxTokens);

        PlanOutcome outcome = queryPlanParser.parse(planText);
        state.setPlanOutcome(outcome);

        if (outcome instanceof ClarificationRequest clarification) {
            log.info("Planner asked for clarification - correlationId: {}, question: {}",
                    correlationId, clarification.question());
        } else if (outcome instanceof ExecutablePlan plan) {
            log.info("Query plan received - correlationId: {}, boards: {}, metrics: {}, analysisType: {}",
                    correlationId, plan.getBoardsToQuery(), plan.getMetrics(), plan.getAnalysisType());
        }
        return state;
    }
}
