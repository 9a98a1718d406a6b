package com.mondayBi.biAgent.orchestrator.service;

import com.mondayBi.biAgent.board.model.BoardTag;
import com.mondayBi.biAgent.board.model.RawItem;
import com.mondayBi.biAgent.cleaning.model.CleanedItem;
import com.mondayBi.biAgent.cleaning.model.CleaningResult;
import com.mondayBi.biAgent.cleaning.service.BoardCleaner;
import com.mondayBi.biAgent.config.BoardProperties;
import com.mondayBi.biAgent.gateway.dto.QueryResponse;
import com.mondayBi.biAgent.orchestrator.exception.PlanParseException;
import com.mondayBi.biAgent.orchestrator.model.BoardResult;
import com.mondayBi.biAgent.orchestrator.model.ClarificationRequest;
import com.mondayBi.biAgent.orchestrator.model.ConversationTurn;
import com.mondayBi.biAgent.orchestrator.model.ExecutablePlan;
import com.mondayBi.biAgent.orchestrator.model.OrchestrationState;
import com.mondayBi.biAgent.orchestrator.model.OrchestrationStep;
import com.mondayBi.biAgent.query.model.MetricsResult;
import com.mondayBi.biAgent.query.service.FilterEngine;
import com.mondayBi.biAgent.query.service.MetricsEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;


/**
 * Orchestrator service - workflow owner and coordinator.
 *
 * Responsibilities:
 * - Run one user turn from question to answer, strictly in sequence
 * - Coordinate the board, cleaning, query and language model services
 * - Keep the action trace and merged quality report, including on failure
 *
 * Workflow steps:
 * FETCH_SCHEMAS -> FETCH_SAMPLES -> REQUEST_PLAN -> (IF CLARIFICATION -> DONE)
 * -> CLEAN_AND_FILTER -> COMPUTE_METRICS (per board) -> REQUEST_SYNTHESIS -> DONE
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrchestratorService {

    static final String REPHRASE_ANSWER = "I had trouble understanding your question. Could you rephrase it? "
            + "I need to create a clear plan to query the right data.";
    static final String AT_CAPACITY_ANSWER = "Our AI service is temporarily at capacity. "
            + "This usually resets within a few minutes. Please try again shortly.";
    static final String GENERIC_ERROR_ANSWER = "Something went wrong while processing your query. Please try again.";

    private final BoardFetchService boardFetchService;
    private final QueryPlanningService queryPlanningService;
    private final AnswerSynthesisService answerSynthesisService;
    private final BoardCleaner boardCleaner;
    private final FilterEngine filterEngine;
    private final MetricsEngine metricsEngine;
    private final BoardProperties boardProperties;
    private final Clock clock;

    /**
     * Main orchestration method - processes a question through the complete workflow.
     *
     * @param question      The user's question
     * @param history       Caller-supplied conversation history, oldest first; only read
     * @param correlationId Correlation ID for logging
     * @return Answer with action trace and data quality report; never throws
     */
    public QueryResponse orchestrate(String question, List<ConversationTurn> history, String correlationId) {
        log.info("Starting orchestration - correlationId: {}", correlationId);

        OrchestrationState state = OrchestrationState.builder()
                .correlationId(correlationId)
                .question(question)
                .history(ConversationHistory.trailingWindow(history))
                .today(LocalDate.now(clock))
                .build();

        try {
            // Step 1: FETCH_SCHEMAS
            state.transitionTo(OrchestrationStep.FETCH_SCHEMAS, "Fetching board schemas from Monday.com...");
            state = boardFetchService.fetchSchemas(state);

            // Step 2: FETCH_SAMPLES
            state.transitionTo(OrchestrationStep.FETCH_SAMPLES, "Fetching available filter values...");
            state = boardFetchService.fetchSamples(state);

            // Step 3: REQUEST_PLAN
            state.transitionTo(OrchestrationStep.REQUEST_PLAN, "Analyzing query with AI to create execution plan...");
            state = queryPlanningService.requestPlan(state);

            if (state.getPlanOutcome() instanceof ClarificationRequest clarification) {
                state.transitionTo(OrchestrationStep.DONE, "Need more info: " + clarification.question());
                state.setAnswer(clarification.question());
                log.info("Orchestration ended with clarification - correlationId: {}", correlationId);
                return respond(state);
            }

            ExecutablePlan plan = state.getExecutablePlan();
            state.trace(String.format("Query plan: query %s board(s), analysis type: %s",
                    plan.getBoardsToQuery().stream().map(BoardTag::getTag).collect(Collectors.joining(", ")),
                    plan.getAnalysisType().getValue()));

            // Steps 4-5: CLEAN_AND_FILTER and COMPUTE_METRICS, board by board
            for (BoardTag board : plan.getBoardsToQuery()) {
                processBoard(state, plan, board);
            }
            state.getQualityReport().summarizeMerged();

            // Step 6: REQUEST_SYNTHESIS
            state.transitionTo(OrchestrationStep.REQUEST_SYNTHESIS, "Generating business insight response...");
            state = answerSynthesisService.synthesize(state);

            // Step 7: DONE
            state.transitionTo(OrchestrationStep.DONE, "Response generated successfully");
            log.info("Orchestration completed - correlationId: {}, boards: {}, trace lines: {}",
                    correlationId, state.getBoardResults().size(), state.getActionTrace().size());
            return respond(state);

        } catch (PlanParseException e) {
            log.error("Failed to parse query plan - correlationId: {}", correlationId, e);
            state.trace("Error parsing AI query plan: " + e.getMessage());
            return fail(state, REPHRASE_ANSWER);
        } catch (Exception e) {
            log.error("Error in orchestration - correlationId: {}, step: {}", correlationId, state.getStep(), e);
            if (isRateLimited(e)) {
                state.trace("Rate limit reached - waiting for API quota to reset");
                return fail(state, AT_CAPACITY_ANSWER);
            }
            state.trace("Error: " + e.getMessage());
            return fail(state, GENERIC_ERROR_ANSWER);
        }
    }

    /**
     * Steps CLEAN_AND_FILTER and COMPUTE_METRICS for one board. The rows fetched for the
     * available-values step are reused; the board is not read again.
     */
    private void processBoard(OrchestrationState state, ExecutablePlan plan, BoardTag board) {
        String label = boardProperties.get(board).getLabel();

        state.transitionTo(OrchestrationStep.CLEAN_AND_FILTER, "Processing " + label + " data...");
        log.debug("Step CLEAN_AND_FILTER - correlationId: {}, board: {}", state.getCorrelationId(), board);

        List<RawItem> rawItems = state.getRawItems().getOrDefault(board, List.of());
        state.trace("Using " + rawItems.size() + " " + label + " from Monday.com");

        state.trace("Cleaning and normalizing " + label + " data...");
        CleaningResult cleaned = boardCleaner.clean(rawItems);
        state.getQualityReport().merge(cleaned.qualityReport());

        List<CleanedItem> filtered = filterEngine.apply(cleaned.items(), plan.getFilters(), board);
        state.trace("After filtering: " + filtered.size() + " " + label + " match criteria");

        state.transitionTo(OrchestrationStep.COMPUTE_METRICS, "Computing metrics for " + label + "...");
        log.debug("Step COMPUTE_METRICS - correlationId: {}, board: {}", state.getCorrelationId(), board);
        MetricsResult metrics = metricsEngine.compute(filtered, plan.getMetrics(), board);

        state.getBoardResults().put(board, BoardResult.builder()
                .filteredItems(filtered)
                .qualityReport(cleaned.qualityReport())
                .metrics(metrics)
                .build());

        log.info("Board processed - correlationId: {}, board: {}, raw: {}, filtered: {}",
                state.getCorrelationId(), board, rawItems.size(), filtered.size());
    }

    /**
     * True when any message in the cause chain carries a rate-limit signal.
     */
    static boolean isRateLimited(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            String message = current.getMessage();
            if (message == null) {
                continue;
            }
            String lower = message.toLowerCase(Locale.ROOT);
            if (lower.contains("429") || lower.contains("rate_limit") || lower.contains("rate limit")) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private QueryResponse fail(OrchestrationState state, String answer) {
        state.getQualityReport().summarizeMerged();
        state.setAnswer(answer);
        state.setStep(OrchestrationStep.DONE);
        return respond(state);
    }

    private QueryResponse respond(OrchestrationState state) {
        return QueryResponse.builder()
                .answer(state.getAnswer())
                .actionTrace(state.getActionTrace())
                .dataQualityReport(state.getQualityReport())
                .build();
    }
}
