package com.mondayBi.biAgent.orchestrator.model;

import com.mondayBi.biAgent.board.model.BoardSchema;
import com.mondayBi.biAgent.board.model.BoardTag;
import com.mondayBi.biAgent.board.model.RawItem;
import com.mondayBi.biAgent.cleaning.model.QualityReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestration state - everything one user turn accumulates on its way through the steps.
 * <p>
 * Lives only for the duration of the request.
 * </p>
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OrchestrationState {

    private String correlationId;

    private String question;

    /**
     * Trailing window of the caller's conversation history.
     */
    @Builder.Default
    private List<ConversationTurn> history = new ArrayList<>();

    /**
     * Date the turn runs on, used in prompts.
     */
    private LocalDate today;

    @Builder.Default
    private OrchestrationStep step = OrchestrationStep.FETCH_SCHEMAS;

    /**
     * Human-readable trace of what the agent did, returned to the caller.
     */
    @Builder.Default
    private List<String> actionTrace = new ArrayList<>();

    @Builder.Default
    private Map<BoardTag, BoardSchema> schemas = new EnumMap<>(BoardTag.class);

    /**
     * Raw items per board, fetched once and reused for cleaning.
     */
    @Builder.Default
    private Map<BoardTag, List<RawItem>> rawItems = new EnumMap<>(BoardTag.class);

    /**
     * Prompt block listing the distinct values of the filterable columns.
     */
    private String availableValues;

    private PlanOutcome planOutcome;

    @Builder.Default
    private Map<BoardTag, BoardResult> boardResults = new LinkedHashMap<>();

    /**
     * Quality report merged over every board cleaned so far.
     */
    @Builder.Default
    private QualityReport qualityReport = QualityReport.empty();

    private String answer;

    /**
     * Moves to the next step and records a trace line for it.
     *
     * @param next      Step being entered
     * @param traceLine Trace line describing the transition
     */
    public void transitionTo(OrchestrationStep next, String traceLine) {
        this.step = next;
        trace(traceLine);
    }

    public void trace(String traceLine) {
        actionTrace.add(traceLine);
    }

    public ExecutablePlan getExecutablePlan() {
        if (planOutcome instanceof ExecutablePlan plan) {
            return plan;
        }
        throw new IllegalStateException("No executable plan in state - step: " + step);
    }
}
