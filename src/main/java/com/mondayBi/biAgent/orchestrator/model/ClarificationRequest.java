package com.mondayBi.biAgent.orchestrator.model;

/**
 * Planner asked the user to clarify instead of producing a plan.
 *
 * @param question Question to show to the user
 */
public record ClarificationRequest(String question) implements PlanOutcome {
}
