package com.mondayBi.biAgent.orchestrator.model;

/**
 * What the planning call decided: either an executable plan or a question back to the user.
 */
public sealed interface PlanOutcome permits ExecutablePlan, ClarificationRequest {
}
