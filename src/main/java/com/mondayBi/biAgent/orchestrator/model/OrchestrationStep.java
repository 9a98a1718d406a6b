package com.mondayBi.biAgent.orchestrator.model;

/**
 * Steps of one user turn, in execution order.
 * A clarification request jumps from {@link #REQUEST_PLAN} straight to {@link #DONE}.
 */
public enum OrchestrationStep {
    FETCH_SCHEMAS,
    FETCH_SAMPLES,
    REQUEST_PLAN,
    CLEAN_AND_FILTER,
    COMPUTE_METRICS,
    REQUEST_SYNTHESIS,
    DONE
}
