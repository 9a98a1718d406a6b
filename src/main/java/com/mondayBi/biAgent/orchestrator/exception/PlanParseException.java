package com.mondayBi.biAgent.orchestrator.exception;

/**
 * Exception thrown when the planner's reply is not a usable query plan.
 */
public class PlanParseException extends RuntimeException {

    public PlanParseException(String message) {
        super(message);
    }

    public PlanParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
