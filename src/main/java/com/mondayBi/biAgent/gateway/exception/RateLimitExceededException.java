package com.mondayBi.biAgent.gateway.exception;

/**
 * Exception thrown when a client sends more questions per minute than allowed.
 */
public class RateLimitExceededException extends RuntimeException {

    public RateLimitExceededException(String message) {
        super(message);
    }
}
