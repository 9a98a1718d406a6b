package com.mondayBi.biAgent.gateway.exception;

/**
 * Exception thrown when a request names a board tag that is not configured.
 */
public class InvalidBoardException extends RuntimeException {

    public InvalidBoardException(String message) {
        super(message);
    }
}
