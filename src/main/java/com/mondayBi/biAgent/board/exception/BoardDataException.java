package com.mondayBi.biAgent.board.exception;

/**
 * Exception thrown when board schema or items cannot be fetched.
 */
public class BoardDataException extends RuntimeException {

    public BoardDataException(String message) {
        super(message);
    }

    public BoardDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
