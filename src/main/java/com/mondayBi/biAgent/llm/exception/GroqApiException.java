package com.mondayBi.biAgent.llm.exception;

/**
 * Exception thrown when a Groq API call fails or returns no usable content.
 */
public class GroqApiException extends RuntimeException {

    public GroqApiException(String message) {
        super(message);
    }

    public GroqApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
