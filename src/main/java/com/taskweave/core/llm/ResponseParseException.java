package com.taskweave.core.llm;

/**
 * Thrown when response text cannot be parsed into the expected output.
 */
public class ResponseParseException extends RuntimeException {
    public ResponseParseException(String message) {
        super(message);
    }

    public ResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
