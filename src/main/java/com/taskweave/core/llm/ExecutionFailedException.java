package com.taskweave.core.llm;

/**
 * Thrown when the execution capability fails to produce a response.
 */
public class ExecutionFailedException extends RuntimeException {

    public ExecutionFailedException(String message) {
        super(message);
    }

    public ExecutionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
