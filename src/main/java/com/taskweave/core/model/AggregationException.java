package com.taskweave.core.model;

/**
 * Thrown by a {@link Job} when its sub-task outputs cannot be folded into a result.
 * The orchestrator propagates it unmodified.
 */
public class AggregationException extends RuntimeException {

    public AggregationException(String message) {
        super(message);
    }

    public AggregationException(String message, Throwable cause) {
        super(message, cause);
    }
}
