package com.taskweave.core.engine;

/**
 * Recorded as a sub-task's error when cancellation stopped it before any attempt failed.
 */
public class SubTaskCancelledException extends RuntimeException {

    private final String subTaskId;

    public SubTaskCancelledException(String subTaskId) {
        super("Sub-task " + subTaskId + " cancelled before it could complete");
        this.subTaskId = subTaskId;
    }

    public String getSubTaskId() {
        return subTaskId;
    }
}
