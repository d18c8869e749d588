package com.taskweave.core.engine;

/**
 * Thrown by {@link JobOrchestrator#run} when a sub-task exhausts its retry budget
 * while {@code continueOnError} is false. The cause is the sub-task's final error.
 */
public class JobAbortedException extends RuntimeException {

    private final String jobId;
    private final String subTaskId;
    private final int index;

    public JobAbortedException(String jobId, String subTaskId, int index, Throwable cause) {
        super("Job " + jobId + " aborted: sub-task " + subTaskId + " (index " + index + ") failed: "
                + (cause != null ? cause.getMessage() : "unknown error"), cause);
        this.jobId = jobId;
        this.subTaskId = subTaskId;
        this.index = index;
    }

    public String getJobId() {
        return jobId;
    }

    public String getSubTaskId() {
        return subTaskId;
    }

    /** Position of the failed sub-task in decomposition order. */
    public int getIndex() {
        return index;
    }
}
