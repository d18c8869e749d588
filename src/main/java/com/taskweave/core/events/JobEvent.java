package com.taskweave.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A progress event emitted while a job runs.
 *
 * @param eventType  one of the {@code *_EVENT} constants, e.g. "subtask.completed"
 * @param jobId      the job this event belongs to
 * @param subTaskId  the sub-task this event relates to (nullable for job-level events)
 * @param index      sub-task position in decomposition order, or -1 for job-level events
 * @param payload    event-specific data
 * @param timestamp  when the event occurred
 */
public record JobEvent(
    String eventType,
    String jobId,
    String subTaskId,
    int index,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String JOB_STARTED = "job.started";
    public static final String SUBTASK_STARTED = "subtask.started";
    public static final String SUBTASK_COMPLETED = "subtask.completed";
    public static final String SUBTASK_FAILED = "subtask.failed";
    public static final String JOB_COMPLETED = "job.completed";
    public static final String JOB_ABORTED = "job.aborted";

    public static JobEvent forJob(String eventType, String jobId, Map<String, Object> payload) {
        return new JobEvent(eventType, jobId, null, -1, payload, Instant.now());
    }

    public static JobEvent forSubTask(String eventType, String jobId, String subTaskId, int index,
                                      Map<String, Object> payload) {
        return new JobEvent(eventType, jobId, subTaskId, index, payload, Instant.now());
    }
}
