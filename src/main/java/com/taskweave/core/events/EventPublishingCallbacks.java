package com.taskweave.core.events;

import com.taskweave.core.model.JobCallbacks;
import com.taskweave.core.model.SubTask;

import java.util.List;
import java.util.Map;

/**
 * Translates the callback hooks of one run into {@link JobEvent}s on a {@link JobEventBus}.
 */
public class EventPublishingCallbacks<O> implements JobCallbacks<O> {

    private final JobEventBus eventBus;
    private final String jobId;
    private final String jobType;

    public EventPublishingCallbacks(JobEventBus eventBus, String jobId, String jobType) {
        this.eventBus = eventBus;
        this.jobId = jobId;
        this.jobType = jobType;
    }

    @Override
    public void onJobStart(int totalTasks) {
        eventBus.publish(JobEvent.forJob(JobEvent.JOB_STARTED, jobId,
                Map.of("jobType", jobType, "totalTasks", totalTasks)));
    }

    @Override
    public void onSubTaskStart(SubTask<O> task, int index, int total) {
        eventBus.publish(JobEvent.forSubTask(JobEvent.SUBTASK_STARTED, jobId, task.id(), index,
                Map.of("name", task.name(), "total", total)));
    }

    @Override
    public void onSubTaskComplete(SubTask<O> task, O output, int index) {
        eventBus.publish(JobEvent.forSubTask(JobEvent.SUBTASK_COMPLETED, jobId, task.id(), index,
                Map.of("name", task.name())));
    }

    @Override
    public void onSubTaskError(SubTask<O> task, Throwable error, int index) {
        eventBus.publish(JobEvent.forSubTask(JobEvent.SUBTASK_FAILED, jobId, task.id(), index,
                Map.of("name", task.name(),
                       "errorType", error.getClass().getSimpleName(),
                       "message", String.valueOf(error.getMessage()))));
    }

    @Override
    public void onJobComplete(List<O> outputs) {
        eventBus.publish(JobEvent.forJob(JobEvent.JOB_COMPLETED, jobId,
                Map.of("jobType", jobType, "outputs", outputs.size())));
    }

    /**
     * Published by the orchestrator when a run aborts; not part of the callback contract.
     */
    public void onJobAborted(String subTaskId, int index, Throwable cause) {
        eventBus.publish(JobEvent.forSubTask(JobEvent.JOB_ABORTED, jobId, subTaskId, index,
                Map.of("jobType", jobType, "message", String.valueOf(cause.getMessage()))));
    }
}
