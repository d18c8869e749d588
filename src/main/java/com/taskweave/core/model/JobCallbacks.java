package com.taskweave.core.model;

import java.util.List;

/**
 * Optional observer hooks for a decomposed run. Every hook defaults to a no-op.
 * <p>
 * Sub-task hooks are called from worker threads and may run concurrently with each
 * other. Exceptions thrown by a hook are logged by the orchestrator and otherwise ignored.
 *
 * @param <O> per-sub-task output type
 */
public interface JobCallbacks<O> {

    default void onJobStart(int totalTasks) {}

    default void onSubTaskStart(SubTask<O> task, int index, int total) {}

    default void onSubTaskComplete(SubTask<O> task, O output, int index) {}

    default void onSubTaskError(SubTask<O> task, Throwable error, int index) {}

    default void onJobComplete(List<O> outputs) {}

    static <O> JobCallbacks<O> none() {
        return new JobCallbacks<>() {};
    }

    /**
     * Returns callbacks that invoke {@code first} and then {@code second} for every hook.
     */
    static <O> JobCallbacks<O> compose(JobCallbacks<O> first, JobCallbacks<O> second) {
        if (first == null) return second != null ? second : none();
        if (second == null) return first;
        return new JobCallbacks<>() {
            @Override
            public void onJobStart(int totalTasks) {
                first.onJobStart(totalTasks);
                second.onJobStart(totalTasks);
            }

            @Override
            public void onSubTaskStart(SubTask<O> task, int index, int total) {
                first.onSubTaskStart(task, index, total);
                second.onSubTaskStart(task, index, total);
            }

            @Override
            public void onSubTaskComplete(SubTask<O> task, O output, int index) {
                first.onSubTaskComplete(task, output, index);
                second.onSubTaskComplete(task, output, index);
            }

            @Override
            public void onSubTaskError(SubTask<O> task, Throwable error, int index) {
                first.onSubTaskError(task, error, index);
                second.onSubTaskError(task, error, index);
            }

            @Override
            public void onJobComplete(List<O> outputs) {
                first.onJobComplete(outputs);
                second.onJobComplete(outputs);
            }
        };
    }
}
