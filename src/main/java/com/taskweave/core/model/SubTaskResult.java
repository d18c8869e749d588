package com.taskweave.core.model;

import java.util.Objects;

/**
 * Outcome of one sub-task's attempt sequence. Exactly one of {@code output} and
 * {@code error} is set.
 *
 * @param subTask    the sub-task this result belongs to
 * @param index      position of the sub-task in decomposition order
 * @param output     parsed output on success, otherwise null
 * @param error      final error on failure, otherwise null
 * @param cancelled  true when retries stopped because cancellation was requested
 * @param attempts   number of execution capability invocations made
 */
public record SubTaskResult<O>(
    SubTask<O> subTask,
    int index,
    O output,
    Throwable error,
    boolean cancelled,
    int attempts
) {

    public SubTaskResult {
        Objects.requireNonNull(subTask, "subTask");
        if ((output == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of output and error must be set for " + subTask.id());
        }
    }

    public static <O> SubTaskResult<O> success(SubTask<O> subTask, int index, O output, int attempts) {
        return new SubTaskResult<>(subTask, index, output, null, false, attempts);
    }

    public static <O> SubTaskResult<O> failure(SubTask<O> subTask, int index, Throwable error, int attempts) {
        return new SubTaskResult<>(subTask, index, null, error, false, attempts);
    }

    public static <O> SubTaskResult<O> cancelled(SubTask<O> subTask, int index, Throwable error, int attempts) {
        return new SubTaskResult<>(subTask, index, null, error, true, attempts);
    }

    public boolean success() {
        return error == null;
    }
}
