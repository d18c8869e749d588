package com.taskweave.core.model;

import java.util.List;

/**
 * A unit of work that may be decomposed into independent sub-tasks and later
 * aggregated into one result.
 * <p>
 * Lifecycle, driven by {@code JobOrchestrator.run}:
 * <ol>
 *   <li>the caller constructs the job for a single invocation</li>
 *   <li>the orchestrator asks {@link #shouldDecompose()}</li>
 *   <li>if false, {@link #executeDirect()} produces the result</li>
 *   <li>otherwise {@link #decompose()} is called once, the sub-tasks run in waves,
 *       and {@link #aggregate(List)} folds the successful outputs</li>
 * </ol>
 * A job must not change while a run is in progress and has no existence beyond it.
 *
 * @param <I> input type
 * @param <O> per-sub-task output type
 * @param <R> final result type
 */
public interface Job<I, O, R> {

    String id();

    /** Job type, used for logging and metrics tags. */
    String type();

    I input();

    JobContext context();

    /**
     * Whether this job is worth splitting into sub-tasks. Policy for choosing the
     * direct path lives here, not in the orchestrator.
     */
    boolean shouldDecompose();

    /**
     * Breaks the job into sub-tasks. The returned order is the order outputs are
     * handed to {@link #aggregate(List)}.
     */
    List<SubTask<O>> decompose();

    /**
     * Folds the outputs of the successful sub-tasks, in decomposition order. The
     * list may be shorter than the sub-task list, or empty, when sub-tasks failed
     * or the job was cancelled.
     *
     * @throws AggregationException when the outputs cannot form a result
     */
    R aggregate(List<O> outputs);

    /**
     * Produces the result in one step, for jobs too small to be worth decomposing.
     * The orchestrator neither retries nor observes this call.
     */
    R executeDirect();
}
