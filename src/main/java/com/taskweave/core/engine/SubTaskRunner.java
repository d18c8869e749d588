package com.taskweave.core.engine;

import com.taskweave.core.llm.ExecutionCapability;
import com.taskweave.core.metrics.JobMetrics;
import com.taskweave.core.model.CancellationToken;
import com.taskweave.core.model.JobConfig;
import com.taskweave.core.model.SubTask;
import com.taskweave.core.model.SubTaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one sub-task with retries: up to {@code retryBudget + 1} capability calls,
 * stopping at the first response that parses.
 * <p>
 * Capability and parse failures, errors included, are caught here and never escape; the
 * caller gets a {@link SubTaskResult} either way. Cancellation is checked before every attempt and
 * after every failed one.
 */
class SubTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(SubTaskRunner.class);

    private final ExecutionCapability capability;
    private final JobMetrics metrics;

    SubTaskRunner(ExecutionCapability capability, JobMetrics metrics) {
        this.capability = capability;
        this.metrics = metrics;
    }

    <O> SubTaskResult<O> run(SubTask<O> task, int index, JobConfig config, CancellationToken token) {
        long maxAttempts = config.maxAttempts();
        Throwable lastError = null;
        int attempts = 0;
        long startMs = System.currentTimeMillis();

        for (long attempt = 0; attempt < maxAttempts; attempt++) {
            if (token.isCancellationRequested()) {
                log.info("Sub-task \"{}\" cancelled after {} attempt(s)", task.name(), attempts);
                return record(SubTaskResult.cancelled(task, index,
                        lastError != null ? lastError : new SubTaskCancelledException(task.id()), attempts), startMs);
            }

            attempts++;
            try {
                String response = capability.execute(task.instruction(), config.executionProfile(), token);
                O output = task.parseResponse(response);
                if (attempt > 0) {
                    log.info("Sub-task \"{}\" succeeded on attempt {}/{}", task.name(), attempts, maxAttempts);
                }
                return record(SubTaskResult.success(task, index, output, attempts), startMs);
            } catch (Throwable e) {
                lastError = e;
                log.debug("Sub-task \"{}\" attempt {} failed", task.name(), attempts, e);

                if (token.isCancellationRequested()) {
                    log.info("Sub-task \"{}\" cancelled after failed attempt {}: {}",
                            task.name(), attempts, e.getMessage());
                    return record(SubTaskResult.cancelled(task, index, e, attempts), startMs);
                }
                if (attempt + 1 < maxAttempts) {
                    log.info("Retrying sub-task \"{}\" (attempt {}/{}) after: {}",
                            task.name(), attempt + 2, maxAttempts, e.getMessage());
                }
            }
        }

        log.warn("Sub-task \"{}\" failed after {} attempt(s): {}",
                task.name(), attempts, lastError.getMessage());
        return record(SubTaskResult.failure(task, index, lastError, attempts), startMs);
    }

    private <O> SubTaskResult<O> record(SubTaskResult<O> result, long startMs) {
        if (metrics != null && result.attempts() > 0) {
            metrics.recordSubTaskExecution(result.success(), System.currentTimeMillis() - startMs);
            metrics.recordSubTaskAttempts(result.attempts());
        }
        return result;
    }
}
