package com.taskweave.core.engine;

import com.taskweave.core.events.EventPublishingCallbacks;
import com.taskweave.core.events.JobEventBus;
import com.taskweave.core.llm.ExecutionCapability;
import com.taskweave.core.logging.MdcContext;
import com.taskweave.core.metrics.JobMetrics;
import com.taskweave.core.model.Job;
import com.taskweave.core.model.JobCallbacks;
import com.taskweave.core.model.JobConfig;
import com.taskweave.core.model.JobConfigOverrides;
import com.taskweave.core.model.SubTask;
import com.taskweave.core.model.SubTaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Drives a {@link Job} through its lifecycle: direct execution, or decomposition into
 * sub-tasks that run in concurrency-bounded waves with per-sub-task retry, followed by
 * aggregation of the successful outputs in decomposition order.
 * <p>
 * Holds no per-run state; one instance can run any number of jobs, concurrently or not.
 * The Spring context exposes a default instance configured from {@link EngineProperties},
 * and tests or callers with different needs construct their own.
 *
 * <p>{@link #run} fails only when
 * <ul>
 *   <li>{@link Job#executeDirect()} fails (the exception propagates as thrown),</li>
 *   <li>a sub-task exhausts its retries while {@code continueOnError} is false
 *       ({@link JobAbortedException}), or</li>
 *   <li>{@link Job#aggregate(List)} fails (the exception propagates as thrown).</li>
 * </ul>
 */
@Service
public class JobOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(JobOrchestrator.class);

    private final JobConfig defaultConfig;
    private final WaveExecutor waveExecutor;
    private final JobEventBus eventBus;
    private final JobMetrics metrics;

    @Autowired
    public JobOrchestrator(ExecutionCapability capability, EngineProperties properties,
                           JobEventBus eventBus, JobMetrics metrics) {
        this(capability, properties.toJobConfig(), eventBus, metrics);
    }

    public JobOrchestrator(ExecutionCapability capability) {
        this(capability, JobConfig.defaults(), null, null);
    }

    public JobOrchestrator(ExecutionCapability capability, JobConfig defaultConfig) {
        this(capability, defaultConfig, null, null);
    }

    public JobOrchestrator(ExecutionCapability capability, JobConfig defaultConfig,
                           JobEventBus eventBus, JobMetrics metrics) {
        Objects.requireNonNull(capability, "capability");
        this.defaultConfig = Objects.requireNonNull(defaultConfig, "defaultConfig");
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.waveExecutor = new WaveExecutor(new SubTaskRunner(capability, metrics), metrics);
    }

    public JobConfig defaultConfig() {
        return defaultConfig;
    }

    public <I, O, R> R run(Job<I, O, R> job) {
        return run(job, null, null);
    }

    public <I, O, R> R run(Job<I, O, R> job, JobCallbacks<O> callbacks) {
        return run(job, callbacks, null);
    }

    /**
     * Runs {@code job} to completion and returns its result.
     *
     * @param callbacks observer hooks (nullable)
     * @param overrides per-run config merged over {@link #defaultConfig()} (nullable)
     */
    public <I, O, R> R run(Job<I, O, R> job, JobCallbacks<O> callbacks, JobConfigOverrides overrides) {
        Objects.requireNonNull(job, "job");
        JobConfig config = (overrides != null ? overrides : JobConfigOverrides.none()).mergeOver(defaultConfig);

        MdcContext.setJob(job.id(), job.type());
        try {
            if (!job.shouldDecompose()) {
                log.info("Job \"{}\" running as single task", job.id());
                R result = job.executeDirect();
                recordOutcome(job, "direct");
                return result;
            }
            return runDecomposed(job, callbacks, config);
        } finally {
            MdcContext.clear();
        }
    }

    private <I, O, R> R runDecomposed(Job<I, O, R> job, JobCallbacks<O> callbacks, JobConfig config) {
        List<SubTask<O>> subTasks = List.copyOf(job.decompose());
        int total = subTasks.size();
        log.info("Job \"{}\" decomposed into {} sub-tasks (concurrency={}, retries={}, continueOnError={})",
                job.id(), total, config.concurrencyLimit(), config.retryBudget(), config.continueOnError());

        EventPublishingCallbacks<O> events = eventBus != null
                ? new EventPublishingCallbacks<>(eventBus, job.id(), job.type())
                : null;
        JobCallbacks<O> observers = GuardedCallbacks.of(callbacks, events);

        observers.onJobStart(total);

        var token = job.context().cancellationToken();
        List<SubTaskResult<O>> results = waveExecutor.execute(
                job.id(), job.type(), subTasks, config, token, observers);

        var outputs = new ArrayList<O>(total);
        int failed = 0;
        int undispatched = 0;
        for (SubTaskResult<O> result : results) {
            if (result == null) {
                undispatched++;
                continue;
            }
            if (result.success()) {
                outputs.add(result.output());
                continue;
            }
            failed++;
            if (!config.continueOnError() && !result.cancelled()) {
                log.warn("Job \"{}\" aborted: sub-task \"{}\" exhausted {} attempt(s)",
                        job.id(), result.subTask().name(), result.attempts());
                recordOutcome(job, "aborted");
                if (events != null) {
                    events.onJobAborted(result.subTask().id(), result.index(), result.error());
                }
                throw new JobAbortedException(job.id(), result.subTask().id(), result.index(), result.error());
            }
        }

        boolean cancelled = token.isCancellationRequested();
        if (cancelled) {
            log.warn("Job \"{}\" cancelled: {} of {} sub-tasks produced output, {} never dispatched",
                    job.id(), outputs.size(), total, undispatched);
        } else {
            log.info("Job \"{}\" sub-tasks settled: {} succeeded, {} failed", job.id(), outputs.size(), failed);
        }

        List<O> finalOutputs = List.copyOf(outputs);
        observers.onJobComplete(finalOutputs);

        R result;
        try {
            result = job.aggregate(finalOutputs);
        } catch (RuntimeException e) {
            log.warn("Job \"{}\" aggregation failed: {}", job.id(), e.getMessage());
            recordOutcome(job, "failed");
            throw e;
        }
        recordOutcome(job, cancelled ? "cancelled" : "completed");
        return result;
    }

    private void recordOutcome(Job<?, ?, ?> job, String outcome) {
        if (metrics != null) {
            metrics.recordJobResult(job.type(), outcome);
        }
    }
}
