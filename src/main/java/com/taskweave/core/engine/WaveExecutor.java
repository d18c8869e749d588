package com.taskweave.core.engine;

import com.taskweave.core.logging.MdcContext;
import com.taskweave.core.metrics.JobMetrics;
import com.taskweave.core.model.CancellationToken;
import com.taskweave.core.model.JobCallbacks;
import com.taskweave.core.model.JobConfig;
import com.taskweave.core.model.SubTask;
import com.taskweave.core.model.SubTaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Dispatches sub-tasks in consecutive waves of {@code concurrencyLimit}.
 * <p>
 * Every sub-task of a wave runs concurrently on a fixed pool sized to the limit, and
 * the next wave starts only after the whole current wave has settled. Cancellation is
 * checked before each wave. Results come back index-aligned with the input; slots of
 * sub-tasks that were never dispatched are {@code null}.
 */
class WaveExecutor {

    private static final Logger log = LoggerFactory.getLogger(WaveExecutor.class);

    private final SubTaskRunner runner;
    private final JobMetrics metrics;

    WaveExecutor(SubTaskRunner runner, JobMetrics metrics) {
        this.runner = runner;
        this.metrics = metrics;
    }

    <O> List<SubTaskResult<O>> execute(String jobId, String jobType, List<SubTask<O>> tasks,
                                       JobConfig config, CancellationToken token, JobCallbacks<O> callbacks) {
        int total = tasks.size();
        var results = new AtomicReferenceArray<SubTaskResult<O>>(total);
        if (total == 0) {
            return List.of();
        }

        int waveSize = config.concurrencyLimit();
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(waveSize, total), workerThreads(jobId));
        try {
            int waveNumber = 0;
            for (int waveStart = 0; waveStart < total; waveStart += waveSize) {
                if (token.isCancellationRequested()) {
                    log.info("Job {} cancelled, skipping {} undispatched sub-task(s)", jobId, total - waveStart);
                    break;
                }
                waveNumber++;
                int waveEnd = Math.min(waveStart + waveSize, total);
                MdcContext.setWave(jobId, waveNumber);
                log.info("Wave {}: dispatching sub-tasks {}..{} of {}", waveNumber, waveStart, waveEnd - 1, total);
                if (metrics != null) {
                    metrics.recordWave(waveEnd - waveStart);
                }

                var futures = new ArrayList<CompletableFuture<Void>>(waveEnd - waveStart);
                for (int i = waveStart; i < waveEnd; i++) {
                    final int index = i;
                    final SubTask<O> task = tasks.get(index);
                    futures.add(CompletableFuture.runAsync(() -> {
                        MdcContext.setSubTask(jobId, jobType, task.id());
                        try {
                            callbacks.onSubTaskStart(task, index, total);
                            SubTaskResult<O> result = runner.run(task, index, config, token);
                            results.set(index, result);
                            if (result.success()) {
                                callbacks.onSubTaskComplete(task, result.output(), index);
                            } else {
                                callbacks.onSubTaskError(task, result.error(), index);
                            }
                        } finally {
                            MdcContext.clear();
                        }
                    }, pool));
                }

                awaitWave(futures);
                log.info("Wave {} settled", waveNumber);
            }
        } finally {
            pool.shutdownNow();
            MdcContext.clearWave();
        }

        var ordered = new ArrayList<SubTaskResult<O>>(total);
        for (int i = 0; i < total; i++) {
            ordered.add(results.get(i));
        }
        return Collections.unmodifiableList(ordered);
    }

    private static void awaitWave(List<CompletableFuture<Void>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            // Surface the worker's own failure, not the future wrapper
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Sub-task worker failed", cause);
        }
    }

    private static ThreadFactory workerThreads(String jobId) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "taskweave-" + jobId + "-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
