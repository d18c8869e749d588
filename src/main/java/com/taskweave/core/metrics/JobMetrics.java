package com.taskweave.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for job execution.
 */
@Service
public class JobMetrics {

    private final MeterRegistry registry;

    public JobMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param jobType job type tag
     * @param outcome "direct", "completed", "cancelled", "aborted" or "failed"
     */
    public void recordJobResult(String jobType, String outcome) {
        Counter.builder("taskweave.jobs.total")
                .tag("type", jobType)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordSubTaskExecution(boolean success, long ms) {
        Timer.builder("taskweave.subtask.duration")
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordSubTaskAttempts(int attempts) {
        DistributionSummary.builder("taskweave.subtask.attempts")
                .description("Execution capability invocations per sub-task")
                .register(registry)
                .record(attempts);
    }

    public void recordWave(int size) {
        DistributionSummary.builder("taskweave.wave.size")
                .description("Number of sub-tasks dispatched per wave")
                .register(registry)
                .record(size);
    }
}
