package com.taskweave.core.model;

/**
 * Effective execution settings for one run. Read-only during execution.
 *
 * @param concurrencyLimit  maximum sub-tasks in flight at once; also the wave size
 * @param retryBudget       extra attempts per sub-task after the first
 * @param continueOnError   aggregate partial outputs instead of aborting when a sub-task fails
 * @param executionProfile  opaque selector passed to the execution capability
 */
public record JobConfig(
    int concurrencyLimit,
    int retryBudget,
    boolean continueOnError,
    String executionProfile
) {

    public static final int DEFAULT_CONCURRENCY_LIMIT = 3;
    public static final int DEFAULT_RETRY_BUDGET = 1;
    public static final String DEFAULT_EXECUTION_PROFILE = "standard";

    private static final JobConfig DEFAULTS = new JobConfig(
            DEFAULT_CONCURRENCY_LIMIT, DEFAULT_RETRY_BUDGET, true, DEFAULT_EXECUTION_PROFILE);

    public JobConfig {
        if (concurrencyLimit < 1) {
            throw new IllegalArgumentException("concurrencyLimit must be >= 1, was " + concurrencyLimit);
        }
        if (retryBudget < 0) {
            throw new IllegalArgumentException("retryBudget must be >= 0, was " + retryBudget);
        }
        if (executionProfile == null || executionProfile.isBlank()) {
            throw new IllegalArgumentException("executionProfile must not be blank");
        }
    }

    public static JobConfig defaults() {
        return DEFAULTS;
    }

    /** Total capability calls allowed per sub-task. Widened so the largest budget does not overflow. */
    public long maxAttempts() {
        return retryBudget + 1L;
    }
}
