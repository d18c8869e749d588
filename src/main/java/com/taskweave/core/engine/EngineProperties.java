package com.taskweave.core.engine;

import com.taskweave.core.model.JobConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Default job configuration applied by the orchestrator bean before caller overrides.
 */
@Component
@ConfigurationProperties(prefix = "taskweave.jobs")
public class EngineProperties {

    private int concurrencyLimit = JobConfig.DEFAULT_CONCURRENCY_LIMIT;
    private int retryBudget = JobConfig.DEFAULT_RETRY_BUDGET;
    private boolean continueOnError = true;
    private String executionProfile = JobConfig.DEFAULT_EXECUTION_PROFILE;

    public int getConcurrencyLimit() { return concurrencyLimit; }
    public void setConcurrencyLimit(int concurrencyLimit) { this.concurrencyLimit = concurrencyLimit; }
    public int getRetryBudget() { return retryBudget; }
    public void setRetryBudget(int retryBudget) { this.retryBudget = retryBudget; }
    public boolean isContinueOnError() { return continueOnError; }
    public void setContinueOnError(boolean continueOnError) { this.continueOnError = continueOnError; }
    public String getExecutionProfile() { return executionProfile; }
    public void setExecutionProfile(String executionProfile) { this.executionProfile = executionProfile; }

    /**
     * @throws IllegalArgumentException if the configured values are out of range
     */
    public JobConfig toJobConfig() {
        return new JobConfig(concurrencyLimit, retryBudget, continueOnError, executionProfile);
    }
}
