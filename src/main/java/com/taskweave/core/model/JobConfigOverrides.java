package com.taskweave.core.model;

/**
 * Caller-supplied partial configuration. Null fields keep the value of the
 * defaults they are merged over.
 */
public record JobConfigOverrides(
    Integer concurrencyLimit,
    Integer retryBudget,
    Boolean continueOnError,
    String executionProfile
) {

    private static final JobConfigOverrides NONE = new JobConfigOverrides(null, null, null, null);

    public static JobConfigOverrides none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public JobConfig mergeOver(JobConfig defaults) {
        return new JobConfig(
                concurrencyLimit != null ? concurrencyLimit : defaults.concurrencyLimit(),
                retryBudget != null ? retryBudget : defaults.retryBudget(),
                continueOnError != null ? continueOnError : defaults.continueOnError(),
                executionProfile != null ? executionProfile : defaults.executionProfile()
        );
    }

    public static final class Builder {
        private Integer concurrencyLimit;
        private Integer retryBudget;
        private Boolean continueOnError;
        private String executionProfile;

        private Builder() {}

        public Builder concurrencyLimit(int concurrencyLimit) {
            this.concurrencyLimit = concurrencyLimit;
            return this;
        }

        public Builder retryBudget(int retryBudget) {
            this.retryBudget = retryBudget;
            return this;
        }

        public Builder continueOnError(boolean continueOnError) {
            this.continueOnError = continueOnError;
            return this;
        }

        public Builder executionProfile(String executionProfile) {
            this.executionProfile = executionProfile;
            return this;
        }

        public JobConfigOverrides build() {
            return new JobConfigOverrides(concurrencyLimit, retryBudget, continueOnError, executionProfile);
        }
    }
}
