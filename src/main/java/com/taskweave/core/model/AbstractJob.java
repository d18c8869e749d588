package com.taskweave.core.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Base class holding a job's identity, input and context.
 * <p>
 * Subclasses implement the four behaviour methods of {@link Job}. The job type
 * defaults to the simple class name.
 */
public abstract class AbstractJob<I, O, R> implements Job<I, O, R> {

    private final String id;
    private final I input;
    private final JobContext context;

    protected AbstractJob(I input, JobContext context) {
        this("job-" + UUID.randomUUID().toString().substring(0, 8), input, context);
    }

    protected AbstractJob(String id, I input, JobContext context) {
        this.id = Objects.requireNonNull(id, "id");
        this.input = Objects.requireNonNull(input, "input");
        this.context = Objects.requireNonNull(context, "context");
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String type() {
        return getClass().getSimpleName();
    }

    @Override
    public I input() {
        return input;
    }

    @Override
    public JobContext context() {
        return context;
    }

    @Override
    public String toString() {
        return type() + "[" + id + "]";
    }
}
