package com.taskweave.core.engine;

import com.taskweave.core.model.JobCallbacks;
import com.taskweave.core.model.SubTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Fans each hook out to several observers, isolating the run from observer failures.
 */
final class GuardedCallbacks<O> implements JobCallbacks<O> {

    private static final Logger log = LoggerFactory.getLogger(GuardedCallbacks.class);

    private final List<JobCallbacks<O>> delegates;

    private GuardedCallbacks(List<JobCallbacks<O>> delegates) {
        this.delegates = delegates;
    }

    @SafeVarargs
    static <O> JobCallbacks<O> of(JobCallbacks<O>... observers) {
        var delegates = new ArrayList<JobCallbacks<O>>();
        for (var observer : observers) {
            if (observer != null) delegates.add(observer);
        }
        return new GuardedCallbacks<>(List.copyOf(delegates));
    }

    @Override
    public void onJobStart(int totalTasks) {
        each("onJobStart", c -> c.onJobStart(totalTasks));
    }

    @Override
    public void onSubTaskStart(SubTask<O> task, int index, int total) {
        each("onSubTaskStart", c -> c.onSubTaskStart(task, index, total));
    }

    @Override
    public void onSubTaskComplete(SubTask<O> task, O output, int index) {
        each("onSubTaskComplete", c -> c.onSubTaskComplete(task, output, index));
    }

    @Override
    public void onSubTaskError(SubTask<O> task, Throwable error, int index) {
        each("onSubTaskError", c -> c.onSubTaskError(task, error, index));
    }

    @Override
    public void onJobComplete(List<O> outputs) {
        each("onJobComplete", c -> c.onJobComplete(outputs));
    }

    private void each(String hook, Consumer<JobCallbacks<O>> call) {
        for (var delegate : delegates) {
            try {
                call.accept(Objects.requireNonNull(delegate));
            } catch (RuntimeException e) {
                log.warn("Callback {} threw exception: {}", hook, e.getMessage(), e);
            }
        }
    }
}
