package com.taskweave.core.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal shared between a caller and the workers of a job.
 * <p>
 * Workers only ever read the token. Cancelling never interrupts work already in flight;
 * it stops new waves and new attempts from starting.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final boolean cancellable;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * A token that can never be cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Requests cancellation. Returns true if this call changed the state.
     */
    public boolean cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.none() cannot be cancelled");
        }
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "CancellationToken[cancelled=" + cancelled.get() + "]";
    }
}
