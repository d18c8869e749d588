package com.taskweave.core.model;

import java.util.Objects;

/**
 * Context a job runs in: who owns it, where, how to cancel it, and any
 * caller-specific extension fields.
 *
 * @param ownerId            user or service that submitted the job
 * @param workspaceId        workspace the job belongs to (nullable)
 * @param cancellationToken  cooperative cancellation signal polled by the engine
 * @param extensions         typed caller-specific fields
 */
public record JobContext(
    String ownerId,
    String workspaceId,
    CancellationToken cancellationToken,
    JobExtensions extensions
) {

    public JobContext {
        Objects.requireNonNull(ownerId, "ownerId");
        if (cancellationToken == null) cancellationToken = CancellationToken.none();
        if (extensions == null) extensions = JobExtensions.empty();
    }

    public static JobContext of(String ownerId) {
        return new JobContext(ownerId, null, CancellationToken.none(), JobExtensions.empty());
    }

    public static JobContext of(String ownerId, CancellationToken cancellationToken) {
        return new JobContext(ownerId, null, cancellationToken, JobExtensions.empty());
    }

    public JobContext withWorkspace(String workspaceId) {
        return new JobContext(ownerId, workspaceId, cancellationToken, extensions);
    }

    public <T> JobContext withExtension(JobExtensions.Key<T> key, T value) {
        return new JobContext(ownerId, workspaceId, cancellationToken, extensions.with(key, value));
    }

    public boolean isCancellationRequested() {
        return cancellationToken.isCancellationRequested();
    }
}
