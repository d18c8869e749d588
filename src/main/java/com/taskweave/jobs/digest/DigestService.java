package com.taskweave.jobs.digest;

import com.taskweave.core.engine.JobOrchestrator;
import com.taskweave.core.llm.ExecutionCapability;
import com.taskweave.core.model.JobCallbacks;
import com.taskweave.core.model.JobConfigOverrides;
import com.taskweave.core.model.JobContext;
import org.springframework.stereotype.Service;

/**
 * Creates {@link DocumentDigestJob}s from configuration and runs them on the orchestrator.
 */
@Service
public class DigestService {

    private final ExecutionCapability capability;
    private final JobOrchestrator orchestrator;
    private final DigestProperties properties;

    public DigestService(ExecutionCapability capability, JobOrchestrator orchestrator,
                         DigestProperties properties) {
        this.capability = capability;
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    public DocumentDigestJob createJob(DigestRequest request, JobContext context) {
        return new DocumentDigestJob(request, context, capability,
                properties.getChunkSize(), properties.getMinCoverage());
    }

    /**
     * Digests a document. The execution profile of {@code overrides} (or the orchestrator
     * default) also applies when the document is small enough to run as a single call.
     */
    public DocumentDigest digest(DigestRequest request, JobContext context,
                                 JobCallbacks<ChunkDigest> callbacks, JobConfigOverrides overrides) {
        var effective = (overrides != null ? overrides : JobConfigOverrides.none())
                .mergeOver(orchestrator.defaultConfig());
        var job = createJob(request,
                context.withExtension(DocumentDigestJob.DIRECT_PROFILE, effective.executionProfile()));
        return orchestrator.run(job, callbacks, overrides);
    }
}
