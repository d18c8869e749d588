package com.taskweave.jobs.digest;

import com.taskweave.core.llm.ExecutionCapability;
import com.taskweave.core.llm.JsonResponseParser;
import com.taskweave.core.llm.ResponseParseException;
import com.taskweave.core.model.AbstractJob;
import com.taskweave.core.model.AggregationException;
import com.taskweave.core.model.JobConfig;
import com.taskweave.core.model.JobContext;
import com.taskweave.core.model.JobExtensions;
import com.taskweave.core.model.SubTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;

/**
 * Summarizes a document. Documents longer than one chunk are split with
 * {@link TextChunker}, each chunk is digested by its own sub-task, and the chunk
 * digests are merged in document order.
 */
public class DocumentDigestJob extends AbstractJob<DigestRequest, ChunkDigest, DocumentDigest> {

    private static final Logger log = LoggerFactory.getLogger(DocumentDigestJob.class);

    /** Execution profile used by the single-call path. */
    public static final JobExtensions.Key<String> DIRECT_PROFILE =
            JobExtensions.Key.of("digest.directProfile", String.class);

    private final ExecutionCapability capability;
    private final JsonResponseParser parser;
    private final List<String> chunks;
    private final double minCoverage;

    public DocumentDigestJob(DigestRequest input, JobContext context, ExecutionCapability capability,
                             int chunkSize, double minCoverage) {
        super(input, context);
        if (minCoverage < 0.0 || minCoverage > 1.0) {
            throw new IllegalArgumentException("minCoverage must be within [0, 1], was " + minCoverage);
        }
        this.capability = capability;
        this.parser = new JsonResponseParser();
        this.chunks = new TextChunker(chunkSize).split(input.text());
        this.minCoverage = minCoverage;
    }

    @Override
    public String type() {
        return "document-digest";
    }

    public int chunkCount() {
        return chunks.size();
    }

    @Override
    public boolean shouldDecompose() {
        return chunks.size() > 1;
    }

    @Override
    public List<SubTask<ChunkDigest>> decompose() {
        var subTasks = new ArrayList<SubTask<ChunkDigest>>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            int number = i + 1;
            subTasks.add(SubTask.of(
                    id() + "-chunk-" + number,
                    "Chunk " + number + "/" + chunks.size(),
                    DigestInstructions.forChunk(input().title(), number, chunks.size(), chunks.get(i)),
                    this::parseChunkDigest));
        }
        return subTasks;
    }

    @Override
    public DocumentDigest aggregate(List<ChunkDigest> outputs) {
        int total = chunks.size();
        double coverage = total == 0 ? 1.0 : (double) outputs.size() / total;
        if (coverage < minCoverage) {
            throw new AggregationException(String.format(Locale.ROOT,
                    "Only %d of %d chunks digested (%.0f%%), below the required %.0f%%",
                    outputs.size(), total, coverage * 100, minCoverage * 100));
        }
        if (outputs.size() < total) {
            log.warn("Digest of \"{}\" is partial: {} of {} chunks", input().title(), outputs.size(), total);
        }

        var summaries = new ArrayList<String>(outputs.size());
        for (ChunkDigest digest : outputs) {
            summaries.add(digest.summary().strip());
        }
        return new DocumentDigest(input().title(), String.join("\n\n", summaries),
                mergeKeyPoints(outputs), outputs.size(), total);
    }

    @Override
    public DocumentDigest executeDirect() {
        String profile = context().extensions().getOrDefault(DIRECT_PROFILE, JobConfig.DEFAULT_EXECUTION_PROFILE);
        String response = capability.execute(
                DigestInstructions.forWholeDocument(input().title(), input().text()),
                profile, context().cancellationToken());
        ChunkDigest digest = parseChunkDigest(response);
        return new DocumentDigest(input().title(), digest.summary().strip(),
                mergeKeyPoints(List.of(digest)), 1, 1);
    }

    ChunkDigest parseChunkDigest(String text) {
        ChunkDigest digest = parser.parse(text, ChunkDigest.class);
        if (digest.summary() == null || digest.summary().isBlank()) {
            throw new ResponseParseException("Digest response has no summary");
        }
        return digest;
    }

    static List<String> mergeKeyPoints(List<ChunkDigest> digests) {
        var merged = new LinkedHashMap<String, String>();
        for (ChunkDigest digest : digests) {
            for (String point : digest.keyPoints()) {
                if (point.isBlank()) continue;
                String trimmed = point.strip();
                merged.putIfAbsent(trimmed.toLowerCase(Locale.ROOT), trimmed);
            }
        }
        return List.copyOf(merged.values());
    }
}
