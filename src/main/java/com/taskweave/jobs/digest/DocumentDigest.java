package com.taskweave.jobs.digest;

import java.util.List;

/**
 * Final result of a {@link DocumentDigestJob}.
 *
 * @param title          document title
 * @param summary        chunk summaries joined in document order
 * @param keyPoints      de-duplicated key points in first-seen order
 * @param chunksCovered  chunks whose digest made it into the result
 * @param chunksTotal    chunks the document was split into
 */
public record DocumentDigest(
    String title,
    String summary,
    List<String> keyPoints,
    int chunksCovered,
    int chunksTotal
) {

    public boolean complete() {
        return chunksCovered == chunksTotal;
    }
}
