package com.taskweave.jobs.digest;

import java.util.List;
import java.util.Objects;

/**
 * Model output for one chunk of a document. Null key points are dropped.
 */
public record ChunkDigest(String summary, List<String> keyPoints) {

    public ChunkDigest {
        keyPoints = keyPoints == null ? List.of()
                : keyPoints.stream().filter(Objects::nonNull).toList();
    }
}
