package com.taskweave.jobs.digest;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "taskweave.digest")
public class DigestProperties {

    /** Largest chunk sent in one sub-task; documents at or below this run as a single call. */
    private int chunkSize = 6000;

    /** Fraction of chunks that must succeed for the digest to be produced. */
    private double minCoverage = 0.5;

    public int getChunkSize() { return chunkSize; }
    public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }
    public double getMinCoverage() { return minCoverage; }
    public void setMinCoverage(double minCoverage) { this.minCoverage = minCoverage; }
}
