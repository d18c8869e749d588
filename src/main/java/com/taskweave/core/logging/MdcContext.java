package com.taskweave.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Taskweave-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setJob(String jobId, String jobType) {
        MDC.put("jobId", jobId);
        MDC.put("jobType", jobType);
    }

    public static void setSubTask(String jobId, String jobType, String subTaskId) {
        setJob(jobId, jobType);
        MDC.put("subTaskId", subTaskId);
    }

    public static void setWave(String jobId, int waveNumber) {
        MDC.put("jobId", jobId);
        MDC.put("waveNumber", String.valueOf(waveNumber));
    }

    public static void clearWave() {
        MDC.remove("waveNumber");
    }

    public static void clear() {
        MDC.remove("jobId");
        MDC.remove("jobType");
        MDC.remove("subTaskId");
        MDC.remove("waveNumber");
    }
}
