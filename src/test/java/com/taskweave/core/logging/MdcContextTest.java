package com.taskweave.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setJob puts jobId and jobType in MDC")
    void setJob() {
        MdcContext.setJob("job-1a2b3c4d", "document-digest");
        assertEquals("job-1a2b3c4d", MDC.get("jobId"));
        assertEquals("document-digest", MDC.get("jobType"));
    }

    @Test
    @DisplayName("setSubTask adds subTaskId to the job keys")
    void setSubTask() {
        MdcContext.setSubTask("job-1", "document-digest", "job-1-chunk-2");
        assertEquals("job-1", MDC.get("jobId"));
        assertEquals("document-digest", MDC.get("jobType"));
        assertEquals("job-1-chunk-2", MDC.get("subTaskId"));
    }

    @Test
    @DisplayName("setWave puts jobId and waveNumber in MDC")
    void setWave() {
        MdcContext.setWave("job-1", 3);
        assertEquals("job-1", MDC.get("jobId"));
        assertEquals("3", MDC.get("waveNumber"));
    }

    @Test
    @DisplayName("clearWave removes only waveNumber")
    void clearWave() {
        MdcContext.setJob("job-1", "document-digest");
        MdcContext.setWave("job-1", 2);
        MdcContext.clearWave();
        assertNull(MDC.get("waveNumber"));
        assertEquals("job-1", MDC.get("jobId"));
    }

    @Test
    @DisplayName("clear removes all taskweave MDC keys")
    void clear() {
        MdcContext.setSubTask("job-1", "document-digest", "job-1-chunk-1");
        MdcContext.setWave("job-1", 2);
        MdcContext.clear();
        assertNull(MDC.get("jobId"));
        assertNull(MDC.get("jobType"));
        assertNull(MDC.get("subTaskId"));
        assertNull(MDC.get("waveNumber"));
    }

    @Test
    @DisplayName("clear does not remove unrelated MDC keys")
    void clearKeepsForeignKeys() {
        MDC.put("requestId", "r-1");
        MdcContext.setJob("job-1", "x");
        MdcContext.clear();
        assertEquals("r-1", MDC.get("requestId"));
        MDC.remove("requestId");
    }
}
