package com.hotpreview.core.logging;

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
    @DisplayName("setProject puts projectId in MDC")
    void setProject() {
        MdcContext.setProject("prj-1234");
        assertEquals("prj-1234", MDC.get("projectId"));
        assertNull(MDC.get("jobId"));
    }

    @Test
    @DisplayName("setJob puts projectId and jobId in MDC")
    void setJob() {
        MdcContext.setJob("prj-1234", "job-abcd");
        assertEquals("prj-1234", MDC.get("projectId"));
        assertEquals("job-abcd", MDC.get("jobId"));
    }

    @Test
    @DisplayName("clear removes only hotpreview keys")
    void clear() {
        MDC.put("requestId", "r-1");
        MdcContext.setJob("prj-1234", "job-abcd");
        MdcContext.clear();
        assertNull(MDC.get("projectId"));
        assertNull(MDC.get("jobId"));
        assertEquals("r-1", MDC.get("requestId"));
        MDC.remove("requestId");
    }
}
