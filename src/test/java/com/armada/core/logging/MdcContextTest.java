package com.armada.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("setRun puts runId in MDC and drops wave and item")
    void setRun() {
        MdcContext.setWave("epic-151", 2);
        MdcContext.setItem("epic-151", "145");
        MdcContext.setRun("epic-160");
        assertEquals("epic-160", MDC.get("runId"));
        assertNull(MDC.get("waveNumber"));
        assertNull(MDC.get("itemId"));
    }

    @Test
    @DisplayName("setWave puts runId and waveNumber in MDC")
    void setWave() {
        MdcContext.setWave("epic-151", 3);
        assertEquals("epic-151", MDC.get("runId"));
        assertEquals("3", MDC.get("waveNumber"));
    }

    @Test
    @DisplayName("clearItem keeps run and wave")
    void clearItem() {
        MdcContext.setWave("epic-151", 1);
        MdcContext.setItem("epic-151", "145");
        MdcContext.clearItem();
        assertEquals("epic-151", MDC.get("runId"));
        assertEquals("1", MDC.get("waveNumber"));
        assertNull(MDC.get("itemId"));
    }

    @Test
    @DisplayName("restore brings back a captured outer context")
    void captureAndRestore() {
        MdcContext.setWave("project-q3", 1);
        var outer = MdcContext.capture();

        MdcContext.setRun("epic-151");
        MdcContext.setItem("epic-151", "145");
        MdcContext.restore(outer);

        assertEquals("project-q3", MDC.get("runId"));
        assertEquals("1", MDC.get("waveNumber"));
        assertNull(MDC.get("itemId"));
    }

    @Test
    @DisplayName("clear removes all armada MDC keys")
    void clear() {
        MdcContext.setWave("epic-151", 2);
        MdcContext.setItem("epic-151", "145");
        MdcContext.clear();
        assertNull(MDC.get("runId"));
        assertNull(MDC.get("waveNumber"));
        assertNull(MDC.get("itemId"));
    }
}
