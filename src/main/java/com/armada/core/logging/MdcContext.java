package com.armada.core.logging;

import org.slf4j.MDC;

import java.util.Map;

/**
 * Utility for managing armada-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String WAVE_NUMBER = "waveNumber";
    public static final String ITEM_ID = "itemId";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
        MDC.remove(WAVE_NUMBER);
        MDC.remove(ITEM_ID);
    }

    public static void setWave(String runId, int waveNumber) {
        MDC.put(RUN_ID, runId);
        MDC.put(WAVE_NUMBER, String.valueOf(waveNumber));
    }

    public static void setItem(String runId, String itemId) {
        MDC.put(RUN_ID, runId);
        MDC.put(ITEM_ID, itemId);
    }

    public static void clearItem() {
        MDC.remove(ITEM_ID);
    }

    /** Snapshot of the current keys, for nested runs that must hand the context back. */
    public static Map<String, String> capture() {
        return MDC.getCopyOfContextMap();
    }

    public static void restore(Map<String, String> snapshot) {
        clear();
        if (snapshot != null) {
            snapshot.forEach(MDC::put);
        }
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(WAVE_NUMBER);
        MDC.remove(ITEM_ID);
    }
}
